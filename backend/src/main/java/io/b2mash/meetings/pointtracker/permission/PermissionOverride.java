package io.b2mash.meetings.pointtracker.permission;

import java.util.Objects;

/**
 * Adds ({@code enabled}) or removes ({@code !enabled}) one role from one action's allowed set.
 */
public record PermissionOverride(Role role, PermissionAction action, boolean enabled) {

  public PermissionOverride {
    Objects.requireNonNull(role, "role");
    Objects.requireNonNull(action, "action");
  }
}
