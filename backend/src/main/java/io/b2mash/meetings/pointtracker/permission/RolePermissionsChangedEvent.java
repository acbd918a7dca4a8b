package io.b2mash.meetings.pointtracker.permission;

import java.util.List;

/**
 * Published inside the override write transaction. Carries only the entries that write applied;
 * listeners re-read the table after commit instead of trusting a list read before it.
 */
public record RolePermissionsChangedEvent(List<PermissionOverride> changes) {

  public RolePermissionsChangedEvent {
    changes = List.copyOf(changes);
  }
}
