package io.b2mash.meetings.pointtracker.permission;

import io.b2mash.meetings.pointtracker.exception.InvariantViolationException;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable action to allowed-roles table. Instances are only produced by rebuilding from the
 * defaults, so two matrices built from the same overrides are always equal.
 */
public final class PermissionMatrix {

  private static final PermissionMatrix DEFAULTS = of(DefaultPermissionMatrix.table());

  private final Map<PermissionAction, Set<Role>> allowedRoles;

  private PermissionMatrix(Map<PermissionAction, Set<Role>> allowedRoles) {
    this.allowedRoles = allowedRoles;
  }

  public static PermissionMatrix defaults() {
    return DEFAULTS;
  }

  /**
   * Copies the defaults and applies {@code overrides} in list order. A later override for the same
   * (role, action) wins.
   */
  public static PermissionMatrix fromDefaults(List<PermissionOverride> overrides) {
    var working = new EnumMap<PermissionAction, EnumSet<Role>>(PermissionAction.class);
    DefaultPermissionMatrix.table().forEach((action, roles) -> working.put(action, copy(roles)));

    for (PermissionOverride override : overrides) {
      EnumSet<Role> roles = working.get(override.action());
      if (roles == null) {
        throw new InvariantViolationException(
            "No matrix entry to override for " + override.action().code());
      }
      if (override.enabled()) {
        roles.add(override.role());
      } else {
        roles.remove(override.role());
      }
    }
    return of(working);
  }

  static PermissionMatrix of(Map<PermissionAction, ? extends Set<Role>> table) {
    var frozen = new EnumMap<PermissionAction, Set<Role>>(PermissionAction.class);
    table.forEach((action, roles) -> frozen.put(action, Collections.unmodifiableSet(copy(roles))));
    return new PermissionMatrix(Collections.unmodifiableMap(frozen));
  }

  /** Roles allowed {@code action}. A missing entry is a table bug and fails loudly. */
  public Set<Role> allowedRoles(PermissionAction action) {
    Set<Role> roles = allowedRoles.get(action);
    if (roles == null) {
      throw new InvariantViolationException(
          "Effective permission matrix has no entry for " + action.code());
    }
    return roles;
  }

  public boolean allows(Role role, PermissionAction action) {
    return allowedRoles(action).contains(role);
  }

  public Map<PermissionAction, Set<Role>> asMap() {
    return allowedRoles;
  }

  private static EnumSet<Role> copy(Set<Role> roles) {
    return roles.isEmpty() ? EnumSet.noneOf(Role.class) : EnumSet.copyOf(roles);
  }

  @Override
  public boolean equals(Object o) {
    return this == o
        || (o instanceof PermissionMatrix other && allowedRoles.equals(other.allowedRoles));
  }

  @Override
  public int hashCode() {
    return allowedRoles.hashCode();
  }

  @Override
  public String toString() {
    return "PermissionMatrix" + allowedRoles;
  }
}
