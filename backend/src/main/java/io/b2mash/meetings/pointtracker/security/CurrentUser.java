package io.b2mash.meetings.pointtracker.security;

import io.b2mash.meetings.pointtracker.permission.ProjectRole;
import io.b2mash.meetings.pointtracker.permission.Role;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Identity and grants of the user behind one request. Built once per request by {@link
 * CurrentUserFilter} and never mutated afterwards.
 *
 * @param id user id; assignment references of the form {@code user:<id>} point at it
 * @param email login email, used by the legacy assignment fallback
 * @param name display name
 * @param roles global roles
 * @param companyId company the user belongs to; nullable
 * @param projectIds projects the user is a member of
 * @param projectRoles role held in each project, for the projects that have one
 */
public record CurrentUser(
    UUID id,
    String email,
    String name,
    Set<Role> roles,
    UUID companyId,
    Set<UUID> projectIds,
    Map<UUID, ProjectRole> projectRoles) {

  public CurrentUser {
    Objects.requireNonNull(id, "id");
    roles = roles == null || roles.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(roles));
    projectIds = projectIds == null ? Set.of() : Set.copyOf(projectIds);
    projectRoles = projectRoles == null ? Map.of() : Map.copyOf(projectRoles);
  }

  public boolean hasRole(Role role) {
    return roles.contains(role);
  }

  public boolean isAdministrator() {
    return roles.stream().anyMatch(Role::isAdministrator);
  }

  public ProjectRole projectRole(UUID projectId) {
    return projectId == null ? null : projectRoles.get(projectId);
  }
}
