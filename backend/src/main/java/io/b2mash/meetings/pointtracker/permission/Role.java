package io.b2mash.meetings.pointtracker.permission;

import io.b2mash.meetings.pointtracker.exception.InvalidStateException;
import java.util.Optional;

/** Global user roles. {@link #BIM_MANAGER} is the administrator and passes every check. */
public enum Role {
  BIM_MANAGER("BIM Manager", "Full access across all projects, global KPIs, user management"),
  BIM_PROJECT_MANAGER(
      "BIM Project Manager", "Full access within assigned projects, project-level KPIs"),
  BIM_COORDINATOR(
      "BIM Coordinator", "Add/edit points, attachments, statuses, attendance in assigned projects"),
  BIM_DESIGNER("BIM Designer", "Edit assigned points, upload attachments, add comments"),
  ENGINEER("Engineer", "Edit assigned points, upload attachments, add comments"),
  PROJECT_MANAGER(
      "Project Manager", "Company-filtered view of points and KPIs in assigned projects"),
  DESIGN_MANAGER("Design Manager", "Review role: view all, comment and upload attachments only"),
  VIEWER("Viewer", "Read-only access to assigned projects");

  private final String displayName;
  private final String description;

  Role(String displayName, String description) {
    this.displayName = displayName;
    this.description = description;
  }

  public String displayName() {
    return displayName;
  }

  public String description() {
    return description;
  }

  public boolean isAdministrator() {
    return this == BIM_MANAGER;
  }

  public static Optional<Role> findByName(String name) {
    if (name == null) {
      return Optional.empty();
    }
    for (Role role : values()) {
      if (role.name().equalsIgnoreCase(name.trim())) {
        return Optional.of(role);
      }
    }
    return Optional.empty();
  }

  /** Parses a role name from API input. Unknown names are a caller error. */
  public static Role fromName(String name) {
    return findByName(name)
        .orElseThrow(
            () -> new InvalidStateException("Unknown role", "No role named '" + name + "'"));
  }
}
