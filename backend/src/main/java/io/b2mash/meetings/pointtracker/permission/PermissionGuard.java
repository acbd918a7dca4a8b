package io.b2mash.meetings.pointtracker.permission;

import io.b2mash.meetings.pointtracker.exception.ForbiddenException;
import io.b2mash.meetings.pointtracker.security.CurrentUser;
import io.b2mash.meetings.pointtracker.security.RequestScopes;
import java.util.UUID;
import org.springframework.stereotype.Component;

/**
 * Route-level guard over {@link PermissionResolver}. Each method reads the request's {@link
 * CurrentUser}, throws {@link ForbiddenException} naming what was denied, and returns the user on
 * success so callers can continue with it.
 */
@Component
public class PermissionGuard {

  private final PermissionResolver permissionResolver;

  public PermissionGuard(PermissionResolver permissionResolver) {
    this.permissionResolver = permissionResolver;
  }

  public CurrentUser requirePermission(PermissionAction action) {
    var user = RequestScopes.requireCurrentUser();
    if (!permissionResolver.hasPermission(user, action)) {
      throw new ForbiddenException(
          "Permission denied", "Action " + action.code() + " is not permitted");
    }
    return user;
  }

  public CurrentUser requireProjectAccess(UUID projectId) {
    var user = RequestScopes.requireCurrentUser();
    if (!permissionResolver.canAccessProject(user, projectId)) {
      throw new ForbiddenException(
          "Project access denied", "You do not have access to project " + projectId);
    }
    return user;
  }

  public CurrentUser requireProjectPermission(PermissionAction action, UUID projectId) {
    var user = RequestScopes.requireCurrentUser();
    if (!permissionResolver.hasProjectPermission(user, action, projectId)) {
      throw new ForbiddenException(
          "Permission denied",
          "Action " + action.code() + " is not permitted in project " + projectId);
    }
    return user;
  }

  public CurrentUser requirePointEdit(UUID pointId, String assignedTo, UUID projectId) {
    var user = RequestScopes.requireCurrentUser();
    if (!permissionResolver.canEditPoint(user, assignedTo, projectId)) {
      throw new ForbiddenException(
          "Point edit denied", "You are not allowed to edit point " + pointId);
    }
    return user;
  }
}
