package io.b2mash.meetings.pointtracker.permission;

import io.b2mash.meetings.pointtracker.security.CurrentUser;
import java.util.UUID;

/** Allows when the user's role in {@code projectId} confers the action. */
public class ProjectRolePolicy implements PolicyEvaluator {

  @Override
  public PolicyDecision evaluate(CurrentUser user, PermissionAction action, UUID projectId) {
    ProjectRole projectRole = user.projectRole(projectId);
    return ProjectRolePermissions.grants(projectRole, action)
        ? PolicyDecision.ALLOW
        : PolicyDecision.ABSTAIN;
  }
}
