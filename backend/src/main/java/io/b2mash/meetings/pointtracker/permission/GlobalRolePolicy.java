package io.b2mash.meetings.pointtracker.permission;

import io.b2mash.meetings.pointtracker.security.CurrentUser;
import java.util.Set;
import java.util.UUID;

/** Allows when any of the user's global roles holds the action in the effective matrix. */
public class GlobalRolePolicy implements PolicyEvaluator {

  private final EffectivePermissionMatrix matrix;

  public GlobalRolePolicy(EffectivePermissionMatrix matrix) {
    this.matrix = matrix;
  }

  @Override
  public PolicyDecision evaluate(CurrentUser user, PermissionAction action, UUID projectId) {
    Set<Role> allowed = matrix.resolve(action);
    for (Role role : user.roles()) {
      if (allowed.contains(role)) {
        return PolicyDecision.ALLOW;
      }
    }
    return PolicyDecision.ABSTAIN;
  }
}
