package io.b2mash.meetings.pointtracker.permission;

import io.b2mash.meetings.pointtracker.security.CurrentUser;
import java.util.UUID;

/**
 * One independent source of grants consulted by {@link PermissionResolver#hasProjectPermission}.
 * Evaluators run in a fixed order; the first non-abstaining decision wins.
 */
public interface PolicyEvaluator {

  PolicyDecision evaluate(CurrentUser user, PermissionAction action, UUID projectId);
}
