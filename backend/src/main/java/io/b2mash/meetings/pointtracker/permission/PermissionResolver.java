package io.b2mash.meetings.pointtracker.permission;

import io.b2mash.meetings.pointtracker.security.CurrentUser;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Answers whether a user may perform an action, optionally within a project or on a point.
 *
 * <p>All queries are side-effect free and read only the published {@link
 * EffectivePermissionMatrix} and the fixed {@link ProjectRolePermissions} table. The administrator
 * role passes every check regardless of matrix contents.
 */
@Service
public class PermissionResolver {

  private static final Logger log = LoggerFactory.getLogger(PermissionResolver.class);

  private static final Map<String, PermissionAction> SUMMARY_KEYS = summaryKeys();

  private final EffectivePermissionMatrix matrix;
  private final List<PolicyEvaluator> projectPolicies;

  public PermissionResolver(EffectivePermissionMatrix matrix) {
    this.matrix = matrix;
    this.projectPolicies = List.of(new GlobalRolePolicy(matrix), new ProjectRolePolicy());
  }

  public boolean hasPermission(CurrentUser user, PermissionAction action) {
    if (user.isAdministrator()) {
      return true;
    }
    var allowed = matrix.resolve(action);
    return user.roles().stream().anyMatch(allowed::contains);
  }

  /** A null {@code projectId} means the check is not project-scoped and passes. */
  public boolean canAccessProject(CurrentUser user, UUID projectId) {
    if (user.isAdministrator() || projectId == null) {
      return true;
    }
    return user.projectIds().contains(projectId);
  }

  /**
   * Project access is required first. The global role grant is consulted before the project role
   * grant; either one allows.
   */
  public boolean hasProjectPermission(CurrentUser user, PermissionAction action, UUID projectId) {
    if (user.isAdministrator()) {
      return true;
    }
    if (!canAccessProject(user, projectId)) {
      return false;
    }
    for (PolicyEvaluator policy : projectPolicies) {
      PolicyDecision decision = policy.evaluate(user, action, projectId);
      if (decision != PolicyDecision.ABSTAIN) {
        return decision == PolicyDecision.ALLOW;
      }
    }
    return false;
  }

  /**
   * Whether the user may edit a point assigned to {@code assignedTo}. Users without {@code
   * points:edit:any} need {@code points:edit:assigned} and a matching assignment: a {@code user:}
   * reference must name the user's id; any other form matches when it contains the user's email.
   */
  public boolean canEditPoint(CurrentUser user, String assignedTo, UUID projectId) {
    if (!canAccessProject(user, projectId)) {
      return false;
    }
    if (hasPermission(user, PermissionAction.EDIT_ANY_POINT)) {
      return true;
    }
    if (!hasPermission(user, PermissionAction.EDIT_ASSIGNED_POINTS)) {
      return false;
    }
    var reference = AssignmentReference.parse(assignedTo);
    if (reference == null) {
      return false;
    }
    if (reference.isUser()) {
      return reference.refersToUser(user.id());
    }
    return reference.mentionsEmail(user.email());
  }

  /** Rebuilds the matrix from the defaults plus {@code overrides} and publishes it atomically. */
  public void updateEffectiveMatrix(List<PermissionOverride> overrides) {
    matrix.replace(PermissionMatrix.fromDefaults(overrides));
    log.info("Effective permission matrix rebuilt with {} override(s)", overrides.size());
  }

  /** Capability flags for the client, keyed the way the web client reads them. */
  public Map<String, Boolean> permissionSummary(CurrentUser user) {
    var summary = new LinkedHashMap<String, Boolean>();
    SUMMARY_KEYS.forEach((key, action) -> summary.put(key, hasPermission(user, action)));
    summary.put("isBimManager", user.isAdministrator());
    return summary;
  }

  private static Map<String, PermissionAction> summaryKeys() {
    var keys = new LinkedHashMap<String, PermissionAction>();
    keys.put("canCreateMeetings", PermissionAction.CREATE_MEETINGS);
    keys.put("canEditMeetings", PermissionAction.EDIT_MEETINGS);
    keys.put("canCloseMeetings", PermissionAction.CLOSE_MEETINGS);
    keys.put("canSendMinutes", PermissionAction.SEND_MINUTES);
    keys.put("canCreatePoints", PermissionAction.CREATE_POINTS);
    keys.put("canEditAnyPoint", PermissionAction.EDIT_ANY_POINT);
    keys.put("canEditAssignedPoints", PermissionAction.EDIT_ASSIGNED_POINTS);
    keys.put("canAssignPoints", PermissionAction.ASSIGN_POINTS);
    keys.put("canUploadAttachments", PermissionAction.UPLOAD_ATTACHMENTS);
    keys.put("canComment", PermissionAction.CREATE_COMMENTS);
    keys.put("canEditAttendance", PermissionAction.EDIT_ATTENDANCE);
    keys.put("canViewAllProjects", PermissionAction.VIEW_ALL_PROJECTS);
    keys.put("canCreateProjects", PermissionAction.CREATE_PROJECTS);
    keys.put("canEditProjects", PermissionAction.EDIT_PROJECTS);
    keys.put("canManageUsers", PermissionAction.MANAGE_USERS);
    keys.put("canViewGlobalKpis", PermissionAction.VIEW_GLOBAL_KPIS);
    keys.put("canViewProjectKpis", PermissionAction.VIEW_PROJECT_KPIS);
    keys.put("canViewCompanyKpis", PermissionAction.VIEW_COMPANY_KPIS);
    return Collections.unmodifiableMap(keys);
  }
}
