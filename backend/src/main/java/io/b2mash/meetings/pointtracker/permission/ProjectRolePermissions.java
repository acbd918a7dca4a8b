package io.b2mash.meetings.pointtracker.permission;

import static io.b2mash.meetings.pointtracker.permission.PermissionAction.ASSIGN_POINTS;
import static io.b2mash.meetings.pointtracker.permission.PermissionAction.CLOSE_MEETINGS;
import static io.b2mash.meetings.pointtracker.permission.PermissionAction.CREATE_COMMENTS;
import static io.b2mash.meetings.pointtracker.permission.PermissionAction.CREATE_MEETINGS;
import static io.b2mash.meetings.pointtracker.permission.PermissionAction.CREATE_POINTS;
import static io.b2mash.meetings.pointtracker.permission.PermissionAction.EDIT_ANY_POINT;
import static io.b2mash.meetings.pointtracker.permission.PermissionAction.EDIT_ASSIGNED_POINTS;
import static io.b2mash.meetings.pointtracker.permission.PermissionAction.EDIT_ATTENDANCE;
import static io.b2mash.meetings.pointtracker.permission.PermissionAction.EDIT_MEETINGS;
import static io.b2mash.meetings.pointtracker.permission.PermissionAction.EDIT_PROJECTS;
import static io.b2mash.meetings.pointtracker.permission.PermissionAction.SEND_MINUTES;
import static io.b2mash.meetings.pointtracker.permission.PermissionAction.UPLOAD_ATTACHMENTS;
import static io.b2mash.meetings.pointtracker.permission.PermissionAction.VIEW_PROJECT_KPIS;

import io.b2mash.meetings.pointtracker.exception.InvariantViolationException;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/** Actions a {@link ProjectRole} confers inside its project. Not editable at runtime. */
public final class ProjectRolePermissions {

  private static final Map<ProjectRole, Set<PermissionAction>> GRANTS;

  static {
    var table = new EnumMap<ProjectRole, Set<PermissionAction>>(ProjectRole.class);
    var leadership =
        EnumSet.of(
            CREATE_MEETINGS,
            EDIT_MEETINGS,
            CLOSE_MEETINGS,
            SEND_MINUTES,
            CREATE_POINTS,
            EDIT_ANY_POINT,
            ASSIGN_POINTS,
            UPLOAD_ATTACHMENTS,
            CREATE_COMMENTS,
            EDIT_ATTENDANCE,
            EDIT_PROJECTS,
            VIEW_PROJECT_KPIS);
    var designLead = EnumSet.of(CREATE_POINTS, EDIT_ANY_POINT, UPLOAD_ATTACHMENTS, CREATE_COMMENTS);
    var teamMember = EnumSet.of(EDIT_ASSIGNED_POINTS, UPLOAD_ATTACHMENTS, CREATE_COMMENTS);

    table.put(ProjectRole.PROJECT_LEADER, leadership);
    table.put(ProjectRole.BIM_MANAGER, leadership);
    table.put(
        ProjectRole.BIM_COORDINATOR,
        EnumSet.of(
            CREATE_MEETINGS,
            EDIT_MEETINGS,
            CREATE_POINTS,
            EDIT_ANY_POINT,
            UPLOAD_ATTACHMENTS,
            CREATE_COMMENTS,
            EDIT_ATTENDANCE));
    table.put(ProjectRole.DESIGN_LEAD, designLead);
    var designManager = EnumSet.copyOf(designLead);
    designManager.add(VIEW_PROJECT_KPIS);
    table.put(ProjectRole.DESIGN_MANAGER, designManager);
    table.put(ProjectRole.DESIGN_TEAM_MEMBER, teamMember);
    table.put(ProjectRole.ENGINEER, teamMember);
    table.put(ProjectRole.EXTERNAL_CONSULTANT, EnumSet.of(CREATE_COMMENTS));
    table.put(ProjectRole.PROJECT_VIEWER, EnumSet.noneOf(PermissionAction.class));

    for (ProjectRole role : ProjectRole.values()) {
      if (!table.containsKey(role)) {
        throw new InvariantViolationException("Project grant table has no entry for " + role);
      }
      table.put(role, Collections.unmodifiableSet(EnumSet.copyOf(table.get(role))));
    }
    GRANTS = Collections.unmodifiableMap(table);
  }

  private ProjectRolePermissions() {}

  public static Set<PermissionAction> grantedTo(ProjectRole role) {
    return GRANTS.get(role);
  }

  public static boolean grants(ProjectRole role, PermissionAction action) {
    return role != null && GRANTS.get(role).contains(action);
  }
}
