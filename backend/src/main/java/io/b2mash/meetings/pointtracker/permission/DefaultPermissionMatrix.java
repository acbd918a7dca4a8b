package io.b2mash.meetings.pointtracker.permission;

import static io.b2mash.meetings.pointtracker.permission.Role.BIM_COORDINATOR;
import static io.b2mash.meetings.pointtracker.permission.Role.BIM_DESIGNER;
import static io.b2mash.meetings.pointtracker.permission.Role.BIM_MANAGER;
import static io.b2mash.meetings.pointtracker.permission.Role.BIM_PROJECT_MANAGER;
import static io.b2mash.meetings.pointtracker.permission.Role.DESIGN_MANAGER;
import static io.b2mash.meetings.pointtracker.permission.Role.ENGINEER;
import static io.b2mash.meetings.pointtracker.permission.Role.PROJECT_MANAGER;

import io.b2mash.meetings.pointtracker.exception.InvariantViolationException;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Out-of-the-box role grants for every {@link PermissionAction}. Overrides stored in {@code
 * role_permissions} are applied on top of this table, never in place of it.
 */
public final class DefaultPermissionMatrix {

  private static final Map<PermissionAction, Set<Role>> DEFAULTS;

  static {
    var table = new EnumMap<PermissionAction, Set<Role>>(PermissionAction.class);
    var meetingRoles = EnumSet.of(BIM_MANAGER, BIM_PROJECT_MANAGER);
    var pointEditors = EnumSet.of(BIM_MANAGER, BIM_PROJECT_MANAGER, BIM_COORDINATOR);
    var contributors =
        EnumSet.of(
            BIM_MANAGER,
            BIM_PROJECT_MANAGER,
            BIM_COORDINATOR,
            BIM_DESIGNER,
            ENGINEER,
            PROJECT_MANAGER,
            DESIGN_MANAGER);

    table.put(PermissionAction.CREATE_MEETINGS, meetingRoles);
    table.put(PermissionAction.EDIT_MEETINGS, meetingRoles);
    table.put(PermissionAction.CLOSE_MEETINGS, meetingRoles);
    table.put(PermissionAction.SEND_MINUTES, meetingRoles);

    table.put(PermissionAction.CREATE_POINTS, pointEditors);
    table.put(PermissionAction.EDIT_ANY_POINT, pointEditors);
    table.put(PermissionAction.EDIT_ASSIGNED_POINTS, EnumSet.of(BIM_DESIGNER, ENGINEER));
    table.put(PermissionAction.ASSIGN_POINTS, EnumSet.of(BIM_MANAGER, BIM_PROJECT_MANAGER));

    table.put(PermissionAction.UPLOAD_ATTACHMENTS, contributors);
    table.put(PermissionAction.CREATE_COMMENTS, contributors);
    table.put(PermissionAction.EDIT_ATTENDANCE, pointEditors);

    table.put(PermissionAction.VIEW_ALL_PROJECTS, EnumSet.of(BIM_MANAGER));
    table.put(PermissionAction.CREATE_PROJECTS, EnumSet.of(BIM_MANAGER));
    table.put(PermissionAction.EDIT_PROJECTS, EnumSet.of(BIM_MANAGER, BIM_PROJECT_MANAGER));
    table.put(PermissionAction.MANAGE_USERS, EnumSet.of(BIM_MANAGER));

    table.put(PermissionAction.VIEW_GLOBAL_KPIS, EnumSet.of(BIM_MANAGER));
    table.put(PermissionAction.VIEW_PROJECT_KPIS, EnumSet.of(BIM_MANAGER, BIM_PROJECT_MANAGER));
    table.put(PermissionAction.VIEW_COMPANY_KPIS, EnumSet.of(PROJECT_MANAGER));

    for (PermissionAction action : PermissionAction.values()) {
      if (!table.containsKey(action)) {
        throw new InvariantViolationException(
            "Default permission matrix has no entry for " + action.code());
      }
      table.put(action, Collections.unmodifiableSet(EnumSet.copyOf(table.get(action))));
    }
    DEFAULTS = Collections.unmodifiableMap(table);
  }

  private DefaultPermissionMatrix() {}

  /** Returns the full default table, one entry per action. */
  public static Map<PermissionAction, Set<Role>> table() {
    return DEFAULTS;
  }

  public static Set<Role> rolesFor(PermissionAction action) {
    return DEFAULTS.get(action);
  }
}
