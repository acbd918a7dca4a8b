package io.b2mash.meetings.pointtracker.permission;

import io.b2mash.meetings.pointtracker.exception.InvalidStateException;
import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Fine-grained capability tokens. Each action has a stable wire code (stored in {@code
 * role_permissions.action} and used by the REST API), a label and a category.
 */
public enum PermissionAction {
  CREATE_MEETINGS("meetings:create", "Create Meetings", PermissionCategory.MEETINGS),
  EDIT_MEETINGS("meetings:edit", "Edit Meetings", PermissionCategory.MEETINGS),
  CLOSE_MEETINGS("meetings:close", "Close Meetings", PermissionCategory.MEETINGS),
  SEND_MINUTES("meetings:send_minutes", "Send Minutes", PermissionCategory.MEETINGS),
  CREATE_POINTS("points:create", "Create Points", PermissionCategory.POINTS),
  EDIT_ANY_POINT("points:edit:any", "Edit Any Point", PermissionCategory.POINTS),
  EDIT_ASSIGNED_POINTS("points:edit:assigned", "Edit Assigned Points", PermissionCategory.POINTS),
  ASSIGN_POINTS("points:assign", "Assign Points", PermissionCategory.POINTS),
  UPLOAD_ATTACHMENTS("attachments:upload", "Upload Attachments", PermissionCategory.CONTENT),
  CREATE_COMMENTS("comments:create", "Create Comments", PermissionCategory.CONTENT),
  EDIT_ATTENDANCE("attendance:edit", "Edit Attendance", PermissionCategory.ATTENDANCE),
  VIEW_ALL_PROJECTS("projects:view_all", "View All Projects", PermissionCategory.PROJECTS),
  CREATE_PROJECTS("projects:create", "Create Projects", PermissionCategory.PROJECTS),
  EDIT_PROJECTS("projects:edit", "Edit Projects", PermissionCategory.PROJECTS),
  MANAGE_USERS("users:manage", "Manage Users", PermissionCategory.ADMINISTRATION),
  VIEW_GLOBAL_KPIS("kpis:view_global", "View Global KPIs", PermissionCategory.KPIS),
  VIEW_PROJECT_KPIS("kpis:view_project", "View Project KPIs", PermissionCategory.KPIS),
  VIEW_COMPANY_KPIS("kpis:view_company", "View Company KPIs", PermissionCategory.KPIS);

  private static final Map<String, PermissionAction> BY_CODE =
      Arrays.stream(values())
          .collect(Collectors.toMap(PermissionAction::code, Function.identity()));

  private final String code;
  private final String label;
  private final PermissionCategory category;

  PermissionAction(String code, String label, PermissionCategory category) {
    this.code = code;
    this.label = label;
    this.category = category;
  }

  public String code() {
    return code;
  }

  public String label() {
    return label;
  }

  public PermissionCategory category() {
    return category;
  }

  /** Lookup that tolerates unknown codes, for persisted data. */
  public static Optional<PermissionAction> findByCode(String code) {
    return Optional.ofNullable(code == null ? null : BY_CODE.get(code));
  }

  /** Parses an action code from API input. Unknown codes are a caller error. */
  public static PermissionAction fromCode(String code) {
    return findByCode(code)
        .orElseThrow(
            () ->
                new InvalidStateException(
                    "Unknown permission action", "No permission action with code '" + code + "'"));
  }
}
