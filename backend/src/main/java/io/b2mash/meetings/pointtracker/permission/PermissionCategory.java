package io.b2mash.meetings.pointtracker.permission;

/** Grouping of {@link PermissionAction}s for the admin configuration screen. */
public enum PermissionCategory {
  MEETINGS("Meetings"),
  POINTS("Points"),
  CONTENT("Content"),
  ATTENDANCE("Attendance"),
  PROJECTS("Projects"),
  ADMINISTRATION("Administration"),
  KPIS("KPIs & Analytics");

  private final String label;

  PermissionCategory(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }
}
