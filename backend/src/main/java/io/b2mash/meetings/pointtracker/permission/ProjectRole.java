package io.b2mash.meetings.pointtracker.permission;

/** Role a user holds inside one project. Independent of the user's global {@link Role}s. */
public enum ProjectRole {
  PROJECT_LEADER("Project Leader"),
  BIM_MANAGER("BIM Manager"),
  BIM_COORDINATOR("BIM Coordinator"),
  DESIGN_LEAD("Design Lead"),
  DESIGN_MANAGER("Design Manager"),
  DESIGN_TEAM_MEMBER("Design Team Member"),
  ENGINEER("Engineer"),
  EXTERNAL_CONSULTANT("External Consultant"),
  PROJECT_VIEWER("Project Viewer");

  private final String displayName;

  ProjectRole(String displayName) {
    this.displayName = displayName;
  }

  public String displayName() {
    return displayName;
  }
}
