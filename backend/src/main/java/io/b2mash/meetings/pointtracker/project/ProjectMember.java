package io.b2mash.meetings.pointtracker.project;

import io.b2mash.meetings.pointtracker.permission.ProjectRole;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.util.UUID;

/** A user's membership in a project, with the project role it confers (nullable). */
@Entity
@Table(name = "project_users")
public class ProjectMember {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "project_id", nullable = false)
  private UUID projectId;

  @Column(name = "user_id", nullable = false)
  private UUID userId;

  @Enumerated(EnumType.STRING)
  @Column(name = "project_role", length = 50)
  private ProjectRole projectRole;

  protected ProjectMember() {}

  public ProjectMember(UUID projectId, UUID userId, ProjectRole projectRole) {
    this.projectId = projectId;
    this.userId = userId;
    this.projectRole = projectRole;
  }

  public UUID getId() {
    return id;
  }

  public UUID getProjectId() {
    return projectId;
  }

  public UUID getUserId() {
    return userId;
  }

  public ProjectRole getProjectRole() {
    return projectRole;
  }
}
