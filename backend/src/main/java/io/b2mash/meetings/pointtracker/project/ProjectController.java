package io.b2mash.meetings.pointtracker.project;

import io.b2mash.meetings.pointtracker.security.RequestScopes;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ProjectController {

  private final ProjectService projectService;

  public ProjectController(ProjectService projectService) {
    this.projectService = projectService;
  }

  @GetMapping("/api/projects")
  public ResponseEntity<List<ProjectResponse>> listProjects() {
    var user = RequestScopes.requireCurrentUser();
    return ResponseEntity.ok(
        projectService.listAccessibleProjects(user).stream().map(ProjectResponse::from).toList());
  }

  public record ProjectResponse(UUID id, String name) {

    public static ProjectResponse from(Project project) {
      return new ProjectResponse(project.getId(), project.getName());
    }
  }
}
