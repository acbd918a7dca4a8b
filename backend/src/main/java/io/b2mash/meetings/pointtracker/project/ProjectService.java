package io.b2mash.meetings.pointtracker.project;

import io.b2mash.meetings.pointtracker.security.CurrentUser;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class ProjectService {

  private final ProjectRepository projectRepository;

  public ProjectService(ProjectRepository projectRepository) {
    this.projectRepository = projectRepository;
  }

  /** Every project for the administrator, otherwise the user's memberships. */
  @Transactional(readOnly = true)
  public Set<UUID> accessibleProjectIds(CurrentUser user) {
    if (user.isAdministrator()) {
      return projectRepository.findAll().stream().map(Project::getId).collect(Collectors.toSet());
    }
    return user.projectIds();
  }

  @Transactional(readOnly = true)
  public List<Project> listAccessibleProjects(CurrentUser user) {
    if (user.isAdministrator()) {
      return projectRepository.findAllByOrderByNameAsc();
    }
    if (user.projectIds().isEmpty()) {
      return List.of();
    }
    return projectRepository.findByIdInOrderByNameAsc(user.projectIds());
  }
}
