package io.b2mash.meetings.pointtracker.user;

import io.b2mash.meetings.pointtracker.permission.ProjectRole;
import io.b2mash.meetings.pointtracker.project.ProjectMember;
import io.b2mash.meetings.pointtracker.project.ProjectMemberRepository;
import io.b2mash.meetings.pointtracker.security.CurrentUser;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Optional;
import java.util.UUID;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Builds the per-request {@link CurrentUser} from the user row and project memberships. */
@Service
public class UserContextService {

  private final AppUserRepository userRepository;
  private final ProjectMemberRepository projectMemberRepository;

  public UserContextService(
      AppUserRepository userRepository, ProjectMemberRepository projectMemberRepository) {
    this.userRepository = userRepository;
    this.projectMemberRepository = projectMemberRepository;
  }

  @Transactional(readOnly = true)
  public Optional<UUID> findUserIdBySubject(String subject) {
    return userRepository.findBySubject(subject).map(AppUser::getId);
  }

  /** Returns the context of an active user, or empty if the user is unknown or deactivated. */
  @Transactional(readOnly = true)
  public Optional<CurrentUser> loadCurrentUser(UUID userId) {
    return userRepository.findById(userId).filter(AppUser::isActive).map(this::toCurrentUser);
  }

  private CurrentUser toCurrentUser(AppUser user) {
    var projectIds = new HashSet<UUID>();
    var projectRoles = new HashMap<UUID, ProjectRole>();
    for (ProjectMember membership : projectMemberRepository.findByUserId(user.getId())) {
      projectIds.add(membership.getProjectId());
      if (membership.getProjectRole() != null) {
        projectRoles.put(membership.getProjectId(), membership.getProjectRole());
      }
    }
    return new CurrentUser(
        user.getId(),
        user.getEmail(),
        user.getName(),
        user.getRoles(),
        user.getCompanyId(),
        projectIds,
        projectRoles);
  }
}
