package io.b2mash.meetings.pointtracker.project;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ProjectMemberRepository extends JpaRepository<ProjectMember, UUID> {

  List<ProjectMember> findByUserId(UUID userId);
}
