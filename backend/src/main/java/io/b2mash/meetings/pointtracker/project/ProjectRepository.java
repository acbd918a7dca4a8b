package io.b2mash.meetings.pointtracker.project;

import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ProjectRepository extends JpaRepository<Project, UUID> {

  List<Project> findAllByOrderByNameAsc();

  List<Project> findByIdInOrderByNameAsc(Collection<UUID> ids);
}
