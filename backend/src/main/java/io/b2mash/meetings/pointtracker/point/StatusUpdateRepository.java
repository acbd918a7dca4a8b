package io.b2mash.meetings.pointtracker.point;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface StatusUpdateRepository extends JpaRepository<StatusUpdate, UUID> {

  List<StatusUpdate> findByPointIdOrderByCreatedAtAsc(UUID pointId);

  long countByPointId(UUID pointId);
}
