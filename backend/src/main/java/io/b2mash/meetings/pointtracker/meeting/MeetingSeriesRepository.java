package io.b2mash.meetings.pointtracker.meeting;

import jakarta.persistence.LockModeType;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface MeetingSeriesRepository extends JpaRepository<MeetingSeries, UUID> {

  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT s FROM MeetingSeries s WHERE s.id = :id")
  Optional<MeetingSeries> findByIdForUpdate(@Param("id") UUID id);

  List<MeetingSeries> findByProjectIdAndStatusOrderByCreatedAtDesc(
      UUID projectId, ContainerStatus status);

  List<MeetingSeries> findByProjectIdAndStatusAndIdNotOrderByCreatedAtDesc(
      UUID projectId, ContainerStatus status, UUID excludeId);
}
