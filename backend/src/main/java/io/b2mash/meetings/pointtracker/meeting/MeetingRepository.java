package io.b2mash.meetings.pointtracker.meeting;

import jakarta.persistence.LockModeType;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface MeetingRepository extends JpaRepository<Meeting, UUID> {

  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT m FROM Meeting m WHERE m.id = :id")
  Optional<Meeting> findByIdForUpdate(@Param("id") UUID id);

  List<Meeting> findByProjectIdAndStatusOrderByMeetingDateAsc(
      UUID projectId, ContainerStatus status);

  List<Meeting> findByProjectIdAndStatusAndIdNotOrderByMeetingDateAsc(
      UUID projectId, ContainerStatus status, UUID excludeId);
}
