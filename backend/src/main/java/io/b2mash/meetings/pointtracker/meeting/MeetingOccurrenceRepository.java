package io.b2mash.meetings.pointtracker.meeting;

import jakarta.persistence.LockModeType;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface MeetingOccurrenceRepository extends JpaRepository<MeetingOccurrence, UUID> {

  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT o FROM MeetingOccurrence o WHERE o.id = :id")
  Optional<MeetingOccurrence> findByIdForUpdate(@Param("id") UUID id);
}
