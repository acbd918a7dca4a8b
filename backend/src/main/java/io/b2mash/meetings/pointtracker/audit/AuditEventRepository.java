package io.b2mash.meetings.pointtracker.audit;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface AuditEventRepository extends JpaRepository<AuditEvent, UUID> {

  List<AuditEvent> findByEntityTypeAndEntityIdOrderByOccurredAtDesc(
      String entityType, UUID entityId);

  List<AuditEvent> findByEventTypeOrderByOccurredAtDesc(String eventType);
}
