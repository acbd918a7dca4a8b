package io.b2mash.meetings.pointtracker.audit;

import io.b2mash.meetings.pointtracker.security.CurrentUser;
import io.b2mash.meetings.pointtracker.security.RequestScopes;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

/**
 * Builder that constructs an {@link AuditEventRecord}. Actor and source are taken from the current
 * request when not set explicitly.
 *
 * <pre>{@code
 * AuditEventRecord record = AuditEventBuilder.builder()
 *     .eventType("meeting.closed")
 *     .entityType("meeting")
 *     .entityId(meeting.getId())
 *     .details(Map.of("mode", "move"))
 *     .build();
 * }</pre>
 */
public class AuditEventBuilder {

  private String eventType;
  private String entityType;
  private UUID entityId;
  private UUID actorId;
  private Map<String, Object> details;

  private boolean actorIdExplicitlySet;

  private AuditEventBuilder() {}

  public static AuditEventBuilder builder() {
    return new AuditEventBuilder();
  }

  public AuditEventBuilder eventType(String eventType) {
    this.eventType = eventType;
    return this;
  }

  public AuditEventBuilder entityType(String entityType) {
    this.entityType = entityType;
    return this;
  }

  public AuditEventBuilder entityId(UUID entityId) {
    this.entityId = entityId;
    return this;
  }

  public AuditEventBuilder actorId(UUID actorId) {
    this.actorId = actorId;
    this.actorIdExplicitlySet = true;
    return this;
  }

  public AuditEventBuilder details(Map<String, Object> details) {
    this.details = details;
    return this;
  }

  /**
   * Builds the record. {@code actorId} defaults to the bound {@link CurrentUser}, {@code actorType}
   * is "USER" when an actor is known and "SYSTEM" otherwise, {@code source} is "API" inside an HTTP
   * request and "INTERNAL" elsewhere.
   */
  public AuditEventRecord build() {
    UUID resolvedActorId = this.actorId;
    if (!actorIdExplicitlySet) {
      resolvedActorId = RequestScopes.currentUser().map(CurrentUser::id).orElse(null);
    }
    String actorType = resolvedActorId != null ? "USER" : "SYSTEM";
    String source = inHttpRequest() ? "API" : "INTERNAL";

    return new AuditEventRecord(
        eventType,
        entityType,
        entityId,
        resolvedActorId,
        actorType,
        source,
        Optional.ofNullable(details).orElse(Map.of()));
  }

  private static boolean inHttpRequest() {
    return RequestContextHolder.getRequestAttributes() instanceof ServletRequestAttributes;
  }
}
