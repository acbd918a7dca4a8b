package io.b2mash.meetings.pointtracker.closure;

import io.b2mash.meetings.pointtracker.audit.AuditEventBuilder;
import io.b2mash.meetings.pointtracker.audit.AuditService;
import io.b2mash.meetings.pointtracker.config.ClosureProperties;
import io.b2mash.meetings.pointtracker.exception.ForbiddenException;
import io.b2mash.meetings.pointtracker.exception.InvalidStateException;
import io.b2mash.meetings.pointtracker.exception.InvariantViolationException;
import io.b2mash.meetings.pointtracker.exception.ResourceConflictException;
import io.b2mash.meetings.pointtracker.exception.ResourceNotFoundException;
import io.b2mash.meetings.pointtracker.meeting.Meeting;
import io.b2mash.meetings.pointtracker.meeting.MeetingOccurrence;
import io.b2mash.meetings.pointtracker.meeting.MeetingOccurrenceRepository;
import io.b2mash.meetings.pointtracker.meeting.MeetingRepository;
import io.b2mash.meetings.pointtracker.meeting.MeetingSeries;
import io.b2mash.meetings.pointtracker.meeting.MeetingSeriesRepository;
import io.b2mash.meetings.pointtracker.meeting.PointContainer;
import io.b2mash.meetings.pointtracker.permission.PermissionAction;
import io.b2mash.meetings.pointtracker.permission.PermissionGuard;
import io.b2mash.meetings.pointtracker.permission.PermissionResolver;
import io.b2mash.meetings.pointtracker.point.Point;
import io.b2mash.meetings.pointtracker.point.PointRepository;
import io.b2mash.meetings.pointtracker.point.PointStatus;
import io.b2mash.meetings.pointtracker.point.StatusUpdate;
import io.b2mash.meetings.pointtracker.point.StatusUpdateRepository;
import io.b2mash.meetings.pointtracker.security.CurrentUser;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Closes and reopens meetings, series and occurrences.
 *
 * <p>Each operation is one transaction. The container row is locked before anything else happens,
 * so of two concurrent closes of the same container the second sees it closed and fails with a
 * conflict. A move target is locked as well, so it cannot be closed while points are re-parented
 * into it. Permission, state and target checks all run before the first write; any later failure
 * rolls back the point changes, the status updates and the audit entry together.
 */
@Service
@EnableConfigurationProperties(ClosureProperties.class)
public class ClosureService {

  private static final Logger log = LoggerFactory.getLogger(ClosureService.class);

  private static final String UNKNOWN_TITLE = "Unknown";

  private final MeetingRepository meetingRepository;
  private final MeetingSeriesRepository seriesRepository;
  private final MeetingOccurrenceRepository occurrenceRepository;
  private final PointRepository pointRepository;
  private final StatusUpdateRepository statusUpdateRepository;
  private final PermissionGuard permissionGuard;
  private final PermissionResolver permissionResolver;
  private final AuditService auditService;
  private final ClosureProperties closureProperties;

  public ClosureService(
      MeetingRepository meetingRepository,
      MeetingSeriesRepository seriesRepository,
      MeetingOccurrenceRepository occurrenceRepository,
      PointRepository pointRepository,
      StatusUpdateRepository statusUpdateRepository,
      PermissionGuard permissionGuard,
      PermissionResolver permissionResolver,
      AuditService auditService,
      ClosureProperties closureProperties) {
    this.meetingRepository = meetingRepository;
    this.seriesRepository = seriesRepository;
    this.occurrenceRepository = occurrenceRepository;
    this.pointRepository = pointRepository;
    this.statusUpdateRepository = statusUpdateRepository;
    this.permissionGuard = permissionGuard;
    this.permissionResolver = permissionResolver;
    this.auditService = auditService;
    this.closureProperties = closureProperties;
  }

  @Transactional
  public ClosureResult closeMeeting(UUID meetingId, CloseCommand command) {
    var sourceKey = ContainerKey.meeting(meetingId);
    var locked = lockForClose(sourceKey, command);
    var meeting = locked.get(sourceKey);
    if (meeting == null) {
      throw new ResourceNotFoundException("Meeting", meetingId);
    }
    var unresolved =
        pointRepository.findByMeetingIdAndStatusInOrderByCreatedAtAsc(
            meetingId, PointStatus.UNRESOLVED);
    return close(meeting, "meeting", unresolved, command, locked);
  }

  @Transactional
  public ClosureResult closeSeries(UUID seriesId, CloseCommand command) {
    var sourceKey = ContainerKey.series(seriesId);
    var locked = lockForClose(sourceKey, command);
    var series = locked.get(sourceKey);
    if (series == null) {
      throw new ResourceNotFoundException("MeetingSeries", seriesId);
    }
    var unresolved =
        pointRepository.findBySeriesIdAndStatusInOrderByCreatedAtAsc(
            seriesId, PointStatus.UNRESOLVED);
    return close(series, "meeting_series", unresolved, command, locked);
  }

  @Transactional
  public ClosureResult reopenMeeting(UUID meetingId) {
    var meeting =
        meetingRepository
            .findByIdForUpdate(meetingId)
            .orElseThrow(() -> new ResourceNotFoundException("Meeting", meetingId));
    return reopen(meeting, "meeting");
  }

  @Transactional
  public ClosureResult reopenSeries(UUID seriesId) {
    var series =
        seriesRepository
            .findByIdForUpdate(seriesId)
            .orElseThrow(() -> new ResourceNotFoundException("MeetingSeries", seriesId));
    return reopen(series, "meeting_series");
  }

  /** Marks an occurrence completed. Occurrences own no points, so nothing is migrated. */
  @Transactional
  public ClosureResult completeOccurrence(UUID occurrenceId) {
    var occurrence = lockOccurrence(occurrenceId);
    var user = requireCloseOnSeriesProject(occurrence);

    occurrence.complete(Instant.now());
    occurrenceRepository.save(occurrence);

    logAudit(
        "meeting_occurrence.completed", "meeting_occurrence", occurrence.getId(), null, null, 0);
    log.info("Meeting occurrence {} completed by user {}", occurrenceId, user.id());
    return occurrenceResult(occurrence);
  }

  @Transactional
  public ClosureResult reopenOccurrence(UUID occurrenceId) {
    var occurrence = lockOccurrence(occurrenceId);
    var user = requireCloseOnSeriesProject(occurrence);

    occurrence.reopen();
    occurrenceRepository.save(occurrence);

    logAudit(
        "meeting_occurrence.reopened", "meeting_occurrence", occurrence.getId(), null, null, 0);
    log.info("Meeting occurrence {} reopened by user {}", occurrenceId, user.id());
    return occurrenceResult(occurrence);
  }

  // --- Internals ---

  private ClosureResult close(
      PointContainer source,
      String entityType,
      List<Point> unresolved,
      CloseCommand command,
      Map<ContainerKey, PointContainer> locked) {
    var user =
        permissionGuard.requireProjectPermission(
            PermissionAction.CLOSE_MEETINGS, source.getProjectId());
    if (!source.isOpen()) {
      throw new ResourceConflictException(
          "Already closed", "The " + source.kind() + " " + source.getId() + " is already closed");
    }
    if (command == null || command.mode() == null) {
      throw new InvalidStateException("Missing closure mode", "Closure mode is required");
    }
    PointContainer target =
        command.mode() == ClosureMode.MOVE
            ? resolveMoveTarget(source, command, user, locked)
            : null;

    // No writes above this line
    var today = LocalDate.now();
    String actor = closureProperties.systemActor();
    var updates = new ArrayList<StatusUpdate>(unresolved.size());
    var affected = new ArrayList<UUID>(unresolved.size());
    for (Point point : unresolved) {
      String text;
      if (target != null) {
        if (target instanceof Meeting) {
          point.moveToMeeting(target.getId());
        } else {
          point.moveToSeries(target.getId());
        }
        text = moveMessage(source, target);
      } else {
        point.forceClose();
        text = "Closed with " + source.kind();
      }
      updates.add(new StatusUpdate(point.getId(), today, text, actor));
      affected.add(point.getId());
    }
    pointRepository.saveAll(unresolved);
    statusUpdateRepository.saveAll(updates);

    source.close(Instant.now());
    saveContainer(source);

    UUID targetId = target != null ? target.getId() : null;
    logAudit(
        entityType + ".closed",
        entityType,
        source.getId(),
        command.mode(),
        target,
        affected.size());
    log.info(
        "Closed {} {} (mode={}, target={}, affectedPoints={}) by user {}",
        source.kind(),
        source.getId(),
        command.mode().value(),
        targetId,
        affected.size(),
        user.id());

    return new ClosureResult(
        source.getId(),
        entityType,
        source.getStatus().name(),
        source.getClosedAt(),
        command.mode(),
        targetId,
        affected);
  }

  private ClosureResult reopen(PointContainer container, String entityType) {
    var user =
        permissionGuard.requireProjectPermission(
            PermissionAction.CLOSE_MEETINGS, container.getProjectId());

    container.reopen();
    saveContainer(container);

    logAudit(entityType + ".reopened", entityType, container.getId(), null, null, 0);
    log.info("Reopened {} {} by user {}", container.kind(), container.getId(), user.id());
    return new ClosureResult(
        container.getId(),
        entityType,
        container.getStatus().name(),
        container.getClosedAt(),
        null,
        null,
        List.of());
  }

  /**
   * Locks the source and, in move mode, the target row. Rows are always locked in ascending key
   * order, so two closes moving points into each other's container cannot deadlock. Missing rows
   * are absent from the result.
   */
  private Map<ContainerKey, PointContainer> lockForClose(
      ContainerKey sourceKey, CloseCommand command) {
    var keys = new TreeSet<ContainerKey>();
    keys.add(sourceKey);
    var targetKey = moveTargetKey(command);
    if (targetKey != null) {
      keys.add(targetKey);
    }
    var locked = new HashMap<ContainerKey, PointContainer>();
    for (ContainerKey key : keys) {
      lockContainer(key).ifPresent(container -> locked.put(key, container));
    }
    return locked;
  }

  private Optional<PointContainer> lockContainer(ContainerKey key) {
    return key.series()
        ? seriesRepository.findByIdForUpdate(key.id()).map(PointContainer.class::cast)
        : meetingRepository.findByIdForUpdate(key.id()).map(PointContainer.class::cast);
  }

  /** The single requested move target, or null when the command names none or both. */
  private static ContainerKey moveTargetKey(CloseCommand command) {
    if (command == null || command.mode() != ClosureMode.MOVE) {
      return null;
    }
    if (command.targetMeetingId() != null && command.targetSeriesId() == null) {
      return ContainerKey.meeting(command.targetMeetingId());
    }
    if (command.targetSeriesId() != null && command.targetMeetingId() == null) {
      return ContainerKey.series(command.targetSeriesId());
    }
    return null;
  }

  /**
   * Validates the move target: exactly one id, an existing container other than the source, still
   * open under its row lock, in a project the user can access.
   */
  private PointContainer resolveMoveTarget(
      PointContainer source,
      CloseCommand command,
      CurrentUser user,
      Map<ContainerKey, PointContainer> locked) {
    UUID targetMeetingId = command.targetMeetingId();
    UUID targetSeriesId = command.targetSeriesId();
    if (targetMeetingId != null && targetSeriesId != null) {
      throw new InvalidStateException(
          "Ambiguous move target", "Specify either targetMeetingId or targetSeriesId, not both");
    }
    if (targetMeetingId == null && targetSeriesId == null) {
      throw new InvalidStateException(
          "Missing move target", "Mode 'move' requires targetMeetingId or targetSeriesId");
    }

    PointContainer target = locked.get(moveTargetKey(command));
    if (target == null) {
      throw targetMeetingId != null
          ? new ResourceNotFoundException("Meeting", targetMeetingId)
          : new ResourceNotFoundException("MeetingSeries", targetSeriesId);
    }

    if (target.getClass().equals(source.getClass()) && target.getId().equals(source.getId())) {
      throw new InvalidStateException(
          "Invalid move target",
          "Points cannot be moved to the " + source.kind() + " being closed");
    }
    if (!target.isOpen()) {
      throw new InvalidStateException(
          "Invalid move target",
          "The target " + target.kind() + " " + target.getId() + " is closed");
    }
    if (!permissionResolver.canAccessProject(user, target.getProjectId())) {
      throw new ForbiddenException(
          "Project access denied",
          "You do not have access to project " + target.getProjectId() + " of the move target");
    }
    return target;
  }

  private static String moveMessage(PointContainer source, PointContainer target) {
    return "Point moved from closed "
        + source.kind()
        + " \""
        + titleOrUnknown(source)
        + "\" to "
        + target.kind()
        + " \""
        + titleOrUnknown(target)
        + "\"";
  }

  private static String titleOrUnknown(PointContainer container) {
    String title = container.getTitle();
    return title == null || title.isBlank() ? UNKNOWN_TITLE : title;
  }

  private void saveContainer(PointContainer container) {
    if (container instanceof Meeting meeting) {
      meetingRepository.save(meeting);
    } else if (container instanceof MeetingSeries series) {
      seriesRepository.save(series);
    } else {
      throw new InvariantViolationException(
          "Unsupported container type " + container.getClass().getSimpleName());
    }
  }

  private MeetingOccurrence lockOccurrence(UUID occurrenceId) {
    return occurrenceRepository
        .findByIdForUpdate(occurrenceId)
        .orElseThrow(() -> new ResourceNotFoundException("MeetingOccurrence", occurrenceId));
  }

  private CurrentUser requireCloseOnSeriesProject(MeetingOccurrence occurrence) {
    var series =
        seriesRepository
            .findById(occurrence.getSeriesId())
            .orElseThrow(
                () ->
                    new InvariantViolationException(
                        "Occurrence " + occurrence.getId() + " references missing series"));
    return permissionGuard.requireProjectPermission(
        PermissionAction.CLOSE_MEETINGS, series.getProjectId());
  }

  private static ClosureResult occurrenceResult(MeetingOccurrence occurrence) {
    return new ClosureResult(
        occurrence.getId(),
        "meeting_occurrence",
        occurrence.getStatus().name(),
        occurrence.getClosedAt(),
        null,
        null,
        List.of());
  }

  private void logAudit(
      String eventType,
      String entityType,
      UUID entityId,
      ClosureMode mode,
      PointContainer target,
      int affectedPoints) {
    var details = new LinkedHashMap<String, Object>();
    if (mode != null) {
      details.put("mode", mode.value());
    }
    if (target != null) {
      details.put("target_type", target.kind());
      details.put("target_id", target.getId().toString());
    }
    details.put("affected_points", affectedPoints);
    auditService.log(
        AuditEventBuilder.builder()
            .eventType(eventType)
            .entityType(entityType)
            .entityId(entityId)
            .details(details)
            .build());
  }

  /** Row identity across the meeting and series tables; orders locks by id, then table. */
  private record ContainerKey(boolean series, UUID id) implements Comparable<ContainerKey> {

    static ContainerKey meeting(UUID id) {
      return new ContainerKey(false, id);
    }

    static ContainerKey series(UUID id) {
      return new ContainerKey(true, id);
    }

    @Override
    public int compareTo(ContainerKey other) {
      int byId = id.compareTo(other.id);
      return byId != 0 ? byId : Boolean.compare(series, other.series);
    }
  }
}
