package io.b2mash.meetings.pointtracker.point;

import io.b2mash.meetings.pointtracker.audit.AuditEventBuilder;
import io.b2mash.meetings.pointtracker.audit.AuditService;
import io.b2mash.meetings.pointtracker.exception.InvariantViolationException;
import io.b2mash.meetings.pointtracker.exception.ResourceNotFoundException;
import io.b2mash.meetings.pointtracker.meeting.Meeting;
import io.b2mash.meetings.pointtracker.meeting.MeetingRepository;
import io.b2mash.meetings.pointtracker.meeting.MeetingSeries;
import io.b2mash.meetings.pointtracker.meeting.MeetingSeriesRepository;
import io.b2mash.meetings.pointtracker.permission.PermissionGuard;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class PointService {

  private static final Logger log = LoggerFactory.getLogger(PointService.class);

  private final PointRepository pointRepository;
  private final StatusUpdateRepository statusUpdateRepository;
  private final MeetingRepository meetingRepository;
  private final MeetingSeriesRepository seriesRepository;
  private final PermissionGuard permissionGuard;
  private final AuditService auditService;

  public PointService(
      PointRepository pointRepository,
      StatusUpdateRepository statusUpdateRepository,
      MeetingRepository meetingRepository,
      MeetingSeriesRepository seriesRepository,
      PermissionGuard permissionGuard,
      AuditService auditService) {
    this.pointRepository = pointRepository;
    this.statusUpdateRepository = statusUpdateRepository;
    this.meetingRepository = meetingRepository;
    this.seriesRepository = seriesRepository;
    this.permissionGuard = permissionGuard;
    this.auditService = auditService;
  }

  /**
   * Changes a point's status on behalf of the current user and appends one status update
   * attributed to them. Users without {@code points:edit:any} may only change points assigned to
   * them.
   */
  @Transactional
  public Point updateStatus(UUID pointId, PointStatus newStatus, String comment) {
    var point =
        pointRepository
            .findById(pointId)
            .orElseThrow(() -> new ResourceNotFoundException("Point", pointId));
    UUID projectId = resolveProjectId(point);
    var user = permissionGuard.requirePointEdit(pointId, point.getAssignedToRef(), projectId);

    PointStatus oldStatus = point.getStatus();
    point.changeStatus(newStatus);
    point = pointRepository.save(point);

    String text =
        comment != null && !comment.isBlank()
            ? comment
            : "Status changed from " + label(oldStatus) + " to " + label(newStatus);
    String actionOn = user.name() != null && !user.name().isBlank() ? user.name() : user.email();
    statusUpdateRepository.save(new StatusUpdate(pointId, LocalDate.now(), text, actionOn));

    var details = new LinkedHashMap<String, Object>();
    details.put("from", oldStatus.name());
    details.put("to", newStatus.name());
    details.put("project_id", projectId.toString());
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("point.status_changed")
            .entityType("point")
            .entityId(pointId)
            .details(details)
            .build());

    log.info(
        "Point {} status changed {} -> {} by user {}", pointId, oldStatus, newStatus, user.id());
    return point;
  }

  @Transactional(readOnly = true)
  public List<StatusUpdate> listStatusUpdates(UUID pointId) {
    var point =
        pointRepository
            .findById(pointId)
            .orElseThrow(() -> new ResourceNotFoundException("Point", pointId));
    permissionGuard.requireProjectAccess(resolveProjectId(point));
    return statusUpdateRepository.findByPointIdOrderByCreatedAtAsc(pointId);
  }

  private UUID resolveProjectId(Point point) {
    if (point.getMeetingId() != null) {
      return meetingRepository
          .findById(point.getMeetingId())
          .map(Meeting::getProjectId)
          .orElseThrow(
              () ->
                  new InvariantViolationException(
                      "Point " + point.getId() + " references missing meeting"));
    }
    return seriesRepository
        .findById(point.getSeriesId())
        .map(MeetingSeries::getProjectId)
        .orElseThrow(
            () ->
                new InvariantViolationException(
                    "Point " + point.getId() + " references missing series"));
  }

  private static String label(PointStatus status) {
    String name = status.name().toLowerCase();
    return Character.toUpperCase(name.charAt(0)) + name.substring(1);
  }
}
