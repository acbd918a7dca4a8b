package io.b2mash.meetings.pointtracker.meeting;

import io.b2mash.meetings.pointtracker.permission.PermissionGuard;
import java.util.List;
import java.util.UUID;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Lists the containers a closing meeting's points can be moved to. */
@Service
public class MeetingQueryService {

  private final MeetingRepository meetingRepository;
  private final MeetingSeriesRepository seriesRepository;
  private final PermissionGuard permissionGuard;

  public MeetingQueryService(
      MeetingRepository meetingRepository,
      MeetingSeriesRepository seriesRepository,
      PermissionGuard permissionGuard) {
    this.meetingRepository = meetingRepository;
    this.seriesRepository = seriesRepository;
    this.permissionGuard = permissionGuard;
  }

  /** Scheduled meetings of the project, earliest first, without {@code excludeId}. */
  @Transactional(readOnly = true)
  public List<Meeting> listOpenMeetings(UUID projectId, UUID excludeId) {
    permissionGuard.requireProjectAccess(projectId);
    if (excludeId == null) {
      return meetingRepository.findByProjectIdAndStatusOrderByMeetingDateAsc(
          projectId, ContainerStatus.SCHEDULED);
    }
    return meetingRepository.findByProjectIdAndStatusAndIdNotOrderByMeetingDateAsc(
        projectId, ContainerStatus.SCHEDULED, excludeId);
  }

  /** Open series of the project, newest first, without {@code excludeId}. */
  @Transactional(readOnly = true)
  public List<MeetingSeries> listOpenSeries(UUID projectId, UUID excludeId) {
    permissionGuard.requireProjectAccess(projectId);
    if (excludeId == null) {
      return seriesRepository.findByProjectIdAndStatusOrderByCreatedAtDesc(
          projectId, ContainerStatus.SCHEDULED);
    }
    return seriesRepository.findByProjectIdAndStatusAndIdNotOrderByCreatedAtDesc(
        projectId, ContainerStatus.SCHEDULED, excludeId);
  }
}
