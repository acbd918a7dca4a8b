package io.b2mash.meetings.pointtracker.closure;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.b2mash.meetings.pointtracker.audit.AuditEventRecord;
import io.b2mash.meetings.pointtracker.audit.AuditService;
import io.b2mash.meetings.pointtracker.config.ClosureProperties;
import io.b2mash.meetings.pointtracker.exception.ForbiddenException;
import io.b2mash.meetings.pointtracker.exception.InvalidStateException;
import io.b2mash.meetings.pointtracker.exception.ResourceConflictException;
import io.b2mash.meetings.pointtracker.exception.ResourceNotFoundException;
import io.b2mash.meetings.pointtracker.meeting.ContainerStatus;
import io.b2mash.meetings.pointtracker.meeting.Meeting;
import io.b2mash.meetings.pointtracker.meeting.MeetingOccurrence;
import io.b2mash.meetings.pointtracker.meeting.MeetingOccurrenceRepository;
import io.b2mash.meetings.pointtracker.meeting.MeetingRepository;
import io.b2mash.meetings.pointtracker.meeting.MeetingSeries;
import io.b2mash.meetings.pointtracker.meeting.MeetingSeriesRepository;
import io.b2mash.meetings.pointtracker.meeting.OccurrenceStatus;
import io.b2mash.meetings.pointtracker.permission.PermissionAction;
import io.b2mash.meetings.pointtracker.permission.PermissionGuard;
import io.b2mash.meetings.pointtracker.permission.PermissionResolver;
import io.b2mash.meetings.pointtracker.permission.Role;
import io.b2mash.meetings.pointtracker.point.Point;
import io.b2mash.meetings.pointtracker.point.PointRepository;
import io.b2mash.meetings.pointtracker.point.PointStatus;
import io.b2mash.meetings.pointtracker.point.StatusUpdate;
import io.b2mash.meetings.pointtracker.point.StatusUpdateRepository;
import io.b2mash.meetings.pointtracker.security.CurrentUser;
import io.b2mash.meetings.pointtracker.testutil.TestUsers;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class ClosureServiceTest {

  private static final UUID PROJECT_ID = UUID.randomUUID();

  @Mock private MeetingRepository meetingRepository;
  @Mock private MeetingSeriesRepository seriesRepository;
  @Mock private MeetingOccurrenceRepository occurrenceRepository;
  @Mock private PointRepository pointRepository;
  @Mock private StatusUpdateRepository statusUpdateRepository;
  @Mock private PermissionGuard permissionGuard;
  @Mock private PermissionResolver permissionResolver;
  @Mock private AuditService auditService;

  private ClosureService service;
  private CurrentUser manager;

  @BeforeEach
  void setUp() {
    service =
        new ClosureService(
            meetingRepository,
            seriesRepository,
            occurrenceRepository,
            pointRepository,
            statusUpdateRepository,
            permissionGuard,
            permissionResolver,
            auditService,
            new ClosureProperties(null));
    manager = TestUsers.user().roles(Role.BIM_PROJECT_MANAGER).member(PROJECT_ID).build();
  }

  @Test
  void closeMode_forceClosesUnresolvedPoints_andClosesMeeting() {
    var meeting = meeting("Weekly coordination");
    var open = meetingPoint(meeting, PointStatus.OPEN);
    var ongoing = meetingPoint(meeting, PointStatus.ONGOING);
    var alreadyClosed = meetingPoint(meeting, PointStatus.CLOSED);
    givenLockedMeeting(meeting, List.of(open, ongoing));
    givenCloseAllowed();

    var result = service.closeMeeting(meeting.getId(), CloseCommand.closeAll());

    assertThat(open.getStatus()).isEqualTo(PointStatus.CLOSED);
    assertThat(ongoing.getStatus()).isEqualTo(PointStatus.CLOSED);
    assertThat(alreadyClosed.getStatus()).isEqualTo(PointStatus.CLOSED);
    assertThat(meeting.getStatus()).isEqualTo(ContainerStatus.CLOSED);
    assertThat(meeting.getClosedAt()).isNotNull();
    assertThat(result.affectedPointIds()).containsExactly(open.getId(), ongoing.getId());

    var updates = captureStatusUpdates();
    assertThat(updates).hasSize(2);
    assertThat(updates)
        .allSatisfy(
            update -> {
              assertThat(update.getStatus()).isEqualTo("Closed with meeting");
              assertThat(update.getActionOn()).isEqualTo("System");
              assertThat(update.getDate()).isEqualTo(LocalDate.now());
            });
    assertThat(updates).extracting(StatusUpdate::getPointId).doesNotContain(alreadyClosed.getId());
  }

  @Test
  void moveMode_reparentsUnresolvedPointToTargetMeeting() {
    var source = meeting("Design review 1");
    var target = meeting("Design review 2");
    var open = meetingPoint(source, PointStatus.OPEN);
    var postponed = meetingPoint(source, PointStatus.POSTPONED);
    givenLockedMeeting(source, List.of(open));
    givenCloseAllowed();
    when(meetingRepository.findByIdForUpdate(target.getId())).thenReturn(Optional.of(target));
    when(permissionResolver.canAccessProject(manager, PROJECT_ID)).thenReturn(true);

    var result = service.closeMeeting(source.getId(), CloseCommand.moveToMeeting(target.getId()));

    assertThat(open.getMeetingId()).isEqualTo(target.getId());
    assertThat(open.getSeriesId()).isNull();
    assertThat(open.getStatus()).isEqualTo(PointStatus.OPEN);
    assertThat(postponed.getMeetingId()).isEqualTo(source.getId());
    assertThat(source.getStatus()).isEqualTo(ContainerStatus.CLOSED);
    assertThat(result.targetId()).isEqualTo(target.getId());
    assertThat(result.mode()).isEqualTo(ClosureMode.MOVE);

    var updates = captureStatusUpdates();
    assertThat(updates).hasSize(1);
    assertThat(updates.get(0).getStatus())
        .isEqualTo(
            "Point moved from closed meeting \"Design review 1\" to meeting \"Design review 2\"");
  }

  @Test
  void moveMode_locksTargetBeforeSource_whenTargetIdIsLower() {
    var source = meeting("Later id");
    var target = meeting("Earlier id");
    ReflectionTestUtils.setField(source, "id", new UUID(0L, 2L));
    ReflectionTestUtils.setField(target, "id", new UUID(0L, 1L));
    givenLockedMeeting(source, List.of(meetingPoint(source, PointStatus.OPEN)));
    givenCloseAllowed();
    when(meetingRepository.findByIdForUpdate(target.getId())).thenReturn(Optional.of(target));
    when(permissionResolver.canAccessProject(manager, PROJECT_ID)).thenReturn(true);

    service.closeMeeting(source.getId(), CloseCommand.moveToMeeting(target.getId()));

    var locks = inOrder(meetingRepository);
    locks.verify(meetingRepository).findByIdForUpdate(target.getId());
    locks.verify(meetingRepository).findByIdForUpdate(source.getId());
    verify(meetingRepository, never()).findById(any());
  }

  @Test
  void moveMode_locksSourceBeforeTarget_whenSourceIdIsLower() {
    var source = meeting("Earlier id");
    var target = meeting("Later id");
    ReflectionTestUtils.setField(source, "id", new UUID(0L, 1L));
    ReflectionTestUtils.setField(target, "id", new UUID(0L, 2L));
    givenLockedMeeting(source, List.of());
    givenCloseAllowed();
    when(meetingRepository.findByIdForUpdate(target.getId())).thenReturn(Optional.of(target));
    when(permissionResolver.canAccessProject(manager, PROJECT_ID)).thenReturn(true);

    service.closeMeeting(source.getId(), CloseCommand.moveToMeeting(target.getId()));

    var locks = inOrder(meetingRepository);
    locks.verify(meetingRepository).findByIdForUpdate(source.getId());
    locks.verify(meetingRepository).findByIdForUpdate(target.getId());
  }

  @Test
  void moveMode_toSeries_clearsMeetingParent() {
    var source = meeting("Kick-off");
    var series = series("Weekly BIM");
    var open = meetingPoint(source, PointStatus.NEW);
    givenLockedMeeting(source, List.of(open));
    givenCloseAllowed();
    when(seriesRepository.findByIdForUpdate(series.getId())).thenReturn(Optional.of(series));
    when(permissionResolver.canAccessProject(manager, PROJECT_ID)).thenReturn(true);

    service.closeMeeting(source.getId(), CloseCommand.moveToSeries(series.getId()));

    assertThat(open.getSeriesId()).isEqualTo(series.getId());
    assertThat(open.getMeetingId()).isNull();
    assertThat(captureStatusUpdates().get(0).getStatus())
        .isEqualTo("Point moved from closed meeting \"Kick-off\" to series \"Weekly BIM\"");
  }

  @Test
  void moveMode_withoutTarget_failsBeforeAnyWrite() {
    var meeting = meeting("No target");
    var open = meetingPoint(meeting, PointStatus.OPEN);
    givenLockedMeeting(meeting, List.of(open));
    givenCloseAllowed();

    assertThatThrownBy(
            () ->
                service.closeMeeting(
                    meeting.getId(), new CloseCommand(ClosureMode.MOVE, null, null)))
        .isInstanceOf(InvalidStateException.class);

    assertThat(meeting.getStatus()).isEqualTo(ContainerStatus.SCHEDULED);
    assertThat(open.getMeetingId()).isEqualTo(meeting.getId());
    assertThat(open.getStatus()).isEqualTo(PointStatus.OPEN);
    assertNoWrites();
  }

  @Test
  void moveMode_withBothTargets_isRejected() {
    var meeting = meeting("Both targets");
    givenLockedMeeting(meeting, List.of());
    givenCloseAllowed();

    assertThatThrownBy(
            () ->
                service.closeMeeting(
                    meeting.getId(),
                    new CloseCommand(ClosureMode.MOVE, UUID.randomUUID(), UUID.randomUUID())))
        .isInstanceOf(InvalidStateException.class)
        .hasMessageContaining("not both");
    assertNoWrites();
  }

  @Test
  void moveMode_targetIsSource_isRejected() {
    var meeting = meeting("Self");
    givenLockedMeeting(meeting, List.of());
    givenCloseAllowed();

    var selfMove = CloseCommand.moveToMeeting(meeting.getId());

    assertThatThrownBy(() -> service.closeMeeting(meeting.getId(), selfMove))
        .isInstanceOf(InvalidStateException.class);
    assertNoWrites();
  }

  @Test
  void moveMode_closedTarget_isRejected() {
    var source = meeting("Source");
    var target = meeting("Closed target");
    target.close(Instant.now());
    givenLockedMeeting(source, List.of());
    givenCloseAllowed();
    when(meetingRepository.findByIdForUpdate(target.getId())).thenReturn(Optional.of(target));

    assertThatThrownBy(
            () -> service.closeMeeting(source.getId(), CloseCommand.moveToMeeting(target.getId())))
        .isInstanceOf(InvalidStateException.class)
        .hasMessageContaining("closed");
    assertNoWrites();
  }

  @Test
  void moveMode_missingTarget_isNotFound() {
    var source = meeting("Source");
    var missing = UUID.randomUUID();
    givenLockedMeeting(source, List.of());
    givenCloseAllowed();
    when(meetingRepository.findByIdForUpdate(missing)).thenReturn(Optional.empty());

    assertThatThrownBy(
            () -> service.closeMeeting(source.getId(), CloseCommand.moveToMeeting(missing)))
        .isInstanceOf(ResourceNotFoundException.class);
    assertNoWrites();
  }

  @Test
  void moveMode_targetInInaccessibleProject_isForbidden() {
    var source = meeting("Source");
    var foreignProject = UUID.randomUUID();
    var target = new Meeting(foreignProject, "Elsewhere", LocalDate.now());
    ReflectionTestUtils.setField(target, "id", UUID.randomUUID());
    givenLockedMeeting(source, List.of());
    givenCloseAllowed();
    when(meetingRepository.findByIdForUpdate(target.getId())).thenReturn(Optional.of(target));
    when(permissionResolver.canAccessProject(manager, foreignProject)).thenReturn(false);

    assertThatThrownBy(
            () -> service.closeMeeting(source.getId(), CloseCommand.moveToMeeting(target.getId())))
        .isInstanceOf(ForbiddenException.class);
    assertNoWrites();
  }

  @Test
  void moveMode_requiresTarget_evenWithNothingToMove() {
    var meeting = meeting("Empty");
    givenLockedMeeting(meeting, List.of());
    givenCloseAllowed();

    assertThatThrownBy(
            () ->
                service.closeMeeting(
                    meeting.getId(), new CloseCommand(ClosureMode.MOVE, null, null)))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void closeMode_withNoUnresolvedPoints_stillClosesMeeting() {
    var meeting = meeting("Nothing open");
    givenLockedMeeting(meeting, List.of());
    givenCloseAllowed();

    var result = service.closeMeeting(meeting.getId(), CloseCommand.closeAll());

    assertThat(result.affectedPointIds()).isEmpty();
    assertThat(meeting.getStatus()).isEqualTo(ContainerStatus.CLOSED);
    assertThat(captureStatusUpdates()).isEmpty();
  }

  @Test
  void close_withoutPermission_isForbiddenAndWritesNothing() {
    var meeting = meeting("Restricted");
    givenLockedMeeting(meeting, List.of(meetingPoint(meeting, PointStatus.OPEN)));
    when(permissionGuard.requireProjectPermission(PermissionAction.CLOSE_MEETINGS, PROJECT_ID))
        .thenThrow(new ForbiddenException("Permission denied", "meetings:close"));

    assertThatThrownBy(() -> service.closeMeeting(meeting.getId(), CloseCommand.closeAll()))
        .isInstanceOf(ForbiddenException.class);
    assertThat(meeting.getStatus()).isEqualTo(ContainerStatus.SCHEDULED);
    assertNoWrites();
  }

  @Test
  void close_alreadyClosedMeeting_isConflict() {
    var meeting = meeting("Done");
    meeting.close(Instant.now());
    givenLockedMeeting(meeting, List.of());
    givenCloseAllowed();

    assertThatThrownBy(() -> service.closeMeeting(meeting.getId(), CloseCommand.closeAll()))
        .isInstanceOf(ResourceConflictException.class);
    assertNoWrites();
  }

  @Test
  void close_unknownMeeting_isNotFound() {
    var id = UUID.randomUUID();
    when(meetingRepository.findByIdForUpdate(id)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.closeMeeting(id, CloseCommand.closeAll()))
        .isInstanceOf(ResourceNotFoundException.class);
    verifyNoInteractions(permissionGuard);
  }

  @Test
  void closeSeries_forceClose_usesSeriesWording() {
    var series = series("Site walk");
    var point = Point.inSeries(series.getId(), "Check railing", PointStatus.ONGOING);
    ReflectionTestUtils.setField(point, "id", UUID.randomUUID());
    when(seriesRepository.findByIdForUpdate(series.getId())).thenReturn(Optional.of(series));
    when(pointRepository.findBySeriesIdAndStatusInOrderByCreatedAtAsc(
            series.getId(), PointStatus.UNRESOLVED))
        .thenReturn(List.of(point));
    givenCloseAllowed();

    var result = service.closeSeries(series.getId(), CloseCommand.closeAll());

    assertThat(result.containerType()).isEqualTo("meeting_series");
    assertThat(series.getStatus()).isEqualTo(ContainerStatus.CLOSED);
    assertThat(captureStatusUpdates().get(0).getStatus()).isEqualTo("Closed with series");
    assertThat(captureAudit().eventType()).isEqualTo("meeting_series.closed");
  }

  @Test
  void reopen_afterForceClose_leavesPointsClosed() {
    var meeting = meeting("Scenario D");
    var open = meetingPoint(meeting, PointStatus.OPEN);
    var ongoing = meetingPoint(meeting, PointStatus.ONGOING);
    givenLockedMeeting(meeting, List.of(open, ongoing));
    givenCloseAllowed();
    service.closeMeeting(meeting.getId(), CloseCommand.closeAll());

    var result = service.reopenMeeting(meeting.getId());

    assertThat(meeting.getStatus()).isEqualTo(ContainerStatus.SCHEDULED);
    assertThat(meeting.getClosedAt()).isNull();
    assertThat(result.affectedPointIds()).isEmpty();
    assertThat(open.getStatus()).isEqualTo(PointStatus.CLOSED);
    assertThat(ongoing.getStatus()).isEqualTo(PointStatus.CLOSED);
  }

  @Test
  void reopen_scheduledMeeting_isInvalid() {
    var meeting = meeting("Still open");
    when(meetingRepository.findByIdForUpdate(meeting.getId())).thenReturn(Optional.of(meeting));
    givenCloseAllowed();

    assertThatThrownBy(() -> service.reopenMeeting(meeting.getId()))
        .isInstanceOf(InvalidStateException.class);
    verify(auditService, never()).log(any());
  }

  @Test
  void completeOccurrence_usesSeriesProjectForPermission() {
    var series = series("Weekly");
    var occurrence = new MeetingOccurrence(series.getId(), LocalDate.now());
    ReflectionTestUtils.setField(occurrence, "id", UUID.randomUUID());
    when(occurrenceRepository.findByIdForUpdate(occurrence.getId()))
        .thenReturn(Optional.of(occurrence));
    when(seriesRepository.findById(series.getId())).thenReturn(Optional.of(series));
    givenCloseAllowed();

    var result = service.completeOccurrence(occurrence.getId());

    assertThat(occurrence.getStatus()).isEqualTo(OccurrenceStatus.COMPLETED);
    assertThat(result.status()).isEqualTo("COMPLETED");
    assertThat(captureAudit().eventType()).isEqualTo("meeting_occurrence.completed");
    verifyNoInteractions(pointRepository, statusUpdateRepository);
  }

  @Test
  void completeOccurrence_cancelled_isInvalid() {
    var series = series("Weekly");
    var occurrence = new MeetingOccurrence(series.getId(), LocalDate.now());
    occurrence.cancel();
    ReflectionTestUtils.setField(occurrence, "id", UUID.randomUUID());
    when(occurrenceRepository.findByIdForUpdate(occurrence.getId()))
        .thenReturn(Optional.of(occurrence));
    when(seriesRepository.findById(series.getId())).thenReturn(Optional.of(series));
    givenCloseAllowed();

    assertThatThrownBy(() -> service.completeOccurrence(occurrence.getId()))
        .isInstanceOf(InvalidStateException.class);
    verify(occurrenceRepository, never()).save(any());
  }

  // --- Helpers ---

  private Meeting meeting(String title) {
    var meeting = new Meeting(PROJECT_ID, title, LocalDate.now());
    ReflectionTestUtils.setField(meeting, "id", UUID.randomUUID());
    return meeting;
  }

  private MeetingSeries series(String title) {
    var series = new MeetingSeries(PROJECT_ID, title, "weekly");
    ReflectionTestUtils.setField(series, "id", UUID.randomUUID());
    return series;
  }

  private static Point meetingPoint(Meeting meeting, PointStatus status) {
    var point = Point.inMeeting(meeting.getId(), "Point " + status, status);
    ReflectionTestUtils.setField(point, "id", UUID.randomUUID());
    return point;
  }

  private void givenLockedMeeting(Meeting meeting, List<Point> unresolved) {
    when(meetingRepository.findByIdForUpdate(meeting.getId())).thenReturn(Optional.of(meeting));
    when(pointRepository.findByMeetingIdAndStatusInOrderByCreatedAtAsc(
            meeting.getId(), PointStatus.UNRESOLVED))
        .thenReturn(unresolved);
  }

  private void givenCloseAllowed() {
    when(permissionGuard.requireProjectPermission(PermissionAction.CLOSE_MEETINGS, PROJECT_ID))
        .thenReturn(manager);
  }

  @SuppressWarnings("unchecked")
  private List<StatusUpdate> captureStatusUpdates() {
    ArgumentCaptor<List<StatusUpdate>> captor = ArgumentCaptor.forClass(List.class);
    verify(statusUpdateRepository).saveAll(captor.capture());
    return captor.getValue();
  }

  private AuditEventRecord captureAudit() {
    var captor = ArgumentCaptor.forClass(AuditEventRecord.class);
    verify(auditService).log(captor.capture());
    return captor.getValue();
  }

  private void assertNoWrites() {
    verify(pointRepository, never()).saveAll(anyList());
    verify(statusUpdateRepository, never()).saveAll(anyList());
    verify(meetingRepository, never()).save(any());
    verify(auditService, never()).log(any());
  }
}
