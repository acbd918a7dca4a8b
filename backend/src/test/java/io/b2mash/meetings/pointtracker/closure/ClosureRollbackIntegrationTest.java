package io.b2mash.meetings.pointtracker.closure;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.doThrow;

import io.b2mash.meetings.pointtracker.audit.AuditService;
import io.b2mash.meetings.pointtracker.meeting.ContainerStatus;
import io.b2mash.meetings.pointtracker.meeting.MeetingRepository;
import io.b2mash.meetings.pointtracker.permission.Role;
import io.b2mash.meetings.pointtracker.point.PointRepository;
import io.b2mash.meetings.pointtracker.point.PointStatus;
import io.b2mash.meetings.pointtracker.point.StatusUpdateRepository;
import io.b2mash.meetings.pointtracker.project.ProjectMemberRepository;
import io.b2mash.meetings.pointtracker.project.ProjectRepository;
import io.b2mash.meetings.pointtracker.security.RequestScopes;
import io.b2mash.meetings.pointtracker.testutil.TestFixtures;
import io.b2mash.meetings.pointtracker.user.AppUserRepository;
import io.b2mash.meetings.pointtracker.user.UserContextService;
import java.util.UUID;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

/** A failure while recording the audit entry must undo the whole closure. */
@SpringBootTest(
    properties =
        "spring.datasource.url=jdbc:h2:mem:pointtracker_rollback;MODE=PostgreSQL;"
            + "DATABASE_TO_LOWER=TRUE;DEFAULT_NULL_ORDERING=HIGH;DB_CLOSE_DELAY=-1")
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class ClosureRollbackIntegrationTest {

  @MockitoBean private AuditService auditService;

  @Autowired private AppUserRepository userRepository;
  @Autowired private ProjectRepository projectRepository;
  @Autowired private ProjectMemberRepository memberRepository;
  @Autowired private MeetingRepository meetingRepository;
  @Autowired private PointRepository pointRepository;
  @Autowired private StatusUpdateRepository statusUpdateRepository;
  @Autowired private UserContextService userContextService;
  @Autowired private ClosureService closureService;

  private UUID projectId;
  private UUID managerId;

  @BeforeAll
  void createProjectAndManager() {
    projectId = TestFixtures.createProject(projectRepository, "Rollback Project").getId();
    managerId =
        TestFixtures.createUser(
                userRepository, "user_rb_manager", "Rollback Manager", Role.BIM_PROJECT_MANAGER)
            .getId();
    TestFixtures.addMember(memberRepository, projectId, managerId, null);
  }

  @BeforeEach
  void bindManager() {
    RequestScopes.bind(userContextService.loadCurrentUser(managerId).orElseThrow());
    doThrow(new IllegalStateException("audit store unavailable"))
        .when(auditService)
        .log(argThat(event -> event != null && event.eventType().endsWith(".closed")));
  }

  @AfterEach
  void clearScope() {
    RequestScopes.clear();
  }

  @Test
  void auditFailure_rollsBackForceClose() {
    var meeting = TestFixtures.createMeeting(meetingRepository, projectId, "Rollback close");
    var open =
        TestFixtures.createMeetingPoint(
            pointRepository, meeting.getId(), "Rollback point", PointStatus.OPEN);

    assertThatThrownBy(() -> closureService.closeMeeting(meeting.getId(), CloseCommand.closeAll()))
        .isInstanceOf(IllegalStateException.class)
        .hasMessage("audit store unavailable");

    assertThat(meetingRepository.findById(meeting.getId()).orElseThrow().getStatus())
        .isEqualTo(ContainerStatus.SCHEDULED);
    assertThat(pointRepository.findById(open.getId()).orElseThrow().getStatus())
        .isEqualTo(PointStatus.OPEN);
    assertThat(statusUpdateRepository.countByPointId(open.getId())).isZero();
  }

  @Test
  void auditFailure_rollsBackMove() {
    var source = TestFixtures.createMeeting(meetingRepository, projectId, "Rollback source");
    var target = TestFixtures.createMeeting(meetingRepository, projectId, "Rollback target");
    var open =
        TestFixtures.createMeetingPoint(
            pointRepository, source.getId(), "Rollback move point", PointStatus.ONGOING);

    assertThatThrownBy(
            () ->
                closureService.closeMeeting(
                    source.getId(), CloseCommand.moveToMeeting(target.getId())))
        .isInstanceOf(IllegalStateException.class);

    assertThat(pointRepository.findById(open.getId()).orElseThrow().getMeetingId())
        .isEqualTo(source.getId());
    assertThat(meetingRepository.findById(source.getId()).orElseThrow().isOpen()).isTrue();
    assertThat(statusUpdateRepository.countByPointId(open.getId())).isZero();
  }
}
