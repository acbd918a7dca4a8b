package io.b2mash.meetings.pointtracker.security;

import static io.b2mash.meetings.pointtracker.testutil.TestUsers.jwtFor;
import static org.hamcrest.Matchers.hasItem;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import io.b2mash.meetings.pointtracker.permission.ProjectRole;
import io.b2mash.meetings.pointtracker.permission.Role;
import io.b2mash.meetings.pointtracker.project.ProjectMemberRepository;
import io.b2mash.meetings.pointtracker.project.ProjectRepository;
import io.b2mash.meetings.pointtracker.testutil.TestFixtures;
import io.b2mash.meetings.pointtracker.user.AppUserRepository;
import java.util.UUID;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class SecurityIntegrationTest {

  private static final String MEMBER = "user_sec_member";
  private static final String DEACTIVATED = "user_sec_deactivated";

  @Autowired private MockMvc mockMvc;
  @Autowired private AppUserRepository userRepository;
  @Autowired private ProjectRepository projectRepository;
  @Autowired private ProjectMemberRepository memberRepository;

  private UUID projectId;

  @BeforeAll
  void createUsers() {
    projectId = TestFixtures.createProject(projectRepository, "Security Project").getId();
    var memberId =
        TestFixtures.createUser(userRepository, MEMBER, "Sam Member", Role.VIEWER).getId();
    TestFixtures.addMember(memberRepository, projectId, memberId, ProjectRole.PROJECT_VIEWER);

    var deactivated =
        TestFixtures.createUser(userRepository, DEACTIVATED, "Dee Activated", Role.BIM_MANAGER);
    deactivated.deactivate();
    userRepository.save(deactivated);
  }

  @Test
  void requestWithoutToken_returns401() throws Exception {
    mockMvc.perform(get("/api/me/permissions")).andExpect(status().isUnauthorized());
  }

  @Test
  void unknownSubject_returns401() throws Exception {
    mockMvc
        .perform(get("/api/me/permissions").with(jwtFor("user_sec_unknown")))
        .andExpect(status().isUnauthorized());
  }

  @Test
  void deactivatedUser_returns401() throws Exception {
    mockMvc
        .perform(get("/api/projects").with(jwtFor(DEACTIVATED)))
        .andExpect(status().isUnauthorized());
  }

  @Test
  void knownSubject_isResolvedToStoredUser() throws Exception {
    mockMvc
        .perform(get("/api/me/permissions").with(jwtFor(MEMBER)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.roles[0]").value("VIEWER"))
        .andExpect(jsonPath("$.permissions.canCloseMeetings").value(false));

    mockMvc
        .perform(get("/api/projects").with(jwtFor(MEMBER)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[*].id", hasItem(projectId.toString())));
  }

  @Test
  void unmappedPath_isDenied() throws Exception {
    mockMvc
        .perform(get("/internal/anything").with(jwtFor(MEMBER)))
        .andExpect(status().isForbidden());
  }
}
