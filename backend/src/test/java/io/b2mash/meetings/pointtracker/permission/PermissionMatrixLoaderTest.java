package io.b2mash.meetings.pointtracker.permission;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

import io.b2mash.meetings.pointtracker.config.PermissionProperties;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.LockSupport;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class PermissionMatrixLoaderTest {

  @Mock private RolePermissionService rolePermissionService;

  private final EffectivePermissionMatrix matrix = new EffectivePermissionMatrix();
  private final PermissionResolver resolver = new PermissionResolver(matrix);

  @Test
  void loadOnStartup_appliesStoredOverrides() {
    when(rolePermissionService.loadOverrides())
        .thenReturn(
            List.of(new PermissionOverride(Role.VIEWER, PermissionAction.CREATE_COMMENTS, true)));
    var loader = loader(false);

    loader.loadOnStartup();

    assertThat(matrix.resolve(PermissionAction.CREATE_COMMENTS)).contains(Role.VIEWER);
  }

  @Test
  void loadOnStartup_failure_keepsDefaults() {
    when(rolePermissionService.loadOverrides())
        .thenThrow(new DataAccessResourceFailureException("database unavailable"));
    var loader = loader(false);

    loader.loadOnStartup();

    assertThat(matrix.current()).isEqualTo(PermissionMatrix.defaults());
  }

  @Test
  void loadOnStartup_failure_abortsWhenConfigured() {
    when(rolePermissionService.loadOverrides())
        .thenThrow(new DataAccessResourceFailureException("database unavailable"));
    var loader = loader(true);

    assertThatThrownBy(loader::loadOnStartup)
        .isInstanceOf(IllegalStateException.class)
        .hasCauseInstanceOf(DataAccessResourceFailureException.class);
  }

  @Test
  void onRolePermissionsChanged_republishesMatrix() {
    var revoke =
        new PermissionOverride(Role.BIM_PROJECT_MANAGER, PermissionAction.CLOSE_MEETINGS, false);
    when(rolePermissionService.loadOverrides()).thenReturn(List.of(revoke));
    var loader = loader(false);

    loader.onRolePermissionsChanged(new RolePermissionsChangedEvent(List.of(revoke)));

    assertThat(matrix.resolve(PermissionAction.CLOSE_MEETINGS)).containsExactly(Role.BIM_MANAGER);
  }

  @Test
  void onRolePermissionsChanged_usesCommittedTable_notTheEventsEntries() {
    var viewerCreatesPoints =
        new PermissionOverride(Role.VIEWER, PermissionAction.CREATE_POINTS, true);
    var engineerCreatesMeetings =
        new PermissionOverride(Role.ENGINEER, PermissionAction.CREATE_MEETINGS, true);
    var stored = List.of(viewerCreatesPoints, engineerCreatesMeetings);
    when(rolePermissionService.loadOverrides()).thenReturn(stored);
    var loader = loader(false);

    loader.onRolePermissionsChanged(new RolePermissionsChangedEvent(List.of(viewerCreatesPoints)));

    assertThat(matrix.current()).isEqualTo(PermissionMatrix.fromDefaults(stored));
    assertThat(matrix.resolve(PermissionAction.CREATE_MEETINGS)).contains(Role.ENGINEER);
  }

  @Test
  void concurrentReloads_lastReadWins() throws Exception {
    var older = List.of(new PermissionOverride(Role.VIEWER, PermissionAction.CREATE_POINTS, true));
    var newer =
        List.of(
            new PermissionOverride(Role.VIEWER, PermissionAction.CREATE_POINTS, true),
            new PermissionOverride(Role.ENGINEER, PermissionAction.CREATE_MEETINGS, true));
    var reads = new AtomicInteger();
    var firstReadStarted = new CountDownLatch(1);
    var releaseFirstRead = new CountDownLatch(1);
    when(rolePermissionService.loadOverrides())
        .thenAnswer(
            invocation -> {
              if (reads.getAndIncrement() == 0) {
                firstReadStarted.countDown();
                releaseFirstRead.await(10, TimeUnit.SECONDS);
                return older;
              }
              return newer;
            });
    var loader = loader(false);
    var event = new RolePermissionsChangedEvent(List.of());

    var executor = Executors.newFixedThreadPool(2);
    try {
      var slow = executor.submit(() -> loader.onRolePermissionsChanged(event));
      assertThat(firstReadStarted.await(10, TimeUnit.SECONDS)).isTrue();
      var fast = executor.submit(() -> loader.onRolePermissionsChanged(event));
      // the second reload must not overtake the first one's swap
      LockSupport.parkNanos(TimeUnit.MILLISECONDS.toNanos(200));
      releaseFirstRead.countDown();
      slow.get(10, TimeUnit.SECONDS);
      fast.get(10, TimeUnit.SECONDS);
    } finally {
      executor.shutdownNow();
    }

    assertThat(reads.get()).isEqualTo(2);
    assertThat(matrix.current()).isEqualTo(PermissionMatrix.fromDefaults(newer));
  }

  private PermissionMatrixLoader loader(boolean failOnLoadError) {
    return new PermissionMatrixLoader(
        rolePermissionService, resolver, new PermissionProperties(failOnLoadError));
  }
}
