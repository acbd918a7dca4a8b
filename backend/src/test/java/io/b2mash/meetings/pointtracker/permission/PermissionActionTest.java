package io.b2mash.meetings.pointtracker.permission;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.meetings.pointtracker.exception.InvalidStateException;
import java.util.Arrays;
import org.junit.jupiter.api.Test;

class PermissionActionTest {

  @Test
  void codes_areUnique() {
    assertThat(Arrays.stream(PermissionAction.values()).map(PermissionAction::code))
        .doesNotHaveDuplicates()
        .hasSize(18);
  }

  @Test
  void fromCode_resolvesKnownCode() {
    assertThat(PermissionAction.fromCode("points:edit:assigned"))
        .isEqualTo(PermissionAction.EDIT_ASSIGNED_POINTS);
  }

  @Test
  void fromCode_rejectsUnknownCode() {
    assertThatThrownBy(() -> PermissionAction.fromCode("meetings:delete"))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void findByCode_toleratesUnknownCode() {
    assertThat(PermissionAction.findByCode("meetings:delete")).isEmpty();
    assertThat(PermissionAction.findByCode(null)).isEmpty();
  }

  @Test
  void role_fromName_isCaseInsensitive() {
    assertThat(Role.fromName("bim_coordinator")).isEqualTo(Role.BIM_COORDINATOR);
    assertThatThrownBy(() -> Role.fromName("SUPERUSER")).isInstanceOf(InvalidStateException.class);
  }

  @Test
  void onlyBimManager_isAdministrator() {
    assertThat(Arrays.stream(Role.values()).filter(Role::isAdministrator))
        .containsExactly(Role.BIM_MANAGER);
  }
}
