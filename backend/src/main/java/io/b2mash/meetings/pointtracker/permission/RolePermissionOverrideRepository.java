package io.b2mash.meetings.pointtracker.permission;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface RolePermissionOverrideRepository
    extends JpaRepository<RolePermissionOverride, UUID> {

  Optional<RolePermissionOverride> findByRoleAndAction(String role, String action);

  List<RolePermissionOverride> findAllByOrderByRoleAscActionAsc();
}
