package io.b2mash.meetings.pointtracker.permission;

import io.b2mash.meetings.pointtracker.security.RequestScopes;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/role-permissions")
public class RolePermissionController {

  private final RolePermissionService rolePermissionService;
  private final PermissionGuard permissionGuard;

  public RolePermissionController(
      RolePermissionService rolePermissionService, PermissionGuard permissionGuard) {
    this.rolePermissionService = rolePermissionService;
    this.permissionGuard = permissionGuard;
  }

  /** Static data for the admin screen: actions, categories, default grants and roles. */
  @GetMapping("/config")
  public ResponseEntity<PermissionConfigResponse> getConfig() {
    RequestScopes.requireCurrentUser();
    return ResponseEntity.ok(PermissionConfigResponse.build());
  }

  @GetMapping
  public ResponseEntity<List<OverrideResponse>> listOverrides() {
    permissionGuard.requirePermission(PermissionAction.MANAGE_USERS);
    return ResponseEntity.ok(
        rolePermissionService.listOverrides().stream().map(OverrideResponse::from).toList());
  }

  @PatchMapping
  public ResponseEntity<List<OverrideResponse>> updateOverrides(
      @Valid @RequestBody UpdateOverridesRequest request) {
    permissionGuard.requirePermission(PermissionAction.MANAGE_USERS);
    var commands =
        request.overrides().stream()
            .map(
                o ->
                    new RolePermissionService.OverrideCommand(o.role(), o.action(), o.enabled()))
            .toList();
    return ResponseEntity.ok(
        rolePermissionService.bulkUpsert(commands).stream().map(OverrideResponse::from).toList());
  }

  // --- DTOs ---

  public record OverrideEntry(
      @NotBlank(message = "role is required") String role,
      @NotBlank(message = "action is required") String action,
      @NotNull(message = "enabled is required") Boolean enabled) {}

  public record UpdateOverridesRequest(
      @NotEmpty(message = "overrides must not be empty") List<@Valid OverrideEntry> overrides) {}

  public record OverrideResponse(
      UUID id, String role, String action, boolean enabled, Instant updatedAt) {

    public static OverrideResponse from(RolePermissionOverride override) {
      return new OverrideResponse(
          override.getId(),
          override.getRole(),
          override.getAction(),
          override.isEnabled(),
          override.getUpdatedAt());
    }
  }

  public record ActionInfo(String code, String label, String category) {}

  public record RoleInfo(String name, String displayName, String description) {}

  public record PermissionConfigResponse(
      List<ActionInfo> actions,
      Map<String, String> categories,
      Map<String, List<String>> defaults,
      List<RoleInfo> roles) {

    static PermissionConfigResponse build() {
      var actions =
          Arrays.stream(PermissionAction.values())
              .map(a -> new ActionInfo(a.code(), a.label(), a.category().name()))
              .toList();

      var categories = new LinkedHashMap<String, String>();
      for (PermissionCategory category : PermissionCategory.values()) {
        categories.put(category.name(), category.label());
      }

      var defaults = new LinkedHashMap<String, List<String>>();
      DefaultPermissionMatrix.table()
          .forEach(
              (action, roles) ->
                  defaults.put(action.code(), roles.stream().map(Role::name).toList()));

      var roles =
          Arrays.stream(Role.values())
              .map(r -> new RoleInfo(r.name(), r.displayName(), r.description()))
              .toList();

      return new PermissionConfigResponse(actions, categories, defaults, roles);
    }
  }
}
