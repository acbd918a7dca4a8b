package io.b2mash.meetings.pointtracker.permission;

import io.b2mash.meetings.pointtracker.security.RequestScopes;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class MyPermissionsController {

  private final PermissionResolver permissionResolver;

  public MyPermissionsController(PermissionResolver permissionResolver) {
    this.permissionResolver = permissionResolver;
  }

  @GetMapping("/api/me/permissions")
  public ResponseEntity<MyPermissionsResponse> getMyPermissions() {
    var user = RequestScopes.requireCurrentUser();
    return ResponseEntity.ok(
        new MyPermissionsResponse(
            user.id(),
            user.roles().stream().map(Role::name).sorted().toList(),
            permissionResolver.permissionSummary(user)));
  }

  public record MyPermissionsResponse(
      UUID userId, List<String> roles, Map<String, Boolean> permissions) {}
}
