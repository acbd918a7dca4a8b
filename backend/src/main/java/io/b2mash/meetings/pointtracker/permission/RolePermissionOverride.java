package io.b2mash.meetings.pointtracker.permission;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/**
 * Stored admin override for one (role, action) pair. Role and action are kept as their wire codes
 * so that rows written by an older release still load.
 */
@Entity
@Table(name = "role_permissions")
public class RolePermissionOverride {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "role", nullable = false, length = 50)
  private String role;

  @Column(name = "action", nullable = false, length = 50)
  private String action;

  @Column(name = "is_enabled", nullable = false)
  private boolean enabled;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected RolePermissionOverride() {}

  public RolePermissionOverride(Role role, PermissionAction action, boolean enabled) {
    this.role = role.name();
    this.action = action.code();
    this.enabled = enabled;
    this.updatedAt = Instant.now();
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
    this.updatedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public String getRole() {
    return role;
  }

  public String getAction() {
    return action;
  }

  public boolean isEnabled() {
    return enabled;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
