package io.b2mash.meetings.pointtracker.permission;

import io.b2mash.meetings.pointtracker.config.PermissionProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/** Keeps the effective matrix in step with the stored overrides. */
@Component
@EnableConfigurationProperties(PermissionProperties.class)
public class PermissionMatrixLoader {

  private static final Logger log = LoggerFactory.getLogger(PermissionMatrixLoader.class);

  private final RolePermissionService rolePermissionService;
  private final PermissionResolver permissionResolver;
  private final PermissionProperties properties;

  public PermissionMatrixLoader(
      RolePermissionService rolePermissionService,
      PermissionResolver permissionResolver,
      PermissionProperties properties) {
    this.rolePermissionService = rolePermissionService;
    this.permissionResolver = permissionResolver;
    this.properties = properties;
  }

  /**
   * Loads stored overrides at startup. On failure the defaults stay in force unless {@code
   * pointtracker.permissions.fail-on-load-error} is set.
   */
  @EventListener(ApplicationReadyEvent.class)
  public void loadOnStartup() {
    try {
      refresh();
    } catch (RuntimeException e) {
      if (properties.failOnLoadError()) {
        throw new IllegalStateException("Failed to load role permission overrides", e);
      }
      log.warn("Failed to load role permission overrides, using defaults: {}", e.getMessage());
    }
  }

  /**
   * Reloads after an override write commits. The table is read again in a fresh transaction, since
   * overlapping writers may each have committed changes the other's event never saw.
   */
  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  @Transactional(propagation = Propagation.REQUIRES_NEW, readOnly = true)
  public void onRolePermissionsChanged(RolePermissionsChangedEvent event) {
    log.debug("{} role permission override(s) committed, reloading matrix", event.changes().size());
    refresh();
  }

  /** Reads the stored overrides and swaps in the rebuilt matrix. Reloads never interleave. */
  synchronized void refresh() {
    permissionResolver.updateEffectiveMatrix(rolePermissionService.loadOverrides());
  }
}
