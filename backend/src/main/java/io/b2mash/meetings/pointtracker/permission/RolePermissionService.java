package io.b2mash.meetings.pointtracker.permission;

import io.b2mash.meetings.pointtracker.audit.AuditEventBuilder;
import io.b2mash.meetings.pointtracker.audit.AuditService;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class RolePermissionService {

  private static final Logger log = LoggerFactory.getLogger(RolePermissionService.class);

  /** Entity id used for audit events that concern the override table as a whole. */
  static final UUID MATRIX_ENTITY_ID = new UUID(0L, 0L);

  private final RolePermissionOverrideRepository overrideRepository;
  private final AuditService auditService;
  private final ApplicationEventPublisher eventPublisher;

  public RolePermissionService(
      RolePermissionOverrideRepository overrideRepository,
      AuditService auditService,
      ApplicationEventPublisher eventPublisher) {
    this.overrideRepository = overrideRepository;
    this.auditService = auditService;
    this.eventPublisher = eventPublisher;
  }

  @Transactional(readOnly = true)
  public List<RolePermissionOverride> listOverrides() {
    return overrideRepository.findAllByOrderByRoleAscActionAsc();
  }

  /**
   * Stored overrides as resolver input. Rows whose role or action is no longer known are skipped.
   */
  @Transactional(readOnly = true)
  public List<PermissionOverride> loadOverrides() {
    var result = new ArrayList<PermissionOverride>();
    for (RolePermissionOverride row : overrideRepository.findAllByOrderByRoleAscActionAsc()) {
      toOverride(row).ifPresent(result::add);
    }
    return result;
  }

  /**
   * Upserts {@code overrides}, last write wins per (role, action). Every entry is parsed before the
   * first write, so one unknown role or action leaves the table untouched. The effective matrix is
   * republished once the transaction commits.
   *
   * @return the stored overrides after the write
   */
  @Transactional
  public List<RolePermissionOverride> bulkUpsert(List<OverrideCommand> commands) {
    var latest = new LinkedHashMap<String, PermissionOverride>();
    for (OverrideCommand command : commands) {
      var override =
          new PermissionOverride(
              Role.fromName(command.role()),
              PermissionAction.fromCode(command.action()),
              command.enabled());
      latest.remove(key(override));
      latest.put(key(override), override);
    }

    for (PermissionOverride override : latest.values()) {
      overrideRepository
          .findByRoleAndAction(override.role().name(), override.action().code())
          .ifPresentOrElse(
              existing -> existing.setEnabled(override.enabled()),
              () ->
                  overrideRepository.save(
                      new RolePermissionOverride(
                          override.role(), override.action(), override.enabled())));
    }
    overrideRepository.flush();

    var changes = new ArrayList<Map<String, Object>>();
    for (PermissionOverride override : latest.values()) {
      changes.add(
          Map.of(
              "role", override.role().name(),
              "action", override.action().code(),
              "enabled", override.enabled()));
    }
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("role_permission.updated")
            .entityType("role_permission")
            .entityId(MATRIX_ENTITY_ID)
            .details(Map.of("changes", changes))
            .build());

    eventPublisher.publishEvent(new RolePermissionsChangedEvent(List.copyOf(latest.values())));
    log.info("Upserted {} role permission override(s)", latest.size());
    return overrideRepository.findAllByOrderByRoleAscActionAsc();
  }

  private static String key(PermissionOverride override) {
    return override.role().name() + "|" + override.action().code();
  }

  private static Optional<PermissionOverride> toOverride(RolePermissionOverride row) {
    var action = PermissionAction.findByCode(row.getAction());
    var role = Role.findByName(row.getRole());
    if (action.isEmpty() || role.isEmpty()) {
      log.warn(
          "Skipping stored role permission override with unknown role/action: {}/{}",
          row.getRole(),
          row.getAction());
      return Optional.empty();
    }
    return Optional.of(new PermissionOverride(role.get(), action.get(), row.isEnabled()));
  }

  /** One requested change, as received from the API. */
  public record OverrideCommand(String role, String action, boolean enabled) {}
}
