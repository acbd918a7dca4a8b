package io.b2mash.meetings.pointtracker.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for meeting closure.
 *
 * @param systemActor name recorded as {@code action_on} on status updates written by a closure
 */
@ConfigurationProperties(prefix = "pointtracker.closure")
public record ClosureProperties(String systemActor) {

  public static final String DEFAULT_SYSTEM_ACTOR = "System";

  public ClosureProperties {
    if (systemActor == null || systemActor.isBlank()) {
      systemActor = DEFAULT_SYSTEM_ACTOR;
    }
  }
}
