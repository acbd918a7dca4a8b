package io.b2mash.meetings.pointtracker.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the permission matrix.
 *
 * @param failOnLoadError abort startup when stored overrides cannot be loaded, instead of falling
 *     back to the default matrix
 */
@ConfigurationProperties(prefix = "pointtracker.permissions")
public record PermissionProperties(boolean failOnLoadError) {}
