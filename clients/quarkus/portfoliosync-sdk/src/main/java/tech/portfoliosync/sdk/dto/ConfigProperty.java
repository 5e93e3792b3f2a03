package tech.portfoliosync.sdk.dto;

/**
 * A server configuration property.
 */
public record ConfigProperty(
    String groupName,
    String propertyName,
    String propertyValue
) {}
