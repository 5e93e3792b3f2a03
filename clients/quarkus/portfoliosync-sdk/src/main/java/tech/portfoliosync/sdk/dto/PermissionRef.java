package tech.portfoliosync.sdk.dto;

/**
 * A permission as embedded in a team record.
 */
public record PermissionRef(
    String name,
    String description
) {}
