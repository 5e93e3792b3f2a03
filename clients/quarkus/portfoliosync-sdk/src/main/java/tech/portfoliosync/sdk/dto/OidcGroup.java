package tech.portfoliosync.sdk.dto;

/**
 * An OpenID Connect group known to the server.
 */
public record OidcGroup(
    String uuid,
    String name
) {}
