package tech.portfoliosync.sdk.dto;

/**
 * Mapping between an OIDC group and a team.
 */
public record MappedOidcGroup(
    String uuid,
    OidcGroup group
) {}
