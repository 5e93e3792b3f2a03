package tech.portfoliosync.sdk.enums;

/**
 * Permissions that can be granted to a team.
 */
public enum Permission {
    ACCESS_MANAGEMENT,
    BOM_UPLOAD,
    POLICY_MANAGEMENT,
    POLICY_VIOLATION_ANALYSIS,
    PORTFOLIO_MANAGEMENT,
    PROJECT_CREATION_UPLOAD,
    SYSTEM_CONFIGURATION,
    VIEW_PORTFOLIO,
    VIEW_VULNERABILITY,
    VULNERABILITY_MANAGEMENT
}
