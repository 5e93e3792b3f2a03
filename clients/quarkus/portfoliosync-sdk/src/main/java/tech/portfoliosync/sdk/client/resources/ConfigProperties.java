package tech.portfoliosync.sdk.client.resources;

import tech.portfoliosync.sdk.client.DependencyTrackClient;
import tech.portfoliosync.sdk.dto.ConfigProperty;

import java.util.List;

/**
 * Resource for server configuration properties.
 */
public class ConfigProperties {

    static final String ACCESS_MANAGEMENT_GROUP = "access-management";
    static final String ACL_ENABLED_PROPERTY = "acl.enabled";

    private final DependencyTrackClient client;

    public ConfigProperties(DependencyTrackClient client) {
        this.client = client;
    }

    /**
     * Update several properties in one call. Returns {@code true} on {@code 200 OK}.
     */
    public boolean updateAll(List<ConfigProperty> properties) {
        return client.mutate("POST", "/api/v1/configProperty/aggregate", properties, 200);
    }

    /**
     * Turn on portfolio access control.
     */
    public boolean enablePortfolioAccessControl() {
        return updateAll(List.of(new ConfigProperty(ACCESS_MANAGEMENT_GROUP, ACL_ENABLED_PROPERTY, "true")));
    }
}
