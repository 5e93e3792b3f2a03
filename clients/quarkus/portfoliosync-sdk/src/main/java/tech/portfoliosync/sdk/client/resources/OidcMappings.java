package tech.portfoliosync.sdk.client.resources;

import tech.portfoliosync.sdk.client.DependencyTrackClient;

/**
 * Resource for mapping OIDC groups to teams.
 */
public class OidcMappings {

    private static final String PATH = "/api/v1/oidc/mapping";

    private final DependencyTrackClient client;

    public OidcMappings(DependencyTrackClient client) {
        this.client = client;
    }

    /**
     * Map a group to a team. Returns {@code true} on {@code 200 OK}.
     */
    public boolean create(String groupUuid, String teamUuid) {
        return client.mutate("PUT", PATH, new MappingRequest(groupUuid, teamUuid), 200);
    }

    /**
     * Remove one group to team mapping, addressed by the mapping uuid reported in a team's
     * {@code mappedOidcGroups}. Returns {@code true} on {@code 200 OK}.
     */
    public boolean delete(String mappingUuid) {
        return client.mutate("DELETE", PATH + "/" + mappingUuid, null, 200);
    }

    public record MappingRequest(String group, String team) {}
}
