package tech.portfoliosync.sdk.client.resources;

import com.fasterxml.jackson.core.type.TypeReference;
import tech.portfoliosync.sdk.client.DependencyTrackClient;
import tech.portfoliosync.sdk.dto.ListResult;
import tech.portfoliosync.sdk.dto.OidcGroup;

import java.util.List;

/**
 * Resource for managing OpenID Connect groups.
 */
public class OidcGroups {

    private static final String PATH = "/api/v1/oidc/group";

    private final DependencyTrackClient client;

    public OidcGroups(DependencyTrackClient client) {
        this.client = client;
    }

    /**
     * List all OIDC groups.
     */
    public ListResult<OidcGroup> list() {
        List<OidcGroup> groups = client.request("GET", PATH, null, new TypeReference<List<OidcGroup>>() {});
        return ListResult.of(groups);
    }

    /**
     * Create an OIDC group. Returns {@code true} on {@code 201 Created}.
     */
    public boolean create(String name) {
        return client.mutate("PUT", PATH, new CreateGroupRequest(name), 201);
    }

    /**
     * Delete an OIDC group. Returns {@code true} on {@code 200 OK}.
     */
    public boolean delete(String uuid) {
        return client.mutate("DELETE", PATH + "/" + uuid, null, 200);
    }

    public record CreateGroupRequest(String name) {}
}
