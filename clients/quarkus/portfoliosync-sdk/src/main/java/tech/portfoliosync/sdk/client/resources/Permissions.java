package tech.portfoliosync.sdk.client.resources;

import tech.portfoliosync.sdk.client.DependencyTrackClient;
import tech.portfoliosync.sdk.enums.Permission;

/**
 * Resource for granting permissions to teams.
 */
public class Permissions {

    private final DependencyTrackClient client;

    public Permissions(DependencyTrackClient client) {
        this.client = client;
    }

    /**
     * Grant a permission to a team. Returns {@code true} on {@code 200 OK}; the server
     * answers {@code 304} when the team already holds it.
     */
    public boolean grantToTeam(Permission permission, String teamUuid) {
        return client.mutate("POST", "/api/v1/permission/" + permission.name() + "/team/" + teamUuid, null, 200);
    }
}
