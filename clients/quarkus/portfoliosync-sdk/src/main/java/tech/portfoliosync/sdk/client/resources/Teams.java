package tech.portfoliosync.sdk.client.resources;

import com.fasterxml.jackson.core.type.TypeReference;
import org.jboss.logging.Logger;
import tech.portfoliosync.sdk.client.DependencyTrackClient;
import tech.portfoliosync.sdk.dto.ListResult;
import tech.portfoliosync.sdk.dto.Team;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Resource for managing teams.
 */
public class Teams {

    private static final Logger LOG = Logger.getLogger(Teams.class);
    private static final String PATH = "/api/v1/team";

    private final DependencyTrackClient client;

    public Teams(DependencyTrackClient client) {
        this.client = client;
    }

    /**
     * List all teams, including their API keys, permissions and OIDC group mappings.
     */
    public ListResult<Team> list() {
        List<Team> teams = client.request("GET", PATH, null, new TypeReference<List<Team>>() {});
        return ListResult.of(teams);
    }

    /**
     * Create a team.
     *
     * @return the created team on {@code 201 Created}, empty for any other status
     */
    public Optional<Team> create(String name) {
        var response = client.send("PUT", PATH, new CreateTeamRequest(name));
        if (response.status() != 201) {
            LOG.warnf("PUT %s for team '%s' returned %d, treating as unchanged: %s",
                PATH, name, response.status(), response.body());
            return Optional.empty();
        }
        try {
            Team created = client.getObjectMapper().readValue(response.body(), Team.class);
            return Optional.of(created);
        } catch (IOException | IllegalArgumentException e) {
            // 201 without a readable body: the team exists but its uuid is unknown until the next listing
            LOG.warnf("Team '%s' created but response body could not be read: %s", name, e.getMessage());
            return Optional.of(new Team(null, name, null, null, null));
        }
    }

    /**
     * Delete a team. Returns {@code true} on {@code 200 OK}.
     */
    public boolean delete(String uuid) {
        return client.mutate("DELETE", PATH, new DeleteTeamRequest(uuid), 200);
    }

    public record CreateTeamRequest(String name) {}

    public record DeleteTeamRequest(String uuid) {}
}
