package tech.portfoliosync.reconciler.converge;

import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;
import tech.portfoliosync.reconciler.model.ResourceState;
import tech.portfoliosync.sdk.client.DependencyTrackClient;
import tech.portfoliosync.sdk.dto.Team;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Creates or deletes teams by name.
 *
 * <p>Observed teams are read once per pass. Two passes running at the same time can both
 * see a team as missing; the loser's create is answered with a non-201 status, which is
 * reported as unchanged.
 */
@ApplicationScoped
public class TeamConverger {

    private static final Logger LOG = Logger.getLogger(TeamConverger.class);

    public boolean converge(DependencyTrackClient client, List<String> teamNames, ResourceState state) {
        if (teamNames.isEmpty()) {
            return false;
        }
        Map<String, String> observed = new HashMap<>();
        for (Team team : client.teams().list().items()) {
            observed.put(team.name(), team.uuid());
        }
        boolean changed = false;

        for (String name : teamNames) {
            if (state == ResourceState.PRESENT) {
                if (observed.containsKey(name)) {
                    continue;
                }
                Optional<Team> created = client.teams().create(name);
                if (created.isPresent()) {
                    LOG.infof("Created team '%s'", name);
                    observed.put(name, created.get().uuid());
                    changed = true;
                }
            } else {
                String uuid = observed.get(name);
                if (uuid == null) {
                    continue;
                }
                if (client.teams().delete(uuid)) {
                    LOG.infof("Deleted team '%s'", name);
                    observed.remove(name);
                    changed = true;
                }
            }
        }
        return changed;
    }
}
