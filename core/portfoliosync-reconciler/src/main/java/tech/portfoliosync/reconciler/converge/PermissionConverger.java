package tech.portfoliosync.reconciler.converge;

import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;
import tech.portfoliosync.sdk.client.DependencyTrackClient;
import tech.portfoliosync.sdk.dto.Team;
import tech.portfoliosync.sdk.enums.Permission;

import java.util.Collection;
import java.util.Set;

/**
 * Grants desired permissions to a team.
 *
 * <p>Grants are additive: a permission the team holds but the document does not list is
 * left in place.
 */
@ApplicationScoped
public class PermissionConverger {

    private static final Logger LOG = Logger.getLogger(PermissionConverger.class);

    public boolean converge(DependencyTrackClient client, Team team, Collection<Permission> desired) {
        Set<String> held = team.permissionNames();
        boolean changed = false;

        for (Permission permission : Permission.values()) {
            if (!desired.contains(permission) || held.contains(permission.name())) {
                continue;
            }
            if (client.permissions().grantToTeam(permission, team.uuid())) {
                LOG.infof("Granted %s to team '%s'", permission, team.name());
                changed = true;
            }
        }
        return changed;
    }
}
