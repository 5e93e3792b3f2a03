package tech.portfoliosync.reconciler.converge;

import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;
import tech.portfoliosync.reconciler.model.ResourceState;
import tech.portfoliosync.sdk.client.DependencyTrackClient;
import tech.portfoliosync.sdk.dto.OidcGroup;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Creates or deletes OIDC groups by name.
 */
@ApplicationScoped
public class OidcGroupConverger {

    private static final Logger LOG = Logger.getLogger(OidcGroupConverger.class);

    public boolean converge(DependencyTrackClient client, List<String> groupNames, ResourceState state) {
        if (groupNames.isEmpty()) {
            return false;
        }
        Map<String, String> observed = observe(client);
        boolean changed = false;

        for (String name : groupNames) {
            if (state == ResourceState.PRESENT) {
                if (observed.containsKey(name)) {
                    continue;
                }
                if (client.oidcGroups().create(name)) {
                    LOG.infof("Created OIDC group '%s'", name);
                    observed.put(name, null);
                    changed = true;
                }
            } else {
                String uuid = observed.get(name);
                if (uuid == null) {
                    continue;
                }
                if (client.oidcGroups().delete(uuid)) {
                    LOG.infof("Deleted OIDC group '%s'", name);
                    observed.remove(name);
                    changed = true;
                }
            }
        }
        return changed;
    }

    /**
     * Observed groups by name.
     */
    static Map<String, String> observe(DependencyTrackClient client) {
        Map<String, String> byName = new HashMap<>();
        for (OidcGroup group : client.oidcGroups().list().items()) {
            byName.put(group.name(), group.uuid());
        }
        return byName;
    }
}
