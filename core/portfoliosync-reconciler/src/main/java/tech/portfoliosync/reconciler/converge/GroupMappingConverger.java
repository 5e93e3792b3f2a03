package tech.portfoliosync.reconciler.converge;

import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;
import tech.portfoliosync.sdk.client.DependencyTrackClient;
import tech.portfoliosync.sdk.dto.MappedOidcGroup;
import tech.portfoliosync.sdk.dto.Team;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;

/**
 * Maps a team to exactly its desired OIDC groups.
 *
 * <p>Only the team's own mappings are considered: a desired group the team is not mapped to
 * gets a mapping request, a mapping the team holds for a group it no longer wants is removed
 * by its mapping uuid. Mappings of other teams are never touched. Desired groups that do not
 * exist on the server are ignored; they are created by {@link OidcGroupConverger}.
 */
@ApplicationScoped
public class GroupMappingConverger {

    private static final Logger LOG = Logger.getLogger(GroupMappingConverger.class);

    public boolean converge(DependencyTrackClient client, Team team, Collection<String> desiredGroups) {
        Map<String, String> mapped = mappingsByGroupName(team);
        Map<String, String> observed = OidcGroupConverger.observe(client);
        boolean changed = false;

        for (String groupName : new LinkedHashSet<>(desiredGroups)) {
            if (mapped.containsKey(groupName)) {
                continue;
            }
            String groupUuid = observed.get(groupName);
            if (groupUuid == null) {
                LOG.debugf("OIDC group '%s' for team '%s' does not exist, not mapped", groupName, team.name());
                continue;
            }
            if (client.oidcMappings().create(groupUuid, team.uuid())) {
                LOG.infof("Mapped OIDC group '%s' to team '%s'", groupName, team.name());
                changed = true;
            }
        }

        for (Map.Entry<String, String> mapping : mapped.entrySet()) {
            if (desiredGroups.contains(mapping.getKey())) {
                continue;
            }
            if (client.oidcMappings().delete(mapping.getValue())) {
                LOG.infof("Removed mapping of OIDC group '%s' from team '%s'", mapping.getKey(), team.name());
                changed = true;
            }
        }
        return changed;
    }

    /**
     * Mapping uuids of the team, keyed by group name.
     */
    private static Map<String, String> mappingsByGroupName(Team team) {
        Map<String, String> mapped = new LinkedHashMap<>();
        for (MappedOidcGroup mapping : team.mappedOidcGroups()) {
            if (mapping.group() == null || mapping.group().name() == null || mapping.uuid() == null) {
                LOG.debugf("Ignoring incomplete OIDC mapping on team '%s'", team.name());
                continue;
            }
            mapped.put(mapping.group().name(), mapping.uuid());
        }
        return mapped;
    }
}
