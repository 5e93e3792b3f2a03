package tech.portfoliosync.reconciler;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.portfoliosync.reconciler.converge.GroupMappingConverger;
import tech.portfoliosync.reconciler.converge.OidcGroupConverger;
import tech.portfoliosync.reconciler.converge.PermissionConverger;
import tech.portfoliosync.reconciler.converge.ProjectAclConverger;
import tech.portfoliosync.reconciler.converge.ProjectConverger;
import tech.portfoliosync.reconciler.converge.TeamConverger;
import tech.portfoliosync.reconciler.model.DesiredState;
import tech.portfoliosync.reconciler.model.DesiredTeam;
import tech.portfoliosync.reconciler.model.ReconciliationResult;
import tech.portfoliosync.reconciler.model.ResourceState;
import tech.portfoliosync.reconciler.scope.AccessScopeResolver;
import tech.portfoliosync.reconciler.tree.ProjectTree;
import tech.portfoliosync.reconciler.tree.ProjectTreeBuilder;
import tech.portfoliosync.sdk.client.DependencyTrackClient;
import tech.portfoliosync.sdk.dto.Team;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs one reconciliation pass.
 *
 * <p>Present: groups, teams, projects, then for every desired team its group mappings,
 * permissions and portfolio ACL. Absent: groups, teams, projects. Calls are sequential because
 * later steps need ids produced by earlier ones. A failed read aborts the pass with the
 * client's exception; failed writes only leave {@code changed} untouched. The driver keeps no
 * state between passes, so an aborted pass is recovered by running a new one.
 */
@ApplicationScoped
public class ReconciliationDriver {

    private static final Logger LOG = Logger.getLogger(ReconciliationDriver.class);

    private final OidcGroupConverger groupConverger;
    private final TeamConverger teamConverger;
    private final ProjectConverger projectConverger;
    private final PermissionConverger permissionConverger;
    private final GroupMappingConverger mappingConverger;
    private final ProjectAclConverger aclConverger;
    private final ProjectTreeBuilder treeBuilder;
    private final AccessScopeResolver scopeResolver;

    @Inject
    public ReconciliationDriver(OidcGroupConverger groupConverger,
                                TeamConverger teamConverger,
                                ProjectConverger projectConverger,
                                PermissionConverger permissionConverger,
                                GroupMappingConverger mappingConverger,
                                ProjectAclConverger aclConverger,
                                ProjectTreeBuilder treeBuilder,
                                AccessScopeResolver scopeResolver) {
        this.groupConverger = groupConverger;
        this.teamConverger = teamConverger;
        this.projectConverger = projectConverger;
        this.permissionConverger = permissionConverger;
        this.mappingConverger = mappingConverger;
        this.aclConverger = aclConverger;
        this.treeBuilder = treeBuilder;
        this.scopeResolver = scopeResolver;
    }

    /**
     * Driver wired with default components, for use outside a CDI container.
     */
    public static ReconciliationDriver create() {
        return new ReconciliationDriver(
            new OidcGroupConverger(),
            new TeamConverger(),
            new ProjectConverger(),
            new PermissionConverger(),
            new GroupMappingConverger(),
            new ProjectAclConverger(),
            new ProjectTreeBuilder(),
            new AccessScopeResolver()
        );
    }

    public ReconciliationResult reconcile(DependencyTrackClient client, DesiredState desired) {
        LOG.infof("Reconciling %s against %s", desired.state(), client.getSettings().baseUrl());
        ReconciliationResult result = desired.state() == ResourceState.PRESENT
            ? reconcilePresent(client, desired)
            : reconcileAbsent(client, desired);
        LOG.infof("Reconciliation finished, changed=%s", result.changed());
        return result;
    }

    private ReconciliationResult reconcilePresent(DependencyTrackClient client, DesiredState desired) {
        boolean changed = groupConverger.converge(client, desired.oidcGroups(), ResourceState.PRESENT);
        changed |= teamConverger.converge(client, desired.teamNames(), ResourceState.PRESENT);

        ProjectTree tree = treeBuilder.build(client.projects());
        changed |= projectConverger.converge(client, tree, desired.projects(), ResourceState.PRESENT);

        Map<String, Team> observedTeams = new HashMap<>();
        for (Team team : client.teams().list().items()) {
            observedTeams.put(team.name(), team);
        }

        Map<String, List<String>> apiKeys = new LinkedHashMap<>();
        for (DesiredTeam desiredTeam : desired.teams()) {
            Team team = observedTeams.get(desiredTeam.name());
            if (team == null || team.uuid() == null) {
                LOG.warnf("Team '%s' does not exist on the server, skipping its mappings and access control",
                    desiredTeam.name());
                continue;
            }
            apiKeys.put(team.name(), team.apiKeyValues());
            changed |= reconcileTeam(client, tree, team, desiredTeam);
        }

        return new ReconciliationResult(changed, apiKeys);
    }

    private boolean reconcileTeam(DependencyTrackClient client, ProjectTree tree, Team team, DesiredTeam desiredTeam) {
        boolean changed = mappingConverger.converge(client, team, desiredTeam.oidcGroups());
        changed |= permissionConverger.converge(client, team, desiredTeam.permissions());

        // Always attempted; its outcome is not part of the change signal
        client.configProperties().enablePortfolioAccessControl();

        Set<String> allowed = scopeResolver.desiredProjects(tree, desiredTeam.portfolioAccessControl());
        changed |= aclConverger.converge(client, tree, team, allowed);
        return changed;
    }

    private ReconciliationResult reconcileAbsent(DependencyTrackClient client, DesiredState desired) {
        boolean changed = groupConverger.converge(client, desired.oidcGroups(), ResourceState.ABSENT);
        changed |= teamConverger.converge(client, desired.teamNames(), ResourceState.ABSENT);

        if (!desired.projects().isEmpty()) {
            ProjectTree tree = treeBuilder.build(client.projects());
            changed |= projectConverger.converge(client, tree, desired.projects(), ResourceState.ABSENT);
        }
        return new ReconciliationResult(changed, Map.of());
    }
}
