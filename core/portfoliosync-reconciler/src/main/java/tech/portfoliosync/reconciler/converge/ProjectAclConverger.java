package tech.portfoliosync.reconciler.converge;

import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;
import tech.portfoliosync.reconciler.tree.ProjectNode;
import tech.portfoliosync.reconciler.tree.ProjectTree;
import tech.portfoliosync.sdk.client.DependencyTrackClient;
import tech.portfoliosync.sdk.dto.Project;
import tech.portfoliosync.sdk.dto.Team;

import java.util.HashSet;
import java.util.Set;

/**
 * Converges a team's portfolio ACL entries over the whole project forest.
 *
 * <p>Every node is decided on its own: allowed and not granted is granted, not allowed and
 * granted is revoked, anything else is left alone. Access is not inherited, so the walk
 * always continues into the children. A project dropped from the desired set on a later pass
 * is revoked.
 */
@ApplicationScoped
public class ProjectAclConverger {

    private static final Logger LOG = Logger.getLogger(ProjectAclConverger.class);

    public boolean converge(DependencyTrackClient client, ProjectTree tree, Team team, Set<String> allowed) {
        Set<String> granted = new HashSet<>();
        for (Project project : client.aclMappings().listProjects(team.uuid()).items()) {
            granted.add(project.uuid());
        }

        boolean changed = false;
        for (ProjectNode root : tree.roots()) {
            changed |= converge(client, root, team, allowed, granted);
        }
        return changed;
    }

    private boolean converge(DependencyTrackClient client, ProjectNode node, Team team,
                             Set<String> allowed, Set<String> granted) {
        boolean changed = false;
        if (!node.isPlaceholder()) {
            String projectUuid = node.remoteId().orElseThrow();
            boolean wanted = allowed.contains(node.name());
            boolean present = granted.contains(projectUuid);
            if (wanted && !present) {
                if (client.aclMappings().create(team.uuid(), projectUuid)) {
                    LOG.infof("Granted team '%s' access to project '%s'", team.name(), node.name());
                    changed = true;
                }
            } else if (!wanted && present) {
                if (client.aclMappings().delete(team.uuid(), projectUuid)) {
                    LOG.infof("Revoked team '%s' access to project '%s'", team.name(), node.name());
                    changed = true;
                }
            }
        }

        for (ProjectNode child : node.children()) {
            changed |= converge(client, child, team, allowed, granted);
        }
        return changed;
    }
}
