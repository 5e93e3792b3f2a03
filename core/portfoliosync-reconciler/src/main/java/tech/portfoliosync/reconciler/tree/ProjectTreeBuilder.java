package tech.portfoliosync.reconciler.tree;

import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;
import tech.portfoliosync.sdk.client.resources.Projects;
import tech.portfoliosync.sdk.dto.Project;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads the complete project forest from the server.
 *
 * <p>Roots come from the paginated root listing, together with any children the listing
 * embeds. Every node that has a remote id is then fetched once to discover its children,
 * depth first, until no unexplored node with an id remains. Placeholders without an id are
 * skipped. Any failed read propagates.
 */
@ApplicationScoped
public class ProjectTreeBuilder {

    private static final Logger LOG = Logger.getLogger(ProjectTreeBuilder.class);

    public ProjectTree build(Projects projects) {
        ProjectTree tree = new ProjectTree();

        for (Project root : projects.listRoots().items()) {
            if (root.name() == null) {
                LOG.debugf("Skipping root project without a name: %s", root.uuid());
                continue;
            }
            ProjectNode node = tree.addRoot(root.name(), root.uuid());
            mergeChildren(node, root.children());
        }

        Set<String> fetched = new HashSet<>();
        for (ProjectNode root : new ArrayList<>(tree.roots())) {
            expand(projects, root, fetched);
        }

        LOG.debugf("Built project tree with %d roots and %d projects", tree.roots().size(), tree.size());
        return tree;
    }

    private void expand(Projects projects, ProjectNode node, Set<String> fetched) {
        if (node.isPlaceholder()) {
            LOG.tracef("Project '%s' has no id yet, not reading it", node.name());
        } else {
            String id = node.remoteId().orElseThrow();
            Project project = fetched.add(id) ? projects.get(id) : null;
            if (project != null) {
                mergeChildren(node, project.children());
            }
        }

        for (ProjectNode child : new ArrayList<>(node.children())) {
            expand(projects, child, fetched);
        }
    }

    private void mergeChildren(ProjectNode node, List<Project> children) {
        for (Project child : children) {
            if (child.name() == null) {
                continue;
            }
            node.mergeChild(child.name(), child.uuid());
        }
    }
}
