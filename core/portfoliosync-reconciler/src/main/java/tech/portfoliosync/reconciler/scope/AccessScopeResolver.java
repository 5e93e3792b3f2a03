package tech.portfoliosync.reconciler.scope;

import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;
import tech.portfoliosync.reconciler.model.PortfolioAccessControl;
import tech.portfoliosync.reconciler.tree.ProjectNode;
import tech.portfoliosync.reconciler.tree.ProjectTree;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Decides which requested projects a team may be granted under a root-descent policy.
 *
 * <p>A name is allowed if it is the root itself or appears anywhere below the root. When the
 * root is not in the tree nothing is allowed. Names outside the scope are dropped silently.
 */
@ApplicationScoped
public class AccessScopeResolver {

    private static final Logger LOG = Logger.getLogger(AccessScopeResolver.class);

    /**
     * @return the allowed names in request order, without duplicates
     */
    public Set<String> resolveScope(ProjectTree tree, String rootProjectName, Collection<String> requestedNames) {
        Set<String> allowed = new LinkedHashSet<>();
        Optional<ProjectNode> root = tree.find(rootProjectName);
        if (root.isEmpty()) {
            LOG.debugf("Root project '%s' not found, no project is in scope", rootProjectName);
            return allowed;
        }

        for (String requested : requestedNames) {
            if (requested.equals(rootProjectName) || isDescendant(root.get(), requested)) {
                allowed.add(requested);
            } else {
                LOG.debugf("Project '%s' is not below '%s', dropping it", requested, rootProjectName);
            }
        }
        return allowed;
    }

    /**
     * The project set a team should end up with: the policy's projects, filtered by
     * {@link #resolveScope} when verification is enabled.
     */
    public Set<String> desiredProjects(ProjectTree tree, PortfolioAccessControl policy) {
        if (!policy.verify().enabled()) {
            return new LinkedHashSet<>(policy.projects());
        }
        return resolveScope(tree, policy.verify().rootProject(), policy.projects());
    }

    private boolean isDescendant(ProjectNode node, String name) {
        for (ProjectNode child : node.children()) {
            if (child.name().equals(name) || isDescendant(child, name)) {
                return true;
            }
        }
        return false;
    }
}
