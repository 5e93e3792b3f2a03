package tech.portfoliosync.reconciler.tree;

import org.jboss.logging.Logger;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * In-memory project forest keyed by project name.
 *
 * <p>Project names are unique across the whole forest, so lookups are by name rather than
 * by path. The tree is acyclic by construction: nodes are only ever added under an existing
 * parent or as new roots.
 */
public class ProjectTree {

    private static final Logger LOG = Logger.getLogger(ProjectTree.class);

    private final Map<String, ProjectNode> roots = new LinkedHashMap<>();

    public Collection<ProjectNode> roots() {
        return Collections.unmodifiableCollection(roots.values());
    }

    /**
     * Adds a root, or fills in the id of an existing root placeholder.
     */
    public ProjectNode addRoot(String name, String remoteId) {
        ProjectNode root = roots.computeIfAbsent(name, n -> new ProjectNode(n, remoteId));
        root.assignIdIfMissing(remoteId);
        return root;
    }

    /**
     * Attaches a project under the named parent, or as a root when {@code parentName} is null.
     *
     * @return the attached node, or empty when the parent is not in the tree
     */
    public Optional<ProjectNode> attach(String parentName, String name, String remoteId) {
        if (parentName == null) {
            return Optional.of(addRoot(name, remoteId));
        }
        return find(parentName).map(parent -> parent.mergeChild(name, remoteId));
    }

    /**
     * Depth-first search for a node by name.
     */
    public Optional<ProjectNode> find(String name) {
        Deque<ProjectNode> stack = new ArrayDeque<>(roots.values());
        while (!stack.isEmpty()) {
            ProjectNode node = stack.pop();
            if (node.name().equals(name)) {
                return Optional.of(node);
            }
            node.children().forEach(stack::push);
        }
        return Optional.empty();
    }

    public boolean contains(String name) {
        return find(name).isPresent();
    }

    /**
     * Visits every node, parents before their children.
     */
    public void walk(Consumer<ProjectNode> visitor) {
        for (ProjectNode root : roots.values()) {
            walk(root, visitor);
        }
    }

    private void walk(ProjectNode node, Consumer<ProjectNode> visitor) {
        visitor.accept(node);
        for (ProjectNode child : node.children()) {
            walk(child, visitor);
        }
    }

    /**
     * Flattens the forest into a name to remote id map. Placeholders are left out.
     * If a name occurs twice, the first one in walk order wins.
     */
    public Map<String, String> flatten() {
        Map<String, String> byName = new LinkedHashMap<>();
        walk(node -> node.remoteId().ifPresent(id -> {
            String previous = byName.putIfAbsent(node.name(), id);
            if (previous != null && !previous.equals(id)) {
                LOG.warnf("Project name '%s' appears twice in the project tree (%s, %s); using %s",
                    node.name(), previous, id, previous);
            }
        }));
        return byName;
    }

    public int size() {
        int[] count = {0};
        walk(node -> count[0]++);
        return count[0];
    }

    @Override
    public String toString() {
        return "ProjectTree[roots=" + roots.keySet() + ", size=" + size() + "]";
    }
}
