package tech.portfoliosync.reconciler.tree;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One project in the forest. A node without a remote id is a placeholder for a project
 * that has been referenced by name but not read yet.
 */
public final class ProjectNode {

    private final String name;
    private String remoteId;
    private final Map<String, ProjectNode> children = new LinkedHashMap<>();

    ProjectNode(String name, String remoteId) {
        this.name = Objects.requireNonNull(name, "name");
        this.remoteId = remoteId;
    }

    public String name() {
        return name;
    }

    public Optional<String> remoteId() {
        return Optional.ofNullable(remoteId);
    }

    public boolean isPlaceholder() {
        return remoteId == null;
    }

    public Collection<ProjectNode> children() {
        return Collections.unmodifiableCollection(children.values());
    }

    public Optional<ProjectNode> child(String childName) {
        return Optional.ofNullable(children.get(childName));
    }

    /**
     * Adds a child or, if one with that name exists, fills in its id when it has none.
     * An id already assigned is never replaced.
     *
     * @return the child node
     */
    ProjectNode mergeChild(String childName, String childId) {
        ProjectNode child = children.computeIfAbsent(childName, n -> new ProjectNode(n, childId));
        child.assignIdIfMissing(childId);
        return child;
    }

    void assignIdIfMissing(String id) {
        if (remoteId == null && id != null) {
            remoteId = id;
        }
    }

    @Override
    public String toString() {
        return "ProjectNode[" + name + (remoteId != null ? "@" + remoteId : "") + ", children=" + children.keySet() + "]";
    }
}
