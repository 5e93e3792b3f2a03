package tech.portfoliosync.reconciler.model;

import tech.portfoliosync.sdk.enums.Classifier;

/**
 * A project as declared in the desired-state document. {@code parent} names another project.
 */
public record DesiredProject(
    String name,
    String parent,
    Classifier classifier,
    String version
) {
    public DesiredProject {
        classifier = classifier != null ? classifier : Classifier.APPLICATION;
        if (parent != null && parent.isBlank()) {
            parent = null;
        }
    }

    public boolean hasParent() {
        return parent != null;
    }
}
