package tech.portfoliosync.sdk.dto;

import tech.portfoliosync.sdk.enums.Classifier;

import java.util.List;

/**
 * A project. {@code children} is only populated on single-project reads and,
 * depending on the server version, on root listings.
 */
public record Project(
    String uuid,
    String name,
    String version,
    Classifier classifier,
    ProjectRef parent,
    List<Project> children
) {
    public Project {
        children = children != null ? children : List.of();
    }

    /**
     * Reference to a parent project by uuid.
     */
    public record ProjectRef(String uuid) {}
}
