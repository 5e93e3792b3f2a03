package tech.portfoliosync.sdk.client.resources;

import com.fasterxml.jackson.core.type.TypeReference;
import org.jboss.logging.Logger;
import tech.portfoliosync.sdk.client.DependencyTrackClient;
import tech.portfoliosync.sdk.dto.ListResult;
import tech.portfoliosync.sdk.dto.Project;
import tech.portfoliosync.sdk.enums.Classifier;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resource for managing projects.
 */
public class Projects {

    private static final Logger LOG = Logger.getLogger(Projects.class);
    private static final String PATH = "/api/v1/project";

    private final DependencyTrackClient client;

    public Projects(DependencyTrackClient client) {
        this.client = client;
    }

    /**
     * List all root projects, following pagination until the reported total is reached.
     *
     * <p>Stops early on an empty page, and on a page that adds nothing new, which happens
     * when a server ignores the paging parameters. Projects repeated across pages are kept once.
     */
    public ListResult<Project> listRoots() {
        Map<String, Project> roots = new LinkedHashMap<>();
        int pageNumber = 1;
        int total = 0;
        while (true) {
            ListResult<Project> page = client.requestPage(PATH + "?onlyRoot=true", pageNumber,
                new TypeReference<List<Project>>() {});
            int before = roots.size();
            for (Project project : page.items()) {
                roots.putIfAbsent(project.uuid() != null ? project.uuid() : project.name(), project);
            }
            total = page.total();
            if (page.items().isEmpty() || roots.size() == before || roots.size() >= total) {
                break;
            }
            pageNumber++;
        }
        ListResult<Project> result = new ListResult<>(new ArrayList<>(roots.values()), total);
        if (result.isIncomplete()) {
            LOG.debugf("Root listing reported %d projects but only %d were returned", total, roots.size());
        }
        return result;
    }

    /**
     * Get a project by uuid, including its immediate children.
     */
    public Project get(String uuid) {
        return client.request("GET", PATH + "/" + uuid, null, new TypeReference<Project>() {});
    }

    /**
     * Create a project.
     *
     * @return the created project on {@code 201 Created}, empty for any other status
     */
    public Optional<Project> create(CreateProjectRequest request) {
        var response = client.send("PUT", PATH, request);
        if (response.status() != 201) {
            LOG.warnf("PUT %s for project '%s' returned %d, treating as unchanged: %s",
                PATH, request.name(), response.status(), response.body());
            return Optional.empty();
        }
        try {
            return Optional.of(client.getObjectMapper().readValue(response.body(), Project.class));
        } catch (IOException | IllegalArgumentException e) {
            LOG.warnf("Project '%s' created but response body could not be read: %s", request.name(), e.getMessage());
            return Optional.of(new Project(null, request.name(), request.version(), request.classifier(), request.parent(), null));
        }
    }

    /**
     * Delete a project. The outcome is never reported as a change; deleting a project that
     * still has children is left to the server's own constraints.
     */
    public boolean delete(String uuid) {
        client.mutate("DELETE", PATH + "/" + uuid, null, 204);
        return false;
    }

    public record CreateProjectRequest(
        String name,
        String version,
        Classifier classifier,
        Project.ProjectRef parent
    ) {
        public static CreateProjectRequest of(String name, String version, Classifier classifier, String parentUuid) {
            return new CreateProjectRequest(name, version, classifier,
                parentUuid != null ? new Project.ProjectRef(parentUuid) : null);
        }
    }
}
