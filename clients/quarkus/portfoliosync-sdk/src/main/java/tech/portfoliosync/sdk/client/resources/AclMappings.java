package tech.portfoliosync.sdk.client.resources;

import com.fasterxml.jackson.core.type.TypeReference;
import tech.portfoliosync.sdk.client.DependencyTrackClient;
import tech.portfoliosync.sdk.dto.ListResult;
import tech.portfoliosync.sdk.dto.Project;

import java.util.List;

/**
 * Resource for portfolio access control entries between teams and projects.
 */
public class AclMappings {

    private static final String PATH = "/api/v1/acl";

    private final DependencyTrackClient client;

    public AclMappings(DependencyTrackClient client) {
        this.client = client;
    }

    /**
     * List the projects a team currently has access to.
     */
    public ListResult<Project> listProjects(String teamUuid) {
        List<Project> projects = client.request("GET", PATH + "/team/" + teamUuid, null,
            new TypeReference<List<Project>>() {});
        return ListResult.of(projects);
    }

    /**
     * Grant a team access to a project. Returns {@code true} on {@code 200 OK}.
     */
    public boolean create(String teamUuid, String projectUuid) {
        return client.mutate("PUT", PATH + "/mapping", new AclMappingRequest(teamUuid, projectUuid), 200);
    }

    /**
     * Revoke a team's access to a project. Returns {@code true} on {@code 200 OK}.
     */
    public boolean delete(String teamUuid, String projectUuid) {
        return client.mutate("DELETE", PATH + "/mapping/team/" + teamUuid + "/project/" + projectUuid, null, 200);
    }

    public record AclMappingRequest(String team, String project) {}
}
