package tech.portfoliosync.reconciler.support;

import tech.portfoliosync.sdk.client.ClientSettings;
import tech.portfoliosync.sdk.client.DependencyTrackClient;
import tech.portfoliosync.sdk.client.resources.AclMappings;
import tech.portfoliosync.sdk.client.resources.ConfigProperties;
import tech.portfoliosync.sdk.client.resources.OidcGroups;
import tech.portfoliosync.sdk.client.resources.OidcMappings;
import tech.portfoliosync.sdk.client.resources.Permissions;
import tech.portfoliosync.sdk.client.resources.Projects;
import tech.portfoliosync.sdk.client.resources.Projects.CreateProjectRequest;
import tech.portfoliosync.sdk.client.resources.Teams;
import tech.portfoliosync.sdk.dto.ApiKey;
import tech.portfoliosync.sdk.dto.ListResult;
import tech.portfoliosync.sdk.dto.MappedOidcGroup;
import tech.portfoliosync.sdk.dto.OidcGroup;
import tech.portfoliosync.sdk.dto.PermissionRef;
import tech.portfoliosync.sdk.dto.Project;
import tech.portfoliosync.sdk.dto.Team;
import tech.portfoliosync.sdk.enums.Permission;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicInteger;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * In-memory Dependency-Track server behind a mocked {@link DependencyTrackClient}.
 *
 * <p>Writes answer the way the real server does: creating something that exists or granting
 * a held permission is not a change. The resource mocks are exposed so tests can verify the
 * calls a converger made.
 */
public class FakeDependencyTrack {

    private final AtomicInteger ids = new AtomicInteger();

    private final Map<String, String> groups = new LinkedHashMap<>();
    private final Map<String, FakeTeam> teams = new LinkedHashMap<>();
    private final Map<String, FakeProject> projects = new LinkedHashMap<>();
    private final Map<String, FakeMapping> oidcMappings = new LinkedHashMap<>();
    private final Set<String> aclEntries = new LinkedHashSet<>();
    private boolean aclEnabled;

    public final DependencyTrackClient client = mock(DependencyTrackClient.class);
    public final OidcGroups oidcGroupsResource = mock(OidcGroups.class);
    public final Teams teamsResource = mock(Teams.class);
    public final Projects projectsResource = mock(Projects.class);
    public final Permissions permissionsResource = mock(Permissions.class);
    public final OidcMappings oidcMappingsResource = mock(OidcMappings.class);
    public final AclMappings aclMappingsResource = mock(AclMappings.class);
    public final ConfigProperties configPropertiesResource = mock(ConfigProperties.class);

    public FakeDependencyTrack() {
        when(client.getSettings()).thenReturn(ClientSettings.of("http://dtrack.test", "test-key"));
        when(client.oidcGroups()).thenReturn(oidcGroupsResource);
        when(client.teams()).thenReturn(teamsResource);
        when(client.projects()).thenReturn(projectsResource);
        when(client.permissions()).thenReturn(permissionsResource);
        when(client.oidcMappings()).thenReturn(oidcMappingsResource);
        when(client.aclMappings()).thenReturn(aclMappingsResource);
        when(client.configProperties()).thenReturn(configPropertiesResource);

        stubGroups();
        stubTeams();
        stubProjects();
        stubAccess();
    }

    // Seeding

    public String addGroup(String name) {
        String uuid = nextId("g");
        groups.put(name, uuid);
        return uuid;
    }

    public String addTeam(String name, String... apiKeys) {
        String uuid = nextId("t");
        teams.put(uuid, new FakeTeam(uuid, name, new TreeSet<>(), List.of(apiKeys)));
        return uuid;
    }

    public String addProject(String name, String parentUuid) {
        String uuid = nextId("p");
        projects.put(uuid, new FakeProject(uuid, name, parentUuid));
        return uuid;
    }

    public void grantPermission(String teamUuid, Permission permission) {
        teams.get(teamUuid).permissions().add(permission.name());
    }

    public void grantAcl(String teamUuid, String projectUuid) {
        aclEntries.add(teamUuid + "|" + projectUuid);
    }

    public String mapGroup(String groupUuid, String teamUuid) {
        String uuid = nextId("m");
        oidcMappings.put(uuid, new FakeMapping(groupUuid, teamUuid));
        return uuid;
    }

    // Inspection

    public String groupId(String name) {
        return groups.get(name);
    }

    public String teamId(String name) {
        return teams.values().stream()
            .filter(t -> t.name().equals(name))
            .map(FakeTeam::uuid)
            .findFirst()
            .orElse(null);
    }

    public String projectId(String name) {
        return projects.values().stream()
            .filter(p -> p.name().equals(name))
            .map(FakeProject::uuid)
            .findFirst()
            .orElse(null);
    }

    public Team team(String name) {
        return toTeam(teams.get(teamId(name)));
    }

    public Set<String> aclProjectNames(String teamName) {
        String teamUuid = teamId(teamName);
        Set<String> names = new TreeSet<>();
        for (FakeProject project : projects.values()) {
            if (aclEntries.contains(teamUuid + "|" + project.uuid())) {
                names.add(project.name());
            }
        }
        return names;
    }

    public boolean isAclEnabled() {
        return aclEnabled;
    }

    /**
     * Name-based view of the whole server state, for comparing two points in time.
     */
    public Map<String, Object> snapshot() {
        Map<String, Object> state = new TreeMap<>();
        state.put("groups", new TreeSet<>(groups.keySet()));
        Map<String, Object> teamState = new TreeMap<>();
        for (FakeTeam team : teams.values()) {
            teamState.put(team.name(), List.of(
                new TreeSet<>(team.permissions()),
                mappedGroupNames(team.uuid()),
                aclProjectNames(team.name())));
        }
        state.put("teams", teamState);
        Map<String, String> projectState = new TreeMap<>();
        for (FakeProject project : projects.values()) {
            FakeProject parent = project.parentUuid() != null ? projects.get(project.parentUuid()) : null;
            projectState.put(project.name(), parent != null ? parent.name() : "");
        }
        state.put("projects", projectState);
        state.put("aclEnabled", aclEnabled);
        return state;
    }

    public Set<String> mappedGroupNames(String teamUuid) {
        Set<String> names = new TreeSet<>();
        groups.forEach((name, uuid) -> {
            if (isMapped(uuid, teamUuid)) {
                names.add(name);
            }
        });
        return names;
    }

    // Stubs

    private void stubGroups() {
        when(oidcGroupsResource.list()).thenAnswer(inv -> ListResult.of(
            groups.entrySet().stream().map(e -> new OidcGroup(e.getValue(), e.getKey())).toList()));
        when(oidcGroupsResource.create(anyString())).thenAnswer(inv -> {
            String name = inv.getArgument(0);
            if (groups.containsKey(name)) {
                return false;
            }
            addGroup(name);
            return true;
        });
        when(oidcGroupsResource.delete(anyString())).thenAnswer(inv -> {
            String uuid = inv.getArgument(0);
            oidcMappings.values().removeIf(m -> m.groupUuid().equals(uuid));
            return groups.values().remove(uuid);
        });
    }

    private void stubTeams() {
        when(teamsResource.list()).thenAnswer(inv -> ListResult.of(
            teams.values().stream().map(this::toTeam).toList()));
        when(teamsResource.create(anyString())).thenAnswer(inv -> {
            String name = inv.getArgument(0);
            if (teamId(name) != null) {
                return Optional.empty();
            }
            String uuid = addTeam(name, "odt_" + name.toLowerCase());
            return Optional.of(toTeam(teams.get(uuid)));
        });
        when(teamsResource.delete(anyString())).thenAnswer(inv -> teams.remove((String) inv.getArgument(0)) != null);
    }

    private void stubProjects() {
        when(projectsResource.listRoots()).thenAnswer(inv -> ListResult.of(
            projects.values().stream()
                .filter(p -> p.parentUuid() == null)
                .map(p -> new Project(p.uuid(), p.name(), null, null, null, null))
                .toList()));
        when(projectsResource.get(anyString())).thenAnswer(inv -> {
            FakeProject project = projects.get((String) inv.getArgument(0));
            List<Project> children = new ArrayList<>();
            for (FakeProject candidate : projects.values()) {
                if (project.uuid().equals(candidate.parentUuid())) {
                    children.add(new Project(candidate.uuid(), candidate.name(), null, null, null, null));
                }
            }
            return new Project(project.uuid(), project.name(), null, null, null, children);
        });
        when(projectsResource.create(any(CreateProjectRequest.class))).thenAnswer(inv -> {
            CreateProjectRequest request = inv.getArgument(0);
            if (projectId(request.name()) != null) {
                return Optional.empty();
            }
            String parentUuid = request.parent() != null ? request.parent().uuid() : null;
            String uuid = addProject(request.name(), parentUuid);
            return Optional.of(new Project(uuid, request.name(), request.version(), request.classifier(), request.parent(), null));
        });
        when(projectsResource.delete(anyString())).thenAnswer(inv -> {
            projects.remove((String) inv.getArgument(0));
            return false;
        });
    }

    private void stubAccess() {
        when(permissionsResource.grantToTeam(any(Permission.class), anyString())).thenAnswer(inv -> {
            Permission permission = inv.getArgument(0);
            FakeTeam team = teams.get((String) inv.getArgument(1));
            return team != null && team.permissions().add(permission.name());
        });
        when(oidcMappingsResource.create(anyString(), anyString())).thenAnswer(inv -> {
            String groupUuid = inv.getArgument(0);
            String teamUuid = inv.getArgument(1);
            if (isMapped(groupUuid, teamUuid)) {
                return false;
            }
            mapGroup(groupUuid, teamUuid);
            return true;
        });
        when(oidcMappingsResource.delete(anyString())).thenAnswer(inv ->
            oidcMappings.remove((String) inv.getArgument(0)) != null);
        when(aclMappingsResource.listProjects(anyString())).thenAnswer(inv -> {
            String teamUuid = inv.getArgument(0);
            return ListResult.of(projects.values().stream()
                .filter(p -> aclEntries.contains(teamUuid + "|" + p.uuid()))
                .map(p -> new Project(p.uuid(), p.name(), null, null, null, null))
                .toList());
        });
        when(aclMappingsResource.create(anyString(), anyString())).thenAnswer(inv ->
            aclEntries.add(inv.getArgument(0) + "|" + inv.getArgument(1)));
        when(aclMappingsResource.delete(anyString(), anyString())).thenAnswer(inv ->
            aclEntries.remove(inv.getArgument(0) + "|" + inv.getArgument(1)));
        when(configPropertiesResource.enablePortfolioAccessControl()).thenAnswer(inv -> {
            aclEnabled = true;
            return true;
        });
    }

    private Team toTeam(FakeTeam team) {
        return new Team(
            team.uuid(),
            team.name(),
            team.apiKeys().stream().map(k -> new ApiKey(k, null, null)).toList(),
            team.permissions().stream().map(p -> new PermissionRef(p, null)).toList(),
            mappingsOf(team.uuid())
        );
    }

    private List<MappedOidcGroup> mappingsOf(String teamUuid) {
        List<MappedOidcGroup> mapped = new ArrayList<>();
        oidcMappings.forEach((uuid, mapping) -> {
            if (mapping.teamUuid().equals(teamUuid)) {
                groups.forEach((name, groupUuid) -> {
                    if (groupUuid.equals(mapping.groupUuid())) {
                        mapped.add(new MappedOidcGroup(uuid, new OidcGroup(groupUuid, name)));
                    }
                });
            }
        });
        return mapped;
    }

    private boolean isMapped(String groupUuid, String teamUuid) {
        return oidcMappings.values().stream()
            .anyMatch(m -> m.groupUuid().equals(groupUuid) && m.teamUuid().equals(teamUuid));
    }

    private String nextId(String prefix) {
        return prefix + "-" + ids.incrementAndGet();
    }

    private record FakeTeam(String uuid, String name, Set<String> permissions, List<String> apiKeys) {}

    private record FakeProject(String uuid, String name, String parentUuid) {}

    private record FakeMapping(String groupUuid, String teamUuid) {}
}
