package tech.portfoliosync.reconciler.model;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Set;

/**
 * Reads and validates desired-state documents. YAML is the native format; since YAML is a
 * superset of JSON, JSON documents load through the same mapper.
 */
@ApplicationScoped
public class DesiredStateLoader {

    private static final Logger LOG = Logger.getLogger(DesiredStateLoader.class);

    private final ObjectMapper yamlMapper;

    public DesiredStateLoader() {
        this.yamlMapper = YAMLMapper.builder()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS, true)
            .build();
    }

    public DesiredState load(Path document) {
        if (!Files.isRegularFile(document)) {
            throw new InvalidDesiredStateException("Desired-state document not found: " + document);
        }
        try (InputStream in = Files.newInputStream(document)) {
            return load(in, document.toString());
        } catch (IOException e) {
            throw new InvalidDesiredStateException("Cannot read " + document + ": " + e.getMessage(), e);
        }
    }

    public DesiredState load(InputStream in, String source) {
        DesiredState state;
        try {
            state = yamlMapper.readValue(in, DesiredState.class);
        } catch (IOException e) {
            throw new InvalidDesiredStateException("Invalid desired-state document " + source + ": " + e.getMessage(), e);
        }
        if (state == null) {
            throw new InvalidDesiredStateException("Desired-state document " + source + " is empty");
        }
        validate(state);
        LOG.debugf("Loaded %s: state=%s, %d groups, %d teams, %d projects",
            source, state.state(), state.oidcGroups().size(), state.teams().size(), state.projects().size());
        return state;
    }

    /**
     * Checks what the record types cannot express: required names and unique declarations.
     */
    public void validate(DesiredState state) {
        for (String group : state.oidcGroups()) {
            requireName(group, "oidcGroups entry");
        }

        Set<String> teamNames = new HashSet<>();
        for (DesiredTeam team : state.teams()) {
            if (team == null) {
                throw new InvalidDesiredStateException("Empty teams entry");
            }
            requireName(team.name(), "teams[].name");
            if (!teamNames.add(team.name())) {
                throw new InvalidDesiredStateException("Team '" + team.name() + "' is declared more than once");
            }
            for (String group : team.oidcGroups()) {
                requireName(group, "teams[" + team.name() + "].oidcGroups entry");
            }
            if (team.permissions().contains(null)) {
                throw new InvalidDesiredStateException("Missing or blank teams[" + team.name() + "].permissions entry");
            }
            PortfolioAccessControl pac = team.portfolioAccessControl();
            for (String project : pac.projects()) {
                requireName(project, "teams[" + team.name() + "].portfolioAccessControl.projects entry");
            }
            if (pac.verify().enabled() && pac.verify().rootProject().isBlank()) {
                LOG.warnf("Team '%s' verifies portfolio access without a root project; no project will be granted",
                    team.name());
            }
        }

        Set<String> projectNames = new HashSet<>();
        for (DesiredProject project : state.projects()) {
            if (project == null) {
                throw new InvalidDesiredStateException("Empty projects entry");
            }
            requireName(project.name(), "projects[].name");
            if (!projectNames.add(project.name())) {
                throw new InvalidDesiredStateException("Project '" + project.name() + "' is declared more than once");
            }
            if (project.name().equals(project.parent())) {
                throw new InvalidDesiredStateException("Project '" + project.name() + "' cannot be its own parent");
            }
        }
    }

    private static void requireName(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new InvalidDesiredStateException("Missing or blank " + field);
        }
    }
}
