package tech.portfoliosync.reconciler.model;

import com.fasterxml.jackson.annotation.JsonAlias;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The complete desired state handed to one reconciliation pass.
 *
 * <p>{@code url} and {@code apiKey} may be left out when the command line or configuration
 * provides them.
 */
public record DesiredState(
    String url,
    @JsonAlias({"api_key", "apikey"}) String apiKey,
    ResourceState state,
    @JsonAlias("oidc_groups") List<String> oidcGroups,
    List<DesiredTeam> teams,
    List<DesiredProject> projects
) {
    public DesiredState {
        state = state != null ? state : ResourceState.PRESENT;
        oidcGroups = oidcGroups != null ? Collections.unmodifiableList(new ArrayList<>(oidcGroups)) : List.of();
        teams = teams != null ? Collections.unmodifiableList(new ArrayList<>(teams)) : List.of();
        projects = projects != null ? Collections.unmodifiableList(new ArrayList<>(projects)) : List.of();
    }

    public List<String> teamNames() {
        return teams.stream().map(DesiredTeam::name).toList();
    }
}
