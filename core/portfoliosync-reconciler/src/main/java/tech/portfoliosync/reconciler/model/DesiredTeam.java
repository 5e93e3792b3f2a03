package tech.portfoliosync.reconciler.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import tech.portfoliosync.sdk.enums.Permission;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A team as declared in the desired-state document.
 */
public record DesiredTeam(
    String name,
    @JsonAlias("oidc_groups") List<String> oidcGroups,
    List<Permission> permissions,
    @JsonAlias("portfolio_access_control") PortfolioAccessControl portfolioAccessControl
) {
    public DesiredTeam {
        oidcGroups = oidcGroups != null ? Collections.unmodifiableList(new ArrayList<>(oidcGroups)) : List.of();
        permissions = permissions != null ? Collections.unmodifiableList(new ArrayList<>(permissions)) : List.of();
        portfolioAccessControl = portfolioAccessControl != null ? portfolioAccessControl : PortfolioAccessControl.none();
    }

    public static DesiredTeam named(String name) {
        return new DesiredTeam(name, null, null, null);
    }
}
