package tech.portfoliosync.reconciler.model;

import com.fasterxml.jackson.annotation.JsonAlias;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Portfolio access policy of one team: the projects it should see, optionally restricted
 * to descendants of a root project.
 */
public record PortfolioAccessControl(
    Verify verify,
    List<String> projects
) {
    public PortfolioAccessControl {
        verify = verify != null ? verify : Verify.DISABLED;
        projects = projects != null ? Collections.unmodifiableList(new ArrayList<>(projects)) : List.of();
    }

    public static PortfolioAccessControl none() {
        return new PortfolioAccessControl(Verify.DISABLED, List.of());
    }

    /**
     * Root-descent verification. When enabled, only {@code rootProject} and its descendants
     * may be granted.
     */
    public record Verify(
        boolean enabled,
        @JsonAlias("root_project") String rootProject
    ) {
        public static final Verify DISABLED = new Verify(false, "");

        public Verify {
            rootProject = rootProject != null ? rootProject : "";
        }
    }
}
