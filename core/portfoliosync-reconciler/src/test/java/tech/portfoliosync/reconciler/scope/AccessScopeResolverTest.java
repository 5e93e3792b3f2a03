package tech.portfoliosync.reconciler.scope;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import tech.portfoliosync.reconciler.model.PortfolioAccessControl;
import tech.portfoliosync.reconciler.model.PortfolioAccessControl.Verify;
import tech.portfoliosync.reconciler.tree.ProjectTree;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class AccessScopeResolverTest {

    private ProjectTree tree;
    private AccessScopeResolver resolver;

    @BeforeEach
    void setUp() {
        // A -> (B -> D), C ; E
        tree = new ProjectTree();
        tree.addRoot("A", "a");
        tree.attach("A", "B", "b");
        tree.attach("A", "C", "c");
        tree.attach("B", "D", "d");
        tree.addRoot("E", "e");
        resolver = new AccessScopeResolver();
    }

    @Test
    void shouldAllowDescendantsOfRoot() {
        assertEquals(Set.of("B", "D"), resolver.resolveScope(tree, "A", List.of("B", "D", "X")));
    }

    @Test
    void shouldFailClosedWhenRootIsMissing() {
        assertTrue(resolver.resolveScope(tree, "Z", List.of("A")).isEmpty());
    }

    @Test
    void shouldAllowRootItself() {
        assertEquals(Set.of("A"), resolver.resolveScope(tree, "A", List.of("A")));
    }

    @Test
    void shouldRejectProjectsUnderAnotherRoot() {
        assertEquals(Set.of("C"), resolver.resolveScope(tree, "A", List.of("E", "C")));
    }

    @Test
    void shouldRejectAncestorsOfNestedRoot() {
        assertEquals(Set.of("D"), resolver.resolveScope(tree, "B", List.of("A", "C", "D")));
    }

    @Test
    void shouldKeepRequestOrderWithoutDuplicates() {
        assertEquals(List.of("D", "B"), List.copyOf(resolver.resolveScope(tree, "A", List.of("D", "B", "D"))));
    }

    @Test
    void disabledVerificationShouldKeepAllProjects() {
        var policy = new PortfolioAccessControl(Verify.DISABLED, List.of("E", "X"));

        assertEquals(Set.of("E", "X"), resolver.desiredProjects(tree, policy));
    }

    @Test
    void enabledVerificationShouldFilterProjects() {
        var policy = new PortfolioAccessControl(new Verify(true, "B"), List.of("D", "C"));

        assertEquals(Set.of("D"), resolver.desiredProjects(tree, policy));
    }

    @Test
    void enabledVerificationWithoutRootShouldAllowNothing() {
        var policy = new PortfolioAccessControl(new Verify(true, null), List.of("A", "B"));

        assertTrue(resolver.desiredProjects(tree, policy).isEmpty());
    }
}
