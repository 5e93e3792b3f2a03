package tech.portfoliosync.reconciler.converge;

import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;
import tech.portfoliosync.reconciler.model.DesiredProject;
import tech.portfoliosync.reconciler.model.ResourceState;
import tech.portfoliosync.reconciler.tree.ProjectTree;
import tech.portfoliosync.sdk.client.DependencyTrackClient;
import tech.portfoliosync.sdk.client.resources.Projects.CreateProjectRequest;
import tech.portfoliosync.sdk.dto.Project;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Creates or deletes projects, resolving parents by name against the project tree.
 *
 * <p>Projects are handled in document order. A project whose parent is not known when its
 * turn comes is skipped for the rest of the pass, so a parent must be listed before its
 * children to have both created in one pass. Created projects are attached to {@code tree}
 * right away.
 */
@ApplicationScoped
public class ProjectConverger {

    private static final Logger LOG = Logger.getLogger(ProjectConverger.class);

    public boolean converge(DependencyTrackClient client, ProjectTree tree,
                            List<DesiredProject> projects, ResourceState state) {
        Map<String, String> observed = tree.flatten();
        boolean changed = false;

        for (DesiredProject project : projects) {
            if (state == ResourceState.PRESENT) {
                changed |= create(client, tree, observed, project);
            } else {
                delete(client, observed, project);
            }
        }
        return changed;
    }

    private boolean create(DependencyTrackClient client, ProjectTree tree,
                           Map<String, String> observed, DesiredProject project) {
        if (observed.containsKey(project.name())) {
            return false;
        }
        String parentUuid = null;
        if (project.hasParent()) {
            parentUuid = observed.get(project.parent());
            if (parentUuid == null) {
                LOG.debugf("Parent '%s' of project '%s' does not exist yet, skipping",
                    project.parent(), project.name());
                return false;
            }
        }

        Optional<Project> created = client.projects().create(
            CreateProjectRequest.of(project.name(), project.version(), project.classifier(), parentUuid));
        if (created.isEmpty()) {
            return false;
        }

        String uuid = created.get().uuid();
        tree.attach(project.parent(), project.name(), uuid);
        if (uuid != null) {
            observed.put(project.name(), uuid);
        }
        LOG.infof("Created project '%s'%s", project.name(),
            project.hasParent() ? " under '" + project.parent() + "'" : "");
        return true;
    }

    private void delete(DependencyTrackClient client, Map<String, String> observed, DesiredProject project) {
        String uuid = observed.get(project.name());
        if (uuid == null) {
            return;
        }
        client.projects().delete(uuid);
        LOG.infof("Requested deletion of project '%s'", project.name());
    }
}
