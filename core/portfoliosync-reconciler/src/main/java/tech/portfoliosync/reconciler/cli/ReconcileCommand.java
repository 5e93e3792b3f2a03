package tech.portfoliosync.reconciler.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.quarkus.picocli.runtime.annotations.TopCommand;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;
import tech.portfoliosync.reconciler.ReconciliationDriver;
import tech.portfoliosync.reconciler.model.DesiredState;
import tech.portfoliosync.reconciler.model.DesiredStateLoader;
import tech.portfoliosync.reconciler.model.InvalidDesiredStateException;
import tech.portfoliosync.reconciler.model.ReconciliationResult;
import tech.portfoliosync.sdk.client.DependencyTrackClient;
import tech.portfoliosync.sdk.client.DependencyTrackClientFactory;
import tech.portfoliosync.sdk.exception.DependencyTrackException;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

@TopCommand
@Command(name = "portfoliosync", mixinStandardHelpOptions = true, version = "1.0",
    description = "Reconciles Dependency-Track OIDC groups, teams, projects and portfolio ACLs against a desired-state document")
public class ReconcileCommand implements Callable<Integer> {

    private static final Logger LOG = Logger.getLogger(ReconcileCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;

    @Inject
    DesiredStateLoader loader;

    @Inject
    DependencyTrackClientFactory clientFactory;

    @Inject
    ReconciliationDriver driver;

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", paramLabel = "DOCUMENT",
        description = "Desired-state document (YAML or JSON)")
    Path document;

    @Option(names = {"-u", "--url"},
        description = "Dependency-Track URL, overrides the document")
    String url;

    @Option(names = {"-k", "--api-key"},
        description = "API key, overrides the document")
    String apiKey;

    @Option(names = {"--check"}, defaultValue = "false",
        description = "Validate the document and report no change without contacting the server")
    boolean check;

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Override
    public Integer call() {
        DesiredState desired;
        try {
            desired = loader.load(document);
        } catch (InvalidDesiredStateException e) {
            LOG.error(e.getMessage());
            return EXIT_FAILED;
        }

        if (check) {
            LOG.infof("Check mode: %s is valid, nothing applied", document);
            return print(ReconciliationResult.unchanged());
        }

        try {
            DependencyTrackClient client = clientFactory.create(
                url != null ? url : desired.url(),
                apiKey != null ? apiKey : desired.apiKey()
            );
            return print(driver.reconcile(client, desired));
        } catch (IllegalArgumentException e) {
            LOG.error(e.getMessage());
            return EXIT_FAILED;
        } catch (DependencyTrackException e) {
            LOG.errorf(e, "Reconciliation aborted: %s", e.getMessage());
            if (e.hasResponse() && e.getResponseBody() != null) {
                LOG.debugf("Response body of %s %s: %s", e.getMethod(), e.getEndpoint(), e.getResponseBody());
            }
            return EXIT_FAILED;
        }
    }

    private int print(ReconciliationResult result) {
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("changed", result.changed());
        output.put("apiKeys", result.apiKeys());
        try {
            spec.commandLine().getOut().println(objectMapper.writeValueAsString(output));
            spec.commandLine().getOut().flush();
        } catch (JsonProcessingException e) {
            throw new CommandLine.ExecutionException(spec.commandLine(), "Cannot write result", e);
        }
        return EXIT_OK;
    }
}
