package tech.portfoliosync.sdk.client;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jboss.logging.Logger;
import tech.portfoliosync.sdk.client.resources.*;
import tech.portfoliosync.sdk.dto.ListResult;
import tech.portfoliosync.sdk.exception.AuthenticationException;
import tech.portfoliosync.sdk.exception.DependencyTrackException;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;

/**
 * Client for the Dependency-Track REST API.
 *
 * <p>Reads and writes follow different failure rules. A read ({@link #request}) that does not
 * return a 2xx status throws {@link DependencyTrackException}. A write ({@link #mutate}) never
 * throws on status; it reports whether the server answered with the status that signals a
 * change. Transport failures throw in both cases. Nothing is retried.
 *
 * <p>Example usage:
 * <pre>{@code
 * var client = new DependencyTrackClient(ClientSettings.of("https://dtrack.example.com", apiKey));
 *
 * // List teams
 * var teams = client.teams().list();
 *
 * // Create an OIDC group
 * boolean changed = client.oidcGroups().create("developers");
 * }</pre>
 */
public class DependencyTrackClient {

    private static final Logger LOG = Logger.getLogger(DependencyTrackClient.class);

    static final String TOTAL_COUNT_HEADER = "X-Total-Count";

    private final ClientSettings settings;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    private OidcGroups oidcGroups;
    private Teams teams;
    private Projects projects;
    private Permissions permissions;
    private OidcMappings oidcMappings;
    private AclMappings aclMappings;
    private ConfigProperties configProperties;

    public DependencyTrackClient(ClientSettings settings) {
        this.settings = settings;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(settings.timeout())
            .build();
        this.objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(DeserializationFeature.READ_UNKNOWN_ENUM_VALUES_AS_NULL, true);
    }

    /**
     * Get the OIDC Groups resource.
     */
    public OidcGroups oidcGroups() {
        if (oidcGroups == null) {
            oidcGroups = new OidcGroups(this);
        }
        return oidcGroups;
    }

    /**
     * Get the Teams resource.
     */
    public Teams teams() {
        if (teams == null) {
            teams = new Teams(this);
        }
        return teams;
    }

    /**
     * Get the Projects resource.
     */
    public Projects projects() {
        if (projects == null) {
            projects = new Projects(this);
        }
        return projects;
    }

    /**
     * Get the Permissions resource.
     */
    public Permissions permissions() {
        if (permissions == null) {
            permissions = new Permissions(this);
        }
        return permissions;
    }

    /**
     * Get the OIDC group to team Mappings resource.
     */
    public OidcMappings oidcMappings() {
        if (oidcMappings == null) {
            oidcMappings = new OidcMappings(this);
        }
        return oidcMappings;
    }

    /**
     * Get the portfolio ACL Mappings resource.
     */
    public AclMappings aclMappings() {
        if (aclMappings == null) {
            aclMappings = new AclMappings(this);
        }
        return aclMappings;
    }

    /**
     * Get the Config Properties resource.
     */
    public ConfigProperties configProperties() {
        if (configProperties == null) {
            configProperties = new ConfigProperties(this);
        }
        return configProperties;
    }

    /**
     * Make an authenticated read request. Any non-2xx status is fatal.
     */
    public <T> T request(String method, String endpoint, Object body, TypeReference<T> responseType) {
        ApiResponse response = send(method, endpoint, body);
        requireSuccess(method, endpoint, response);

        if (response.body() == null || response.body().isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(response.body(), responseType);
        } catch (IOException e) {
            throw DependencyTrackException.unreadableResponse(method, endpoint, response.status(), e);
        }
    }

    /**
     * Read one page of a paginated listing. The total comes from the {@code X-Total-Count}
     * header, or the page size when the server omits it.
     */
    public <T> ListResult<T> requestPage(String endpoint, int pageNumber, TypeReference<List<T>> itemType) {
        String separator = endpoint.contains("?") ? "&" : "?";
        String pagedEndpoint = endpoint + separator
            + "pageNumber=" + pageNumber + "&pageSize=" + settings.pageSize();

        ApiResponse response = send("GET", pagedEndpoint, null);
        requireSuccess("GET", pagedEndpoint, response);

        List<T> items;
        try {
            items = response.body() == null || response.body().isBlank()
                ? List.of()
                : objectMapper.readValue(response.body(), itemType);
        } catch (IOException e) {
            throw DependencyTrackException.unreadableResponse("GET", pagedEndpoint, response.status(), e);
        }

        return new ListResult<>(items, response.totalCount());
    }

    /**
     * Make an authenticated write request. Returns {@code true} only when the server answers
     * with {@code changedStatus}; every other status is logged and reported as no change.
     */
    public boolean mutate(String method, String endpoint, Object body, int changedStatus) {
        ApiResponse response = send(method, endpoint, body);
        if (response.status() == changedStatus) {
            return true;
        }
        if (response.status() >= 400) {
            LOG.warnf("%s %s returned %d, treating as unchanged: %s",
                method, endpoint, response.status(), response.body());
        } else {
            LOG.debugf("%s %s returned %d, no change", method, endpoint, response.status());
        }
        return false;
    }

    /**
     * Send a request and return the raw status and body without interpreting the status.
     */
    public ApiResponse send(String method, String endpoint, Object body) {
        try {
            HttpRequest.Builder requestBuilder = HttpRequest.newBuilder()
                .uri(URI.create(settings.baseUrl() + endpoint))
                .header(settings.apiKeyHeader(), settings.credentialValue())
                .header("Accept", "application/json")
                .header("Content-Type", "application/json")
                .timeout(settings.timeout());

            if (body != null) {
                String jsonBody = objectMapper.writeValueAsString(body);
                requestBuilder.method(method, HttpRequest.BodyPublishers.ofString(jsonBody));
            } else {
                requestBuilder.method(method, HttpRequest.BodyPublishers.noBody());
            }

            LOG.tracef("%s %s", method, endpoint);
            HttpResponse<String> response = httpClient.send(
                requestBuilder.build(),
                HttpResponse.BodyHandlers.ofString()
            );

            int totalCount = response.headers()
                .firstValue(TOTAL_COUNT_HEADER)
                .map(DependencyTrackClient::parseCount)
                .orElse(-1);

            return new ApiResponse(response.statusCode(), response.body(), totalCount);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw DependencyTrackException.transportFailed(method, endpoint, e);
        } catch (IOException | IllegalArgumentException e) {
            throw DependencyTrackException.transportFailed(method, endpoint, e);
        }
    }

    private void requireSuccess(String method, String endpoint, ApiResponse response) {
        int status = response.status();
        if (status == 401) {
            throw AuthenticationException.unauthorized(method, endpoint);
        }
        if (status == 403) {
            throw AuthenticationException.forbidden(method, endpoint);
        }
        if (status < 200 || status >= 300) {
            throw DependencyTrackException.readFailed(method, endpoint, status, response.body());
        }
    }

    private static int parseCount(String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            LOG.debugf("Ignoring malformed %s header: %s", TOTAL_COUNT_HEADER, value);
            return -1;
        }
    }

    public ClientSettings getSettings() {
        return settings;
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    /**
     * Raw response of a single call.
     *
     * @param totalCount value of {@code X-Total-Count}, or -1 when absent
     */
    public record ApiResponse(int status, String body, int totalCount) {}
}
