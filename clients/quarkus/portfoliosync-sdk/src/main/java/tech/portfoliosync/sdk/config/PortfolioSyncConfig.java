package tech.portfoliosync.sdk.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.util.Optional;

/**
 * Configuration for the Dependency-Track SDK.
 *
 * <p>Configure in application.properties:
 * <pre>
 * portfoliosync.base-url=https://dependencytrack.example.com
 * portfoliosync.api-key=your_api_key
 * portfoliosync.api-key-header=X-Api-Key
 * </pre>
 *
 * <p>The base URL and API key are fallbacks; a desired-state document or the command line
 * usually supplies both.
 */
@ConfigMapping(prefix = "portfoliosync")
public interface PortfolioSyncConfig {

    /**
     * Base URL of the Dependency-Track API server.
     */
    @WithName("base-url")
    Optional<String> baseUrl();

    /**
     * API key with permission to manage teams, projects and access control.
     */
    @WithName("api-key")
    Optional<String> apiKey();

    /**
     * Header carrying the API key. {@code Authorization} sends it as a bearer token.
     */
    @WithName("api-key-header")
    @WithDefault("X-Api-Key")
    String apiKeyHeader();

    /**
     * HTTP client configuration.
     */
    HttpConfig http();

    interface HttpConfig {
        /**
         * Request timeout in seconds.
         */
        @WithDefault("30")
        int timeout();

        /**
         * Page size used for paginated project listings.
         */
        @WithName("page-size")
        @WithDefault("100")
        int pageSize();
    }
}
