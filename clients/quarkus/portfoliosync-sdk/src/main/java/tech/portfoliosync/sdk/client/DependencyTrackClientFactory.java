package tech.portfoliosync.sdk.client;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.portfoliosync.sdk.config.PortfolioSyncConfig;

import java.time.Duration;

/**
 * Builds a fresh {@link DependencyTrackClient} for each reconciliation pass.
 *
 * <p>Explicit values win over configuration; configuration is the fallback.
 */
@ApplicationScoped
public class DependencyTrackClientFactory {

    private final PortfolioSyncConfig config;

    @Inject
    public DependencyTrackClientFactory(PortfolioSyncConfig config) {
        this.config = config;
    }

    public ClientSettings settings(String baseUrl, String apiKey) {
        String url = firstNonBlank(baseUrl, config.baseUrl().orElse(null));
        String key = firstNonBlank(apiKey, config.apiKey().orElse(null));
        if (url == null) {
            throw new IllegalArgumentException("No Dependency-Track URL given. Set url or portfoliosync.base-url");
        }
        if (key == null) {
            throw new IllegalArgumentException("No API key given. Set apiKey or portfoliosync.api-key");
        }
        return new ClientSettings(
            url,
            key,
            config.apiKeyHeader(),
            Duration.ofSeconds(config.http().timeout()),
            config.http().pageSize()
        );
    }

    public DependencyTrackClient create(String baseUrl, String apiKey) {
        return new DependencyTrackClient(settings(baseUrl, apiKey));
    }

    private static String firstNonBlank(String first, String second) {
        if (first != null && !first.isBlank()) {
            return first;
        }
        if (second != null && !second.isBlank()) {
            return second;
        }
        return null;
    }
}
