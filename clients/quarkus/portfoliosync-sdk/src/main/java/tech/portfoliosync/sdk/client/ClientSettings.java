package tech.portfoliosync.sdk.client;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable connection settings for one {@link DependencyTrackClient}.
 *
 * @param baseUrl       server root, without the {@code /api} suffix
 * @param apiKey        credential sent with every request
 * @param apiKeyHeader  header name for the credential
 * @param timeout       per-request timeout
 * @param pageSize      page size for paginated listings
 */
public record ClientSettings(
    String baseUrl,
    String apiKey,
    String apiKeyHeader,
    Duration timeout,
    int pageSize
) {

    public static final String DEFAULT_API_KEY_HEADER = "X-Api-Key";
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
    public static final int DEFAULT_PAGE_SIZE = 100;

    public ClientSettings {
        Objects.requireNonNull(baseUrl, "baseUrl");
        Objects.requireNonNull(apiKey, "apiKey");
        baseUrl = baseUrl.replaceAll("/+$", "");
        if (apiKeyHeader == null || apiKeyHeader.isBlank()) {
            apiKeyHeader = DEFAULT_API_KEY_HEADER;
        }
        if (timeout == null) {
            timeout = DEFAULT_TIMEOUT;
        }
        if (pageSize <= 0) {
            pageSize = DEFAULT_PAGE_SIZE;
        }
    }

    public static ClientSettings of(String baseUrl, String apiKey) {
        return new ClientSettings(baseUrl, apiKey, DEFAULT_API_KEY_HEADER, DEFAULT_TIMEOUT, DEFAULT_PAGE_SIZE);
    }

    /**
     * Value of the credential header; bearer tokens get their scheme prefix.
     */
    public String credentialValue() {
        return "Authorization".equalsIgnoreCase(apiKeyHeader) ? "Bearer " + apiKey : apiKey;
    }

    @Override
    public String toString() {
        return "ClientSettings[baseUrl=" + baseUrl + ", apiKeyHeader=" + apiKeyHeader
            + ", timeout=" + timeout + ", pageSize=" + pageSize + "]";
    }
}
