package tech.portfoliosync.reconciler.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a reconciliation pass.
 *
 * @param changed  whether any call changed the server
 * @param apiKeys  API keys per desired team; empty on the absent path
 */
public record ReconciliationResult(
    boolean changed,
    Map<String, List<String>> apiKeys
) {
    public ReconciliationResult {
        apiKeys = apiKeys != null ? Collections.unmodifiableMap(new LinkedHashMap<>(apiKeys)) : Map.of();
    }

    public static ReconciliationResult unchanged() {
        return new ReconciliationResult(false, Map.of());
    }
}
