package tech.portfoliosync.sdk.dto;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A team with its issued API keys, permissions and OIDC group mappings.
 */
public record Team(
    String uuid,
    String name,
    List<ApiKey> apiKeys,
    List<PermissionRef> permissions,
    List<MappedOidcGroup> mappedOidcGroups
) {
    public Team {
        apiKeys = apiKeys != null ? apiKeys : List.of();
        permissions = permissions != null ? permissions : List.of();
        mappedOidcGroups = mappedOidcGroups != null ? mappedOidcGroups : List.of();
    }

    public Set<String> permissionNames() {
        return permissions.stream()
            .map(PermissionRef::name)
            .filter(Objects::nonNull)
            .collect(Collectors.toSet());
    }

    public List<String> apiKeyValues() {
        return apiKeys.stream()
            .map(ApiKey::displayValue)
            .filter(Objects::nonNull)
            .toList();
    }
}
