package tech.flowcatalyst.authz.catalog;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Definition of a role: a named bundle of permission keys.
 *
 * Role keys are lowercase with underscores (e.g., "workspace_owner", "read_only").
 * A role may legitimately grant nothing (e.g., "workspace_member").
 */
public record RoleDefinition(String key, String description, Set<String> permissionKeys) {

    private static final Pattern VALID_KEY = Pattern.compile("^[a-z][a-z0-9_]*$");

    public RoleDefinition {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Role key cannot be null or empty");
        }
        if (!VALID_KEY.matcher(key).matches()) {
            throw new IllegalArgumentException(
                "Role key must be lowercase alphanumeric with underscores: " + key);
        }
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("Description cannot be null or empty for role " + key);
        }

        // Empty set is valid - a role can exist without permissions
        permissionKeys = permissionKeys == null
            ? Collections.emptySet()
            : Collections.unmodifiableSet(new LinkedHashSet<>(permissionKeys));

        for (String permissionKey : permissionKeys) {
            if (permissionKey == null) {
                throw new IllegalArgumentException("Role " + key + " contains a null permission key");
            }
        }
    }

    /**
     * Create a role from permission definitions.
     * This is the preferred approach as the compiler checks the permissions exist.
     */
    public static RoleDefinition make(String key, String description, Collection<PermissionDefinition> permissions) {
        Set<String> keys = permissions.stream()
            .map(PermissionDefinition::key)
            .collect(Collectors.toCollection(LinkedHashSet::new));
        return new RoleDefinition(key, description, keys);
    }

    /**
     * Create a role from raw permission keys.
     * Unknown keys are only detected when the role is added to a {@link PermissionCatalog}.
     */
    public static RoleDefinition makeFromKeys(String key, String description, Collection<String> permissionKeys) {
        return new RoleDefinition(key, description, new LinkedHashSet<>(permissionKeys));
    }

    public boolean grants(String permissionKey) {
        return permissionKeys.contains(permissionKey);
    }

    @Override
    public String toString() {
        return key + " (" + permissionKeys.size() + " permissions: " + description + ")";
    }
}
