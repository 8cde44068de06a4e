package tech.flowcatalyst.authz.catalog;

import java.util.regex.Pattern;

/**
 * Definition of a grantable capability.
 *
 * Permission keys follow the structure: {service}.{resource}.{action}
 *
 * Where:
 * - service: Owning service (e.g., "docs", "cms", "accounts")
 * - resource: The resource being accessed, underscores allowed (e.g., "document", "blog_entry")
 * - action: The operation, camelCase allowed (e.g., "read", "listByWorkspace")
 *
 * The key is the identity of a permission and never changes meaning once assigned;
 * only the description may be updated.
 */
public record PermissionDefinition(String key, String description) {

    public static final int MAX_KEY_LENGTH = 128;

    private static final Pattern VALID_KEY = Pattern.compile("^[a-z]+\\.[a-z_]+\\.[a-zA-Z]+$");

    public PermissionDefinition {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Permission key cannot be null or empty");
        }
        if (key.length() > MAX_KEY_LENGTH) {
            throw new IllegalArgumentException(
                "Permission key exceeds " + MAX_KEY_LENGTH + " characters: " + key);
        }
        if (!VALID_KEY.matcher(key).matches()) {
            throw new IllegalArgumentException(
                "Permission key must follow service.resource.action: " + key);
        }
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("Description cannot be null or empty for permission " + key);
        }
    }

    /**
     * Static factory mirroring the constant-style declarations in {@link WorkspacePermissions}.
     */
    public static PermissionDefinition make(String key, String description) {
        return new PermissionDefinition(key, description);
    }

    /**
     * @return true if the given string is a well-formed permission key
     */
    public static boolean isValidKey(String key) {
        return key != null && key.length() <= MAX_KEY_LENGTH && VALID_KEY.matcher(key).matches();
    }

    @Override
    public String toString() {
        return key + " (" + description + ")";
    }
}
