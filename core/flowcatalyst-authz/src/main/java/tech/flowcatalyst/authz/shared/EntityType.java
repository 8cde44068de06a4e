package tech.flowcatalyst.authz.shared;

/**
 * Entity types with their typed ID prefixes.
 */
public enum EntityType {
    PERMISSION("prm"),
    ROLE("rol");

    private final String prefix;

    EntityType(String prefix) {
        this.prefix = prefix;
    }

    public String prefix() {
        return prefix;
    }
}
