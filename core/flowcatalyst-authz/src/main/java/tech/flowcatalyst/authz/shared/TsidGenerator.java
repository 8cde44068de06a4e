package tech.flowcatalyst.authz.shared;

import com.github.f4b6a3.tsid.TsidCreator;

import java.util.Objects;

/**
 * Centralized TSID generation for catalog rows.
 *
 * Format: "{prefix}_{tsid}" (e.g., "rol_0HZXEQ5Y8JY5Z"), 17 characters in total.
 * IDs are time-sortable and safe to generate on several instances at once.
 */
public final class TsidGenerator {

    public static final String SEPARATOR = "_";

    public static String generate(EntityType type) {
        Objects.requireNonNull(type, "EntityType must not be null");
        return type.prefix() + SEPARATOR + TsidCreator.getTsid().toString();
    }

    private TsidGenerator() {
        // Utility class
    }
}
