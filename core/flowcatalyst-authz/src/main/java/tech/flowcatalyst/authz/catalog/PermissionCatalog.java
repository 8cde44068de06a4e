package tech.flowcatalyst.authz.catalog;

import org.jboss.logging.Logger;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable catalog of every permission and role the system knows about.
 *
 * The catalog is the single authority for what should exist in the grant store.
 * It is built once at process start and validated eagerly: a duplicated key, a
 * role referencing an unknown permission, or a global action that is not a
 * catalog permission all fail with {@link CatalogValidationException}.
 *
 * Global actions are permissions any authenticated principal holds outside of a
 * tenant (e.g. creating a workspace). They are resolved from the catalog alone
 * and never reach the grant store.
 */
public final class PermissionCatalog {

    private static final Logger LOG = Logger.getLogger(PermissionCatalog.class);

    // Permission key -> PermissionDefinition
    private final Map<String, PermissionDefinition> permissions;

    // Role key -> RoleDefinition
    private final Map<String, RoleDefinition> roles;

    private final Set<String> globalActions;

    private PermissionCatalog(Map<String, PermissionDefinition> permissions,
                              Map<String, RoleDefinition> roles,
                              Set<String> globalActions) {
        this.permissions = Collections.unmodifiableMap(permissions);
        this.roles = Collections.unmodifiableMap(roles);
        this.globalActions = Collections.unmodifiableSet(globalActions);
    }

    /**
     * Build and validate a catalog.
     *
     * IMPORTANT: every role permission key and every global action must reference
     * a permission in {@code permissions}.
     *
     * @param permissions all permission definitions
     * @param roles all role definitions
     * @param globalActions permission keys granted to any principal without a tenant
     * @return the validated catalog
     * @throws CatalogValidationException if the catalog is inconsistent
     */
    public static PermissionCatalog of(Collection<PermissionDefinition> permissions,
                                       Collection<RoleDefinition> roles,
                                       Collection<String> globalActions) {
        Map<String, PermissionDefinition> permissionsByKey = new LinkedHashMap<>();
        for (PermissionDefinition permission : permissions) {
            if (permissionsByKey.putIfAbsent(permission.key(), permission) != null) {
                throw new CatalogValidationException("Duplicate permission key: " + permission.key());
            }
        }

        Map<String, RoleDefinition> rolesByKey = new LinkedHashMap<>();
        for (RoleDefinition role : roles) {
            if (rolesByKey.putIfAbsent(role.key(), role) != null) {
                throw new CatalogValidationException("Duplicate role key: " + role.key());
            }
            for (String permissionKey : role.permissionKeys()) {
                if (!permissionsByKey.containsKey(permissionKey)) {
                    throw new CatalogValidationException(
                        "Role " + role.key() + " references unknown permission: " + permissionKey);
                }
            }
        }

        Set<String> globals = new LinkedHashSet<>();
        for (String action : globalActions) {
            if (!permissionsByKey.containsKey(action)) {
                throw new CatalogValidationException("Global action is not a catalog permission: " + action);
            }
            globals.add(action);
        }

        LOG.debugf("Permission catalog built: %d permissions, %d roles, %d global actions",
            permissionsByKey.size(), rolesByKey.size(), globals.size());

        return new PermissionCatalog(permissionsByKey, rolesByKey, globals);
    }

    public Collection<PermissionDefinition> permissions() {
        return permissions.values();
    }

    public Collection<RoleDefinition> roles() {
        return roles.values();
    }

    public Optional<PermissionDefinition> permission(String key) {
        return Optional.ofNullable(permissions.get(key));
    }

    public Optional<RoleDefinition> role(String key) {
        return Optional.ofNullable(roles.get(key));
    }

    public boolean hasPermission(String key) {
        return permissions.containsKey(key);
    }

    public boolean hasRole(String key) {
        return roles.containsKey(key);
    }

    public Set<String> permissionKeys() {
        return permissions.keySet();
    }

    public Set<String> roleKeys() {
        return roles.keySet();
    }

    public Set<String> globalActions() {
        return globalActions;
    }

    public boolean isGlobalAction(String actionKey) {
        return actionKey != null && globalActions.contains(actionKey);
    }

    /**
     * Get the permission keys a role is entitled to.
     *
     * @param roleKey Role key
     * @return Set of permission keys, or empty set if the role is not in the catalog
     */
    public Set<String> permissionKeysForRole(String roleKey) {
        RoleDefinition role = roles.get(roleKey);
        return role != null ? role.permissionKeys() : Collections.emptySet();
    }

    /**
     * Role key -> granted permission keys, in the shape expected by
     * {@link tech.flowcatalyst.authz.resolve.PermissionResolver}.
     */
    public Map<String, Set<String>> grantMap() {
        Map<String, Set<String>> grants = new LinkedHashMap<>();
        for (RoleDefinition role : roles.values()) {
            grants.put(role.key(), role.permissionKeys());
        }
        return Collections.unmodifiableMap(grants);
    }

    @Override
    public String toString() {
        return "PermissionCatalog[" + permissions.size() + " permissions, " + roles.size() + " roles]";
    }
}
