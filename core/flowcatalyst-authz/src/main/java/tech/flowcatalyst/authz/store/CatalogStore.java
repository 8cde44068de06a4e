package tech.flowcatalyst.authz.store;

import tech.flowcatalyst.authz.catalog.PermissionDefinition;
import tech.flowcatalyst.authz.catalog.RoleDefinition;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/**
 * Persistence primitives used to reconcile the catalog into the grant store.
 *
 * Every write is keyed on natural keys and treats a conflict as a no-op (or a
 * description update), so overlapping callers never produce duplicates.
 * All methods throw {@link GrantStoreUnavailableException} on store failure.
 */
public interface CatalogStore {

    /**
     * Insert each permission by key; existing permissions only get their description updated.
     */
    void upsertPermissions(Collection<PermissionDefinition> permissions);

    /**
     * @return permission key -> permission id for the keys that exist
     */
    Map<String, String> findPermissionIds(Collection<String> permissionKeys);

    /**
     * Insert the role by key, or update its description.
     *
     * @return the role id, or empty when the store did not report one
     */
    Optional<String> upsertRole(RoleDefinition role);

    Optional<String> findRoleId(String roleKey);

    /**
     * Link the role to each permission, ignoring links that already exist.
     *
     * @return number of links actually inserted
     */
    int insertRoleGrants(String roleId, Collection<String> permissionIds);

    /**
     * @return permission key -> permission id for every permission currently linked to the role
     */
    Map<String, String> findRoleGrants(String roleId);

    /**
     * @return true if a link was removed
     */
    boolean deleteRoleGrant(String roleId, String permissionId);
}
