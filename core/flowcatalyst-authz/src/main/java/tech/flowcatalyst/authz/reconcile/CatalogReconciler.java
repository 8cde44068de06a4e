package tech.flowcatalyst.authz.reconcile;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.flowcatalyst.authz.catalog.PermissionCatalog;
import tech.flowcatalyst.authz.catalog.RoleDefinition;
import tech.flowcatalyst.authz.store.CatalogStore;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Converges the grant store onto the permission catalog.
 *
 * On each run:
 * 1. Catalog permissions are upserted by key (description only on conflict)
 * 2. Each catalog role is upserted and its id resolved
 * 3. Missing role-permission links are inserted
 * 4. Links to catalog permissions the role should not hold are removed
 *
 * Links to permission keys the catalog does not track are left untouched.
 * Every write is conflict-tolerant, so the run is idempotent and overlapping
 * runs (rolling deploys) converge on the same state without locking.
 */
@ApplicationScoped
public class CatalogReconciler {

    private static final Logger LOG = Logger.getLogger(CatalogReconciler.class);

    private final CatalogStore store;

    @Inject
    public CatalogReconciler(CatalogStore store) {
        this.store = store;
    }

    /**
     * Reconcile the catalog into the grant store.
     *
     * @param catalog the catalog to apply
     * @return counts of what changed
     * @throws ReconciliationException if a role cannot be resolved after upsert
     * @throws tech.flowcatalyst.authz.store.GrantStoreUnavailableException if the store fails
     */
    public ReconciliationResult reconcile(PermissionCatalog catalog) {
        LOG.infof("Reconciling permission catalog: %d permissions, %d roles",
            catalog.permissions().size(), catalog.roles().size());

        store.upsertPermissions(catalog.permissions());

        Map<String, String> permissionIdByKey = store.findPermissionIds(catalog.permissionKeys());

        int inserted = 0;
        int removed = 0;
        for (RoleDefinition role : catalog.roles()) {
            String roleId = resolveRoleId(role);

            Set<String> desiredIds = new LinkedHashSet<>();
            for (String permissionKey : role.permissionKeys()) {
                String permissionId = permissionIdByKey.get(permissionKey);
                if (permissionId == null) {
                    LOG.warnf("Permission %s not found in store for role %s", permissionKey, role.key());
                    continue;
                }
                desiredIds.add(permissionId);
            }

            int roleInserted = desiredIds.isEmpty() ? 0 : store.insertRoleGrants(roleId, desiredIds);
            int roleRemoved = removeDrift(catalog, role, roleId);

            if (roleInserted > 0 || roleRemoved > 0) {
                LOG.infof("Role %s: %d grants inserted, %d drifted grants removed",
                    role.key(), roleInserted, roleRemoved);
            }
            inserted += roleInserted;
            removed += roleRemoved;
        }

        ReconciliationResult result = new ReconciliationResult(
            catalog.permissions().size(), catalog.roles().size(), inserted, removed);
        LOG.infof("Catalog reconciliation complete: %d grants inserted, %d removed",
            result.grantsInserted(), result.grantsRemoved());
        return result;
    }

    /**
     * Upsert the role and resolve its id, re-querying when the upsert reported none.
     */
    private String resolveRoleId(RoleDefinition role) {
        return store.upsertRole(role)
            .or(() -> store.findRoleId(role.key()))
            .orElseThrow(() -> new ReconciliationException(role.key(),
                "Failed to upsert role: " + role.key()));
    }

    /**
     * Remove persisted links of the role to catalog permissions outside its desired set.
     *
     * @return number of links removed
     */
    private int removeDrift(PermissionCatalog catalog, RoleDefinition role, String roleId) {
        int removed = 0;
        for (Map.Entry<String, String> grant : store.findRoleGrants(roleId).entrySet()) {
            String permissionKey = grant.getKey();
            if (!catalog.hasPermission(permissionKey) || role.grants(permissionKey)) {
                continue;
            }
            if (store.deleteRoleGrant(roleId, grant.getValue())) {
                LOG.debugf("Removed drifted grant %s from role %s", permissionKey, role.key());
                removed++;
            }
        }
        return removed;
    }
}
