package tech.flowcatalyst.authz.store.panache;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import tech.flowcatalyst.authz.catalog.PermissionDefinition;
import tech.flowcatalyst.authz.catalog.RoleDefinition;
import tech.flowcatalyst.authz.shared.EntityType;
import tech.flowcatalyst.authz.shared.TsidGenerator;
import tech.flowcatalyst.authz.store.CatalogStore;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * PostgreSQL implementation of the catalog reconciliation primitives.
 *
 * <p>All writes are single native statements using {@code ON CONFLICT}, so two
 * instances reconciling at the same time (rolling deploy) converge instead of
 * failing on unique constraints. Each call runs in its own transaction; a
 * reader sees every link either before or after a given insert or delete.
 * Failures, including commit failures, surface as
 * {@link tech.flowcatalyst.authz.store.GrantStoreUnavailableException}.
 */
@ApplicationScoped
public class CatalogWriteRepository implements CatalogStore {

    @Inject
    EntityManager em;

    @Override
    public void upsertPermissions(Collection<PermissionDefinition> permissions) {
        StoreTransactions.run("Failed to upsert permissions", () -> {
            for (PermissionDefinition permission : permissions) {
                em.createNativeQuery(
                        "INSERT INTO authz.permissions (id, key, description, created_at) " +
                        "VALUES (:id, :key, :description, now()) " +
                        "ON CONFLICT (key) DO UPDATE SET description = EXCLUDED.description")
                    .setParameter("id", TsidGenerator.generate(EntityType.PERMISSION))
                    .setParameter("key", permission.key())
                    .setParameter("description", permission.description())
                    .executeUpdate();
            }
        });
    }

    @Override
    public Map<String, String> findPermissionIds(Collection<String> permissionKeys) {
        if (permissionKeys.isEmpty()) {
            return new LinkedHashMap<>();
        }
        return StoreTransactions.call("Failed to load permission ids", () -> {
            List<Object[]> rows = em.createQuery(
                    "SELECT p.permissionKey, p.id FROM PermissionEntity p WHERE p.permissionKey IN :keys",
                    Object[].class)
                .setParameter("keys", permissionKeys)
                .getResultList();
            Map<String, String> idsByKey = new LinkedHashMap<>();
            for (Object[] row : rows) {
                idsByKey.put((String) row[0], (String) row[1]);
            }
            return idsByKey;
        });
    }

    @Override
    public Optional<String> upsertRole(RoleDefinition role) {
        return StoreTransactions.call("Failed to upsert role " + role.key(), () -> {
            @SuppressWarnings("unchecked")
            List<Object> ids = em.createNativeQuery(
                    "INSERT INTO authz.roles (id, key, description, created_at) " +
                    "VALUES (:id, :key, :description, now()) " +
                    "ON CONFLICT (key) DO UPDATE SET description = EXCLUDED.description " +
                    "RETURNING id")
                .setParameter("id", TsidGenerator.generate(EntityType.ROLE))
                .setParameter("key", role.key())
                .setParameter("description", role.description())
                .getResultList();
            return ids.isEmpty() ? Optional.<String>empty() : Optional.ofNullable((String) ids.get(0));
        });
    }

    @Override
    public Optional<String> findRoleId(String roleKey) {
        return StoreTransactions.call("Failed to find role " + roleKey, () -> {
            List<String> results = em.createQuery(
                    "SELECT r.id FROM RoleEntity r WHERE r.roleKey = :key", String.class)
                .setParameter("key", roleKey)
                .getResultList();
            return results.isEmpty() ? Optional.<String>empty() : Optional.of(results.get(0));
        });
    }

    @Override
    public int insertRoleGrants(String roleId, Collection<String> permissionIds) {
        return StoreTransactions.call("Failed to insert grants for role " + roleId, () -> {
            int inserted = 0;
            for (String permissionId : permissionIds) {
                inserted += em.createNativeQuery(
                        "INSERT INTO authz.role_permissions (role_id, permission_id) " +
                        "VALUES (:roleId, :permissionId) " +
                        "ON CONFLICT DO NOTHING")
                    .setParameter("roleId", roleId)
                    .setParameter("permissionId", permissionId)
                    .executeUpdate();
            }
            return inserted;
        });
    }

    @Override
    public Map<String, String> findRoleGrants(String roleId) {
        return StoreTransactions.call("Failed to load grants for role " + roleId, () -> {
            List<Object[]> rows = em.createQuery(
                    "SELECT p.permissionKey, p.id FROM RoleGrantEntity g, PermissionEntity p " +
                    "WHERE g.permissionId = p.id AND g.roleId = :roleId",
                    Object[].class)
                .setParameter("roleId", roleId)
                .getResultList();
            Map<String, String> grants = new LinkedHashMap<>();
            for (Object[] row : rows) {
                grants.put((String) row[0], (String) row[1]);
            }
            return grants;
        });
    }

    @Override
    public boolean deleteRoleGrant(String roleId, String permissionId) {
        return StoreTransactions.call("Failed to delete grant for role " + roleId, () ->
            em.createNativeQuery(
                    "DELETE FROM authz.role_permissions WHERE role_id = :roleId AND permission_id = :permissionId")
                .setParameter("roleId", roleId)
                .setParameter("permissionId", permissionId)
                .executeUpdate() > 0);
    }
}
