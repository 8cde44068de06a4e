package tech.flowcatalyst.authz.store.panache;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import tech.flowcatalyst.authz.store.RoleGrantRepository;

import java.util.Set;

/**
 * Read-side repository answering "does any of these roles grant this permission".
 */
@ApplicationScoped
public class RoleGrantReadRepository implements RoleGrantRepository {

    @Inject
    EntityManager em;

    @Override
    public boolean roleSetGrants(Set<String> roleKeys, String actionKey) {
        if (roleKeys == null || roleKeys.isEmpty()) {
            return false;
        }
        return StoreTransactions.call("Failed to test grants for " + actionKey, () -> {
            Long count = em.createQuery(
                    "SELECT COUNT(g.roleId) FROM RoleGrantEntity g, RoleEntity r, PermissionEntity p " +
                    "WHERE g.roleId = r.id AND g.permissionId = p.id " +
                    "AND r.roleKey IN :roleKeys AND p.permissionKey = :actionKey", Long.class)
                .setParameter("roleKeys", roleKeys)
                .setParameter("actionKey", actionKey)
                .getSingleResult();
            return count > 0;
        });
    }
}
