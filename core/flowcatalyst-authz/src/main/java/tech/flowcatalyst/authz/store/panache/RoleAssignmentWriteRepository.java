package tech.flowcatalyst.authz.store.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import tech.flowcatalyst.authz.store.entity.RoleAssignmentEntity;

/**
 * Write-side repository for role assignments.
 * Extends PanacheRepositoryBase for access to the managed EntityManager.
 */
@ApplicationScoped
public class RoleAssignmentWriteRepository
        implements PanacheRepositoryBase<RoleAssignmentEntity, RoleAssignmentEntity.Key> {

    /**
     * Insert an assignment, doing nothing if the (user, workspace, role) triple exists.
     *
     * @return true if a row was inserted
     */
    public boolean insertIfAbsent(String userId, String workspaceId, String roleKey) {
        return StoreTransactions.call("Failed to assign role " + roleKey, () -> {
            int inserted = getEntityManager().createNativeQuery(
                    "INSERT INTO authz.user_roles (user_id, workspace_id, role_key) " +
                    "VALUES (:userId, :workspaceId, :roleKey) " +
                    "ON CONFLICT DO NOTHING")
                .setParameter("userId", userId)
                .setParameter("workspaceId", workspaceId)
                .setParameter("roleKey", roleKey)
                .executeUpdate();
            return inserted > 0;
        });
    }
}
