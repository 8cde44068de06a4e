package tech.flowcatalyst.authz.store.panache;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import tech.flowcatalyst.authz.store.RoleAssignmentRepository;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Read-side repository for role assignments.
 * Uses EntityManager directly and delegates writes to {@link RoleAssignmentWriteRepository}.
 */
@ApplicationScoped
public class RoleAssignmentReadRepository implements RoleAssignmentRepository {

    @Inject
    EntityManager em;

    @Inject
    RoleAssignmentWriteRepository writeRepo;

    @Override
    public Set<String> fetchRoleKeys(String principalId, String tenantId) {
        return StoreTransactions.call("Failed to fetch roles for principal " + principalId, () ->
            new LinkedHashSet<>(em.createQuery(
                    "SELECT a.roleKey FROM RoleAssignmentEntity a " +
                    "WHERE a.userId = :userId AND a.workspaceId = :workspaceId", String.class)
                .setParameter("userId", principalId)
                .setParameter("workspaceId", tenantId)
                .getResultList()));
    }

    // Write operations delegate to WriteRepository
    @Override
    public boolean assignRole(String principalId, String tenantId, String roleKey) {
        return writeRepo.insertIfAbsent(principalId, tenantId, roleKey);
    }
}
