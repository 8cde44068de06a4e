package tech.flowcatalyst.authz.store;

import java.util.Set;

/**
 * Repository interface for principal role assignments within a tenant.
 */
public interface RoleAssignmentRepository {

    // Read operations

    /**
     * @return role keys held by the principal in the tenant, empty if none
     * @throws GrantStoreUnavailableException if the store cannot be queried
     */
    Set<String> fetchRoleKeys(String principalId, String tenantId);

    // Write operations

    /**
     * Insert the assignment unless it already exists.
     *
     * @return true if a new assignment was written
     * @throws GrantStoreUnavailableException if the store cannot be written
     */
    boolean assignRole(String principalId, String tenantId, String roleKey);
}
