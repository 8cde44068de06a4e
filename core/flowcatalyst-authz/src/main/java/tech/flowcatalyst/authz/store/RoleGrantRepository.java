package tech.flowcatalyst.authz.store;

import java.util.Set;

/**
 * Repository interface for testing role to permission grants.
 */
public interface RoleGrantRepository {

    /**
     * Test whether any of the given roles is linked to the permission.
     *
     * @param roleKeys role keys to test, never empty
     * @param actionKey permission key
     * @return true if at least one role grants the permission
     * @throws GrantStoreUnavailableException if the store cannot be queried
     */
    boolean roleSetGrants(Set<String> roleKeys, String actionKey);
}
