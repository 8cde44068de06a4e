package tech.flowcatalyst.authz.resolve;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.flowcatalyst.authz.catalog.PermissionCatalog;
import tech.flowcatalyst.authz.store.GrantStoreUnavailableException;
import tech.flowcatalyst.authz.store.RoleAssignmentRepository;
import tech.flowcatalyst.authz.store.RoleGrantRepository;

import java.util.Set;

/**
 * Answers "may principal P perform action A, optionally within workspace W".
 *
 * IMPORTANT: This service ONLY evaluates role-based grants. It holds no state of
 * its own; each call is a function of its arguments and the current grant store.
 *
 * Permission format: {service}.{resource}.{action}
 * Example: "docs.document.read"
 *
 * Store failures are never turned into a decision here. They surface as
 * {@link GrantStoreUnavailableException} and the caller chooses the policy.
 */
@ApplicationScoped
public class AuthorizationService {

    private static final Logger LOG = Logger.getLogger(AuthorizationService.class);

    private final RoleAssignmentRepository roleAssignmentRepository;
    private final RoleGrantRepository roleGrantRepository;
    private final PermissionCatalog catalog;

    @Inject
    public AuthorizationService(RoleAssignmentRepository roleAssignmentRepository,
                                RoleGrantRepository roleGrantRepository,
                                PermissionCatalog catalog) {
        this.roleAssignmentRepository = roleAssignmentRepository;
        this.roleGrantRepository = roleGrantRepository;
        this.catalog = catalog;
    }

    /**
     * Check if a principal may perform an action.
     *
     * Without a workspace only the catalog's global actions are allowed and the
     * grant store is not consulted. Within a workspace a principal with no roles
     * is denied, {@code super_admin} is allowed outright, and otherwise any one
     * role granting the action is enough.
     *
     * @param principalId The principal ID
     * @param tenantId The workspace ID, or null for platform-level actions
     * @param actionKey The permission key to check
     * @return true if the action is allowed
     * @throws GrantStoreUnavailableException if the grant store cannot be queried
     */
    public boolean checkPermission(String principalId, String tenantId, String actionKey) {
        if (tenantId == null) {
            boolean allowed = catalog.isGlobalAction(actionKey);
            LOG.debugf("Global check principal=%s action=%s allowed=%s", principalId, actionKey, allowed);
            return allowed;
        }

        Set<String> roleKeys = roleAssignmentRepository.fetchRoleKeys(principalId, tenantId);
        if (roleKeys.isEmpty()) {
            LOG.debugf("Principal %s has no roles in workspace %s", principalId, tenantId);
            return false;
        }

        // Bypass, not a regular grant: super_admin links are never read
        if (roleKeys.contains(Roles.SUPER_ADMIN)) {
            return true;
        }

        boolean allowed = roleGrantRepository.roleSetGrants(roleKeys, actionKey);
        LOG.debugf("Workspace check principal=%s workspace=%s action=%s roles=%s allowed=%s",
            principalId, tenantId, actionKey, roleKeys, allowed);
        return allowed;
    }
}
