package tech.flowcatalyst.authz.assignment;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.flowcatalyst.authz.catalog.PermissionCatalog;
import tech.flowcatalyst.authz.store.RoleAssignmentRepository;

/**
 * Assigns roles to principals within a workspace.
 *
 * This is the only writer of role assignments. Assigning a role the principal
 * already holds is a no-op.
 */
@ApplicationScoped
public class RoleAssignmentService {

    private static final Logger LOG = Logger.getLogger(RoleAssignmentService.class);

    private final RoleAssignmentRepository repository;
    private final PermissionCatalog catalog;

    @Inject
    public RoleAssignmentService(RoleAssignmentRepository repository, PermissionCatalog catalog) {
        this.repository = repository;
        this.catalog = catalog;
    }

    /**
     * Assign a role to a principal in a workspace.
     *
     * @param principalId The principal ID
     * @param tenantId The workspace ID
     * @param roleKey A role key defined in the catalog
     * @throws IllegalArgumentException if an argument is blank or the role is unknown
     * @throws tech.flowcatalyst.authz.store.GrantStoreUnavailableException if the store fails
     */
    public void assignRole(String principalId, String tenantId, String roleKey) {
        requireNonBlank(principalId, "principalId");
        requireNonBlank(tenantId, "tenantId");
        requireNonBlank(roleKey, "roleKey");
        if (!catalog.hasRole(roleKey)) {
            throw new IllegalArgumentException("Unknown role: " + roleKey);
        }

        boolean inserted = repository.assignRole(principalId, tenantId, roleKey);
        if (inserted) {
            LOG.infof("Assigned role %s to principal %s in workspace %s", roleKey, principalId, tenantId);
        } else {
            LOG.debugf("Principal %s already holds role %s in workspace %s", principalId, roleKey, tenantId);
        }
    }

    private static void requireNonBlank(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " cannot be null or empty");
        }
    }
}
