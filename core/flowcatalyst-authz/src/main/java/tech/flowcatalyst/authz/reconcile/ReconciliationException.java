package tech.flowcatalyst.authz.reconcile;

/**
 * A reconciliation run could not be completed safely.
 *
 * Raised when a role cannot be resolved after its upsert. The run stops before
 * any grant link of that role is written, so the store never holds a partially
 * applied role.
 */
public class ReconciliationException extends RuntimeException {

    private final String roleKey;

    public ReconciliationException(String roleKey, String message) {
        super(message);
        this.roleKey = roleKey;
    }

    public String roleKey() {
        return roleKey;
    }
}
