package tech.flowcatalyst.authz.reconcile;

/**
 * Summary of a reconciliation run.
 *
 * @param permissions permissions upserted
 * @param roles roles reconciled
 * @param grantsInserted role-permission links created by this run
 * @param grantsRemoved drifted links removed by this run
 */
public record ReconciliationResult(int permissions, int roles, int grantsInserted, int grantsRemoved) {

    public boolean changedGrants() {
        return grantsInserted > 0 || grantsRemoved > 0;
    }
}
