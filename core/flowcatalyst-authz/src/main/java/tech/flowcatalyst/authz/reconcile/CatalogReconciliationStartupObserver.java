package tech.flowcatalyst.authz.reconcile;

import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.flowcatalyst.authz.catalog.PermissionCatalog;
import tech.flowcatalyst.authz.config.AuthzConfig;

/**
 * Startup observer that reconciles the permission catalog on application start.
 *
 * <p>Runs after Flyway migrations have completed. A failed reconciliation is
 * rethrown so the instance does not start serving with a half-applied catalog.
 *
 * <p>Can be disabled via {@code authz.reconcile.on-startup}.
 */
@ApplicationScoped
public class CatalogReconciliationStartupObserver {

    private static final Logger LOG = Logger.getLogger(CatalogReconciliationStartupObserver.class);

    @Inject
    CatalogReconciler reconciler;

    @Inject
    PermissionCatalog catalog;

    @Inject
    AuthzConfig config;

    void onStart(@Observes StartupEvent event) {
        if (!config.reconcile().onStartup()) {
            LOG.info("Catalog reconciliation disabled via configuration");
            return;
        }

        LOG.info("=== CATALOG RECONCILIATION ===");
        try {
            ReconciliationResult result = reconciler.reconcile(catalog);
            if (result.changedGrants()) {
                LOG.infof("Grant store updated (inserted=%d, removed=%d)",
                    result.grantsInserted(), result.grantsRemoved());
            } else {
                LOG.debug("Grant store already matched the catalog");
            }
        } catch (RuntimeException e) {
            LOG.error("Catalog reconciliation failed", e);
            throw e;
        }
        LOG.info("==============================");
    }
}
