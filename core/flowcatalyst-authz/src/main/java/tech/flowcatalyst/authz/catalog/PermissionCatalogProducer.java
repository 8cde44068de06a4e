package tech.flowcatalyst.authz.catalog;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;

/**
 * Exposes the standard catalog as a CDI bean.
 *
 * The catalog is built once; a {@link CatalogValidationException} here prevents
 * the application from starting.
 */
@ApplicationScoped
public class PermissionCatalogProducer {

    private static final Logger LOG = Logger.getLogger(PermissionCatalogProducer.class);

    @Produces
    @Singleton
    PermissionCatalog permissionCatalog() {
        PermissionCatalog catalog = StandardCatalog.load();
        LOG.infof("Loaded permission catalog: %d permissions, %d roles, %d global actions",
            catalog.permissions().size(), catalog.roles().size(), catalog.globalActions().size());
        return catalog;
    }
}
