package tech.flowcatalyst.authz.catalog;

/**
 * Thrown when a permission catalog is internally inconsistent.
 *
 * Raised while the catalog is being built at process start. It is never caught
 * inside the service: an invalid catalog must stop the process.
 */
public class CatalogValidationException extends RuntimeException {

    public CatalogValidationException(String message) {
        super(message);
    }
}
