package tech.flowcatalyst.authz.store;

/**
 * The grant store could not be reached or queried.
 *
 * Repositories wrap every persistence failure in this exception. It is never
 * converted into an allow or a deny inside the service; callers decide the
 * policy (the HTTP layer fails closed).
 */
public class GrantStoreUnavailableException extends RuntimeException {

    public GrantStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
