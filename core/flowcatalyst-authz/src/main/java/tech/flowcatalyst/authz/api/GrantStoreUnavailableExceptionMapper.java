package tech.flowcatalyst.authz.api;

import jakarta.inject.Inject;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;
import tech.flowcatalyst.authz.store.GrantStoreUnavailableException;

/**
 * Maps grant store failures to a 500 envelope.
 *
 * The request is not allowed: callers treat an indeterminate check as a deny.
 * The store error itself is logged, never returned to the client.
 */
@Provider
public class GrantStoreUnavailableExceptionMapper implements ExceptionMapper<GrantStoreUnavailableException> {

    private static final Logger LOG = Logger.getLogger(GrantStoreUnavailableExceptionMapper.class);

    @Inject
    RequestContext requestContext;

    @Override
    public Response toResponse(GrantStoreUnavailableException exception) {
        String requestId = requestContext.getRequestId();
        LOG.errorf(exception, "Grant store unavailable [requestId=%s]", requestId);

        return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
            .type(MediaType.APPLICATION_JSON)
            .entity(ApiEnvelope.failure(ApiEnvelope.INTERNAL_ERROR,
                "An internal error occurred while processing the request.", requestId))
            .build();
    }
}
