package tech.flowcatalyst.authz.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import jakarta.inject.Inject;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

/**
 * The JSON message body reader reports a malformed body as a
 * {@link WebApplicationException} caused by a {@link JsonProcessingException}.
 * Those become a 400 {@code VALIDATION_ERROR} envelope; every other
 * {@link WebApplicationException} keeps its own response.
 */
@Provider
public class UnreadableBodyExceptionMapper implements ExceptionMapper<WebApplicationException> {

    private static final Logger LOG = Logger.getLogger(UnreadableBodyExceptionMapper.class);

    @Inject
    RequestContext requestContext;

    @Override
    public Response toResponse(WebApplicationException exception) {
        JsonProcessingException parseFailure = findParseFailure(exception);
        if (parseFailure == null) {
            return exception.getResponse();
        }
        String requestId = requestContext.getRequestId();
        LOG.debugf("Unparseable request body [requestId=%s]: %s", requestId, parseFailure.getOriginalMessage());
        return RequestValidation.badRequest(RequestValidation.INVALID_JSON, requestId);
    }

    private static JsonProcessingException findParseFailure(Throwable exception) {
        for (Throwable cause = exception.getCause(); cause != null; cause = cause.getCause()) {
            if (cause instanceof JsonProcessingException) {
                return (JsonProcessingException) cause;
            }
        }
        return null;
    }
}
