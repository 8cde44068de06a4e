package tech.flowcatalyst.authz.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import jakarta.inject.Inject;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

/**
 * Maps request bodies Jackson cannot parse to a 400 {@code VALIDATION_ERROR} envelope.
 *
 * @see UnreadableBodyExceptionMapper
 */
@Provider
public class InvalidJsonExceptionMapper implements ExceptionMapper<JsonProcessingException> {

    private static final Logger LOG = Logger.getLogger(InvalidJsonExceptionMapper.class);

    @Inject
    RequestContext requestContext;

    @Override
    public Response toResponse(JsonProcessingException exception) {
        String requestId = requestContext.getRequestId();
        LOG.debugf("Unparseable request body [requestId=%s]: %s", requestId, exception.getOriginalMessage());
        return RequestValidation.badRequest(RequestValidation.INVALID_JSON, requestId);
    }
}
