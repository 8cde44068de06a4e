package tech.flowcatalyst.authz.api;

import jakarta.annotation.Priority;
import jakarta.inject.Inject;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.container.ResourceInfo;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

import java.lang.reflect.Method;

/**
 * Rejects requests whose declared {@code Content-Length} exceeds the limit of
 * the {@link LimitedBody} annotated resource method.
 *
 * Bodies without a declared length are still bounded by the server-wide limit.
 */
@Provider
@LimitedBody
@Priority(Priorities.USER + 100)
public class BodyLimitFilter implements ContainerRequestFilter {

    private static final Logger LOG = Logger.getLogger(BodyLimitFilter.class);

    @Context
    ResourceInfo resourceInfo;

    @Inject
    RequestContext requestContext;

    @Override
    public void filter(ContainerRequestContext request) {
        int length = request.getLength();
        if (length < 0) {
            return;
        }

        int maxBytes = maxBytes();
        if (length > maxBytes) {
            String requestId = requestContext.getRequestId();
            LOG.debugf("Rejected %d byte body (limit %d) [requestId=%s]", length, maxBytes, requestId);
            request.abortWith(RequestValidation.badRequest(RequestValidation.BODY_TOO_LARGE, requestId));
        }
    }

    private int maxBytes() {
        Method method = resourceInfo.getResourceMethod();
        LimitedBody limit = method != null ? method.getAnnotation(LimitedBody.class) : null;
        if (limit == null && resourceInfo.getResourceClass() != null) {
            limit = resourceInfo.getResourceClass().getAnnotation(LimitedBody.class);
        }
        return limit != null ? limit.maxBytes() : LimitedBody.DEFAULT_MAX_BYTES;
    }
}
