package tech.flowcatalyst.authz.api;

import jakarta.enterprise.context.RequestScoped;

/**
 * Request-scoped holder for the request ID used in response envelopes and logs.
 *
 * Populated from the {@code X-Request-ID} header by {@link RequestIdFilter};
 * generated on first access otherwise.
 */
@RequestScoped
public class RequestContext {

    private String requestId;

    public String getRequestId() {
        if (requestId == null) {
            requestId = RequestIds.generate();
        }
        return requestId;
    }

    public void setRequestId(String requestId) {
        this.requestId = requestId;
    }
}
