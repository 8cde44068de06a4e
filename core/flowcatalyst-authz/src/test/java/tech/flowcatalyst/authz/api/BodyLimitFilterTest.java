package tech.flowcatalyst.authz.api;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ResourceInfo;
import jakarta.ws.rs.core.Response;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BodyLimitFilterTest {

    @Mock
    ResourceInfo resourceInfo;

    @Mock
    ContainerRequestContext request;

    private BodyLimitFilter filter;

    @BeforeEach
    void setUp() {
        filter = new BodyLimitFilter();
        filter.resourceInfo = resourceInfo;
        filter.requestContext = new RequestContext();
        filter.requestContext.setRequestId("req-limit");
    }

    @Test
    @DisplayName("A check body over 8KB is rejected with a 400 envelope")
    void filter_shouldAbort_whenCheckBodyOverLimit() throws Exception {
        when(resourceInfo.getResourceMethod())
            .thenReturn(AuthzCheckResource.class.getMethod("check", JsonNode.class));
        when(request.getLength()).thenReturn(9_000);

        filter.filter(request);

        ArgumentCaptor<Response> response = ArgumentCaptor.forClass(Response.class);
        verify(request).abortWith(response.capture());
        assertThat(response.getValue().getStatus()).isEqualTo(400);
        ApiEnvelope.Failure envelope = (ApiEnvelope.Failure) response.getValue().getEntity();
        assertThat(envelope.error().code()).isEqualTo(ApiEnvelope.VALIDATION_ERROR);
        assertThat(envelope.error().message()).isEqualTo(RequestValidation.BODY_TOO_LARGE);
        assertThat(envelope.meta().requestId()).isEqualTo("req-limit");
    }

    @Test
    @DisplayName("An action body of 9000 bytes fits the 32KB action limit")
    void filter_shouldPass_whenActionBodyUnderLimit() throws Exception {
        when(resourceInfo.getResourceMethod())
            .thenReturn(InternalActionsResource.class.getMethod("execute", JsonNode.class));
        when(request.getLength()).thenReturn(9_000);

        filter.filter(request);

        verify(request, never()).abortWith(any());
    }

    @Test
    @DisplayName("Small bodies pass")
    void filter_shouldPass_whenUnderLimit() throws Exception {
        lenient().when(resourceInfo.getResourceMethod())
            .thenReturn(AuthzCheckResource.class.getMethod("check", JsonNode.class));
        when(request.getLength()).thenReturn(100);

        filter.filter(request);

        verify(request, never()).abortWith(any());
    }

    @Test
    @DisplayName("Bodies without a declared length are left to the server-wide limit")
    void filter_shouldPass_whenLengthUnknown() {
        when(request.getLength()).thenReturn(-1);

        filter.filter(request);

        verify(request, never()).abortWith(any());
        verifyNoInteractions(resourceInfo);
    }
}
