package tech.flowcatalyst.authz.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.inject.Inject;
import jakarta.validation.Validator;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.parameters.RequestBody;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import tech.flowcatalyst.authz.resolve.AuthorizationService;

import java.util.Optional;

/**
 * Permission check API for sibling services.
 *
 * A missing workspace means a platform-level check: only the global actions
 * of the catalog are allowed. Grant store failures are mapped to a 500 by
 * {@link GrantStoreUnavailableExceptionMapper}; callers must treat them as a deny.
 */
@Path("/authz")
@Tag(name = "Authorization", description = "Permission checks")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class AuthzCheckResource {

    static final String UUID_PATTERN =
        "^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$";

    @Inject
    AuthorizationService authorizationService;

    @Inject
    RequestContext requestContext;

    @Inject
    Validator validator;

    @Inject
    ObjectMapper objectMapper;

    @POST
    @Path("/check")
    @LimitedBody(maxBytes = 8 * 1024)
    @Operation(summary = "Check a permission",
        description = "Returns whether the user may perform the action, optionally within a workspace.")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Decision",
            content = @Content(schema = @Schema(implementation = CheckResponse.class))),
        @APIResponse(responseCode = "400", description = "Invalid, unknown-field or oversized request",
            content = @Content(schema = @Schema(implementation = ApiEnvelope.Failure.class))),
        @APIResponse(responseCode = "500", description = "Grant store unavailable",
            content = @Content(schema = @Schema(implementation = ApiEnvelope.Failure.class)))
    })
    public Response check(
            @RequestBody(content = @Content(schema = @Schema(implementation = CheckRequest.class)))
            JsonNode body) {
        String requestId = requestContext.getRequestId();

        CheckRequest request;
        try {
            request = RequestValidation.readStrict(objectMapper, body, CheckRequest.class);
        } catch (JsonProcessingException e) {
            return RequestValidation.badRequest("Invalid request body: " + e.getOriginalMessage(), requestId);
        }

        Optional<Response> invalid = RequestValidation.validate(validator, request, requestId);
        if (invalid.isPresent()) {
            return invalid.get();
        }

        boolean allowed = authorizationService.checkPermission(
            request.userId(), request.workspaceId(), request.actionKey());

        return Response.ok(ApiEnvelope.success(new CheckResponse(allowed), requestId)).build();
    }

    // ==================== DTOs ====================

    @Schema(description = "Permission check request")
    public record CheckRequest(
        @Schema(description = "User ID (UUID)", required = true)
        @NotNull @Pattern(regexp = UUID_PATTERN, message = "must be a UUID")
        String userId,

        @Schema(description = "Workspace ID (UUID); omit or null for platform-level actions", nullable = true)
        @Pattern(regexp = UUID_PATTERN, message = "must be a UUID")
        String workspaceId,

        @Schema(description = "Permission key", example = "docs.document.read", required = true)
        @NotBlank @Size(max = 256)
        String actionKey
    ) {}

    @Schema(description = "Permission check result")
    public record CheckResponse(
        boolean allowed
    ) {}
}
