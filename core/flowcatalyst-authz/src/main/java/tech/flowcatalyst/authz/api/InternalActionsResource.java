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
import org.jboss.logging.Logger;
import tech.flowcatalyst.authz.assignment.RoleAssignmentService;
import tech.flowcatalyst.authz.config.AuthzConfig;

import java.util.Optional;

/**
 * Internal action dispatch used by sibling services.
 *
 * Supported actions:
 * - {@code authz.assignRole}: give a user a role in a workspace. Only the roles
 *   listed in {@code authz.assignment.assignable-roles} may be assigned here.
 */
@Path("/internal")
@Tag(name = "Internal", description = "Service-to-service actions")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class InternalActionsResource {

    private static final Logger LOG = Logger.getLogger(InternalActionsResource.class);

    public static final String ASSIGN_ROLE = "authz.assignRole";

    @Inject
    RoleAssignmentService roleAssignmentService;

    @Inject
    AuthzConfig config;

    @Inject
    ObjectMapper objectMapper;

    @Inject
    RequestContext requestContext;

    @Inject
    Validator validator;

    @POST
    @Path("/authz-actions")
    @LimitedBody(maxBytes = 32 * 1024)
    @Operation(summary = "Execute an internal authorization action")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Action executed",
            content = @Content(schema = @Schema(implementation = AssignRoleResponse.class))),
        @APIResponse(responseCode = "400", description = "Unknown action, invalid or oversized request",
            content = @Content(schema = @Schema(implementation = ApiEnvelope.Failure.class))),
        @APIResponse(responseCode = "500", description = "Grant store unavailable",
            content = @Content(schema = @Schema(implementation = ApiEnvelope.Failure.class)))
    })
    public Response execute(
            @RequestBody(content = @Content(schema = @Schema(implementation = ActionRequest.class)))
            JsonNode body) {
        String requestId = requestContext.getRequestId();

        ActionRequest request;
        try {
            request = RequestValidation.readStrict(objectMapper, body, ActionRequest.class);
        } catch (JsonProcessingException e) {
            return RequestValidation.badRequest("Invalid request body: " + e.getOriginalMessage(), requestId);
        }

        Optional<Response> invalid = RequestValidation.validate(validator, request, requestId);
        if (invalid.isPresent()) {
            return invalid.get();
        }

        if (!ASSIGN_ROLE.equals(request.actionKey())) {
            return RequestValidation.badRequest("Unsupported action: " + request.actionKey(), requestId);
        }
        return assignRole(request.payload(), requestId);
    }

    private Response assignRole(JsonNode payload, String requestId) {
        if (payload == null || !payload.isObject()) {
            return RequestValidation.badRequest("payload: must be an object", requestId);
        }

        AssignRolePayload assign;
        try {
            assign = RequestValidation.readStrict(objectMapper, payload, AssignRolePayload.class);
        } catch (JsonProcessingException e) {
            LOG.debugf("Rejected %s payload [requestId=%s]: %s", ASSIGN_ROLE, requestId, e.getOriginalMessage());
            return RequestValidation.badRequest("payload: " + e.getOriginalMessage(), requestId);
        }

        Optional<Response> invalid = RequestValidation.validate(validator, assign, requestId);
        if (invalid.isPresent()) {
            return invalid.get();
        }

        if (!config.assignment().assignableRoles().contains(assign.roleKey())) {
            return RequestValidation.badRequest("payload.roleKey: role cannot be assigned: " + assign.roleKey(), requestId);
        }

        try {
            roleAssignmentService.assignRole(assign.userId(), assign.workspaceId(), assign.roleKey());
        } catch (IllegalArgumentException e) {
            return RequestValidation.badRequest(e.getMessage(), requestId);
        }

        return Response.ok(ApiEnvelope.success(new AssignRoleResponse(true), requestId)).build();
    }

    // ==================== DTOs ====================

    @Schema(description = "Internal action request")
    public record ActionRequest(
        @Schema(description = "Action to execute", example = ASSIGN_ROLE, required = true)
        @NotBlank @Size(max = 256)
        String actionKey,

        @Schema(description = "Action-specific payload")
        JsonNode payload
    ) {}

    @Schema(description = "Payload of authz.assignRole")
    public record AssignRolePayload(
        @NotNull @Pattern(regexp = AuthzCheckResource.UUID_PATTERN, message = "must be a UUID")
        String userId,

        @NotNull @Pattern(regexp = AuthzCheckResource.UUID_PATTERN, message = "must be a UUID")
        String workspaceId,

        @NotBlank
        String roleKey
    ) {}

    @Schema(description = "Result of authz.assignRole")
    public record AssignRoleResponse(
        boolean assigned
    ) {}
}
