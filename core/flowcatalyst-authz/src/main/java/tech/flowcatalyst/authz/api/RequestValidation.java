package tech.flowcatalyst.authz.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import java.util.Comparator;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Strict reading and Bean Validation of request bodies, reported as a 400 envelope.
 */
final class RequestValidation {

    static final String INVALID_JSON = "Invalid JSON body";
    static final String BODY_REQUIRED = "Request body is required";
    static final String BODY_TOO_LARGE = "Request body too large";

    private RequestValidation() {}

    /**
     * Bind a JSON tree to a request type, rejecting properties the type does not declare.
     *
     * @return the bound value, or null when the tree is missing or JSON null
     */
    static <T> T readStrict(ObjectMapper objectMapper, JsonNode tree, Class<T> type) throws JsonProcessingException {
        if (tree == null || tree.isNull() || tree.isMissingNode()) {
            return null;
        }
        return objectMapper.readerFor(type)
            .with(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .treeToValue(tree, type);
    }

    /**
     * Validate a request body.
     *
     * @return a 400 response when the body is missing or invalid, empty otherwise
     */
    static <T> Optional<Response> validate(Validator validator, T body, String requestId) {
        if (body == null) {
            return Optional.of(badRequest(BODY_REQUIRED, requestId));
        }
        Set<ConstraintViolation<T>> violations = validator.validate(body);
        if (violations.isEmpty()) {
            return Optional.empty();
        }
        String message = violations.stream()
            .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
            .map(v -> v.getPropertyPath() + ": " + v.getMessage())
            .collect(Collectors.joining("; "));
        return Optional.of(badRequest(message, requestId));
    }

    static Response badRequest(String message, String requestId) {
        return Response.status(Response.Status.BAD_REQUEST)
            .type(MediaType.APPLICATION_JSON)
            .entity(ApiEnvelope.failure(ApiEnvelope.VALIDATION_ERROR, message, requestId))
            .build();
    }
}
