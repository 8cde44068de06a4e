package tech.flowcatalyst.authz.api;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Response envelope shared by every endpoint.
 *
 * Success: {@code {"ok": true, "data": ..., "meta": {"requestId": ...}}}
 * Failure: {@code {"ok": false, "error": {"code": ..., "message": ...}, "meta": {"requestId": ...}}}
 */
public final class ApiEnvelope {

    public static final String VALIDATION_ERROR = "VALIDATION_ERROR";
    public static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    private ApiEnvelope() {} // Prevent instantiation

    @Schema(description = "Successful response")
    public record Success<T>(
        @Schema(description = "Always true", example = "true")
        boolean ok,
        T data,
        Meta meta
    ) {}

    @Schema(description = "Error response")
    public record Failure(
        @Schema(description = "Always false", example = "false")
        boolean ok,
        ErrorBody error,
        Meta meta
    ) {}

    @Schema(description = "Error details")
    public record ErrorBody(
        @Schema(description = "Machine-readable error code", example = "VALIDATION_ERROR")
        String code,
        @Schema(description = "Human-readable message")
        String message
    ) {}

    @Schema(description = "Response metadata")
    public record Meta(
        @Schema(description = "Request correlation ID", example = "req-lx2k9f3a-8h2k1c")
        String requestId
    ) {}

    public static <T> Success<T> success(T data, String requestId) {
        return new Success<>(true, data, new Meta(requestId));
    }

    public static Failure failure(String code, String message, String requestId) {
        return new Failure(false, new ErrorBody(code, message), new Meta(requestId));
    }
}
