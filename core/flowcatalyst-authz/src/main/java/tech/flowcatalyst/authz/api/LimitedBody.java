package tech.flowcatalyst.authz.api;

import jakarta.ws.rs.NameBinding;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Caps the request body size of a resource method below the server-wide
 * {@code quarkus.http.limits.max-body-size}.
 *
 * Oversized requests are answered by {@link BodyLimitFilter} with a 400
 * {@code VALIDATION_ERROR} envelope instead of a bare 413.
 *
 * @see BodyLimitFilter
 */
@NameBinding
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.TYPE, ElementType.METHOD})
public @interface LimitedBody {

    int DEFAULT_MAX_BYTES = 32 * 1024;

    /**
     * Largest accepted {@code Content-Length}, in bytes.
     */
    int maxBytes() default DEFAULT_MAX_BYTES;
}
