package io.conduit.server.validation;

import static java.lang.annotation.ElementType.FIELD;
import static java.lang.annotation.ElementType.PARAMETER;
import static java.lang.annotation.ElementType.TYPE_USE;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;
import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;

/// Marks a session identifier taken from a path or body.
///
/// ```java
/// @POST
/// @Path("/{sessionId}/reset")
/// public Response reset(@PathParam("sessionId") @ValidId String sessionId) { ... }
/// ```
///
/// @see InputValidator#isSafeId(String)
@Target({FIELD, PARAMETER, TYPE_USE})
@Retention(RUNTIME)
@Constraint(validatedBy = ValidIdValidator.class)
@Documented
public @interface ValidId {

    String message() default
            "must be a valid identifier (alphanumeric, dots, hyphens, underscores; 1-128 chars)";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
