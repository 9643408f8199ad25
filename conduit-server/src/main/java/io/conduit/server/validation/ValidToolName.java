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

/// Marks a tool name, either `server:tool` or a bare `tool`.
///
/// @see InputValidator#isToolName(String)
@Target({FIELD, PARAMETER, TYPE_USE})
@Retention(RUNTIME)
@Constraint(validatedBy = ValidToolNameValidator.class)
@Documented
public @interface ValidToolName {

    String message() default "must be a tool name of the form 'server:tool' or 'tool'";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
