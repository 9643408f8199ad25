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

/// Marks a free-text chat message.
///
/// A valid message is not blank, fits in {@link #maxBytes()} UTF-8 bytes and
/// carries no control characters other than TAB, LF and CR.
///
/// ```java
/// public record ChatRequest(@ValidMessage String message) {}
/// ```
///
/// @see ValidMessageValidator
@Target({FIELD, PARAMETER, TYPE_USE})
@Retention(RUNTIME)
@Constraint(validatedBy = ValidMessageValidator.class)
@Documented
public @interface ValidMessage {

    String message() default "invalid message";

    /// Maximum UTF-8 size in bytes.
    int maxBytes() default InputValidator.MAX_MESSAGE_BYTES;

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
