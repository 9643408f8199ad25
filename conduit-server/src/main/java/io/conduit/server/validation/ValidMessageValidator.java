package io.conduit.server.validation;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

/// Checks {@link ValidMessage} constraints.
///
/// Each failed check reports its own message so clients can tell an empty
/// message from an oversized one.
public class ValidMessageValidator implements ConstraintValidator<ValidMessage, String> {

    private int maxBytes = InputValidator.MAX_MESSAGE_BYTES;

    @Override
    public void initialize(ValidMessage annotation) {
        this.maxBytes = annotation.maxBytes();
    }

    @Override
    public boolean isValid(String value, ConstraintValidatorContext ctx) {
        if (value == null || value.isBlank()) {
            return reject(ctx, "Message is required");
        }
        if (InputValidator.exceedsSizeLimit(value, maxBytes)) {
            return reject(ctx, "Message exceeds " + maxBytes + " bytes");
        }
        if (InputValidator.containsDangerousChars(value)) {
            return reject(ctx, "Message contains illegal control characters");
        }
        return true;
    }

    private static boolean reject(ConstraintValidatorContext ctx, String message) {
        ctx.disableDefaultConstraintViolation();
        ctx.buildConstraintViolationWithTemplate(message).addConstraintViolation();
        return false;
    }
}
