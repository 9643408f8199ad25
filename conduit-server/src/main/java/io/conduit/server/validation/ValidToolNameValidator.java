package io.conduit.server.validation;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

/// Checks {@link ValidToolName} constraints.
public class ValidToolNameValidator implements ConstraintValidator<ValidToolName, String> {

    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        return InputValidator.isToolName(value);
    }
}
