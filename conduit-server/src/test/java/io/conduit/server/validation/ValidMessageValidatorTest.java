package io.conduit.server.validation;

import static org.assertj.core.api.Assertions.assertThat;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import java.util.Set;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ValidMessageValidatorTest {

    private static ValidatorFactory factory;
    private static Validator validator;

    @BeforeAll
    static void setup() {
        factory = Validation.buildDefaultValidatorFactory();
        validator = factory.getValidator();
    }

    @AfterAll
    static void tearDown() {
        factory.close();
    }

    record ChatDto(@ValidMessage String message) {}

    record SmallChatDto(@ValidMessage(maxBytes = 16) String message) {}

    record SessionDto(@ValidId String sessionId) {}

    record ToolDto(@ValidToolName String toolName) {}

    @Nested
    class Message {

        @Test
        void shouldRejectMissingMessage() {
            assertSingleViolation(validator.validate(new ChatDto(null)), "Message is required");
        }

        @Test
        void shouldRejectBlankMessage() {
            assertSingleViolation(validator.validate(new ChatDto(" \n ")), "Message is required");
        }

        @Test
        void shouldRejectOversizedMessage() {
            assertSingleViolation(
                    validator.validate(new SmallChatDto("x".repeat(17))), "Message exceeds 16 bytes");
        }

        @Test
        void shouldAcceptMessageAtLimit() {
            assertThat(validator.validate(new SmallChatDto("x".repeat(16)))).isEmpty();
        }

        @Test
        void shouldRejectControlCharacters() {
            assertSingleViolation(
                    validator.validate(new ChatDto("hello\u0000")),
                    "Message contains illegal control characters");
        }

        @Test
        void shouldAcceptMultiLineMessage() {
            assertThat(validator.validate(new ChatDto("What did Alice send?\n\tThanks"))).isEmpty();
        }
    }

    @Nested
    class Identifiers {

        @Test
        void shouldRejectUnsafeSessionId() {
            assertThat(validator.validate(new SessionDto("../etc/passwd"))).hasSize(1);
        }

        @Test
        void shouldAcceptSessionId() {
            assertThat(validator.validate(new SessionDto("session-1"))).isEmpty();
        }

        @Test
        void shouldAcceptSessionIdAtMaximumLength() {
            assertThat(validator.validate(new SessionDto("s".repeat(128)))).isEmpty();
        }

        @Test
        void shouldRejectSessionIdOverMaximumLength() {
            assertSingleViolation(
                    validator.validate(new SessionDto("s".repeat(129))),
                    "must be a valid identifier (alphanumeric, dots, hyphens, underscores;"
                            + " 1-128 chars)");
        }

        @Test
        void shouldAcceptNamespacedToolName() {
            assertThat(validator.validate(new ToolDto("rag:search"))).isEmpty();
        }

        @Test
        void shouldRejectMalformedToolName() {
            assertThat(validator.validate(new ToolDto("rag:search:extra"))).hasSize(1);
        }
    }

    private static void assertSingleViolation(
            Set<? extends ConstraintViolation<?>> violations, String expectedMessage) {
        assertThat(violations).hasSize(1);
        assertThat(violations.iterator().next().getMessage()).isEqualTo(expectedMessage);
    }
}
