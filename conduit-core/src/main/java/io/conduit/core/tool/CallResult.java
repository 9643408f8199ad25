package io.conduit.core.tool;

/// Outcome envelope of a single tool invocation.
///
/// Never partially filled: a successful result carries no error, a failed
/// result always carries one. Execution time is recorded in both cases.
///
/// @param success whether the call succeeded
/// @param data call output on success, may be null for tools without output
/// @param error failure description, present exactly when `success` is false
/// @param executionTimeMs wall-clock duration of the invocation, not negative
/// @param <T> output type
public record CallResult<T>(boolean success, T data, String error, long executionTimeMs) {

    public CallResult {
        if (success && error != null) {
            throw new IllegalArgumentException("successful result must not carry an error");
        }
        if (!success && (error == null || error.isBlank())) {
            throw new IllegalArgumentException("failed result must carry an error");
        }
        if (!success && data != null) {
            throw new IllegalArgumentException("failed result must not carry data");
        }
        if (executionTimeMs < 0) {
            throw new IllegalArgumentException("executionTimeMs must not be negative");
        }
    }

    public static <T> CallResult<T> success(T data, long executionTimeMs) {
        return new CallResult<>(true, data, null, executionTimeMs);
    }

    public static <T> CallResult<T> failure(String error, long executionTimeMs) {
        return new CallResult<>(false, null, error, executionTimeMs);
    }
}
