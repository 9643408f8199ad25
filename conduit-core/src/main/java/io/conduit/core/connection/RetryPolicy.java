package io.conduit.core.connection;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;
import java.util.logging.Logger;

/// Retry schedule shared by process-level initialization and connection-level
/// reconnects.
///
/// The delay before retry `n` (1-based, counting retries, not attempts) is
/// `initialDelay * multiplier^(n-1)`, capped at `maxDelay`, then spread by
/// `±jitter` (a fraction of the delay).
///
/// {@snippet :
/// RetryPolicy policy = RetryPolicy.defaults();
/// policy.execute("initialize", () -> {
///     orchestrator.initialize(servers);
///     return null;
/// });
/// }
///
/// @param maxAttempts total attempts including the first, at least 1
/// @param initialDelay delay before the first retry, not negative
/// @param multiplier backoff factor applied per retry, at least 1.0
/// @param maxDelay upper bound for a single delay, not negative
/// @param jitter random spread as a fraction of the delay, `0.0..1.0`
public record RetryPolicy(
        int maxAttempts, Duration initialDelay, double multiplier, Duration maxDelay, double jitter) {

    private static final Logger logger = Logger.getLogger(RetryPolicy.class.getName());

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_INITIAL_DELAY = Duration.ofSeconds(1);

    public RetryPolicy {
        Objects.requireNonNull(initialDelay, "initialDelay must not be null");
        Objects.requireNonNull(maxDelay, "maxDelay must not be null");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (initialDelay.isNegative() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("delays must not be negative");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be at least 1.0");
        }
        if (jitter < 0.0 || jitter > 1.0) {
            throw new IllegalArgumentException("jitter must be between 0.0 and 1.0");
        }
    }

    /// Returns the default policy: 3 attempts, 1s initial delay, doubling, 20% jitter.
    ///
    /// @return default policy, never null
    public static RetryPolicy defaults() {
        return new RetryPolicy(
                DEFAULT_MAX_ATTEMPTS, DEFAULT_INITIAL_DELAY, 2.0, Duration.ofSeconds(30), 0.2);
    }

    /// Returns a policy that tries exactly once.
    ///
    /// @return single-attempt policy, never null
    public static RetryPolicy once() {
        return new RetryPolicy(1, Duration.ZERO, 1.0, Duration.ZERO, 0.0);
    }

    /// Computes the delay before the given retry, without jitter.
    ///
    /// @param retry 1-based retry number
    /// @return base delay, never negative
    public Duration baseDelay(int retry) {
        if (retry < 1 || initialDelay.isZero()) {
            return Duration.ZERO;
        }
        double millis = initialDelay.toMillis() * Math.pow(multiplier, retry - 1);
        long capped = (long) Math.min(millis, (double) maxDelay.toMillis());
        return Duration.ofMillis(capped);
    }

    /// Computes the jittered delay before the given retry.
    ///
    /// @param retry 1-based retry number
    /// @param random uniform sample in `[0, 1)`
    /// @return delay, never negative
    public Duration delay(int retry, double random) {
        long base = baseDelay(retry).toMillis();
        if (base == 0 || jitter == 0.0) {
            return Duration.ofMillis(base);
        }
        double spread = base * jitter * (2.0 * random - 1.0);
        return Duration.ofMillis(Math.max(0L, Math.round(base + spread)));
    }

    /// Runs an action, retrying on {@link RuntimeException} until it succeeds or
    /// the attempts are exhausted.
    ///
    /// @param operation name used in log lines, not null
    /// @param action the action, not null
    /// @param <T> result type
    /// @return the first successful result
    /// @throws RuntimeException the last failure once attempts are exhausted
    public <T> T execute(String operation, Supplier<T> action) {
        Objects.requireNonNull(action, "action must not be null");
        RuntimeException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return action.get();
            } catch (RuntimeException e) {
                last = e;
                if (attempt == maxAttempts) {
                    break;
                }
                Duration wait = delay(attempt, ThreadLocalRandom.current().nextDouble());
                logger.warning(
                        "Attempt "
                                + attempt
                                + "/"
                                + maxAttempts
                                + " of '"
                                + operation
                                + "' failed: "
                                + e.getMessage()
                                + ". Retrying in "
                                + wait.toMillis()
                                + "ms");
                if (!sleep(wait)) {
                    break;
                }
            }
        }
        throw last;
    }

    private static boolean sleep(Duration wait) {
        if (wait.isZero()) {
            return true;
        }
        try {
            Thread.sleep(wait.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
