package io.conduit.core.agent;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/// Lets a caller abort a running turn before the iteration cap is reached.
///
/// The reasoning loop checks the token before every model call and every tool
/// call. A token is cancelled explicitly through {@link #cancel()} or
/// implicitly once its deadline passes. Calls already in flight are not
/// interrupted.
///
/// @implNote Thread-safe.
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final Instant deadline;
    private final Clock clock;

    private CancellationToken(Instant deadline, Clock clock) {
        this.deadline = deadline;
        this.clock = clock;
    }

    /// Creates a token without a deadline.
    ///
    /// @return new token, never null
    public static CancellationToken create() {
        return new CancellationToken(null, Clock.systemUTC());
    }

    /// Creates a token that cancels itself after the given timeout.
    ///
    /// @param timeout time budget from now, not null
    /// @return new token, never null
    public static CancellationToken withTimeout(Duration timeout) {
        return withTimeout(timeout, Clock.systemUTC());
    }

    static CancellationToken withTimeout(Duration timeout, Clock clock) {
        Objects.requireNonNull(timeout, "timeout must not be null");
        return new CancellationToken(clock.instant().plus(timeout), clock);
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get() || (deadline != null && !clock.instant().isBefore(deadline));
    }
}
