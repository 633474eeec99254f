package org.abstractica.xmpp.impl.connection;

import java.time.Duration;
import java.util.Objects;

/**
 * Exponential backoff for automatic reconnects.
 *
 * <p>The delay before reconnect attempt {@code n} (counting from 0) is
 * {@code min(baseDelay * 2^n, maxDelay)}. No reconnect is attempted once
 * {@code n} reaches {@code maxAttempts}.</p>
 *
 * @param maxAttempts number of automatic reconnects after consecutive failures
 * @param baseDelay   delay before the first reconnect
 * @param maxDelay    upper bound on any delay
 */
public record ReconnectPolicy(
        int maxAttempts,
        Duration baseDelay,
        Duration maxDelay
)
{
    /**
     * Five attempts, starting at one second, capped at thirty seconds.
     */
    public static final ReconnectPolicy DEFAULT = new ReconnectPolicy(5, Duration.ofMillis(1000), Duration.ofMillis(30_000));

    public ReconnectPolicy
    {
        if (maxAttempts < 0)
        {
            throw new IllegalArgumentException("maxAttempts must be non-negative: " + maxAttempts);
        }
        Objects.requireNonNull(baseDelay, "baseDelay");
        Objects.requireNonNull(maxDelay, "maxDelay");
        if (baseDelay.isNegative() || maxDelay.compareTo(baseDelay) < 0)
        {
            throw new IllegalArgumentException("Require 0 <= baseDelay <= maxDelay");
        }
    }

    /**
     * Returns whether another reconnect may follow {@code attempts} failed
     * reconnects.
     *
     * @param attempts reconnects already made since the last success
     * @return true if a reconnect is allowed
     */
    public boolean allows(int attempts)
    {
        return attempts < maxAttempts;
    }

    /**
     * Returns the delay before the reconnect following {@code attempts}
     * earlier reconnects.
     *
     * @param attempts reconnects already made since the last success
     * @return the backoff delay
     */
    public Duration delayFor(int attempts)
    {
        if (attempts < 0)
        {
            throw new IllegalArgumentException("attempts must be non-negative: " + attempts);
        }
        // 2^31 ms already exceeds any sane cap
        if (attempts >= 31)
        {
            return maxDelay;
        }
        long delayMs = baseDelay.toMillis() * (1L << attempts);
        return Duration.ofMillis(Math.min(delayMs, maxDelay.toMillis()));
    }
}
