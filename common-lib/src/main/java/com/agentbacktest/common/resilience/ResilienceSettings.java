package com.agentbacktest.common.resilience;

import com.agentbacktest.common.exception.InvalidConfigurationException;

import java.time.Duration;

/**
 * Retry and circuit-breaker tuning shared by every channel.
 *
 * @param maxRetries       additional attempts after the first one
 * @param baseDelay        backoff before the first retry; doubles per retry
 * @param maxDelay         upper bound of any single backoff
 * @param failureThreshold consecutive failures that open a channel's circuit
 * @param cooldown         how long an open circuit rejects calls
 * @param callTimeout      hard limit of a single attempt
 * @param callDeadline     limit of the whole call, retries and backoff included
 */
public record ResilienceSettings(
    int maxRetries,
    Duration baseDelay,
    Duration maxDelay,
    int failureThreshold,
    Duration cooldown,
    Duration callTimeout,
    Duration callDeadline
) {

    public static ResilienceSettings defaults() {
        return new ResilienceSettings(2, Duration.ofSeconds(1), Duration.ofSeconds(60),
            5, Duration.ofMinutes(1), Duration.ofSeconds(30), Duration.ofMinutes(2));
    }

    public ResilienceSettings validate() {
        if (maxRetries < 0) throw new InvalidConfigurationException("maxRetries must be >= 0");
        if (failureThreshold <= 0) throw new InvalidConfigurationException("failureThreshold must be positive");
        requirePositive("baseDelay", baseDelay);
        requirePositive("maxDelay", maxDelay);
        requirePositive("cooldown", cooldown);
        requirePositive("callTimeout", callTimeout);
        requirePositive("callDeadline", callDeadline);
        if (maxDelay.compareTo(baseDelay) < 0) {
            throw new InvalidConfigurationException("maxDelay must not be shorter than baseDelay");
        }
        return this;
    }

    private static void requirePositive(String name, Duration d) {
        if (d == null || d.isNegative() || d.isZero()) {
            throw new InvalidConfigurationException(name + " must be a positive duration");
        }
    }
}
