package io.taskrelay.server.tasks;

import java.time.Duration;

import io.taskrelay.util.Assert;

/**
 * Retry schedule for webhook deliveries.
 *
 * @param maxAttempts total attempts per event, including the first
 * @param initialBackoff delay before the first retry
 * @param multiplier factor applied to the delay after every retry
 * @param maxBackoff upper bound of the delay
 * @param attemptTimeout time allowed for one attempt
 */
public record DeliveryPolicy(int maxAttempts, Duration initialBackoff, double multiplier, Duration maxBackoff,
                             Duration attemptTimeout) {

    public static final DeliveryPolicy DEFAULT = new DeliveryPolicy(5, Duration.ofMillis(500), 2.0,
            Duration.ofSeconds(10), Duration.ofSeconds(15));

    public DeliveryPolicy {
        Assert.checkNotNullParam("initialBackoff", initialBackoff);
        Assert.checkNotNullParam("maxBackoff", maxBackoff);
        Assert.checkNotNullParam("attemptTimeout", attemptTimeout);
        Assert.isTrue(maxAttempts >= 1, "maxAttempts must be at least 1");
        Assert.isTrue(multiplier >= 1.0, "multiplier must be at least 1.0");
    }

    /**
     * @param failedAttempts number of attempts made so far, starting at 1
     * @return the delay before the next attempt
     */
    public Duration backoffAfter(int failedAttempts) {
        double millis = initialBackoff.toMillis() * Math.pow(multiplier, Math.max(0, failedAttempts - 1));
        return Duration.ofMillis((long) Math.min(millis, maxBackoff.toMillis()));
    }
}
