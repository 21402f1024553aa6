package io.taskrelay.server.config;

import java.time.Duration;

import io.taskrelay.server.tasks.DeliveryPolicy;
import io.taskrelay.util.Assert;

/**
 * Typed view of the server configuration.
 *
 * @param defaultProtocolVersion version assumed when a caller declares none
 * @param defaultHistoryLength history messages returned when a request does not say
 * @param defaultPageSize page size when a listing request does not say
 * @param maxPageSize upper bound applied to requested page sizes
 * @param blockingTimeout how long a blocking {@code SendMessage} waits
 * @param subscriberQueueSize bound of each subscriber's queue
 * @param pollTimeout how long a stream consumer waits for the next event before re-checking
 * @param deliveryPolicy webhook retry policy
 * @param allowPrivateDestinations whether webhooks may target loopback or private networks
 */
public record A2AServerSettings(String defaultProtocolVersion, int defaultHistoryLength, int defaultPageSize,
                                int maxPageSize, Duration blockingTimeout, int subscriberQueueSize,
                                Duration pollTimeout, DeliveryPolicy deliveryPolicy,
                                boolean allowPrivateDestinations) {

    public A2AServerSettings {
        Assert.checkNotNullParam("defaultProtocolVersion", defaultProtocolVersion);
        Assert.checkNotNullParam("blockingTimeout", blockingTimeout);
        Assert.checkNotNullParam("pollTimeout", pollTimeout);
        Assert.checkNotNullParam("deliveryPolicy", deliveryPolicy);
        Assert.isTrue(defaultHistoryLength > 0, "defaultHistoryLength must be positive");
        Assert.isTrue(defaultPageSize > 0, "defaultPageSize must be positive");
        Assert.isTrue(maxPageSize >= defaultPageSize, "maxPageSize must not be below defaultPageSize");
        Assert.isTrue(subscriberQueueSize > 0, "subscriberQueueSize must be positive");
    }

    /**
     * Reads the settings from a configuration provider.
     *
     * @param config the provider
     * @return the settings
     * @throws IllegalArgumentException if a value is missing or malformed
     */
    public static A2AServerSettings from(A2AConfigProvider config) {
        DeliveryPolicy deliveryPolicy = new DeliveryPolicy(
                Integer.parseInt(config.getValue("a2a.push.max-attempts")),
                Duration.ofMillis(Long.parseLong(config.getValue("a2a.push.initial-backoff-millis"))),
                Double.parseDouble(config.getValue("a2a.push.backoff-multiplier")),
                Duration.ofMillis(Long.parseLong(config.getValue("a2a.push.max-backoff-millis"))),
                Duration.ofMillis(Long.parseLong(config.getValue("a2a.push.attempt-timeout-millis"))));
        return new A2AServerSettings(
                config.getValue("a2a.protocol.default-version"),
                Integer.parseInt(config.getValue("a2a.tasks.default-history-length")),
                Integer.parseInt(config.getValue("a2a.tasks.default-page-size")),
                Integer.parseInt(config.getValue("a2a.tasks.max-page-size")),
                Duration.ofSeconds(Long.parseLong(config.getValue("a2a.blocking.timeout-seconds"))),
                Integer.parseInt(config.getValue("a2a.events.subscriber-queue-size")),
                Duration.ofMillis(Long.parseLong(config.getValue("a2a.events.poll-timeout-millis"))),
                deliveryPolicy,
                Boolean.parseBoolean(config.getValue("a2a.push.allow-private-destinations")));
    }

    /**
     * @return the settings built from {@code META-INF/a2a-defaults.properties} and system properties
     */
    public static A2AServerSettings defaults() {
        return from(new SystemPropertyConfigProvider(new DefaultValuesConfigProvider()));
    }

    public A2AServerSettings withAllowPrivateDestinations(boolean allow) {
        return new A2AServerSettings(defaultProtocolVersion, defaultHistoryLength, defaultPageSize, maxPageSize,
                blockingTimeout, subscriberQueueSize, pollTimeout, deliveryPolicy, allow);
    }

    public A2AServerSettings withDeliveryPolicy(DeliveryPolicy policy) {
        return new A2AServerSettings(defaultProtocolVersion, defaultHistoryLength, defaultPageSize, maxPageSize,
                blockingTimeout, subscriberQueueSize, pollTimeout, policy, allowPrivateDestinations);
    }

    public A2AServerSettings withSubscriberQueueSize(int size) {
        return new A2AServerSettings(defaultProtocolVersion, defaultHistoryLength, defaultPageSize, maxPageSize,
                blockingTimeout, size, pollTimeout, deliveryPolicy, allowPrivateDestinations);
    }

    public A2AServerSettings withBlockingTimeout(Duration timeout) {
        return new A2AServerSettings(defaultProtocolVersion, defaultHistoryLength, defaultPageSize, maxPageSize,
                timeout, subscriberQueueSize, pollTimeout, deliveryPolicy, allowPrivateDestinations);
    }
}
