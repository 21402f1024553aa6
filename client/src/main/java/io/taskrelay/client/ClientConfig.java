package io.taskrelay.client;

import java.time.Duration;
import java.util.Map;
import java.util.Properties;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import io.taskrelay.common.A2AHeaders;
import io.taskrelay.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * Settings of a {@link TaskObserver}.
 *
 * @param url base URL of the remote agent, used to fetch its card
 * @param bearerToken token sent as {@code Authorization: Bearer ...}, if any
 * @param timeout overall time allowed for one {@code sendAndObserve} call
 * @param pollInterval pause between two {@code GetTask} polls
 * @param maxRetries attempts made for each remote call before giving up
 * @param retryDelay delay before the first retry, doubled after each further failure
 */
public record ClientConfig(@Nullable String url, @Nullable String bearerToken, Duration timeout,
                           Duration pollInterval, int maxRetries, Duration retryDelay) {

    private static final Pattern ENV_REFERENCE = Pattern.compile("\\$\\{([A-Za-z_][A-Za-z0-9_]*)}");

    public ClientConfig {
        Assert.checkNotNullParam("timeout", timeout);
        Assert.checkNotNullParam("pollInterval", pollInterval);
        Assert.checkNotNullParam("retryDelay", retryDelay);
        Assert.isTrue(!timeout.isNegative() && !timeout.isZero(), "timeout must be positive");
        Assert.isTrue(!pollInterval.isNegative(), "pollInterval must not be negative");
        Assert.isTrue(maxRetries > 0, "maxRetries must be positive");
        Assert.isTrue(!retryDelay.isNegative(), "retryDelay must not be negative");
    }

    public static ClientConfig defaults() {
        return new ClientConfig(null, null, Duration.ofSeconds(300), Duration.ofSeconds(1), 3, Duration.ofSeconds(1));
    }

    /**
     * Reads the settings below {@code prefix}, for example {@code agents.sql.url}. Absent keys
     * keep their default. {@code ${NAME}} references are replaced from the process
     * environment; a reference to an unset variable is kept as written.
     *
     * @param properties the source properties
     * @param prefix key prefix, including its trailing dot
     * @return the settings
     * @throws IllegalArgumentException if a value is malformed
     */
    public static ClientConfig fromProperties(Properties properties, String prefix) {
        return fromProperties(properties, prefix, System::getenv);
    }

    static ClientConfig fromProperties(Properties properties, String prefix, Function<String, @Nullable String> env) {
        Assert.checkNotNullParam("properties", properties);
        Assert.checkNotNullParam("prefix", prefix);
        ClientConfig defaults = defaults();
        String timeout = value(properties, prefix + "timeout-seconds", env);
        String pollInterval = value(properties, prefix + "poll-interval-millis", env);
        String maxRetries = value(properties, prefix + "max-retries", env);
        String retryDelay = value(properties, prefix + "retry-delay-millis", env);
        try {
            return new ClientConfig(
                    value(properties, prefix + "url", env),
                    value(properties, prefix + "bearer-token", env),
                    timeout == null ? defaults.timeout() : Duration.ofSeconds(Long.parseLong(timeout)),
                    pollInterval == null ? defaults.pollInterval() : Duration.ofMillis(Long.parseLong(pollInterval)),
                    maxRetries == null ? defaults.maxRetries() : Integer.parseInt(maxRetries),
                    retryDelay == null ? defaults.retryDelay() : Duration.ofMillis(Long.parseLong(retryDelay)));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed client setting below " + prefix + ": " + e.getMessage(), e);
        }
    }

    private static @Nullable String value(Properties properties, String key, Function<String, @Nullable String> env) {
        String raw = properties.getProperty(key);
        return raw == null ? null : expand(raw.trim(), env);
    }

    static String expand(String value, Function<String, @Nullable String> env) {
        Matcher matcher = ENV_REFERENCE.matcher(value);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String resolved = env.apply(matcher.group(1));
            matcher.appendReplacement(sb, Matcher.quoteReplacement(resolved != null ? resolved : matcher.group()));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    /**
     * @return the headers to send with every remote call
     */
    public Map<String, String> authHeaders() {
        if (bearerToken == null || bearerToken.isBlank()) {
            return Map.of();
        }
        return Map.of(A2AHeaders.AUTHORIZATION, "Bearer " + bearerToken);
    }

    public ClientConfig withUrl(@Nullable String url) {
        return new ClientConfig(url, bearerToken, timeout, pollInterval, maxRetries, retryDelay);
    }

    public ClientConfig withTimeout(Duration timeout) {
        return new ClientConfig(url, bearerToken, timeout, pollInterval, maxRetries, retryDelay);
    }

    public ClientConfig withPollInterval(Duration pollInterval) {
        return new ClientConfig(url, bearerToken, timeout, pollInterval, maxRetries, retryDelay);
    }

    public ClientConfig withRetries(int maxRetries, Duration retryDelay) {
        return new ClientConfig(url, bearerToken, timeout, pollInterval, maxRetries, retryDelay);
    }
}
