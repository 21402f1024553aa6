package io.taskrelay.server.config;

import java.util.Optional;

import io.taskrelay.util.Assert;

/**
 * Lets JVM system properties override the values of another provider.
 */
public class SystemPropertyConfigProvider implements A2AConfigProvider {

    private final A2AConfigProvider delegate;

    public SystemPropertyConfigProvider(A2AConfigProvider delegate) {
        this.delegate = Assert.checkNotNullParam("delegate", delegate);
    }

    @Override
    public String getValue(String name) {
        String value = System.getProperty(name);
        return value != null ? value : delegate.getValue(name);
    }

    @Override
    public Optional<String> getOptionalValue(String name) {
        String value = System.getProperty(name);
        return value != null ? Optional.of(value) : delegate.getOptionalValue(name);
    }
}
