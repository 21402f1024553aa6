package io.taskrelay.server.config;

import java.util.Optional;

/**
 * Source of configuration values for the server components.
 * <p>
 * Integrations plug their own configuration system in by providing an implementation
 * (for example one backed by MicroProfile Config or Spring's {@code Environment}).
 * {@link DefaultValuesConfigProvider} serves the built-in defaults.
 */
public interface A2AConfigProvider {

    /**
     * Returns a configuration value.
     *
     * @param name the property name
     * @return the value
     * @throws IllegalArgumentException if the property is not defined
     */
    String getValue(String name);

    /**
     * Returns a configuration value if it is defined.
     *
     * @param name the property name
     * @return the value, or empty if not defined
     */
    Optional<String> getOptionalValue(String name);
}
