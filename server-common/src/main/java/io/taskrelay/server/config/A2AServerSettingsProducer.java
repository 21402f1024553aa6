package io.taskrelay.server.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import io.taskrelay.util.Assert;

/**
 * Makes {@link A2AServerSettings} injectable, reading the classpath defaults with system
 * property overrides.
 */
@ApplicationScoped
public class A2AServerSettingsProducer {

    private final DefaultValuesConfigProvider defaults;

    @Inject
    public A2AServerSettingsProducer(DefaultValuesConfigProvider defaults) {
        this.defaults = Assert.checkNotNullParam("defaults", defaults);
    }

    @Produces
    @Singleton
    public A2AServerSettings settings() {
        return A2AServerSettings.from(new SystemPropertyConfigProvider(defaults));
    }
}
