package io.taskrelay.server.config;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.Enumeration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serves the defaults declared in every {@code META-INF/a2a-defaults.properties} on the
 * classpath.
 * <p>
 * Two resources declaring the same key with different values is a packaging error and
 * fails initialization.
 */
@ApplicationScoped
public class DefaultValuesConfigProvider implements A2AConfigProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(DefaultValuesConfigProvider.class);

    static final String DEFAULTS_RESOURCE = "META-INF/a2a-defaults.properties";

    private final Map<String, String> defaults = new HashMap<>();
    private volatile boolean initialized;

    public DefaultValuesConfigProvider() {
    }

    @PostConstruct
    void init() {
        synchronized (defaults) {
            if (initialized) {
                return;
            }
            loadDefaults(Thread.currentThread().getContextClassLoader() != null
                    ? Thread.currentThread().getContextClassLoader()
                    : DefaultValuesConfigProvider.class.getClassLoader());
            initialized = true;
        }
    }

    private void loadDefaults(ClassLoader classLoader) {
        try {
            Enumeration<URL> resources = classLoader.getResources(DEFAULTS_RESOURCE);
            while (resources.hasMoreElements()) {
                URL url = resources.nextElement();
                Properties properties = new Properties();
                try (InputStream in = url.openStream()) {
                    properties.load(in);
                }
                for (String name : properties.stringPropertyNames()) {
                    String value = properties.getProperty(name);
                    String existing = defaults.putIfAbsent(name, value);
                    if (existing != null && !existing.equals(value)) {
                        throw new IllegalStateException("Conflicting default for '" + name + "' in " + url
                                + ": '" + existing + "' vs '" + value + "'");
                    }
                }
                LOGGER.debug("Loaded {} defaults from {}", properties.size(), url);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load " + DEFAULTS_RESOURCE, e);
        }
    }

    @Override
    public String getValue(String name) {
        return getOptionalValue(name)
                .orElseThrow(() -> new IllegalArgumentException("No configuration value for '" + name + "'"));
    }

    @Override
    public Optional<String> getOptionalValue(String name) {
        init();
        return Optional.ofNullable(defaults.get(name));
    }
}
