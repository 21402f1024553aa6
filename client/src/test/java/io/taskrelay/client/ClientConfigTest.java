package io.taskrelay.client;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import java.util.Map;
import java.util.Properties;
import java.util.function.Function;

import org.junit.jupiter.api.Test;

public class ClientConfigTest {

    private static final Function<String, String> ENV = Map.of("SQL_AGENT_TOKEN", "s3cret", "SQL_HOST", "sql.internal")::get;

    @Test
    public void testDefaults() {
        ClientConfig config = ClientConfig.defaults();

        assertNull(config.url());
        assertEquals(Duration.ofSeconds(300), config.timeout());
        assertEquals(Duration.ofSeconds(1), config.pollInterval());
        assertEquals(3, config.maxRetries());
        assertEquals(Duration.ofSeconds(1), config.retryDelay());
        assertEquals(Map.of(), config.authHeaders());
    }

    @Test
    public void testReadsPrefixedPropertiesAndExpandsEnvironment() {
        Properties properties = new Properties();
        properties.setProperty("agents.sql.url", "http://${SQL_HOST}:8002");
        properties.setProperty("agents.sql.bearer-token", "${SQL_AGENT_TOKEN}");
        properties.setProperty("agents.sql.timeout-seconds", "60");
        properties.setProperty("agents.sql.poll-interval-millis", "250");
        properties.setProperty("agents.other.max-retries", "9");

        ClientConfig config = ClientConfig.fromProperties(properties, "agents.sql.", ENV);

        assertEquals("http://sql.internal:8002", config.url());
        assertEquals("s3cret", config.bearerToken());
        assertEquals(Duration.ofSeconds(60), config.timeout());
        assertEquals(Duration.ofMillis(250), config.pollInterval());
        assertEquals(3, config.maxRetries());
        assertEquals(Map.of("Authorization", "Bearer s3cret"), config.authHeaders());
    }

    @Test
    public void testUnsetVariableKeepsLiteral() {
        assertEquals("${MISSING}/a2a", ClientConfig.expand("${MISSING}/a2a", ENV));
        assertEquals("sql.internal-${MISSING}", ClientConfig.expand("${SQL_HOST}-${MISSING}", ENV));
        assertEquals("no references", ClientConfig.expand("no references", ENV));
    }

    @Test
    public void testRejectsMalformedValues() {
        Properties properties = new Properties();
        properties.setProperty("a.max-retries", "three");
        assertThrows(IllegalArgumentException.class, () -> ClientConfig.fromProperties(properties, "a.", ENV));

        properties.setProperty("a.max-retries", "0");
        assertThrows(IllegalArgumentException.class, () -> ClientConfig.fromProperties(properties, "a.", ENV));
    }
}
