package io.taskrelay.server.extensions;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;

import io.taskrelay.server.ServerCallContext;
import io.taskrelay.server.auth.UnauthenticatedUser;
import io.taskrelay.spec.AgentCapabilities;
import io.taskrelay.spec.AgentCard;
import io.taskrelay.spec.AgentExtension;
import io.taskrelay.spec.ExtensionSupportRequiredError;
import org.junit.jupiter.api.Test;

class A2AExtensionsTest {

    private static final String TRACING = "https://example.com/ext/tracing/v1";
    private static final String BILLING = "https://example.com/ext/billing/v1";

    private static AgentCard card(AgentExtension... extensions) {
        return AgentCard.builder()
                .name("agent")
                .description("test agent")
                .url("http://localhost:9999")
                .version("1.0.0")
                .capabilities(AgentCapabilities.builder().extensions(List.of(extensions)).build())
                .build();
    }

    private static ServerCallContext context(String... requested) {
        return new ServerCallContext(UnauthenticatedUser.INSTANCE, Map.of(), Set.of(requested));
    }

    @Test
    void testParsesCommaSeparatedHeaderValues() {
        Set<String> parsed = A2AExtensions.getRequestedExtensions(
                Arrays.asList(TRACING + ", " + BILLING, null, " ", TRACING));
        assertEquals(List.of(TRACING, BILLING), List.copyOf(parsed));
        assertTrue(A2AExtensions.getRequestedExtensions(null).isEmpty());
    }

    @Test
    void testMissingRequiredExtensionIsRejected() {
        AgentCard card = card(new AgentExtension(TRACING, true), new AgentExtension(BILLING, false));

        ExtensionSupportRequiredError e = assertThrows(ExtensionSupportRequiredError.class,
                () -> A2AExtensions.validateRequiredExtensions(card, context(BILLING)));
        assertEquals(List.of(TRACING), e.getDetails().get("extensions"));
        assertThrows(ExtensionSupportRequiredError.class,
                () -> A2AExtensions.validateRequiredExtensions(card, null));
    }

    @Test
    void testKnownRequestedExtensionsAreActivated() {
        AgentCard card = card(new AgentExtension(TRACING, true), new AgentExtension(BILLING, false));
        ServerCallContext context = context(TRACING, "https://example.com/ext/unknown");

        A2AExtensions.validateRequiredExtensions(card, context);

        assertEquals(Set.of(TRACING), context.getActivatedExtensions());
        assertTrue(context.isExtensionActive(TRACING));
    }

    @Test
    void testOptionalExtensionsNeedNotBeRequested() {
        AgentCard card = card(new AgentExtension(BILLING, false));
        assertDoesNotThrow(() -> A2AExtensions.validateRequiredExtensions(card, context()));
        assertDoesNotThrow(() -> A2AExtensions.validateRequiredExtensions(card(), null));
    }

    @Test
    void testFindExtensionMatchesExactUri() {
        AgentCard card = card(new AgentExtension(TRACING, false));
        assertNotNull(A2AExtensions.findExtensionByUri(card, TRACING));
        assertNull(A2AExtensions.findExtensionByUri(card, TRACING + "/"));
    }
}
