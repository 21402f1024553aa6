package io.taskrelay.server.extensions;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import io.taskrelay.server.ServerCallContext;
import io.taskrelay.spec.AgentCard;
import io.taskrelay.spec.AgentExtension;
import io.taskrelay.spec.ExtensionSupportRequiredError;
import org.jspecify.annotations.Nullable;

/**
 * Negotiates protocol extensions between the caller and the agent.
 * <p>
 * Extensions are matched by exact URI. Requested extensions the agent does not declare are
 * ignored; the extensions both sides know are recorded as activated on the call context.
 */
public final class A2AExtensions {

    private A2AExtensions() {
    }

    /**
     * Parses the values of the {@code A2A-Extensions} header. Each value may hold a comma
     * separated list.
     *
     * @param values the header values, may be {@code null}
     * @return the requested extension URIs, in request order
     */
    public static Set<String> getRequestedExtensions(@Nullable List<String> values) {
        Set<String> extensions = new LinkedHashSet<>();
        if (values == null) {
            return extensions;
        }
        for (String value : values) {
            if (value == null) {
                continue;
            }
            for (String uri : value.split(",")) {
                String trimmed = uri.trim();
                if (!trimmed.isEmpty()) {
                    extensions.add(trimmed);
                }
            }
        }
        return extensions;
    }

    /**
     * Fails the request if the agent requires an extension the caller did not request, then
     * records the activated extensions on {@code context}.
     *
     * @throws ExtensionSupportRequiredError naming the missing required extensions
     */
    public static void validateRequiredExtensions(AgentCard agentCard, @Nullable ServerCallContext context)
            throws ExtensionSupportRequiredError {
        Set<String> requested = context == null ? Set.of() : context.getRequestedExtensions();
        List<String> missing = new ArrayList<>();
        for (AgentExtension extension : agentCard.capabilities().extensionsOrEmpty()) {
            if (extension.required() && !requested.contains(extension.uri())) {
                missing.add(extension.uri());
            }
        }
        if (!missing.isEmpty()) {
            throw ExtensionSupportRequiredError.forExtensions(missing);
        }
        if (context != null) {
            for (AgentExtension extension : agentCard.capabilities().extensionsOrEmpty()) {
                if (requested.contains(extension.uri())) {
                    context.activateExtension(extension.uri());
                }
            }
        }
    }

    /**
     * @return the extension declared by the agent with this URI, or {@code null}
     */
    public static @Nullable AgentExtension findExtensionByUri(AgentCard agentCard, String uri) {
        for (AgentExtension extension : agentCard.capabilities().extensionsOrEmpty()) {
            if (extension.uri().equals(uri)) {
                return extension;
            }
        }
        return null;
    }
}
