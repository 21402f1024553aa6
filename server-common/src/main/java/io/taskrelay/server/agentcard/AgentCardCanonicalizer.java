package io.taskrelay.server.agentcard;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.taskrelay.spec.AgentCard;
import io.taskrelay.util.Utils;
import org.jspecify.annotations.Nullable;

/**
 * Produces the canonical JSON form of an agent card that detached signatures are computed
 * over: object keys sorted, no insignificant whitespace, the {@code signatures} member
 * removed, and members that are null, empty or {@code false} omitted.
 * <p>
 * Two cards that differ only in member order or in omitted defaults canonicalize to the same
 * bytes.
 */
public final class AgentCardCanonicalizer {

    static final String SIGNATURES = "signatures";

    private AgentCardCanonicalizer() {
    }

    public static String canonicalize(AgentCard card) {
        JsonNode tree = Utils.OBJECT_MAPPER.valueToTree(card);
        if (tree instanceof ObjectNode objectNode) {
            objectNode.remove(SIGNATURES);
        }
        JsonNode canonical = normalize(tree);
        try {
            return Utils.OBJECT_MAPPER.writeValueAsString(canonical == null ? JsonNodeFactory.instance.objectNode() : canonical);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot write canonical form of agent card " + card.name(), e);
        }
    }

    public static byte[] canonicalBytes(AgentCard card) {
        return canonicalize(card).getBytes(StandardCharsets.UTF_8);
    }

    // null for members that must be omitted
    private static @Nullable JsonNode normalize(JsonNode node) {
        if (node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isBoolean()) {
            return node.booleanValue() ? node : null;
        }
        if (node.isTextual()) {
            return node.textValue().isEmpty() ? null : node;
        }
        if (node.isArray()) {
            ArrayNode array = JsonNodeFactory.instance.arrayNode();
            for (JsonNode element : node) {
                JsonNode normalized = normalize(element);
                // positions inside arrays are significant
                array.add(normalized == null ? JsonNodeFactory.instance.nullNode() : normalized);
            }
            return array.isEmpty() ? null : array;
        }
        if (node.isObject()) {
            List<String> names = new ArrayList<>();
            Iterator<String> fieldNames = node.fieldNames();
            fieldNames.forEachRemaining(names::add);
            names.sort(null);
            ObjectNode sorted = JsonNodeFactory.instance.objectNode();
            for (String name : names) {
                JsonNode normalized = normalize(node.get(name));
                if (normalized != null) {
                    sorted.set(name, normalized);
                }
            }
            return sorted.isEmpty() ? null : sorted;
        }
        return node;
    }
}
