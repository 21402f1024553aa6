package io.taskrelay.server.agentcard;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

import io.taskrelay.spec.AgentCard;
import io.taskrelay.spec.AgentCardSignature;
import io.taskrelay.spec.AgentInterface;
import io.taskrelay.spec.AgentSkill;
import io.taskrelay.spec.SecurityRequirement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Structural checks of an agent card before it is published, and verification of its
 * detached signatures.
 */
public final class AgentCardValidator {

    private static final Logger LOGGER = LoggerFactory.getLogger(AgentCardValidator.class);

    private static final Pattern MAJOR_MINOR = Pattern.compile("^\\d+\\.\\d+$");
    private static final Set<String> KNOWN_BINDINGS = Set.of("JSONRPC", "GRPC", "HTTP+JSON");

    private AgentCardValidator() {
    }

    /**
     * @throws IllegalArgumentException listing every problem found
     */
    public static void validate(AgentCard card) {
        List<String> problems = findProblems(card);
        if (!problems.isEmpty()) {
            throw new IllegalArgumentException("Invalid agent card '" + card.name() + "': " + String.join("; ", problems));
        }
    }

    public static List<String> findProblems(AgentCard card) {
        List<String> problems = new ArrayList<>();
        if (card.name().isBlank()) {
            problems.add("name is blank");
        }
        if (!isHttpUrl(card.url())) {
            problems.add("url must be an absolute http(s) URL");
        }
        if (card.protocolVersions().isEmpty()) {
            problems.add("protocolVersions is empty");
        }
        for (String version : card.protocolVersions()) {
            if (!MAJOR_MINOR.matcher(version).matches()) {
                problems.add("protocol version '" + version + "' is not Major.Minor");
            }
        }
        for (AgentInterface agentInterface : card.supportedInterfaces()) {
            if (!KNOWN_BINDINGS.contains(agentInterface.protocolBinding().toUpperCase(Locale.ROOT))) {
                LOGGER.debug("Agent card {} declares custom binding {}", card.name(), agentInterface.protocolBinding());
            }
            if (!isHttpUrl(agentInterface.url())) {
                problems.add("interface " + agentInterface.protocolBinding() + " has an invalid url");
            }
        }
        Set<String> skillIds = new HashSet<>();
        for (AgentSkill skill : card.skills()) {
            if (!skillIds.add(skill.id())) {
                problems.add("duplicate skill id '" + skill.id() + "'");
            }
        }
        for (SecurityRequirement requirement : card.securityRequirements()) {
            for (String scheme : requirement.schemes().keySet()) {
                if (!card.securitySchemes().containsKey(scheme)) {
                    problems.add("security requirement references undeclared scheme '" + scheme + "'");
                }
            }
        }
        return problems;
    }

    /**
     * @return {@code true} if the card carries at least one signature and every signature verifies
     */
    public static boolean verifySignatures(AgentCard card, AgentCardSignatureVerifier verifier) {
        if (card.signatures().isEmpty()) {
            return false;
        }
        byte[] payload = AgentCardCanonicalizer.canonicalBytes(card);
        for (AgentCardSignature signature : card.signatures()) {
            if (!verifier.verify(signature, payload)) {
                LOGGER.warn("Signature of agent card {} failed verification", card.name());
                return false;
            }
        }
        return true;
    }

    private static boolean isHttpUrl(String url) {
        try {
            URI uri = new URI(url);
            String scheme = uri.getScheme();
            return uri.getHost() != null
                    && ("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme));
        } catch (URISyntaxException e) {
            return false;
        }
    }
}
