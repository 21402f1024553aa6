package io.taskrelay.server.version;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import io.taskrelay.server.ServerCallContext;
import io.taskrelay.spec.AgentCard;
import io.taskrelay.spec.VersionNotSupportedError;
import io.taskrelay.util.Utils;
import org.jspecify.annotations.Nullable;

/**
 * Checks the protocol version a caller declared (the {@code A2A-Version} header) against the
 * versions the agent card lists.
 * <p>
 * Versions are compared on {@code Major.Minor}; a patch component is ignored. A caller that
 * declares nothing is assumed to speak the server's default version. There is no fallback to
 * another version.
 */
public final class A2AVersionValidator {

    private static final Pattern VERSION = Pattern.compile("^(\\d+)\\.(\\d+)(?:\\.\\d+)?$");

    private A2AVersionValidator() {
    }

    public static String validateProtocolVersion(AgentCard agentCard, @Nullable ServerCallContext context)
            throws VersionNotSupportedError {
        return validateProtocolVersion(agentCard, context, Utils.SPEC_VERSION_1_0);
    }

    /**
     * @param defaultVersion the version assumed when the caller declares none
     * @return the negotiated {@code Major.Minor} version
     * @throws VersionNotSupportedError if the version is malformed or not supported by the agent
     */
    public static String validateProtocolVersion(AgentCard agentCard, @Nullable ServerCallContext context,
                                                 String defaultVersion) throws VersionNotSupportedError {
        String requested = context == null ? null : context.getRequestedProtocolVersion();
        if (requested == null || requested.isBlank()) {
            requested = defaultVersion;
        }
        String normalized = majorMinor(requested.trim());
        if (normalized != null) {
            for (String supported : agentCard.protocolVersions()) {
                if (normalized.equals(majorMinor(supported.trim()))) {
                    return normalized;
                }
            }
        }
        throw new VersionNotSupportedError("Protocol version " + requested + " is not supported",
                Map.of("requestedVersion", requested, "supportedVersions", agentCard.protocolVersions()));
    }

    static @Nullable String majorMinor(String version) {
        Matcher matcher = VERSION.matcher(version);
        if (!matcher.matches()) {
            return null;
        }
        try {
            return Integer.parseInt(matcher.group(1)) + "." + Integer.parseInt(matcher.group(2));
        } catch (NumberFormatException e) {
            // out of int range
            return null;
        }
    }
}
