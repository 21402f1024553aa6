package io.taskrelay.server.agentcard;

import io.taskrelay.spec.AgentCardSignature;

/**
 * Verifies detached agent card signatures. Key management and the signature algorithms live
 * outside this library; implementations typically wrap a JWS library.
 */
@FunctionalInterface
public interface AgentCardSignatureVerifier {

    /**
     * @param signature the detached signature from the card
     * @param canonicalPayload the card's canonical form, see {@link AgentCardCanonicalizer}
     * @return whether the signature is valid for the payload
     */
    boolean verify(AgentCardSignature signature, byte[] canonicalPayload);
}
