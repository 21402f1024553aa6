package io.taskrelay.spec;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.taskrelay.util.Assert;
import io.taskrelay.util.Utils;
import org.jspecify.annotations.Nullable;

/**
 * A detached JWS over the canonical form of an {@link AgentCard}.
 *
 * @param protectedHeader the base64url encoded protected JWS header
 * @param signature the base64url encoded signature
 * @param header optional unprotected header
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AgentCardSignature(String protectedHeader, String signature, @Nullable Map<String, Object> header) {

    public AgentCardSignature {
        Assert.checkNotNullParam("protectedHeader", protectedHeader);
        Assert.checkNotNullParam("signature", signature);
        header = Utils.copyOfNullable(header);
    }
}
