package io.taskrelay.spec;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import io.taskrelay.util.Assert;
import io.taskrelay.util.Utils;
import org.jspecify.annotations.Nullable;

/**
 * A protocol extension declared by an agent.
 *
 * @param uri identifies the extension; matching is by exact string
 * @param description optional description
 * @param required whether callers must request the extension
 * @param params optional extension specific configuration
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record AgentExtension(String uri, @Nullable String description, boolean required,
                             @Nullable Map<String, Object> params) {

    public AgentExtension {
        Assert.checkNotNullParam("uri", uri);
        params = Utils.copyOfNullable(params);
    }

    public AgentExtension(String uri, boolean required) {
        this(uri, null, required, null);
    }
}
