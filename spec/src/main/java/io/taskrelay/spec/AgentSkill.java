package io.taskrelay.spec;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import io.taskrelay.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * A capability an agent advertises.
 *
 * @param id unique identifier of the skill
 * @param name human readable name
 * @param description what the skill does
 * @param tags keywords
 * @param examples example prompts
 * @param inputModes media types the skill accepts, overriding the card defaults
 * @param outputModes media types the skill produces, overriding the card defaults
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonIgnoreProperties(ignoreUnknown = true)
public record AgentSkill(String id, String name, String description, List<String> tags,
                         @Nullable List<String> examples, @Nullable List<String> inputModes,
                         @Nullable List<String> outputModes) {

    public AgentSkill {
        Assert.checkNotNullParam("id", id);
        Assert.checkNotNullParam("name", name);
        Assert.checkNotNullParam("description", description);
        tags = tags == null ? List.of() : List.copyOf(tags);
        examples = examples == null ? null : List.copyOf(examples);
        inputModes = inputModes == null ? null : List.copyOf(inputModes);
        outputModes = outputModes == null ? null : List.copyOf(outputModes);
    }

    public AgentSkill(String id, String name, String description) {
        this(id, name, description, List.of(), null, null, null);
    }
}
