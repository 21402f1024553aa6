package io.taskrelay.spec;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import io.taskrelay.util.Assert;
import io.taskrelay.util.Utils;
import org.jspecify.annotations.Nullable;

/**
 * An output produced by an agent for a task.
 * <p>
 * Artifacts are append-only: once an artifact id exists on a task its parts are never
 * replaced, only extended by further chunks.
 *
 * @param artifactId unique identifier within the task
 * @param name optional human readable name
 * @param description optional description
 * @param parts the ordered content
 * @param metadata optional metadata
 * @param extensions optional URIs of extensions that contributed to this artifact
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Artifact(String artifactId, @Nullable String name, @Nullable String description,
                       List<Part<?>> parts, @Nullable Map<String, Object> metadata,
                       @Nullable List<String> extensions) {

    public Artifact {
        Assert.checkNotNullParam("artifactId", artifactId);
        Assert.checkNotNullParam("parts", parts);
        parts = List.copyOf(parts);
        metadata = Utils.copyOfNullable(metadata);
        extensions = extensions == null ? null : List.copyOf(extensions);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(Artifact artifact) {
        return new Builder()
                .artifactId(artifact.artifactId)
                .name(artifact.name)
                .description(artifact.description)
                .parts(artifact.parts)
                .metadata(artifact.metadata)
                .extensions(artifact.extensions);
    }

    public static class Builder {
        private @Nullable String artifactId;
        private @Nullable String name;
        private @Nullable String description;
        private @Nullable List<Part<?>> parts;
        private @Nullable Map<String, Object> metadata;
        private @Nullable List<String> extensions;

        private Builder() {
        }

        public Builder artifactId(String artifactId) {
            this.artifactId = artifactId;
            return this;
        }

        public Builder name(@Nullable String name) {
            this.name = name;
            return this;
        }

        public Builder description(@Nullable String description) {
            this.description = description;
            return this;
        }

        public Builder parts(List<Part<?>> parts) {
            this.parts = parts;
            return this;
        }

        public Builder parts(Part<?>... parts) {
            this.parts = Arrays.asList(parts);
            return this;
        }

        public Builder metadata(@Nullable Map<String, Object> metadata) {
            this.metadata = metadata;
            return this;
        }

        public Builder extensions(@Nullable List<String> extensions) {
            this.extensions = extensions;
            return this;
        }

        public Artifact build() {
            return new Artifact(
                    Assert.checkNotNullParam("artifactId", artifactId),
                    name,
                    description,
                    Assert.checkNotNullParam("parts", parts),
                    metadata,
                    extensions);
        }
    }
}
