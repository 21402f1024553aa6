package io.taskrelay.server.util;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import io.taskrelay.spec.Artifact;
import io.taskrelay.spec.DataPart;
import io.taskrelay.spec.Part;
import io.taskrelay.spec.TextPart;
import org.jspecify.annotations.Nullable;

/**
 * Factory methods for artifacts with generated ids.
 */
public final class ArtifactUtils {

    private ArtifactUtils() {
    }

    public static Artifact newArtifact(List<Part<?>> parts, @Nullable String name, @Nullable String description) {
        return Artifact.builder()
                .artifactId(UUID.randomUUID().toString())
                .name(name)
                .description(description)
                .parts(parts)
                .build();
    }

    public static Artifact newArtifact(List<Part<?>> parts, @Nullable String name) {
        return newArtifact(parts, name, null);
    }

    public static Artifact newTextArtifact(String name, String text, @Nullable String description) {
        return newArtifact(List.of(new TextPart(text)), name, description);
    }

    public static Artifact newTextArtifact(String name, String text) {
        return newTextArtifact(name, text, null);
    }

    public static Artifact newDataArtifact(String name, Map<String, Object> data, @Nullable String description) {
        return newArtifact(List.of(new DataPart(data)), name, description);
    }

    public static Artifact newDataArtifact(String name, Map<String, Object> data) {
        return newDataArtifact(name, data, null);
    }
}
