package io.taskrelay.spec;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import io.taskrelay.util.Assert;
import io.taskrelay.util.Utils;
import org.jspecify.annotations.Nullable;

/**
 * A single turn of communication between a client and an agent.
 * <p>
 * A message carries ordered {@link Part}s and may reference the task and context it
 * belongs to. A user message without a {@code taskId} starts new work; with a
 * {@code taskId} it continues an existing task (for example answering an
 * {@code input-required} question).
 *
 * @param role who sent the message
 * @param parts the ordered content (at least one part for inbound messages)
 * @param messageId unique identifier chosen by the sender
 * @param contextId optional conversation grouping
 * @param taskId optional task this message belongs to
 * @param referenceTaskIds optional related tasks
 * @param metadata optional arbitrary metadata
 * @param extensions optional URIs of extensions this message uses
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Message(Role role, List<Part<?>> parts, String messageId, @Nullable String contextId,
                      @Nullable String taskId, @Nullable List<String> referenceTaskIds,
                      @Nullable Map<String, Object> metadata, @Nullable List<String> extensions)
        implements EventKind, StreamingEventKind {

    public Message {
        Assert.checkNotNullParam("role", role);
        Assert.checkNotNullParam("parts", parts);
        Assert.checkNotNullParam("messageId", messageId);
        parts = List.copyOf(parts);
        referenceTaskIds = referenceTaskIds == null ? null : List.copyOf(referenceTaskIds);
        metadata = Utils.copyOfNullable(metadata);
        extensions = extensions == null ? null : List.copyOf(extensions);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(Message message) {
        return new Builder(message);
    }

    /**
     * The sender of a message.
     */
    public enum Role {
        ROLE_USER("user"),
        ROLE_AGENT("agent");

        private final String role;

        Role(String role) {
            this.role = role;
        }

        @JsonValue
        public String asString() {
            return role;
        }

        @JsonCreator
        public static Role fromString(String role) {
            for (Role value : values()) {
                if (value.role.equals(role) || value.name().equals(role)) {
                    return value;
                }
            }
            throw new IllegalArgumentException("Invalid Role: " + role);
        }
    }

    public static class Builder {
        private @Nullable Role role;
        private @Nullable List<Part<?>> parts;
        private @Nullable String messageId;
        private @Nullable String contextId;
        private @Nullable String taskId;
        private @Nullable List<String> referenceTaskIds;
        private @Nullable Map<String, Object> metadata;
        private @Nullable List<String> extensions;

        private Builder() {
        }

        private Builder(Message message) {
            role = message.role;
            parts = message.parts;
            messageId = message.messageId;
            contextId = message.contextId;
            taskId = message.taskId;
            referenceTaskIds = message.referenceTaskIds;
            metadata = message.metadata;
            extensions = message.extensions;
        }

        public Builder role(Role role) {
            this.role = role;
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

        public Builder messageId(String messageId) {
            this.messageId = messageId;
            return this;
        }

        public Builder contextId(@Nullable String contextId) {
            this.contextId = contextId;
            return this;
        }

        public Builder taskId(@Nullable String taskId) {
            this.taskId = taskId;
            return this;
        }

        public Builder referenceTaskIds(@Nullable List<String> referenceTaskIds) {
            this.referenceTaskIds = referenceTaskIds;
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

        /**
         * Builds the message, generating a random {@code messageId} when none was set.
         *
         * @return the message
         */
        public Message build() {
            return new Message(
                    Assert.checkNotNullParam("role", role),
                    Assert.checkNotNullParam("parts", parts),
                    messageId == null ? UUID.randomUUID().toString() : messageId,
                    contextId,
                    taskId,
                    referenceTaskIds,
                    metadata,
                    extensions);
        }
    }
}
