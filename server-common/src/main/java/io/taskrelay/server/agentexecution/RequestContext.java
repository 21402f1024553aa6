package io.taskrelay.server.agentexecution;

import java.util.List;
import java.util.stream.Collectors;

import io.taskrelay.server.ServerCallContext;
import io.taskrelay.spec.Message;
import io.taskrelay.spec.MessageSendConfiguration;
import io.taskrelay.spec.Task;
import io.taskrelay.spec.TextPart;
import io.taskrelay.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * What an {@link AgentExecutor} is asked to work on: the incoming message, the task it
 * belongs to and the tasks it references.
 */
public class RequestContext {

    private final String taskId;
    private final String contextId;
    private final @Nullable Message message;
    private final @Nullable Task task;
    private final List<Task> relatedTasks;
    private final @Nullable MessageSendConfiguration configuration;
    private final @Nullable ServerCallContext callContext;

    private RequestContext(Builder builder) {
        this.taskId = Assert.checkNotNullParam("taskId", builder.taskId);
        this.contextId = Assert.checkNotNullParam("contextId", builder.contextId);
        this.message = builder.message;
        this.task = builder.task;
        this.relatedTasks = List.copyOf(builder.relatedTasks);
        this.configuration = builder.configuration;
        this.callContext = builder.callContext;
    }

    public String getTaskId() {
        return taskId;
    }

    public String getContextId() {
        return contextId;
    }

    /**
     * @return the message that triggered this execution, {@code null} for cancellation
     */
    public @Nullable Message getMessage() {
        return message;
    }

    /**
     * @return the task as it was when the agent was invoked
     */
    public @Nullable Task getTask() {
        return task;
    }

    /**
     * @return the tasks named in the message's {@code referenceTaskIds}
     */
    public List<Task> getRelatedTasks() {
        return relatedTasks;
    }

    public @Nullable MessageSendConfiguration getConfiguration() {
        return configuration;
    }

    public @Nullable ServerCallContext getCallContext() {
        return callContext;
    }

    /**
     * @param delimiter placed between text parts
     * @return the text parts of the message joined with {@code delimiter}, empty if there is no message
     */
    public String getUserInput(String delimiter) {
        if (message == null) {
            return "";
        }
        return message.parts().stream()
                .filter(part -> part instanceof TextPart)
                .map(part -> ((TextPart) part).text())
                .collect(Collectors.joining(delimiter));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private @Nullable String taskId;
        private @Nullable String contextId;
        private @Nullable Message message;
        private @Nullable Task task;
        private List<Task> relatedTasks = List.of();
        private @Nullable MessageSendConfiguration configuration;
        private @Nullable ServerCallContext callContext;

        public Builder taskId(String taskId) {
            this.taskId = taskId;
            return this;
        }

        public Builder contextId(String contextId) {
            this.contextId = contextId;
            return this;
        }

        public Builder message(@Nullable Message message) {
            this.message = message;
            return this;
        }

        public Builder task(@Nullable Task task) {
            this.task = task;
            return this;
        }

        public Builder relatedTasks(List<Task> relatedTasks) {
            this.relatedTasks = relatedTasks;
            return this;
        }

        public Builder configuration(@Nullable MessageSendConfiguration configuration) {
            this.configuration = configuration;
            return this;
        }

        public Builder callContext(@Nullable ServerCallContext callContext) {
            this.callContext = callContext;
            return this;
        }

        public RequestContext build() {
            return new RequestContext(this);
        }
    }
}
