package io.taskrelay.server.tasks;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import io.taskrelay.spec.Artifact;
import io.taskrelay.spec.InvalidAgentResponseError;
import io.taskrelay.spec.Message;
import io.taskrelay.spec.Part;
import io.taskrelay.spec.Task;
import io.taskrelay.spec.TaskArtifactUpdateEvent;
import io.taskrelay.spec.TaskState;
import io.taskrelay.spec.TaskStatus;
import io.taskrelay.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * The agent's handle on the task it works on.
 * <p>
 * Every call is applied atomically by the {@link TaskManager}: it is validated against the
 * state machine, persisted and published to subscribers and webhooks before it returns.
 * Calls that the state machine rejects, for example completing a task that a client
 * canceled in the meantime, throw {@link InvalidAgentResponseError} and change nothing.
 */
public class AgentEmitter {

    private final TaskManager taskManager;
    private final String taskId;
    private final String contextId;

    public AgentEmitter(TaskManager taskManager, String taskId, String contextId) {
        this.taskManager = Assert.checkNotNullParam("taskManager", taskManager);
        this.taskId = Assert.checkNotNullParam("taskId", taskId);
        this.contextId = Assert.checkNotNullParam("contextId", contextId);
    }

    public String getTaskId() {
        return taskId;
    }

    public String getContextId() {
        return contextId;
    }

    public Task startWork() {
        return startWork(null);
    }

    public Task startWork(@Nullable Message message) {
        return updateStatus(TaskState.TASK_STATE_WORKING, message);
    }

    /**
     * Adds a complete artifact, for example one built with
     * {@link io.taskrelay.server.util.ArtifactUtils}.
     */
    public Task addArtifact(Artifact artifact) {
        return taskManager.addArtifact(new TaskArtifactUpdateEvent(taskId, contextId, artifact));
    }

    /**
     * Adds a complete artifact with a generated id.
     */
    public Task addArtifact(List<Part<?>> parts, @Nullable String name) {
        return addArtifact(parts, null, name, null);
    }

    public Task addArtifact(List<Part<?>> parts, @Nullable String artifactId, @Nullable String name,
                            @Nullable Map<String, Object> metadata) {
        return addArtifact(parts, artifactId, name, metadata, null, null);
    }

    /**
     * Adds an artifact or one chunk of it.
     *
     * @param artifactId the artifact id; generated if {@code null}
     * @param append {@code true} to append the parts to an artifact already sent
     * @param lastChunk {@code true} if no further chunks follow
     */
    public Task addArtifact(List<Part<?>> parts, @Nullable String artifactId, @Nullable String name,
                            @Nullable Map<String, Object> metadata, @Nullable Boolean append,
                            @Nullable Boolean lastChunk) {
        Artifact artifact = Artifact.builder()
                .artifactId(artifactId == null ? UUID.randomUUID().toString() : artifactId)
                .name(name)
                .parts(parts)
                .metadata(metadata)
                .build();
        return taskManager.addArtifact(new TaskArtifactUpdateEvent(taskId, contextId, artifact, append, lastChunk, null));
    }

    public Task requiresInput(Message message) {
        return updateStatus(TaskState.TASK_STATE_INPUT_REQUIRED, message);
    }

    public Task requiresAuth(Message message) {
        return updateStatus(TaskState.TASK_STATE_AUTH_REQUIRED, message);
    }

    public Task complete() {
        return complete(null);
    }

    public Task complete(@Nullable Message message) {
        return updateStatus(TaskState.TASK_STATE_COMPLETED, message);
    }

    public Task fail() {
        return fail(null);
    }

    public Task fail(@Nullable Message message) {
        return updateStatus(TaskState.TASK_STATE_FAILED, message);
    }

    public Task reject(@Nullable Message message) {
        return updateStatus(TaskState.TASK_STATE_REJECTED, message);
    }

    public Task cancel() {
        return taskManager.cancel(taskId).task();
    }

    /**
     * Publishes an agent message on the task's streams without changing the task.
     */
    public void sendMessage(Message message) {
        taskManager.emitMessage(taskId, withIds(message));
    }

    /**
     * Creates an agent message bound to this task.
     */
    public Message newAgentMessage(List<Part<?>> parts, @Nullable Map<String, Object> metadata) {
        return Message.builder()
                .role(Message.Role.ROLE_AGENT)
                .taskId(taskId)
                .contextId(contextId)
                .parts(parts)
                .metadata(metadata)
                .build();
    }

    private Task updateStatus(TaskState state, @Nullable Message message) {
        return taskManager.updateStatus(taskId, new TaskStatus(state, message == null ? null : withIds(message)), null);
    }

    private Message withIds(Message message) {
        if (taskId.equals(message.taskId()) && contextId.equals(message.contextId())) {
            return message;
        }
        return Message.builder(message).taskId(taskId).contextId(contextId).build();
    }
}
