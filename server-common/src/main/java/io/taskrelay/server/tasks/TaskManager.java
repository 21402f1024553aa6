package io.taskrelay.server.tasks;

import static io.taskrelay.util.Assert.checkNotNullParam;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.taskrelay.server.auth.AuthorizationScope;
import io.taskrelay.server.events.EventQueue;
import io.taskrelay.server.events.QueueManager;
import io.taskrelay.spec.Artifact;
import io.taskrelay.spec.InvalidAgentResponseError;
import io.taskrelay.spec.Message;
import io.taskrelay.spec.Part;
import io.taskrelay.spec.StreamingEventKind;
import io.taskrelay.spec.Task;
import io.taskrelay.spec.TaskArtifactUpdateEvent;
import io.taskrelay.spec.TaskNotCancelableError;
import io.taskrelay.spec.TaskNotFoundError;
import io.taskrelay.spec.TaskState;
import io.taskrelay.spec.TaskStatus;
import io.taskrelay.spec.TaskStatusUpdateEvent;
import io.taskrelay.spec.UnsupportedOperationError;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies every change to a task as one atomic unit.
 * <p>
 * A mutation runs under the task's lock and, in this order, checks the state transition,
 * writes the task to the {@link TaskStore}, appends the resulting event to the task's main
 * {@link EventQueue} and hands the event to the {@link PushNotificationSender}. Two
 * mutations of the same task never interleave, so the store, the live streams and the
 * webhooks observe one total order; different tasks never contend.
 * <p>
 * A rejected mutation leaves the task untouched.
 */
@ApplicationScoped
public class TaskManager {

    private static final Logger LOGGER = LoggerFactory.getLogger(TaskManager.class);

    private final TaskStore taskStore;
    private final QueueManager queueManager;
    private final PushNotificationSender pushSender;
    private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    // artifact ids whose last chunk has been received, per task
    private final ConcurrentMap<String, Set<String>> closedArtifacts = new ConcurrentHashMap<>();

    @Inject
    public TaskManager(TaskStore taskStore, QueueManager queueManager, PushNotificationSender pushSender) {
        this.taskStore = checkNotNullParam("taskStore", taskStore);
        this.queueManager = checkNotNullParam("queueManager", queueManager);
        this.pushSender = checkNotNullParam("pushSender", pushSender);
    }

    /**
     * Runs an action while holding the task's lock. The lock is reentrant, so the action may
     * call the other methods of this class.
     */
    public <T> T withLock(String taskId, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(taskId, id -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public @Nullable Task getTask(String taskId) {
        return taskStore.get(taskId);
    }

    /**
     * Creates a task in the {@code submitted} state with {@code message} as its first history entry.
     */
    public Task createTask(String taskId, String contextId, Message message, AuthorizationScope owner) {
        return withLock(taskId, () -> {
            Task existing = taskStore.get(taskId);
            TaskStateMachine.checkTransition(taskId, existing == null ? null : existing.status().state(),
                    TaskState.TASK_STATE_SUBMITTED);
            Task task = Task.builder()
                    .id(taskId)
                    .contextId(contextId)
                    .status(new TaskStatus(TaskState.TASK_STATE_SUBMITTED))
                    .history(List.of(message))
                    .artifacts(List.of())
                    .build();
            taskStore.save(task, owner);
            LOGGER.info("Created task {} in context {}", taskId, contextId);
            emit(task);
            return task;
        });
    }

    /**
     * Records a new user message on an existing task. An interrupted task moves back to
     * {@code working}.
     *
     * @throws UnsupportedOperationError if the task is in a final state
     */
    public Task appendMessage(String taskId, Message message) {
        return withLock(taskId, () -> {
            Task task = requireTask(taskId);
            TaskState state = task.status().state();
            if (state.isFinal()) {
                throw new UnsupportedOperationError("Task " + taskId + " is in final state " + state.asString()
                        + " and accepts no further messages", Map.of("taskId", taskId, "state", state.asString()));
            }
            List<Message> history = new ArrayList<>(task.historyOrEmpty());
            TaskStatus status = task.status();
            if (status.message() != null) {
                history.add(status.message());
                status = new TaskStatus(status.state(), null, status.timestamp());
            }
            history.add(message);
            Task updated = Task.builder(task).status(status).history(history).build();
            taskStore.save(updated, ownerOf(taskId));
            if (state.isInterrupted()) {
                return updateStatus(taskId, new TaskStatus(TaskState.TASK_STATE_WORKING), null);
            }
            return updated;
        });
    }

    /**
     * Moves a task to a new status.
     *
     * @throws InvalidAgentResponseError if the transition is illegal
     */
    public Task updateStatus(String taskId, TaskStatus status, @Nullable Map<String, Object> metadata) {
        return withLock(taskId, () -> {
            Task task = requireTask(taskId);
            TaskStateMachine.checkTransition(taskId, task.status().state(), status.state());

            Task.Builder builder = Task.builder(task).status(status);
            if (task.status().message() != null) {
                List<Message> history = new ArrayList<>(task.historyOrEmpty());
                history.add(task.status().message());
                builder.history(history);
            }
            if (metadata != null) {
                Map<String, Object> merged = task.metadata() == null ? new HashMap<>() : new HashMap<>(task.metadata());
                merged.putAll(metadata);
                builder.metadata(merged);
            }
            Task updated = builder.build();
            taskStore.save(updated, ownerOf(taskId));
            LOGGER.debug("Task {} moved from {} to {}", taskId, task.status().state().asString(), status.state().asString());
            emit(new TaskStatusUpdateEvent(taskId, task.contextId(), status, status.state().isFinal(), metadata));
            if (status.state().isFinal()) {
                finish(taskId, status.state());
            }
            return updated;
        });
    }

    /**
     * Adds an artifact, or appends a chunk to an artifact already present.
     *
     * @throws InvalidAgentResponseError if the task is final, the artifact was already completed,
     *         or the event would replace an existing artifact
     */
    public Task addArtifact(TaskArtifactUpdateEvent event) {
        String taskId = event.taskId();
        return withLock(taskId, () -> {
            Task task = requireTask(taskId);
            if (task.status().state().isFinal()) {
                throw new InvalidAgentResponseError("Task " + taskId + " is in final state "
                        + task.status().state().asString() + " and accepts no artifacts");
            }
            Artifact incoming = event.artifact();
            String artifactId = incoming.artifactId();
            Set<String> closed = closedArtifacts.computeIfAbsent(taskId, id -> ConcurrentHashMap.newKeySet());
            if (closed.contains(artifactId)) {
                throw new InvalidAgentResponseError("Artifact " + artifactId + " of task " + taskId
                        + " already received its last chunk");
            }

            List<Artifact> artifacts = new ArrayList<>(task.artifactsOrEmpty());
            int existingIndex = indexOf(artifacts, artifactId);
            if (existingIndex < 0) {
                artifacts.add(incoming);
            } else if (event.isAppend()) {
                artifacts.set(existingIndex, appendParts(artifacts.get(existingIndex), incoming));
            } else {
                throw new InvalidAgentResponseError("Artifact " + artifactId + " of task " + taskId
                        + " already exists; send further parts with append=true");
            }
            if (event.isLastChunk()) {
                closed.add(artifactId);
            }

            Task updated = Task.builder(task).artifacts(artifacts).build();
            taskStore.save(updated, ownerOf(taskId));
            emit(event);
            return updated;
        });
    }

    /**
     * Cancels a task. Cancelling a task that is already canceled returns it unchanged.
     *
     * @throws TaskNotFoundError if there is no such task
     * @throws TaskNotCancelableError if the task reached another final state
     */
    public CancelResult cancel(String taskId) {
        return withLock(taskId, () -> {
            Task task = requireTask(taskId);
            TaskState state = task.status().state();
            if (state == TaskState.TASK_STATE_CANCELED) {
                return new CancelResult(task, false);
            }
            if (state.isFinal()) {
                throw new TaskNotCancelableError("Task " + taskId + " is in final state " + state.asString(),
                        Map.of("taskId", taskId, "state", state.asString()));
            }
            Task canceled = updateStatus(taskId, new TaskStatus(TaskState.TASK_STATE_CANCELED), null);
            LOGGER.info("Canceled task {}", taskId);
            return new CancelResult(canceled, true);
        });
    }

    /**
     * Captures the current task and registers a subscriber queue in one atomic step, so the
     * subscriber receives every event generated after the snapshot exactly once.
     *
     * @throws UnsupportedOperationError if the task is in a final state
     */
    public Subscription subscribe(String taskId) {
        return withLock(taskId, () -> {
            Task task = requireTask(taskId);
            if (task.status().state().isFinal()) {
                throw new UnsupportedOperationError("Task " + taskId + " is in final state "
                        + task.status().state().asString() + " and has no further events",
                        Map.of("taskId", taskId, "state", task.status().state().asString()));
            }
            EventQueue child = queueManager.getOrCreate(taskId).tap();
            return new Subscription(task, child);
        });
    }

    /**
     * Sends a message produced by the agent for this task to the live streams and webhooks
     * without changing the task.
     *
     * @throws InvalidAgentResponseError if the task is in a final state
     */
    public void emitMessage(String taskId, Message message) {
        withLock(taskId, () -> {
            Task task = requireTask(taskId);
            if (task.status().state().isFinal()) {
                throw new InvalidAgentResponseError("Task " + taskId + " is in final state "
                        + task.status().state().asString() + " and accepts no messages");
            }
            emit(message);
            return null;
        });
    }

    /**
     * Removes a task and everything kept for it.
     */
    public void purge(String taskId) {
        withLock(taskId, () -> {
            queueManager.close(taskId);
            closedArtifacts.remove(taskId);
            taskStore.delete(taskId);
            return null;
        });
        locks.remove(taskId);
    }

    private void emit(StreamingEventKind event) {
        String taskId = event instanceof Task task ? task.id() : taskIdOf(event);
        if (taskId != null) {
            queueManager.getOrCreate(taskId).enqueueEvent(event);
        }
        pushSender.sendNotification(event);
    }

    private void finish(String taskId, TaskState state) {
        LOGGER.info("Task {} finished in state {}", taskId, state.asString());
        closedArtifacts.remove(taskId);
        queueManager.close(taskId);
    }

    private Task requireTask(String taskId) {
        Task task = taskStore.get(taskId);
        if (task == null) {
            throw TaskNotFoundError.forTask(taskId);
        }
        return task;
    }

    private AuthorizationScope ownerOf(String taskId) {
        AuthorizationScope owner = taskStore.getOwner(taskId);
        return owner == null ? AuthorizationScope.anonymous() : owner;
    }

    private static @Nullable String taskIdOf(StreamingEventKind event) {
        if (event instanceof TaskStatusUpdateEvent statusUpdate) {
            return statusUpdate.taskId();
        } else if (event instanceof TaskArtifactUpdateEvent artifactUpdate) {
            return artifactUpdate.taskId();
        } else if (event instanceof Message message) {
            return message.taskId();
        }
        return null;
    }

    private static int indexOf(List<Artifact> artifacts, String artifactId) {
        for (int i = 0; i < artifacts.size(); i++) {
            if (artifacts.get(i).artifactId().equals(artifactId)) {
                return i;
            }
        }
        return -1;
    }

    private static Artifact appendParts(Artifact existing, Artifact chunk) {
        List<Part<?>> parts = new ArrayList<>(existing.parts());
        parts.addAll(chunk.parts());
        Artifact.Builder builder = Artifact.builder(existing).parts(parts);
        if (chunk.metadata() != null) {
            Map<String, Object> merged = existing.metadata() == null ? new HashMap<>() : new HashMap<>(existing.metadata());
            merged.putAll(chunk.metadata());
            builder.metadata(merged);
        }
        return builder.build();
    }

    /**
     * @param task the task after the request
     * @param transitioned {@code false} if the task was already canceled
     */
    public record CancelResult(Task task, boolean transitioned) {
    }

    /**
     * @param snapshot the task at subscription time
     * @param queue the subscriber's queue, receiving every later event
     */
    public record Subscription(Task snapshot, EventQueue queue) {
    }
}
