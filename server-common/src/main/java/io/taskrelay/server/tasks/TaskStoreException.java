package io.taskrelay.server.tasks;

import io.taskrelay.spec.A2AServerException;
import org.jspecify.annotations.Nullable;

/**
 * Base class for failures of a {@link TaskStore} implementation.
 * <p>
 * The request handler reports these to callers as {@link io.taskrelay.spec.InternalError};
 * the task id, when known, is kept for logging.
 *
 * @see TaskPersistenceException
 * @see TaskSerializationException
 */
public class TaskStoreException extends A2AServerException {

    private final @Nullable String taskId;

    public TaskStoreException(String msg) {
        super(msg);
        this.taskId = null;
    }

    public TaskStoreException(String msg, Throwable cause) {
        super(msg, cause);
        this.taskId = null;
    }

    public TaskStoreException(@Nullable String taskId, String msg) {
        super(msg);
        this.taskId = taskId;
    }

    public TaskStoreException(@Nullable String taskId, String msg, Throwable cause) {
        super(msg, cause);
        this.taskId = taskId;
    }

    public @Nullable String getTaskId() {
        return taskId;
    }
}
