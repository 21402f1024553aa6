package io.taskrelay.server.tasks;

import org.jspecify.annotations.Nullable;

/**
 * A storage backend could not read or write a task.
 * <p>
 * Transient failures (connection loss, lock timeouts) may succeed when retried; permanent
 * ones (constraint violations, exhausted capacity) will not.
 */
public class TaskPersistenceException extends TaskStoreException {

    private final boolean isTransientFailure;

    public TaskPersistenceException(@Nullable String taskId, String msg) {
        this(taskId, msg, false);
    }

    public TaskPersistenceException(@Nullable String taskId, String msg, boolean isTransient) {
        super(taskId, msg);
        this.isTransientFailure = isTransient;
    }

    public TaskPersistenceException(@Nullable String taskId, String msg, Throwable cause, boolean isTransient) {
        super(taskId, msg, cause);
        this.isTransientFailure = isTransient;
    }

    public boolean isTransient() {
        return isTransientFailure;
    }
}
