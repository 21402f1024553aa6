package io.taskrelay.server.tasks;

import org.jspecify.annotations.Nullable;

/**
 * A stored task could not be converted to or from its persisted form. Never transient.
 */
public class TaskSerializationException extends TaskStoreException {

    public TaskSerializationException(@Nullable String taskId, String msg) {
        super(taskId, msg);
    }

    public TaskSerializationException(@Nullable String taskId, String msg, Throwable cause) {
        super(taskId, msg, cause);
    }
}
