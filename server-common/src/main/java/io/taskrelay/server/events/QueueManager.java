package io.taskrelay.server.events;

import org.jspecify.annotations.Nullable;

/**
 * Registry of the per-task {@link EventQueue}s.
 */
public interface QueueManager {

    /**
     * Returns the main queue of a task, creating it if needed.
     */
    EventQueue getOrCreate(String taskId);

    @Nullable EventQueue get(String taskId);

    /**
     * @return a new child of the task's main queue, or {@code null} if the task has no queue
     */
    @Nullable EventQueue tap(String taskId);

    /**
     * Closes a task's main queue gracefully and forgets it. Unknown tasks are ignored.
     */
    void close(String taskId);
}
