package io.taskrelay.server.tasks;

import io.taskrelay.server.auth.AuthorizationScope;
import io.taskrelay.spec.ListTasksParams;
import io.taskrelay.spec.ListTasksResult;
import io.taskrelay.spec.Task;
import org.jspecify.annotations.Nullable;

/**
 * Keyed storage for tasks together with the scope that owns each of them.
 * <p>
 * Callers serialize writes to one task through {@link TaskManager}; implementations only
 * need to be safe for concurrent access to different tasks and for readers running
 * alongside a writer.
 *
 * <h2>Ownership</h2>
 * The owner recorded by the first {@link #save} of a task is permanent. Later saves keep
 * it regardless of the scope they pass.
 *
 * <h2>Exceptions</h2>
 * Backends that can fail throw the {@link TaskStoreException} hierarchy:
 * {@link TaskPersistenceException} for I/O and database failures and
 * {@link TaskSerializationException} for data that cannot be decoded.
 */
public interface TaskStore {

    /**
     * Creates or replaces a task.
     *
     * @param task the task
     * @param owner the scope of the caller that created the task
     * @throws TaskStoreException if the task cannot be stored
     */
    void save(Task task, AuthorizationScope owner);

    /**
     * @param taskId the task id
     * @return the complete stored task, or {@code null} if there is none
     * @throws TaskStoreException if the task cannot be read
     */
    @Nullable Task get(String taskId);

    /**
     * @param taskId the task id
     * @return the scope that owns the task, or {@code null} if there is no such task
     */
    @Nullable AuthorizationScope getOwner(String taskId);

    /**
     * Removes a task. Removing an unknown task does nothing.
     *
     * @param taskId the task id
     */
    void delete(String taskId);

    /**
     * Lists the tasks owned by {@code scope}, newest status first.
     *
     * @param params filters, page size, page token and per-task projection
     * @param scope the caller's scope
     * @return one page of tasks
     * @throws io.taskrelay.spec.InvalidParamsError if the page token is malformed
     */
    ListTasksResult list(ListTasksParams params, AuthorizationScope scope);
}
