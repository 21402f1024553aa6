package io.taskrelay.server.auth;

import io.taskrelay.server.tasks.TaskStore;
import io.taskrelay.spec.Task;
import io.taskrelay.spec.TaskNotFoundError;
import io.taskrelay.util.Assert;

/**
 * Resolves task ids through the caller's scope. A task owned by another scope produces the
 * same {@link TaskNotFoundError} as a task that does not exist.
 */
public class ScopeFilter {

    private final TaskStore taskStore;

    public ScopeFilter(TaskStore taskStore) {
        this.taskStore = Assert.checkNotNullParam("taskStore", taskStore);
    }

    public Task findVisible(String taskId, AuthorizationScope scope) throws TaskNotFoundError {
        Task task = taskStore.get(taskId);
        if (task == null || !isVisible(taskId, scope)) {
            throw TaskNotFoundError.forTask(taskId);
        }
        return task;
    }

    public boolean isVisible(String taskId, AuthorizationScope scope) {
        AuthorizationScope owner = taskStore.getOwner(taskId);
        return owner != null && scope.permits(owner);
    }
}
