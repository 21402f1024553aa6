package io.taskrelay.server.util;

import java.util.List;

import io.taskrelay.spec.Message;
import io.taskrelay.spec.Task;
import org.jspecify.annotations.Nullable;

/**
 * Projections of a stored task returned to callers.
 */
public final class TaskViews {

    private TaskViews() {
    }

    /**
     * Applies the {@code historyLength} rule: {@code null} keeps the most recent
     * {@code defaultHistoryLength} messages, {@code 0} omits the history, {@code N} keeps the
     * most recent N.
     */
    public static Task limitHistory(Task task, @Nullable Integer historyLength, int defaultHistoryLength) {
        int length = historyLength == null ? defaultHistoryLength : historyLength;
        List<Message> history = task.history();
        if (length == 0) {
            return history == null ? task : Task.builder(task).history((List<Message>) null).build();
        }
        if (history != null && history.size() > length) {
            return Task.builder(task)
                    .history(history.subList(history.size() - length, history.size()))
                    .build();
        }
        return task;
    }

    public static Task withoutArtifacts(Task task) {
        if (task.artifacts() == null) {
            return task;
        }
        return Task.builder(task).artifacts(null).build();
    }
}
