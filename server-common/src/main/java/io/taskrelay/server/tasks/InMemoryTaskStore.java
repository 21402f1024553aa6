package io.taskrelay.server.tasks;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.taskrelay.server.auth.AuthorizationScope;
import io.taskrelay.server.config.A2AServerSettings;
import io.taskrelay.server.util.TaskViews;
import io.taskrelay.spec.ListTasksParams;
import io.taskrelay.spec.ListTasksResult;
import io.taskrelay.spec.Task;
import io.taskrelay.util.PageToken;
import org.jspecify.annotations.Nullable;

/**
 * In-memory implementation of {@link TaskStore}.
 * <p>
 * Tasks are kept in a {@link ConcurrentHashMap} and lost on restart. Listing sorts the
 * caller's tasks by status timestamp (descending, millisecond precision) and task id
 * (ascending), then locates the page start with a binary search on the keyset cursor, so
 * tasks written between two page requests never cause a row to be skipped or repeated.
 * <p>
 * This store performs no I/O and never throws {@link TaskStoreException}.
 */
@ApplicationScoped
public class InMemoryTaskStore implements TaskStore {

    private final ConcurrentMap<String, Entry> tasks = new ConcurrentHashMap<>();
    private final A2AServerSettings settings;

    public InMemoryTaskStore() {
        this(A2AServerSettings.defaults());
    }

    @Inject
    public InMemoryTaskStore(A2AServerSettings settings) {
        this.settings = settings;
    }

    @Override
    public void save(Task task, AuthorizationScope owner) {
        tasks.compute(task.id(), (id, existing) -> new Entry(task, existing == null ? owner : existing.owner()));
    }

    @Override
    public @Nullable Task get(String taskId) {
        Entry entry = tasks.get(taskId);
        return entry == null ? null : entry.task();
    }

    @Override
    public @Nullable AuthorizationScope getOwner(String taskId) {
        Entry entry = tasks.get(taskId);
        return entry == null ? null : entry.owner();
    }

    @Override
    public void delete(String taskId) {
        tasks.remove(taskId);
    }

    @Override
    public ListTasksResult list(ListTasksParams params, AuthorizationScope scope) {
        PageToken pageToken = PageToken.fromString(params.pageToken());

        List<Task> filtered = tasks.values().stream()
                .filter(entry -> scope.permits(entry.owner()))
                .map(Entry::task)
                .filter(task -> params.contextId() == null || params.contextId().equals(task.contextId()))
                .filter(task -> params.status() == null || params.status() == task.status().state())
                .filter(task -> params.statusTimestampAfter() == null
                        || timestampOf(task).isAfter(params.statusTimestampAfter()))
                .sorted(Comparator.comparing(InMemoryTaskStore::timestampOf, Comparator.reverseOrder())
                        .thenComparing(Task::id))
                .toList();

        int pageSize = effectivePageSize(params.pageSize());
        int startIndex = pageToken == null ? 0 : firstAfter(filtered, pageToken);
        int endIndex = Math.min(startIndex + pageSize, filtered.size());
        List<Task> page = filtered.subList(startIndex, endIndex);

        String nextPageToken = "";
        if (endIndex < filtered.size()) {
            Task last = filtered.get(endIndex - 1);
            nextPageToken = new PageToken(timestampOf(last), last.id()).toString();
        }

        boolean includeArtifacts = params.shouldIncludeArtifacts();
        List<Task> views = page.stream()
                .map(task -> TaskViews.limitHistory(task, params.historyLength(), settings.defaultHistoryLength()))
                .map(task -> includeArtifacts ? task : TaskViews.withoutArtifacts(task))
                .toList();

        return new ListTasksResult(views, filtered.size(), views.size(), nextPageToken);
    }

    private int effectivePageSize(@Nullable Integer requested) {
        if (requested == null) {
            return settings.defaultPageSize();
        }
        return Math.min(requested, settings.maxPageSize());
    }

    // Index of the first task strictly after the cursor in (timestamp desc, id asc) order.
    private static int firstAfter(List<Task> sorted, PageToken token) {
        Instant tokenTimestamp = token.timestamp().truncatedTo(ChronoUnit.MILLIS);
        int left = 0;
        int right = sorted.size();
        while (left < right) {
            int mid = left + (right - left) / 2;
            Task task = sorted.get(mid);
            int timestampCompare = timestampOf(task).compareTo(tokenTimestamp);
            if (timestampCompare < 0 || (timestampCompare == 0 && task.id().compareTo(token.id()) > 0)) {
                right = mid;
            } else {
                left = mid + 1;
            }
        }
        return left;
    }

    private static Instant timestampOf(Task task) {
        return task.status().timestamp().toInstant().truncatedTo(ChronoUnit.MILLIS);
    }

    private record Entry(Task task, AuthorizationScope owner) {
    }
}
