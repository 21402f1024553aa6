package io.taskrelay.server.events;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.taskrelay.server.config.A2AServerSettings;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@ApplicationScoped
public class InMemoryQueueManager implements QueueManager {

    private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryQueueManager.class);

    private final ConcurrentMap<String, EventQueue> queues = new ConcurrentHashMap<>();
    private final int childQueueSize;

    public InMemoryQueueManager() {
        this(EventQueue.DEFAULT_QUEUE_SIZE);
    }

    @Inject
    public InMemoryQueueManager(A2AServerSettings settings) {
        this(settings.subscriberQueueSize());
    }

    public InMemoryQueueManager(int childQueueSize) {
        this.childQueueSize = childQueueSize;
    }

    @Override
    public EventQueue getOrCreate(String taskId) {
        return queues.computeIfAbsent(taskId, id -> {
            EventQueue queue = EventQueue.create(id, childQueueSize);
            ((EventQueue.MainQueue) queue).addOnCloseCallback(() -> queues.remove(id, queue));
            LOGGER.debug("Created new queue {} for task {}", System.identityHashCode(queue), id);
            return queue;
        });
    }

    @Override
    public @Nullable EventQueue get(String taskId) {
        return queues.get(taskId);
    }

    @Override
    public @Nullable EventQueue tap(String taskId) {
        EventQueue queue = queues.get(taskId);
        return queue == null ? null : queue.tap();
    }

    @Override
    public void close(String taskId) {
        EventQueue existing = queues.remove(taskId);
        if (existing != null) {
            LOGGER.debug("Closing queue {} for task {}", System.identityHashCode(existing), taskId);
            existing.close();
        }
    }
}
