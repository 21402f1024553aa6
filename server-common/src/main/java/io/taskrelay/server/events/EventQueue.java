package io.taskrelay.server.events;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import io.taskrelay.spec.Event;
import io.taskrelay.util.Assert;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Event stream of one task.
 * <p>
 * Each task has a single {@link MainQueue} that keeps the append-only log of the task's
 * events and fans every event out to its children. Every subscriber reads from its own
 * bounded {@link ChildQueue} obtained with {@link #tap()}, so subscribers are independent
 * of each other and of the task: a child that cannot accept an event is closed immediately
 * instead of blocking the producer.
 * <p>
 * Producers must serialize {@link #enqueueEvent(Event)} calls for a task (the
 * {@link io.taskrelay.server.tasks.TaskManager} holds the task lock) so that all children
 * observe the same order.
 */
public abstract class EventQueue implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(EventQueue.class);

    public static final int DEFAULT_QUEUE_SIZE = 256;

    private final int queueSize;
    private volatile boolean closed = false;

    protected EventQueue(int queueSize) {
        if (queueSize <= 0) {
            throw new IllegalArgumentException("Queue size must be greater than 0");
        }
        this.queueSize = queueSize;
    }

    /**
     * Creates the main queue of a task.
     *
     * @param taskId the task id
     * @param childQueueSize capacity of each child queue
     * @return the new main queue
     */
    public static EventQueue create(String taskId, int childQueueSize) {
        return new MainQueue(taskId, childQueueSize);
    }

    public int getQueueSize() {
        return queueSize;
    }

    public abstract void enqueueEvent(Event event);

    /**
     * Creates a child queue that receives every event enqueued from now on.
     *
     * @throws IllegalStateException if this is not a main queue
     */
    public abstract EventQueue tap();

    /**
     * Takes the next event.
     *
     * @param waitMilliSeconds how long to wait; {@code 0} or less does not wait
     * @return the event, or {@code null} if none arrived in time
     * @throws EventQueueClosedException if the queue is closed and drained
     */
    public abstract @Nullable Event dequeueEvent(int waitMilliSeconds) throws EventQueueClosedException;

    public abstract int size();

    /**
     * Closes the queue gracefully: consumers still receive the events already queued.
     */
    @Override
    public void close() {
        close(false);
    }

    /**
     * @param immediate if {@code true} pending events are discarded
     */
    public abstract void close(boolean immediate);

    public boolean isClosed() {
        return closed;
    }

    protected boolean markClosed() {
        synchronized (this) {
            if (closed) {
                return false;
            }
            closed = true;
            return true;
        }
    }

    static class MainQueue extends EventQueue {
        private final String taskId;
        private final List<ChildQueue> children = new CopyOnWriteArrayList<>();
        private final List<Event> log = new ArrayList<>();
        private final List<Runnable> onCloseCallbacks = new CopyOnWriteArrayList<>();

        MainQueue(String taskId, int childQueueSize) {
            super(childQueueSize);
            this.taskId = Assert.checkNotNullParam("taskId", taskId);
            LOGGER.debug("Created MainQueue for task {} with child queue size {}", taskId, childQueueSize);
        }

        @Override
        public EventQueue tap() {
            ChildQueue child = new ChildQueue(this, getQueueSize());
            if (isClosed()) {
                child.close();
            } else {
                children.add(child);
            }
            return child;
        }

        @Override
        public void enqueueEvent(Event event) {
            if (isClosed()) {
                LOGGER.warn("MainQueue for task {} is closed. Event will not be enqueued: {}", taskId, event);
                return;
            }
            synchronized (log) {
                log.add(event);
            }
            distributeToChildren(event);
        }

        private void distributeToChildren(Event event) {
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug("MainQueue[{}]: distributing {} to {} children",
                        taskId, event.getClass().getSimpleName(), children.size());
            }
            children.forEach(child -> child.internalEnqueueEvent(event));
        }

        @Override
        public @Nullable Event dequeueEvent(int waitMilliSeconds) {
            throw new UnsupportedOperationException("MainQueue cannot be consumed directly, use tap()");
        }

        @Override
        public int size() {
            synchronized (log) {
                return log.size();
            }
        }

        /**
         * @return a copy of every event enqueued for the task so far
         */
        public List<Event> getEventLog() {
            synchronized (log) {
                return List.copyOf(log);
            }
        }

        public String getTaskId() {
            return taskId;
        }

        public int getChildCount() {
            return children.size();
        }

        void addOnCloseCallback(Runnable callback) {
            onCloseCallbacks.add(callback);
        }

        void childClosing(ChildQueue child) {
            children.remove(child);
            LOGGER.debug("MainQueue[{}]: child closed, {} remaining", taskId, children.size());
        }

        @Override
        public void close(boolean immediate) {
            if (!markClosed()) {
                return;
            }
            LOGGER.debug("Closing MainQueue for task {} (immediate={})", taskId, immediate);
            for (Runnable callback : onCloseCallbacks) {
                try {
                    callback.run();
                } catch (RuntimeException e) {
                    LOGGER.error("Error in onClose callback for task {}", taskId, e);
                }
            }
            children.forEach(child -> child.closeFromParent(immediate));
            children.clear();
        }
    }

    static class ChildQueue extends EventQueue {
        private final MainQueue parent;
        private final BlockingQueue<Event> queue;
        private volatile boolean immediateClose = false;
        private volatile boolean overflowed = false;

        ChildQueue(MainQueue parent, int queueSize) {
            super(queueSize);
            this.parent = parent;
            this.queue = new LinkedBlockingQueue<>(queueSize);
        }

        @Override
        public void enqueueEvent(Event event) {
            parent.enqueueEvent(event);
        }

        private void internalEnqueueEvent(Event event) {
            if (isClosed()) {
                return;
            }
            if (!queue.offer(event)) {
                LOGGER.warn("Subscriber queue for task {} is full ({} events). Closing it.",
                        parent.getTaskId(), getQueueSize());
                overflowed = true;
                close(true);
            }
        }

        @Override
        public @Nullable Event dequeueEvent(int waitMilliSeconds) throws EventQueueClosedException {
            if (isClosed() && (queue.isEmpty() || immediateClose)) {
                throw new EventQueueClosedException(overflowed);
            }
            if (waitMilliSeconds <= 0) {
                return queue.poll();
            }
            try {
                return queue.poll(waitMilliSeconds, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return null;
            }
        }

        @Override
        public EventQueue tap() {
            throw new IllegalStateException("Can only tap the main queue");
        }

        @Override
        public int size() {
            return queue.size();
        }

        public boolean isOverflowed() {
            return overflowed;
        }

        private void closeFromParent(boolean immediate) {
            doClose(immediate);
        }

        private void doClose(boolean immediate) {
            if (!markClosed()) {
                return;
            }
            if (immediate) {
                immediateClose = true;
                queue.clear();
            }
        }

        @Override
        public void close(boolean immediate) {
            doClose(immediate);
            parent.childClosing(this);
        }
    }
}
