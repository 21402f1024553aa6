package io.taskrelay.server.events;

import java.time.Duration;
import java.util.concurrent.Executor;
import java.util.concurrent.Flow;

import io.taskrelay.spec.Event;
import io.taskrelay.spec.InternalError;
import io.taskrelay.spec.Message;
import io.taskrelay.spec.StreamingEventKind;
import io.taskrelay.spec.Task;
import io.taskrelay.spec.TaskStatusUpdateEvent;
import io.taskrelay.util.Assert;
import mutiny.zero.BackpressureStrategy;
import mutiny.zero.TubeConfiguration;
import mutiny.zero.ZeroPublisher;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Exposes a child {@link EventQueue} as a {@link Flow.Publisher}.
 * <p>
 * The publisher emits an optional initial item, then every event the queue receives, and
 * completes after the task's terminal event. It fails with {@link InternalError} if the
 * subscriber fell so far behind that its queue overflowed; the subscriber may subscribe
 * again to receive a fresh snapshot. Cancelling the subscription closes the child queue and
 * nothing else.
 */
public class EventConsumer {

    private static final Logger LOGGER = LoggerFactory.getLogger(EventConsumer.class);

    private final EventQueue queue;
    private final Executor executor;
    private final int pollTimeoutMillis;

    public EventConsumer(EventQueue queue, Executor executor, Duration pollTimeout) {
        this.queue = Assert.checkNotNullParam("queue", queue);
        this.executor = Assert.checkNotNullParam("executor", executor);
        this.pollTimeoutMillis = (int) Math.max(1, pollTimeout.toMillis());
    }

    public Flow.Publisher<StreamingEventKind> consumeAll() {
        return consumeAll(null);
    }

    /**
     * @param first item emitted before any queued event, typically the task snapshot
     */
    public Flow.Publisher<StreamingEventKind> consumeAll(@Nullable StreamingEventKind first) {
        TubeConfiguration config = new TubeConfiguration()
                .withBackpressureStrategy(BackpressureStrategy.BUFFER)
                .withBufferSize(queue.getQueueSize());
        return ZeroPublisher.create(config, tube -> {
            tube.whenCancelled(() -> {
                LOGGER.debug("Subscriber cancelled, closing {}", queue);
                queue.close(true);
            });
            executor.execute(() -> {
                if (first != null) {
                    tube.send(first);
                    if (isStreamTerminatingEvent(first)) {
                        queue.close(true);
                        tube.complete();
                        return;
                    }
                }
                while (!tube.cancelled()) {
                    Event event;
                    try {
                        event = queue.dequeueEvent(pollTimeoutMillis);
                    } catch (EventQueueClosedException e) {
                        if (e.isOverflowed()) {
                            tube.fail(new InternalError("Subscriber fell behind the event stream, subscribe again to resume"));
                        } else {
                            tube.complete();
                        }
                        return;
                    }
                    if (event == null) {
                        continue;
                    }
                    if (!(event instanceof StreamingEventKind streamingEvent)) {
                        LOGGER.warn("Ignoring non streaming event {}", event);
                        continue;
                    }
                    tube.send(streamingEvent);
                    if (isStreamTerminatingEvent(streamingEvent)) {
                        queue.close(true);
                        tube.complete();
                        return;
                    }
                }
            });
        });
    }

    /**
     * @return {@code true} if nothing can follow this event on a task's stream
     */
    public static boolean isStreamTerminatingEvent(StreamingEventKind event) {
        if (event instanceof Message message) {
            // a reply that started no task; messages about a task do not end its stream
            return message.taskId() == null;
        }
        if (event instanceof Task task) {
            return task.status().state().isFinal();
        }
        if (event instanceof TaskStatusUpdateEvent statusUpdate) {
            return statusUpdate.isFinal();
        }
        return false;
    }
}
