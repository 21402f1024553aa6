package io.taskrelay.server.events;

/**
 * Thrown by {@link EventQueue#dequeueEvent(int)} once a closed queue has no more events to
 * hand out.
 */
public class EventQueueClosedException extends Exception {

    private final boolean overflowed;

    public EventQueueClosedException() {
        this(false);
    }

    public EventQueueClosedException(boolean overflowed) {
        super(overflowed ? "Event queue closed after overflowing" : "Event queue closed");
        this.overflowed = overflowed;
    }

    /**
     * @return {@code true} if the queue was closed because its consumer fell behind
     */
    public boolean isOverflowed() {
        return overflowed;
    }
}
