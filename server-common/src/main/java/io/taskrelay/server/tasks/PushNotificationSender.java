package io.taskrelay.server.tasks;

import io.taskrelay.spec.StreamingEventKind;

/**
 * Delivers task events to the webhooks registered for the task.
 */
public interface PushNotificationSender {

    /**
     * Queues an event for delivery and returns without waiting for it.
     * Events of one task must be passed in the order they were generated.
     *
     * @param kind the event to push
     */
    void sendNotification(StreamingEventKind kind);
}
