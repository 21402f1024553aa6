package io.taskrelay.server.tasks;

import java.util.List;

import io.taskrelay.spec.PushNotificationConfig;
import org.jspecify.annotations.Nullable;

/**
 * Webhook registrations, keyed by task.
 */
public interface PushNotificationConfigStore {

    /**
     * Registers a webhook for a task, replacing any registration with the same id.
     *
     * @param taskId the task id
     * @param config the webhook; a missing id is generated
     * @return the stored configuration, with its id
     */
    PushNotificationConfig setInfo(String taskId, PushNotificationConfig config);

    /**
     * @return the task's registrations in registration order, empty if there are none
     */
    List<PushNotificationConfig> getInfo(String taskId);

    @Nullable PushNotificationConfig getInfo(String taskId, String configId);

    /**
     * Removes one registration. Unknown ids are ignored.
     */
    void deleteInfo(String taskId, String configId);

    /**
     * Removes every registration of a task.
     */
    void deleteAll(String taskId);
}
