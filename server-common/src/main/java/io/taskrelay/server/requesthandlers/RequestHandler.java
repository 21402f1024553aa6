package io.taskrelay.server.requesthandlers;

import java.util.concurrent.Flow;

import io.taskrelay.server.ServerCallContext;
import io.taskrelay.spec.A2AError;
import io.taskrelay.spec.AgentCard;
import io.taskrelay.spec.DeleteTaskPushNotificationConfigParams;
import io.taskrelay.spec.EventKind;
import io.taskrelay.spec.GetExtendedAgentCardParams;
import io.taskrelay.spec.GetTaskPushNotificationConfigParams;
import io.taskrelay.spec.ListTaskPushNotificationConfigParams;
import io.taskrelay.spec.ListTaskPushNotificationConfigResult;
import io.taskrelay.spec.ListTasksParams;
import io.taskrelay.spec.ListTasksResult;
import io.taskrelay.spec.MessageSendParams;
import io.taskrelay.spec.StreamingEventKind;
import io.taskrelay.spec.Task;
import io.taskrelay.spec.TaskIdParams;
import io.taskrelay.spec.TaskPushNotificationConfig;
import io.taskrelay.spec.TaskQueryParams;
import org.jspecify.annotations.Nullable;

/**
 * The protocol operations, independent of any transport binding.
 * <p>
 * A binding (JSON-RPC, REST, gRPC) decodes a request into the parameter record, calls the
 * matching method with the caller's {@link ServerCallContext} and encodes the result. Errors
 * are thrown as {@link A2AError}s; {@link io.taskrelay.server.binding.A2AErrorMapper} turns
 * them into the binding's status codes.
 */
public interface RequestHandler {

    /**
     * Sends a message, starting a new task or continuing an existing one.
     *
     * @return the task, or a {@link io.taskrelay.spec.Message} if the agent answered directly
     */
    EventKind onMessageSend(MessageSendParams params, @Nullable ServerCallContext context) throws A2AError;

    /**
     * Sends a message and streams the task's events: a snapshot of the task first, then every
     * later event until the task reaches a final state.
     */
    Flow.Publisher<StreamingEventKind> onMessageSendStream(MessageSendParams params,
                                                          @Nullable ServerCallContext context) throws A2AError;

    Task onGetTask(TaskQueryParams params, @Nullable ServerCallContext context) throws A2AError;

    ListTasksResult onListTasks(ListTasksParams params, @Nullable ServerCallContext context) throws A2AError;

    Task onCancelTask(TaskIdParams params, @Nullable ServerCallContext context) throws A2AError;

    /**
     * Streams the events of an existing, non-final task, starting with its current snapshot.
     */
    Flow.Publisher<StreamingEventKind> onSubscribeToTask(TaskIdParams params,
                                                        @Nullable ServerCallContext context) throws A2AError;

    TaskPushNotificationConfig onCreateTaskPushNotificationConfig(TaskPushNotificationConfig params,
                                                                  @Nullable ServerCallContext context) throws A2AError;

    TaskPushNotificationConfig onGetTaskPushNotificationConfig(GetTaskPushNotificationConfigParams params,
                                                               @Nullable ServerCallContext context) throws A2AError;

    ListTaskPushNotificationConfigResult onListTaskPushNotificationConfig(ListTaskPushNotificationConfigParams params,
                                                                          @Nullable ServerCallContext context) throws A2AError;

    void onDeleteTaskPushNotificationConfig(DeleteTaskPushNotificationConfigParams params,
                                            @Nullable ServerCallContext context) throws A2AError;

    AgentCard onGetExtendedAgentCard(GetExtendedAgentCardParams params,
                                     @Nullable ServerCallContext context) throws A2AError;

    /**
     * Removes a task in a final state together with its webhook registrations.
     */
    void onDeleteTask(TaskIdParams params, @Nullable ServerCallContext context) throws A2AError;
}
