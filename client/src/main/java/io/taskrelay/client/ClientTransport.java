package io.taskrelay.client;

import io.taskrelay.spec.A2AClientException;
import io.taskrelay.spec.AgentCard;
import io.taskrelay.spec.EventKind;
import io.taskrelay.spec.MessageSendParams;
import io.taskrelay.spec.Task;
import io.taskrelay.spec.TaskIdParams;
import io.taskrelay.spec.TaskQueryParams;

/**
 * The operations a {@link TaskObserver} needs from a remote agent.
 *
 * <p>An {@link A2AClientException} signals a transport failure that may succeed when
 * retried. Protocol errors reported by the agent surface as
 * {@link io.taskrelay.spec.A2AError} and are never retried.
 */
public interface ClientTransport {

    EventKind sendMessage(MessageSendParams params) throws A2AClientException;

    Task getTask(TaskQueryParams params) throws A2AClientException;

    Task cancelTask(TaskIdParams params) throws A2AClientException;

    AgentCard getAgentCard() throws A2AClientException;
}
