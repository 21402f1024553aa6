package io.taskrelay.client;

import io.taskrelay.server.ServerCallContext;
import io.taskrelay.server.requesthandlers.RequestHandler;
import io.taskrelay.spec.AgentCard;
import io.taskrelay.spec.EventKind;
import io.taskrelay.spec.MessageSendParams;
import io.taskrelay.spec.Task;
import io.taskrelay.spec.TaskIdParams;
import io.taskrelay.spec.TaskQueryParams;
import io.taskrelay.util.Assert;

/**
 * Calls a {@link RequestHandler} in the same process, every request carrying the same
 * {@link ServerCallContext}.
 */
public class LocalClientTransport implements ClientTransport {

    private final RequestHandler requestHandler;
    private final AgentCard agentCard;
    private final ServerCallContext context;

    public LocalClientTransport(RequestHandler requestHandler, AgentCard agentCard, ServerCallContext context) {
        Assert.checkNotNullParam("requestHandler", requestHandler);
        Assert.checkNotNullParam("agentCard", agentCard);
        Assert.checkNotNullParam("context", context);
        this.requestHandler = requestHandler;
        this.agentCard = agentCard;
        this.context = context;
    }

    @Override
    public EventKind sendMessage(MessageSendParams params) {
        return requestHandler.onMessageSend(params, context);
    }

    @Override
    public Task getTask(TaskQueryParams params) {
        return requestHandler.onGetTask(params, context);
    }

    @Override
    public Task cancelTask(TaskIdParams params) {
        return requestHandler.onCancelTask(params, context);
    }

    @Override
    public AgentCard getAgentCard() {
        return agentCard;
    }
}
