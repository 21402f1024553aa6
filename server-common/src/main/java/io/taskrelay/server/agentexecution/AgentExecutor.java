package io.taskrelay.server.agentexecution;

import io.taskrelay.server.tasks.AgentEmitter;
import io.taskrelay.spec.A2AError;
import io.taskrelay.spec.Message;
import org.jspecify.annotations.Nullable;

/**
 * The agent behind the request handler.
 * <p>
 * {@link #execute} runs asynchronously on the handler's executor and reports progress
 * through the {@link AgentEmitter}. Exceptions it throws fail the task.
 */
public interface AgentExecutor {

    /**
     * Works on a task. Called for a new task and for every message continuing an existing one.
     */
    void execute(RequestContext context, AgentEmitter agentEmitter) throws A2AError;

    /**
     * Told that the task was canceled. The task is already in the {@code canceled} state when
     * this runs; the agent should stop its work.
     */
    void cancel(RequestContext context, AgentEmitter agentEmitter) throws A2AError;

    /**
     * Lets the agent answer a message that names no task with a single message instead of
     * starting a task.
     *
     * @return the reply, or {@code null} to start a task
     */
    default @Nullable Message respondDirectly(RequestContext context) throws A2AError {
        return null;
    }
}
