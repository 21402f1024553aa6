package io.taskrelay.server.tasks;

import static io.taskrelay.spec.TaskState.TASK_STATE_AUTH_REQUIRED;
import static io.taskrelay.spec.TaskState.TASK_STATE_CANCELED;
import static io.taskrelay.spec.TaskState.TASK_STATE_COMPLETED;
import static io.taskrelay.spec.TaskState.TASK_STATE_FAILED;
import static io.taskrelay.spec.TaskState.TASK_STATE_INPUT_REQUIRED;
import static io.taskrelay.spec.TaskState.TASK_STATE_REJECTED;
import static io.taskrelay.spec.TaskState.TASK_STATE_SUBMITTED;
import static io.taskrelay.spec.TaskState.TASK_STATE_WORKING;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import io.taskrelay.spec.InvalidAgentResponseError;
import io.taskrelay.spec.TaskState;
import org.jspecify.annotations.Nullable;

/**
 * Legal task state transitions.
 * <pre>
 *   (new)          -&gt; submitted
 *   submitted      -&gt; working | rejected | failed
 *   working        -&gt; working | completed | failed | rejected | input-required | auth-required
 *   input-required -&gt; working
 *   auth-required  -&gt; working
 *   any non-final  -&gt; canceled
 * </pre>
 * Final states accept no transition.
 */
public final class TaskStateMachine {

    private static final Map<TaskState, Set<TaskState>> TRANSITIONS = Map.of(
            TASK_STATE_SUBMITTED, EnumSet.of(TASK_STATE_WORKING, TASK_STATE_REJECTED, TASK_STATE_FAILED,
                    TASK_STATE_CANCELED),
            TASK_STATE_WORKING, EnumSet.of(TASK_STATE_WORKING, TASK_STATE_COMPLETED, TASK_STATE_FAILED,
                    TASK_STATE_REJECTED, TASK_STATE_INPUT_REQUIRED, TASK_STATE_AUTH_REQUIRED, TASK_STATE_CANCELED),
            TASK_STATE_INPUT_REQUIRED, EnumSet.of(TASK_STATE_WORKING, TASK_STATE_CANCELED),
            TASK_STATE_AUTH_REQUIRED, EnumSet.of(TASK_STATE_WORKING, TASK_STATE_CANCELED));

    private TaskStateMachine() {
    }

    /**
     * @param from the current state, or {@code null} for a task that does not exist yet
     * @param to the requested state
     * @return whether the transition is legal
     */
    public static boolean isValidTransition(@Nullable TaskState from, TaskState to) {
        if (from == null) {
            return to == TASK_STATE_SUBMITTED;
        }
        return TRANSITIONS.getOrDefault(from, Set.of()).contains(to);
    }

    /**
     * @throws InvalidAgentResponseError if the transition is not legal
     */
    public static void checkTransition(String taskId, @Nullable TaskState from, TaskState to)
            throws InvalidAgentResponseError {
        if (!isValidTransition(from, to)) {
            throw new InvalidAgentResponseError(
                    "Illegal transition of task " + taskId + " from " + (from == null ? "(new)" : from.asString())
                            + " to " + to.asString(),
                    Map.of("taskId", taskId, "from", from == null ? "" : from.asString(), "to", to.asString()));
        }
    }
}
