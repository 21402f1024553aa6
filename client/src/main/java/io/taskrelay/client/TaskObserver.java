package io.taskrelay.client;

import java.time.Duration;
import java.util.function.BooleanSupplier;

import io.taskrelay.spec.A2AClientException;
import io.taskrelay.spec.A2AError;
import io.taskrelay.spec.EventKind;
import io.taskrelay.spec.Message;
import io.taskrelay.spec.MessageSendConfiguration;
import io.taskrelay.spec.MessageSendParams;
import io.taskrelay.spec.Part;
import io.taskrelay.spec.Task;
import io.taskrelay.spec.TaskIdParams;
import io.taskrelay.spec.TaskQueryParams;
import io.taskrelay.spec.TaskState;
import io.taskrelay.spec.TextPart;
import io.taskrelay.util.Assert;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Delegates a prompt to a remote agent and waits for the task to settle.
 *
 * <p>The message is sent without blocking, then the task is polled every
 * {@link ClientConfig#pollInterval()} until it is terminal or asks for input. Remote calls
 * failing with {@link A2AClientException} are retried up to {@link ClientConfig#maxRetries()}
 * times, the delay doubling from {@link ClientConfig#retryDelay()}. When the overall
 * {@link ClientConfig#timeout()} elapses, or the caller asks to stop, the remote task is
 * canceled.
 */
public class TaskObserver {

    private static final Logger LOGGER = LoggerFactory.getLogger(TaskObserver.class);

    private static final MessageSendConfiguration NON_BLOCKING = MessageSendConfiguration.builder()
            .blocking(false)
            .build();

    public enum Outcome {
        COMPLETED,
        /** The task failed or was rejected. */
        FAILED,
        /** The task waits for input or authorization from the caller. */
        INPUT_REQUIRED,
        CANCELLED,
        TIMEOUT
    }

    /**
     * @param outcome how the observation ended
     * @param task the last task snapshot; {@code null} on timeout, on caller cancellation and
     *             when the agent replied directly
     * @param reply the agent's direct reply when it answered without creating a task
     */
    public record Observation(Outcome outcome, @Nullable Task task, @Nullable Message reply) {

        /**
         * Renders the observation as a single line such as {@code [COMPLETED] 42 rows} or
         * {@code [INPUT_REQUIRED:task_id=abc] Which year?}.
         */
        public String describe() {
            if (outcome == Outcome.COMPLETED) {
                String text = task != null ? TaskResults.extractText(task) : reply != null ? firstText(reply) : null;
                return "[COMPLETED] " + (text != null ? text : "Task completed");
            } else if (outcome == Outcome.INPUT_REQUIRED && task != null) {
                return "[INPUT_REQUIRED:task_id=" + task.id() + "] " + TaskResults.extractQuestion(task);
            } else if (outcome == Outcome.FAILED) {
                Message status = task != null ? task.status().message() : null;
                String text = status != null ? firstText(status) : null;
                return "[FAILED] " + (text != null ? text : "Unknown error");
            } else if (outcome == Outcome.CANCELLED) {
                return "[CANCELLED] Task was cancelled";
            }
            return "[TIMEOUT] Task timed out";
        }

        private static @Nullable String firstText(Message message) {
            for (Part<?> part : message.parts()) {
                if (part instanceof TextPart textPart) {
                    return textPart.text();
                }
            }
            return null;
        }
    }

    @FunctionalInterface
    private interface RemoteCall<T> {
        T call() throws A2AClientException;
    }

    private final ClientTransport transport;
    private final ClientConfig config;

    public TaskObserver(ClientTransport transport, ClientConfig config) {
        Assert.checkNotNullParam("transport", transport);
        Assert.checkNotNullParam("config", config);
        this.transport = transport;
        this.config = config;
    }

    public Observation sendAndObserve(String prompt) throws A2AClientException {
        return sendAndObserve(prompt, null, () -> false);
    }

    /**
     * Sends {@code prompt} and waits for the outcome.
     *
     * @param prompt the text to send
     * @param taskId a task waiting for input to continue, or {@code null} to start a new one
     * @param isCancelled polled between two status checks; returning {@code true} cancels
     *                    the remote task
     * @return the observation
     * @throws A2AClientException if a remote call still fails after the last retry
     * @throws A2AError if the agent rejects a request
     */
    public Observation sendAndObserve(String prompt, @Nullable String taskId, BooleanSupplier isCancelled)
            throws A2AClientException {
        Assert.checkNotNullParam("prompt", prompt);
        Assert.checkNotNullParam("isCancelled", isCancelled);
        long deadline = System.nanoTime() + config.timeout().toNanos();

        MessageSendParams params = new MessageSendParams(TaskResults.createMessage(prompt, taskId), NON_BLOCKING, null);
        EventKind result = withRetries("SendMessage", () -> transport.sendMessage(params));
        if (result instanceof Message reply) {
            LOGGER.info("Agent replied directly to message {}", params.message().messageId());
            return new Observation(Outcome.COMPLETED, null, reply);
        }

        Task task = (Task) result;
        String id = task.id();
        LOGGER.info("Task {} created", id);
        while (true) {
            Outcome outcome = outcomeOf(task);
            if (outcome != null) {
                return new Observation(outcome, task, null);
            }
            if (System.nanoTime() - deadline > 0) {
                LOGGER.error("Task {} timed out after {}", id, config.timeout());
                cancelRemote(id);
                return new Observation(Outcome.TIMEOUT, null, null);
            }
            if (isCancelled.getAsBoolean()) {
                LOGGER.info("Task {} cancelled by caller", id);
                cancelRemote(id);
                return new Observation(Outcome.CANCELLED, null, null);
            }
            sleep(config.pollInterval());
            task = withRetries("GetTask", () -> transport.getTask(new TaskQueryParams(id)));
            LOGGER.debug("Task {}: {}", id, task.status().state().asString());
        }
    }

    private static @Nullable Outcome outcomeOf(Task task) {
        TaskState state = task.status().state();
        if (state == TaskState.TASK_STATE_COMPLETED) {
            LOGGER.info("Task {} completed", task.id());
            return Outcome.COMPLETED;
        } else if (state == TaskState.TASK_STATE_FAILED || state == TaskState.TASK_STATE_REJECTED) {
            LOGGER.error("Task {} {}", task.id(), state.asString());
            return Outcome.FAILED;
        } else if (state == TaskState.TASK_STATE_CANCELED) {
            return Outcome.CANCELLED;
        } else if (state.isInterrupted()) {
            LOGGER.info("Task {} needs input", task.id());
            return Outcome.INPUT_REQUIRED;
        }
        return null;
    }

    private void cancelRemote(String taskId) {
        try {
            transport.cancelTask(new TaskIdParams(taskId));
        } catch (A2AClientException | A2AError e) {
            LOGGER.warn("Failed to cancel task {}: {}", taskId, e.getMessage());
        }
    }

    private <T> T withRetries(String operation, RemoteCall<T> call) throws A2AClientException {
        for (int attempt = 1; ; attempt++) {
            try {
                return call.call();
            } catch (A2AClientException e) {
                if (attempt >= config.maxRetries()) {
                    throw e;
                }
                Duration delay = config.retryDelay().multipliedBy(1L << (attempt - 1));
                LOGGER.warn("{} attempt {} failed, retrying in {}: {}", operation, attempt, delay, e.getMessage());
                sleep(delay);
            }
        }
    }

    private static void sleep(Duration duration) throws A2AClientException {
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new A2AClientException("Interrupted while waiting for the remote task", e);
        }
    }
}
