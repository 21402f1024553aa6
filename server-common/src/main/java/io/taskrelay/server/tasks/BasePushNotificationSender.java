package io.taskrelay.server.tasks;

import static io.taskrelay.common.A2AHeaders.APPLICATION_JSON;
import static io.taskrelay.common.A2AHeaders.AUTHORIZATION;
import static io.taskrelay.common.A2AHeaders.CONTENT_TYPE;
import static io.taskrelay.common.A2AHeaders.X_A2A_NOTIFICATION_TOKEN;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.taskrelay.client.http.HttpClient;
import io.taskrelay.client.http.HttpResponse;
import io.taskrelay.client.http.HttpStatusException;
import io.taskrelay.server.config.A2AServerSettings;
import io.taskrelay.server.http.HttpClientManager;
import io.taskrelay.spec.A2AError;
import io.taskrelay.spec.AuthenticationInfo;
import io.taskrelay.spec.Message;
import io.taskrelay.spec.PushNotificationConfig;
import io.taskrelay.spec.StreamResponse;
import io.taskrelay.spec.StreamingEventKind;
import io.taskrelay.spec.Task;
import io.taskrelay.spec.TaskStatusUpdateEvent;
import io.taskrelay.spec.UpdateEvent;
import io.taskrelay.util.Utils;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Delivers every task event to the task's webhooks as a JSON {@link StreamResponse}.
 * <p>
 * Each (task, webhook) registration has its own delivery chain: an event is posted only
 * after the previous event for the same registration was delivered or given up on, so a
 * receiver sees the events in generation order and a slow or failing receiver delays no
 * other. Failed attempts (network errors, timeouts, {@code 5xx}, {@code 408} and
 * {@code 429} responses) are retried according to the {@link DeliveryPolicy}; once the
 * attempts are exhausted the event is dropped and the failure logged. Any other status,
 * {@code 401} and {@code 403} included, is a rejection and is not retried. An attempt
 * that times out is cancelled before the next one starts. Delivery outcomes
 * never affect the task.
 * <p>
 * The registrations of a task are released once its terminal event has been queued.
 */
@ApplicationScoped
public class BasePushNotificationSender implements PushNotificationSender {

    private static final Logger LOGGER = LoggerFactory.getLogger(BasePushNotificationSender.class);

    private final PushNotificationConfigStore configStore;
    private final HttpClientManager clientManager;
    private final DeliveryPolicy policy;
    private final WebhookUrlValidator urlValidator;
    private final Executor executor;
    private final ConcurrentMap<DeliveryKey, CompletableFuture<Void>> deliveryChains = new ConcurrentHashMap<>();

    @Inject
    public BasePushNotificationSender(PushNotificationConfigStore configStore, HttpClientManager clientManager,
                                      A2AServerSettings settings) {
        this(configStore, clientManager, settings.deliveryPolicy(),
                new WebhookUrlValidator(settings.allowPrivateDestinations()), ForkJoinPool.commonPool());
    }

    public BasePushNotificationSender(PushNotificationConfigStore configStore, HttpClientManager clientManager,
                                      DeliveryPolicy policy, WebhookUrlValidator urlValidator, Executor executor) {
        this.configStore = configStore;
        this.clientManager = clientManager;
        this.policy = policy;
        this.urlValidator = urlValidator;
        this.executor = executor;
    }

    @Override
    public void sendNotification(StreamingEventKind kind) {
        String taskId = taskIdOf(kind);
        if (taskId == null) {
            LOGGER.debug("Not pushing {} without a task id", kind.getClass().getSimpleName());
            return;
        }
        List<PushNotificationConfig> pushConfigs = configStore.getInfo(taskId);
        if (pushConfigs.isEmpty()) {
            return;
        }

        String body;
        try {
            body = Utils.toJsonString(StreamResponse.of(kind));
        } catch (JsonProcessingException e) {
            LOGGER.error("Cannot serialize {} for task {}, not pushing it", kind.getClass().getSimpleName(), taskId, e);
            return;
        }

        for (PushNotificationConfig pushConfig : pushConfigs) {
            DeliveryKey key = new DeliveryKey(taskId, pushConfig.id() == null ? pushConfig.url() : pushConfig.id());
            CompletableFuture<Void> chain = deliveryChains.compute(key, (k, tail) ->
                    (tail == null ? CompletableFuture.<Void>completedFuture(null) : tail)
                            .thenComposeAsync(v -> deliver(taskId, pushConfig, body), executor));
            chain.whenComplete((v, t) -> deliveryChains.remove(key, chain));
        }

        if (isTerminal(kind)) {
            LOGGER.debug("Task {} finished, releasing {} webhook registrations", taskId, pushConfigs.size());
            configStore.deleteAll(taskId);
        }
    }

    /**
     * @return a future that completes when the event was delivered or given up on, never exceptionally
     */
    private CompletableFuture<Void> deliver(String taskId, PushNotificationConfig pushConfig, String body) {
        CompletableFuture<Void> result = new CompletableFuture<>();
        attempt(taskId, pushConfig, body, 1, result);
        return result;
    }

    private void attempt(String taskId, PushNotificationConfig pushConfig, String body, int attempt,
                         CompletableFuture<Void> result) {
        URI uri;
        try {
            uri = urlValidator.validate(pushConfig.url());
        } catch (A2AError e) {
            LOGGER.warn("Not delivering event of task {} to {}: {}", taskId, pushConfig.url(), e.getMessage());
            result.complete(null);
            return;
        }

        CompletableFuture<HttpResponse> sent;
        try {
            sent = post(uri, pushConfig, body);
        } catch (RuntimeException e) {
            sent = CompletableFuture.failedFuture(e);
        }
        CompletableFuture<HttpResponse> request = sent;
        CompletableFuture<HttpResponse> response = request.copy()
                .orTimeout(policy.attemptTimeout().toMillis(), TimeUnit.MILLISECONDS);

        response.whenComplete((httpResponse, failed) -> {
            Throwable error = unwrap(failed);
            if (error instanceof TimeoutException) {
                request.cancel(true);
            }
            if (error == null && httpResponse.success()) {
                LOGGER.debug("Delivered event of task {} to {} (attempt {})", taskId, pushConfig.url(), attempt);
                result.complete(null);
                return;
            }
            Integer statusCode = statusCodeOf(httpResponse, error);
            String failure = error != null ? String.valueOf(error) : "HTTP " + statusCode;
            if (statusCode != null && !isRetryable(statusCode)) {
                LOGGER.error("Webhook {} rejected event of task {}: {}", pushConfig.url(), taskId, failure);
                result.complete(null);
                return;
            }
            if (attempt >= policy.maxAttempts()) {
                LOGGER.error("Giving up delivering event of task {} to {} after {} attempts: {}",
                        taskId, pushConfig.url(), attempt, failure);
                result.complete(null);
                return;
            }
            Duration backoff = policy.backoffAfter(attempt);
            LOGGER.debug("Delivery of event of task {} to {} failed ({}), retrying in {} ms",
                    taskId, pushConfig.url(), failure, backoff.toMillis());
            CompletableFuture.delayedExecutor(backoff.toMillis(), TimeUnit.MILLISECONDS, executor)
                    .execute(() -> attempt(taskId, pushConfig, body, attempt + 1, result));
        });
    }

    private CompletableFuture<HttpResponse> post(URI uri, PushNotificationConfig pushConfig, String body) {
        HttpClient client = clientManager.getOrCreate(pushConfig.url());
        String path = uri.getRawPath() == null || uri.getRawPath().isEmpty() ? "/" : uri.getRawPath();
        if (uri.getRawQuery() != null) {
            path = path + "?" + uri.getRawQuery();
        }
        HttpClient.PostRequestBuilder postBuilder = client.post(path)
                .addHeader(CONTENT_TYPE, APPLICATION_JSON)
                .timeout(policy.attemptTimeout());
        String token = pushConfig.token();
        if (token != null && !token.isBlank()) {
            postBuilder.addHeader(X_A2A_NOTIFICATION_TOKEN, token);
        }
        String authorization = authorizationHeader(pushConfig.authentication());
        if (authorization != null) {
            postBuilder.addHeader(AUTHORIZATION, authorization);
        }
        return postBuilder.body(body).send();
    }

    private static @Nullable String authorizationHeader(@Nullable AuthenticationInfo authentication) {
        if (authentication == null || authentication.credentials() == null || authentication.credentials().isBlank()) {
            return null;
        }
        String scheme = authentication.schemes().isEmpty() ? "Bearer" : authentication.schemes().get(0);
        return scheme + " " + authentication.credentials();
    }

    /**
     * @return the status the receiver answered with, or {@code null} if no answer arrived
     */
    private static @Nullable Integer statusCodeOf(@Nullable HttpResponse response, @Nullable Throwable error) {
        if (error instanceof HttpStatusException statusError) {
            return statusError.statusCode();
        }
        return error == null && response != null ? response.statusCode() : null;
    }

    private static @Nullable Throwable unwrap(@Nullable Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }

    private static boolean isRetryable(int statusCode) {
        return statusCode >= 500 || statusCode == 408 || statusCode == 429;
    }

    private static boolean isTerminal(StreamingEventKind kind) {
        if (kind instanceof Task task) {
            return task.status().state().isFinal();
        }
        return kind instanceof TaskStatusUpdateEvent statusUpdate && statusUpdate.status().state().isFinal();
    }

    private static @Nullable String taskIdOf(StreamingEventKind kind) {
        if (kind instanceof Task task) {
            return task.id();
        } else if (kind instanceof UpdateEvent updateEvent) {
            return updateEvent.taskId();
        } else if (kind instanceof Message message) {
            return message.taskId();
        }
        return null;
    }

    private record DeliveryKey(String taskId, String registration) {
    }
}
