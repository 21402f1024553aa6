package io.taskrelay.server.tasks;

import static io.taskrelay.common.A2AHeaders.APPLICATION_JSON;
import static io.taskrelay.common.A2AHeaders.AUTHORIZATION;
import static io.taskrelay.common.A2AHeaders.CONTENT_TYPE;
import static io.taskrelay.common.A2AHeaders.X_A2A_NOTIFICATION_TOKEN;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.net.InetAddress;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.taskrelay.client.http.HttpClient;
import io.taskrelay.client.http.HttpResponse;
import io.taskrelay.client.http.HttpStatusException;
import io.taskrelay.server.http.HttpClientManager;
import io.taskrelay.spec.Artifact;
import io.taskrelay.spec.AuthenticationInfo;
import io.taskrelay.spec.PushNotificationConfig;
import io.taskrelay.spec.StreamResponse;
import io.taskrelay.spec.StreamingEventKind;
import io.taskrelay.spec.Task;
import io.taskrelay.spec.TaskArtifactUpdateEvent;
import io.taskrelay.spec.TaskState;
import io.taskrelay.spec.TaskStatus;
import io.taskrelay.spec.TaskStatusUpdateEvent;
import io.taskrelay.spec.TextPart;
import io.taskrelay.util.Utils;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.slf4j.LoggerFactory;

public class PushNotificationSenderTest {

    private static final String TASK_ID = "task-1";
    private static final String CONTEXT_ID = "ctx-1";
    private static final DeliveryPolicy FAST_POLICY = new DeliveryPolicy(3, Duration.ofMillis(10), 2.0,
            Duration.ofMillis(50), Duration.ofMillis(500));

    private TestHttpClient testHttpClient;
    private InMemoryPushNotificationConfigStore configStore;
    private BasePushNotificationSender sender;
    private ExecutorService executor;
    private ListAppender<ILoggingEvent> logAppender;

    /**
     * Captures the webhook requests instead of sending them.
     */
    private static class TestHttpClient implements HttpClient {
        final List<String> bodies = Collections.synchronizedList(new ArrayList<>());
        final List<String> paths = Collections.synchronizedList(new ArrayList<>());
        final List<Map<String, String>> headers = Collections.synchronizedList(new ArrayList<>());
        final Queue<Integer> statusCodes = new ConcurrentLinkedQueue<>();
        final Set<String> hangingPaths = ConcurrentHashMap.newKeySet();
        final List<CompletableFuture<HttpResponse>> hangingRequests = Collections.synchronizedList(new ArrayList<>());
        volatile CountDownLatch latch;
        volatile boolean shouldThrowException = false;

        @Override
        public GetRequestBuilder get(String path) {
            throw new UnsupportedOperationException();
        }

        @Override
        public PostRequestBuilder post(String path) {
            return new TestPostBuilder(path);
        }

        @Override
        public DeleteRequestBuilder delete(String path) {
            throw new UnsupportedOperationException();
        }

        class TestPostBuilder implements HttpClient.PostRequestBuilder {
            private final String path;
            private final Map<String, String> requestHeaders = new HashMap<>();
            private volatile String body;

            TestPostBuilder(String path) {
                this.path = path;
            }

            @Override
            public PostRequestBuilder body(String body) {
                this.body = body;
                return this;
            }

            @Override
            public PostRequestBuilder addHeader(String name, String value) {
                requestHeaders.put(name, value);
                return this;
            }

            @Override
            public PostRequestBuilder addHeaders(Map<String, String> headers) {
                requestHeaders.putAll(headers);
                return this;
            }

            @Override
            public PostRequestBuilder timeout(Duration timeout) {
                return this;
            }

            @Override
            public CompletableFuture<HttpResponse> send() {
                if (hangingPaths.contains(path)) {
                    CompletableFuture<HttpResponse> hanging = new CompletableFuture<>();
                    hangingRequests.add(hanging);
                    return hanging;
                }
                try {
                    bodies.add(body);
                    paths.add(path);
                    headers.add(new HashMap<>(requestHeaders));
                    if (shouldThrowException) {
                        return CompletableFuture.failedFuture(new IOException("Simulated network error"));
                    }
                    Integer status = statusCodes.poll();
                    int statusCode = status == null ? 200 : status;
                    if (statusCode == 401 || statusCode == 403) {
                        // same failure the JDK client reports for these
                        return CompletableFuture.failedFuture(new HttpStatusException(statusCode, "HTTP " + statusCode));
                    }
                    return CompletableFuture.completedFuture(new HttpResponse() {
                        @Override
                        public int statusCode() {
                            return statusCode;
                        }

                        @Override
                        public String body() {
                            return "";
                        }
                    });
                } finally {
                    if (latch != null) {
                        latch.countDown();
                    }
                }
            }
        }
    }

    @BeforeEach
    public void setUp() {
        testHttpClient = new TestHttpClient();
        configStore = new InMemoryPushNotificationConfigStore();
        executor = Executors.newCachedThreadPool();
        WebhookUrlValidator publicResolver = new WebhookUrlValidator(false,
                host -> new InetAddress[] {InetAddress.getByAddress(host, new byte[] {93, (byte) 184, (byte) 216, 34})});
        sender = new BasePushNotificationSender(configStore, new HttpClientManager(url -> testHttpClient),
                FAST_POLICY, publicResolver, executor);

        Logger logger = (Logger) LoggerFactory.getLogger(BasePushNotificationSender.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        logger.addAppender(logAppender);
    }

    @AfterEach
    public void tearDown() {
        Logger logger = (Logger) LoggerFactory.getLogger(BasePushNotificationSender.class);
        logger.detachAppender(logAppender);
        executor.shutdownNow();
    }

    @Test
    public void testSendsEventWithTokenAndAuthorization() throws Exception {
        configStore.setInfo(TASK_ID, PushNotificationConfig.builder()
                .url("https://hooks.example.com/a2a?tenant=acme")
                .token("client-token")
                .authentication(new AuthenticationInfo(List.of("Bearer"), "secret"))
                .build());
        testHttpClient.latch = new CountDownLatch(1);

        Task task = task(TaskState.TASK_STATE_WORKING);
        sender.sendNotification(task);

        assertTrue(testHttpClient.latch.await(5, TimeUnit.SECONDS));
        assertEquals("/a2a?tenant=acme", testHttpClient.paths.get(0));
        Map<String, String> sentHeaders = testHttpClient.headers.get(0);
        assertEquals(APPLICATION_JSON, sentHeaders.get(CONTENT_TYPE));
        assertEquals("client-token", sentHeaders.get(X_A2A_NOTIFICATION_TOKEN));
        assertEquals("Bearer secret", sentHeaders.get(AUTHORIZATION));

        StreamResponse response = Utils.unmarshalFrom(testHttpClient.bodies.get(0), StreamResponse.class);
        assertEquals(task.id(), assertInstanceOf(Task.class, response.event()).id());
    }

    @Test
    public void testNoTokenHeaderWithoutToken() throws Exception {
        configStore.setInfo(TASK_ID, PushNotificationConfig.builder().url("https://hooks.example.com/a2a").build());
        testHttpClient.latch = new CountDownLatch(1);

        sender.sendNotification(statusUpdate(TaskState.TASK_STATE_WORKING));

        assertTrue(testHttpClient.latch.await(5, TimeUnit.SECONDS));
        Map<String, String> sentHeaders = testHttpClient.headers.get(0);
        assertFalse(sentHeaders.containsKey(X_A2A_NOTIFICATION_TOKEN));
        assertFalse(sentHeaders.containsKey(AUTHORIZATION));
    }

    @Test
    public void testNothingSentWithoutRegistration() throws Exception {
        testHttpClient.latch = new CountDownLatch(1);

        sender.sendNotification(task(TaskState.TASK_STATE_WORKING));

        assertFalse(testHttpClient.latch.await(200, TimeUnit.MILLISECONDS));
        assertTrue(testHttpClient.bodies.isEmpty());
    }

    @Test
    public void testServerErrorsAreRetried() throws Exception {
        configStore.setInfo(TASK_ID, PushNotificationConfig.builder().url("https://hooks.example.com/a2a").build());
        testHttpClient.statusCodes.add(503);
        testHttpClient.statusCodes.add(429);
        testHttpClient.latch = new CountDownLatch(3);

        sender.sendNotification(statusUpdate(TaskState.TASK_STATE_WORKING));

        assertTrue(testHttpClient.latch.await(5, TimeUnit.SECONDS));
        Thread.sleep(200);
        assertEquals(3, testHttpClient.bodies.size());
        assertTrue(errors().isEmpty());
    }

    @Test
    public void testClientErrorIsNotRetried() throws Exception {
        configStore.setInfo(TASK_ID, PushNotificationConfig.builder().url("https://hooks.example.com/a2a").build());
        testHttpClient.statusCodes.add(400);
        testHttpClient.latch = new CountDownLatch(1);

        sender.sendNotification(statusUpdate(TaskState.TASK_STATE_WORKING));

        assertTrue(testHttpClient.latch.await(5, TimeUnit.SECONDS));
        waitFor(() -> !errors().isEmpty());
        Thread.sleep(200);
        assertEquals(1, testHttpClient.bodies.size());
        assertTrue(errors().get(0).getFormattedMessage().contains("HTTP 400"));
    }

    @ParameterizedTest
    @ValueSource(ints = {401, 403})
    public void testAuthRejectionIsNotRetried(int statusCode) throws Exception {
        configStore.setInfo(TASK_ID, PushNotificationConfig.builder().url("https://hooks.example.com/a2a").build());
        testHttpClient.statusCodes.add(statusCode);
        testHttpClient.latch = new CountDownLatch(1);

        sender.sendNotification(statusUpdate(TaskState.TASK_STATE_WORKING));

        assertTrue(testHttpClient.latch.await(5, TimeUnit.SECONDS));
        waitFor(() -> !errors().isEmpty());
        Thread.sleep(200);
        assertEquals(1, testHttpClient.bodies.size());
        String message = errors().get(0).getFormattedMessage();
        assertTrue(message.contains("rejected"), message);
    }

    @Test
    public void testTimedOutAttemptIsCancelled() throws Exception {
        sender = new BasePushNotificationSender(configStore, new HttpClientManager(url -> testHttpClient),
                new DeliveryPolicy(2, Duration.ofMillis(10), 2.0, Duration.ofMillis(50), Duration.ofMillis(100)),
                new WebhookUrlValidator(false,
                        host -> new InetAddress[] {InetAddress.getByAddress(host, new byte[] {93, (byte) 184, (byte) 216, 34})}),
                executor);
        configStore.setInfo(TASK_ID, PushNotificationConfig.builder().url("https://slow.example.com/hang").build());
        testHttpClient.hangingPaths.add("/hang");

        sender.sendNotification(statusUpdate(TaskState.TASK_STATE_WORKING));

        waitFor(() -> !errors().isEmpty());
        assertEquals(2, testHttpClient.hangingRequests.size());
        synchronized (testHttpClient.hangingRequests) {
            for (CompletableFuture<HttpResponse> request : testHttpClient.hangingRequests) {
                assertTrue(request.isCancelled());
            }
        }
        assertTrue(errors().get(0).getFormattedMessage().contains("Giving up"));
    }

    @Test
    public void testExhaustedRetriesAreLogged() throws Exception {
        configStore.setInfo(TASK_ID, PushNotificationConfig.builder().url("https://hooks.example.com/a2a").build());
        testHttpClient.shouldThrowException = true;
        testHttpClient.latch = new CountDownLatch(FAST_POLICY.maxAttempts());

        sender.sendNotification(statusUpdate(TaskState.TASK_STATE_WORKING));

        assertTrue(testHttpClient.latch.await(5, TimeUnit.SECONDS));
        waitFor(() -> !errors().isEmpty());
        assertEquals(FAST_POLICY.maxAttempts(), testHttpClient.bodies.size());
        String message = errors().get(0).getFormattedMessage();
        assertTrue(message.contains("Giving up"), message);
        assertTrue(message.contains("Simulated network error"), message);
    }

    @Test
    public void testEventsAreDeliveredInOrder() throws Exception {
        configStore.setInfo(TASK_ID, PushNotificationConfig.builder().url("https://hooks.example.com/a2a").build());
        // the first event needs a retry, the others must still arrive after it
        testHttpClient.statusCodes.add(500);
        testHttpClient.latch = new CountDownLatch(6);

        for (int i = 0; i < 5; i++) {
            sender.sendNotification(artifactUpdate("artifact-" + i));
        }

        assertTrue(testHttpClient.latch.await(5, TimeUnit.SECONDS));
        List<String> delivered = new ArrayList<>();
        for (String body : testHttpClient.bodies) {
            StreamingEventKind event = Utils.unmarshalFrom(body, StreamResponse.class).event();
            delivered.add(((TaskArtifactUpdateEvent) event).artifact().artifactId());
        }
        assertEquals(List.of("artifact-0", "artifact-0", "artifact-1", "artifact-2", "artifact-3", "artifact-4"),
                delivered);
    }

    @Test
    public void testHangingWebhookDoesNotDelayOthers() throws Exception {
        configStore.setInfo(TASK_ID, PushNotificationConfig.builder().id("slow").url("https://slow.example.com/hang").build());
        configStore.setInfo(TASK_ID, PushNotificationConfig.builder().id("fast").url("https://fast.example.com/ok").build());
        testHttpClient.hangingPaths.add("/hang");
        testHttpClient.latch = new CountDownLatch(2);

        sender.sendNotification(statusUpdate(TaskState.TASK_STATE_WORKING));
        sender.sendNotification(artifactUpdate("a1"));

        assertTrue(testHttpClient.latch.await(400, TimeUnit.MILLISECONDS));
        assertEquals(List.of("/ok", "/ok"), testHttpClient.paths);
    }

    @Test
    public void testRegistrationsAreReleasedAfterFinalEvent() throws Exception {
        configStore.setInfo(TASK_ID, PushNotificationConfig.builder().url("https://hooks.example.com/a2a").build());
        testHttpClient.latch = new CountDownLatch(1);

        sender.sendNotification(statusUpdate(TaskState.TASK_STATE_COMPLETED));

        assertTrue(testHttpClient.latch.await(5, TimeUnit.SECONDS));
        assertTrue(configStore.getInfo(TASK_ID).isEmpty());
    }

    @Test
    public void testPrivateDestinationIsNotContacted() throws Exception {
        WebhookUrlValidator loopbackResolver = new WebhookUrlValidator(false,
                host -> new InetAddress[] {InetAddress.getLoopbackAddress()});
        sender = new BasePushNotificationSender(configStore, new HttpClientManager(url -> testHttpClient),
                FAST_POLICY, loopbackResolver, executor);
        configStore.setInfo(TASK_ID, PushNotificationConfig.builder().url("https://rebound.example.com/a2a").build());
        testHttpClient.latch = new CountDownLatch(1);

        sender.sendNotification(statusUpdate(TaskState.TASK_STATE_WORKING));

        assertFalse(testHttpClient.latch.await(300, TimeUnit.MILLISECONDS));
        assertTrue(testHttpClient.bodies.isEmpty());
    }

    private List<ILoggingEvent> errors() {
        synchronized (logAppender.list) {
            return logAppender.list.stream().filter(event -> event.getLevel() == Level.ERROR).toList();
        }
    }

    private static void waitFor(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (!condition.getAsBoolean() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertTrue(condition.getAsBoolean(), "condition not met in time");
    }

    private static Task task(TaskState state) {
        return Task.builder()
                .id(TASK_ID)
                .contextId(CONTEXT_ID)
                .status(new TaskStatus(state))
                .build();
    }

    private static TaskStatusUpdateEvent statusUpdate(TaskState state) {
        return new TaskStatusUpdateEvent(TASK_ID, CONTEXT_ID, new TaskStatus(state), state.isFinal(), null);
    }

    private static TaskArtifactUpdateEvent artifactUpdate(String artifactId) {
        Artifact artifact = Artifact.builder().artifactId(artifactId).parts(new TextPart("content")).build();
        return new TaskArtifactUpdateEvent(TASK_ID, CONTEXT_ID, artifact);
    }
}
