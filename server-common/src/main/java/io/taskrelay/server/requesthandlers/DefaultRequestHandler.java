package io.taskrelay.server.requesthandlers;

import static io.taskrelay.util.Assert.checkNotNullParam;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.Flow;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import io.taskrelay.server.ExtendedAgentCard;
import io.taskrelay.server.PublicAgentCard;
import io.taskrelay.server.ServerCallContext;
import io.taskrelay.server.agentexecution.AgentExecutor;
import io.taskrelay.server.agentexecution.RequestContext;
import io.taskrelay.server.auth.AuthorizationScope;
import io.taskrelay.server.auth.ScopeFilter;
import io.taskrelay.server.auth.ScopePolicy;
import io.taskrelay.server.auth.TenantPrincipalScopePolicy;
import io.taskrelay.server.config.A2AServerSettings;
import io.taskrelay.server.events.EventConsumer;
import io.taskrelay.server.events.EventQueue;
import io.taskrelay.server.events.EventQueueClosedException;
import io.taskrelay.server.events.QueueManager;
import io.taskrelay.server.extensions.A2AExtensions;
import io.taskrelay.server.tasks.AgentEmitter;
import io.taskrelay.server.tasks.PushNotificationConfigStore;
import io.taskrelay.server.tasks.PushNotificationSender;
import io.taskrelay.server.tasks.TaskManager;
import io.taskrelay.server.tasks.TaskStore;
import io.taskrelay.server.tasks.TaskStoreException;
import io.taskrelay.server.tasks.WebhookUrlValidator;
import io.taskrelay.server.util.TaskViews;
import io.taskrelay.server.util.async.Internal;
import io.taskrelay.server.version.A2AVersionValidator;
import io.taskrelay.spec.A2AError;
import io.taskrelay.spec.AgentCard;
import io.taskrelay.spec.AgentSkill;
import io.taskrelay.spec.ContentTypeNotSupportedError;
import io.taskrelay.spec.DeleteTaskPushNotificationConfigParams;
import io.taskrelay.spec.Event;
import io.taskrelay.spec.EventKind;
import io.taskrelay.spec.ExtendedAgentCardNotConfiguredError;
import io.taskrelay.spec.FilePart;
import io.taskrelay.spec.GetExtendedAgentCardParams;
import io.taskrelay.spec.GetTaskPushNotificationConfigParams;
import io.taskrelay.spec.InternalError;
import io.taskrelay.spec.InvalidParamsError;
import io.taskrelay.spec.ListTaskPushNotificationConfigParams;
import io.taskrelay.spec.ListTaskPushNotificationConfigResult;
import io.taskrelay.spec.ListTasksParams;
import io.taskrelay.spec.ListTasksResult;
import io.taskrelay.spec.Message;
import io.taskrelay.spec.MessageSendConfiguration;
import io.taskrelay.spec.MessageSendParams;
import io.taskrelay.spec.Part;
import io.taskrelay.spec.PushNotificationConfig;
import io.taskrelay.spec.PushNotificationNotSupportedError;
import io.taskrelay.spec.StreamingEventKind;
import io.taskrelay.spec.Task;
import io.taskrelay.spec.TaskIdParams;
import io.taskrelay.spec.TaskNotFoundError;
import io.taskrelay.spec.TaskPushNotificationConfig;
import io.taskrelay.spec.TaskQueryParams;
import io.taskrelay.spec.TaskState;
import io.taskrelay.spec.TaskStatusUpdateEvent;
import io.taskrelay.spec.TextPart;
import io.taskrelay.spec.UnsupportedOperationError;
import mutiny.zero.ZeroPublisher;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The standard {@link RequestHandler}.
 * <p>
 * Every operation first checks the caller's protocol version and extensions against the
 * agent card and resolves the caller's {@link AuthorizationScope}; tasks outside that scope
 * are reported as not found. Requests are validated completely before anything changes, and
 * every change to a task goes through the {@link TaskManager}.
 * <p>
 * Agents run asynchronously on the internal executor. A blocking {@code SendMessage} waits,
 * at most for the configured blocking timeout, until the task is final or interrupted;
 * a non-blocking one returns the task as soon as it is recorded.
 */
@ApplicationScoped
public class DefaultRequestHandler implements RequestHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(DefaultRequestHandler.class);

    private final AgentCard agentCard;
    private final @Nullable AgentCard extendedAgentCard;
    private final AgentExecutor agentExecutor;
    private final TaskStore taskStore;
    private final TaskManager taskManager;
    private final PushNotificationConfigStore pushConfigStore;
    private final ScopePolicy scopePolicy;
    private final ScopeFilter scopeFilter;
    private final WebhookUrlValidator urlValidator;
    private final A2AServerSettings settings;
    private final Executor executor;

    @Inject
    public DefaultRequestHandler(@PublicAgentCard AgentCard agentCard,
                                 @ExtendedAgentCard Instance<AgentCard> extendedAgentCard,
                                 AgentExecutor agentExecutor, TaskStore taskStore, TaskManager taskManager,
                                 PushNotificationConfigStore pushConfigStore, ScopePolicy scopePolicy,
                                 A2AServerSettings settings, @Internal Executor executor) {
        this(agentCard, extendedAgentCard.isResolvable() ? extendedAgentCard.get() : null, agentExecutor,
                taskStore, taskManager, pushConfigStore, scopePolicy, settings, executor);
    }

    public DefaultRequestHandler(AgentCard agentCard, @Nullable AgentCard extendedAgentCard,
                                 AgentExecutor agentExecutor, TaskStore taskStore, TaskManager taskManager,
                                 PushNotificationConfigStore pushConfigStore, ScopePolicy scopePolicy,
                                 A2AServerSettings settings, Executor executor) {
        this.agentCard = checkNotNullParam("agentCard", agentCard);
        this.extendedAgentCard = extendedAgentCard;
        this.agentExecutor = checkNotNullParam("agentExecutor", agentExecutor);
        this.taskStore = checkNotNullParam("taskStore", taskStore);
        this.taskManager = checkNotNullParam("taskManager", taskManager);
        this.pushConfigStore = checkNotNullParam("pushConfigStore", pushConfigStore);
        this.scopePolicy = checkNotNullParam("scopePolicy", scopePolicy);
        this.settings = checkNotNullParam("settings", settings);
        this.executor = checkNotNullParam("executor", executor);
        this.scopeFilter = new ScopeFilter(taskStore);
        this.urlValidator = new WebhookUrlValidator(settings.allowPrivateDestinations());
    }

    /**
     * Creates a handler with the default settings, no extended card and the
     * {@link TenantPrincipalScopePolicy}.
     */
    public static DefaultRequestHandler create(AgentCard agentCard, AgentExecutor agentExecutor, TaskStore taskStore,
                                               QueueManager queueManager, PushNotificationConfigStore pushConfigStore,
                                               PushNotificationSender pushSender, Executor executor) {
        return create(agentCard, null, agentExecutor, taskStore, queueManager, pushConfigStore, pushSender,
                A2AServerSettings.defaults(), executor);
    }

    public static DefaultRequestHandler create(AgentCard agentCard, @Nullable AgentCard extendedAgentCard,
                                               AgentExecutor agentExecutor, TaskStore taskStore,
                                               QueueManager queueManager, PushNotificationConfigStore pushConfigStore,
                                               PushNotificationSender pushSender, A2AServerSettings settings,
                                               Executor executor) {
        TaskManager taskManager = new TaskManager(taskStore, queueManager, pushSender);
        return new DefaultRequestHandler(agentCard, extendedAgentCard, agentExecutor, taskStore, taskManager,
                pushConfigStore, new TenantPrincipalScopePolicy(), settings, executor);
    }

    @Override
    public EventKind onMessageSend(MessageSendParams params, @Nullable ServerCallContext context) throws A2AError {
        return withStorageErrors(() -> {
            MessageSendConfiguration configuration = params.configuration();
            PreparedSend prepared = prepareSend(params, context, configuration != null && configuration.isBlocking());
            if (prepared.directReply() != null) {
                return prepared.directReply();
            }
            Task result = prepared.task();
            if (prepared.queue() != null) {
                result = awaitFinalOrInterrupted(result.id(), prepared.queue());
            }
            return TaskViews.limitHistory(result, configuration == null ? null : configuration.historyLength(),
                    settings.defaultHistoryLength());
        });
    }

    @Override
    public Flow.Publisher<StreamingEventKind> onMessageSendStream(MessageSendParams params,
                                                                 @Nullable ServerCallContext context) throws A2AError {
        requireStreaming();
        return withStorageErrors(() -> {
            PreparedSend prepared = prepareSend(params, context, true);
            Message directReply = prepared.directReply();
            if (directReply != null) {
                return ZeroPublisher.<StreamingEventKind>fromItems(directReply);
            }
            return new EventConsumer(prepared.queue(), executor, settings.pollTimeout()).consumeAll(prepared.task());
        });
    }

    @Override
    public Task onGetTask(TaskQueryParams params, @Nullable ServerCallContext context) throws A2AError {
        return withStorageErrors(() -> {
            AuthorizationScope scope = authorize(context, params.tenant());
            Task task = scopeFilter.findVisible(params.id(), scope);
            return TaskViews.limitHistory(task, params.historyLength(), settings.defaultHistoryLength());
        });
    }

    @Override
    public ListTasksResult onListTasks(ListTasksParams params, @Nullable ServerCallContext context) throws A2AError {
        return withStorageErrors(() -> {
            AuthorizationScope scope = authorize(context, params.tenant());
            return taskStore.list(params, scope);
        });
    }

    @Override
    public Task onCancelTask(TaskIdParams params, @Nullable ServerCallContext context) throws A2AError {
        return withStorageErrors(() -> {
            AuthorizationScope scope = authorize(context, params.tenant());
            Task task = scopeFilter.findVisible(params.id(), scope);
            TaskManager.CancelResult result = taskManager.cancel(task.id());
            if (result.transitioned()) {
                RequestContext requestContext = RequestContext.builder()
                        .taskId(task.id())
                        .contextId(task.contextId())
                        .task(result.task())
                        .callContext(context)
                        .build();
                AgentEmitter emitter = new AgentEmitter(taskManager, task.id(), task.contextId());
                executor.execute(() -> notifyAgentOfCancel(requestContext, emitter));
            }
            return TaskViews.limitHistory(result.task(), null, settings.defaultHistoryLength());
        });
    }

    @Override
    public Flow.Publisher<StreamingEventKind> onSubscribeToTask(TaskIdParams params,
                                                               @Nullable ServerCallContext context) throws A2AError {
        requireStreaming();
        return withStorageErrors(() -> {
            AuthorizationScope scope = authorize(context, params.tenant());
            Task task = scopeFilter.findVisible(params.id(), scope);
            TaskManager.Subscription subscription = taskManager.subscribe(task.id());
            LOGGER.debug("New subscriber for task {}", task.id());
            return new EventConsumer(subscription.queue(), executor, settings.pollTimeout())
                    .consumeAll(subscription.snapshot());
        });
    }

    @Override
    public TaskPushNotificationConfig onCreateTaskPushNotificationConfig(TaskPushNotificationConfig params,
                                                                         @Nullable ServerCallContext context)
            throws A2AError {
        requirePushNotifications();
        return withStorageErrors(() -> {
            AuthorizationScope scope = authorize(context, params.tenant());
            Task task = scopeFilter.findVisible(params.taskId(), scope);
            urlValidator.validate(params.pushNotificationConfig().url());
            PushNotificationConfig stored = taskManager.withLock(task.id(), () -> {
                requireNotFinal(taskManager.getTask(task.id()), task.id());
                return pushConfigStore.setInfo(task.id(), params.pushNotificationConfig());
            });
            LOGGER.debug("Registered webhook {} for task {}", stored.id(), task.id());
            return new TaskPushNotificationConfig(task.id(), stored, params.tenant());
        });
    }

    @Override
    public TaskPushNotificationConfig onGetTaskPushNotificationConfig(GetTaskPushNotificationConfigParams params,
                                                                      @Nullable ServerCallContext context)
            throws A2AError {
        requirePushNotifications();
        return withStorageErrors(() -> {
            AuthorizationScope scope = authorize(context, params.tenant());
            Task task = scopeFilter.findVisible(params.taskId(), scope);
            PushNotificationConfig config = pushConfigStore.getInfo(task.id(), params.id());
            if (config == null) {
                throw new InvalidParamsError("No push notification config " + params.id() + " for task " + task.id(),
                        Map.of("field", "id", "taskId", task.id(), "id", params.id()));
            }
            return new TaskPushNotificationConfig(task.id(), config, params.tenant());
        });
    }

    @Override
    public ListTaskPushNotificationConfigResult onListTaskPushNotificationConfig(
            ListTaskPushNotificationConfigParams params, @Nullable ServerCallContext context) throws A2AError {
        requirePushNotifications();
        return withStorageErrors(() -> {
            AuthorizationScope scope = authorize(context, params.tenant());
            Task task = scopeFilter.findVisible(params.id(), scope);
            List<PushNotificationConfig> configs = pushConfigStore.getInfo(task.id());

            int start = 0;
            String pageToken = params.pageToken();
            if (pageToken != null && !pageToken.isEmpty()) {
                start = indexOfConfig(configs, pageToken) + 1;
                if (start == 0) {
                    throw new InvalidParamsError("Invalid page token", Map.of("field", "pageToken"));
                }
            }
            Integer pageSize = params.pageSize();
            int end = pageSize == null || pageSize == 0 ? configs.size() : Math.min(configs.size(), start + pageSize);

            List<TaskPushNotificationConfig> page = new ArrayList<>(end - start);
            for (PushNotificationConfig config : configs.subList(start, end)) {
                page.add(new TaskPushNotificationConfig(task.id(), config, params.tenant()));
            }
            String nextPageToken = end < configs.size() ? configs.get(end - 1).id() : "";
            return new ListTaskPushNotificationConfigResult(page, nextPageToken);
        });
    }

    @Override
    public void onDeleteTaskPushNotificationConfig(DeleteTaskPushNotificationConfigParams params,
                                                   @Nullable ServerCallContext context) throws A2AError {
        requirePushNotifications();
        withStorageErrors(() -> {
            AuthorizationScope scope = authorize(context, params.tenant());
            Task task = scopeFilter.findVisible(params.taskId(), scope);
            pushConfigStore.deleteInfo(task.id(), params.id());
            return null;
        });
    }

    @Override
    public AgentCard onGetExtendedAgentCard(GetExtendedAgentCardParams params,
                                            @Nullable ServerCallContext context) throws A2AError {
        negotiate(context);
        if (!agentCard.capabilities().extendedAgentCard() || extendedAgentCard == null) {
            throw new ExtendedAgentCardNotConfiguredError("The agent does not provide an extended agent card");
        }
        return extendedAgentCard;
    }

    @Override
    public void onDeleteTask(TaskIdParams params, @Nullable ServerCallContext context) throws A2AError {
        withStorageErrors(() -> {
            AuthorizationScope scope = authorize(context, params.tenant());
            Task task = scopeFilter.findVisible(params.id(), scope);
            taskManager.withLock(task.id(), () -> {
                Task current = taskManager.getTask(task.id());
                if (current == null) {
                    throw TaskNotFoundError.forTask(task.id());
                }
                TaskState state = current.status().state();
                if (!state.isFinal()) {
                    throw new UnsupportedOperationError("Task " + task.id() + " is in state " + state.asString()
                            + "; only tasks in a final state can be deleted",
                            Map.of("taskId", task.id(), "state", state.asString()));
                }
                pushConfigStore.deleteAll(task.id());
                taskManager.purge(task.id());
                return null;
            });
            LOGGER.info("Deleted task {}", task.id());
            return null;
        });
    }

    /**
     * Validates a {@code SendMessage} request and records its effect: either a direct reply
     * from the agent, or a new or continued task with the agent started on it.
     *
     * @param subscribe whether to register a subscriber queue before the agent starts
     */
    private PreparedSend prepareSend(MessageSendParams params, @Nullable ServerCallContext context, boolean subscribe) {
        AuthorizationScope scope = authorize(context, params.tenant());
        Message message = params.message();
        MessageSendConfiguration configuration = params.configuration();
        validateMessage(message);
        validateContentTypes(message, configuration);
        PushNotificationConfig pushConfig = configuration == null ? null : configuration.pushNotificationConfig();
        if (pushConfig != null) {
            requirePushNotifications();
            urlValidator.validate(pushConfig.url());
        }
        List<Task> relatedTasks = resolveReferencedTasks(message, scope);

        String existingTaskId = message.taskId();
        if (existingTaskId == null) {
            return startTask(message, configuration, pushConfig, relatedTasks, scope, context, subscribe);
        }
        return continueTask(existingTaskId, message, configuration, pushConfig, relatedTasks, scope, context, subscribe);
    }

    private PreparedSend startTask(Message message, @Nullable MessageSendConfiguration configuration,
                                   @Nullable PushNotificationConfig pushConfig, List<Task> relatedTasks,
                                   AuthorizationScope scope, @Nullable ServerCallContext context, boolean subscribe) {
        String taskId = UUID.randomUUID().toString();
        String contextId = message.contextId() != null ? message.contextId() : UUID.randomUUID().toString();
        Message recorded = Message.builder(message).taskId(taskId).contextId(contextId).build();
        RequestContext.Builder requestContext = RequestContext.builder()
                .taskId(taskId)
                .contextId(contextId)
                .message(recorded)
                .relatedTasks(relatedTasks)
                .configuration(configuration)
                .callContext(context);

        Message directReply = agentExecutor.respondDirectly(requestContext.build());
        if (directReply != null) {
            LOGGER.debug("Agent answered message {} directly", message.messageId());
            return PreparedSend.reply(Message.builder(directReply).contextId(contextId).taskId(null).build());
        }

        PreparedSend prepared = taskManager.withLock(taskId, () -> {
            if (pushConfig != null) {
                pushConfigStore.setInfo(taskId, pushConfig);
            }
            Task task = taskManager.createTask(taskId, contextId, recorded, scope);
            EventQueue queue = subscribe ? taskManager.subscribe(taskId).queue() : null;
            return PreparedSend.task(task, queue);
        });
        startAgent(requestContext.task(prepared.task()).build());
        return prepared;
    }

    private PreparedSend continueTask(String taskId, Message message, @Nullable MessageSendConfiguration configuration,
                                      @Nullable PushNotificationConfig pushConfig, List<Task> relatedTasks,
                                      AuthorizationScope scope, @Nullable ServerCallContext context,
                                      boolean subscribe) {
        Task existing = scopeFilter.findVisible(taskId, scope);
        if (message.contextId() != null && !message.contextId().equals(existing.contextId())) {
            throw new InvalidParamsError("Message contextId " + message.contextId()
                    + " does not match the contextId of task " + taskId,
                    Map.of("field", "message.contextId", "taskId", taskId, "contextId", existing.contextId()));
        }
        Message recorded = Message.builder(message).taskId(taskId).contextId(existing.contextId()).build();

        PreparedSend prepared = taskManager.withLock(taskId, () -> {
            requireNotFinal(taskManager.getTask(taskId), taskId);
            if (pushConfig != null) {
                pushConfigStore.setInfo(taskId, pushConfig);
            }
            Task task = taskManager.appendMessage(taskId, recorded);
            EventQueue queue = subscribe ? taskManager.subscribe(taskId).queue() : null;
            return PreparedSend.task(task, queue);
        });
        startAgent(RequestContext.builder()
                .taskId(taskId)
                .contextId(existing.contextId())
                .message(recorded)
                .task(prepared.task())
                .relatedTasks(relatedTasks)
                .configuration(configuration)
                .callContext(context)
                .build());
        return prepared;
    }

    private void startAgent(RequestContext requestContext) {
        AgentEmitter emitter = new AgentEmitter(taskManager, requestContext.getTaskId(), requestContext.getContextId());
        executor.execute(() -> runAgent(requestContext, emitter));
    }

    private void runAgent(RequestContext requestContext, AgentEmitter emitter) {
        String taskId = requestContext.getTaskId();
        try {
            agentExecutor.execute(requestContext, emitter);
        } catch (RuntimeException e) {
            LOGGER.error("Agent failed while working on task {}", taskId, e);
            failTask(emitter, e);
        }
    }

    private void failTask(AgentEmitter emitter, RuntimeException cause) {
        String taskId = emitter.getTaskId();
        try {
            taskManager.withLock(taskId, () -> {
                Task task = taskManager.getTask(taskId);
                if (task != null && !task.status().state().isFinal()) {
                    String reason = cause.getMessage() == null ? "Agent failed" : cause.getMessage();
                    emitter.fail(emitter.newAgentMessage(List.of(new TextPart(reason)), null));
                }
                return null;
            });
        } catch (A2AError | TaskStoreException e) {
            LOGGER.error("Could not record the failure of task {}", taskId, e);
        }
    }

    private void notifyAgentOfCancel(RequestContext requestContext, AgentEmitter emitter) {
        try {
            agentExecutor.cancel(requestContext, emitter);
        } catch (RuntimeException e) {
            LOGGER.warn("Agent cancel hook failed for task {}", requestContext.getTaskId(), e);
        }
    }

    /**
     * Reads events until the task is final or interrupted, or the blocking timeout elapses,
     * and returns the stored task.
     */
    private Task awaitFinalOrInterrupted(String taskId, EventQueue queue) {
        long deadline = System.nanoTime() + settings.blockingTimeout().toNanos();
        int pollMillis = (int) Math.max(1, settings.pollTimeout().toMillis());
        try {
            while (true) {
                long remaining = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                if (remaining <= 0) {
                    LOGGER.debug("Blocking wait for task {} timed out", taskId);
                    break;
                }
                Event event = queue.dequeueEvent((int) Math.min(remaining, pollMillis));
                if (event instanceof TaskStatusUpdateEvent statusUpdate) {
                    TaskState state = statusUpdate.status().state();
                    if (statusUpdate.isFinal() || state.isFinal() || state.isInterrupted()) {
                        break;
                    }
                }
            }
        } catch (EventQueueClosedException e) {
            // the main queue closes after the final event; the store holds the outcome
            LOGGER.debug("Event queue of task {} closed while waiting (overflowed: {})", taskId, e.isOverflowed());
        } finally {
            queue.close(true);
        }
        Task task = taskManager.getTask(taskId);
        if (task == null) {
            throw TaskNotFoundError.forTask(taskId);
        }
        return task;
    }

    private AuthorizationScope authorize(@Nullable ServerCallContext context, @Nullable String tenant) {
        negotiate(context);
        return scopePolicy.resolve(context, tenant);
    }

    private void negotiate(@Nullable ServerCallContext context) {
        A2AVersionValidator.validateProtocolVersion(agentCard, context, settings.defaultProtocolVersion());
        A2AExtensions.validateRequiredExtensions(agentCard, context);
    }

    private static void validateMessage(Message message) {
        if (message.parts().isEmpty()) {
            throw new InvalidParamsError("Message must contain at least one part", Map.of("field", "message.parts"));
        }
        if (message.messageId().isBlank()) {
            throw new InvalidParamsError("Message must have a messageId", Map.of("field", "message.messageId"));
        }
        if (message.role() != Message.Role.ROLE_USER) {
            throw new InvalidParamsError("Only user messages can be sent to an agent", Map.of("field", "message.role"));
        }
    }

    private void validateContentTypes(Message message, @Nullable MessageSendConfiguration configuration) {
        List<String> accepted = configuration == null ? null : configuration.acceptedOutputModes();
        if (accepted != null && !accepted.isEmpty()) {
            List<String> produced = collectModes(agentCard.defaultOutputModes(), false);
            if (!produced.isEmpty() && accepted.stream().noneMatch(mode -> matchesAny(mode, produced))) {
                throw new ContentTypeNotSupportedError("None of the accepted output modes " + accepted
                        + " is produced by the agent", Map.of("field", "configuration.acceptedOutputModes",
                        "supported", produced));
            }
        }
        List<String> inputModes = collectModes(agentCard.defaultInputModes(), true);
        if (inputModes.isEmpty()) {
            return;
        }
        for (Part<?> part : message.parts()) {
            if (part instanceof FilePart filePart) {
                String mimeType = filePart.file().mimeType();
                if (mimeType != null && !matchesAny(mimeType, inputModes)) {
                    throw new ContentTypeNotSupportedError("The agent does not accept files of type " + mimeType,
                            Map.of("field", "message.parts", "mimeType", mimeType, "supported", inputModes));
                }
            }
        }
    }

    private List<String> collectModes(List<String> defaults, boolean input) {
        List<String> modes = new ArrayList<>(defaults);
        for (AgentSkill skill : agentCard.skills()) {
            List<String> skillModes = input ? skill.inputModes() : skill.outputModes();
            if (skillModes != null) {
                modes.addAll(skillModes);
            }
        }
        return modes;
    }

    /**
     * Media type matching with {@code *}{@code /*} and {@code type/*} wildcards on either side.
     */
    static boolean matchesAny(String mediaType, List<String> supported) {
        String candidate = baseType(mediaType);
        for (String mode : supported) {
            String other = baseType(mode);
            if (candidate.equals(other) || "*/*".equals(candidate) || "*/*".equals(other)
                    || wildcardMatches(candidate, other) || wildcardMatches(other, candidate)) {
                return true;
            }
        }
        return false;
    }

    private static boolean wildcardMatches(String pattern, String type) {
        return pattern.endsWith("/*") && type.startsWith(pattern.substring(0, pattern.length() - 1));
    }

    private static String baseType(String mediaType) {
        int semicolon = mediaType.indexOf(';');
        String base = semicolon < 0 ? mediaType : mediaType.substring(0, semicolon);
        return base.trim().toLowerCase(Locale.ROOT);
    }

    private List<Task> resolveReferencedTasks(Message message, AuthorizationScope scope) {
        List<String> referenceTaskIds = message.referenceTaskIds();
        if (referenceTaskIds == null || referenceTaskIds.isEmpty()) {
            return List.of();
        }
        List<Task> related = new ArrayList<>(referenceTaskIds.size());
        for (String referenceTaskId : referenceTaskIds) {
            related.add(scopeFilter.findVisible(referenceTaskId, scope));
        }
        return related;
    }

    private void requireStreaming() {
        if (!agentCard.capabilities().streaming()) {
            throw new UnsupportedOperationError("The agent does not support streaming");
        }
    }

    private void requirePushNotifications() {
        if (!agentCard.capabilities().pushNotifications()) {
            throw new PushNotificationNotSupportedError("The agent does not support push notifications");
        }
    }

    private static void requireNotFinal(@Nullable Task task, String taskId) {
        if (task == null) {
            throw TaskNotFoundError.forTask(taskId);
        }
        TaskState state = task.status().state();
        if (state.isFinal()) {
            throw new UnsupportedOperationError("Task " + taskId + " is in final state " + state.asString(),
                    Map.of("taskId", taskId, "state", state.asString()));
        }
    }

    private static int indexOfConfig(List<PushNotificationConfig> configs, String id) {
        for (int i = 0; i < configs.size(); i++) {
            if (id.equals(configs.get(i).id())) {
                return i;
            }
        }
        return -1;
    }

    private static <T> T withStorageErrors(Supplier<T> operation) {
        try {
            return operation.get();
        } catch (TaskStoreException e) {
            LOGGER.error("Task storage failure{}", e.getTaskId() == null ? "" : " for task " + e.getTaskId(), e);
            throw new InternalError("Task storage failure");
        }
    }

    private record PreparedSend(@Nullable Task task, @Nullable EventQueue queue, @Nullable Message directReply) {

        static PreparedSend task(Task task, @Nullable EventQueue queue) {
            return new PreparedSend(task, queue, null);
        }

        static PreparedSend reply(Message message) {
            return new PreparedSend(null, null, message);
        }
    }
}
