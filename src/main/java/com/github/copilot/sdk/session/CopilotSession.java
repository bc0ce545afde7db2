package com.github.copilot.sdk.session;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.copilot.sdk.exceptions.RequestTimeoutException;
import com.github.copilot.sdk.exceptions.SessionFailedException;
import com.github.copilot.sdk.types.events.SessionEvent;
import com.github.copilot.sdk.types.events.SessionEventHandler;
import com.github.copilot.sdk.types.events.SessionEventType;
import com.github.copilot.sdk.types.options.ConnectionState;
import com.github.copilot.sdk.types.options.InfiniteSessionConfig;
import com.github.copilot.sdk.types.options.MessageMode;
import com.github.copilot.sdk.types.options.MessageOptions;
import com.github.copilot.sdk.types.options.ResumeSessionConfig;
import com.github.copilot.sdk.types.permissions.PermissionHandler;
import com.github.copilot.sdk.types.permissions.PermissionInvocation;
import com.github.copilot.sdk.types.permissions.PermissionRequest;
import com.github.copilot.sdk.types.permissions.PermissionRequestResult;
import com.github.copilot.sdk.types.tools.Tool;
import com.github.copilot.sdk.types.tools.ToolInvocation;
import com.github.copilot.sdk.types.tools.ToolResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A conversation with the Copilot CLI server.
 *
 * <p>Sessions are created through {@link com.github.copilot.sdk.client.CopilotClient#createSession}
 * or {@link com.github.copilot.sdk.client.CopilotClient#resumeSession}. Each session owns its
 * tool registry, permission handler and event subscribers.
 *
 * <p>Example:
 * <pre>{@code
 * CopilotSession session = client.createSession(SessionConfig.builder()
 *     .model("claude-sonnet-4.5")
 *     .streaming(true)
 *     .build()).join();
 *
 * Runnable unsubscribe = session.on(event -> {
 *     if (SessionEventType.ASSISTANT_MESSAGE_DELTA.equals(event.getType())) {
 *         System.out.print(event.getDataText("deltaContent"));
 *     }
 * });
 * session.sendAndWait(MessageOptions.of("What is 2 + 2?"), Duration.ofMinutes(1)).join();
 * unsubscribe.run();
 * session.destroy().join();
 * }</pre>
 */
public class CopilotSession implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(CopilotSession.class);

    private final String sessionId;
    private final SessionEngine engine;
    private final CompactionGate compactionGate;
    private final List<SessionEventHandler> handlers = new CopyOnWriteArrayList<>();
    private final Map<String, Tool> tools = new ConcurrentHashMap<>();
    private final Object sendLock = new Object();

    private volatile ResumeSessionConfig resumeConfig;
    private volatile PermissionHandler permissionHandler;
    private volatile StreamAssembler assembler;
    private volatile SessionState state = SessionState.ACTIVE;
    private CompletableFuture<?> sendChain = CompletableFuture.completedFuture(null);

    CopilotSession(String sessionId, SessionEngine engine, ResumeSessionConfig resumeConfig,
                   @Nullable InfiniteSessionConfig infiniteSessions) {
        this.sessionId = sessionId;
        this.engine = engine;
        this.compactionGate = new CompactionGate(sessionId, infiniteSessions);
        rebind(resumeConfig);
    }

    public String getSessionId() {
        return sessionId;
    }

    public SessionState getState() {
        return state;
    }

    public CompactionState getCompactionState() {
        return compactionGate.getState();
    }

    /**
     * Subscribe to this session's events.
     *
     * @return a handle that removes the subscription
     */
    public Runnable on(SessionEventHandler handler) {
        handlers.add(handler);
        return () -> handlers.remove(handler);
    }

    public CompletableFuture<String> send(String prompt) {
        return send(MessageOptions.of(prompt));
    }

    /**
     * Send a message. Resolves with the server's message id once the server accepted it.
     *
     * <p>{@link MessageMode#ENQUEUE} messages reach the server in the order they were sent;
     * each waits until the previous one was accepted. {@link MessageMode#IMMEDIATE} messages
     * skip that queue. Both wait while the session is blocked on compaction.
     *
     * @throws com.github.copilot.sdk.exceptions.ConfigurationException for invalid options
     */
    public CompletableFuture<String> send(MessageOptions options) {
        SessionConfigValidator.validateMessage(options);
        if (state != SessionState.ACTIVE) {
            return failed(new SessionFailedException(sessionId, "session is " + state.name().toLowerCase()));
        }
        ObjectNode params = SessionPayloads.send(engine.getMapper(), sessionId, options);

        if (options.getMode() == MessageMode.IMMEDIATE) {
            return admission().thenCompose(ignored -> dispatchSend(params));
        }
        synchronized (sendLock) {
            CompletableFuture<String> result = sendChain
                    .handle((ignored, error) -> null)
                    .thenCompose(ignored -> admission())
                    .thenCompose(ignored -> dispatchSend(params));
            sendChain = result;
            return result;
        }
    }

    /**
     * Send a message and wait until the session is idle.
     *
     * @return the last {@code assistant.message} event seen before idle, or {@code null}
     */
    public CompletableFuture<SessionEvent> sendAndWait(MessageOptions options, Duration timeout) {
        CompletableFuture<SessionEvent> done = new CompletableFuture<>();
        AtomicReference<SessionEvent> lastMessage = new AtomicReference<>();
        Runnable unsubscribe = on(event -> {
            switch (event.getType()) {
                case SessionEventType.ASSISTANT_MESSAGE:
                    lastMessage.set(event);
                    break;
                case SessionEventType.SESSION_IDLE:
                    done.complete(lastMessage.get());
                    break;
                case SessionEventType.SESSION_ERROR:
                case SessionEventType.SESSION_FAILED:
                    String message = event.getDataText("message");
                    done.completeExceptionally(new SessionFailedException(sessionId,
                            message != null ? message : event.getType()));
                    break;
                default:
                    break;
            }
        });

        try {
            send(options).whenComplete((messageId, error) -> {
                if (error != null) {
                    done.completeExceptionally(error);
                }
            });
        } catch (RuntimeException e) {
            unsubscribe.run();
            throw e;
        }

        return done.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS).handle((event, error) -> {
            unsubscribe.run();
            if (error == null) {
                return event;
            }
            Throwable cause = SessionEngine.unwrap(error);
            if (cause instanceof TimeoutException) {
                throw new CompletionException(new RequestTimeoutException("session.sendAndWait", timeout));
            }
            throw cause instanceof CompletionException ? (CompletionException) cause : new CompletionException(cause);
        });
    }

    /**
     * All events recorded for this session so far.
     */
    public CompletableFuture<List<SessionEvent>> getMessages() {
        if (state == SessionState.DESTROYED) {
            return failed(new SessionFailedException(sessionId, "session is destroyed"));
        }
        return engine.request("session.getMessages", SessionPayloads.sessionOnly(engine.getMapper(), sessionId))
                .thenApply(result -> {
                    List<SessionEvent> events = new ArrayList<>();
                    for (JsonNode node : result.path("events")) {
                        events.add(SessionEvent.fromJson(node));
                    }
                    return Collections.unmodifiableList(events);
                });
    }

    /**
     * Abort the message currently being processed. The session stays usable.
     */
    public CompletableFuture<Void> abort() {
        if (state != SessionState.ACTIVE) {
            return failed(new SessionFailedException(sessionId, "session is " + state.name().toLowerCase()));
        }
        assembler.reset();
        return engine.request("session.abort", SessionPayloads.sessionOnly(engine.getMapper(), sessionId))
                .thenApply(result -> null);
    }

    /**
     * Release the session on the server and stop routing its events. Idempotent.
     */
    public CompletableFuture<Void> destroy() {
        synchronized (sendLock) {
            if (state == SessionState.DESTROYED) {
                return CompletableFuture.completedFuture(null);
            }
            state = SessionState.DESTROYED;
        }
        engine.detach(this);
        compactionGate.abandon(new SessionFailedException(sessionId, "session destroyed"));
        handlers.clear();
        if (!engine.isConnected()) {
            return CompletableFuture.completedFuture(null);
        }
        return engine.request("session.destroy", SessionPayloads.sessionOnly(engine.getMapper(), sessionId))
                .thenApply(result -> null);
    }

    @Override
    public void close() {
        destroy().join();
    }

    /**
     * Text streamed so far for a message that has not completed yet, or {@code null}.
     * Completed messages carry their full text in the {@code assistant.message} event.
     */
    @Nullable
    public String getPartialMessage(String messageId) {
        return assembler.partialMessage(messageId);
    }

    ResumeSessionConfig getResumeConfig() {
        return resumeConfig;
    }

    /**
     * Install tools, permission handler and streaming mode from a create or resume configuration.
     */
    void rebind(ResumeSessionConfig config) {
        this.resumeConfig = config;
        tools.clear();
        for (Tool tool : config.getTools()) {
            tools.put(tool.getName(), tool);
        }
        this.permissionHandler = config.getOnPermissionRequest();
        this.assembler = new StreamAssembler(sessionId, config.isStreaming());
    }

    /**
     * Entry point for events routed by the connection, called on the reader thread.
     */
    void dispatchEvent(SessionEvent event) {
        String assembled = assembler.accept(event);
        if (assembled != null && event.getDataText("content") == null && event.getData().isObject()) {
            ObjectNode data = ((ObjectNode) event.getData()).deepCopy();
            data.put("content", assembled);
            event = new SessionEvent(event.getId(), event.getTimestamp(), event.getParentId(), event.getType(), data);
        }
        switch (event.getType()) {
            case SessionEventType.SESSION_IDLE:
                assembler.reset();
                break;
            case SessionEventType.SESSION_USAGE_INFO:
                Double utilization = utilizationOf(event.getData());
                if (utilization != null) {
                    compactionGate.onUsage(utilization);
                }
                break;
            case SessionEventType.SESSION_COMPACTION_START:
                compactionGate.onCompactionStart();
                break;
            case SessionEventType.SESSION_COMPACTION_COMPLETE:
                compactionGate.onCompactionComplete();
                break;
            default:
                break;
        }
        emit(event);
    }

    CompletableFuture<ToolResult> handleToolCall(ToolInvocation invocation) {
        Tool tool = tools.get(invocation.getToolName());
        if (tool == null) {
            logger.debug("Session {} has no tool {}", sessionId, invocation.getToolName());
            return CompletableFuture.completedFuture(ToolResult.rejected(
                    "Tool '" + invocation.getToolName() + "' is not supported by this client instance."));
        }
        CompletableFuture<ToolResult> pending;
        try {
            pending = tool.getHandler().handle(invocation);
        } catch (RuntimeException e) {
            pending = failed(e);
        }
        if (pending == null) {
            pending = CompletableFuture.completedFuture(null);
        }
        return pending.handle((result, error) -> {
            if (error != null) {
                Throwable cause = SessionEngine.unwrap(error);
                logger.warn("Tool {} failed in session {}", invocation.getToolName(), sessionId, cause);
                return ToolResult.failure(describe(cause));
            }
            if (result == null) {
                return ToolResult.failure("Tool " + invocation.getToolName() + " returned no result");
            }
            return result;
        });
    }

    CompletableFuture<PermissionRequestResult> handlePermission(PermissionRequest request) {
        PermissionHandler handler = permissionHandler;
        if (handler == null) {
            return CompletableFuture.completedFuture(PermissionRequestResult.deniedNoApprovalRule());
        }
        CompletableFuture<PermissionRequestResult> pending;
        try {
            pending = handler.handle(request, new PermissionInvocation(sessionId));
        } catch (RuntimeException e) {
            pending = failed(e);
        }
        if (pending == null) {
            pending = CompletableFuture.completedFuture(null);
        }
        return pending.handle((result, error) -> {
            if (error != null) {
                logger.warn("Permission handler failed in session {}; denying", sessionId, SessionEngine.unwrap(error));
                return PermissionRequestResult.deniedNoApprovalRule();
            }
            return result != null ? result : PermissionRequestResult.deniedNoApprovalRule();
        });
    }

    void emitConnectionState(ConnectionState connectionState) {
        ObjectNode data = engine.getMapper().createObjectNode();
        data.put("state", connectionState.getValue());
        if (connectionState == ConnectionState.ERROR) {
            assembler.reset();
        }
        emit(SessionEvent.synthetic(SessionEventType.CONNECTION_STATE_CHANGED, data));
    }

    void markResumed() {
        compactionGate.reset();
        emit(SessionEvent.synthetic(SessionEventType.SESSION_RESUMED, engine.getMapper().createObjectNode()));
    }

    /**
     * Move to the terminal failed state and tell subscribers why.
     */
    void fail(String message) {
        synchronized (sendLock) {
            if (state != SessionState.ACTIVE) {
                return;
            }
            state = SessionState.FAILED;
        }
        logger.warn("Session {} failed: {}", sessionId, message);
        compactionGate.abandon(new SessionFailedException(sessionId, message));
        ObjectNode data = engine.getMapper().createObjectNode();
        data.put("message", message);
        emit(SessionEvent.synthetic(SessionEventType.SESSION_FAILED, data));
    }

    /**
     * Wait at the compaction gate, at most the client's request timeout.
     */
    private CompletableFuture<Void> admission() {
        CompletableFuture<Void> gate = compactionGate.admission();
        if (gate.isDone()) {
            return gate;
        }
        Duration timeout = engine.getRequestTimeout();
        logger.debug("Session {} holding message until compaction completes", sessionId);
        return gate.thenApply(ignored -> (Void) null)
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((ignored, error) -> {
                    if (error == null) {
                        return null;
                    }
                    Throwable cause = SessionEngine.unwrap(error);
                    if (cause instanceof TimeoutException) {
                        throw new CompletionException(new RequestTimeoutException("session.send", timeout));
                    }
                    throw cause instanceof CompletionException ? (CompletionException) cause : new CompletionException(cause);
                });
    }

    private CompletableFuture<String> dispatchSend(ObjectNode params) {
        if (state != SessionState.ACTIVE) {
            return failed(new SessionFailedException(sessionId, "session is " + state.name().toLowerCase()));
        }
        return engine.request("session.send", params).thenApply(result -> {
            JsonNode messageId = result.get("messageId");
            return messageId != null && !messageId.isNull() ? messageId.asText() : null;
        });
    }

    private void emit(SessionEvent event) {
        for (SessionEventHandler handler : handlers) {
            try {
                handler.onEvent(event);
            } catch (RuntimeException e) {
                logger.warn("Event handler failed on {} in session {}", event.getType(), sessionId, e);
            }
        }
    }

    @Nullable
    static Double utilizationOf(JsonNode data) {
        JsonNode utilization = data.get("utilization");
        if (utilization != null && utilization.isNumber()) {
            return utilization.asDouble();
        }
        JsonNode limit = data.get("tokenLimit");
        JsonNode current = data.get("currentTokens");
        if (limit != null && current != null && limit.isNumber() && current.isNumber() && limit.asDouble() > 0) {
            return current.asDouble() / limit.asDouble();
        }
        return null;
    }

    private static String describe(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

    private static <T> CompletableFuture<T> failed(Throwable error) {
        CompletableFuture<T> future = new CompletableFuture<>();
        future.completeExceptionally(error);
        return future;
    }

    @Override
    public String toString() {
        return "CopilotSession{" + sessionId + ", " + state + "}";
    }
}
