package com.github.copilot.sdk.client;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.copilot.sdk.exceptions.CLIConnectionException;
import com.github.copilot.sdk.exceptions.CopilotSDKException;
import com.github.copilot.sdk.internal.ConnectionManager;
import com.github.copilot.sdk.protocol.MessageCodec;
import com.github.copilot.sdk.session.CopilotSession;
import com.github.copilot.sdk.session.SessionConfigValidator;
import com.github.copilot.sdk.session.SessionEngine;
import com.github.copilot.sdk.transport.DefaultTransportFactory;
import com.github.copilot.sdk.transport.TransportFactory;
import com.github.copilot.sdk.types.events.GlobalEventHandler;
import com.github.copilot.sdk.types.options.ConnectionState;
import com.github.copilot.sdk.types.options.CopilotClientOptions;
import com.github.copilot.sdk.types.options.ResumeSessionConfig;
import com.github.copilot.sdk.types.options.SessionConfig;
import com.github.copilot.sdk.types.responses.GetAuthStatusResponse;
import com.github.copilot.sdk.types.responses.GetStatusResponse;
import com.github.copilot.sdk.types.responses.ModelInfo;
import com.github.copilot.sdk.types.responses.PingResponse;
import com.github.copilot.sdk.types.responses.SessionMetadata;
import com.github.copilot.sdk.types.responses.StopError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Client for the Copilot CLI server.
 *
 * <p>Example:
 * <pre>{@code
 * try (CopilotClient client = new CopilotClient()) {
 *     CopilotSession session = client.createSession(
 *         SessionConfig.builder().model("claude-sonnet-4.5").build()).join();
 *     SessionEvent reply = session.sendAndWait(MessageOptions.of("Hello"), Duration.ofMinutes(2)).join();
 *     System.out.println(reply.getDataText("content"));
 * }
 * }</pre>
 *
 * <p>With {@code autoStart} (the default) the first operation starts the server; otherwise
 * call {@link #start()} first.
 */
public final class CopilotClient implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(CopilotClient.class);

    private static final TypeReference<List<ModelInfo>> MODEL_LIST = new TypeReference<List<ModelInfo>>() {
    };
    private static final TypeReference<List<SessionMetadata>> SESSION_LIST = new TypeReference<List<SessionMetadata>>() {
    };

    private final CopilotClientOptions options;
    private final ObjectMapper mapper;
    private final ConnectionManager connection;
    private final SessionEngine sessions;
    private final List<GlobalEventHandler> globalHandlers = new CopyOnWriteArrayList<>();

    public CopilotClient() {
        this(CopilotClientOptions.builder().build());
    }

    /**
     * @throws com.github.copilot.sdk.exceptions.ConfigurationException for conflicting options
     */
    public CopilotClient(CopilotClientOptions options) {
        this(options, null);
    }

    /**
     * Client over a caller-supplied transport, e.g. an in-memory server in tests.
     */
    public CopilotClient(CopilotClientOptions options, @Nullable TransportFactory transportFactory) {
        this.options = Objects.requireNonNull(options, "options");
        ClientOptionsValidator.validate(options);
        this.mapper = new ObjectMapper();
        MessageCodec codec = new MessageCodec(mapper);
        TransportFactory factory = transportFactory != null ? transportFactory : new DefaultTransportFactory(options);
        this.connection = new ConnectionManager(options, factory, codec);
        this.sessions = new SessionEngine(connection, mapper);

        connection.setRequestHandler(sessions);
        connection.setRecoveryListener(sessions);
        connection.setGlobalListener(this::dispatchGlobalEvent);
        connection.addStateListener(sessions::onConnectionStateChanged);
    }

    public CopilotClientOptions getOptions() {
        return options;
    }

    public ConnectionState getState() {
        return connection.getState();
    }

    /**
     * Start the server (or connect to it) and verify the protocol version.
     * Concurrent calls share one attempt.
     */
    public CompletableFuture<Void> start() {
        return connection.connect();
    }

    /**
     * Destroy all sessions, then close the connection.
     *
     * @return problems met while destroying sessions; empty when shutdown was clean
     */
    public List<StopError> stop() {
        List<StopError> errors = new ArrayList<>();
        if (connection.getState() == ConnectionState.CONNECTED) {
            errors.addAll(sessions.destroyAll());
        } else {
            sessions.clear();
        }
        try {
            connection.disconnect();
        } catch (CopilotSDKException e) {
            errors.add(new StopError("Failed to close connection: " + e.getMessage(), e));
        }
        logger.debug("Client stopped with {} error(s)", errors.size());
        return errors;
    }

    /**
     * Close the connection without destroying sessions on the server.
     */
    public void forceStop() {
        sessions.clear();
        connection.forceStop();
    }

    public CompletableFuture<PingResponse> ping(@Nullable String message) {
        ObjectNode params = mapper.createObjectNode();
        if (message != null) {
            params.put("message", message);
        } else {
            params.putNull("message");
        }
        return call("ping", params, PingResponse.class);
    }

    public CompletableFuture<GetStatusResponse> getStatus() {
        return call("status.get", mapper.createObjectNode(), GetStatusResponse.class);
    }

    public CompletableFuture<GetAuthStatusResponse> getAuthStatus() {
        return call("auth.getStatus", mapper.createObjectNode(), GetAuthStatusResponse.class);
    }

    public CompletableFuture<List<ModelInfo>> listModels() {
        return ensureStarted()
                .thenCompose(ignored -> connection.request("models.list", mapper.createObjectNode()))
                .thenApply(result -> readList(result.path("models"), MODEL_LIST));
    }

    /**
     * Sessions the server has persisted, including ones not open in this client.
     */
    public CompletableFuture<List<SessionMetadata>> listSessions() {
        return ensureStarted()
                .thenCompose(ignored -> connection.request("session.list", mapper.createObjectNode()))
                .thenApply(result -> readList(result.path("sessions"), SESSION_LIST));
    }

    /**
     * Permanently delete a session's persisted data on the server.
     */
    public CompletableFuture<Void> deleteSession(String sessionId) {
        ObjectNode params = mapper.createObjectNode();
        params.put("sessionId", sessionId);
        return ensureStarted()
                .thenCompose(ignored -> connection.request("session.delete", params))
                .thenApply(result -> {
                    if (!result.path("success").asBoolean(false)) {
                        throw new CopilotSDKException("Failed to delete session " + sessionId + ": "
                                + result.path("error").asText("unknown error"));
                    }
                    return null;
                });
    }

    /**
     * Create a session.
     *
     * @throws com.github.copilot.sdk.exceptions.ConfigurationException for invalid configuration,
     *                                                                  before anything is sent
     */
    public CompletableFuture<CopilotSession> createSession(SessionConfig config) {
        SessionConfigValidator.validate(config);
        return ensureStarted().thenCompose(ignored -> sessions.create(config));
    }

    public CompletableFuture<CopilotSession> createSession() {
        return createSession(SessionConfig.builder().build());
    }

    /**
     * Resume a persisted session. Tools and the permission handler must be supplied again.
     */
    public CompletableFuture<CopilotSession> resumeSession(String sessionId, ResumeSessionConfig config) {
        SessionConfigValidator.validateResume(sessionId, config);
        return ensureStarted().thenCompose(ignored -> sessions.resume(sessionId, config));
    }

    public CompletableFuture<CopilotSession> resumeSession(String sessionId) {
        return resumeSession(sessionId, ResumeSessionConfig.empty());
    }

    /**
     * Listen to connection-global notifications (those not tied to a session).
     *
     * @return a handle that removes the listener
     */
    public Runnable onEvent(GlobalEventHandler handler) {
        globalHandlers.add(handler);
        return () -> globalHandlers.remove(handler);
    }

    /**
     * @return a handle that removes the listener
     */
    public Runnable onConnectionStateChange(Consumer<ConnectionState> listener) {
        connection.addStateListener(listener);
        return () -> connection.removeStateListener(listener);
    }

    @Override
    public void close() {
        List<StopError> errors = stop();
        for (StopError error : errors) {
            logger.warn("{}", error.getMessage(), error.getCause());
        }
        connection.shutdownScheduler();
    }

    private <T> CompletableFuture<T> call(String method, ObjectNode params, Class<T> type) {
        return ensureStarted()
                .thenCompose(ignored -> connection.request(method, params,
                        "ping".equals(method) ? options.getPingTimeout() : null))
                .thenApply(result -> mapper.convertValue(result, type));
    }

    private <T> List<T> readList(JsonNode node, TypeReference<List<T>> type) {
        if (!node.isArray()) {
            return Collections.emptyList();
        }
        return mapper.convertValue(node, type);
    }

    private CompletableFuture<Void> ensureStarted() {
        if (connection.getState() == ConnectionState.CONNECTED) {
            return CompletableFuture.completedFuture(null);
        }
        if (options.isAutoStart()) {
            return connection.connect();
        }
        CompletableFuture<Void> failed = new CompletableFuture<>();
        failed.completeExceptionally(new CLIConnectionException("Client not connected. Call start() first."));
        return failed;
    }

    private void dispatchGlobalEvent(String method, JsonNode params) {
        for (GlobalEventHandler handler : globalHandlers) {
            try {
                handler.onEvent(method, params);
            } catch (RuntimeException e) {
                logger.warn("Global event handler failed on {}", method, e);
            }
        }
    }
}
