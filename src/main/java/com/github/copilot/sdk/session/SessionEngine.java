package com.github.copilot.sdk.session;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.copilot.sdk.exceptions.JsonRpcException;
import com.github.copilot.sdk.internal.ConnectionManager;
import com.github.copilot.sdk.internal.ConnectionRecoveryListener;
import com.github.copilot.sdk.protocol.InboundRequestHandler;
import com.github.copilot.sdk.protocol.RpcError;
import com.github.copilot.sdk.types.options.ConnectionState;
import com.github.copilot.sdk.types.options.ResumeSessionConfig;
import com.github.copilot.sdk.types.options.SessionConfig;
import com.github.copilot.sdk.types.permissions.PermissionKind;
import com.github.copilot.sdk.types.permissions.PermissionRequest;
import com.github.copilot.sdk.types.permissions.PermissionRequestResult;
import com.github.copilot.sdk.types.responses.StopError;
import com.github.copilot.sdk.types.tools.ToolInvocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;

/**
 * Registry of open sessions. Creates and resumes sessions, answers the server's
 * tool and permission requests on their behalf, and re-resumes them after the
 * connection was restarted.
 */
public class SessionEngine implements InboundRequestHandler, ConnectionRecoveryListener {

    private static final Logger logger = LoggerFactory.getLogger(SessionEngine.class);

    public static final String TOOL_CALL_METHOD = "tool.call";
    public static final String PERMISSION_REQUEST_METHOD = "permission.request";

    private final ConnectionManager connection;
    private final ObjectMapper mapper;
    private final Map<String, CopilotSession> sessions = new ConcurrentHashMap<>();

    public SessionEngine(ConnectionManager connection, ObjectMapper mapper) {
        this.connection = connection;
        this.mapper = mapper;
    }

    /**
     * Create a session. Events are routed to it before the create request is sent,
     * so none emitted during creation are lost.
     *
     * @throws com.github.copilot.sdk.exceptions.ConfigurationException for invalid configuration
     */
    public CompletableFuture<CopilotSession> create(SessionConfig config) {
        SessionConfigValidator.validate(config);
        String sessionId = config.getSessionId() != null ? config.getSessionId() : UUID.randomUUID().toString();
        SessionConfig effective = config.toBuilder().sessionId(sessionId).build();

        CopilotSession session = new CopilotSession(sessionId, this, effective.toResumeConfig(),
                effective.getInfiniteSessions());
        register(session);

        return request("session.create", SessionPayloads.create(mapper, effective))
                .handle((result, error) -> {
                    if (error != null) {
                        detach(session);
                        throw asCompletionException(error);
                    }
                    String assigned = result.path("sessionId").asText(sessionId);
                    if (!assigned.equals(sessionId)) {
                        logger.warn("Server assigned session id {} instead of {}", assigned, sessionId);
                        detach(session);
                        CopilotSession renamed = new CopilotSession(assigned, this, effective.toResumeConfig(),
                                effective.getInfiniteSessions());
                        register(renamed);
                        return renamed;
                    }
                    logger.debug("Created session {}", sessionId);
                    return session;
                });
    }

    /**
     * Resume a session the server already knows. Tools and permission handler come from
     * {@code config}; nothing is carried over from an earlier session object.
     */
    public CompletableFuture<CopilotSession> resume(String sessionId, ResumeSessionConfig config) {
        SessionConfigValidator.validateResume(sessionId, config);
        CopilotSession previous = sessions.get(sessionId);
        if (previous != null) {
            previous.fail("superseded by resume");
            detach(previous);
        }
        CopilotSession session = new CopilotSession(sessionId, this, config, null);
        register(session);

        return request("session.resume", SessionPayloads.resume(mapper, sessionId, config))
                .handle((result, error) -> {
                    if (error != null) {
                        detach(session);
                        throw asCompletionException(error);
                    }
                    logger.debug("Resumed session {}", sessionId);
                    return session;
                });
    }

    /**
     * Sessions currently routed by this engine.
     */
    public Collection<CopilotSession> getSessions() {
        return Collections.unmodifiableCollection(new ArrayList<>(sessions.values()));
    }

    @Nullable
    public CopilotSession getSession(String sessionId) {
        return sessions.get(sessionId);
    }

    /**
     * Destroy every open session, collecting failures instead of stopping at the first.
     */
    public List<StopError> destroyAll() {
        List<StopError> errors = new ArrayList<>();
        for (CopilotSession session : getSessions()) {
            try {
                session.destroy().get();
            } catch (ExecutionException e) {
                Throwable cause = unwrap(e.getCause());
                errors.add(new StopError("Failed to destroy session " + session.getSessionId() + ": "
                        + cause.getMessage(), cause));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                errors.add(new StopError("Interrupted while destroying session " + session.getSessionId(), e));
                break;
            }
        }
        return errors;
    }

    /**
     * Drop every session without contacting the server.
     */
    public void clear() {
        for (CopilotSession session : getSessions()) {
            session.fail("client stopped");
            detach(session);
        }
    }

    /**
     * Forward a connection state change to every session's subscribers.
     */
    public void onConnectionStateChanged(ConnectionState state) {
        for (CopilotSession session : getSessions()) {
            session.emitConnectionState(state);
        }
    }

    @Override
    public CompletableFuture<JsonNode> handle(String method, JsonNode params) {
        switch (method) {
            case TOOL_CALL_METHOD:
                return handleToolCall(params);
            case PERMISSION_REQUEST_METHOD:
                return handlePermissionRequest(params);
            default:
                return failed(new JsonRpcException(method, RpcError.METHOD_NOT_FOUND,
                        "Method not found: " + method, null));
        }
    }

    @Override
    public void onReconnected() {
        for (CopilotSession session : getSessions()) {
            if (session.getState() != SessionState.ACTIVE) {
                continue;
            }
            String sessionId = session.getSessionId();
            request("session.resume", SessionPayloads.resume(mapper, sessionId, session.getResumeConfig()))
                    .whenComplete((result, error) -> {
                        if (error == null) {
                            logger.info("Resumed session {} after restart", sessionId);
                            session.markResumed();
                        } else {
                            session.fail("could not be resumed after restart: " + unwrap(error).getMessage());
                            detach(session);
                        }
                    });
        }
    }

    @Override
    public void onRecoveryFailed(Throwable cause) {
        for (CopilotSession session : getSessions()) {
            session.fail(cause.getMessage());
            detach(session);
        }
    }

    ObjectMapper getMapper() {
        return mapper;
    }

    Duration getRequestTimeout() {
        return connection.getRequestTimeout();
    }

    boolean isConnected() {
        return connection.getState() == ConnectionState.CONNECTED;
    }

    CompletableFuture<JsonNode> request(String method, ObjectNode params) {
        return connection.request(method, params);
    }

    void detach(CopilotSession session) {
        if (sessions.remove(session.getSessionId(), session)) {
            connection.unsubscribe(session.getSessionId());
        }
    }

    private void register(CopilotSession session) {
        sessions.put(session.getSessionId(), session);
        connection.subscribe(session.getSessionId(), session::dispatchEvent);
    }

    private CompletableFuture<JsonNode> handleToolCall(JsonNode params) {
        String sessionId = params.path("sessionId").asText();
        CopilotSession session = sessions.get(sessionId);
        ToolInvocation invocation = new ToolInvocation(
                sessionId,
                params.path("toolCallId").asText(),
                params.path("toolName").asText(),
                params.path("arguments")
        );
        if (session == null) {
            return failed(new JsonRpcException(TOOL_CALL_METHOD, RpcError.INVALID_PARAMS,
                    "Unknown session: " + sessionId, null));
        }
        return session.handleToolCall(invocation).thenApply(result -> {
            ObjectNode response = mapper.createObjectNode();
            response.set("result", mapper.valueToTree(result));
            return response;
        });
    }

    private CompletableFuture<JsonNode> handlePermissionRequest(JsonNode params) {
        String sessionId = params.path("sessionId").asText();
        CopilotSession session = sessions.get(sessionId);
        CompletableFuture<PermissionRequestResult> outcome;
        if (session == null) {
            logger.warn("Permission request for unknown session {}; denying", sessionId);
            outcome = CompletableFuture.completedFuture(PermissionRequestResult.deniedNoApprovalRule());
        } else {
            PermissionRequest request = parsePermissionRequest(params.path("permissionRequest"));
            outcome = request != null
                    ? session.handlePermission(request)
                    : CompletableFuture.completedFuture(PermissionRequestResult.deniedNoApprovalRule());
        }
        return outcome.thenApply(result -> {
            ObjectNode response = mapper.createObjectNode();
            response.set("result", mapper.valueToTree(result));
            return response;
        });
    }

    @Nullable
    private PermissionRequest parsePermissionRequest(JsonNode node) {
        PermissionKind kind;
        try {
            kind = PermissionKind.fromValue(node.path("kind").asText());
        } catch (IllegalArgumentException e) {
            logger.warn("Unrecognised permission request kind {}; denying", node.path("kind").asText());
            return null;
        }
        Map<String, Object> extra = new HashMap<>();
        node.fields().forEachRemaining(field -> {
            if (!"kind".equals(field.getKey()) && !"toolCallId".equals(field.getKey())) {
                extra.put(field.getKey(), mapper.convertValue(field.getValue(), Object.class));
            }
        });
        JsonNode toolCallId = node.get("toolCallId");
        return new PermissionRequest(kind, toolCallId != null && !toolCallId.isNull() ? toolCallId.asText() : null, extra);
    }

    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static CompletionException asCompletionException(Throwable error) {
        return error instanceof CompletionException ? (CompletionException) error : new CompletionException(error);
    }

    private static <T> CompletableFuture<T> failed(Throwable error) {
        CompletableFuture<T> future = new CompletableFuture<>();
        future.completeExceptionally(error);
        return future;
    }
}
