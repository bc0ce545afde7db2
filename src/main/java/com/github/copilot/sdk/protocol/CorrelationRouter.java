package com.github.copilot.sdk.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.copilot.sdk.exceptions.CLIConnectionException;
import com.github.copilot.sdk.exceptions.CopilotSDKException;
import com.github.copilot.sdk.exceptions.JsonRpcException;
import com.github.copilot.sdk.exceptions.MessageParseException;
import com.github.copilot.sdk.exceptions.RequestTimeoutException;
import com.github.copilot.sdk.transport.Frame;
import com.github.copilot.sdk.transport.Transport;
import com.github.copilot.sdk.types.events.GlobalEventHandler;
import com.github.copilot.sdk.types.events.SessionEvent;
import com.github.copilot.sdk.types.events.SessionEventHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.time.Duration;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;

/**
 * Multiplexes requests, responses and events over one {@link Transport}.
 *
 * <p>Holds a single pending table keyed by {@link PendingKey}: outbound entries are
 * client requests awaiting a response, inbound entries are server requests awaiting
 * a caller handler's answer. One reader thread decodes frames and dispatches them;
 * inbound requests are handed to a separate pool so handlers can run concurrently
 * with the reader.
 */
public final class CorrelationRouter implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(CorrelationRouter.class);

    public static final String SESSION_EVENT_METHOD = "session.event";
    public static final String CANCEL_METHOD = "$/cancelRequest";

    private final Transport transport;
    private final MessageCodec codec;
    private final ObjectMapper mapper;
    private final int maxConsecutiveDecodeFailures;

    private final Map<PendingKey, PendingOperation> pending = new ConcurrentHashMap<>();
    private final Map<String, SessionEventHandler> sessionListeners = new ConcurrentHashMap<>();
    private final AtomicLong nextRequestId = new AtomicLong();
    private final AtomicInteger consecutiveDecodeFailures = new AtomicInteger();
    private final AtomicBoolean reading = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicBoolean closing = new AtomicBoolean(false);

    private final ExecutorService readerExecutor;
    private final ExecutorService inboundExecutor;
    private final ScheduledExecutorService deadlineScheduler;

    private volatile InboundRequestHandler requestHandler;
    private volatile GlobalEventHandler globalListener;
    private volatile Runnable disconnectListener;
    private volatile Runnable unhealthyListener;

    public CorrelationRouter(Transport transport, MessageCodec codec, int maxConsecutiveDecodeFailures) {
        this.transport = transport;
        this.codec = codec;
        this.mapper = codec.getMapper();
        this.maxConsecutiveDecodeFailures = maxConsecutiveDecodeFailures;
        this.readerExecutor = Executors.newSingleThreadExecutor(daemonThreads("copilot-reader"));
        this.inboundExecutor = Executors.newCachedThreadPool(daemonThreads("copilot-inbound"));
        this.deadlineScheduler = Executors.newSingleThreadScheduledExecutor(daemonThreads("copilot-deadlines"));
    }

    public void setRequestHandler(@Nullable InboundRequestHandler requestHandler) {
        this.requestHandler = requestHandler;
    }

    public void setGlobalListener(@Nullable GlobalEventHandler globalListener) {
        this.globalListener = globalListener;
    }

    /**
     * Called once when the inbound stream ends without {@link #close()} having been called.
     */
    public void setDisconnectListener(@Nullable Runnable disconnectListener) {
        this.disconnectListener = disconnectListener;
    }

    /**
     * Called when too many consecutive frames fail to decode.
     */
    public void setUnhealthyListener(@Nullable Runnable unhealthyListener) {
        this.unhealthyListener = unhealthyListener;
    }

    /**
     * Start the reader thread.
     */
    public void start() {
        if (reading.compareAndSet(false, true)) {
            readerExecutor.submit(this::readLoop);
        }
    }

    public boolean isOpen() {
        return !closed.get();
    }

    /**
     * Send a request and return a future for its result.
     *
     * <p>Cancelling the returned future removes the pending entry and sends a
     * best-effort {@code $/cancelRequest} notification.
     *
     * @param timeout deadline for the response; {@code null} or zero means none
     */
    public CompletableFuture<JsonNode> issue(String method, @Nullable JsonNode params, @Nullable Duration timeout) {
        CompletableFuture<JsonNode> future = new CompletableFuture<>();
        if (closed.get()) {
            future.completeExceptionally(new CLIConnectionException("Connection closed"));
            return future;
        }

        long id = nextRequestId.incrementAndGet();
        PendingOperation operation = PendingOperation.outbound(Long.toString(id), method, future);
        PendingKey key = operation.getKey();
        pending.put(key, operation);

        // teardown may have drained the table between the check above and the put
        if (closed.get() && pending.remove(key) != null) {
            future.completeExceptionally(new CLIConnectionException("Connection closed"));
            return future;
        }

        if (timeout != null && !timeout.isZero() && !timeout.isNegative()) {
            try {
                operation.setDeadline(deadlineScheduler.schedule(() -> {
                    if (pending.remove(key) != null) {
                        logger.debug("Request {} id={} timed out", method, id);
                        future.completeExceptionally(new RequestTimeoutException(method, timeout));
                    }
                }, timeout.toMillis(), TimeUnit.MILLISECONDS));
            } catch (RejectedExecutionException e) {
                pending.remove(key);
                future.completeExceptionally(new CLIConnectionException("Connection closed"));
                return future;
            }
        }

        future.whenComplete((result, error) -> {
            operation.cancelDeadline();
            if (future.isCancelled() && pending.remove(key) != null) {
                sendCancel(id);
            }
        });

        try {
            logger.debug("Sending {} id={}", method, id);
            transport.send(codec.encode(Envelope.request(id, method, params)));
        } catch (CopilotSDKException e) {
            if (pending.remove(key) != null) {
                future.completeExceptionally(e);
            }
        }
        return future;
    }

    /**
     * Send a one-way notification.
     */
    public void sendNotification(String method, @Nullable JsonNode params) {
        if (closed.get()) {
            throw new CLIConnectionException("Connection closed");
        }
        transport.send(codec.encode(Envelope.event(method, params)));
    }

    /**
     * Route {@code session.event} notifications for one session to a listener.
     * Events for a session reach its listener in arrival order.
     */
    public void subscribe(String sessionId, SessionEventHandler listener) {
        sessionListeners.put(sessionId, listener);
    }

    public void unsubscribe(String sessionId) {
        sessionListeners.remove(sessionId);
    }

    /**
     * Number of entries in the pending table, both directions.
     */
    public int pendingCount() {
        return pending.size();
    }

    /**
     * Fail every outbound request and drop inbound entries. Later calls to
     * {@link #issue} fail immediately.
     */
    public void failAll(Throwable cause) {
        closed.set(true);
        Iterator<Map.Entry<PendingKey, PendingOperation>> iterator = pending.entrySet().iterator();
        while (iterator.hasNext()) {
            PendingOperation operation = iterator.next().getValue();
            iterator.remove();
            operation.cancelDeadline();
            if (operation.getFuture() != null) {
                operation.getFuture().completeExceptionally(cause);
            }
        }
    }

    @Override
    public void close() {
        if (!closing.compareAndSet(false, true)) {
            return;
        }
        failAll(new CLIConnectionException("Connection closed"));
        transport.close();
        readerExecutor.shutdownNow();
        inboundExecutor.shutdown();
        deadlineScheduler.shutdownNow();
    }

    private void readLoop() {
        try (Stream<Frame> frames = transport.readFrames()) {
            Iterator<Frame> iterator = frames.iterator();
            while (!Thread.currentThread().isInterrupted() && iterator.hasNext()) {
                Frame frame = iterator.next();
                if (frame.isMalformed()) {
                    recordDecodeFailure(new MessageParseException(frame.getError(), ""));
                    continue;
                }
                DecodeResult decoded = codec.decode(frame.getPayload());
                if (!decoded.isOk()) {
                    recordDecodeFailure(decoded.getError());
                    continue;
                }
                consecutiveDecodeFailures.set(0);
                dispatch(decoded.getEnvelope());
            }
        } catch (Exception e) {
            if (!closing.get()) {
                logger.error("Fatal error while reading from {}", transport.describe(), e);
            }
        } finally {
            reading.set(false);
            boolean unexpected = !closing.get();
            failAll(new CLIConnectionException("Connection closed before response"));
            deadlineScheduler.shutdownNow();
            inboundExecutor.shutdown();
            Runnable listener = disconnectListener;
            if (unexpected && listener != null) {
                logger.debug("Inbound stream from {} ended", transport.describe());
                listener.run();
            }
        }
    }

    private void recordDecodeFailure(MessageParseException error) {
        logger.warn("Skipping undecodable message: {} {}", error.getMessage(), abbreviate(error.getRawMessage()));
        int failures = consecutiveDecodeFailures.incrementAndGet();
        if (failures > maxConsecutiveDecodeFailures) {
            consecutiveDecodeFailures.set(0);
            logger.warn("{} consecutive undecodable messages from {}", failures, transport.describe());
            Runnable listener = unhealthyListener;
            if (listener != null) {
                listener.run();
            }
        }
    }

    private void dispatch(Envelope envelope) {
        switch (envelope.getKind()) {
            case RESPONSE:
            case ERROR:
                handleResponse(envelope);
                break;
            case EVENT:
                handleEvent(envelope);
                break;
            case REQUEST:
                handleRequest(envelope);
                break;
            default:
                logger.warn("Ignoring envelope of unknown kind: {}", envelope);
                break;
        }
    }

    private void handleResponse(Envelope envelope) {
        PendingOperation operation = pending.remove(new PendingKey(Direction.OUTBOUND, envelope.idKey()));
        if (operation == null) {
            logger.warn("Received response for unknown request id {}", envelope.getId());
            return;
        }
        operation.cancelDeadline();
        CompletableFuture<JsonNode> future = operation.getFuture();
        if (envelope.getKind() == EnvelopeKind.ERROR) {
            RpcError error = envelope.getError();
            future.completeExceptionally(new JsonRpcException(
                    operation.getMethod(), error.getCode(), error.getMessage(), error.getData()));
        } else {
            JsonNode result = envelope.getResult();
            future.complete(result != null ? result : mapper.nullNode());
        }
    }

    private void handleEvent(Envelope envelope) {
        String sessionId = envelope.sessionId();
        if (SESSION_EVENT_METHOD.equals(envelope.getMethod()) && sessionId != null) {
            SessionEventHandler listener = sessionListeners.get(sessionId);
            if (listener == null) {
                logger.debug("Dropping event for unknown session {}", sessionId);
                return;
            }
            SessionEvent event = SessionEvent.fromJson(envelope.getParams().path("event"));
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                logger.warn("Session {} listener failed on {}", sessionId, event.getType(), e);
            }
            return;
        }

        GlobalEventHandler listener = globalListener;
        if (listener == null) {
            logger.debug("No listener for event {}", envelope.getMethod());
            return;
        }
        try {
            listener.onEvent(envelope.getMethod(), envelope.getParams());
        } catch (RuntimeException e) {
            logger.warn("Global listener failed on {}", envelope.getMethod(), e);
        }
    }

    private void handleRequest(Envelope envelope) {
        JsonNode id = envelope.getId();
        String method = envelope.getMethod();
        PendingOperation operation = PendingOperation.inbound(envelope.idKey(), method);
        if (pending.putIfAbsent(operation.getKey(), operation) != null) {
            logger.warn("Duplicate inbound request id {} for {}", id, method);
            sendSafely(Envelope.error(id, RpcError.of(RpcError.INVALID_REQUEST, "Duplicate request id")));
            return;
        }

        InboundRequestHandler handler = requestHandler;
        if (handler == null) {
            answer(operation, id, null, new JsonRpcException(method, RpcError.METHOD_NOT_FOUND,
                    "Method not found: " + method, null));
            return;
        }

        JsonNode params = envelope.getParams() != null ? envelope.getParams() : mapper.createObjectNode();
        try {
            inboundExecutor.submit(() -> {
                CompletableFuture<JsonNode> reply;
                try {
                    reply = handler.handle(method, params);
                } catch (RuntimeException e) {
                    reply = new CompletableFuture<>();
                    reply.completeExceptionally(e);
                }
                reply.whenComplete((result, error) -> answer(operation, id, result, error));
            });
        } catch (RejectedExecutionException e) {
            logger.debug("Dropping inbound {} after shutdown", method);
            pending.remove(operation.getKey());
        }
    }

    private void answer(PendingOperation operation, JsonNode id, @Nullable JsonNode result, @Nullable Throwable error) {
        if (pending.remove(operation.getKey()) == null) {
            logger.debug("Inbound request {} id={} already answered or dropped", operation.getMethod(), id);
            return;
        }
        if (error == null) {
            sendSafely(Envelope.response(id, result));
            return;
        }
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof JsonRpcException) {
            JsonRpcException rpc = (JsonRpcException) cause;
            sendSafely(Envelope.error(id, new RpcError(rpc.getCode(), rpc.getErrorMessage(), rpc.getData())));
        } else {
            logger.warn("Handler for {} failed", operation.getMethod(), cause);
            sendSafely(Envelope.error(id, RpcError.of(RpcError.INTERNAL_ERROR,
                    cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName())));
        }
    }

    private void sendCancel(long id) {
        ObjectNode params = mapper.createObjectNode();
        params.put("id", id);
        try {
            sendNotification(CANCEL_METHOD, params);
        } catch (CopilotSDKException e) {
            logger.debug("Could not send cancellation for id={}: {}", id, e.getMessage());
        }
    }

    private void sendSafely(Envelope envelope) {
        try {
            transport.send(codec.encode(envelope));
        } catch (CopilotSDKException e) {
            logger.warn("Failed to send {}: {}", envelope, e.getMessage());
        }
    }

    private static String abbreviate(String raw) {
        if (raw == null) {
            return "";
        }
        return raw.length() > 200 ? raw.substring(0, 200) + "..." : raw;
    }

    private static ThreadFactory daemonThreads(String name) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, name + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
