package com.github.copilot.sdk.internal;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.copilot.sdk.CopilotSdk;
import com.github.copilot.sdk.exceptions.CLIConnectionException;
import com.github.copilot.sdk.protocol.CorrelationRouter;
import com.github.copilot.sdk.protocol.InboundRequestHandler;
import com.github.copilot.sdk.protocol.MessageCodec;
import com.github.copilot.sdk.transport.Transport;
import com.github.copilot.sdk.transport.TransportFactory;
import com.github.copilot.sdk.types.events.GlobalEventHandler;
import com.github.copilot.sdk.types.events.SessionEventHandler;
import com.github.copilot.sdk.types.options.ConnectionState;
import com.github.copilot.sdk.types.options.CopilotClientOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Owns the connection to the CLI server: startup, protocol version check, health
 * monitoring, crash detection and automatic restart.
 *
 * <p>State machine: {@code disconnected -> connecting -> connected}, and on an
 * unexpected loss {@code connected -> error -> connecting} (restart) or staying in
 * {@code error} when no restart is possible. Concurrent {@link #connect()} calls share
 * one in-flight attempt, so two processes are never spawned.
 */
public class ConnectionManager {

    private static final Logger logger = LoggerFactory.getLogger(ConnectionManager.class);

    static final int MAX_HEALTH_FAILURES = 3;

    private final CopilotClientOptions options;
    private final TransportFactory transportFactory;
    private final MessageCodec codec;

    private final Object lock = new Object();
    private final List<Consumer<ConnectionState>> stateListeners = new CopyOnWriteArrayList<>();
    private final Map<String, SessionEventHandler> subscriptions = new ConcurrentHashMap<>();
    private final AtomicInteger healthFailures = new AtomicInteger();
    private final ScheduledExecutorService scheduler;

    private volatile ConnectionState state = ConnectionState.DISCONNECTED;
    private volatile CorrelationRouter router;
    private volatile Transport transport;
    private CompletableFuture<Void> connectFuture;
    private ScheduledFuture<?> healthTask;
    private volatile boolean stopping;

    private volatile InboundRequestHandler requestHandler;
    private volatile GlobalEventHandler globalListener;
    private volatile ConnectionRecoveryListener recoveryListener;

    public ConnectionManager(CopilotClientOptions options, TransportFactory transportFactory, MessageCodec codec) {
        this.options = options;
        this.transportFactory = transportFactory;
        this.codec = codec;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "copilot-connection");
            thread.setDaemon(true);
            return thread;
        });
    }

    public ConnectionState getState() {
        return state;
    }

    public void addStateListener(Consumer<ConnectionState> listener) {
        stateListeners.add(listener);
    }

    public void removeStateListener(Consumer<ConnectionState> listener) {
        stateListeners.remove(listener);
    }

    public void setRequestHandler(@Nullable InboundRequestHandler requestHandler) {
        this.requestHandler = requestHandler;
        CorrelationRouter current = router;
        if (current != null) {
            current.setRequestHandler(requestHandler);
        }
    }

    public void setGlobalListener(@Nullable GlobalEventHandler globalListener) {
        this.globalListener = globalListener;
        CorrelationRouter current = router;
        if (current != null) {
            current.setGlobalListener(globalListener);
        }
    }

    public void setRecoveryListener(@Nullable ConnectionRecoveryListener recoveryListener) {
        this.recoveryListener = recoveryListener;
    }

    /**
     * Route a session's events to a listener; survives restarts.
     */
    public void subscribe(String sessionId, SessionEventHandler listener) {
        subscriptions.put(sessionId, listener);
        CorrelationRouter current = router;
        if (current != null) {
            current.subscribe(sessionId, listener);
        }
    }

    public void unsubscribe(String sessionId) {
        subscriptions.remove(sessionId);
        CorrelationRouter current = router;
        if (current != null) {
            current.unsubscribe(sessionId);
        }
    }

    /**
     * Whether the current transport spawned the server process.
     */
    public boolean ownsServer() {
        Transport current = transport;
        return current != null && current.ownsServer();
    }

    /**
     * Connect, or join the attempt already in progress.
     */
    public CompletableFuture<Void> connect() {
        synchronized (lock) {
            stopping = false;
            if (state == ConnectionState.CONNECTED) {
                return CompletableFuture.completedFuture(null);
            }
            if (connectFuture != null && !connectFuture.isDone()) {
                return connectFuture;
            }
            connectFuture = openConnection();
            return connectFuture;
        }
    }

    /**
     * Issue a request on the current connection.
     */
    public CompletableFuture<JsonNode> request(String method, @Nullable JsonNode params, @Nullable Duration timeout) {
        CorrelationRouter current = router;
        if (state != ConnectionState.CONNECTED || current == null) {
            CompletableFuture<JsonNode> failed = new CompletableFuture<>();
            failed.completeExceptionally(new CLIConnectionException("Not connected. Call start() first."));
            return failed;
        }
        return current.issue(method, params, timeout != null ? timeout : options.getRequestTimeout());
    }

    public CompletableFuture<JsonNode> request(String method, @Nullable JsonNode params) {
        return request(method, params, null);
    }

    /**
     * Default deadline for requests issued without one.
     */
    public Duration getRequestTimeout() {
        return options.getRequestTimeout();
    }

    /**
     * Graceful shutdown: stop monitoring, fail anything pending, close the transport.
     */
    public void disconnect() {
        shutdown(new CLIConnectionException("Connection closed"));
    }

    /**
     * Immediate shutdown used when graceful cleanup is not wanted.
     */
    public void forceStop() {
        shutdown(new CLIConnectionException("Client force-stopped"));
    }

    private void shutdown(CLIConnectionException cause) {
        CorrelationRouter current;
        synchronized (lock) {
            stopping = true;
            cancelHealthCheck();
            current = router;
            router = null;
            transport = null;
            connectFuture = null;
        }
        if (current != null) {
            current.failAll(cause);
            current.close();
        }
        setState(ConnectionState.DISCONNECTED);
    }

    private CompletableFuture<Void> openConnection() {
        setState(ConnectionState.CONNECTING);
        Transport newTransport;
        try {
            newTransport = transportFactory.create();
        } catch (RuntimeException e) {
            setState(ConnectionState.ERROR);
            CompletableFuture<Void> failed = new CompletableFuture<>();
            failed.completeExceptionally(e);
            return failed;
        }

        logger.debug("Connecting to {}", newTransport.describe());
        return newTransport.connect()
                .thenCompose(ignored -> {
                    CorrelationRouter newRouter = new CorrelationRouter(
                            newTransport, codec, options.getMaxConsecutiveDecodeFailures());
                    newRouter.setRequestHandler(requestHandler);
                    newRouter.setGlobalListener(globalListener);
                    newRouter.setDisconnectListener(() -> onConnectionLost(newRouter, "connection closed by server"));
                    newRouter.setUnhealthyListener(() -> onConnectionLost(newRouter, "too many undecodable messages"));
                    subscriptions.forEach(newRouter::subscribe);
                    newRouter.start();
                    synchronized (lock) {
                        router = newRouter;
                        transport = newTransport;
                    }
                    return verifyProtocolVersion(newRouter);
                })
                .whenComplete((ignored, error) -> {
                    if (error == null) {
                        healthFailures.set(0);
                        setState(ConnectionState.CONNECTED);
                        scheduleHealthCheck();
                        return;
                    }
                    logger.debug("Connection attempt failed: {}", unwrap(error).getMessage());
                    CorrelationRouter failedRouter;
                    synchronized (lock) {
                        failedRouter = router;
                        router = null;
                        transport = null;
                    }
                    if (failedRouter != null) {
                        failedRouter.close();
                    } else {
                        newTransport.close();
                    }
                    setState(ConnectionState.ERROR);
                });
    }

    private CompletableFuture<Void> verifyProtocolVersion(CorrelationRouter target) {
        ObjectNode params = codec.getMapper().createObjectNode();
        params.putNull("message");
        return target.issue("ping", params, options.getPingTimeout()).thenAccept(result -> {
            JsonNode version = result.get("protocolVersion");
            if (version == null || version.isNull()) {
                logger.warn("Server did not report a protocol version; assuming {}", CopilotSdk.PROTOCOL_VERSION);
                return;
            }
            if (version.asInt() != CopilotSdk.PROTOCOL_VERSION) {
                throw new CLIConnectionException("SDK protocol version mismatch: SDK expects version "
                        + CopilotSdk.PROTOCOL_VERSION + ", but server reports version " + version.asInt()
                        + ". Please update your SDK or server to ensure compatibility.");
            }
        });
    }

    private void scheduleHealthCheck() {
        Duration interval = options.getHealthCheckInterval();
        if (interval == null || interval.isZero() || interval.isNegative()) {
            return;
        }
        synchronized (lock) {
            cancelHealthCheck();
            long millis = interval.toMillis();
            healthTask = scheduler.scheduleWithFixedDelay(this::checkHealth, millis, millis, TimeUnit.MILLISECONDS);
        }
    }

    private void cancelHealthCheck() {
        if (healthTask != null) {
            healthTask.cancel(false);
            healthTask = null;
        }
    }

    /**
     * Send one health ping. Completes once the outcome was recorded; never blocks the caller.
     */
    CompletableFuture<Void> checkHealth() {
        CorrelationRouter current = router;
        if (state != ConnectionState.CONNECTED || current == null) {
            return CompletableFuture.completedFuture(null);
        }
        ObjectNode params = codec.getMapper().createObjectNode();
        params.putNull("message");
        return current.issue("ping", params, options.getPingTimeout()).handle((result, error) -> {
            if (error == null) {
                healthFailures.set(0);
                return null;
            }
            int failures = healthFailures.incrementAndGet();
            logger.warn("Health check failed ({}/{}): {}", failures, MAX_HEALTH_FAILURES, unwrap(error).getMessage());
            if (failures >= MAX_HEALTH_FAILURES) {
                onConnectionLost(current, "health check failed " + failures + " times");
            }
            return null;
        });
    }

    private void onConnectionLost(CorrelationRouter source, String reason) {
        synchronized (lock) {
            if (stopping || source != router || state != ConnectionState.CONNECTED) {
                return;
            }
            cancelHealthCheck();
            router = null;
        }
        boolean owned = ownsServer();
        synchronized (lock) {
            transport = null;
        }
        logger.warn("Lost connection to Copilot CLI: {}", reason);
        setState(ConnectionState.ERROR);
        source.failAll(new CLIConnectionException("Connection lost: " + reason));
        source.close();

        if (options.isAutoRestart() && owned) {
            scheduler.execute(() -> restart(1));
        } else {
            notifyRecoveryFailed(new CLIConnectionException("Connection lost: " + reason));
        }
    }

    private void restart(int attempt) {
        if (stopping) {
            return;
        }
        if (attempt > options.getMaxRestartAttempts()) {
            logger.error("Giving up on Copilot CLI after {} restart attempts", options.getMaxRestartAttempts());
            setState(ConnectionState.ERROR);
            notifyRecoveryFailed(new CLIConnectionException(
                    "Failed to restart Copilot CLI after " + options.getMaxRestartAttempts() + " attempts"));
            return;
        }
        long delay = options.getRestartBackoff().toMillis() << (attempt - 1);
        scheduler.schedule(() -> {
            if (stopping) {
                return;
            }
            logger.info("Restarting Copilot CLI (attempt {}/{})", attempt, options.getMaxRestartAttempts());
            connect().whenComplete((ignored, error) -> {
                if (error == null) {
                    logger.info("Copilot CLI restarted");
                    ConnectionRecoveryListener listener = recoveryListener;
                    if (listener != null) {
                        listener.onReconnected();
                    }
                } else {
                    logger.warn("Restart attempt {} failed: {}", attempt, unwrap(error).getMessage());
                    restart(attempt + 1);
                }
            });
        }, delay, TimeUnit.MILLISECONDS);
    }

    private void notifyRecoveryFailed(Throwable cause) {
        ConnectionRecoveryListener listener = recoveryListener;
        if (listener != null) {
            listener.onRecoveryFailed(cause);
        }
    }

    private void setState(ConnectionState newState) {
        ConnectionState previous;
        synchronized (lock) {
            previous = state;
            state = newState;
        }
        if (previous == newState) {
            return;
        }
        logger.debug("Connection state {} -> {}", previous, newState);
        for (Consumer<ConnectionState> listener : stateListeners) {
            try {
                listener.accept(newState);
            } catch (RuntimeException e) {
                logger.warn("Connection state listener failed", e);
            }
        }
    }

    /**
     * Release the monitoring thread. The manager cannot be reused afterwards.
     */
    public void shutdownScheduler() {
        scheduler.shutdownNow();
    }

    static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }
}
