package com.github.copilot.sdk.transport;

import java.io.Closeable;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Stream;

/**
 * A byte channel to the CLI server carrying framed JSON messages.
 *
 * <p>Implementations either own a spawned process or attach to an existing server;
 * the connection lifecycle code does not distinguish between them.
 */
public interface Transport extends Closeable {

    /**
     * Open the channel: spawn the process or connect the socket.
     */
    CompletableFuture<Void> connect();

    /**
     * Write one message as a single frame. Safe to call from concurrent threads;
     * frames are never interleaved.
     *
     * @param message JSON text of the message
     * @throws com.github.copilot.sdk.exceptions.CLIConnectionException if the channel is closed
     */
    void send(String message);

    /**
     * Lazily read inbound frames. The stream ends when the process exits or the socket
     * closes. Calling this again continues from the current position.
     */
    Stream<Frame> readFrames();

    /**
     * Check if the transport is connected and writable.
     */
    boolean isReady();

    /**
     * Whether closing this transport also terminates the server it talks to.
     */
    boolean ownsServer();

    /**
     * Short description for logs, e.g. {@code stdio:/usr/bin/copilot} or {@code tcp:localhost:8080}.
     */
    String describe();

    /**
     * Release the process or socket. Idempotent.
     */
    @Override
    void close();
}
