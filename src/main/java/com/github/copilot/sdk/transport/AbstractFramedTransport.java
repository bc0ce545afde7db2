package com.github.copilot.sdk.transport;

import com.github.copilot.sdk.exceptions.CLIConnectionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Shared framing, write serialisation and close bookkeeping for stream-based transports.
 */
public abstract class AbstractFramedTransport implements Transport {

    private static final Logger logger = LoggerFactory.getLogger(AbstractFramedTransport.class);

    private final Object writeLock = new Object();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private OutputStream out;
    private FrameCodec.Reader reader;
    private volatile boolean ready;

    /**
     * Install the connected streams. Called by subclasses once the channel is open.
     */
    protected final void attachStreams(InputStream in, OutputStream out) {
        this.reader = FrameCodec.reader(in);
        this.out = new BufferedOutputStream(out);
        this.ready = true;
    }

    @Override
    public void send(String message) {
        if (!ready || out == null) {
            throw new CLIConnectionException("Transport not connected: " + describe());
        }
        synchronized (writeLock) {
            try {
                FrameCodec.writeFrame(out, message);
            } catch (IOException e) {
                ready = false;
                throw new CLIConnectionException("Failed to write to " + describe(), e);
            }
        }
    }

    @Override
    public Stream<Frame> readFrames() {
        if (reader == null) {
            throw new CLIConnectionException("Transport not connected: " + describe());
        }
        Spliterator<Frame> spliterator = new Spliterators.AbstractSpliterator<Frame>(
                Long.MAX_VALUE,
                Spliterator.ORDERED | Spliterator.NONNULL
        ) {
            @Override
            public boolean tryAdvance(Consumer<? super Frame> action) {
                Frame frame;
                try {
                    frame = reader.readFrame();
                } catch (IOException e) {
                    if (!closed.get()) {
                        logger.debug("Read from {} ended: {}", describe(), e.getMessage());
                    }
                    frame = null;
                }
                if (frame == null) {
                    ready = false;
                    return false;
                }
                action.accept(frame);
                return true;
            }
        };
        return StreamSupport.stream(spliterator, false);
    }

    @Override
    public boolean isReady() {
        return ready && !closed.get();
    }

    @Override
    public final void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        ready = false;
        synchronized (writeLock) {
            if (out != null) {
                try {
                    out.close();
                } catch (IOException e) {
                    logger.warn("Error closing output of {}", describe(), e);
                }
            }
        }
        releaseResources();
    }

    protected boolean isClosed() {
        return closed.get();
    }

    /**
     * Release the process or socket behind this transport. Runs at most once.
     */
    protected abstract void releaseResources();
}
