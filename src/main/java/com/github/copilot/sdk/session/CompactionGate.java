package com.github.copilot.sdk.session;

import com.github.copilot.sdk.types.options.InfiniteSessionConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.concurrent.CompletableFuture;

/**
 * Admission gate for outgoing messages, driven by the server's usage and compaction events.
 *
 * <p>{@code NORMAL -> BACKGROUND_COMPACTING -> (NORMAL | BLOCKED_COMPACTING) -> NORMAL}.
 * While {@link CompactionState#BLOCKED_COMPACTING}, {@link #admission()} returns a future
 * that completes when the server reports {@code session.compaction_complete}.
 */
public class CompactionGate {

    private static final Logger logger = LoggerFactory.getLogger(CompactionGate.class);

    private final String sessionId;
    private final boolean enabled;
    private final double backgroundThreshold;
    private final double exhaustionThreshold;

    private CompactionState state = CompactionState.NORMAL;
    private CompletableFuture<Void> unblocked = CompletableFuture.completedFuture(null);

    public CompactionGate(String sessionId, @Nullable InfiniteSessionConfig config) {
        InfiniteSessionConfig effective = config != null ? config : InfiniteSessionConfig.defaults();
        this.sessionId = sessionId;
        this.enabled = effective.isEnabled();
        this.backgroundThreshold = effective.getBackgroundCompactionThreshold();
        this.exhaustionThreshold = effective.getBufferExhaustionThreshold();
    }

    public synchronized CompactionState getState() {
        return state;
    }

    /**
     * Record a server-reported utilisation in [0,1].
     */
    public synchronized void onUsage(double utilization) {
        if (!enabled) {
            return;
        }
        if (utilization >= exhaustionThreshold) {
            block();
        } else if (utilization >= backgroundThreshold && state == CompactionState.NORMAL) {
            transition(CompactionState.BACKGROUND_COMPACTING);
        }
    }

    public synchronized void onCompactionStart() {
        if (enabled && state == CompactionState.NORMAL) {
            transition(CompactionState.BACKGROUND_COMPACTING);
        }
    }

    public synchronized void onCompactionComplete() {
        if (state == CompactionState.NORMAL) {
            return;
        }
        transition(CompactionState.NORMAL);
        unblocked.complete(null);
    }

    /**
     * Completes once a message may be dispatched.
     */
    public synchronized CompletableFuture<Void> admission() {
        return unblocked;
    }

    /**
     * Back to {@link CompactionState#NORMAL}, releasing waiting messages. A restarted server
     * has no compaction in progress, so no completion event will arrive for the old one.
     */
    public synchronized void reset() {
        if (state != CompactionState.NORMAL) {
            transition(CompactionState.NORMAL);
        }
        unblocked.complete(null);
    }

    /**
     * Fail any message waiting at the gate; used when the session ends.
     */
    public synchronized void abandon(Throwable cause) {
        unblocked.completeExceptionally(cause);
    }

    private void block() {
        if (state == CompactionState.BLOCKED_COMPACTING) {
            return;
        }
        transition(CompactionState.BLOCKED_COMPACTING);
        unblocked = new CompletableFuture<>();
    }

    private void transition(CompactionState next) {
        logger.debug("Session {} compaction {} -> {}", sessionId, state, next);
        state = next;
    }
}
