package com.github.copilot.sdk.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Getter;

import javax.annotation.Nullable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;

/**
 * An entry in the router's pending table.
 */
@Getter
public final class PendingOperation {

    private final PendingKey key;
    private final String method;
    @Nullable
    private final CompletableFuture<JsonNode> future;
    @Nullable
    private volatile ScheduledFuture<?> deadline;

    private PendingOperation(PendingKey key, String method, @Nullable CompletableFuture<JsonNode> future) {
        this.key = key;
        this.method = method;
        this.future = future;
    }

    static PendingOperation outbound(String id, String method, CompletableFuture<JsonNode> future) {
        return new PendingOperation(new PendingKey(Direction.OUTBOUND, id), method, future);
    }

    static PendingOperation inbound(String id, String method) {
        return new PendingOperation(new PendingKey(Direction.INBOUND, id), method, null);
    }

    void setDeadline(ScheduledFuture<?> deadline) {
        this.deadline = deadline;
    }

    void cancelDeadline() {
        ScheduledFuture<?> d = deadline;
        if (d != null) {
            d.cancel(false);
        }
    }
}
