package com.github.copilot.sdk.session;

import com.github.copilot.sdk.types.events.SessionEvent;
import com.github.copilot.sdk.types.events.SessionEventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.HashMap;
import java.util.Map;

/**
 * Reassembles streamed message and reasoning deltas, one buffer per block.
 *
 * <p>Fed from the connection's reader thread only, so events for a block arrive in order.
 */
public class StreamAssembler {

    private static final Logger logger = LoggerFactory.getLogger(StreamAssembler.class);

    enum BlockKind {
        MESSAGE("messageId"),
        REASONING("reasoningId");

        private final String idField;

        BlockKind(String idField) {
            this.idField = idField;
        }
    }

    private final String sessionId;
    private final boolean streaming;
    private final Map<BlockKind, Map<String, StringBuilder>> buffers = new HashMap<>();

    public StreamAssembler(String sessionId, boolean streaming) {
        this.sessionId = sessionId;
        this.streaming = streaming;
        for (BlockKind kind : BlockKind.values()) {
            buffers.put(kind, new HashMap<>());
        }
    }

    /**
     * Apply one event.
     *
     * @return the assembled text when the event completed a block that received deltas,
     * otherwise {@code null}
     */
    @Nullable
    public synchronized String accept(SessionEvent event) {
        switch (event.getType()) {
            case SessionEventType.ASSISTANT_MESSAGE_DELTA:
                appendDelta(BlockKind.MESSAGE, event);
                return null;
            case SessionEventType.ASSISTANT_REASONING_DELTA:
                appendDelta(BlockKind.REASONING, event);
                return null;
            case SessionEventType.ASSISTANT_MESSAGE:
                return complete(BlockKind.MESSAGE, event);
            case SessionEventType.ASSISTANT_REASONING:
                return complete(BlockKind.REASONING, event);
            default:
                return null;
        }
    }

    /**
     * Text buffered so far for an open message block.
     */
    @Nullable
    public synchronized String partialMessage(String messageId) {
        StringBuilder buffer = buffers.get(BlockKind.MESSAGE).get(messageId);
        return buffer != null ? buffer.toString() : null;
    }

    public synchronized int openBlocks() {
        int count = 0;
        for (Map<String, StringBuilder> perKind : buffers.values()) {
            count += perKind.size();
        }
        return count;
    }

    /**
     * Drop every open block, e.g. after the connection was lost mid-stream.
     */
    public synchronized void reset() {
        for (Map<String, StringBuilder> perKind : buffers.values()) {
            perKind.clear();
        }
    }

    private void appendDelta(BlockKind kind, SessionEvent event) {
        if (!streaming) {
            logger.warn("Session {} received {} although streaming is disabled", sessionId, event.getType());
            return;
        }
        String blockId = event.getDataText(kind.idField);
        if (blockId == null) {
            logger.warn("Session {} received {} without {}", sessionId, event.getType(), kind.idField);
            return;
        }
        String delta = event.getDataText("deltaContent");
        buffers.get(kind).computeIfAbsent(blockId, id -> new StringBuilder())
                .append(delta != null ? delta : "");
    }

    @Nullable
    private String complete(BlockKind kind, SessionEvent event) {
        String blockId = event.getDataText(kind.idField);
        if (blockId == null) {
            return null;
        }
        StringBuilder buffer = buffers.get(kind).remove(blockId);
        if (buffer == null) {
            return null;
        }
        String assembled = buffer.toString();
        String content = event.getDataText("content");
        if (content != null && !content.equals(assembled)) {
            logger.warn("Session {} {} {}: streamed content ({} chars) differs from final content ({} chars)",
                    sessionId, kind, blockId, assembled.length(), content.length());
        }
        return assembled;
    }
}
