package com.github.copilot.sdk.types.events;

/**
 * Session event type names the client interprets.
 * Subscribers receive every event type, including ones not listed here.
 */
public final class SessionEventType {

    public static final String SESSION_START = "session.start";
    public static final String SESSION_RESUME = "session.resume";
    public static final String SESSION_IDLE = "session.idle";
    public static final String SESSION_ERROR = "session.error";
    public static final String SESSION_USAGE_INFO = "session.usage_info";
    public static final String SESSION_COMPACTION_START = "session.compaction_start";
    public static final String SESSION_COMPACTION_COMPLETE = "session.compaction_complete";

    public static final String USER_MESSAGE = "user.message";
    public static final String ASSISTANT_MESSAGE = "assistant.message";
    public static final String ASSISTANT_MESSAGE_DELTA = "assistant.message_delta";
    public static final String ASSISTANT_REASONING = "assistant.reasoning";
    public static final String ASSISTANT_REASONING_DELTA = "assistant.reasoning_delta";

    // Synthesised by the client
    public static final String CONNECTION_STATE_CHANGED = "client.connection_state_changed";
    public static final String SESSION_RESUMED = "client.session_resumed";
    public static final String SESSION_FAILED = "client.session_failed";

    private SessionEventType() {
    }
}
