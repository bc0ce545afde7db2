package com.github.copilot.sdk.session;

/**
 * Client-side view of a session's context compaction.
 */
public enum CompactionState {
    NORMAL,
    /** Compaction running on the server; sends are admitted. */
    BACKGROUND_COMPACTING,
    /** Context buffer exhausted; sends wait until compaction completes. */
    BLOCKED_COMPACTING
}
