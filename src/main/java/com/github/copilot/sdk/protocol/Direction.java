package com.github.copilot.sdk.protocol;

/**
 * Which side issued a pending request.
 */
public enum Direction {
    /** Issued by this client, awaiting the server's response. */
    OUTBOUND,
    /** Issued by the server, awaiting a caller handler's answer. */
    INBOUND
}
