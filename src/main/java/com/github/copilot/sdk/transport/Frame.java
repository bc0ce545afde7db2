package com.github.copilot.sdk.transport;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import javax.annotation.Nullable;

/**
 * One unit read from the wire: either a complete JSON payload, or a record that the
 * bytes at this position could not be framed. Malformed frames are reported, not thrown,
 * so the reader loop keeps running.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class Frame {

    @Nullable
    private final String payload;
    @Nullable
    private final String error;

    public static Frame of(String payload) {
        return new Frame(payload, null);
    }

    public static Frame malformed(String error) {
        return new Frame(null, error);
    }

    public boolean isMalformed() {
        return error != null;
    }

    @Override
    public String toString() {
        return isMalformed() ? "Frame[malformed: " + error + "]" : "Frame[" + payload + "]";
    }
}
