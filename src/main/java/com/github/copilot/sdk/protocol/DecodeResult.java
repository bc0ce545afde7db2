package com.github.copilot.sdk.protocol;

import com.github.copilot.sdk.exceptions.MessageParseException;

import javax.annotation.Nullable;

/**
 * Outcome of decoding one frame: an envelope or the reason it was rejected.
 */
public final class DecodeResult {

    @Nullable
    private final Envelope envelope;
    @Nullable
    private final MessageParseException error;

    private DecodeResult(@Nullable Envelope envelope, @Nullable MessageParseException error) {
        this.envelope = envelope;
        this.error = error;
    }

    public static DecodeResult ok(Envelope envelope) {
        return new DecodeResult(envelope, null);
    }

    public static DecodeResult failure(MessageParseException error) {
        return new DecodeResult(null, error);
    }

    public boolean isOk() {
        return envelope != null;
    }

    @Nullable
    public Envelope getEnvelope() {
        return envelope;
    }

    @Nullable
    public MessageParseException getError() {
        return error;
    }
}
