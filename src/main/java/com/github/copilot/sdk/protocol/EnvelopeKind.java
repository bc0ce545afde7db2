package com.github.copilot.sdk.protocol;

/**
 * Discriminant of a decoded protocol message.
 */
public enum EnvelopeKind {
    REQUEST,
    RESPONSE,
    ERROR,
    EVENT
}
