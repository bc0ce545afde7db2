package com.github.copilot.sdk.transport;

/**
 * Creates a fresh, unconnected transport for each connection attempt.
 */
@FunctionalInterface
public interface TransportFactory {
    Transport create();
}
