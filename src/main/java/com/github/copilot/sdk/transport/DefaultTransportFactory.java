package com.github.copilot.sdk.transport;

import com.github.copilot.sdk.types.options.CopilotClientOptions;

/**
 * Picks the transport variant from validated client options.
 */
public class DefaultTransportFactory implements TransportFactory {

    private final CopilotClientOptions options;

    public DefaultTransportFactory(CopilotClientOptions options) {
        this.options = options;
    }

    @Override
    public Transport create() {
        if (options.isExternalServer()) {
            return SocketTransport.attach(ServerAddress.parse(options.getCliUrl()));
        }
        if (options.isStdioMode()) {
            return new StdioTransport(options);
        }
        return SocketTransport.spawn(new CliProcessLauncher(options));
    }
}
