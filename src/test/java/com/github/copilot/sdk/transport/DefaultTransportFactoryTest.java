package com.github.copilot.sdk.transport;

import com.github.copilot.sdk.types.options.CopilotClientOptions;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DefaultTransportFactoryTest {

    @Test
    void defaultsToStdio() {
        Transport transport = new DefaultTransportFactory(CopilotClientOptions.builder().build()).create();

        assertThat(transport).isInstanceOf(StdioTransport.class);
        assertThat(transport.ownsServer()).isTrue();
    }

    @Test
    void cliUrlAttachesWithoutOwningServer() {
        Transport transport = new DefaultTransportFactory(
                CopilotClientOptions.builder().cliUrl("localhost:9999").build()).create();

        assertThat(transport).isInstanceOf(SocketTransport.class);
        assertThat(transport.ownsServer()).isFalse();
        assertThat(transport.describe()).isEqualTo("tcp:localhost:9999");
    }

    @Test
    void tcpModeSpawnsAndOwnsServer() {
        Transport transport = new DefaultTransportFactory(
                CopilotClientOptions.builder().useStdio(false).build()).create();

        assertThat(transport).isInstanceOf(SocketTransport.class);
        assertThat(transport.ownsServer()).isTrue();
    }
}
