package com.github.copilot.sdk.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.copilot.sdk.transport.Frame;
import com.github.copilot.sdk.transport.FrameCodec;
import com.github.copilot.sdk.types.options.ConnectionState;
import com.github.copilot.sdk.types.options.CopilotClientOptions;
import com.github.copilot.sdk.types.responses.GetStatusResponse;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.ServerSocket;
import java.net.Socket;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Drives a client against a loopback socket speaking the framed wire protocol.
 */
class ExternalServerTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final List<String> methods = new CopyOnWriteArrayList<>();
    private ServerSocket serverSocket;
    private Thread serverThread;

    @BeforeEach
    void startServer() throws IOException {
        serverSocket = new ServerSocket(0);
        serverThread = new Thread(this::serve, "loopback-cli");
        serverThread.setDaemon(true);
        serverThread.start();
    }

    @AfterEach
    void stopServer() throws Exception {
        serverSocket.close();
        serverThread.join(TimeUnit.SECONDS.toMillis(5));
    }

    @Test
    void attachesToRunningServer() throws Exception {
        CopilotClientOptions options = CopilotClientOptions.builder()
                .cliUrl("127.0.0.1:" + serverSocket.getLocalPort())
                .healthCheckInterval(Duration.ZERO)
                .build();

        try (CopilotClient client = new CopilotClient(options)) {
            client.start().get(5, TimeUnit.SECONDS);
            assertThat(client.getState()).isEqualTo(ConnectionState.CONNECTED);

            GetStatusResponse status = client.getStatus().get(5, TimeUnit.SECONDS);
            assertThat(status.getVersion()).isEqualTo("loopback");
            assertThat(status.getProtocolVersion()).isEqualTo(2);

            assertThat(client.stop()).isEmpty();
        }
        assertThat(methods).containsExactly("ping", "status.get");
    }

    private void serve() {
        try (Socket socket = serverSocket.accept()) {
            FrameCodec.Reader reader = FrameCodec.reader(socket.getInputStream());
            OutputStream out = socket.getOutputStream();
            Frame frame;
            while ((frame = reader.readFrame()) != null) {
                JsonNode request = mapper.readTree(frame.getPayload());
                String method = request.path("method").asText();
                methods.add(method);
                ObjectNode response = mapper.createObjectNode();
                response.put("jsonrpc", "2.0");
                response.set("id", request.get("id"));
                ObjectNode result = response.putObject("result");
                if ("ping".equals(method)) {
                    result.put("message", "pong");
                    result.put("timestamp", System.currentTimeMillis());
                    result.put("protocolVersion", 2);
                } else {
                    result.put("version", "loopback");
                    result.put("protocolVersion", 2);
                }
                FrameCodec.writeFrame(out, mapper.writeValueAsString(response));
            }
        } catch (IOException e) {
            // socket closed by the test teardown
        }
    }
}
