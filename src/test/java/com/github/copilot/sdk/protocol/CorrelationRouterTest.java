package com.github.copilot.sdk.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.copilot.sdk.exceptions.CLIConnectionException;
import com.github.copilot.sdk.exceptions.JsonRpcException;
import com.github.copilot.sdk.exceptions.RequestTimeoutException;
import com.github.copilot.sdk.testing.Await;
import com.github.copilot.sdk.testing.QueueTransport;
import com.github.copilot.sdk.types.events.SessionEvent;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;

class CorrelationRouterTest {

    private static final Duration NO_TIMEOUT = null;

    private final ObjectMapper mapper = new ObjectMapper();
    private QueueTransport transport;
    private CorrelationRouter router;

    @BeforeEach
    void setUp() {
        transport = new QueueTransport();
        router = new CorrelationRouter(transport, new MessageCodec(mapper), 2);
        router.start();
    }

    @AfterEach
    void tearDown() {
        router.close();
    }

    @Test
    void matchesResponsesArrivingOutOfOrder() throws Exception {
        CompletableFuture<JsonNode> first = router.issue("models.list", null, NO_TIMEOUT);
        CompletableFuture<JsonNode> second = router.issue("status.get", null, NO_TIMEOUT);
        long firstId = transport.nextSent().path("id").asLong();
        long secondId = transport.nextSent().path("id").asLong();

        transport.push(response(secondId, "{\"version\":\"1.0\"}"));
        transport.push(response(firstId, "{\"models\":[]}"));

        assertThat(second.get(2, TimeUnit.SECONDS).path("version").asText()).isEqualTo("1.0");
        assertThat(first.get(2, TimeUnit.SECONDS).has("models")).isTrue();
        assertThat(router.pendingCount()).isZero();
    }

    @Test
    void concurrentRequestsGetDistinctIdsAndTheirOwnResponses() throws Exception {
        int count = 40;
        ExecutorService callers = Executors.newFixedThreadPool(8);
        try {
            List<Future<CompletableFuture<JsonNode>>> issued = new ArrayList<>();
            for (int i = 0; i < count; i++) {
                String tag = "req-" + i;
                issued.add(callers.submit(() -> router.issue("ping",
                        mapper.createObjectNode().put("message", tag), NO_TIMEOUT)));
            }
            Map<Long, String> tagsById = new HashMap<>();
            for (int i = 0; i < count; i++) {
                JsonNode sent = transport.nextSent();
                tagsById.put(sent.path("id").asLong(), sent.path("params").path("message").asText());
            }
            assertThat(tagsById).hasSize(count);

            List<Long> ids = new ArrayList<>(tagsById.keySet());
            for (int i = ids.size() - 1; i >= 0; i--) {
                long id = ids.get(i);
                transport.push(response(id, "{\"message\":\"" + tagsById.get(id) + "\"}"));
            }

            Set<String> answered = new HashSet<>();
            for (int i = 0; i < count; i++) {
                answered.add(issued.get(i).get().get(2, TimeUnit.SECONDS).path("message").asText());
            }
            for (int i = 0; i < count; i++) {
                assertThat(issued.get(i).get().get().path("message").asText()).isEqualTo("req-" + i);
            }
            assertThat(answered).hasSize(count);
        } finally {
            callers.shutdownNow();
        }
    }

    @Test
    void errorResponseFailsWithServerCodeAndMessage() {
        CompletableFuture<JsonNode> future = router.issue("session.resume", null, NO_TIMEOUT);
        long id = transport.nextSent().path("id").asLong();

        transport.push("{\"jsonrpc\":\"2.0\",\"id\":" + id
                + ",\"error\":{\"code\":-32000,\"message\":\"Session not found\"}}");

        Throwable thrown = catchThrowable(() -> future.get(2, TimeUnit.SECONDS));

        assertThat(thrown).hasCauseInstanceOf(JsonRpcException.class);
        JsonRpcException rpc = (JsonRpcException) thrown.getCause();
        assertThat(rpc.getCode()).isEqualTo(-32000);
        assertThat(rpc.getErrorMessage()).isEqualTo("Session not found");
        assertThat(rpc.getMethod()).isEqualTo("session.resume");
    }

    @Test
    void responseForUnknownIdIsDropped() throws Exception {
        CompletableFuture<JsonNode> future = router.issue("ping", null, NO_TIMEOUT);
        long id = transport.nextSent().path("id").asLong();

        transport.push(response(id + 1000, "{}"));
        transport.push(response(id, "{\"message\":\"pong\"}"));

        assertThat(future.get(2, TimeUnit.SECONDS).path("message").asText()).isEqualTo("pong");
    }

    @Test
    void timeoutRemovesPendingEntryAndIgnoresLateResponse() {
        CompletableFuture<JsonNode> future = router.issue("session.send", null, Duration.ofMillis(50));
        long id = transport.nextSent().path("id").asLong();

        assertThatThrownBy(() -> future.get(2, TimeUnit.SECONDS))
                .hasCauseInstanceOf(RequestTimeoutException.class);
        assertThat(router.pendingCount()).isZero();

        transport.push(response(id, "{}"));
        CompletableFuture<JsonNode> next = router.issue("ping", null, NO_TIMEOUT);
        long nextId = transport.nextSent().path("id").asLong();
        transport.push(response(nextId, "{}"));
        assertThat(next.join()).isNotNull();
    }

    @Test
    void cancellationSendsCancelNotification() {
        CompletableFuture<JsonNode> future = router.issue("session.send", null, NO_TIMEOUT);
        long id = transport.nextSent().path("id").asLong();

        future.cancel(true);

        JsonNode cancel = transport.nextSent();
        assertThat(cancel.path("method").asText()).isEqualTo(CorrelationRouter.CANCEL_METHOD);
        assertThat(cancel.path("params").path("id").asLong()).isEqualTo(id);
        assertThat(cancel.has("id")).isFalse();
        assertThat(router.pendingCount()).isZero();
    }

    @Test
    void endOfStreamFailsPendingAndNotifiesOnce() {
        AtomicInteger disconnects = new AtomicInteger();
        router.setDisconnectListener(disconnects::incrementAndGet);
        CompletableFuture<JsonNode> first = router.issue("ping", null, NO_TIMEOUT);
        CompletableFuture<JsonNode> second = router.issue("status.get", null, NO_TIMEOUT);

        transport.endOfStream();

        assertThatThrownBy(() -> first.get(2, TimeUnit.SECONDS))
                .hasCauseInstanceOf(CLIConnectionException.class)
                .hasMessageContaining("Connection closed before response");
        assertThatThrownBy(() -> second.get(2, TimeUnit.SECONDS))
                .hasCauseInstanceOf(CLIConnectionException.class);
        Await.until(() -> disconnects.get() == 1);
        assertThat(router.pendingCount()).isZero();

        assertThatThrownBy(() -> router.issue("ping", null, NO_TIMEOUT).get(2, TimeUnit.SECONDS))
                .hasCauseInstanceOf(CLIConnectionException.class);
    }

    @Test
    void closeDoesNotReportDisconnect() throws Exception {
        AtomicInteger disconnects = new AtomicInteger();
        router.setDisconnectListener(disconnects::incrementAndGet);
        CompletableFuture<JsonNode> pending = router.issue("ping", null, NO_TIMEOUT);

        router.close();

        assertThatThrownBy(() -> pending.get(2, TimeUnit.SECONDS))
                .hasCauseInstanceOf(CLIConnectionException.class);
        assertThat(transport.isClosed()).isTrue();
        assertThat(router.isOpen()).isFalse();
        Thread.sleep(100);
        assertThat(disconnects.get()).isZero();
    }

    @Test
    void answersInboundRequestEchoingItsId() {
        router.setRequestHandler((method, params) -> CompletableFuture.completedFuture(
                mapper.createObjectNode().put("echo", params.path("value").asText())));

        transport.push("{\"jsonrpc\":\"2.0\",\"id\":\"srv-1\",\"method\":\"tool.call\",\"params\":{\"value\":\"v\"}}");

        JsonNode reply = transport.nextSent();
        assertThat(reply.path("id").asText()).isEqualTo("srv-1");
        assertThat(reply.path("id").isTextual()).isTrue();
        assertThat(reply.path("result").path("echo").asText()).isEqualTo("v");
        assertThat(router.pendingCount()).isZero();
    }

    @Test
    void unknownInboundMethodGetsMethodNotFound() {
        transport.push("{\"jsonrpc\":\"2.0\",\"id\":9,\"method\":\"workspace.open\",\"params\":{}}");

        JsonNode reply = transport.nextSent();
        assertThat(reply.path("id").asInt()).isEqualTo(9);
        assertThat(reply.path("error").path("code").asInt()).isEqualTo(RpcError.METHOD_NOT_FOUND);
        assertThat(reply.path("error").path("message").asText()).isEqualTo("Method not found: workspace.open");
    }

    @Test
    void handlerRpcErrorIsForwarded() {
        router.setRequestHandler((method, params) -> {
            throw new JsonRpcException(method, RpcError.INVALID_PARAMS, "Unknown session: x", null);
        });

        transport.push("{\"jsonrpc\":\"2.0\",\"id\":3,\"method\":\"tool.call\",\"params\":{}}");

        JsonNode reply = transport.nextSent();
        assertThat(reply.path("error").path("code").asInt()).isEqualTo(RpcError.INVALID_PARAMS);
        assertThat(reply.path("error").path("message").asText()).isEqualTo("Unknown session: x");
    }

    @Test
    void handlerFailureBecomesInternalError() {
        router.setRequestHandler((method, params) -> {
            CompletableFuture<JsonNode> failed = new CompletableFuture<>();
            failed.completeExceptionally(new IllegalStateException("disk full"));
            return failed;
        });

        transport.push("{\"jsonrpc\":\"2.0\",\"id\":4,\"method\":\"tool.call\",\"params\":{}}");

        JsonNode reply = transport.nextSent();
        assertThat(reply.path("error").path("code").asInt()).isEqualTo(RpcError.INTERNAL_ERROR);
        assertThat(reply.path("error").path("message").asText()).isEqualTo("disk full");
    }

    @Test
    void duplicateInboundIdIsRejectedAndOriginalAnsweredOnce() {
        CompletableFuture<JsonNode> slow = new CompletableFuture<>();
        router.setRequestHandler((method, params) -> slow);

        transport.push("{\"jsonrpc\":\"2.0\",\"id\":5,\"method\":\"permission.request\",\"params\":{}}");
        Await.until(() -> router.pendingCount() == 1);
        transport.push("{\"jsonrpc\":\"2.0\",\"id\":5,\"method\":\"permission.request\",\"params\":{}}");

        JsonNode rejection = transport.nextSent();
        assertThat(rejection.path("error").path("code").asInt()).isEqualTo(RpcError.INVALID_REQUEST);

        slow.complete(mapper.createObjectNode().put("ok", true));
        JsonNode reply = transport.nextSent();
        assertThat(reply.path("id").asInt()).isEqualTo(5);
        assertThat(reply.path("result").path("ok").asBoolean()).isTrue();
        assertThat(transport.sent("permission.request")).isEmpty();
    }

    @Test
    void tooManyUndecodableFramesMarksConnectionUnhealthy() throws Exception {
        AtomicInteger unhealthy = new AtomicInteger();
        router.setUnhealthyListener(unhealthy::incrementAndGet);

        transport.pushMalformed("Missing Content-Length header");
        transport.push("not json");
        transport.push("{\"jsonrpc\":\"2.0\",\"method\":\"noop\"}");
        transport.push("[]");
        transport.push("{\"id\":1}");
        CompletableFuture<JsonNode> followUp = router.issue("ping", null, NO_TIMEOUT);
        long id = transport.nextSent().path("id").asLong();
        transport.push(response(id, "{}"));
        followUp.get(2, TimeUnit.SECONDS);
        assertThat(unhealthy.get()).isZero();

        transport.push("garbage");
        transport.push("garbage");
        transport.push("garbage");
        Await.until(() -> unhealthy.get() == 1);
    }

    @Test
    void routesSessionEventsBySessionId() {
        List<SessionEvent> first = new CopyOnWriteArrayList<>();
        List<SessionEvent> second = new CopyOnWriteArrayList<>();
        List<String> global = new CopyOnWriteArrayList<>();
        router.subscribe("s1", first::add);
        router.subscribe("s2", second::add);
        router.setGlobalListener((method, params) -> global.add(method));

        transport.push(sessionEvent("s1", "assistant.message_delta"));
        transport.push(sessionEvent("s2", "session.idle"));
        transport.push(sessionEvent("s3", "session.idle"));
        transport.push(sessionEvent("s1", "assistant.message"));
        transport.push("{\"jsonrpc\":\"2.0\",\"method\":\"models.changed\",\"params\":{}}");

        Await.until(() -> global.size() == 1);
        assertThat(first).extracting(SessionEvent::getType)
                .containsExactly("assistant.message_delta", "assistant.message");
        assertThat(second).extracting(SessionEvent::getType).containsExactly("session.idle");
        assertThat(global).containsExactly("models.changed");

        router.unsubscribe("s1");
        transport.push(sessionEvent("s1", "session.idle"));
        transport.push("{\"jsonrpc\":\"2.0\",\"method\":\"models.changed\",\"params\":{}}");
        Await.until(() -> global.size() == 2);
        assertThat(first).hasSize(2);
    }

    private static String response(long id, String result) {
        return "{\"jsonrpc\":\"2.0\",\"id\":" + id + ",\"result\":" + result + "}";
    }

    private static String sessionEvent(String sessionId, String type) {
        return "{\"jsonrpc\":\"2.0\",\"method\":\"session.event\",\"params\":{\"sessionId\":\"" + sessionId
                + "\",\"event\":{\"id\":\"e\",\"type\":\"" + type + "\",\"data\":{}}}}";
    }
}
