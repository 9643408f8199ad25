package io.conduit.server.mcp;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.conduit.core.connection.RemoteTool;
import io.conduit.core.connection.ServerConfig;
import io.conduit.core.connection.ToolCallResponse;
import io.conduit.core.connection.ToolServerClient;
import io.conduit.core.exception.ConnectionException;
import io.conduit.core.exception.ToolExecutionException;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/// Runs the client against an in-process HTTP server that answers like a
/// streamable-HTTP MCP server.
class McpToolServerClientTest {

    private static final String SESSION = "session-abc";
    private static final String SESSION_HEADER = "Mcp-Session-Id";

    private final ObjectMapper mapper = new ObjectMapper();
    private final List<Received> received = new CopyOnWriteArrayList<>();

    private ExecutorService handlers;
    private HttpServer server;
    private ToolServerClient client;
    private volatile int forcedStatus;

    @BeforeEach
    void setUp() throws IOException {
        handlers = Executors.newCachedThreadPool();
        server = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
        server.createContext("/mcp", this::handle);
        server.setExecutor(handlers);
        server.start();

        int port = server.getAddress().getPort();
        McpToolServerClientFactory factory =
                new McpToolServerClientFactory(
                        mapper, Duration.ofSeconds(5), Duration.ofSeconds(5));
        client = factory.create(ServerConfig.of("rag", "http://localhost:" + port, port));
    }

    @AfterEach
    void tearDown() {
        client.close();
        if (server != null) {
            server.stop(0);
        }
        handlers.shutdownNow();
    }

    @Nested
    class Initialize {

        @Test
        void shouldSendHandshakeWithClientIdentity() {
            client.initialize();

            assertThat(posts()).extracting(Received::rpcMethod)
                    .startsWith("initialize", "notifications/initialized");

            JsonNode clientInfo = posts().get(0).body().get("params").get("clientInfo");
            assertThat(clientInfo.get("name").asText()).isEqualTo("conduit-rag-client");
            assertThat(clientInfo.get("version").asText()).isEqualTo("1.0.0");
        }

        @Test
        void shouldEchoSessionIdAfterHandshake() {
            client.initialize();
            client.listTools();

            assertThat(posts().get(0).session()).isNull();
            assertThat(lastPost("tools/list").session()).isEqualTo(SESSION);
        }

        @Test
        void shouldFailWithConnectionExceptionWhenServerRejectsHandshake() {
            forcedStatus = 500;

            assertThatThrownBy(() -> client.initialize())
                    .isInstanceOf(ConnectionException.class)
                    .hasMessageStartingWith("Request 'initialize' to server 'rag' failed");
        }
    }

    @Nested
    class ListTools {

        @Test
        void shouldFollowCursorAcrossPages() {
            client.initialize();

            List<RemoteTool> tools = client.listTools();

            assertThat(tools).extracting(RemoteTool::name).containsExactly("search", "fetch");
            assertThat(tools.get(0).description()).isEqualTo("Search documents");
            assertThat(tools.get(0).inputSchema()).containsEntry("type", "object");
            assertThat(lastPost("tools/list").body().get("params").get("cursor").asText())
                    .isEqualTo("page-2");
        }
    }

    @Nested
    class CallTool {

        @Test
        void shouldReturnTextContent() {
            client.initialize();

            ToolCallResponse response = client.callTool("search", Map.of("query", "reports"));

            assertThat(response.isError()).isFalse();
            assertThat(response.textContent()).isEqualTo("echo: reports");
            JsonNode arguments = lastPost("tools/call").body().get("params").get("arguments");
            assertThat(arguments.get("query").asText()).isEqualTo("reports");
        }

        @Test
        void shouldPassServerReportedFailureAsData() {
            client.initialize();

            ToolCallResponse response = client.callTool("fail", Map.of());

            assertThat(response.isError()).isTrue();
            assertThat(response.errorMessage()).isEqualTo("boom");
        }

        @Test
        void shouldMapRpcErrorToToolExecutionException() {
            client.initialize();

            assertThatThrownBy(() -> client.callTool("unknown", Map.of()))
                    .isInstanceOf(ToolExecutionException.class)
                    .hasMessageContaining("Unknown tool");
        }

        @Test
        void shouldThrowConnectionExceptionOnHttpError() {
            client.initialize();
            forcedStatus = 500;

            assertThatThrownBy(() -> client.callTool("search", Map.of()))
                    .isInstanceOf(ConnectionException.class)
                    .hasMessageStartingWith("Request 'tools/call' to server 'rag' failed");
        }
    }

    @Nested
    class Close {

        @Test
        void shouldRejectRequestsAfterClose() {
            client.initialize();
            client.close();

            assertThatThrownBy(() -> client.listTools())
                    .isInstanceOf(ConnectionException.class)
                    .hasMessage("Client for server 'rag' is closed");
        }

        @Test
        void shouldNotThrowWhenServerIsGone() {
            client.initialize();
            server.stop(0);
            server = null;

            assertThatCode(() -> client.close()).doesNotThrowAnyException();
        }

        @Test
        void shouldTolerateRepeatedClose() {
            client.close();

            assertThatCode(() -> client.close()).doesNotThrowAnyException();
        }
    }

    private List<Received> posts() {
        return received.stream().filter(r -> "POST".equals(r.httpMethod())).toList();
    }

    private Received lastPost(String rpcMethod) {
        List<Received> matching =
                posts().stream().filter(r -> rpcMethod.equals(r.rpcMethod())).toList();
        assertThat(matching).isNotEmpty();
        return matching.get(matching.size() - 1);
    }

    // ———————————————— Fake server ————————————————

    private void handle(HttpExchange exchange) throws IOException {
        String session = exchange.getRequestHeaders().getFirst(SESSION_HEADER);

        if (!"POST".equals(exchange.getRequestMethod())) {
            received.add(new Received(exchange.getRequestMethod(), null, session, null));
            int status = "DELETE".equals(exchange.getRequestMethod()) ? 200 : 405;
            exchange.sendResponseHeaders(status, -1);
            exchange.close();
            return;
        }

        JsonNode body = mapper.readTree(exchange.getRequestBody().readAllBytes());
        String method = body.path("method").asText();
        received.add(new Received("POST", method, session, body));

        if (forcedStatus != 0) {
            exchange.sendResponseHeaders(forcedStatus, -1);
            exchange.close();
            return;
        }
        if (!body.has("id")) {
            exchange.sendResponseHeaders(202, -1);
            exchange.close();
            return;
        }

        JsonNode id = body.get("id");
        JsonNode params = body.path("params");
        switch (method) {
            case "initialize" -> {
                exchange.getResponseHeaders().set(SESSION_HEADER, SESSION);
                respondJson(
                        exchange,
                        result(
                                id,
                                Map.of(
                                        "protocolVersion", params.path("protocolVersion").asText(),
                                        "capabilities", Map.of("tools", Map.of()),
                                        "serverInfo", Map.of("name", "rag", "version", "1.0.0"))));
            }
            case "tools/list" -> {
                if (params.hasNonNull("cursor")) {
                    respondEventStream(
                            exchange,
                            result(
                                    id,
                                    Map.of(
                                            "tools",
                                            List.of(
                                                    Map.of(
                                                            "name", "fetch",
                                                            "description", "Fetch",
                                                            "inputSchema", Map.of("type", "object"))))));
                } else {
                    respondJson(
                            exchange,
                            result(
                                    id,
                                    Map.of(
                                            "tools",
                                            List.of(
                                                    Map.of(
                                                            "name", "search",
                                                            "description", "Search documents",
                                                            "inputSchema", Map.of("type", "object"))),
                                            "nextCursor",
                                            "page-2")));
                }
            }
            case "tools/call" -> respondJson(exchange, callResult(id, params));
            default -> respondJson(exchange, error(id, -32601, "Method not found"));
        }
    }

    private String callResult(JsonNode id, JsonNode params) throws IOException {
        String name = params.path("name").asText();
        if ("fail".equals(name)) {
            return result(
                    id,
                    Map.of("content", List.of(Map.of("type", "text", "text", "boom")), "isError", true));
        }
        if (!"search".equals(name)) {
            return error(id, -32602, "Unknown tool: " + name);
        }
        String query = params.path("arguments").path("query").asText();
        return result(
                id,
                Map.of(
                        "content",
                        List.of(Map.of("type", "text", "text", "echo: " + query)),
                        "isError",
                        false));
    }

    private String result(JsonNode id, Map<String, Object> result) throws IOException {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("jsonrpc", "2.0");
        message.put("id", id);
        message.put("result", result);
        return mapper.writeValueAsString(message);
    }

    private String error(JsonNode id, int code, String message) throws IOException {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("jsonrpc", "2.0");
        response.put("id", id);
        response.put("error", Map.of("code", code, "message", message));
        return mapper.writeValueAsString(response);
    }

    private static void respondJson(HttpExchange exchange, String json) throws IOException {
        respond(exchange, "application/json", json);
    }

    private static void respondEventStream(HttpExchange exchange, String json) throws IOException {
        respond(exchange, "text/event-stream", "event: message\ndata: " + json + "\n\n");
    }

    private static void respond(HttpExchange exchange, String contentType, String payload)
            throws IOException {
        byte[] bytes = payload.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", contentType);
        exchange.sendResponseHeaders(200, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private record Received(String httpMethod, String rpcMethod, String session, JsonNode body) {}
}
