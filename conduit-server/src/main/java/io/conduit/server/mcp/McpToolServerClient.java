package io.conduit.server.mcp;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.conduit.core.connection.RemoteTool;
import io.conduit.core.connection.ServerConfig;
import io.conduit.core.connection.ToolCallResponse;
import io.conduit.core.connection.ToolServerClient;
import io.conduit.core.exception.ConnectionException;
import io.conduit.core.exception.ToolExecutionException;
import io.modelcontextprotocol.client.McpSyncClient;
import io.modelcontextprotocol.spec.McpError;
import io.modelcontextprotocol.spec.McpSchema;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import org.jboss.logging.Logger;

/// {@link ToolServerClient} backed by the MCP Java SDK's synchronous client.
///
/// The SDK owns the streamable HTTP transport: handshake, `Mcp-Session-Id`
/// tracking, event-stream responses and session release on close. This class
/// adapts its schema types to the core's records through Jackson.
///
/// ### Error mapping
/// - a JSON-RPC error answering `tools/call` becomes {@link ToolExecutionException}
/// - every other failure becomes {@link ConnectionException}
///
/// @implNote Thread-safe after {@link #initialize()}.
///
/// @see McpToolServerClientFactory
public class McpToolServerClient implements ToolServerClient {

    private static final Logger LOG = Logger.getLogger(McpToolServerClient.class);

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE =
            new TypeReference<>() {};

    private final ServerConfig config;
    private final McpSyncClient client;
    private final ObjectMapper mapper;

    private volatile boolean closed;

    public McpToolServerClient(ServerConfig config, McpSyncClient client, ObjectMapper mapper) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    @Override
    public void initialize() {
        McpSchema.InitializeResult result = send("initialize", client::initialize);
        LOG.debugv(
                "Server {0} accepted handshake with protocol {1}",
                config.name(),
                result.protocolVersion());
    }

    @Override
    public List<RemoteTool> listTools() {
        List<RemoteTool> tools = new ArrayList<>();
        String cursor = null;
        do {
            String page = cursor;
            McpSchema.ListToolsResult result = send("tools/list", () -> client.listTools(page));
            if (result.tools() != null) {
                for (McpSchema.Tool tool : result.tools()) {
                    tools.add(
                            new RemoteTool(
                                    tool.name(),
                                    tool.description(),
                                    tool.inputSchema() != null
                                            ? mapper.convertValue(tool.inputSchema(), MAP_TYPE)
                                            : null));
                }
            }
            String next = result.nextCursor();
            cursor = next != null && !next.isEmpty() ? next : null;
        } while (cursor != null);
        return tools;
    }

    @Override
    public ToolCallResponse callTool(String toolName, Map<String, Object> arguments) {
        McpSchema.CallToolRequest request =
                new McpSchema.CallToolRequest(toolName, arguments != null ? arguments : Map.of());

        McpSchema.CallToolResult result;
        try {
            result = send("tools/call", () -> client.callTool(request));
        } catch (ConnectionException e) {
            if (e.getCause() instanceof McpError rpc && rpc.getJsonRpcError() != null) {
                throw new ToolExecutionException(toolName, rpc.getMessage(), rpc);
            }
            throw e;
        }

        Map<String, Object> body = mapper.convertValue(result, MAP_TYPE);
        List<Map<String, Object>> content = new ArrayList<>();
        if (body.get("content") instanceof List<?> blocks) {
            for (Object block : blocks) {
                content.add(mapper.convertValue(block, MAP_TYPE));
            }
        }
        Map<String, Object> structured =
                body.get("structuredContent") != null
                        ? mapper.convertValue(body.get("structuredContent"), MAP_TYPE)
                        : null;
        return new ToolCallResponse(content, structured, Boolean.TRUE.equals(body.get("isError")));
    }

    /// Releases the server session. Never throws.
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            client.closeGracefully();
        } catch (RuntimeException e) {
            LOG.debugv("Ignoring close failure for server {0}: {1}", config.name(), e);
        }
    }

    private <T> T send(String method, Supplier<T> call) {
        if (closed) {
            throw new ConnectionException(
                    config.name(), "Client for server '" + config.name() + "' is closed");
        }
        try {
            return call.get();
        } catch (RuntimeException e) {
            throw new ConnectionException(
                    config.name(),
                    "Request '" + method + "' to server '" + config.name() + "' failed: "
                            + e.getMessage(),
                    e);
        }
    }
}
