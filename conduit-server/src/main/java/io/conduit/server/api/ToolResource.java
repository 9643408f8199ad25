package io.conduit.server.api;

import io.conduit.core.connection.ConnectionStatus;
import io.conduit.core.connection.ToolCallResponse;
import io.conduit.core.exception.ToolNotFoundException;
import io.conduit.core.tool.CallResult;
import io.conduit.core.tool.ToolDescriptor;
import io.conduit.core.tool.ToolOrchestrator;
import io.conduit.server.validation.LogSanitizer;
import io.conduit.server.validation.ValidToolName;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jboss.logging.Logger;

/// REST resource exposing the aggregated tool set of every connected server.
@Path("/api/v1/tools")
@Produces(MediaType.APPLICATION_JSON)
public class ToolResource {

    private static final Logger LOG = Logger.getLogger(ToolResource.class);

    private final ToolOrchestrator orchestrator;

    @Inject
    public ToolResource(ToolOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    /// Lists every available tool.
    ///
    /// ### Response (200 OK)
    /// ```json
    /// [{"namespacedName": "rag:search", "description": "...", "inputSchema": {...},
    ///   "serverName": "rag", "originalName": "search"}]
    /// ```
    ///
    /// @return tools ordered by namespaced name
    @GET
    public List<ToolDescriptor> listTools() {
        List<ToolDescriptor> tools = new ArrayList<>(orchestrator.getAllTools().values());
        tools.sort((a, b) -> a.namespacedName().compareTo(b.namespacedName()));
        return tools;
    }

    /// Calls a tool directly, outside any agent turn.
    ///
    /// ### Request
    /// ```
    /// POST /api/v1/tools/rag:search/call
    /// Content-Type: application/json
    ///
    /// {"query": "quarterly report"}
    /// ```
    ///
    /// ### Response (200 OK)
    /// ```json
    /// {"success": true, "text": "...", "content": [...], "executionTimeMs": 42}
    /// {"success": false, "error": "Server 'rag' is unavailable", "executionTimeMs": 5003}
    /// ```
    ///
    /// Tool failures are reported in the body; the HTTP status stays 200.
    ///
    /// @param toolName namespaced or bare tool name
    /// @param arguments tool arguments, may be absent
    /// @return call outcome
    /// @throws ToolNotFoundException if no connected server exposes the tool
    @POST
    @Path("/{toolName}/call")
    @Consumes(MediaType.APPLICATION_JSON)
    public Map<String, Object> callTool(
            @PathParam("toolName") @ValidToolName String toolName, Map<String, Object> arguments) {
        LOG.infov("Direct tool call: {0}", LogSanitizer.sanitize(toolName));
        if (!isKnown(toolName)) {
            throw new ToolNotFoundException(toolName);
        }
        CallResult<ToolCallResponse> result =
                orchestrator.callTool(toolName, arguments != null ? arguments : Map.of());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", result.success());
        if (result.success()) {
            ToolCallResponse response = result.data();
            body.put("text", response.textContent());
            body.put("content", response.content());
            if (response.structuredContent() != null) {
                body.put("structuredContent", response.structuredContent());
            }
        } else {
            body.put("error", result.error());
        }
        body.put("executionTimeMs", result.executionTimeMs());
        return body;
    }

    private boolean isKnown(String toolName) {
        Map<String, ToolDescriptor> tools = orchestrator.getAllTools();
        return tools.containsKey(toolName)
                || tools.values().stream().anyMatch(tool -> tool.originalName().equals(toolName));
    }

    /// Reports the status of every configured server.
    ///
    /// ### Response (200 OK)
    /// ```json
    /// {"rag": {"connected": true, "toolCount": 4, "lastCheck": "2025-01-01T10:00:00Z", "errorCount": 0},
    ///  "gmail": {"connected": false, "toolCount": 0, "lastCheck": null, "errorCount": 3}}
    /// ```
    ///
    /// @return status by server name, in configuration order
    @GET
    @Path("/status")
    public Map<String, ConnectionStatus> status() {
        return orchestrator.getStatus();
    }
}
