package io.conduit.server.api;

import io.conduit.core.agent.AgentConfig;
import io.conduit.core.agent.StreamResponse;
import io.conduit.server.agent.AgentSessionManager;
import io.conduit.server.validation.LogSanitizer;
import io.conduit.server.validation.ValidId;
import io.conduit.server.validation.ValidMessage;
import io.smallrye.mutiny.Multi;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.Map;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.RestStreamElementType;

/// REST resource for agent chat sessions.
///
/// Messages are answered with a Server-Sent Events stream of
/// {@link StreamResponse} JSON objects:
///
/// ```
/// data: {"type":"reasoning","text":"I should search the knowledge base"}
///
/// data: {"type":"tool_call","toolCallId":"call_001","toolName":"rag:search","arguments":{"query":"..."},"status":"started"}
///
/// data: {"type":"tool_call","toolCallId":"call_001","toolName":"rag:search","arguments":{"query":"..."},"status":"completed","result":"..."}
///
/// data: {"type":"content","text":"Here is what I found..."}
///
/// data: {"type":"done"}
/// ```
///
/// Every stream ends with exactly one `done` or `error` event. Closing the
/// connection cancels the turn.
///
/// @see AgentSessionManager for session handling
@Path("/api/v1/sessions")
public class AgentResource {

    private static final Logger LOG = Logger.getLogger(AgentResource.class);

    private final AgentSessionManager sessions;

    @Inject
    public AgentResource(AgentSessionManager sessions) {
        this.sessions = sessions;
    }

    /// Sends a message and streams the agent's turn.
    ///
    /// ### Request
    /// ```
    /// POST /api/v1/sessions/{sessionId}/chat
    /// Content-Type: application/json
    /// Accept: text/event-stream
    ///
    /// {"message": "What did Alice email me about?"}
    /// ```
    ///
    /// @param sessionId the session, created on first use
    /// @param request the message
    /// @return SSE event stream
    @POST
    @Path("/{sessionId}/chat")
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.SERVER_SENT_EVENTS)
    @RestStreamElementType(MediaType.APPLICATION_JSON)
    public Multi<StreamResponse> chat(
            @PathParam("sessionId") @ValidId String sessionId,
            @Valid @NotNull ChatRequest request) {
        String safeSession = LogSanitizer.sanitize(sessionId);
        LOG.infov("Chat request: session={0}", safeSession);

        return sessions.chat(sessionId, request.message())
                .onTermination()
                .invoke(
                        (t, cancelled) -> {
                            if (t != null) {
                                LOG.warnv(t, "Chat stream failed for session: {0}", safeSession);
                            } else if (cancelled) {
                                LOG.infov("Chat stream cancelled by client: {0}", safeSession);
                            } else {
                                LOG.debugv("Chat stream completed for session: {0}", safeSession);
                            }
                        });
    }

    /// Clears a session's conversation history.
    ///
    /// @param sessionId the session
    /// @return `{"status": "reset"}`
    /// @throws NotFoundException if the session does not exist
    @POST
    @Path("/{sessionId}/reset")
    @Produces(MediaType.APPLICATION_JSON)
    public Response reset(@PathParam("sessionId") @ValidId String sessionId) {
        if (!sessions.reset(sessionId)) {
            throw new NotFoundException("Session not found: " + sessionId);
        }
        return Response.ok(Map.of("status", "reset")).build();
    }

    /// Sets the model auth token used by a session.
    ///
    /// ### Request
    /// ```
    /// PUT /api/v1/sessions/{sessionId}/auth-token
    /// Content-Type: application/json
    ///
    /// {"authToken": "sk-..."}
    /// ```
    ///
    /// A null or missing token reverts to the server's provider credentials.
    ///
    /// @param sessionId the session, created on first use
    /// @param request the token
    /// @return `{"status": "updated"}`
    @PUT
    @Path("/{sessionId}/auth-token")
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    public Response updateAuthToken(
            @PathParam("sessionId") @ValidId String sessionId, @NotNull AuthTokenRequest request) {
        sessions.updateAuthToken(sessionId, request.authToken());
        return Response.ok(Map.of("status", "updated")).build();
    }

    /// Replaces the agent configuration of a session.
    ///
    /// ### Request
    /// ```
    /// PUT /api/v1/sessions/{sessionId}/config
    /// Content-Type: application/json
    ///
    /// {"model": "claude-sonnet-4", "processorType": "coact", "maxIterations": 6}
    /// ```
    ///
    /// @param sessionId the session, created on first use
    /// @param config the new configuration
    /// @return `{"status": "updated"}`
    @PUT
    @Path("/{sessionId}/config")
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    public Response updateConfig(
            @PathParam("sessionId") @ValidId String sessionId, @NotNull AgentConfig config) {
        sessions.updateConfig(sessionId, config);
        return Response.ok(Map.of("status", "updated")).build();
    }

    /// Deletes a session.
    ///
    /// @param sessionId the session
    /// @return 204 No Content
    /// @throws NotFoundException if the session does not exist
    @DELETE
    @Path("/{sessionId}")
    public Response delete(@PathParam("sessionId") @ValidId String sessionId) {
        if (!sessions.remove(sessionId)) {
            throw new NotFoundException("Session not found: " + sessionId);
        }
        return Response.noContent().build();
    }

    /// Chat request body.
    ///
    /// @param message the user's message
    public record ChatRequest(@ValidMessage String message) {}

    /// Auth token request body.
    ///
    /// @param authToken the token, may be null
    public record AuthTokenRequest(String authToken) {}
}
