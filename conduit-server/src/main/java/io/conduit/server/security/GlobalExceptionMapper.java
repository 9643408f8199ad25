package io.conduit.server.security;

import io.conduit.core.exception.ConfigurationException;
import io.conduit.core.exception.ConnectionException;
import io.conduit.core.exception.ToolNotFoundException;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import java.util.Map;
import org.jboss.logging.Logger;

/// Maps every exception escaping a resource to a JSON error body.
///
/// | Exception | Status |
/// |-----------|--------|
/// | {@link ToolNotFoundException} | 404 |
/// | {@link ConfigurationException}, {@link IllegalArgumentException} | 400 |
/// | {@link ConnectionException} | 503 |
/// | {@link WebApplicationException} | its own status |
/// | anything else | 500 |
///
/// ```json
/// {"error": "Tool 'rag:missing' not found", "status": 404}
/// ```
///
/// Stack traces stay in the server log. 5xx bodies carry a generic message.
@Provider
public class GlobalExceptionMapper implements ExceptionMapper<Throwable> {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMapper.class);

    @Override
    public Response toResponse(Throwable exception) {
        if (exception instanceof WebApplicationException wae) {
            int status = wae.getResponse().getStatus();
            return error(status, sanitize(status, wae.getMessage()), exception);
        }
        if (exception instanceof ToolNotFoundException) {
            return error(404, exception.getMessage(), exception);
        }
        if (exception instanceof ConfigurationException
                || exception instanceof IllegalArgumentException) {
            return error(400, orDefault(exception.getMessage(), "Bad request"), exception);
        }
        if (exception instanceof ConnectionException) {
            return error(503, "Tool server unavailable", exception);
        }
        return error(500, "Internal server error", exception);
    }

    private static Response error(int status, String message, Throwable exception) {
        if (status >= 500) {
            LOG.errorv(exception, "Server error {0}: {1}", status, exception.getMessage());
        } else {
            LOG.debugv("Client error {0}: {1}", status, message);
        }
        return Response.status(status)
                .type(MediaType.APPLICATION_JSON)
                .entity(Map.of("error", message, "status", status))
                .build();
    }

    private static String sanitize(int status, String raw) {
        return switch (status) {
            case 400 -> orDefault(raw, "Bad request");
            case 401 -> "Authentication required";
            case 403 -> "Access denied";
            case 404 -> orDefault(raw, "Resource not found");
            case 405 -> "Method not allowed";
            case 415 -> "Unsupported media type";
            default -> status >= 500 ? "Internal server error" : orDefault(raw, "Request failed");
        };
    }

    private static String orDefault(String value, String fallback) {
        return value != null && !value.isBlank() ? value : fallback;
    }
}
