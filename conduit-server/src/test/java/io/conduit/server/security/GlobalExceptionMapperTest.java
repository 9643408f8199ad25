package io.conduit.server.security;

import static org.assertj.core.api.Assertions.assertThat;

import io.conduit.core.exception.ConfigurationException;
import io.conduit.core.exception.ConnectionException;
import io.conduit.core.exception.ToolNotFoundException;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Response;
import java.util.Map;
import org.junit.jupiter.api.Test;

class GlobalExceptionMapperTest {

    private final GlobalExceptionMapper mapper = new GlobalExceptionMapper();

    @Test
    void shouldMapUnknownToolTo404() {
        Response response = mapper.toResponse(new ToolNotFoundException("rag:missing"));

        assertThat(response.getStatus()).isEqualTo(404);
        assertThat(response.getEntity())
                .isEqualTo(Map.of("error", "Tool 'rag:missing' not found", "status", 404));
    }

    @Test
    void shouldMapConfigurationErrorTo400() {
        Response response =
                mapper.toResponse(new ConfigurationException("url", "Server URL is required"));

        assertThat(response.getStatus()).isEqualTo(400);
        assertThat(body(response)).containsEntry("error", "Server URL is required");
    }

    @Test
    void shouldMapIllegalArgumentTo400() {
        Response response =
                mapper.toResponse(new IllegalArgumentException("Unknown processor type: x"));

        assertThat(response.getStatus()).isEqualTo(400);
    }

    @Test
    void shouldMapConnectionFailureTo503WithoutDetails() {
        Response response =
                mapper.toResponse(new ConnectionException("rag", "connect to 10.0.0.7 refused"));

        assertThat(response.getStatus()).isEqualTo(503);
        assertThat(body(response)).containsEntry("error", "Tool server unavailable");
    }

    @Test
    void shouldKeepStatusOfWebApplicationException() {
        Response response = mapper.toResponse(new NotFoundException("Session not found: s-1"));

        assertThat(response.getStatus()).isEqualTo(404);
        assertThat(body(response)).containsEntry("error", "Session not found: s-1");
    }

    @Test
    void shouldHideServerErrorDetails() {
        Response response =
                mapper.toResponse(new WebApplicationException("db password leaked", 502));

        assertThat(body(response)).containsEntry("error", "Internal server error");
    }

    @Test
    void shouldMapAnythingElseTo500() {
        Response response = mapper.toResponse(new NullPointerException("secret"));

        assertThat(response.getStatus()).isEqualTo(500);
        assertThat(body(response)).containsEntry("error", "Internal server error");
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> body(Response response) {
        return (Map<String, Object>) response.getEntity();
    }
}
