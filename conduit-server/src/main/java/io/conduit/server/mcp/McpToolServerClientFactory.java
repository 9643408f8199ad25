package io.conduit.server.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.conduit.core.connection.ServerConfig;
import io.conduit.core.connection.ToolServerClient;
import io.conduit.core.connection.ToolServerClientFactory;
import io.modelcontextprotocol.client.McpClient;
import io.modelcontextprotocol.client.McpSyncClient;
import io.modelcontextprotocol.client.transport.HttpClientStreamableHttpTransport;
import io.modelcontextprotocol.spec.McpSchema;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import org.eclipse.microprofile.config.inject.ConfigProperty;

/// Creates {@link McpToolServerClient} instances over the SDK's streamable HTTP transport.
///
/// The client identifies itself as `conduit-<server>-client` / {@value #CLIENT_VERSION}.
///
/// ### Configuration Properties
/// | Property | Default | Description |
/// |----------|---------|-------------|
/// | `conduit.mcp.connect-timeout` | `10s` | TCP connect and handshake timeout |
/// | `conduit.mcp.tool-timeout` | `120s` | Upper bound of a single request |
@ApplicationScoped
public class McpToolServerClientFactory implements ToolServerClientFactory {

    public static final String CLIENT_VERSION = "1.0.0";

    private final ObjectMapper mapper;
    private final Duration connectTimeout;
    private final Duration requestTimeout;

    @Inject
    public McpToolServerClientFactory(
            ObjectMapper mapper,
            @ConfigProperty(name = "conduit.mcp.connect-timeout", defaultValue = "10s")
                    Duration connectTimeout,
            @ConfigProperty(name = "conduit.mcp.tool-timeout", defaultValue = "120s")
                    Duration requestTimeout) {
        this.mapper = mapper;
        this.connectTimeout = connectTimeout;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public ToolServerClient create(ServerConfig config) {
        URI target = config.targetUri();
        HttpClientStreamableHttpTransport transport =
                HttpClientStreamableHttpTransport.builder(
                                target.getScheme() + "://" + target.getRawAuthority())
                        .endpoint(target.getRawPath())
                        .clientBuilder(
                                HttpClient.newBuilder()
                                        .version(HttpClient.Version.HTTP_1_1)
                                        .connectTimeout(connectTimeout))
                        .build();

        McpSyncClient client =
                McpClient.sync(transport)
                        .clientInfo(
                                new McpSchema.Implementation(
                                        clientName(config.name()), CLIENT_VERSION))
                        .initializationTimeout(connectTimeout)
                        .requestTimeout(requestTimeout)
                        .build();
        return new McpToolServerClient(config, client, mapper);
    }

    static String clientName(String serverName) {
        return "conduit-" + serverName + "-client";
    }
}
