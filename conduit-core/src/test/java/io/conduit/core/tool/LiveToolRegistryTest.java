package io.conduit.core.tool;

import static org.assertj.core.api.Assertions.assertThat;

import io.conduit.core.connection.ConnectionManager;
import io.conduit.core.connection.ConnectionOrchestrator;
import io.conduit.core.connection.ConnectionTimeouts;
import io.conduit.core.connection.FakeToolServers;
import io.conduit.core.connection.RetryPolicy;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class LiveToolRegistryTest {

    private final FakeToolServers servers = new FakeToolServers();
    private ExecutorService executor;
    private ConnectionOrchestrator orchestrator;
    private LiveToolRegistry registry;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        ToolRouter router = new ToolRouter();
        ConnectionManager manager =
                new ConnectionManager(
                        servers, router, executor, ConnectionTimeouts.defaults(), Clock.systemUTC());
        orchestrator =
                new ConnectionOrchestrator(
                        manager,
                        router,
                        executor,
                        RetryPolicy.once(),
                        ConnectionOrchestrator.DEFAULT_HEALTH_CHECK_TTL,
                        Clock.systemUTC());
        registry = new LiveToolRegistry(orchestrator, router);

        servers.server("rag")
                .describedTool(
                        "search_documents",
                        "Search the knowledge base",
                        Map.of("type", "object", "required", List.of("query")));
        servers.server("gmail").tool("send_email").tool("list_messages");
        orchestrator.initializeAll(
                List.of(FakeToolServers.config("rag"), FakeToolServers.config("gmail")));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void shouldListToolsByNamespacedNameInServerOrder() {
        assertThat(registry.allTools().keySet())
                .containsExactly("rag:search_documents", "gmail:send_email", "gmail:list_messages");
    }

    @Test
    void shouldOmitToolsOfDisconnectedServers() {
        servers.server("gmail").down();
        orchestrator.healthCheckAll();

        assertThat(registry.allTools()).containsOnlyKeys("rag:search_documents");
    }

    @Test
    void shouldResolveNamespacedAndBareNames() {
        assertThat(registry.resolve("gmail:send_email")).isPresent();
        assertThat(registry.resolve("search_documents"))
                .get()
                .satisfies(c -> assertThat(c.serverName()).isEqualTo("rag"));
        assertThat(registry.resolve("rag:send_email")).isEmpty();
    }

    @Test
    void shouldDescribeTool() {
        ToolDescriptor descriptor = registry.describe("rag:search_documents").orElseThrow();

        assertThat(descriptor.description()).isEqualTo("Search the knowledge base");
        assertThat(descriptor.inputSchema()).containsEntry("required", List.of("query"));
        assertThat(registry.describe("unknown")).isEmpty();
    }

    @Test
    void shouldSeeReplacementConnections() {
        var before = registry.resolve("rag:search_documents").orElseThrow();
        servers.clients("rag").get(0).breakTransport();
        orchestrator.healthCheckAll();
        orchestrator.reconnectUnavailable();

        assertThat(registry.resolve("rag:search_documents")).get().isNotSameAs(before);
    }
}
