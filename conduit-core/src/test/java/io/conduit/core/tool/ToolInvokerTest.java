package io.conduit.core.tool;

import static org.assertj.core.api.Assertions.assertThat;

import io.conduit.core.connection.ConnectionManager;
import io.conduit.core.connection.ConnectionOrchestrator;
import io.conduit.core.connection.ConnectionTimeouts;
import io.conduit.core.connection.FakeToolServers;
import io.conduit.core.connection.MutableClock;
import io.conduit.core.connection.RetryPolicy;
import io.conduit.core.connection.ToolCallResponse;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ToolInvokerTest {

    private final FakeToolServers servers = new FakeToolServers();
    private final MutableClock clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
    private ExecutorService ioExecutor;
    private ExecutorService workExecutor;
    private ConnectionOrchestrator orchestrator;
    private ToolInvoker invoker;

    @BeforeEach
    void setUp() {
        ioExecutor = Executors.newCachedThreadPool();
        workExecutor = Executors.newCachedThreadPool();
        ToolRouter router = new ToolRouter();
        ConnectionTimeouts timeouts =
                new ConnectionTimeouts(
                        Duration.ofSeconds(5), Duration.ofSeconds(5), Duration.ofMillis(300));
        ConnectionManager manager =
                new ConnectionManager(servers, router, ioExecutor, timeouts, clock);
        orchestrator =
                new ConnectionOrchestrator(
                        manager,
                        router,
                        workExecutor,
                        RetryPolicy.once(),
                        ConnectionOrchestrator.DEFAULT_HEALTH_CHECK_TTL,
                        clock);
        invoker = new ToolInvoker(new LiveToolRegistry(orchestrator, router), orchestrator, manager, router);

        servers.server("rag")
                .tool("search", args -> ToolCallResponse.text("results for " + args.get("query")))
                .tool("quota", args -> ToolCallResponse.error("quota exceeded"))
                .tool(
                        "crash",
                        args -> {
                            throw new IllegalStateException("index corrupted");
                        });
        servers.server("gmail").tool("send");
        orchestrator.initializeAll(
                List.of(FakeToolServers.config("rag"), FakeToolServers.config("gmail")));
    }

    @AfterEach
    void tearDown() {
        ioExecutor.shutdownNow();
        workExecutor.shutdownNow();
    }

    @Nested
    class Success {

        @Test
        void shouldCallToolByNamespacedName() {
            CallResult<ToolCallResponse> result =
                    invoker.invoke("rag:search", Map.of("query", "conduit"));

            assertThat(result.success()).isTrue();
            assertThat(result.error()).isNull();
            assertThat(result.executionTimeMs()).isNotNegative();
            assertThat(result.data().textContent()).isEqualTo("results for conduit");
            assertThat(servers.server("rag").calls())
                    .singleElement()
                    .satisfies(call -> assertThat(call.toolName()).isEqualTo("search"));
        }

        @Test
        void shouldResolveBareName() {
            CallResult<ToolCallResponse> result = invoker.invoke("send", Map.of());

            assertThat(result.success()).isTrue();
            assertThat(servers.server("gmail").calls()).hasSize(1);
        }

        @Test
        void shouldTreatNullArgumentsAsEmpty() {
            invoker.invoke("rag:search", null);

            assertThat(servers.server("rag").calls())
                    .singleElement()
                    .satisfies(call -> assertThat(call.arguments()).isEmpty());
        }
    }

    @Nested
    class Failure {

        @Test
        void shouldReportUnknownTool() {
            CallResult<ToolCallResponse> result = invoker.invoke("rag:missing", Map.of());

            assertThat(result.success()).isFalse();
            assertThat(result.data()).isNull();
            assertThat(result.error()).isEqualTo("Tool 'rag:missing' not found");
        }

        @Test
        void shouldReportRemoteToolError() {
            CallResult<ToolCallResponse> result = invoker.invoke("rag:quota", Map.of());

            assertThat(result.success()).isFalse();
            assertThat(result.error()).isEqualTo("quota exceeded");
        }

        @Test
        void shouldReportTransportFailure() {
            CallResult<ToolCallResponse> result = invoker.invoke("rag:crash", Map.of());

            assertThat(result.success()).isFalse();
            assertThat(result.error()).isEqualTo("Tool 'rag:crash' failed: index corrupted");
        }

        @Test
        void shouldReportTimeout() {
            servers.server("rag").latency(1_000);

            CallResult<ToolCallResponse> result = invoker.invoke("rag:search", Map.of());

            assertThat(result.success()).isFalse();
            assertThat(result.error()).contains("timed out after 300ms");
        }

        @Test
        void shouldReportUnavailableServer() {
            servers.server("rag").down();
            clock.advance(Duration.ofSeconds(10));

            CallResult<ToolCallResponse> result = invoker.invoke("rag:search", Map.of());

            assertThat(result.success()).isFalse();
            assertThat(result.error()).isEqualTo("Connection to rag unavailable");
        }
    }

    @Nested
    class StaleConnection {

        @Test
        void shouldReconnectOnceAndCallNewTransport() {
            // Given
            servers.clients("rag").get(0).breakTransport();
            clock.advance(Duration.ofSeconds(10));

            // When
            CallResult<ToolCallResponse> result =
                    invoker.invoke("rag:search", Map.of("query", "after reconnect"));

            // Then
            assertThat(result.success()).isTrue();
            assertThat(servers.server("rag").creates()).isEqualTo(2);
            FakeToolServers.FakeClient fresh = servers.clients("rag").get(1);
            assertThat(servers.server("rag").calls())
                    .singleElement()
                    .satisfies(call -> assertThat(call.client()).isSameAs(fresh));
        }

        @Test
        void shouldSkipHealthCheckWithinTrustWindow() {
            int listings = servers.server("rag").listings();

            invoker.invoke("rag:search", Map.of());
            invoker.invoke("rag:search", Map.of());

            assertThat(servers.server("rag").listings()).isEqualTo(listings);
        }
    }
}
