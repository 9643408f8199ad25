package io.conduit.core.connection;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.conduit.core.exception.ConnectionException;
import io.conduit.core.tool.ToolRouter;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ConnectionOrchestratorTest {

    private static final Instant START = Instant.parse("2026-01-01T00:00:00Z");

    private final FakeToolServers servers = new FakeToolServers();
    private final MutableClock clock = new MutableClock(START);
    private ExecutorService ioExecutor;
    private ExecutorService workExecutor;
    private ConnectionOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        ioExecutor = Executors.newCachedThreadPool();
        workExecutor = Executors.newCachedThreadPool();
        ToolRouter router = new ToolRouter();
        ConnectionManager manager =
                new ConnectionManager(
                        servers, router, ioExecutor, ConnectionTimeouts.defaults(), clock);
        orchestrator =
                new ConnectionOrchestrator(
                        manager,
                        router,
                        workExecutor,
                        RetryPolicy.once(),
                        ConnectionOrchestrator.DEFAULT_HEALTH_CHECK_TTL,
                        clock);
        servers.server("rag").tool("search");
        servers.server("gmail").tool("send");
    }

    @AfterEach
    void tearDown() {
        ioExecutor.shutdownNow();
        workExecutor.shutdownNow();
    }

    private static List<ServerConfig> ragAndGmail() {
        return List.of(FakeToolServers.config("rag"), FakeToolServers.config("gmail"));
    }

    @Nested
    class InitializeAll {

        @Test
        void shouldConnectEveryServer() {
            orchestrator.initializeAll(ragAndGmail());

            assertThat(orchestrator.connections()).containsOnlyKeys("rag", "gmail");
            assertThat(orchestrator.orderedConnections())
                    .extracting(Connection::serverName)
                    .containsExactly("rag", "gmail");
        }

        @Test
        void shouldIsolateFailingServer() {
            // Given
            servers.server("gmail").down();

            // When
            orchestrator.initializeAll(ragAndGmail());

            // Then
            assertThat(orchestrator.connections()).containsOnlyKeys("rag");
            Map<String, ConnectionStatus> status = orchestrator.getStatus();
            assertThat(status).containsOnlyKeys("rag", "gmail");
            assertThat(status.get("rag").connected()).isTrue();
            assertThat(status.get("rag").toolCount()).isEqualTo(1);
            assertThat(status.get("gmail").connected()).isFalse();
            assertThat(status.get("gmail").toolCount()).isZero();
            assertThat(status.get("gmail").errorCount()).isEqualTo(1);
        }

        @Test
        void shouldFailWhenNoServerConnects() {
            servers.server("rag").down();
            servers.server("gmail").down();

            assertThatThrownBy(() -> orchestrator.initializeAll(ragAndGmail()))
                    .isInstanceOf(ConnectionException.class)
                    .hasMessage("Failed to connect to any tool servers (2 attempted)");
        }

        @Test
        void shouldAcceptEmptyServerList() {
            orchestrator.initializeAll(List.of());

            assertThat(orchestrator.connections()).isEmpty();
            assertThat(orchestrator.getStatus()).isEmpty();
        }

        @Test
        void shouldCountInvalidConfigAsFailure() {
            List<ServerConfig> configs =
                    List.of(FakeToolServers.config("rag"), ServerConfig.of("broken", "", 3000));

            orchestrator.initializeAll(configs);

            assertThat(orchestrator.connections()).containsOnlyKeys("rag");
            assertThat(orchestrator.getStatus().get("broken").errorCount()).isEqualTo(1);
        }

        @Test
        void shouldSkipDuplicateServerNames() {
            List<ServerConfig> configs =
                    List.of(FakeToolServers.config("rag"), FakeToolServers.config("rag"));

            orchestrator.initializeAll(configs);

            assertThat(orchestrator.servers()).hasSize(1);
            assertThat(servers.server("rag").creates()).isEqualTo(1);
            assertThat(orchestrator.getStatus().get("rag").connected()).isTrue();
        }

        @Test
        void shouldCloseConnectionsFromPreviousInitialization() {
            orchestrator.initializeAll(ragAndGmail());
            Connection previous = orchestrator.connection("rag").orElseThrow();

            orchestrator.initializeAll(List.of(FakeToolServers.config("rag")));

            assertThat(previous.isConnected()).isFalse();
            assertThat(orchestrator.connections()).containsOnlyKeys("rag");
            assertThat(orchestrator.connection("rag").orElseThrow()).isNotSameAs(previous);
        }
    }

    @Nested
    class EnsureHealthy {

        @Test
        void shouldReturnFalseForNull() {
            assertThat(orchestrator.ensureHealthy(null)).isFalse();
        }

        @Test
        void shouldTrustRecentHealthCheck() {
            orchestrator.initializeAll(ragAndGmail());
            Connection rag = orchestrator.connection("rag").orElseThrow();
            int listings = servers.server("rag").listings();
            clock.advance(Duration.ofSeconds(2));

            assertThat(orchestrator.ensureHealthy(rag)).isTrue();
            assertThat(servers.server("rag").listings()).isEqualTo(listings);
        }

        @Test
        void shouldCheckAgainAfterTrustWindow() {
            orchestrator.initializeAll(ragAndGmail());
            Connection rag = orchestrator.connection("rag").orElseThrow();
            int listings = servers.server("rag").listings();
            clock.advance(Duration.ofSeconds(6));

            assertThat(orchestrator.ensureHealthy(rag)).isTrue();
            assertThat(servers.server("rag").listings()).isEqualTo(listings + 1);
            assertThat(rag.lastHealthCheckAt()).isEqualTo(START.plusSeconds(6));
        }

        @Test
        void shouldReplaceStaleConnection() {
            // Given
            orchestrator.initializeAll(ragAndGmail());
            Connection stale = orchestrator.connection("rag").orElseThrow();
            servers.clients("rag").get(0).breakTransport();
            clock.advance(Duration.ofSeconds(6));

            // When
            boolean healthy = orchestrator.ensureHealthy(stale);

            // Then
            assertThat(healthy).isTrue();
            Connection fresh = orchestrator.connection("rag").orElseThrow();
            assertThat(fresh).isNotSameAs(stale);
            assertThat(fresh.isConnected()).isTrue();
            assertThat(stale.isConnected()).isFalse();
            assertThat(servers.clients("rag").get(0).isClosed()).isTrue();
            assertThat(servers.server("rag").creates()).isEqualTo(2);
        }

        @Test
        void shouldReportFailedReconnect() {
            orchestrator.initializeAll(ragAndGmail());
            Connection stale = orchestrator.connection("rag").orElseThrow();
            servers.server("rag").down();
            clock.advance(Duration.ofSeconds(6));

            assertThat(orchestrator.ensureHealthy(stale)).isFalse();
            assertThat(orchestrator.getStatus().get("rag").connected()).isFalse();
            assertThat(orchestrator.getStatus().get("rag").errorCount()).isEqualTo(1);
        }

        @Test
        void shouldCoalesceConcurrentReconnects() throws Exception {
            // Given
            orchestrator.initializeAll(ragAndGmail());
            Connection stale = orchestrator.connection("rag").orElseThrow();
            servers.clients("rag").get(0).breakTransport();
            servers.server("rag").latency(50);
            clock.advance(Duration.ofSeconds(6));

            int callers = 8;
            ExecutorService pool = Executors.newFixedThreadPool(callers);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<Boolean>> results = new ArrayList<>();
            try {
                for (int i = 0; i < callers; i++) {
                    results.add(
                            pool.submit(
                                    () -> {
                                        start.await();
                                        return orchestrator.ensureHealthy(stale);
                                    }));
                }

                // When
                start.countDown();

                // Then
                for (Future<Boolean> result : results) {
                    assertThat(result.get()).isTrue();
                }
            } finally {
                pool.shutdownNow();
            }
            assertThat(servers.server("rag").creates()).isEqualTo(2);
        }
    }

    @Nested
    class Maintenance {

        @Test
        void shouldMarkUnhealthyConnectionsDisconnected() {
            orchestrator.initializeAll(ragAndGmail());
            servers.server("gmail").down();

            orchestrator.healthCheckAll();

            assertThat(orchestrator.getStatus().get("rag").connected()).isTrue();
            assertThat(orchestrator.getStatus().get("gmail").connected()).isFalse();
        }

        @Test
        void shouldReconnectServerThatRecovered() {
            // Given
            servers.server("gmail").down();
            orchestrator.initializeAll(ragAndGmail());
            servers.server("gmail").up();

            // When
            orchestrator.reconnectUnavailable();

            // Then
            assertThat(orchestrator.connections()).containsOnlyKeys("rag", "gmail");
            assertThat(orchestrator.getStatus().get("gmail").connected()).isTrue();
            assertThat(servers.server("rag").creates()).isEqualTo(1);
        }

        @Test
        void shouldKeepCountingFailuresWhileServerStaysDown() {
            servers.server("gmail").down();
            orchestrator.initializeAll(ragAndGmail());

            orchestrator.reconnectUnavailable();

            assertThat(orchestrator.connections()).doesNotContainKey("gmail");
            assertThat(orchestrator.getStatus().get("gmail").errorCount()).isEqualTo(2);
        }

        @Test
        void shouldRecoverAfterHealthCheckFailure() {
            orchestrator.initializeAll(ragAndGmail());
            servers.clients("gmail").get(0).breakTransport();

            orchestrator.healthCheckAll();
            orchestrator.reconnectUnavailable();

            assertThat(orchestrator.getStatus().get("gmail").connected()).isTrue();
            assertThat(servers.server("gmail").creates()).isEqualTo(2);
        }

        @Test
        void shouldDisconnectEverything() {
            orchestrator.initializeAll(ragAndGmail());

            orchestrator.disconnectAll();

            assertThat(orchestrator.connections()).isEmpty();
            assertThat(servers.clients("rag")).allMatch(FakeToolServers.FakeClient::isClosed);
            assertThat(servers.clients("gmail")).allMatch(FakeToolServers.FakeClient::isClosed);
        }
    }
}
