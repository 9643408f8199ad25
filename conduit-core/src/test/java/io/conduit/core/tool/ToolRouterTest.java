package io.conduit.core.tool;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.conduit.core.connection.Connection;
import io.conduit.core.connection.ConnectionManager;
import io.conduit.core.connection.ConnectionTimeouts;
import io.conduit.core.connection.FakeToolServers;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ToolRouterTest {

    private final ToolRouter router = new ToolRouter();

    @Nested
    class Parse {

        @Test
        void shouldSplitOnFirstSeparator() {
            assertThat(router.parse("rag:search"))
                    .contains(new QualifiedToolName("rag", "search"));
            assertThat(router.parse("rag:ns:search"))
                    .contains(new QualifiedToolName("rag", "ns:search"));
        }

        @Test
        void shouldTrimBothHalves() {
            assertThat(router.parse(" rag : search "))
                    .contains(new QualifiedToolName("rag", "search"));
        }

        @Test
        void shouldTreatBareOrHalfEmptyNamesAsUnqualified() {
            assertThat(router.parse("search")).isEmpty();
            assertThat(router.parse(":search")).isEmpty();
            assertThat(router.parse("rag:")).isEmpty();
            assertThat(router.parse(null)).isEmpty();
        }

        @Test
        void shouldMemoizeUntilCleared() {
            router.parse("rag:search");
            router.parse("rag:search");

            assertThat(router.cacheSize()).isEqualTo(1);

            router.clearCache();

            assertThat(router.cacheSize()).isZero();
            assertThat(router.parse("rag:search")).isPresent();
        }
    }

    @Nested
    class Format {

        @Test
        void shouldJoinWithSeparator() {
            assertThat(router.format("rag", "search")).isEqualTo("rag:search");
        }

        @Test
        void shouldRejectServerNameWithSeparator() {
            assertThatThrownBy(() -> router.format("a:b", "search"))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void shouldRoundTripThroughParse() {
            String formatted = router.format("gmail", "send_email");

            assertThat(router.parse(formatted))
                    .contains(new QualifiedToolName("gmail", "send_email"));
            assertThat(new QualifiedToolName("gmail", "send_email")).hasToString(formatted);
        }
    }

    @Nested
    class Validation {

        @Test
        void shouldAcceptBareAndNamespacedNames() {
            assertThat(router.isValidToolName("search-docs")).isTrue();
            assertThat(router.isValidToolName("rag:search_docs")).isTrue();
        }

        @Test
        void shouldRejectMalformedNames() {
            assertThat(router.isValidToolName(null)).isFalse();
            assertThat(router.isValidToolName("")).isFalse();
            assertThat(router.isValidToolName("rag:")).isFalse();
            assertThat(router.isValidToolName("search docs")).isFalse();
            assertThat(router.isValidToolName("a:b:c")).isFalse();
        }

        @Test
        void shouldStripServerFromNamespacedName() {
            assertThat(router.originalName("rag:search")).isEqualTo("search");
            assertThat(router.originalName("search")).isEqualTo("search");
        }
    }

    @Nested
    class FindOwningConnection {

        private final FakeToolServers servers = new FakeToolServers();
        private ExecutorService executor;
        private Map<String, Connection> connections;
        private ConnectionManager manager;

        @BeforeEach
        void setUp() {
            executor = Executors.newCachedThreadPool();
            manager =
                    new ConnectionManager(
                            servers,
                            router,
                            executor,
                            ConnectionTimeouts.defaults(),
                            Clock.systemUTC());
            servers.server("rag").tool("search").tool("ingest");
            servers.server("web").tool("search").tool("fetch");
            connections = new LinkedHashMap<>();
            connections.put("rag", manager.open(FakeToolServers.config("rag")));
            connections.put("web", manager.open(FakeToolServers.config("web")));
        }

        @AfterEach
        void tearDown() {
            executor.shutdownNow();
        }

        @Test
        void shouldRouteNamespacedNameToItsServer() {
            assertThat(router.findOwningConnection("web:search", connections))
                    .get()
                    .extracting(Connection::serverName)
                    .isEqualTo("web");
        }

        @Test
        void shouldNotFallBackWhenNamespacedServerLacksTool() {
            assertThat(router.findOwningConnection("web:ingest", connections)).isEmpty();
            assertThat(router.findOwningConnection("mail:search", connections)).isEmpty();
        }

        @Test
        void shouldScanConnectedServersForBareName() {
            assertThat(router.findOwningConnection("search", connections))
                    .get()
                    .extracting(Connection::serverName)
                    .isEqualTo("rag");
            assertThat(router.findOwningConnection("fetch", connections))
                    .get()
                    .extracting(Connection::serverName)
                    .isEqualTo("web");
        }

        @Test
        void shouldSkipDisconnectedServers() {
            manager.close(connections.get("rag"));

            assertThat(router.findOwningConnection("rag:search", connections)).isEmpty();
            assertThat(router.findOwningConnection("search", connections))
                    .get()
                    .extracting(Connection::serverName)
                    .isEqualTo("web");
        }

        @Test
        void shouldReturnEmptyForUnknownTool() {
            assertThat(router.findOwningConnection("nope", connections)).isEmpty();
            assertThat(router.findOwningConnection(null, connections)).isEmpty();
        }
    }
}
