package io.conduit.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.conduit.core.agent.AgentConfig;
import io.conduit.core.agent.AgentRuntime;
import io.conduit.core.agent.StreamResponse;
import io.conduit.core.agent.stub.StubModelProvider;
import io.conduit.core.connection.FakeToolServers;
import io.conduit.core.connection.ServerConfig;
import io.conduit.core.connection.ToolCallResponse;
import io.conduit.core.tool.CallResult;
import io.conduit.core.util.ObjectMapperCodec;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ConduitFactory")
class ConduitFactoryTest {

    private final FakeToolServers servers = new FakeToolServers();
    private final ObjectMapperCodec codec = new ObjectMapperCodec();
    private ConduitEnvironment environment;

    @AfterEach
    void tearDown() {
        if (environment != null) {
            environment.close();
        }
        System.clearProperty(StubModelProvider.ENABLED_PROPERTY);
    }

    @Nested
    @DisplayName("builder")
    class Builder {

        @Test
        @DisplayName("requires a client factory")
        void shouldRequireClientFactory() {
            assertThatThrownBy(() -> ConduitFactory.builder().build())
                    .isInstanceOf(NullPointerException.class)
                    .hasMessageContaining("clientFactory");
        }

        @Test
        @DisplayName("requires a JSON codec")
        void shouldRequireJsonCodec() {
            assertThatThrownBy(() -> ConduitFactory.builder().clientFactory(servers).build())
                    .isInstanceOf(NullPointerException.class)
                    .hasMessageContaining("jsonCodec");
        }

        @Test
        @DisplayName("wires a working tool stack")
        void shouldWireToolStack() {
            servers.server("rag").tool("search", args -> ToolCallResponse.text("hit"));
            environment = ConduitFactory.builder().clientFactory(servers).jsonCodec(codec).build();

            environment.getToolOrchestrator().initialize(List.of(FakeToolServers.config("rag")));
            CallResult<ToolCallResponse> result =
                    environment.getToolOrchestrator().callTool("rag:search", Map.of());

            assertThat(result.success()).isTrue();
            assertThat(environment.getToolOrchestrator().getAllTools()).containsOnlyKeys("rag:search");
            assertThat(environment.getToolOrchestrator().getStatus().get("rag").connected()).isTrue();
        }

        @Test
        @DisplayName("runs an agent turn end to end in stub mode")
        void shouldRunAgentTurnInStubMode() {
            servers.server("rag").tool("search");
            environment =
                    ConduitFactory.builder()
                            .clientFactory(servers)
                            .jsonCodec(codec)
                            .stubMode(true)
                            .build();
            environment.getToolOrchestrator().initialize(List.of(FakeToolServers.config("rag")));

            AgentRuntime runtime =
                    environment.createRuntime(AgentConfig.builder().model("claude-sonnet-4").build());
            List<StreamResponse> events = runtime.chat("hello");

            assertThat(events)
                    .contains(new StreamResponse.Content("[STUB] hello"))
                    .last()
                    .isEqualTo(new StreamResponse.Done());
        }

        @Test
        @DisplayName("disconnects servers on close")
        void shouldDisconnectOnClose() {
            servers.server("rag").tool("search");
            environment = ConduitFactory.builder().clientFactory(servers).jsonCodec(codec).build();
            environment.getToolOrchestrator().initialize(List.of(FakeToolServers.config("rag")));

            environment.close();

            assertThat(servers.clients("rag")).allMatch(FakeToolServers.FakeClient::isClosed);
            assertThat(environment.getConnectionOrchestrator().connections()).isEmpty();
            environment = null;
        }

        @Test
        @DisplayName("applies configured history window")
        void shouldApplyConfig() {
            ConduitConfig config = ConduitConfig.builder().historyWindow(2).build();
            environment =
                    ConduitFactory.builder()
                            .clientFactory(servers)
                            .jsonCodec(codec)
                            .config(config)
                            .stubMode(true)
                            .build();
            environment.getToolOrchestrator().initialize(List.<ServerConfig>of());

            AgentRuntime runtime =
                    environment.createRuntime(AgentConfig.builder().model("any").build());
            runtime.chat("one");
            runtime.chat("two");

            assertThat(runtime.memory().history()).hasSize(2);
        }
    }

    @Nested
    @DisplayName("credentials")
    class Credentials {

        @Test
        @DisplayName("loads prefixed and key-like properties")
        void shouldLoadCredentialsFromProperties() {
            Properties properties = new Properties();
            properties.setProperty("conduit.credentials.ANTHROPIC_API_KEY", "sk-ant");
            properties.setProperty("OPENAI_API_KEY", "sk-oai");
            properties.setProperty("conduit.stub.enabled", "true");
            properties.setProperty("unrelated.setting", "x");
            properties.setProperty("EMPTY_TOKEN", "");

            Map<String, String> credentials = ConduitFactory.loadCredentialsFromProperties(properties);

            assertThat(credentials)
                    .containsOnly(
                            Map.entry("ANTHROPIC_API_KEY", "sk-ant"),
                            Map.entry("OPENAI_API_KEY", "sk-oai"),
                            Map.entry("conduit.stub.enabled", "true"));
        }
    }
}
