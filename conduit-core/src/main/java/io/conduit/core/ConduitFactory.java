package io.conduit.core;

import io.conduit.core.agent.LanguageModelFactory;
import io.conduit.core.agent.spi.LanguageModelProvider;
import io.conduit.core.agent.stub.StubModelProvider;
import io.conduit.core.connection.ConnectionManager;
import io.conduit.core.connection.ConnectionOrchestrator;
import io.conduit.core.connection.ToolServerClientFactory;
import io.conduit.core.processor.ProcessorFactory;
import io.conduit.core.tool.DefaultToolOrchestrator;
import io.conduit.core.tool.LiveToolRegistry;
import io.conduit.core.tool.ToolInvoker;
import io.conduit.core.tool.ToolRegistry;
import io.conduit.core.tool.ToolRouter;
import io.conduit.core.util.JsonCodec;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/// Composition root for Conduit.
///
/// Wires router, connection manager, orchestrator, registry, invoker and the
/// {@link io.conduit.core.tool.ToolOrchestrator} facade, plus the language model
/// and processor factories, into a {@link ConduitEnvironment}.
///
/// ```java
/// ConduitEnvironment env = ConduitFactory.builder()
///         .config(ConduitConfig.defaults())
///         .clientFactory(myTransportFactory)
///         .jsonCodec(new JacksonJsonCodec())
///         .loadCredentialsFromEnvironment()
///         .build();
///
/// env.getToolOrchestrator().initialize(servers);
/// AgentRuntime agent = env.createRuntime(AgentConfig.builder().model("claude-sonnet-4").build());
/// ```
///
/// Transport and JSON implementations live outside the core; the caller always
/// supplies a {@link ToolServerClientFactory} and a {@link JsonCodec}.
public final class ConduitFactory {

    private ConduitFactory() {}

    public static Builder builder() {
        return new Builder();
    }

    /// Collects API keys from environment variables.
    ///
    /// Picks up every variable ending in `_API_KEY`, `_KEY`, `_SECRET` or `_TOKEN`.
    ///
    /// @return credentials by variable name, never null
    public static Map<String, String> loadCredentialsFromEnvironment() {
        Map<String, String> credentials = new HashMap<>();
        System.getenv()
                .forEach(
                        (key, value) -> {
                            if (value != null && !value.isEmpty() && isApiKeyPattern(key)) {
                                credentials.put(key, value);
                            }
                        });
        return credentials;
    }

    /// Collects credentials from properties.
    ///
    /// Keys prefixed with `conduit.credentials.` are stored without the prefix;
    /// `conduit.stub.enabled` and bare API key names are kept as is.
    ///
    /// @param properties source properties, not null
    /// @return credentials by key, never null
    public static Map<String, String> loadCredentialsFromProperties(Properties properties) {
        Map<String, String> credentials = new HashMap<>();
        String prefix = "conduit.credentials.";
        properties.forEach(
                (key, value) -> {
                    String keyStr = key.toString();
                    String valueStr = value.toString();
                    if (valueStr.isEmpty()) {
                        return;
                    }
                    if (keyStr.startsWith(prefix)) {
                        credentials.put(keyStr.substring(prefix.length()), valueStr);
                    } else if (keyStr.equals(StubModelProvider.ENABLED_PROPERTY)
                            || isApiKeyPattern(keyStr)) {
                        credentials.put(keyStr, valueStr);
                    }
                });
        return credentials;
    }

    private static boolean isApiKeyPattern(String key) {
        String upperKey = key.toUpperCase();
        return upperKey.endsWith("_API_KEY")
                || upperKey.endsWith("_KEY")
                || upperKey.endsWith("_SECRET")
                || upperKey.endsWith("_TOKEN");
    }

    private static void applyStubModeSetting(Map<String, String> credentials) {
        if ("true".equalsIgnoreCase(credentials.get(StubModelProvider.ENABLED_PROPERTY))) {
            System.setProperty(StubModelProvider.ENABLED_PROPERTY, "true");
        }
    }

    private static ExecutorService newPool(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threads =
                runnable -> {
                    Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
                    thread.setDaemon(true);
                    return thread;
                };
        return Executors.newCachedThreadPool(threads);
    }

    public static final class Builder {
        private ConduitConfig config = ConduitConfig.defaults();
        private ToolServerClientFactory clientFactory;
        private JsonCodec jsonCodec;
        private final Map<String, String> credentials = new HashMap<>();
        private final List<LanguageModelProvider> modelProviders = new ArrayList<>();
        private ExecutorService ioExecutor;
        private ExecutorService workExecutor;
        private Clock clock = Clock.systemUTC();

        private Builder() {}

        public Builder config(ConduitConfig config) {
            this.config = config;
            return this;
        }

        public Builder clientFactory(ToolServerClientFactory clientFactory) {
            this.clientFactory = clientFactory;
            return this;
        }

        public Builder jsonCodec(JsonCodec jsonCodec) {
            this.jsonCodec = jsonCodec;
            return this;
        }

        public Builder credential(String key, String value) {
            this.credentials.put(key, value);
            return this;
        }

        public Builder credentials(Map<String, String> credentials) {
            this.credentials.putAll(credentials);
            return this;
        }

        public Builder loadCredentialsFromEnvironment() {
            this.credentials.putAll(ConduitFactory.loadCredentialsFromEnvironment());
            return this;
        }

        public Builder loadCredentialsFromProperties(Properties properties) {
            this.credentials.putAll(ConduitFactory.loadCredentialsFromProperties(properties));
            return this;
        }

        /// Adds an explicit model provider. When any are given, service loading
        /// is skipped and only these plus the stub provider are used.
        ///
        /// @param provider provider, not null
        /// @return this builder for chaining, never null
        public Builder modelProvider(LanguageModelProvider provider) {
            this.modelProviders.add(Objects.requireNonNull(provider, "provider"));
            return this;
        }

        public Builder modelProviders(List<LanguageModelProvider> providers) {
            this.modelProviders.addAll(providers);
            return this;
        }

        public Builder stubMode(boolean enabled) {
            this.credentials.put(StubModelProvider.ENABLED_PROPERTY, String.valueOf(enabled));
            return this;
        }

        /// Sets the executor for transport calls. Tasks block on network I/O,
        /// so a bounded pool must be large enough for concurrent calls.
        ///
        /// @param ioExecutor executor, not null
        /// @return this builder for chaining, never null
        public Builder ioExecutor(ExecutorService ioExecutor) {
            this.ioExecutor = ioExecutor;
            return this;
        }

        /// Sets the executor for fan-out and background memory writes.
        ///
        /// @param workExecutor executor, not null
        /// @return this builder for chaining, never null
        public Builder workExecutor(ExecutorService workExecutor) {
            this.workExecutor = workExecutor;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public ConduitEnvironment build() {
            Objects.requireNonNull(clientFactory, "clientFactory must be set");
            Objects.requireNonNull(jsonCodec, "jsonCodec must be set");
            applyStubModeSetting(credentials);

            List<ExecutorService> owned = new ArrayList<>();
            if (ioExecutor == null) {
                ioExecutor = newPool("conduit-io");
                owned.add(ioExecutor);
            }
            if (workExecutor == null) {
                workExecutor = newPool("conduit-work");
                owned.add(workExecutor);
            }

            ToolRouter router = new ToolRouter();
            ConnectionManager manager =
                    new ConnectionManager(
                            clientFactory, router, ioExecutor, config.getTimeouts(), clock);
            ConnectionOrchestrator orchestrator =
                    new ConnectionOrchestrator(
                            manager,
                            router,
                            workExecutor,
                            config.getRetryPolicy(),
                            config.getHealthCheckTtl(),
                            clock);
            ToolRegistry registry = new LiveToolRegistry(orchestrator, router);
            ToolInvoker invoker = new ToolInvoker(registry, orchestrator, manager, router);
            DefaultToolOrchestrator facade =
                    new DefaultToolOrchestrator(orchestrator, registry, invoker);

            LanguageModelFactory modelFactory;
            if (modelProviders.isEmpty()) {
                modelFactory = new LanguageModelFactory(credentials);
            } else {
                List<LanguageModelProvider> providers = new ArrayList<>(modelProviders);
                providers.add(new StubModelProvider());
                modelFactory = new LanguageModelFactory(credentials, providers);
            }

            return new ConduitEnvironment(
                    config,
                    router,
                    manager,
                    orchestrator,
                    registry,
                    facade,
                    modelFactory,
                    new ProcessorFactory(jsonCodec),
                    jsonCodec,
                    workExecutor,
                    owned);
        }
    }
}
