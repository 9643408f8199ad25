package io.conduit.server.config;

import io.conduit.core.ConduitConfig;
import io.conduit.core.agent.AgentConfig;
import io.conduit.core.agent.ProcessorType;
import io.conduit.core.connection.RetryPolicy;
import io.conduit.core.connection.ServerConfig;
import io.conduit.core.exception.ConfigurationException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.net.URI;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import org.eclipse.microprofile.config.Config;
import org.jboss.logging.Logger;

/// Reads tool-server, runtime and agent settings from MicroProfile Config.
///
/// ### Configuration Properties
/// | Property | Default | Description |
/// |----------|---------|-------------|
/// | `conduit.mcp.servers` | `rag,gmail` | Server names in connection order |
/// | `conduit.mcp.server.<name>.url` | see below | Base URL of the server |
/// | `conduit.mcp.server.<name>.port` | see below | Server port |
/// | `conduit.mcp.server.<name>.endpoint` | `/mcp` | Transport path |
/// | `conduit.mcp.connect-timeout` | `10s` | Handshake and first listing budget |
/// | `conduit.mcp.health-check-timeout` | `5s` | Health-check budget |
/// | `conduit.mcp.tool-timeout` | `120s` | Tool-call budget |
/// | `conduit.mcp.health-check-ttl` | `5s` | Window in which a checked connection is trusted |
/// | `conduit.mcp.retry.max-attempts` | `3` | Attempts for startup and reconnects |
/// | `conduit.mcp.retry.initial-delay` | `1s` | Delay before the first retry |
/// | `conduit.memory.history-window` | `20` | Messages kept per session |
/// | `conduit.agent.model` | `gpt-4o-mini` | Default model for new sessions |
/// | `conduit.agent.temperature` | `0.7` | Sampling temperature |
/// | `conduit.agent.max-tokens` | - | Output token limit |
/// | `conduit.agent.processor` | `react` | `react` or `coact` |
/// | `conduit.agent.max-iterations` | `8` | Reasoning iteration cap |
/// | `conduit.agent.system-prompt` | - | System prompt override |
///
/// The `rag` server defaults to `http://localhost:3000` and `gmail` to
/// `http://localhost:3001`. Other servers must name their URL; a server
/// without one is still returned and fails on its own connection attempt.
@ApplicationScoped
public class ServerConfigLoader {

    private static final Logger LOG = Logger.getLogger(ServerConfigLoader.class);

    static final String SERVERS_KEY = "conduit.mcp.servers";
    static final String DEFAULT_SERVERS = "rag,gmail";
    static final String DEFAULT_MODEL = "gpt-4o-mini";

    private static final Map<String, Integer> WELL_KNOWN_PORTS = Map.of("rag", 3000, "gmail", 3001);

    private final Config config;

    @Inject
    public ServerConfigLoader(Config config) {
        this.config = config;
    }

    /// Builds the server list in configured order.
    ///
    /// Values are not validated here; each config is validated when its
    /// connection is opened.
    ///
    /// @return server configurations, never null
    public List<ServerConfig> loadServers() {
        List<ServerConfig> servers = new ArrayList<>();
        for (String raw : string(SERVERS_KEY).orElse(DEFAULT_SERVERS).split(",")) {
            String name = raw.trim();
            if (name.isEmpty()) {
                continue;
            }
            String prefix = "conduit.mcp.server." + name + ".";
            Integer wellKnown = WELL_KNOWN_PORTS.get(name);

            String url =
                    string(prefix + "url")
                            .orElse(wellKnown != null ? "http://localhost:" + wellKnown : null);
            int port =
                    string(prefix + "port")
                            .map(ServerConfigLoader::parsePort)
                            .orElseGet(() -> wellKnown != null ? wellKnown : portOf(url));
            String endpoint = string(prefix + "endpoint").orElse(null);

            servers.add(new ServerConfig(name, url, port, endpoint));
        }
        LOG.infov("Loaded {0} tool server configurations", servers.size());
        return servers;
    }

    /// Builds the runtime configuration.
    ///
    /// @return runtime configuration, never null
    /// @throws ConfigurationException if a value cannot be parsed
    public ConduitConfig loadConduitConfig() {
        ConduitConfig.Builder builder = ConduitConfig.builder();
        duration("conduit.mcp.connect-timeout").ifPresent(builder::connectTimeout);
        duration("conduit.mcp.health-check-timeout").ifPresent(builder::healthCheckTimeout);
        duration("conduit.mcp.tool-timeout").ifPresent(builder::toolCallTimeout);
        duration("conduit.mcp.health-check-ttl").ifPresent(builder::healthCheckTtl);
        integer("conduit.memory.history-window").ifPresent(builder::historyWindow);
        builder.retryPolicy(loadRetryPolicy());
        return builder.build();
    }

    /// Builds the retry policy shared by startup and reconnects.
    ///
    /// @return retry policy, never null
    public RetryPolicy loadRetryPolicy() {
        RetryPolicy defaults = RetryPolicy.defaults();
        return new RetryPolicy(
                integer("conduit.mcp.retry.max-attempts").orElse(defaults.maxAttempts()),
                duration("conduit.mcp.retry.initial-delay").orElse(defaults.initialDelay()),
                defaults.multiplier(),
                defaults.maxDelay(),
                defaults.jitter());
    }

    /// Builds the agent configuration given to new sessions.
    ///
    /// @return agent configuration, never null
    public AgentConfig loadAgentConfig() {
        AgentConfig.Builder builder =
                AgentConfig.builder()
                        .model(string("conduit.agent.model").orElse(DEFAULT_MODEL))
                        .processorType(
                                ProcessorType.from(string("conduit.agent.processor").orElse(null)));
        string("conduit.agent.temperature")
                .map(value -> parseDouble("conduit.agent.temperature", value))
                .ifPresent(builder::temperature);
        integer("conduit.agent.max-tokens").ifPresent(builder::maxTokens);
        integer("conduit.agent.max-iterations").ifPresent(builder::maxIterations);
        string("conduit.agent.system-prompt").ifPresent(builder::systemPrompt);
        return builder.build();
    }

    /// Extracts `conduit.credentials.*` and `conduit.stub.enabled` for the factory.
    ///
    /// @return credential properties, never null
    public Properties loadCredentialProperties() {
        Properties properties = new Properties();
        String credentialsPrefix = "conduit.credentials.";
        String stubEnabledKey = "conduit.stub.enabled";

        for (String propertyName : config.getPropertyNames()) {
            if (propertyName.startsWith(credentialsPrefix)) {
                string(propertyName).ifPresent(value -> properties.setProperty(propertyName, value));
            }
        }
        string(stubEnabledKey).ifPresent(value -> properties.setProperty(stubEnabledKey, value));
        return properties;
    }

    /// Parses a duration in the forms `500ms`, `10s`, `2m`, `1h`, bare seconds or ISO-8601.
    ///
    /// @param key property name for error messages, not null
    /// @param value the text, not null
    /// @return parsed duration, never null
    /// @throws ConfigurationException if the text is not a duration
    static Duration parseDuration(String key, String value) {
        String text = value.trim().toLowerCase(Locale.ROOT);
        try {
            if (text.startsWith("p")) {
                return Duration.parse(text.toUpperCase(Locale.ROOT));
            }
            if (text.endsWith("ms")) {
                return Duration.ofMillis(Long.parseLong(text.substring(0, text.length() - 2)));
            }
            if (text.endsWith("s")) {
                return Duration.ofSeconds(Long.parseLong(text.substring(0, text.length() - 1)));
            }
            if (text.endsWith("m")) {
                return Duration.ofMinutes(Long.parseLong(text.substring(0, text.length() - 1)));
            }
            if (text.endsWith("h")) {
                return Duration.ofHours(Long.parseLong(text.substring(0, text.length() - 1)));
            }
            return Duration.ofSeconds(Long.parseLong(text));
        } catch (NumberFormatException | DateTimeParseException e) {
            throw new ConfigurationException(key, "Invalid duration for " + key + ": " + value);
        }
    }

    private static int parsePort(String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private static int portOf(String url) {
        if (url == null) {
            return 0;
        }
        try {
            int port = URI.create(url.trim()).getPort();
            return Math.max(port, 0);
        } catch (IllegalArgumentException e) {
            return 0;
        }
    }

    private static double parseDouble(String key, String value) {
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key, "Invalid number for " + key + ": " + value);
        }
    }

    private Optional<String> string(String key) {
        return config.getOptionalValue(key, String.class)
                .map(String::trim)
                .filter(value -> !value.isEmpty());
    }

    private Optional<Duration> duration(String key) {
        return string(key).map(value -> parseDuration(key, value));
    }

    private Optional<Integer> integer(String key) {
        return string(key)
                .map(
                        value -> {
                            try {
                                return Integer.parseInt(value);
                            } catch (NumberFormatException e) {
                                throw new ConfigurationException(
                                        key, "Invalid integer for " + key + ": " + value);
                            }
                        });
    }
}
