package io.conduit.core.agent.stub;

import io.conduit.core.agent.AgentConfig;
import io.conduit.core.agent.spi.LanguageModel;
import io.conduit.core.agent.spi.LanguageModelProvider;
import java.util.Map;
import java.util.logging.Logger;

/// Provider that serves {@link StubLanguageModel} for every model id when stub
/// mode is enabled.
///
/// Stub mode is enabled by the `conduit.stub.enabled` credential, system
/// property, or the `CONDUIT_STUB_ENABLED` environment variable. When enabled,
/// the priority of `1000` overrides every real provider.
public class StubModelProvider implements LanguageModelProvider {

    private static final Logger logger = Logger.getLogger(StubModelProvider.class.getName());

    public static final String ENABLED_PROPERTY = "conduit.stub.enabled";
    private static final String ENABLED_ENV = "CONDUIT_STUB_ENABLED";

    @Override
    public String getName() {
        return "stub";
    }

    @Override
    public boolean supportsModel(String modelId) {
        return isEnabledGlobally();
    }

    @Override
    public LanguageModel createModel(AgentConfig config, Map<String, String> credentials) {
        if (!isEnabled(credentials)) {
            throw new IllegalStateException("Stub provider called but stub mode is disabled");
        }
        logger.info("[STUB] Creating stub model for: " + config.getModel());
        return StubLanguageModel.echo();
    }

    @Override
    public int getPriority() {
        return isEnabledGlobally() ? 1000 : -1;
    }

    private static boolean isEnabledGlobally() {
        if ("true".equalsIgnoreCase(System.getProperty(ENABLED_PROPERTY))) {
            return true;
        }
        return "true".equalsIgnoreCase(System.getenv(ENABLED_ENV));
    }

    private static boolean isEnabled(Map<String, String> credentials) {
        String value = credentials != null ? credentials.get(ENABLED_PROPERTY) : null;
        if (value != null) {
            return "true".equalsIgnoreCase(value);
        }
        return isEnabledGlobally();
    }
}
