package io.conduit.core.agent.spi;

import io.conduit.core.agent.AgentConfig;
import java.util.Map;

/// Service Provider Interface for language model backends.
///
/// Providers are discovered through {@link java.util.ServiceLoader} or passed
/// explicitly to {@link io.conduit.core.agent.LanguageModelFactory}. When several
/// providers support a model id, the one with the highest priority wins.
///
/// ### Registration
/// List the implementation class in
/// `META-INF/services/io.conduit.core.agent.spi.LanguageModelProvider`.
public interface LanguageModelProvider {

    /// @return provider name for logs, never null
    String getName();

    /// @param modelId model identifier such as `claude-sonnet-4`, may be null
    /// @return true if this provider can create the model
    boolean supportsModel(String modelId);

    /// Creates a model instance.
    ///
    /// @param config agent configuration, not null
    /// @param credentials provider credentials by key, not null
    /// @return new model, never null
    /// @throws IllegalStateException if required credentials are missing
    LanguageModel createModel(AgentConfig config, Map<String, String> credentials);

    /// @return selection priority, higher wins
    default int getPriority() {
        return 0;
    }
}
