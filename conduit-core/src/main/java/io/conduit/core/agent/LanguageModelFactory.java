package io.conduit.core.agent;

import io.conduit.core.agent.spi.LanguageModel;
import io.conduit.core.agent.spi.LanguageModelProvider;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.logging.Logger;

/// Creates language models by selecting the best provider for a model id.
public class LanguageModelFactory {

    private static final Logger logger = Logger.getLogger(LanguageModelFactory.class.getName());

    private final List<LanguageModelProvider> providers;
    private final Map<String, String> credentials;

    /// Creates a factory with providers discovered through {@link ServiceLoader}.
    ///
    /// @param credentials provider credentials, not null
    public LanguageModelFactory(Map<String, String> credentials) {
        this(credentials, loadProviders());
    }

    /// Creates a factory with explicit providers.
    ///
    /// @param credentials provider credentials, not null
    /// @param providers available providers, not null
    public LanguageModelFactory(
            Map<String, String> credentials, List<LanguageModelProvider> providers) {
        this.credentials = new HashMap<>(credentials);
        this.providers = List.copyOf(providers);
        logger.info(
                "Loaded "
                        + providers.size()
                        + " language model providers: "
                        + providers.stream().map(LanguageModelProvider::getName).toList());
    }

    /// Creates a model for an agent configuration.
    ///
    /// @param config agent configuration, not null
    /// @return new model, never null
    /// @throws IllegalStateException if no provider supports the model id
    public LanguageModel createModel(AgentConfig config) {
        String modelId = config.getModel();
        LanguageModelProvider provider =
                providers.stream()
                        .filter(p -> p.supportsModel(modelId))
                        .max(Comparator.comparingInt(LanguageModelProvider::getPriority))
                        .orElseThrow(
                                () ->
                                        new IllegalStateException(
                                                "No provider found for model: "
                                                        + modelId
                                                        + ". Available providers: "
                                                        + providers.stream()
                                                                .map(LanguageModelProvider::getName)
                                                                .toList()));

        logger.info("Creating model '" + modelId + "' with provider: " + provider.getName());
        return provider.createModel(config, credentials);
    }

    public List<LanguageModelProvider> getProviders() {
        return Collections.unmodifiableList(providers);
    }

    public boolean isModelSupported(String modelId) {
        return providers.stream().anyMatch(p -> p.supportsModel(modelId));
    }

    private static List<LanguageModelProvider> loadProviders() {
        List<LanguageModelProvider> discovered = new ArrayList<>();
        for (LanguageModelProvider provider : ServiceLoader.load(LanguageModelProvider.class)) {
            discovered.add(provider);
            logger.fine("Discovered provider: " + provider.getName());
        }
        return discovered;
    }
}
