package io.conduit.adapter.langchain4j;

import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import io.conduit.core.agent.AgentConfig;
import io.conduit.core.agent.spi.LanguageModel;
import io.conduit.core.agent.spi.LanguageModelProvider;
import java.time.Duration;
import java.util.Map;
import java.util.function.Function;
import java.util.logging.Logger;

/// LangChain4j implementation of {@link LanguageModelProvider}.
///
/// Creates {@link ChatModel} instances by model-name prefix and wraps them in
/// {@link LangChain4jLanguageModel}:
///
/// | Prefix | Backend | Credential keys |
/// |--------|---------|-----------------|
/// | `claude` | Anthropic | `anthropic_api_key`, `ANTHROPIC_API_KEY` |
/// | `gpt`, `o1`, `o3` | OpenAI | `openai_api_key`, `OPENAI_API_KEY` |
/// | `gemini`, `gemma` | Google AI Gemini | `google_api_key`, `GOOGLE_API_KEY` |
///
/// The API key is taken from {@link AgentConfig#getAuthToken()} when set, then
/// from the credentials map, then from the environment.
///
/// @implNote Stateless and thread-safe. Each call to {@link #createModel} creates
/// a new model instance.
public class LangChain4jModelProvider implements LanguageModelProvider {

    private static final Logger logger = Logger.getLogger(LangChain4jModelProvider.class.getName());

    private static final int DEFAULT_MAX_TOKENS = 4096;
    private static final long DEFAULT_TIMEOUT_SECONDS = 60;

    private final Function<String, String> environment;

    public LangChain4jModelProvider() {
        this(System::getenv);
    }

    LangChain4jModelProvider(Function<String, String> environment) {
        this.environment = environment;
    }

    @Override
    public String getName() {
        return "langchain4j";
    }

    @Override
    public boolean supportsModel(String modelId) {
        return backendOf(modelId) != null;
    }

    @Override
    public LanguageModel createModel(AgentConfig config, Map<String, String> credentials) {
        logger.info("Creating LangChain4j model: " + config.getModel());
        return new LangChain4jLanguageModel(config.getModel(), createChatModel(config, credentials));
    }

    @Override
    public int getPriority() {
        return 100;
    }

    /// Creates the {@link ChatModel} matching the model-name prefix.
    ///
    /// @param config agent configuration containing the model name, not null
    /// @param credentials API keys, not null
    /// @return configured chat model, never null
    /// @throws IllegalArgumentException if the model name is not supported
    /// @throws IllegalStateException if the required API key is missing
    ChatModel createChatModel(AgentConfig config, Map<String, String> credentials) {
        String modelName = config.getModel();
        Backend backend = backendOf(modelName);
        if (backend == null) {
            throw new IllegalArgumentException("Unsupported model: " + modelName);
        }

        return switch (backend) {
            case ANTHROPIC -> AnthropicChatModel.builder()
                    .apiKey(resolveApiKey(config, credentials, "anthropic_api_key", "ANTHROPIC_API_KEY"))
                    .modelName(modelName)
                    .temperature(config.getTemperature())
                    .maxTokens(maxTokens(config))
                    .timeout(timeout(config))
                    .build();
            case OPENAI -> OpenAiChatModel.builder()
                    .apiKey(resolveApiKey(config, credentials, "openai_api_key", "OPENAI_API_KEY"))
                    .modelName(modelName)
                    .temperature(config.getTemperature())
                    .maxTokens(maxTokens(config))
                    .timeout(timeout(config))
                    .build();
            case GEMINI -> GoogleAiGeminiChatModel.builder()
                    .apiKey(resolveApiKey(config, credentials, "google_api_key", "GOOGLE_API_KEY"))
                    .modelName(modelName)
                    .temperature(config.getTemperature())
                    .maxOutputTokens(maxTokens(config))
                    .timeout(timeout(config))
                    .build();
        };
    }

    /// Resolves an API key: auth token, then credentials, then environment.
    ///
    /// @param config agent configuration, not null
    /// @param credentials credential map to search, not null
    /// @param keyNames candidate key names in priority order
    /// @return the first non-blank value found, never null
    /// @throws IllegalStateException if no source provides a key
    String resolveApiKey(AgentConfig config, Map<String, String> credentials, String... keyNames) {
        if (config.getAuthToken() != null && !config.getAuthToken().isBlank()) {
            return config.getAuthToken();
        }
        for (String keyName : keyNames) {
            String value = credentials != null ? credentials.get(keyName) : null;
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        for (String keyName : keyNames) {
            String value = environment.apply(keyName);
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        throw new IllegalStateException(
                "API key not found. Provide one of: " + String.join(", ", keyNames));
    }

    private static Backend backendOf(String modelName) {
        if (modelName == null) return null;
        if (modelName.startsWith("claude")) return Backend.ANTHROPIC;
        if (modelName.startsWith("gpt") || modelName.startsWith("o1") || modelName.startsWith("o3"))
            return Backend.OPENAI;
        if (modelName.startsWith("gemini") || modelName.startsWith("gemma")) return Backend.GEMINI;
        return null;
    }

    private static int maxTokens(AgentConfig config) {
        return config.getMaxTokens() != null ? config.getMaxTokens() : DEFAULT_MAX_TOKENS;
    }

    private static Duration timeout(AgentConfig config) {
        return Duration.ofSeconds(
                config.getTimeoutSeconds() != null
                        ? config.getTimeoutSeconds()
                        : DEFAULT_TIMEOUT_SECONDS);
    }

    private enum Backend {
        ANTHROPIC,
        OPENAI,
        GEMINI
    }
}
