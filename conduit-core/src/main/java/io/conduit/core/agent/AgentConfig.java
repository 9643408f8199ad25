package io.conduit.core.agent;

import java.util.Objects;

/// Immutable per-session agent configuration.
///
/// ### Defaults
/// - `temperature`: `0.7`
/// - `processorType`: {@link ProcessorType#REACT}
/// - `maxIterations`: {@link #DEFAULT_MAX_ITERATIONS}
///
/// `authToken` is handed to the language model provider and takes precedence
/// over provider credentials; changing it through
/// {@link AgentRuntime#updateAuthToken(String)} rebuilds the processor.
///
/// @see Builder
public final class AgentConfig {

    /// Upper bound on model turns per user message.
    public static final int DEFAULT_MAX_ITERATIONS = 8;

    public static final double DEFAULT_TEMPERATURE = 0.7;

    private final String model;
    private final double temperature;
    private final Integer maxTokens;
    private final ProcessorType processorType;
    private final String authToken;
    private final String systemPrompt;
    private final int maxIterations;
    private final Long timeoutSeconds;

    private AgentConfig(Builder builder) {
        this.model = Objects.requireNonNull(builder.model, "Model required");
        this.temperature = builder.temperature;
        this.maxTokens = builder.maxTokens;
        this.processorType =
                Objects.requireNonNull(builder.processorType, "Processor type required");
        this.authToken = builder.authToken;
        this.systemPrompt = builder.systemPrompt;
        this.maxIterations = builder.maxIterations;
        this.timeoutSeconds = builder.timeoutSeconds;
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be at least 1");
        }
    }

    public String getModel() {
        return model;
    }

    public double getTemperature() {
        return temperature;
    }

    public Integer getMaxTokens() {
        return maxTokens;
    }

    public ProcessorType getProcessorType() {
        return processorType;
    }

    /// @return the model auth token, or null to use provider credentials
    public String getAuthToken() {
        return authToken;
    }

    /// @return the system prompt override, or null to use the processor default
    public String getSystemPrompt() {
        return systemPrompt;
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    /// @return model call timeout in seconds, or null for the provider default
    public Long getTimeoutSeconds() {
        return timeoutSeconds;
    }

    /// Returns a builder pre-populated with this configuration.
    ///
    /// @return new builder, never null
    public Builder toBuilder() {
        return new Builder()
                .model(model)
                .temperature(temperature)
                .maxTokens(maxTokens)
                .processorType(processorType)
                .authToken(authToken)
                .systemPrompt(systemPrompt)
                .maxIterations(maxIterations)
                .timeoutSeconds(timeoutSeconds);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "AgentConfig{model="
                + model
                + ", processor="
                + processorType.id()
                + ", maxIterations="
                + maxIterations
                + ", authToken="
                + (authToken != null ? "***" : "none")
                + "}";
    }

    public static final class Builder {
        private String model;
        private double temperature = DEFAULT_TEMPERATURE;
        private Integer maxTokens;
        private ProcessorType processorType = ProcessorType.REACT;
        private String authToken;
        private String systemPrompt;
        private int maxIterations = DEFAULT_MAX_ITERATIONS;
        private Long timeoutSeconds;

        private Builder() {}

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder temperature(double temperature) {
            this.temperature = temperature;
            return this;
        }

        public Builder maxTokens(Integer maxTokens) {
            this.maxTokens = maxTokens;
            return this;
        }

        public Builder processorType(ProcessorType processorType) {
            this.processorType = processorType;
            return this;
        }

        public Builder authToken(String authToken) {
            this.authToken = authToken;
            return this;
        }

        public Builder systemPrompt(String systemPrompt) {
            this.systemPrompt = systemPrompt;
            return this;
        }

        public Builder maxIterations(int maxIterations) {
            this.maxIterations = maxIterations;
            return this;
        }

        public Builder timeoutSeconds(Long timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
            return this;
        }

        public AgentConfig build() {
            return new AgentConfig(this);
        }
    }
}
