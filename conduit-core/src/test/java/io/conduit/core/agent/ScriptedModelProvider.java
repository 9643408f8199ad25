package io.conduit.core.agent;

import io.conduit.core.agent.spi.LanguageModel;
import io.conduit.core.agent.spi.LanguageModelProvider;
import io.conduit.core.agent.stub.StubLanguageModel;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/// Test provider handing out scripted models and recording every request.
final class ScriptedModelProvider implements LanguageModelProvider {

    private final Function<AgentConfig, LanguageModel> models;
    private final List<AgentConfig> createdFor = new CopyOnWriteArrayList<>();

    ScriptedModelProvider(Function<AgentConfig, LanguageModel> models) {
        this.models = models;
    }

    static ScriptedModelProvider replying(String... outputs) {
        return new ScriptedModelProvider(config -> new StubLanguageModel(List.of(outputs)));
    }

    List<AgentConfig> createdFor() {
        return createdFor;
    }

    @Override
    public String getName() {
        return "scripted";
    }

    @Override
    public boolean supportsModel(String modelId) {
        return modelId.startsWith("test-");
    }

    @Override
    public LanguageModel createModel(AgentConfig config, Map<String, String> credentials) {
        createdFor.add(config);
        return models.apply(config);
    }
}
