package com.promptcraft.llm.provider.clients;

import com.promptcraft.llm.mock.MockDataGenerator;
import com.promptcraft.llm.model.GenerationRequest;
import com.promptcraft.llm.model.GenerationResponse;
import com.promptcraft.llm.model.HealthStatus;
import com.promptcraft.llm.model.ModelConfig;
import com.promptcraft.llm.model.ProviderConfig;
import com.promptcraft.llm.provider.LlmProvider;
import com.promptcraft.llm.provider.ProviderErrorType;
import com.promptcraft.llm.provider.ProviderException;
import com.promptcraft.llm.provider.support.HealthProbe;
import com.promptcraft.llm.provider.support.ProviderExecutor;
import com.promptcraft.llm.provider.support.VendorResult;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * Deterministic offline provider. Never touches the network; latency and failures
 * are simulated from {@link ProviderConfig.MockSettings}.
 */
@Slf4j
public class MockProvider implements LlmProvider {
    
    public static final String DEFAULT_MODEL = "mock-model";
    
    private final ProviderConfig config;
    private final MockDataGenerator generator;
    private final ProviderExecutor executor;
    
    public MockProvider(ProviderConfig config, MockDataGenerator generator, ProviderExecutor executor) {
        this.config = config;
        this.generator = generator;
        this.executor = executor;
    }
    
    @Override
    public GenerationResponse generate(GenerationRequest request) {
        String model = request.getModel() != null && !request.getModel().isBlank()
            ? request.getModel()
            : config.resolveModel(request).map(ModelConfig::getName).orElse(DEFAULT_MODEL);
        log.debug("[MOCK] Generating | provider={} | model={} | operation={}",
            config.getName(), model, request.getOperation());
        return executor.execute(config, request, model, (m, timeout) -> respond(request, m));
    }
    
    @Override
    public HealthStatus checkHealth() {
        String model = config.defaultModel().map(ModelConfig::getName).orElse(DEFAULT_MODEL);
        return executor.probe(config, HealthProbe.REQUEST, model, (m, timeout) -> respond(HealthProbe.REQUEST, m));
    }
    
    @Override
    public ProviderConfig getConfig() {
        return config.copy();
    }
    
    @Override
    public String getName() {
        return config.getName();
    }
    
    private VendorResult respond(GenerationRequest request, String model) throws ProviderException {
        simulateLatency();
        
        ProviderErrorType failWith = config.getMock() != null ? config.getMock().getFailWith() : null;
        if (failWith != null) {
            throw new ProviderException("Simulated failure: " + failWith.getDescription(),
                config.getName(), failWith, 0);
        }
        
        String content = generator.generate(request.getOperation(), request.getSystemPrompt(), request.getUserPrompt());
        return VendorResult.builder()
            .content(content)
            .model(model)
            .inputTokens(generator.inputTokens(request.getSystemPrompt(), request.getUserPrompt()))
            .outputTokens(generator.outputTokens(content))
            .billable(false)
            .build();
    }
    
    private void simulateLatency() throws ProviderException {
        Duration latency = config.getMock() != null ? config.getMock().getLatency() : null;
        if (latency == null || latency.isZero() || latency.isNegative()) {
            return;
        }
        try {
            Thread.sleep(latency.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException("Simulated call interrupted", config.getName(),
                ProviderErrorType.TIMEOUT, 0, e);
        }
    }
}
