package com.promptcraft.llm.model;

import com.promptcraft.common.constants.AiOperation;
import com.promptcraft.llm.provider.ProviderErrorType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Static configuration of one provider. Bound from {@code llm.providers[n].*}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ProviderConfig {
    
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
    
    private String name;
    
    @Builder.Default
    private ProviderType type = ProviderType.MOCK;
    
    @ToString.Exclude
    private String apiKey;
    
    private String baseUrl;
    
    @Builder.Default
    private Duration timeout = DEFAULT_TIMEOUT;
    
    @Builder.Default
    private int maxRetries = 3;
    
    @Builder.Default
    private List<ModelConfig> models = new ArrayList<>();
    
    @Builder.Default
    private int priority = 10;
    
    @Builder.Default
    private boolean enabled = true;
    
    @Builder.Default
    private MockSettings mock = new MockSettings();
    
    public Duration effectiveTimeout() {
        return timeout != null && !timeout.isZero() && !timeout.isNegative() ? timeout : DEFAULT_TIMEOUT;
    }
    
    /**
     * Detached copy including models and mock settings, so changes to the copy never
     * reach the original.
     */
    public ProviderConfig copy() {
        List<ModelConfig> copiedModels = new ArrayList<>();
        if (models != null) {
            models.forEach(m -> copiedModels.add(m.copy()));
        }
        MockSettings copiedMock = mock != null
            ? new MockSettings(mock.getLatency(), mock.getFailWith())
            : new MockSettings();
        return toBuilder().models(copiedModels).mock(copiedMock).build();
    }
    
    public boolean hasCredential() {
        return apiKey != null && !apiKey.isBlank();
    }
    
    public Optional<ModelConfig> findModel(String modelName) {
        if (modelName == null || models == null) {
            return Optional.empty();
        }
        return models.stream().filter(m -> modelName.equals(m.getName())).findFirst();
    }
    
    /** First configured model, the provider's default. */
    public Optional<ModelConfig> defaultModel() {
        return models == null || models.isEmpty() ? Optional.empty() : Optional.of(models.get(0));
    }
    
    public Optional<ModelConfig> cheapestModel() {
        if (models == null) {
            return Optional.empty();
        }
        return models.stream().min(Comparator.comparingDouble(ModelConfig::combinedCostPer1K));
    }
    
    public boolean supports(AiOperation operation) {
        return operation == null
            || (models != null && models.stream().anyMatch(m -> m.isRecommendedFor(operation)));
    }
    
    /**
     * Model this provider would use for the request: the requested model when configured
     * here, else the first model recommended for the operation, else the default model.
     */
    public Optional<ModelConfig> resolveModel(GenerationRequest request) {
        Optional<ModelConfig> explicit = findModel(request.getModel());
        if (explicit.isPresent()) {
            return explicit;
        }
        if (request.getOperation() != null && models != null) {
            Optional<ModelConfig> recommended = models.stream()
                .filter(m -> m.isRecommendedFor(request.getOperation()))
                .findFirst();
            if (recommended.isPresent()) {
                return recommended;
            }
        }
        return defaultModel();
    }
    
    /**
     * Offline behaviour knobs for {@link ProviderType#MOCK} providers.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MockSettings {
        private Duration latency = Duration.ZERO;
        private ProviderErrorType failWith;
    }
}
