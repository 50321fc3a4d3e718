package com.promptcraft.llm.provider.support;

import com.promptcraft.llm.model.ModelConfig;
import com.promptcraft.llm.model.ProviderConfig;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Cost computation from token usage and per-model pricing (cents per 1,000 tokens).
 */
@Slf4j
public class PricingCalculator {
    
    private static final double PRECISION = 10_000.0;
    
    public static double cost(ModelConfig model, int inputTokens, int outputTokens) {
        double inputCost = (inputTokens / 1000.0) * model.getInputCostPer1K();
        double outputCost = (outputTokens / 1000.0) * model.getOutputCostPer1K();
        return Math.round((inputCost + outputCost) * PRECISION) / PRECISION;
    }
    
    /**
     * Prices usage for the model that served it. A model the provider does not configure
     * is priced at the provider's cheapest model and the quote is marked as a fallback.
     */
    public Quote quote(ProviderConfig config, String modelName, int inputTokens, int outputTokens) {
        Optional<ModelConfig> model = config.findModel(modelName);
        if (model.isPresent()) {
            return new Quote(cost(model.get(), inputTokens, outputTokens), model.get().getName(), false);
        }
        
        Optional<ModelConfig> cheapest = config.cheapestModel();
        if (cheapest.isEmpty()) {
            log.warn("[PRICING] No pricing configured | provider={} | model={}", config.getName(), modelName);
            return new Quote(0.0, null, true);
        }
        
        log.warn("[PRICING] Unknown model, using cheapest configured rates | provider={} | model={} | pricedAs={}",
            config.getName(), modelName, cheapest.get().getName());
        return new Quote(cost(cheapest.get(), inputTokens, outputTokens), cheapest.get().getName(), true);
    }
    
    @Value
    public static class Quote {
        double costCents;
        String pricedAs;
        boolean fallback;
        
        public String describeFallback(String requestedModel) {
            if (!fallback) {
                return null;
            }
            return pricedAs != null
                ? "Unknown model '" + requestedModel + "'; cost estimated with rates of '" + pricedAs + "'"
                : "Unknown model '" + requestedModel + "'; no pricing configured, cost reported as zero";
        }
    }
}
