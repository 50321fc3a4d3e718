package com.promptcraft.llm.config;

import com.promptcraft.llm.model.ProviderConfig;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "llm")
@Getter
@Setter
public class LlmProperties {
    private List<ProviderConfig> providers = new ArrayList<>();
    private String defaultProvider;
    private String fallbackProvider;
    private boolean skipAiRequests = false; // Mock mode: only MOCK providers are registered
    private int defaultMaxTokens = 1000; // Output estimate when a request sets no limit
    private LoadBalancing loadBalancing = new LoadBalancing();
    private CostOptimization costOptimization = new CostOptimization();
    private Retry retry = new Retry();
    
    @Getter
    @Setter
    public static class LoadBalancing {
        private String strategy = "cheapest";
    }
    
    @Getter
    @Setter
    public static class CostOptimization {
        private boolean enabled = false;
        private double maxCostPerRequestCents = 50.0;
    }
    
    @Getter
    @Setter
    public static class Retry {
        private Duration baseDelay = Duration.ofMillis(500);
        private Duration maxDelay = Duration.ofSeconds(10);
    }
}
