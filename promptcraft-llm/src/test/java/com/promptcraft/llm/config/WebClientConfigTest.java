package com.promptcraft.llm.config;

import com.promptcraft.llm.model.ProviderConfig;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WebClientConfigTest {
    
    @Test
    void responseTimeoutFollowsSlowestProvider() {
        List<ProviderConfig> providers = List.of(
            ProviderConfig.builder().name("openai").timeout(Duration.ofSeconds(30)).build(),
            ProviderConfig.builder().name("anthropic").timeout(Duration.ofSeconds(90)).build(),
            ProviderConfig.builder().name("mock").timeout(Duration.ofSeconds(5)).build());
        
        assertEquals(Duration.ofSeconds(90), WebClientConfig.longestProviderTimeout(providers));
    }
    
    @Test
    void unsetTimeoutCountsAsDefault() {
        List<ProviderConfig> providers = List.of(
            ProviderConfig.builder().name("fast").timeout(Duration.ofSeconds(5)).build(),
            ProviderConfig.builder().name("unset").timeout(null).build());
        
        assertEquals(Duration.ofSeconds(30), WebClientConfig.longestProviderTimeout(providers));
    }
    
    @Test
    void noProvidersUsesDefaultTimeout() {
        assertEquals(Duration.ofSeconds(30), WebClientConfig.longestProviderTimeout(List.of()));
        assertNotNull(new WebClientConfig(new LlmProperties()).webClientBuilder());
    }
}
