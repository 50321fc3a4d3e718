package com.promptcraft.llm.config;

import com.promptcraft.llm.factory.LlmProviderFactory;
import com.promptcraft.llm.manager.LlmProviderManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class LlmManagerConfig {

    @Bean
    public LlmProviderManager llmProviderManager(LlmProviderFactory factory) {
        return factory.getManager();
    }
}
