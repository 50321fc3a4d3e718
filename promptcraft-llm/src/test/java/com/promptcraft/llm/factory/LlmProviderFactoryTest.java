package com.promptcraft.llm.factory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.promptcraft.common.constants.AiOperation;
import com.promptcraft.llm.config.LlmProperties;
import com.promptcraft.llm.exception.LlmConfigurationException;
import com.promptcraft.llm.manager.LlmProviderManager;
import com.promptcraft.llm.manager.LoadBalancingStrategy;
import com.promptcraft.llm.mock.MockDataGenerator;
import com.promptcraft.llm.model.GenerationResponse;
import com.promptcraft.llm.model.ProviderConfig;
import com.promptcraft.llm.model.ProviderType;
import com.promptcraft.llm.provider.clients.AnthropicProvider;
import com.promptcraft.llm.provider.clients.MockProvider;
import com.promptcraft.llm.provider.clients.OpenAiProvider;
import com.promptcraft.llm.provider.support.ProviderExecutor;
import com.promptcraft.llm.provider.support.RetrySettings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static com.promptcraft.llm.LlmTestFixtures.mockConfig;
import static com.promptcraft.llm.LlmTestFixtures.model;
import static com.promptcraft.llm.LlmTestFixtures.request;
import static org.junit.jupiter.api.Assertions.*;

class LlmProviderFactoryTest {
    
    private LlmProperties properties;
    private LlmProviderFactory factory;
    
    @BeforeEach
    void setUp() {
        properties = new LlmProperties();
        properties.setProviders(new ArrayList<>(List.of(
            mockConfig("mock-a", 1, model("m", 0.1, 0.1, AiOperation.PROMPT_IMPROVE)),
            mockConfig("mock-b", 2, model("m", 0.2, 0.2, AiOperation.PROMPT_IMPROVE))
        )));
        factory = new LlmProviderFactory(properties, WebClient.builder(), new ObjectMapper(), new MockDataGenerator());
    }
    
    @Test
    void registersOnlyEnabledProviders() {
        properties.getProviders().get(1).setEnabled(false);
        
        LlmProviderManager manager = factory.createManager();
        
        assertEquals(List.of("mock-a"), manager.listProviders().stream().map(ProviderConfig::getName).toList());
        assertTrue(manager.getProvider("mock-b").isEmpty());
    }
    
    @Test
    void appliesRoutingSettings() {
        properties.setDefaultProvider("mock-b");
        properties.setFallbackProvider("mock-a");
        properties.getLoadBalancing().setStrategy("priority");
        properties.getCostOptimization().setEnabled(true);
        properties.getCostOptimization().setMaxCostPerRequestCents(12.5);
        
        LlmProviderManager manager = factory.createManager();
        
        assertEquals(LoadBalancingStrategy.PRIORITY, manager.getSettings().getStrategy());
        assertEquals("mock-b", manager.getSettings().getDefaultProvider());
        assertEquals("mock-a", manager.getSettings().getFallbackProvider());
        assertTrue(manager.getSettings().isCostOptimization());
        assertEquals(12.5, manager.getSettings().getMaxCostPerRequestCents());
        assertEquals("mock-b", manager.selectProvider(request("hi")).getName());
    }
    
    @Test
    void unknownDefaultProviderIsConfigurationError() {
        properties.setDefaultProvider("nowhere");
        
        assertThrows(LlmConfigurationException.class, factory::createManager);
    }
    
    @Test
    void unknownStrategyIsConfigurationError() {
        properties.getLoadBalancing().setStrategy("random");
        
        assertThrows(LlmConfigurationException.class, factory::createManager);
    }
    
    @Test
    void vendorWithoutApiKeyIsSkippedAndItsRoleCleared() {
        properties.getProviders().add(ProviderConfig.builder()
            .name("openai").type(ProviderType.OPENAI).apiKey(" ").priority(0).build());
        properties.setDefaultProvider("openai");
        
        LlmProviderManager manager = factory.createManager();
        
        assertTrue(manager.getProvider("openai").isEmpty());
        assertNull(manager.getSettings().getDefaultProvider());
        assertEquals(2, manager.listProviders().size());
    }
    
    @Test
    void mockModeRegistersOnlyMockProviders() {
        properties.getProviders().add(ProviderConfig.builder()
            .name("openai").type(ProviderType.OPENAI).apiKey("sk-live").priority(0).build());
        properties.setDefaultProvider("openai");
        properties.setSkipAiRequests(true);
        
        LlmProviderManager manager = factory.createManager();
        
        assertTrue(manager.getProvider("openai").isEmpty());
        assertEquals("mock-a", manager.getSettings().getDefaultProvider());
        assertEquals("mock-a", manager.getSettings().getFallbackProvider());
        GenerationResponse response = manager.generate(request("Please improve this prompt:\n\n\"write tests\"",
            AiOperation.PROMPT_IMPROVE));
        assertTrue(response.isSuccess());
        assertEquals(0.0, response.getUsage().getCostCents());
    }
    
    @Test
    void createsProviderForEachType() {
        ProviderExecutor executor = new ProviderExecutor(RetrySettings.DEFAULT);
        
        assertInstanceOf(OpenAiProvider.class, factory.createProvider(
            ProviderConfig.builder().name("o").type(ProviderType.OPENAI).apiKey("k").build(), executor));
        assertInstanceOf(AnthropicProvider.class, factory.createProvider(
            ProviderConfig.builder().name("a").type(ProviderType.ANTHROPIC).apiKey("k").build(), executor));
        assertInstanceOf(MockProvider.class, factory.createProvider(
            ProviderConfig.builder().name("m").type(ProviderType.MOCK).build(), executor));
    }
    
    @Test
    void createManagerBuildsIndependentInstances() {
        assertNotSame(factory.createManager(), factory.createManager());
    }
    
    @Test
    void concurrentCallersShareOneManager() throws Exception {
        int threads = 16;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<LlmProviderManager>> futures = new ArrayList<>();
        Callable<LlmProviderManager> task = () -> {
            start.await();
            return factory.getManager();
        };
        for (int i = 0; i < threads; i++) {
            futures.add(pool.submit(task));
        }
        start.countDown();
        
        Set<LlmProviderManager> instances = ConcurrentHashMap.newKeySet();
        for (Future<LlmProviderManager> future : futures) {
            instances.add(future.get());
        }
        pool.shutdown();
        
        assertEquals(1, instances.size());
        assertSame(factory.getManager(), instances.iterator().next());
    }
}
