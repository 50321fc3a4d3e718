package com.promptcraft.llm.provider.support;

import com.promptcraft.llm.model.GenerationRequest;
import com.promptcraft.llm.model.GenerationResponse;
import com.promptcraft.llm.model.HealthStatus;
import com.promptcraft.llm.model.ProviderConfig;
import com.promptcraft.llm.provider.ProviderErrorType;
import com.promptcraft.llm.provider.ProviderException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static com.promptcraft.llm.LlmTestFixtures.mockConfig;
import static com.promptcraft.llm.LlmTestFixtures.model;
import static com.promptcraft.llm.LlmTestFixtures.request;
import static org.junit.jupiter.api.Assertions.*;

class ProviderExecutorTest {
    
    private ProviderExecutor executor;
    private ProviderConfig config;
    
    @BeforeEach
    void setUp() {
        executor = new ProviderExecutor(new RetrySettings(Duration.ofMillis(1), Duration.ofMillis(5)));
        config = mockConfig("vendor-a", 1, model("small", 0.15, 0.6), model("large", 2.5, 10));
        config.setMaxRetries(3);
    }
    
    @Test
    void successIsPricedFromTheServingModel() {
        GenerationResponse response = executor.execute(config, request("hello"), "small",
            (m, timeout) -> result("hi", m, 1000, 2000));
        
        assertTrue(response.isSuccess());
        assertEquals("vendor-a", response.getProvider());
        assertEquals("small", response.getModel());
        assertEquals(3000, response.getUsage().getTotalTokens());
        assertEquals(1.35, response.getUsage().getCostCents(), 1e-9);
        assertNull(response.getWarning());
    }
    
    @Test
    void retriesRetryableFailuresUntilSuccess() {
        AtomicInteger calls = new AtomicInteger();
        
        GenerationResponse response = executor.execute(config, request("hello"), "small", (m, timeout) -> {
            if (calls.incrementAndGet() < 3) {
                throw new ProviderException("Rate limit exceeded", "vendor-a", ProviderErrorType.RATE_LIMITED, 429);
            }
            return result("ok", m, 10, 10);
        });
        
        assertTrue(response.isSuccess());
        assertEquals(3, calls.get());
    }
    
    @Test
    void stopsAfterRetryBudgetIsExhausted() {
        AtomicInteger calls = new AtomicInteger();
        config.setMaxRetries(2);
        
        GenerationResponse response = executor.execute(config, request("hello"), "small", (m, timeout) -> {
            calls.incrementAndGet();
            throw new ProviderException("OpenAI service unavailable", "vendor-a", ProviderErrorType.PROVIDER_UNAVAILABLE, 503);
        });
        
        assertFalse(response.isSuccess());
        assertEquals(3, calls.get());
        assertEquals(ProviderErrorType.PROVIDER_UNAVAILABLE, response.getErrorType());
        assertEquals("OpenAI service unavailable", response.getError());
        assertEquals(0.0, response.getUsage().getCostCents());
    }
    
    @Test
    void doesNotRetryAuthenticationFailures() {
        AtomicInteger calls = new AtomicInteger();
        
        GenerationResponse response = executor.execute(config, request("hello"), "small", (m, timeout) -> {
            calls.incrementAndGet();
            throw new ProviderException("Invalid API key", "vendor-a", ProviderErrorType.AUTHENTICATION, 401);
        });
        
        assertFalse(response.isSuccess());
        assertEquals(1, calls.get());
        assertEquals(ProviderErrorType.AUTHENTICATION, response.getErrorType());
        assertEquals("Invalid API key", response.getError());
    }
    
    @Test
    void slowCallIsCutOffAtTheConfiguredTimeout() {
        config.setMaxRetries(0);
        config.setTimeout(Duration.ofMillis(100));
        long start = System.currentTimeMillis();
        
        GenerationResponse response = executor.execute(config, request("hello"), "small", (m, timeout) -> {
            try {
                Thread.sleep(2000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return result("late", m, 1, 1);
        });
        
        long elapsed = System.currentTimeMillis() - start;
        assertFalse(response.isSuccess());
        assertEquals(ProviderErrorType.TIMEOUT, response.getErrorType());
        assertTrue(elapsed < 1500, "should not wait for the slow call, took " + elapsed + "ms");
    }
    
    @Test
    void rejectsEmptyUserPromptWithoutCallingVendor() {
        AtomicInteger calls = new AtomicInteger();
        GenerationRequest blank = request("   ");
        
        GenerationResponse response = executor.execute(config, blank, "small", (m, timeout) -> {
            calls.incrementAndGet();
            return result("x", m, 1, 1);
        });
        
        assertFalse(response.isSuccess());
        assertEquals(ProviderErrorType.INVALID_REQUEST, response.getErrorType());
        assertEquals(0, calls.get());
    }
    
    @Test
    void unknownModelIsPricedAtCheapestRatesWithWarning() {
        GenerationResponse response = executor.execute(config, request("hello"), "mystery",
            (m, timeout) -> result("hi", m, 1000, 1000));
        
        assertTrue(response.isSuccess());
        assertEquals(0.75, response.getUsage().getCostCents(), 1e-9);
        assertNotNull(response.getWarning());
        assertTrue(response.getWarning().contains("mystery"));
    }
    
    @Test
    void nonBillableResultCostsNothing() {
        GenerationResponse response = executor.execute(config, request("hello"), "large", (m, timeout) ->
            VendorResult.builder().content("free").model(m).inputTokens(500).outputTokens(500).billable(false).build());
        
        assertTrue(response.isSuccess());
        assertEquals(0.0, response.getUsage().getCostCents());
        assertEquals(1000, response.getUsage().getTotalTokens());
    }
    
    @Test
    void missingTokenCountsAreEstimatedFromText() {
        GenerationResponse response = executor.execute(config, request("abcdefgh"), "small", (m, timeout) ->
            VendorResult.builder().content("12345678").model(m).build());
        
        assertTrue(response.isSuccess());
        // "You are a helpful assistant." is 28 chars -> 7 tokens, "abcdefgh" -> 2 tokens
        assertEquals(9, response.getUsage().getInputTokens());
        assertEquals(2, response.getUsage().getOutputTokens());
    }
    
    @Test
    void unusablePricingBecomesFailedResponse() {
        ProviderConfig broken = mockConfig("vendor-b", 1, model("odd", -1.0, 0.5));
        broken.setMaxRetries(2);
        AtomicInteger calls = new AtomicInteger();
        
        GenerationResponse response = executor.execute(broken, request("hello"), "odd", (m, timeout) -> {
            calls.incrementAndGet();
            return result("hi", m, 1000, 10);
        });
        
        assertFalse(response.isSuccess());
        assertEquals(ProviderErrorType.INVALID_REQUEST, response.getErrorType());
        assertEquals(0, response.getUsage().getTotalTokens());
        assertEquals(1, calls.get());
    }
    
    @Test
    void unexpectedRuntimeErrorBecomesUnavailable() {
        config.setMaxRetries(0);
        
        GenerationResponse response = executor.execute(config, request("hello"), "small", (m, timeout) -> {
            throw new IllegalStateException("boom");
        });
        
        assertFalse(response.isSuccess());
        assertEquals(ProviderErrorType.PROVIDER_UNAVAILABLE, response.getErrorType());
        assertFalse(response.getError().contains("boom"));
    }
    
    @Test
    void probeMakesSingleAttempt() {
        AtomicInteger calls = new AtomicInteger();
        
        HealthStatus status = executor.probe(config, HealthProbe.REQUEST, "small", (m, timeout) -> {
            calls.incrementAndGet();
            throw new ProviderException("Request timeout", "vendor-a", ProviderErrorType.TIMEOUT, 408);
        });
        
        assertFalse(status.isHealthy());
        assertEquals("vendor-a", status.getProvider());
        assertEquals("Request timeout", status.getError());
        assertEquals(1, calls.get());
        assertNotNull(status.getLastChecked());
    }
    
    @Test
    void backoffDoublesAndIsCapped() {
        RetrySettings settings = new RetrySettings(Duration.ofMillis(500), Duration.ofSeconds(3));
        
        assertEquals(500, settings.backoffMillis(0));
        assertEquals(1000, settings.backoffMillis(1));
        assertEquals(2000, settings.backoffMillis(2));
        assertEquals(3000, settings.backoffMillis(3));
        assertEquals(3000, settings.backoffMillis(40));
    }
    
    private static VendorResult result(String content, String model, int in, int out) {
        return VendorResult.builder().content(content).model(model).inputTokens(in).outputTokens(out).build();
    }
}
