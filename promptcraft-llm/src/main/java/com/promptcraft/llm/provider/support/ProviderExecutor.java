package com.promptcraft.llm.provider.support;

import com.promptcraft.common.util.TokenCounter;
import com.promptcraft.llm.model.GenerationRequest;
import com.promptcraft.llm.model.GenerationResponse;
import com.promptcraft.llm.model.HealthStatus;
import com.promptcraft.llm.model.ProviderConfig;
import com.promptcraft.llm.model.TokenUsage;
import com.promptcraft.llm.provider.ProviderErrorType;
import com.promptcraft.llm.provider.ProviderException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared attempt machinery for every provider: per-attempt timeout, retry with
 * exponential backoff, latency measurement, cost computation and error normalization.
 *
 * <p>Providers hand each vendor attempt to this helper as a {@link VendorCall}; whatever
 * happens, the caller gets back a well-formed {@link GenerationResponse}.
 */
@Slf4j
public class ProviderExecutor {
    
    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();
    
    private final ExecutorService workers;
    private final RetrySettings retrySettings;
    private final PricingCalculator pricingCalculator;
    
    public ProviderExecutor(RetrySettings retrySettings) {
        this(retrySettings, new PricingCalculator());
    }
    
    public ProviderExecutor(RetrySettings retrySettings, PricingCalculator pricingCalculator) {
        this.retrySettings = retrySettings != null ? retrySettings : RetrySettings.DEFAULT;
        this.pricingCalculator = pricingCalculator;
        this.workers = Executors.newCachedThreadPool(daemonThreads("llm-attempt-"));
    }
    
    /**
     * Runs the call with the provider's retry budget. Retryable failures (timeout, rate limit,
     * unavailable) are retried up to {@code maxRetries} times; others fail immediately.
     */
    public GenerationResponse execute(ProviderConfig config, GenerationRequest request, String model,
                                      VendorCall call) {
        return run(config, request, model, call, Math.max(0, config.getMaxRetries()));
    }
    
    /**
     * Single attempt with no retries, reported as a health status.
     */
    public HealthStatus probe(ProviderConfig config, GenerationRequest probeRequest, String model,
                              VendorCall call) {
        GenerationResponse response = run(config, probeRequest, model, call, 0);
        if (response.isSuccess()) {
            return HealthStatus.healthy(config.getName(), response.getResponseTimeMs());
        }
        log.warn("[EXECUTOR] Health probe failed | provider={} | durationMs={} | error={}",
            config.getName(), response.getResponseTimeMs(), response.getError());
        return HealthStatus.unhealthy(config.getName(), response.getResponseTimeMs(), response.getError());
    }
    
    private GenerationResponse run(ProviderConfig config, GenerationRequest request, String model,
                                   VendorCall call, int maxRetries) {
        long startTime = System.currentTimeMillis();
        String provider = config.getName();
        
        if (request == null || !request.hasUserPrompt()) {
            log.warn("[EXECUTOR] Rejected request without user prompt | provider={}", provider);
            return GenerationResponse.failure(provider, model, ProviderErrorType.INVALID_REQUEST,
                "User prompt must not be empty", TokenUsage.empty(), 0);
        }
        
        Duration timeout = config.effectiveTimeout();
        ProviderException lastError = null;
        int attempts = 0;
        
        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            if (attempt > 0) {
                long waitMs = retrySettings.backoffMillis(attempt - 1);
                log.info("[EXECUTOR] Backing off before retry | provider={} | attempt={}/{} | waitMs={}",
                    provider, attempt + 1, maxRetries + 1, waitMs);
                if (!sleep(waitMs)) {
                    break;
                }
            }
            attempts++;
            
            try {
                VendorResult result = attemptWithTimeout(provider, model, timeout, call);
                GenerationResponse response = completeSuccess(config, request, model, result,
                    System.currentTimeMillis() - startTime);
                logRequest(request, response, attempts);
                return response;
            } catch (ProviderException e) {
                lastError = e;
                log.warn("[EXECUTOR] Attempt failed | provider={} | attempt={}/{} | type={} | statusCode={} | retryable={} | error={}",
                    provider, attempt + 1, maxRetries + 1, e.getErrorType(), e.getStatusCode(),
                    e.isRetryable(), e.getMessage());
                if (!e.isRetryable()) {
                    break;
                }
            }
        }
        
        long duration = System.currentTimeMillis() - startTime;
        ProviderErrorType type = lastError != null ? lastError.getErrorType() : ProviderErrorType.TIMEOUT;
        String message = lastError != null ? lastError.getMessage() : "Request interrupted";
        GenerationResponse response = GenerationResponse.failure(provider, model, type, message,
            TokenUsage.empty(), duration);
        logRequest(request, response, attempts);
        return response;
    }
    
    private VendorResult attemptWithTimeout(String provider, String model, Duration timeout, VendorCall call)
            throws ProviderException {
        Future<VendorResult> future = workers.submit(() -> call.call(model, timeout));
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ProviderException("Request timeout after " + timeout.toMillis() + "ms",
                provider, ProviderErrorType.TIMEOUT, 408, e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ProviderException("Request interrupted", provider, ProviderErrorType.TIMEOUT, 0, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ProviderException) {
                throw (ProviderException) cause;
            }
            log.error("[EXECUTOR] Unexpected provider failure | provider={} | model={}", provider, model, cause);
            throw new ProviderException("Unexpected provider failure", provider,
                ProviderErrorType.PROVIDER_UNAVAILABLE, 500, cause);
        }
    }
    
    private GenerationResponse completeSuccess(ProviderConfig config, GenerationRequest request, String model,
                                               VendorResult result, long durationMs) throws ProviderException {
        try {
            return toSuccess(config, request, model, result, durationMs);
        } catch (RuntimeException e) {
            log.error("[EXECUTOR] Could not build response from vendor result | provider={} | model={}",
                config.getName(), model, e);
            throw new ProviderException("Malformed vendor response", config.getName(),
                ProviderErrorType.INVALID_REQUEST, 0, e);
        }
    }
    
    private GenerationResponse toSuccess(ProviderConfig config, GenerationRequest request, String requestedModel,
                                         VendorResult result, long durationMs) {
        String usedModel = result.getModel() != null && !result.getModel().isBlank()
            ? result.getModel() : requestedModel;
        String content = result.getContent() != null ? result.getContent() : "";
        // negative vendor counts are treated as missing
        int inputTokens = isValidCount(result.getInputTokens())
            ? result.getInputTokens()
            : TokenCounter.countTokens(request.getSystemPrompt(), request.getUserPrompt());
        int outputTokens = isValidCount(result.getOutputTokens())
            ? result.getOutputTokens()
            : TokenCounter.countTokens(content);
        
        if (!result.isBillable()) {
            return GenerationResponse.success(content, TokenUsage.of(inputTokens, outputTokens, 0.0),
                config.getName(), usedModel, durationMs);
        }
        
        PricingCalculator.Quote quote = pricingCalculator.quote(config, usedModel, inputTokens, outputTokens);
        GenerationResponse response = GenerationResponse.success(content,
            TokenUsage.of(inputTokens, outputTokens, quote.getCostCents()),
            config.getName(), usedModel, durationMs);
        return quote.isFallback() ? response.withWarning(quote.describeFallback(usedModel)) : response;
    }
    
    private static boolean isValidCount(Integer tokens) {
        return tokens != null && tokens >= 0;
    }
    
    private void logRequest(GenerationRequest request, GenerationResponse response, int attempts) {
        log.info("[EXECUTOR] Request completed | provider={} | operation={} | model={} | inputTokens={} | outputTokens={} | costCents={} | durationMs={} | attempts={} | success={}",
            response.getProvider(),
            request != null ? request.getOperation() : null,
            response.getModel(),
            response.getUsage().getInputTokens(),
            response.getUsage().getOutputTokens(),
            response.getUsage().getCostCents(),
            response.getResponseTimeMs(),
            attempts,
            response.isSuccess());
    }
    
    private boolean sleep(long ms) {
        try {
            Thread.sleep(ms);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
    
    private static ThreadFactory daemonThreads(String prefix) {
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + THREAD_COUNTER.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
