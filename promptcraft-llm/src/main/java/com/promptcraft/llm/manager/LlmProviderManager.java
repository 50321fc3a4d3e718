package com.promptcraft.llm.manager;

import com.promptcraft.common.constants.AiOperation;
import com.promptcraft.common.constants.ComplexityLevel;
import com.promptcraft.common.util.TokenCounter;
import com.promptcraft.llm.exception.LlmConfigurationException;
import com.promptcraft.llm.exception.NoProviderAvailableException;
import com.promptcraft.llm.exception.NoSuitableModelException;
import com.promptcraft.llm.model.GenerationRequest;
import com.promptcraft.llm.model.GenerationResponse;
import com.promptcraft.llm.model.HealthStatus;
import com.promptcraft.llm.model.ModelConfig;
import com.promptcraft.llm.model.ProviderConfig;
import com.promptcraft.llm.model.ProviderStats;
import com.promptcraft.llm.model.TokenUsage;
import com.promptcraft.llm.provider.LlmProvider;
import com.promptcraft.llm.provider.ProviderErrorType;
import com.promptcraft.llm.provider.support.PricingCalculator;
import lombok.Getter;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Registry of providers with selection policy, single-step fallback, concurrent health
 * checking and per-provider usage statistics.
 *
 * <p>Statistics are held as immutable {@link ProviderStats} snapshots behind an
 * {@link AtomicReference} per provider and replaced by compare-and-set, so readers never
 * block writers and never see a half-applied update. Each provider invocation is recorded
 * once, after the provider's own retries have finished.
 *
 * <p>Each provider's configuration is copied when it is registered. Routing reads only
 * that copy, and configurations handed out by this class are copies as well.
 */
@Slf4j
public class LlmProviderManager {
    
    private static final AtomicInteger HEALTH_THREAD_COUNTER = new AtomicInteger();
    
    @Getter
    private final ManagerSettings settings;
    private final ProviderBuilder providerBuilder;
    
    private final Map<String, LlmProvider> providers = new ConcurrentHashMap<>();
    private final Map<String, ProviderConfig> configs = new ConcurrentHashMap<>();
    private final Map<String, AtomicReference<ProviderStats>> providerStats = new ConcurrentHashMap<>();
    private final Map<String, HealthStatus> healthStatus = new ConcurrentHashMap<>();
    
    private final AtomicInteger roundRobinIndex = new AtomicInteger(0);
    private final ExecutorService healthCheckExecutor = Executors.newCachedThreadPool(runnable -> {
        Thread thread = new Thread(runnable, "llm-health-" + HEALTH_THREAD_COUNTER.incrementAndGet());
        thread.setDaemon(true);
        return thread;
    });
    
    public LlmProviderManager(ManagerSettings settings) {
        this(settings, null);
    }
    
    public LlmProviderManager(ManagerSettings settings, ProviderBuilder providerBuilder) {
        this.settings = settings != null ? settings : ManagerSettings.builder().build();
        this.providerBuilder = providerBuilder;
    }
    
    // ===== Registry =====
    
    /**
     * Registers a provider. A provider with the same name replaces the previous entry
     * and starts with fresh statistics.
     */
    public void addProvider(LlmProvider provider) {
        String name = provider.getName();
        if (name == null || name.isBlank()) {
            throw new LlmConfigurationException("Provider name is required");
        }
        
        ProviderConfig config = provider.getConfig().copy();
        configs.put(name, config);
        LlmProvider previous = providers.put(name, provider);
        providerStats.put(name, new AtomicReference<>(ProviderStats.initial(name)));
        healthStatus.remove(name);
        
        log.info("[MANAGER] Provider {} | provider={} | priority={} | enabled={} | models={}",
            previous != null ? "replaced" : "registered",
            name, config.getPriority(), config.isEnabled(),
            config.getModels().stream().map(ModelConfig::getName).collect(Collectors.joining(",")));
    }
    
    public void addProvider(ProviderConfig config) {
        if (providerBuilder == null) {
            throw new LlmConfigurationException("No provider builder configured for provider '" + config.getName() + "'");
        }
        addProvider(providerBuilder.build(config));
    }
    
    public boolean removeProvider(String name) {
        LlmProvider removed = providers.remove(name);
        configs.remove(name);
        providerStats.remove(name);
        healthStatus.remove(name);
        if (removed != null) {
            log.info("[MANAGER] Provider removed | provider={}", name);
        }
        return removed != null;
    }
    
    public Optional<LlmProvider> getProvider(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(providers.get(name));
    }
    
    /** Copies of the enabled providers' configurations, ascending priority. */
    public List<ProviderConfig> listProviders() {
        return enabledProviders().stream().map(p -> configOf(p).copy()).toList();
    }
    
    /**
     * Checks that the configured default and fallback providers are registered and enabled.
     */
    public void validate() {
        requireEnabled("default", settings.getDefaultProvider());
        requireEnabled("fallback", settings.getFallbackProvider());
    }
    
    private void requireEnabled(String role, String name) {
        if (name == null || name.isBlank()) {
            return;
        }
        LlmProvider provider = providers.get(name);
        if (provider == null || !configOf(provider).isEnabled()) {
            throw new LlmConfigurationException(
                "Configured " + role + " provider '" + name + "' is not among the enabled providers "
                    + providers.keySet());
        }
    }
    
    // ===== Generation =====
    
    /**
     * Invokes the selected provider once and returns its response as is, failures included.
     */
    public GenerationResponse generate(GenerationRequest request) {
        Objects.requireNonNull(request, "request");
        LlmProvider provider = selectProvider(request);
        return invoke(provider, request);
    }
    
    /**
     * Like {@link #generate}, but a failed attempt is repeated once on the configured fallback
     * provider when it is enabled and differs from the primary. At most two provider attempts.
     */
    public GenerationResponse generateWithFallback(GenerationRequest request) {
        Objects.requireNonNull(request, "request");
        LlmProvider primary = selectProvider(request);
        GenerationResponse response = invoke(primary, request);
        if (response.isSuccess()) {
            return response;
        }
        
        Optional<LlmProvider> fallback = fallbackFor(primary);
        if (fallback.isEmpty()) {
            log.warn("[MANAGER] Primary provider failed, no usable fallback | provider={} | error={}",
                primary.getName(), response.getError());
            return response;
        }
        
        log.warn("[MANAGER] Primary provider failed, trying fallback | primary={} | fallback={} | errorType={} | error={}",
            primary.getName(), fallback.get().getName(), response.getErrorType(), response.getError());
        return invoke(fallback.get(), request);
    }
    
    private Optional<LlmProvider> fallbackFor(LlmProvider primary) {
        String name = settings.getFallbackProvider();
        if (name == null || name.isBlank() || name.equals(primary.getName())) {
            return Optional.empty();
        }
        LlmProvider fallback = providers.get(name);
        if (fallback == null) {
            log.error("[MANAGER] Fallback provider is not registered | fallback={}", name);
            return Optional.empty();
        }
        return configOf(fallback).isEnabled() ? Optional.of(fallback) : Optional.empty();
    }
    
    private GenerationResponse invoke(LlmProvider provider, GenerationRequest request) {
        long startTime = System.currentTimeMillis();
        GenerationResponse response;
        try {
            response = provider.generate(request);
            if (response == null) {
                response = GenerationResponse.failure(provider.getName(), request.getModel(),
                    ProviderErrorType.PROVIDER_UNAVAILABLE, "Provider returned no response",
                    TokenUsage.empty(), System.currentTimeMillis() - startTime);
            }
        } catch (RuntimeException e) {
            log.error("[MANAGER] Provider raised unexpectedly | provider={}", provider.getName(), e);
            response = GenerationResponse.failure(provider.getName(), request.getModel(),
                ProviderErrorType.PROVIDER_UNAVAILABLE, "Provider failed unexpectedly",
                TokenUsage.empty(), System.currentTimeMillis() - startTime);
        }
        recordStats(provider.getName(), response);
        return response;
    }
    
    private void recordStats(String name, GenerationResponse response) {
        AtomicReference<ProviderStats> ref = providerStats.get(name);
        if (ref == null) {
            return;
        }
        Instant now = Instant.now();
        ProviderStats updated = ref.updateAndGet(current -> current.record(
            response.isSuccess(), response.getResponseTimeMs(), response.getUsage().getCostCents(), now));
        log.debug("[MANAGER] Recorded {} | provider={} | total={} | successful={} | failed={} | avgMs={}",
            response.isSuccess() ? "success" : "failure", name, updated.getTotalRequests(),
            updated.getSuccessfulRequests(), updated.getFailedRequests(),
            String.format("%.1f", updated.getAverageResponseTime()));
    }
    
    // ===== Selection =====
    
    /**
     * Picks one provider for the request according to the configured strategy.
     *
     * @throws NoProviderAvailableException when no provider is enabled
     * @throws NoSuitableModelException when no enabled provider has a model recommended for the operation
     */
    public LlmProvider selectProvider(GenerationRequest request) {
        List<LlmProvider> enabled = enabledProviders();
        if (enabled.isEmpty()) {
            throw new NoProviderAvailableException("No enabled LLM providers are registered");
        }
        
        AiOperation operation = request.getOperation();
        List<LlmProvider> capable = enabled.stream()
            .filter(p -> configOf(p).supports(operation))
            .toList();
        if (capable.isEmpty()) {
            throw new NoSuitableModelException(operation);
        }
        
        List<LlmProvider> reachable = capable.stream()
            .filter(p -> !isKnownUnhealthy(p.getName()))
            .toList();
        if (reachable.isEmpty()) {
            log.warn("[MANAGER] All capable providers were unhealthy at last check, considering them anyway | providers={}",
                names(capable));
            reachable = capable;
        }
        
        List<Candidate> candidates = reachable.stream().map(p -> candidate(p, request)).toList();
        if (settings.isCostOptimization()) {
            candidates = withinBudget(candidates);
        }
        
        Candidate chosen = choose(candidates);
        log.debug("[MANAGER] Selected provider | strategy={} | provider={} | model={} | estimatedCostCents={} | candidates={}",
            settings.getStrategy(), chosen.getName(),
            chosen.getModel() != null ? chosen.getModel().getName() : null,
            chosen.getEstimatedCostCents(), candidates.size());
        return chosen.getProvider();
    }
    
    private Candidate choose(List<Candidate> candidates) {
        if (settings.getStrategy() == LoadBalancingStrategy.ROUND_ROBIN) {
            int index = Math.floorMod(roundRobinIndex.getAndIncrement(), candidates.size());
            return candidates.get(index);
        }
        return candidates.stream().min(comparatorFor(settings.getStrategy())).orElseThrow();
    }
    
    private Comparator<Candidate> comparatorFor(LoadBalancingStrategy strategy) {
        Comparator<Candidate> byCost = Comparator.comparingDouble(Candidate::getEstimatedCostCents);
        Comparator<Candidate> byPriority = Comparator.comparingInt(Candidate::getPriority)
            .thenComparing(Candidate::getName);
        Comparator<Candidate> tieBreak = settings.isCostOptimization() ? byCost.thenComparing(byPriority) : byPriority;
        
        if (strategy == LoadBalancingStrategy.CHEAPEST) {
            return byCost.thenComparing(byPriority);
        }
        if (strategy == LoadBalancingStrategy.FASTEST) {
            return Comparator.comparingDouble(Candidate::observedLatency).thenComparing(tieBreak);
        }
        if (strategy == LoadBalancingStrategy.LEAST_USED) {
            return Comparator.comparingLong((Candidate c) -> c.getStats().getTotalRequests()).thenComparing(tieBreak);
        }
        // PRIORITY: configured default provider first
        String defaultProvider = settings.getDefaultProvider();
        return Comparator.comparing((Candidate c) -> !c.getName().equals(defaultProvider))
            .thenComparingInt(Candidate::getPriority)
            .thenComparing(tieBreak);
    }
    
    private List<Candidate> withinBudget(List<Candidate> candidates) {
        double budget = settings.getMaxCostPerRequestCents();
        List<Candidate> affordable = candidates.stream()
            .filter(c -> c.getEstimatedCostCents() <= budget)
            .toList();
        if (affordable.isEmpty()) {
            log.warn("[MANAGER] No provider fits the per-request budget, ignoring it | budgetCents={} | providers={}",
                budget, candidates.stream().map(Candidate::getName).collect(Collectors.joining(",")));
            return candidates;
        }
        return affordable;
    }
    
    private Candidate candidate(LlmProvider provider, GenerationRequest request) {
        ProviderConfig config = configOf(provider);
        ModelConfig model = config.resolveModel(request).orElse(null);
        double cost = model == null
            ? Double.POSITIVE_INFINITY
            : PricingCalculator.cost(model,
                TokenCounter.countTokens(request.getSystemPrompt(), request.getUserPrompt()),
                request.maxTokensOr(settings.getDefaultMaxTokens()));
        return new Candidate(provider, config, model, cost, currentStats(provider.getName()));
    }
    
    /**
     * Best provider by current health and statistics, independent of any request:
     * known healthy before unknown before unhealthy, then success rate, then latency.
     */
    public ProviderConfig getBestProvider() {
        List<LlmProvider> enabled = enabledProviders();
        if (enabled.isEmpty()) {
            throw new NoProviderAvailableException("No enabled LLM providers are registered");
        }
        
        Comparator<LlmProvider> ranking = Comparator
            .comparingInt((LlmProvider p) -> healthRank(p.getName()))
            .thenComparing(Comparator.comparingDouble((LlmProvider p) -> currentStats(p.getName()).successRate()).reversed())
            .thenComparingDouble(p -> observedLatency(currentStats(p.getName())))
            .thenComparing(byPriority());
        
        return configOf(enabled.stream().min(ranking).orElseThrow()).copy();
    }
    
    /**
     * Best provider for the request's operation, with the complexity judged from the
     * estimated prompt size.
     */
    public ProviderConfig getBestProvider(GenerationRequest request) {
        Objects.requireNonNull(request, "request");
        int estimatedTokens = TokenCounter.countTokens(request.getSystemPrompt(), request.getUserPrompt());
        return getBestProvider(request.getOperation(), ComplexityLevel.fromEstimatedTokens(estimatedTokens));
    }
    
    /**
     * Best provider for an operation and complexity: providers with a model recommended for
     * the operation or rated for the complexity, cheapest first when cost optimization is on,
     * otherwise by priority. Falls back to the first available provider if none match.
     */
    public ProviderConfig getBestProvider(AiOperation operation, ComplexityLevel complexity) {
        List<LlmProvider> enabled = enabledProviders();
        if (enabled.isEmpty()) {
            throw new NoProviderAvailableException("No enabled LLM providers are registered");
        }
        List<LlmProvider> available = enabled.stream().filter(p -> !isKnownUnhealthy(p.getName())).toList();
        if (available.isEmpty()) {
            available = enabled;
        }
        
        List<LlmProvider> suitable = available.stream()
            .filter(p -> configOf(p).getModels().stream()
                .anyMatch(m -> m.isRecommendedFor(operation) || m.supportsComplexity(complexity)))
            .toList();
        if (suitable.isEmpty()) {
            return configOf(available.get(0)).copy();
        }
        
        if (settings.isCostOptimization()) {
            LlmProvider cheapest = suitable.stream()
                .min(Comparator.comparingDouble((LlmProvider p) -> configOf(p).cheapestModel()
                        .map(ModelConfig::combinedCostPer1K).orElse(Double.POSITIVE_INFINITY))
                    .thenComparing(byPriority()))
                .orElseThrow();
            return configOf(cheapest).copy();
        }
        return configOf(suitable.get(0)).copy();
    }
    
    // ===== Health =====
    
    /**
     * Probes every enabled provider concurrently. Each probe is bounded by its provider's
     * timeout, so the sweep takes as long as the slowest probe, not the sum of them.
     */
    public List<HealthStatus> checkAllProviders() {
        List<LlmProvider> targets = enabledProviders();
        long startTime = System.currentTimeMillis();
        
        List<CompletableFuture<HealthStatus>> probes = targets.stream()
            .map(this::probeAsync)
            .toList();
        
        List<HealthStatus> results = probes.stream()
            .map(CompletableFuture::join)
            .toList();
        
        for (HealthStatus status : results) {
            if (providers.containsKey(status.getProvider())) {
                healthStatus.put(status.getProvider(), status);
            }
        }
        
        log.info("[MANAGER] Health check completed | providers={} | healthy={} | durationMs={}",
            results.size(), results.stream().filter(HealthStatus::isHealthy).count(),
            System.currentTimeMillis() - startTime);
        return results;
    }
    
    private CompletableFuture<HealthStatus> probeAsync(LlmProvider provider) {
        String name = provider.getName();
        Duration timeout = configOf(provider).effectiveTimeout();
        long startTime = System.currentTimeMillis();
        
        return CompletableFuture.supplyAsync(() -> safeCheck(provider, startTime), healthCheckExecutor)
            .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
            .exceptionally(error -> {
                Throwable cause = error instanceof CompletionException && error.getCause() != null
                    ? error.getCause() : error;
                String message = cause instanceof TimeoutException
                    ? "Health check timed out after " + timeout.toMillis() + "ms"
                    : "Health check failed";
                log.warn("[MANAGER] Health probe did not complete | provider={} | error={}", name, message);
                return HealthStatus.unhealthy(name, System.currentTimeMillis() - startTime, message);
            });
    }
    
    private HealthStatus safeCheck(LlmProvider provider, long startTime) {
        try {
            HealthStatus status = provider.checkHealth();
            if (status != null) {
                return status;
            }
            return HealthStatus.unhealthy(provider.getName(), System.currentTimeMillis() - startTime,
                "Health check returned no status");
        } catch (RuntimeException e) {
            log.warn("[MANAGER] Health check raised | provider={} | error={}", provider.getName(), e.getMessage());
            return HealthStatus.unhealthy(provider.getName(), System.currentTimeMillis() - startTime,
                "Health check failed");
        }
    }
    
    /** Last probe result for the provider, if any sweep has run since it was registered. */
    public Optional<HealthStatus> getLastHealthStatus(String name) {
        return Optional.ofNullable(healthStatus.get(name));
    }
    
    // ===== Statistics =====
    
    /** Current counters of every registered provider, ascending priority. */
    public List<ProviderStats> getProviderStats() {
        return providers.values().stream()
            .sorted(byPriority())
            .map(p -> providerStats.get(p.getName()))
            .filter(Objects::nonNull)
            .map(AtomicReference::get)
            .toList();
    }
    
    // ===== Internals =====
    
    private List<LlmProvider> enabledProviders() {
        return providers.values().stream()
            .filter(p -> configOf(p).isEnabled())
            .sorted(byPriority())
            .toList();
    }
    
    private ProviderConfig configOf(LlmProvider provider) {
        ProviderConfig config = configs.get(provider.getName());
        return config != null ? config : provider.getConfig();
    }
    
    private Comparator<LlmProvider> byPriority() {
        return Comparator.comparingInt((LlmProvider p) -> configOf(p).getPriority())
            .thenComparing(LlmProvider::getName);
    }
    
    private ProviderStats currentStats(String name) {
        AtomicReference<ProviderStats> ref = providerStats.get(name);
        return ref != null ? ref.get() : ProviderStats.initial(name);
    }
    
    private boolean isKnownUnhealthy(String name) {
        HealthStatus status = healthStatus.get(name);
        return status != null && !status.isHealthy();
    }
    
    private int healthRank(String name) {
        HealthStatus status = healthStatus.get(name);
        if (status == null) return 1;
        return status.isHealthy() ? 0 : 2;
    }
    
    private static double observedLatency(ProviderStats stats) {
        return stats.getTotalRequests() == 0 ? Double.MAX_VALUE : stats.getAverageResponseTime();
    }
    
    private static String names(List<LlmProvider> providers) {
        return providers.stream().map(LlmProvider::getName).collect(Collectors.joining(","));
    }
    
    @Value
    private static class Candidate {
        LlmProvider provider;
        ProviderConfig config;
        ModelConfig model;
        double estimatedCostCents;
        ProviderStats stats;
        
        String getName() {
            return provider.getName();
        }
        
        int getPriority() {
            return config.getPriority();
        }
        
        /** Untried providers rank first so each one gets sampled. */
        double observedLatency() {
            return stats.getTotalRequests() == 0 ? 0.0 : stats.getAverageResponseTime();
        }
    }
}
