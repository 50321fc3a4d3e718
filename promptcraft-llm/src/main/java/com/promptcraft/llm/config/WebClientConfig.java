package com.promptcraft.llm.config;

import com.promptcraft.llm.model.ProviderConfig;
import io.netty.channel.ChannelOption;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.List;

/**
 * Shared WebClient setup for the vendor providers. Each provider applies its own deadline
 * per request; the connector's response timeout is the largest of those deadlines.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class WebClientConfig {

    private static final int MAX_VENDOR_PAYLOAD_BYTES = 4 * 1024 * 1024;
    private static final Duration MAX_CONNECT_TIMEOUT = Duration.ofSeconds(10);

    private final LlmProperties llmProperties;

    @Bean
    public WebClient.Builder webClientBuilder() {
        Duration responseTimeout = longestProviderTimeout(llmProperties.getProviders());
        Duration connectTimeout = responseTimeout.compareTo(MAX_CONNECT_TIMEOUT) < 0 ? responseTimeout : MAX_CONNECT_TIMEOUT;
        log.info("[WEBCLIENT] Vendor connector configured | responseTimeoutMs={} | connectTimeoutMs={}",
                responseTimeout.toMillis(), connectTimeout.toMillis());

        HttpClient httpClient = HttpClient.create()
                .responseTimeout(responseTimeout)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) connectTimeout.toMillis());

        return WebClient.builder()
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(MAX_VENDOR_PAYLOAD_BYTES))
                        .build())
                .clientConnector(new ReactorClientHttpConnector(httpClient));
    }

    /** Largest effective timeout among the configured providers; the default timeout when none are configured. */
    static Duration longestProviderTimeout(List<ProviderConfig> providers) {
        Duration longest = new ProviderConfig().effectiveTimeout();
        if (providers == null || providers.isEmpty()) {
            return longest;
        }
        longest = Duration.ZERO;
        for (ProviderConfig provider : providers) {
            Duration timeout = provider.effectiveTimeout();
            if (timeout.compareTo(longest) > 0) {
                longest = timeout;
            }
        }
        return longest;
    }
}
