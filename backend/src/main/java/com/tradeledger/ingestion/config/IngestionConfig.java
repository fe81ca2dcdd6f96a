package com.tradeledger.ingestion.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.tradeledger.common.RetryPolicy;
import com.tradeledger.ingestion.source.EventPageReader;
import com.tradeledger.ingestion.source.EventSourceClient;
import com.tradeledger.ingestion.source.WebClientEventSourceClient;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Event source client, its rate limiter, the shared retry policy and the tail's seen-uid cache.
 */
@Configuration
@EnableConfigurationProperties({ EventSourceProperties.class, IngestionRetryProperties.class, TailProperties.class })
public class IngestionConfig {

    @Bean
    public RetryPolicy ingestionRetryPolicy(IngestionRetryProperties retryProperties) {
        return new RetryPolicy(
                retryProperties.getBaseDelayMs(),
                retryProperties.getJitterFactor(),
                retryProperties.getMaxAttempts(),
                retryProperties.getMaxDelayMs());
    }

    @Bean(name = "eventSourceRateLimiter")
    public RateLimiter eventSourceRateLimiter(EventSourceProperties properties) {
        int rps = Math.max(1, properties.getMaxRequestsPerSecond());
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(rps)
                .timeoutDuration(Duration.ofMillis(Math.max(0L, properties.getLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("event-source", config);
    }

    @Bean
    public EventSourceClient eventSourceClient(WebClient.Builder webClientBuilder,
                                               EventSourceProperties properties,
                                               EventPageReader eventPageReader,
                                               @Qualifier("eventSourceRateLimiter") RateLimiter rateLimiter) {
        return new WebClientEventSourceClient(webClientBuilder, properties, eventPageReader, rateLimiter);
    }

    /** Bounded memory of uids the tail loop has already settled. */
    @Bean(name = "seenEventUidCache")
    public Cache<String, Boolean> seenEventUidCache(TailProperties tailProperties) {
        return Caffeine.newBuilder()
                .maximumSize(Math.max(1L, tailProperties.getSeenCapacity()))
                .build();
    }
}
