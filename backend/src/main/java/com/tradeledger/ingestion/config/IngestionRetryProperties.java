package com.tradeledger.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Retry policy for event source pages and tail polls (exponential backoff ± jitter). Documented in application.yml.
 */
@ConfigurationProperties(prefix = "tradeledger.ingestion.retry")
@NoArgsConstructor
@Getter
@Setter
public class IngestionRetryProperties {

    /** Base delay in ms for first retry; doubles each attempt. Default 1000. */
    private long baseDelayMs = 1000L;

    /** Jitter factor 0..1 (e.g. 0.2 = ±20%). Default 0.2. */
    private double jitterFactor = 0.2;

    /** Attempts per backfill page, including the first. Default 5. */
    private int maxAttempts = 5;

    /** Upper bound for a single backoff delay in ms. Default 60000. */
    private long maxDelayMs = 60_000L;
}
