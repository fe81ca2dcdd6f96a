package com.tradeledger.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * TronGrid-compatible event source endpoint. Documented in application.yml.
 */
@ConfigurationProperties(prefix = "tradeledger.ingestion.event-source")
@NoArgsConstructor
@Getter
@Setter
public class EventSourceProperties {

    /** Largest page the event source accepts. */
    public static final int MAX_PAGE_SIZE = 200;

    /** Base URL, without the /v1 path. */
    private String baseUrl = "https://nile.trongrid.io";

    /** Sent as TRON-PRO-API-KEY when set. */
    private String apiKey;

    /** Events per page; clamped to 1..200. */
    private int pageSize = MAX_PAGE_SIZE;

    /** Request timeout in ms. Default 20000. */
    private long timeoutMs = 20_000L;

    /** Ask only for confirmed events. */
    private boolean onlyConfirmed = true;

    /** Local client-side request budget per second. */
    private int maxRequestsPerSecond = 5;

    /** Largest response body buffered per page, in bytes. A full page of verbose events runs to a few hundred KB. */
    private int maxResponseBytes = 16 * 1024 * 1024;

    /** How long a request may wait for a rate limiter permit before failing, in ms. */
    private long limiterTimeoutMs = 5_000L;

    public int effectivePageSize() {
        return Math.max(1, Math.min(MAX_PAGE_SIZE, pageSize));
    }
}
