package com.tradeledger.ingestion.source;

import com.tradeledger.ingestion.config.EventSourceProperties;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * TronGrid events client using WebClient. GET {base}/v1/contracts/{contract}/events, one page per call.
 */
public class WebClientEventSourceClient implements EventSourceClient {

    static final String API_KEY_HEADER = "TRON-PRO-API-KEY";
    private static final String EVENTS_PATH = "/v1/contracts/{contract}/events";

    private final WebClient webClient;
    private final EventSourceProperties properties;
    private final EventPageReader pageReader;
    private final RateLimiter rateLimiter;

    public WebClientEventSourceClient(WebClient.Builder builder,
                                      EventSourceProperties properties,
                                      EventPageReader pageReader,
                                      RateLimiter rateLimiter) {
        this.webClient = builder.baseUrl(properties.getBaseUrl())
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(properties.getMaxResponseBytes()))
                .build();
        this.properties = properties;
        this.pageReader = pageReader;
        this.rateLimiter = rateLimiter;
    }

    @Override
    public EventPage fetchPage(String contract, String cursor, EventOrder order) {
        try {
            RateLimiter.waitForPermission(rateLimiter);
        } catch (RequestNotPermitted e) {
            throw new EventSourceException("Local rate limit exhausted for event source", e);
        }
        Duration timeout = Duration.ofMillis(Math.max(1L, properties.getTimeoutMs()));
        String body = webClient.get()
                .uri(uriBuilder -> {
                    uriBuilder.path(EVENTS_PATH)
                            .queryParam("limit", properties.effectivePageSize())
                            .queryParam("only_confirmed", properties.isOnlyConfirmed())
                            .queryParam("order_by", order.queryValue());
                    if (cursor != null && !cursor.isBlank()) {
                        uriBuilder.queryParam("fingerprint", cursor);
                    }
                    return uriBuilder.build(contract);
                })
                .accept(MediaType.APPLICATION_JSON)
                .headers(headers -> {
                    if (properties.getApiKey() != null && !properties.getApiKey().isBlank()) {
                        headers.set(API_KEY_HEADER, properties.getApiKey());
                    }
                })
                .retrieve()
                .bodyToMono(String.class)
                .timeout(timeout)
                .onErrorMap(WebClientResponseException.class, e -> mapResponseError(contract, e))
                .onErrorMap(WebClientRequestException.class,
                        e -> new EventSourceException("Event source unreachable: " + e.getMessage(), e))
                .onErrorMap(DataBufferLimitException.class, WebClientEventSourceClient::pageTooLarge)
                .onErrorMap(TimeoutException.class,
                        e -> new EventSourceException("Event source timed out after " + timeout.toMillis() + " ms", e))
                .block();
        return pageReader.read(body);
    }

    private static EventSourceException pageTooLarge(DataBufferLimitException e) {
        return new EventSourceException("Event source page too large (" + e.getMessage()
                + "); raise tradeledger.ingestion.event-source.max-response-bytes", e);
    }

    private static RuntimeException mapResponseError(String contract, WebClientResponseException e) {
        if (e.getStatusCode().value() == HttpStatus.NOT_FOUND.value()) {
            return new ContractNotFoundException(contract, "Event source has no contract " + contract, e);
        }
        if (e.getCause() instanceof DataBufferLimitException tooLarge) {
            return pageTooLarge(tooLarge);
        }
        return new EventSourceException("Event source answered HTTP " + e.getStatusCode().value(), e);
    }
}
