package com.tradeledger.ingestion.job;

import com.github.benmanes.caffeine.cache.Cache;
import com.tradeledger.common.RetryPolicy;
import com.tradeledger.config.LedgerProperties;
import com.tradeledger.ingestion.source.ContractNotFoundException;
import com.tradeledger.ingestion.source.EventOrder;
import com.tradeledger.ingestion.source.EventPage;
import com.tradeledger.ingestion.source.EventSourceClient;
import com.tradeledger.notification.Alert;
import com.tradeledger.notification.AlertNotifier;
import com.tradeledger.notification.AlertSeverity;
import com.tradeledger.notification.AlertType;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Live mode: polls the newest page at a fixed interval and applies events not seen before.
 * Poll failures are logged and retried with backoff; the loop runs until {@link #stop()} or interruption.
 * The seen-uid cache only short-circuits work; correctness still rests on history dedup.
 */
@Component
@Slf4j
public class TailRunner {

    private final EventSourceClient eventSourceClient;
    private final PageProcessor pageProcessor;
    private final LedgerProperties ledgerProperties;
    private final RetryPolicy ingestionRetryPolicy;
    private final AlertNotifier alertNotifier;
    private final Cache<String, Boolean> seenEventUids;

    private volatile boolean stopRequested;
    private volatile Thread loopThread;

    public TailRunner(EventSourceClient eventSourceClient,
                      PageProcessor pageProcessor,
                      LedgerProperties ledgerProperties,
                      RetryPolicy ingestionRetryPolicy,
                      AlertNotifier alertNotifier,
                      @Qualifier("seenEventUidCache") Cache<String, Boolean> seenEventUids) {
        this.eventSourceClient = eventSourceClient;
        this.pageProcessor = pageProcessor;
        this.ledgerProperties = ledgerProperties;
        this.ingestionRetryPolicy = ingestionRetryPolicy;
        this.alertNotifier = alertNotifier;
        this.seenEventUids = seenEventUids;
    }

    /**
     * Blocks the calling thread until stopped.
     *
     * @throws ContractNotFoundException when the contract is unknown to the source
     */
    public void run(Duration pollInterval) {
        long intervalMs = Math.max(0L, pollInterval.toMillis());
        String contract = ledgerProperties.getContract();
        loopThread = Thread.currentThread();
        log.info("Tailing {} every {} ms", contract, intervalMs);
        int consecutiveFailures = 0;
        try {
            while (!stopRequested && !Thread.currentThread().isInterrupted()) {
                long delayMs = intervalMs;
                try {
                    PageResult result = pollOnce();
                    if (consecutiveFailures > 0) {
                        log.info("Tail recovered after {} failed poll(s)", consecutiveFailures);
                    }
                    consecutiveFailures = 0;
                    if (result.settled() > 0) {
                        log.info("Tail: {} new event(s), {} applied, {} duplicate, {} malformed, {} ignored",
                                result.settled(), result.applied(), result.duplicates(), result.malformed(), result.ignored());
                    }
                } catch (ContractNotFoundException e) {
                    throw e;
                } catch (RuntimeException e) {
                    consecutiveFailures++;
                    delayMs = Math.max(intervalMs, ingestionRetryPolicy.delayMs(consecutiveFailures - 1));
                    log.warn("Tail poll failed ({} in a row), next poll in {} ms: {}", consecutiveFailures, delayMs,
                            e.getMessage(), e);
                    if (consecutiveFailures == ingestionRetryPolicy.getMaxAttempts()) {
                        raiseStalled(contract, consecutiveFailures, e);
                    }
                }
                if (!pause(delayMs)) {
                    break;
                }
            }
        } finally {
            loopThread = null;
        }
        log.info("Tail of {} stopped", contract);
    }

    /** One poll of the newest page. */
    PageResult pollOnce() {
        EventPage page = eventSourceClient.fetchPage(ledgerProperties.getContract(), null, EventOrder.NEWEST_FIRST);
        return pageProcessor.process(page.events(),
                uid -> seenEventUids.getIfPresent(uid) != null,
                uid -> seenEventUids.put(uid, Boolean.TRUE));
    }

    @PreDestroy
    public void stop() {
        stopRequested = true;
        Thread thread = loopThread;
        if (thread != null && thread != Thread.currentThread()) {
            thread.interrupt();
        }
    }

    private boolean pause(long delayMs) {
        if (stopRequested) {
            return false;
        }
        try {
            Thread.sleep(delayMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void raiseStalled(String contract, int failures, RuntimeException cause) {
        alertNotifier.notify(Alert.builder()
                .type(AlertType.INGESTION_STALLED)
                .severity(AlertSeverity.CRITICAL)
                .title("Tail ingestion stalled")
                .message("contract=" + contract + " consecutiveFailures=" + failures + " lastError=" + cause.getMessage())
                .build());
    }
}
