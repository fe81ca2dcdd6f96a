package com.tradeledger.ingestion.job;

import com.tradeledger.common.RetryPolicy;
import com.tradeledger.config.LedgerProperties;
import com.tradeledger.costbasis.store.LedgerPersistenceException;
import com.tradeledger.ingestion.source.EventOrder;
import com.tradeledger.ingestion.source.EventPage;
import com.tradeledger.ingestion.source.EventSourceClient;
import com.tradeledger.ingestion.source.EventSourceException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * One-shot backfill: walks the contract's event history page by page, following cursors until none is returned.
 * A failing page is retried with backoff; after the last attempt the run aborts. Reruns are idempotent.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BackfillRunner {

    private record ProcessedPage(EventPage page, PageResult result) {}

    private final EventSourceClient eventSourceClient;
    private final PageProcessor pageProcessor;
    private final LedgerProperties ledgerProperties;
    private final RetryPolicy ingestionRetryPolicy;

    /**
     * @throws BackfillAbortedException when a page keeps failing or the thread is interrupted
     * @throws com.tradeledger.ingestion.source.ContractNotFoundException when the contract is unknown to the source
     */
    public BackfillSummary run() {
        String contract = ledgerProperties.getContract();
        log.info("Backfill of {} started", contract);
        String cursor = null;
        int pages = 0;
        PageResult totals = PageResult.EMPTY;
        while (true) {
            ProcessedPage processed = fetchAndProcess(contract, cursor, pages);
            pages++;
            totals = totals.plus(processed.result());
            PageResult r = processed.result();
            log.info("Backfill page {}: {} event(s), {} applied, {} duplicate, {} malformed, {} ignored",
                    pages, r.received(), r.applied(), r.duplicates(), r.malformed(), r.ignored());
            String next = processed.page().nextCursor();
            if (next == null) {
                break;
            }
            if (next.equals(cursor)) {
                log.warn("Event source repeated cursor {}; stopping backfill", next);
                break;
            }
            cursor = next;
        }
        BackfillSummary summary = new BackfillSummary(contract, pages, totals);
        log.info(summary.describe());
        return summary;
    }

    private ProcessedPage fetchAndProcess(String contract, String cursor, int pagesCompleted) {
        int maxAttempts = ingestionRetryPolicy.getMaxAttempts();
        RuntimeException lastFailure = null;
        int committedEarlier = 0;
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            try {
                EventPage page = eventSourceClient.fetchPage(contract, cursor, EventOrder.OLDEST_FIRST);
                PageResult result = pageProcessor.process(page.events());
                return new ProcessedPage(page, result.withEarlierCommits(committedEarlier));
            } catch (EventSourceException | LedgerPersistenceException e) {
                lastFailure = e;
                if (e instanceof PartialPageException partial) {
                    committedEarlier += partial.getCompleted().applied();
                }
                if (attempt + 1 >= maxAttempts) {
                    break;
                }
                long delayMs = ingestionRetryPolicy.delayMs(attempt);
                log.warn("Backfill page {} failed (attempt {}/{}), retrying in {} ms: {}",
                        pagesCompleted + 1, attempt + 1, maxAttempts, delayMs, e.getMessage());
                try {
                    Thread.sleep(delayMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new BackfillAbortedException("Backfill interrupted while retrying page " + (pagesCompleted + 1),
                            pagesCompleted, ie);
                }
            }
        }
        throw new BackfillAbortedException("Backfill page " + (pagesCompleted + 1) + " failed after " + maxAttempts
                + " attempt(s) at cursor " + cursor + ": " + lastFailure.getMessage(), pagesCompleted, lastFailure);
    }
}
