package com.tradeledger.ingestion.job;

import com.tradeledger.costbasis.engine.LedgerEventApplier;
import com.tradeledger.costbasis.store.CommitOutcome;
import com.tradeledger.costbasis.store.LedgerPersistenceException;
import com.tradeledger.domain.DomainEvent;
import com.tradeledger.ingestion.parser.EventParseException;
import com.tradeledger.ingestion.parser.EventParser;
import com.tradeledger.ingestion.parser.EventUidGenerator;
import com.tradeledger.ingestion.source.RawEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Applies one page of raw events to the ledger in chain order (block number, then event index).
 * A malformed event is logged and skipped; a persistence failure aborts the page and propagates
 * as a {@link PartialPageException} carrying what was committed before it.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PageProcessor {

    private final EventParser eventParser;
    private final EventUidGenerator eventUidGenerator;
    private final LedgerEventApplier ledgerEventApplier;

    public PageResult process(List<RawEvent> events) {
        return process(events, uid -> false, uid -> { });
    }

    /**
     * @param alreadySeen uids to skip without touching the ledger
     * @param settled     called with each uid once it is applied, found duplicate, skipped as malformed or ignored
     */
    public PageResult process(List<RawEvent> events, Predicate<String> alreadySeen, Consumer<String> settled) {
        List<RawEvent> ordered = new ArrayList<>(events);
        ordered.sort(RawEvent.CHAIN_ORDER);

        int applied = 0;
        int duplicates = 0;
        int malformed = 0;
        int ignored = 0;
        int seen = 0;
        for (RawEvent raw : ordered) {
            String uid = eventUidGenerator.uidOf(raw);
            if (alreadySeen.test(uid)) {
                seen++;
                continue;
            }
            if (!eventParser.supports(raw)) {
                log.debug("Ignoring {} event in tx {}", raw.eventName(), raw.txId());
                ignored++;
                settled.accept(uid);
                continue;
            }
            DomainEvent event;
            try {
                event = eventParser.parse(raw);
            } catch (EventParseException e) {
                log.warn("Skipping malformed {} in tx {} (block {}, idx {}): {}",
                        raw.eventName(), raw.txId(), raw.blockNumber(), raw.eventIndex(), e.getMessage());
                malformed++;
                settled.accept(uid);
                continue;
            }
            CommitOutcome outcome;
            try {
                outcome = ledgerEventApplier.apply(event);
            } catch (LedgerPersistenceException e) {
                throw new PartialPageException("Ledger write failed at " + raw.eventName() + " block "
                        + raw.blockNumber() + " idx " + raw.eventIndex() + ": " + e.getMessage(),
                        new PageResult(events.size(), applied, duplicates, malformed, ignored, seen), e);
            }
            if (outcome == CommitOutcome.APPLIED) {
                applied++;
                log.debug("Applied {} {} token={} block={} idx={}", event.eventName(), uid, event.tokenKey(),
                        event.blockNumber(), event.eventIndex());
            } else {
                duplicates++;
            }
            settled.accept(uid);
        }
        return new PageResult(events.size(), applied, duplicates, malformed, ignored, seen);
    }
}
