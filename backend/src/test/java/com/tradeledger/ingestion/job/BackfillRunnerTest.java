package com.tradeledger.ingestion.job;

import com.tradeledger.common.RetryPolicy;
import com.tradeledger.costbasis.store.LedgerPersistenceException;
import com.tradeledger.domain.OpenPosition;
import com.tradeledger.ingestion.RawEvents;
import com.tradeledger.ingestion.source.ContractNotFoundException;
import com.tradeledger.ingestion.source.EventOrder;
import com.tradeledger.ingestion.source.EventPage;
import com.tradeledger.ingestion.source.EventSourceClient;
import com.tradeledger.ingestion.source.EventSourceException;
import com.tradeledger.ingestion.source.RawEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackfillRunnerTest {

    private static final RetryPolicy NO_WAIT = new RetryPolicy(0L, 0, 3, 0L);

    private final LedgerPipelineFixture fixture = new LedgerPipelineFixture();

    /** 9 buys of 1 @10, full close @12, two buys of 1 @20 and an unrelated Transfer: 13 events, 12 ledger rows. */
    private static List<RawEvent> feed() {
        List<RawEvent> events = new ArrayList<>();
        for (int block = 1; block <= 9; block++) {
            events.add(RawEvents.buy("buy-" + block, block, 0, 10, 1));
        }
        events.add(RawEvents.close("close-10", 10, 0, 12));
        events.add(RawEvents.buy("buy-11", 11, 0, 20, 1));
        events.add(RawEvents.buy("buy-12", 12, 0, 20, 1));
        events.add(RawEvents.other("transfer-12", 12, 1));
        return events;
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 2, 5, 13, 50})
    @DisplayName("every event is processed exactly once regardless of page size")
    void processesEachEventOnce(int pageSize) {
        FakeEventSourceClient source = new FakeEventSourceClient(feed(), pageSize);

        BackfillSummary summary = runner(source).run();

        assertThat(summary.pages()).isEqualTo((13 + pageSize - 1) / pageSize);
        assertThat(summary.totals().received()).isEqualTo(13);
        assertThat(summary.totals().applied()).isEqualTo(12);
        assertThat(summary.totals().ignored()).isEqualTo(1);
        assertThat(summary.totals().duplicates()).isZero();
        assertThat(fixture.store.history()).hasSize(12);
        assertFinalLedger();
    }

    @Test
    @DisplayName("second backfill over the same feed is all duplicates and leaves the ledger unchanged")
    void rerunIsIdempotent() {
        runner(new FakeEventSourceClient(feed(), 4)).run();

        BackfillSummary second = runner(new FakeEventSourceClient(feed(), 3)).run();

        assertThat(second.totals().applied()).isZero();
        assertThat(second.totals().duplicates()).isEqualTo(12);
        assertThat(fixture.store.history()).hasSize(12);
        assertFinalLedger();
    }

    @Test
    @DisplayName("a failing page is retried at the same cursor")
    void transientFailureRetriedAtSameCursor() {
        FakeEventSourceClient source = new FakeEventSourceClient(feed(), 5);
        source.failOn("fp-5", new EventSourceException("HTTP 503"), new EventSourceException("timeout"));

        BackfillSummary summary = runner(source).run();

        assertThat(source.requestedCursors).containsExactly(null, "fp-5", "fp-5", "fp-5", "fp-10");
        assertThat(summary.totals().applied()).isEqualTo(12);
        assertFinalLedger();
    }

    @Test
    @DisplayName("persistence failure retries the page without double-applying")
    void persistenceFailureRetried() {
        FakeEventSourceClient source = new FakeEventSourceClient(feed(), 13);
        fixture.store.failNextInserts(1);

        BackfillSummary summary = runner(source).run();

        assertThat(source.requestedCursors).containsExactly(null, null);
        assertThat(fixture.store.history()).hasSize(12);
        assertFinalLedger();
        assertThat(summary.totals().applied()).isEqualTo(12);
    }

    @Test
    @DisplayName("position write failing after its history row went in is replayed on the page retry")
    void failedPositionWriteReplayedFromHistory() {
        List<RawEvent> events = List.of(
                RawEvents.buy("buy-a", 1, 0, 10, 1),
                RawEvents.buy("buy-b", 2, 0, 20, 1));
        FakeEventSourceClient source = new FakeEventSourceClient(events, 10);
        fixture.store.failPositionWrite(2);

        BackfillSummary summary = runner(source).run();

        assertThat(source.requestedCursors).containsExactly(null, null);
        OpenPosition position = fixture.store.positions().get(RawEvents.TOKEN_HEX);
        assertThat(position.getAmount()).isEqualByComparingTo("2");
        assertThat(position.getAvgEntryPrice()).isEqualByComparingTo("15");
        assertThat(fixture.store.history()).hasSize(2)
                .allSatisfy(h -> assertThat(h.positionWritePending()).isFalse());
        assertThat(summary.totals().applied()).isEqualTo(2);
        assertThat(summary.totals().duplicates()).isZero();
    }

    @Test
    @DisplayName("failed delete on a full close is replayed and the position does not come back")
    void failedDeleteReplayedFromHistory() {
        FakeEventSourceClient source = new FakeEventSourceClient(feed(), 5);
        // writes 1-9 are the buys, the 10th is the delete for close-10
        fixture.store.failPositionWrite(10);

        BackfillSummary summary = runner(source).run();

        assertFinalLedger();
        assertThat(fixture.store.history()).hasSize(12);
        assertThat(summary.totals().applied()).isEqualTo(12);
        assertThat(summary.totals().duplicates()).isZero();
    }

    @Test
    @DisplayName("page that keeps failing aborts the run; earlier pages stay committed")
    void exhaustedRetriesAbort() {
        FakeEventSourceClient source = new FakeEventSourceClient(feed(), 5);
        source.failOn("fp-5", new EventSourceException("a"), new EventSourceException("b"), new EventSourceException("c"));

        assertThatThrownBy(() -> runner(source).run())
                .isInstanceOf(BackfillAbortedException.class)
                .hasMessageContaining("fp-5")
                .satisfies(e -> assertThat(((BackfillAbortedException) e).getPagesCompleted()).isEqualTo(1));

        assertThat(fixture.store.history()).hasSize(5);
        assertThat(fixture.store.positions().get(RawEvents.TOKEN_HEX).getAmount()).isEqualByComparingTo("5");
    }

    @Test
    @DisplayName("unknown contract is not retried")
    void contractNotFoundNotRetried() {
        List<String> calls = new ArrayList<>();
        EventSourceClient source = (contract, cursor, order) -> {
            calls.add(cursor);
            throw new ContractNotFoundException(contract, "404", null);
        };

        assertThatThrownBy(() -> runner(source).run()).isInstanceOf(ContractNotFoundException.class);
        assertThat(calls).hasSize(1);
    }

    @Test
    @DisplayName("a repeated cursor ends the walk")
    void repeatedCursorStops() {
        List<String> calls = new ArrayList<>();
        EventSourceClient source = (contract, cursor, order) -> {
            calls.add(cursor);
            return new EventPage(List.of(), "stuck");
        };

        BackfillSummary summary = runner(source).run();

        assertThat(calls).containsExactly(null, "stuck");
        assertThat(summary.pages()).isEqualTo(2);
    }

    @Test
    @DisplayName("backfill walks history oldest first")
    void requestsOldestFirst() {
        List<EventOrder> orders = new ArrayList<>();
        EventSourceClient source = (contract, cursor, order) -> {
            orders.add(order);
            return new EventPage(List.of(), null);
        };

        runner(source).run();

        assertThat(orders).containsExactly(EventOrder.OLDEST_FIRST);
    }

    private BackfillRunner runner(EventSourceClient source) {
        return new BackfillRunner(source, fixture.pageProcessor, fixture.properties, NO_WAIT);
    }

    private void assertFinalLedger() {
        OpenPosition position = fixture.store.positions().get(RawEvents.TOKEN_HEX);
        assertThat(position).isNotNull();
        assertThat(position.getAmount()).isEqualByComparingTo("2");
        assertThat(position.getAvgEntryPrice()).isEqualByComparingTo("20");
        assertThat(position.getTradeIdOnchain()).isEqualTo(11L);
        assertThat(fixture.store.history())
                .filteredOn(h -> "TradeClosed".equals(h.getEventName()))
                .singleElement()
                .satisfies(h -> {
                    assertThat(h.getAmount()).isEqualByComparingTo("9");
                    assertThat(h.getPnl()).isEqualByComparingTo("18");
                });
    }
}
