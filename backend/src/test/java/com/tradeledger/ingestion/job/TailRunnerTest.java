package com.tradeledger.ingestion.job;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.tradeledger.common.RetryPolicy;
import com.tradeledger.ingestion.RawEvents;
import com.tradeledger.ingestion.source.ContractNotFoundException;
import com.tradeledger.ingestion.source.EventOrder;
import com.tradeledger.ingestion.source.EventPage;
import com.tradeledger.ingestion.source.EventSourceClient;
import com.tradeledger.ingestion.source.EventSourceException;
import com.tradeledger.ingestion.source.RawEvent;
import com.tradeledger.notification.AlertType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TailRunnerTest {

    private static final RetryPolicy NO_WAIT = new RetryPolicy(0L, 0, 3, 0L);

    private final LedgerPipelineFixture fixture = new LedgerPipelineFixture();
    private final Cache<String, Boolean> seen = Caffeine.newBuilder().maximumSize(100).build();

    @AfterEach
    void clearInterruptFlag() {
        Thread.interrupted();
    }

    @Test
    @DisplayName("events already settled by an earlier poll are skipped without touching the ledger")
    void secondPollSkipsSeen() {
        List<RawEvent> page = List.of(RawEvents.buy("t1", 1, 0, 10, 2), RawEvents.buy("t2", 2, 0, 20, 2),
                RawEvents.other("t3", 2, 1));
        TailRunner runner = runner((contract, cursor, order) -> new EventPage(page, "older"));

        PageResult first = runner.pollOnce();
        PageResult second = runner.pollOnce();

        assertThat(first.applied()).isEqualTo(2);
        assertThat(first.ignored()).isEqualTo(1);
        assertThat(second.alreadySeen()).isEqualTo(3);
        assertThat(second.settled()).isZero();
        assertThat(fixture.store.history()).hasSize(2);
        assertThat(fixture.store.positions().get(RawEvents.TOKEN_HEX).getAvgEntryPrice()).isEqualByComparingTo("15");
    }

    @Test
    @DisplayName("after the seen cache forgets an event, history dedup still prevents a second application")
    void evictedUidIsDuplicateNotReapplied() {
        List<RawEvent> page = List.of(RawEvents.buy("t1", 1, 0, 10, 2));
        TailRunner runner = runner((contract, cursor, order) -> new EventPage(page, null));

        runner.pollOnce();
        seen.invalidateAll();
        PageResult again = runner.pollOnce();

        assertThat(again.duplicates()).isEqualTo(1);
        assertThat(fixture.store.positions().get(RawEvents.TOKEN_HEX).getAmount()).isEqualByComparingTo("2");
    }

    @Test
    @DisplayName("malformed events are skipped once and remembered")
    void malformedSkippedAndRemembered() {
        ObjectNode broken = RawEvents.MAPPER.createObjectNode();
        broken.put("tokenAddress", "garbage");
        List<RawEvent> page = List.of(new RawEvent("bad", 1, null, 0, "TradeOpen", broken), RawEvents.buy("t2", 2, 0, 10, 1));
        TailRunner runner = runner((contract, cursor, order) -> new EventPage(page, null));

        PageResult first = runner.pollOnce();
        PageResult second = runner.pollOnce();

        assertThat(first.malformed()).isEqualTo(1);
        assertThat(first.applied()).isEqualTo(1);
        assertThat(second.alreadySeen()).isEqualTo(2);
    }

    @Test
    @DisplayName("events after a failed write are not marked seen and land on the next poll")
    void persistenceFailureLeavesRestUnseen() {
        List<RawEvent> page = List.of(RawEvents.buy("t1", 1, 0, 10, 1), RawEvents.buy("t2", 2, 0, 10, 1));
        TailRunner runner = runner((contract, cursor, order) -> new EventPage(page, null));
        fixture.store.failNextInserts(1);

        assertThatThrownBy(runner::pollOnce).isInstanceOf(RuntimeException.class);
        PageResult retry = runner.pollOnce();

        assertThat(retry.applied()).isEqualTo(2);
        assertThat(fixture.store.history()).hasSize(2);
    }

    @Test
    @DisplayName("a position write that failed after its history row is completed on the next poll")
    void failedPositionWriteCompletedNextPoll() {
        List<RawEvent> page = List.of(RawEvents.buy("t1", 1, 0, 10, 1), RawEvents.buy("t2", 2, 0, 20, 1));
        TailRunner runner = runner((contract, cursor, order) -> new EventPage(page, null));
        fixture.store.failPositionWrite(2);

        assertThatThrownBy(runner::pollOnce).isInstanceOf(PartialPageException.class);
        PageResult retry = runner.pollOnce();

        assertThat(retry.alreadySeen()).isEqualTo(1);
        assertThat(retry.applied()).isEqualTo(1);
        assertThat(fixture.store.positions().get(RawEvents.TOKEN_HEX).getAmount()).isEqualByComparingTo("2");
        assertThat(fixture.store.positions().get(RawEvents.TOKEN_HEX).getAvgEntryPrice()).isEqualByComparingTo("15");
    }

    @Test
    @DisplayName("loop keeps polling the newest page through failures until stopped")
    void loopSurvivesFailuresUntilStopped() {
        AtomicInteger calls = new AtomicInteger();
        AtomicReference<TailRunner> ref = new AtomicReference<>();
        List<EventOrder> orders = new ArrayList<>();
        TailRunner runner = runner((contract, cursor, order) -> {
            orders.add(order);
            int n = calls.incrementAndGet();
            if (n == 2) {
                throw new EventSourceException("HTTP 502");
            }
            if (n == 4) {
                ref.get().stop();
            }
            return new EventPage(List.of(RawEvents.buy("t" + n, n, 0, 10, 1)), null);
        });
        ref.set(runner);

        runner.run(Duration.ZERO);

        assertThat(calls.get()).isEqualTo(4);
        assertThat(orders).containsOnly(EventOrder.NEWEST_FIRST);
        assertThat(fixture.store.history()).hasSize(3);
        assertThat(fixture.alerts).isEmpty();
    }

    @Test
    @DisplayName("repeated poll failures raise a stalled alert once per streak")
    void stalledAlert() {
        AtomicInteger calls = new AtomicInteger();
        AtomicReference<TailRunner> ref = new AtomicReference<>();
        TailRunner runner = runner((contract, cursor, order) -> {
            if (calls.incrementAndGet() == 5) {
                ref.get().stop();
            }
            throw new EventSourceException("unreachable");
        });
        ref.set(runner);

        runner.run(Duration.ZERO);

        assertThat(fixture.alerts).hasSize(1);
        assertThat(fixture.alerts.get(0).getType()).isEqualTo(AlertType.INGESTION_STALLED);
    }

    @Test
    @DisplayName("unknown contract ends the loop")
    void contractNotFoundEndsLoop() {
        TailRunner runner = runner((contract, cursor, order) -> {
            throw new ContractNotFoundException(contract, "404", null);
        });

        assertThatThrownBy(() -> runner.run(Duration.ZERO)).isInstanceOf(ContractNotFoundException.class);
    }

    @Test
    @DisplayName("interrupting the loop thread stops it between polls")
    void interruptStops() throws InterruptedException {
        TailRunner runner = runner((contract, cursor, order) -> new EventPage(List.of(), null));
        Thread loop = new Thread(() -> runner.run(Duration.ofSeconds(30)));
        loop.start();

        Thread.sleep(200);
        runner.stop();
        loop.join(5_000);

        assertThat(loop.isAlive()).isFalse();
    }

    private TailRunner runner(EventSourceClient client) {
        return new TailRunner(client, fixture.pageProcessor, fixture.properties, NO_WAIT, fixture.alerts::add, seen);
    }
}
