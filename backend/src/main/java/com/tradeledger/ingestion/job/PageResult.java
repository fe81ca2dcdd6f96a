package com.tradeledger.ingestion.job;

/**
 * Per-page (or accumulated) processing counters.
 *
 * @param received    events on the page
 * @param applied     events committed to the ledger
 * @param duplicates  events whose history row already existed
 * @param malformed   supported events that failed to parse and were skipped
 * @param ignored     events with a name the ledger does not handle
 * @param alreadySeen events skipped because the tail loop had settled them before
 */
public record PageResult(int received, int applied, int duplicates, int malformed, int ignored, int alreadySeen) {

    public static final PageResult EMPTY = new PageResult(0, 0, 0, 0, 0, 0);

    public PageResult plus(PageResult other) {
        return new PageResult(
                received + other.received,
                applied + other.applied,
                duplicates + other.duplicates,
                malformed + other.malformed,
                ignored + other.ignored,
                alreadySeen + other.alreadySeen);
    }

    /**
     * Reclassifies up to {@code committedEarlier} duplicates as applied: events a failed attempt of the same page
     * committed before it broke off, which the retry then found already materialized.
     */
    public PageResult withEarlierCommits(int committedEarlier) {
        int moved = Math.min(committedEarlier, duplicates);
        return new PageResult(received, applied + moved, duplicates - moved, malformed, ignored, alreadySeen);
    }

    /** Events newly settled by this run: everything except the ones skipped as already seen. */
    public int settled() {
        return applied + duplicates + malformed + ignored;
    }
}
