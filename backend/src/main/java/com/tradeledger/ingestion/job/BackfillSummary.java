package com.tradeledger.ingestion.job;

/**
 * Outcome of a completed backfill.
 */
public record BackfillSummary(String contract, int pages, PageResult totals) {

    public String describe() {
        return String.format("Backfill of %s complete: %d page(s), %d event(s), %d applied, %d duplicate, %d malformed, %d ignored",
                contract, pages, totals.received(), totals.applied(), totals.duplicates(), totals.malformed(), totals.ignored());
    }
}
