package com.tradeledger.ingestion.job;

/**
 * A backfill page kept failing after all retry attempts, or the run was interrupted.
 * Events applied before the failing page stay committed; a rerun resumes idempotently.
 */
public class BackfillAbortedException extends RuntimeException {

    private final int pagesCompleted;

    public BackfillAbortedException(String message, int pagesCompleted, Throwable cause) {
        super(message, cause);
        this.pagesCompleted = pagesCompleted;
    }

    public int getPagesCompleted() {
        return pagesCompleted;
    }
}
