package com.tradeledger.ingestion.job;

import com.tradeledger.costbasis.store.LedgerPersistenceException;

/**
 * A ledger write failed part way through a page. {@link #getCompleted()} counts the events settled before the
 * failure; their rows are already committed and will read as duplicates when the page is retried.
 */
public class PartialPageException extends LedgerPersistenceException {

    private final PageResult completed;

    public PartialPageException(String message, PageResult completed, LedgerPersistenceException cause) {
        super(message, cause);
        this.completed = completed;
    }

    public PageResult getCompleted() {
        return completed;
    }
}
