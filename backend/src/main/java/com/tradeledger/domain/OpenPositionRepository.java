package com.tradeledger.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

/**
 * Persistence for open_positions keyed by canonical token key. Used by MongoLedgerStore.
 */
public interface OpenPositionRepository extends MongoRepository<OpenPosition, String> {
}
