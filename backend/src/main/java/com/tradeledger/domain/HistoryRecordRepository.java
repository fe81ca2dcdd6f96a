package com.tradeledger.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for trade_history. Uniqueness: eventUid.
 */
public interface HistoryRecordRepository extends MongoRepository<HistoryRecord, String> {

    boolean existsByEventUid(String eventUid);

    Optional<HistoryRecord> findByEventUid(String eventUid);

    List<HistoryRecord> findByTokenKeyOrderByBlockNumberAscEventIndexAsc(String tokenKey);
}
