package com.tradeledger.costbasis.store;

import com.tradeledger.costbasis.engine.LedgerTransition;
import com.tradeledger.domain.HistoryRecord;
import com.tradeledger.domain.HistoryRecordRepository;
import com.tradeledger.domain.OpenPosition;
import com.tradeledger.domain.OpenPositionRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Optional;

/**
 * MongoDB ledger store. History inserts rely on the unique eventUid index; a duplicate key means the event was
 * already materialized. With a transaction template the history insert and the position write commit together
 * (requires a replica set); without one, history is written first with the intended position write recorded on it,
 * so a failed position write can be replayed from the row.
 */
@Slf4j
public class MongoLedgerStore implements LedgerStore {

    private final OpenPositionRepository openPositionRepository;
    private final HistoryRecordRepository historyRecordRepository;
    private final TransactionTemplate transactionTemplate;

    /**
     * @param transactionTemplate nullable; when null, commits are two ordered single-document writes
     */
    public MongoLedgerStore(OpenPositionRepository openPositionRepository,
                            HistoryRecordRepository historyRecordRepository,
                            TransactionTemplate transactionTemplate) {
        this.openPositionRepository = openPositionRepository;
        this.historyRecordRepository = historyRecordRepository;
        this.transactionTemplate = transactionTemplate;
    }

    @Override
    public Optional<OpenPosition> findOpenPosition(String tokenKey) {
        try {
            return openPositionRepository.findById(tokenKey);
        } catch (DataAccessException e) {
            throw new LedgerPersistenceException("Failed to load open position for " + tokenKey, e);
        }
    }

    @Override
    public void upsertOpenPosition(OpenPosition position) {
        try {
            openPositionRepository.save(position);
        } catch (DataAccessException e) {
            throw new LedgerPersistenceException("Failed to upsert open position for " + position.getTokenKey(), e);
        }
    }

    @Override
    public void deleteOpenPosition(String tokenKey) {
        try {
            openPositionRepository.deleteById(tokenKey);
        } catch (DataAccessException e) {
            throw new LedgerPersistenceException("Failed to delete open position for " + tokenKey, e);
        }
    }

    @Override
    public boolean historyExists(String eventUid) {
        try {
            return historyRecordRepository.existsByEventUid(eventUid);
        } catch (DataAccessException e) {
            throw new LedgerPersistenceException("Failed to look up history for event " + eventUid, e);
        }
    }

    @Override
    public Optional<HistoryRecord> findHistory(String eventUid) {
        try {
            return historyRecordRepository.findByEventUid(eventUid);
        } catch (DataAccessException e) {
            throw new LedgerPersistenceException("Failed to load history for event " + eventUid, e);
        }
    }

    @Override
    public boolean insertHistoryIfAbsent(HistoryRecord record) {
        try {
            historyRecordRepository.insert(record);
            return true;
        } catch (DuplicateKeyException e) {
            log.debug("History for event {} already present", record.getEventUid());
            return false;
        } catch (DataAccessException e) {
            throw new LedgerPersistenceException("Failed to insert history for event " + record.getEventUid(), e);
        }
    }

    @Override
    public void markPositionApplied(HistoryRecord record) {
        try {
            historyRecordRepository.save(record);
        } catch (DataAccessException e) {
            throw new LedgerPersistenceException("Failed to mark position applied for event " + record.getEventUid(), e);
        }
    }

    @Override
    public CommitOutcome commit(LedgerTransition transition) {
        if (transactionTemplate == null) {
            return LedgerStore.super.commit(transition);
        }
        try {
            return transactionTemplate.execute(status -> {
                CommitOutcome outcome = LedgerStore.super.commit(transition);
                if (outcome == CommitOutcome.DUPLICATE) {
                    status.setRollbackOnly();
                }
                return outcome;
            });
        } catch (TransactionException e) {
            throw new LedgerPersistenceException("Ledger transaction failed for event " + transition.history().getEventUid(), e);
        }
    }
}
