package com.tradeledger.config;

import com.tradeledger.common.address.AddressCanonicalizer;
import com.tradeledger.costbasis.engine.LedgerEngine;
import com.tradeledger.costbasis.store.LedgerStore;
import com.tradeledger.costbasis.store.MongoLedgerStore;
import com.tradeledger.domain.HistoryRecordRepository;
import com.tradeledger.domain.OpenPositionRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.MongoDatabaseFactory;
import org.springframework.data.mongodb.MongoTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Clock;

/**
 * Wires the ledger core from {@link LedgerProperties}: address canonicalizer, engine and Mongo-backed store.
 */
@Configuration
@EnableConfigurationProperties(LedgerProperties.class)
@Slf4j
public class LedgerConfig {

    @Bean
    public Clock ledgerClock() {
        return Clock.systemUTC();
    }

    @Bean
    public AddressCanonicalizer addressCanonicalizer(LedgerProperties properties) {
        return new AddressCanonicalizer(properties.getAddressEncoding());
    }

    /** Reported PnL is tolerated within one unit of the price scale before it counts as divergent. */
    @Bean
    public LedgerEngine ledgerEngine(LedgerProperties properties, Clock ledgerClock) {
        BigDecimal scale = properties.getPriceScale() != null && properties.getPriceScale().signum() > 0
                ? properties.getPriceScale()
                : BigDecimal.ONE;
        BigDecimal tolerance = BigDecimal.ONE.divide(scale, MathContext.DECIMAL128);
        return new LedgerEngine(tolerance, ledgerClock);
    }

    @Bean
    public LedgerStore ledgerStore(LedgerProperties properties,
                                   OpenPositionRepository openPositionRepository,
                                   HistoryRecordRepository historyRecordRepository,
                                   MongoDatabaseFactory mongoDatabaseFactory) {
        TransactionTemplate transactionTemplate = null;
        if (properties.getPersistence().isTransactional()) {
            transactionTemplate = new TransactionTemplate(new MongoTransactionManager(mongoDatabaseFactory));
            log.info("Ledger commits run in MongoDB transactions");
        }
        return new MongoLedgerStore(openPositionRepository, historyRecordRepository, transactionTemplate);
    }
}
