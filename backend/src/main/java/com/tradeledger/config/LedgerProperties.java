package com.tradeledger.config;

import com.tradeledger.common.address.AddressEncoding;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;

/**
 * Ledger settings read once at startup. Documented in application.yml under tradeledger.
 */
@ConfigurationProperties(prefix = "tradeledger")
@NoArgsConstructor
@Getter
@Setter
public class LedgerProperties {

    /** Contract emitting TradeOpen / TradeClosed, in either address encoding. Required. */
    private String contract;

    /** Fixed-point scale of on-chain prices and PnL: 67_500_000 with scale 1e6 is 67.5. */
    private BigDecimal priceScale = new BigDecimal("1000000");

    /** Decimals used for token amounts when the token has no override. */
    private int defaultTokenDecimals = 6;

    /**
     * Per-token decimal overrides. Keys in either encoding; use bracket notation in YAML ("[T...]") so base58
     * case survives binding.
     */
    private Map<String, Integer> tokenDecimals = new HashMap<>();

    /** Same overrides as a JSON object, e.g. {"Txxx":6,"Tyyy":18}. Merged over tokenDecimals. */
    private String tokenDecimalsJson;

    /** Encoding of persisted token keys. */
    private AddressEncoding addressEncoding = AddressEncoding.HEX;

    private Persistence persistence = new Persistence();

    public void setTokenDecimals(Map<String, Integer> tokenDecimals) {
        this.tokenDecimals = tokenDecimals != null ? tokenDecimals : new HashMap<>();
    }

    /**
     * @throws LedgerConfigException on the first missing or out-of-range setting
     */
    public void validate() {
        if (contract == null || contract.isBlank()) {
            throw new LedgerConfigException("Missing required setting tradeledger.contract (NILE_CONTRACT_ADDRESS)");
        }
        if (priceScale == null || priceScale.signum() <= 0) {
            throw new LedgerConfigException("tradeledger.price-scale must be positive, got " + priceScale);
        }
        if (defaultTokenDecimals < 0 || defaultTokenDecimals > 36) {
            throw new LedgerConfigException("tradeledger.default-token-decimals out of range: " + defaultTokenDecimals);
        }
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Persistence {

        /**
         * Commit history and position writes in one MongoDB transaction. Needs a replica set; when false,
         * history is written before the position.
         */
        private boolean transactional = false;
    }
}
