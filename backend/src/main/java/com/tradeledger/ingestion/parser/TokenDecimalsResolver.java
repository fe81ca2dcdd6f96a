package com.tradeledger.ingestion.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradeledger.common.address.AddressCanonicalizer;
import com.tradeledger.common.address.AddressDecodeException;
import com.tradeledger.config.LedgerConfigException;
import com.tradeledger.config.LedgerProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Token decimals by canonical token key. Overrides come from tradeledger.token-decimals and
 * tradeledger.token-decimals-json (JSON wins on conflicts); everything else uses the default.
 */
@Component
@Slf4j
public class TokenDecimalsResolver {

    private static final int MAX_DECIMALS = 36;

    private final Map<String, Integer> decimalsByToken;
    private final int defaultDecimals;

    public TokenDecimalsResolver(LedgerProperties properties, AddressCanonicalizer canonicalizer, ObjectMapper objectMapper) {
        this.defaultDecimals = properties.getDefaultTokenDecimals();
        Map<String, Integer> merged = new HashMap<>();
        properties.getTokenDecimals().forEach((token, decimals) -> put(merged, canonicalizer, token, decimals));
        parseJson(properties.getTokenDecimalsJson(), objectMapper)
                .forEach((token, decimals) -> put(merged, canonicalizer, token, decimals));
        this.decimalsByToken = Collections.unmodifiableMap(merged);
        if (!merged.isEmpty()) {
            log.info("Token decimal overrides: {}", merged);
        }
    }

    public int decimalsFor(String tokenKey) {
        return decimalsByToken.getOrDefault(tokenKey, defaultDecimals);
    }

    private static Map<String, Integer> parseJson(String json, ObjectMapper objectMapper) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            Map<String, Integer> parsed = objectMapper.readValue(json, new TypeReference<Map<String, Integer>>() { });
            return parsed != null ? parsed : Map.of();
        } catch (JsonProcessingException e) {
            throw new LedgerConfigException("tradeledger.token-decimals-json is not a JSON object of integers: "
                    + e.getOriginalMessage(), e);
        }
    }

    private static void put(Map<String, Integer> target, AddressCanonicalizer canonicalizer, String token, Integer decimals) {
        if (decimals == null || decimals < 0 || decimals > MAX_DECIMALS) {
            throw new LedgerConfigException("Token decimals for " + token + " out of range: " + decimals);
        }
        try {
            target.put(canonicalizer.canonicalize(token), decimals);
        } catch (AddressDecodeException e) {
            throw new LedgerConfigException("Token decimals key is not a TRON address: " + token, e);
        }
    }
}
