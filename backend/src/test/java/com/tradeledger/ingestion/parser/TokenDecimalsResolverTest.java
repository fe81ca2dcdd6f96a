package com.tradeledger.ingestion.parser;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradeledger.common.address.AddressCanonicalizer;
import com.tradeledger.common.address.AddressEncoding;
import com.tradeledger.config.LedgerConfigException;
import com.tradeledger.config.LedgerProperties;
import com.tradeledger.ingestion.RawEvents;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TokenDecimalsResolverTest {

    private final AddressCanonicalizer canonicalizer = new AddressCanonicalizer(AddressEncoding.HEX);

    @Test
    void overridesAreKeyedByCanonicalAddress() {
        LedgerProperties props = new LedgerProperties();
        props.setDefaultTokenDecimals(6);
        props.setTokenDecimals(Map.of(RawEvents.TOKEN_BASE58, 8));

        TokenDecimalsResolver resolver = new TokenDecimalsResolver(props, canonicalizer, new ObjectMapper());

        assertThat(resolver.decimalsFor(RawEvents.TOKEN_HEX)).isEqualTo(8);
        assertThat(resolver.decimalsFor("411111111111111111111111111111111111111111")).isEqualTo(6);
    }

    @Test
    void jsonOverridesWinOverMap() {
        LedgerProperties props = new LedgerProperties();
        props.setTokenDecimals(Map.of(RawEvents.TOKEN_BASE58, 8));
        props.setTokenDecimalsJson("{\"" + RawEvents.TOKEN_HEX + "\": 18}");

        TokenDecimalsResolver resolver = new TokenDecimalsResolver(props, canonicalizer, new ObjectMapper());

        assertThat(resolver.decimalsFor(RawEvents.TOKEN_HEX)).isEqualTo(18);
    }

    @Test
    void malformedJsonIsAConfigError() {
        LedgerProperties props = new LedgerProperties();
        props.setTokenDecimalsJson("{not json");

        assertThatThrownBy(() -> new TokenDecimalsResolver(props, canonicalizer, new ObjectMapper()))
                .isInstanceOf(LedgerConfigException.class)
                .hasMessageContaining("token-decimals-json");
    }

    @Test
    void nonAddressKeyIsAConfigError() {
        LedgerProperties props = new LedgerProperties();
        props.setTokenDecimals(Map.of("USDT", 6));

        assertThatThrownBy(() -> new TokenDecimalsResolver(props, canonicalizer, new ObjectMapper()))
                .isInstanceOf(LedgerConfigException.class)
                .hasMessageContaining("USDT");
    }
}
