package com.tradeledger.ingestion.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.SerializableString;
import com.fasterxml.jackson.core.io.CharacterEscapes;
import com.fasterxml.jackson.core.io.SerializedString;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.tradeledger.ingestion.source.RawEvent;
import org.springframework.stereotype.Component;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Deterministic event identity: SHA-1 hex of the compact, key-sorted JSON of
 * {@code {bn, idx, name, res, tx}}. Stable across pages, polls and restarts.
 */
@Component
public class EventUidGenerator {

    private final ObjectMapper canonicalMapper;

    public EventUidGenerator(ObjectMapper objectMapper) {
        this.canonicalMapper = objectMapper.copy()
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
                .configure(SerializationFeature.INDENT_OUTPUT, false);
        this.canonicalMapper.getFactory().setCharacterEscapes(new AsciiOnlyEscapes());
    }

    public String uidOf(RawEvent event) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("tx", event.txId());
        payload.put("bn", event.blockNumber());
        payload.put("idx", event.eventIndex());
        payload.put("name", event.eventName());
        payload.put("res", toPlain(event.result()));
        try {
            byte[] json = canonicalMapper.writeValueAsBytes(payload);
            return HexFormat.of().formatHex(sha1().digest(json));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize event identity payload", e);
        }
    }

    /** Maps nested objects to {@link Map}s so key ordering applies at every level. */
    private Object toPlain(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        return canonicalMapper.convertValue(node, Object.class);
    }

    /**
     * Pure-ASCII output: everything outside printable ASCII becomes a lowercase {@code \\uXXXX} escape, one per
     * UTF-16 unit, so uids match the ones the earlier ledger computed for non-ASCII strings.
     */
    static final class AsciiOnlyEscapes extends CharacterEscapes {

        private final int[] asciiEscapes;

        AsciiOnlyEscapes() {
            int[] escapes = CharacterEscapes.standardAsciiEscapesForJSON();
            for (int c = 0; c < 0x20; c++) {
                if (escapes[c] == ESCAPE_STANDARD) {
                    escapes[c] = ESCAPE_CUSTOM;
                }
            }
            escapes[0x7F] = ESCAPE_CUSTOM;
            this.asciiEscapes = escapes;
        }

        @Override
        public int[] getEscapeCodesForAscii() {
            return asciiEscapes;
        }

        @Override
        public SerializableString getEscapeSequence(int ch) {
            return new SerializedString(String.format("\\u%04x", ch));
        }
    }

    private static MessageDigest sha1() {
        try {
            return MessageDigest.getInstance("SHA-1");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 not available", e);
        }
    }
}
