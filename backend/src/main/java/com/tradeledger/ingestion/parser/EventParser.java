package com.tradeledger.ingestion.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.tradeledger.common.address.AddressCanonicalizer;
import com.tradeledger.common.address.AddressDecodeException;
import com.tradeledger.config.LedgerProperties;
import com.tradeledger.domain.DomainEvent;
import com.tradeledger.domain.TradeAction;
import com.tradeledger.domain.TradeClosedEvent;
import com.tradeledger.domain.TradeOpenedEvent;
import com.tradeledger.ingestion.source.RawEvent;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.Set;

/**
 * Turns a raw TradeOpen / TradeClosed envelope into a typed {@link DomainEvent}.
 * Prices and PnL are divided by the configured price scale; amounts by 10^decimals of the token.
 * Both are carried at 18 fractional digits.
 */
@Component
public class EventParser {

    static final int SCALE = 18;
    private static final Set<String> SUPPORTED = Set.of(TradeOpenedEvent.EVENT_NAME, TradeClosedEvent.EVENT_NAME);

    private final AddressCanonicalizer canonicalizer;
    private final TokenDecimalsResolver tokenDecimalsResolver;
    private final EventUidGenerator uidGenerator;
    private final BigDecimal priceScale;

    public EventParser(AddressCanonicalizer canonicalizer,
                       TokenDecimalsResolver tokenDecimalsResolver,
                       EventUidGenerator uidGenerator,
                       LedgerProperties properties) {
        this.canonicalizer = canonicalizer;
        this.tokenDecimalsResolver = tokenDecimalsResolver;
        this.uidGenerator = uidGenerator;
        this.priceScale = properties.getPriceScale();
    }

    public boolean supports(RawEvent event) {
        return event.eventName() != null && SUPPORTED.contains(event.eventName());
    }

    /**
     * @throws EventParseException when the event is unsupported, a required field is missing or a value is malformed
     */
    public DomainEvent parse(RawEvent event) {
        if (!supports(event)) {
            throw new EventParseException("Unsupported event " + event.eventName());
        }
        if (event.txId() == null) {
            throw new EventParseException(event.eventName() + " without transaction_id");
        }
        JsonNode result = event.result();
        if (result == null || !result.isObject()) {
            throw new EventParseException(event.eventName() + " in tx " + event.txId() + " has no result object");
        }
        String uid = uidGenerator.uidOf(event);
        String tokenKey = address(required(result, "tokenAddress").asText().strip(), "tokenAddress");
        int decimals = tokenDecimalsResolver.decimalsFor(tokenKey);
        Long tradeId = tradeId(result.path("tradeId"));
        String traderRaw = optionalText(result.path("trader"));
        String trader = traderRaw != null ? address(traderRaw, "trader") : null;
        Instant blockTimestamp = event.blockTimestamp() != null ? Instant.ofEpochMilli(event.blockTimestamp()) : null;

        if (TradeOpenedEvent.EVENT_NAME.equals(event.eventName())) {
            TradeAction action;
            try {
                action = TradeAction.fromContractValue(optionalText(result.path("action")));
            } catch (IllegalArgumentException e) {
                throw new EventParseException("Unknown trade action " + result.path("action").asText(), e);
            }
            return new TradeOpenedEvent(uid, event.txId(), event.blockNumber(), event.eventIndex(), blockTimestamp,
                    tradeId, trader, tokenKey,
                    optionalText(result.path("strategy")),
                    action,
                    price(required(result, "entryPrice"), "entryPrice"),
                    amount(required(result, "amount"), decimals),
                    decimals);
        }
        JsonNode amountNode = result.path("amount");
        JsonNode pnlNode = result.path("pnl");
        return new TradeClosedEvent(uid, event.txId(), event.blockNumber(), event.eventIndex(), blockTimestamp,
                tradeId, trader, tokenKey,
                price(required(result, "exitPrice"), "exitPrice"),
                isAbsent(amountNode) ? null : amount(amountNode, decimals),
                isAbsent(pnlNode) ? null : scaled(integer(pnlNode, "pnl")),
                decimals);
    }

    private BigDecimal price(JsonNode node, String field) {
        BigInteger raw = integer(node, field);
        if (raw.signum() < 0) {
            throw new EventParseException(field + " must not be negative: " + raw);
        }
        return scaled(raw);
    }

    private BigDecimal scaled(BigInteger raw) {
        return new BigDecimal(raw).divide(priceScale, SCALE, RoundingMode.HALF_UP);
    }

    private static BigDecimal amount(JsonNode node, int decimals) {
        BigInteger raw = integer(node, "amount");
        if (raw.signum() < 0) {
            throw new EventParseException("amount must not be negative: " + raw);
        }
        return new BigDecimal(raw).movePointLeft(decimals).setScale(SCALE, RoundingMode.HALF_UP);
    }

    private String address(String value, String field) {
        try {
            return canonicalizer.canonicalize(value);
        } catch (AddressDecodeException e) {
            throw new EventParseException("Malformed " + field + " " + value, e);
        }
    }

    private static Long tradeId(JsonNode node) {
        if (isAbsent(node)) {
            return null;
        }
        try {
            return integer(node, "tradeId").longValueExact();
        } catch (ArithmeticException e) {
            throw new EventParseException("tradeId out of range: " + node.asText(), e);
        }
    }

    /** Chain integers arrive as JSON numbers or decimal strings; 0x-prefixed hex is accepted too. */
    static BigInteger integer(JsonNode node, String field) {
        if (node.isIntegralNumber()) {
            return node.bigIntegerValue();
        }
        if (node.isTextual()) {
            String text = node.asText().strip();
            try {
                if (text.startsWith("0x") || text.startsWith("0X")) {
                    return new BigInteger(text.substring(2), 16);
                }
                return new BigInteger(text);
            } catch (NumberFormatException e) {
                throw new EventParseException("Malformed " + field + " value '" + text + "'", e);
            }
        }
        throw new EventParseException("Malformed " + field + " value " + node);
    }

    private static JsonNode required(JsonNode result, String field) {
        JsonNode node = result.path(field);
        if (isAbsent(node)) {
            throw new EventParseException("Missing field " + field);
        }
        return node;
    }

    private static String optionalText(JsonNode node) {
        if (isAbsent(node)) {
            return null;
        }
        String value = node.asText().strip();
        return value.isEmpty() ? null : value;
    }

    private static boolean isAbsent(JsonNode node) {
        return node == null || node.isMissingNode() || node.isNull()
                || (node.isTextual() && node.asText().isBlank());
    }
}
