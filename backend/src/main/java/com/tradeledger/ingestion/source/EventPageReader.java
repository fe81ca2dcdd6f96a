package com.tradeledger.ingestion.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads an event-source response body into an {@link EventPage}.
 * <p>
 * The next cursor is taken from the first of {@code meta.fingerprint}, top-level {@code fingerprint},
 * or the {@code fingerprint} query parameter of {@code meta.links.next}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EventPageReader {

    private final ObjectMapper objectMapper;

    /**
     * @throws EventSourceException when the body is not a JSON object or its data is not an array
     */
    public EventPage read(String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body == null ? "" : body);
        } catch (JsonProcessingException e) {
            throw new EventSourceException("Event source returned malformed JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new EventSourceException("Event source returned a non-object body");
        }
        JsonNode data = root.path("data");
        if (!data.isMissingNode() && !data.isNull() && !data.isArray()) {
            throw new EventSourceException("Event source returned non-array data");
        }
        List<RawEvent> events = new ArrayList<>();
        for (JsonNode node : data) {
            if (!node.isObject()) {
                log.warn("Skipping non-object event envelope: {}", node);
                continue;
            }
            events.add(toRawEvent(node));
        }
        return new EventPage(events, nextCursor(root));
    }

    String nextCursor(JsonNode root) {
        JsonNode meta = root.path("meta");
        String fingerprint = text(meta.path("fingerprint"));
        if (fingerprint != null) {
            return fingerprint;
        }
        fingerprint = text(root.path("fingerprint"));
        if (fingerprint != null) {
            return fingerprint;
        }
        String next = text(meta.path("links").path("next"));
        if (next == null) {
            return null;
        }
        String fromLink = UriComponentsBuilder.fromUriString(next).build().getQueryParams().getFirst("fingerprint");
        if (fromLink == null || fromLink.isBlank()) {
            log.warn("meta.links.next carries no fingerprint parameter, treating page as last: {}", next);
            return null;
        }
        return fromLink;
    }

    private static RawEvent toRawEvent(JsonNode node) {
        JsonNode timestamp = node.path("block_timestamp");
        JsonNode result = node.path("result");
        return new RawEvent(
                text(node.path("transaction_id")),
                node.path("block_number").asLong(0L),
                timestamp.canConvertToLong() || timestamp.isTextual() ? nullableLong(timestamp) : null,
                node.path("event_index").asInt(0),
                text(node.path("event_name")),
                result.isObject() ? result : MissingNode.getInstance());
    }

    private static Long nullableLong(JsonNode node) {
        if (node.canConvertToLong()) {
            return node.asLong();
        }
        try {
            return Long.parseLong(node.asText().trim());
        } catch (NumberFormatException e) {
            log.debug("Ignoring unparseable block_timestamp {}", node);
            return null;
        }
    }

    private static String text(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        String value = node.asText();
        return value.isBlank() ? null : value;
    }
}
