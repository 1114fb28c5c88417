package com.marketplace.realtime.feed.kafka;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.marketplace.realtime.feed.ChangeEvent;
import com.marketplace.realtime.feed.ChangeEventType;
import com.marketplace.realtime.feed.Row;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Turns Debezium JSON records into {@link ChangeEvent}s. Both the plain value and
 * the schema-wrapped form ({@code {"schema":…,"payload":…}}) are accepted.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CdcEnvelopeParser {

    private final ObjectMapper objectMapper;

    /**
     * @param fallbackTable table to assume when the envelope has no source block
     * @return the event, or empty for tombstones, unknown operations and malformed JSON
     */
    public Optional<ChangeEvent> parse(String value, String fallbackTable) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            JsonNode root = objectMapper.readTree(value);
            JsonNode payload = root.path("payload");
            if (payload.isObject()) {
                root = payload;
            }
            CdcEnvelope envelope = objectMapper.treeToValue(root, CdcEnvelope.class);
            ChangeEventType type = ChangeEventType.fromOperation(envelope.op());
            if (type == null) {
                log.debug("Skipping change record with operation {}", envelope.op());
                return Optional.empty();
            }
            String table = envelope.table() != null ? envelope.table() : fallbackTable;
            if (table == null) {
                return Optional.empty();
            }
            Row before = envelope.before() != null ? Row.of(envelope.before()) : null;
            Row after = envelope.after() != null ? Row.of(envelope.after()) : null;
            return Optional.of(new ChangeEvent(type, table, before, after));
        } catch (JsonProcessingException e) {
            log.error("Discarding malformed change record: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }
}
