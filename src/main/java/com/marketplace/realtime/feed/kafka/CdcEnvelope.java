package com.marketplace.realtime.feed.kafka;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Debezium change event value: row images, source metadata and operation code.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CdcEnvelope(
        Map<String, Object> before,
        Map<String, Object> after,
        Map<String, Object> source,
        String op,
        @JsonProperty("ts_ms") Long tsMs
) {

    public String table() {
        Object table = source != null ? source.get("table") : null;
        return table != null ? table.toString() : null;
    }
}
