package com.marketplace.realtime.feed.kafka;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.marketplace.realtime.feed.ChangeEvent;
import com.marketplace.realtime.feed.ChangeEventType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CdcEnvelopeParser Tests")
class CdcEnvelopeParserTest {

    private final CdcEnvelopeParser parser = new CdcEnvelopeParser(new ObjectMapper());

    @Test
    @DisplayName("Parses a plain update envelope")
    void plainUpdate() {
        String value = """
                {"before":{"id":"r1","status":"pending"},
                 "after":{"id":"r1","status":"accepted","updated_at":1714557600000},
                 "source":{"table":"listing_requests"},
                 "op":"u","ts_ms":1714557600123}
                """;

        Optional<ChangeEvent> event = parser.parse(value, "fallback");

        assertThat(event).hasValueSatisfying(e -> {
            assertThat(e.type()).isEqualTo(ChangeEventType.UPDATE);
            assertThat(e.table()).isEqualTo("listing_requests");
            assertThat(e.before().getString("status")).isEqualTo("pending");
            assertThat(e.after().getString("status")).isEqualTo("accepted");
            assertThat(e.after().getInstant("updated_at").toEpochMilli()).isEqualTo(1714557600000L);
        });
    }

    @Test
    @DisplayName("Unwraps schema envelopes and falls back to the topic table")
    void wrappedInsert() {
        String value = """
                {"schema":{"type":"struct"},
                 "payload":{"before":null,"after":{"id":"m1","message":"hi"},"op":"c"}}
                """;

        Optional<ChangeEvent> event = parser.parse(value, "chat_messages");

        assertThat(event).hasValueSatisfying(e -> {
            assertThat(e.type()).isEqualTo(ChangeEventType.INSERT);
            assertThat(e.table()).isEqualTo("chat_messages");
            assertThat(e.before()).isNull();
            assertThat(e.after().getString("message")).isEqualTo("hi");
        });
    }

    @Test
    @DisplayName("Deletes carry only the before image")
    void delete() {
        String value = "{\"before\":{\"id\":\"n1\"},\"after\":null,\"source\":{\"table\":\"notifications\"},\"op\":\"d\"}";

        assertThat(parser.parse(value, null)).hasValueSatisfying(e -> {
            assertThat(e.type()).isEqualTo(ChangeEventType.DELETE);
            assertThat(e.after()).isNull();
            assertThat(e.latest().getString("id")).isEqualTo("n1");
        });
    }

    @Test
    @DisplayName("Skips tombstones, truncates and malformed records")
    void skipped() {
        assertThat(parser.parse(null, "listings")).isEmpty();
        assertThat(parser.parse("  ", "listings")).isEmpty();
        assertThat(parser.parse("{\"op\":\"t\",\"source\":{\"table\":\"listings\"}}", "listings")).isEmpty();
        assertThat(parser.parse("{not json", "listings")).isEmpty();
        assertThat(parser.parse("{\"after\":{\"id\":\"x\"},\"op\":\"c\"}", null)).isEmpty();
    }
}
