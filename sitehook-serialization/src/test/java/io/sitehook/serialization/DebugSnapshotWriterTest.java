package io.sitehook.serialization;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.sitehook.core.event.EventDebugSnapshot;
import io.sitehook.core.event.HandlerSnapshot;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DebugSnapshotWriterTest {

    private static final Instant STARTED = Instant.parse("2024-05-01T10:00:00Z");

    private final DebugSnapshotWriter writer = new DebugSnapshotWriter();
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void shouldWriteEmptySnapshotWithAllBuckets() {
        String json = writer.toJson(new EventDebugSnapshot(Map.of()));

        assertThat(json)
                .isEqualTo("{\"handlers\":{\"incomplete\":[],\"complete\":[],\"failed\":[]}}");
    }

    @Test
    void shouldWriteHandlerEntriesWithIsoTimestamps() throws Exception {
        EventDebugSnapshot snapshot =
                new EventDebugSnapshot(
                        Map.of(
                                "complete",
                                List.of(
                                        new HandlerSnapshot(
                                                "com.example.ScrubHandler",
                                                STARTED,
                                                STARTED.plusSeconds(1),
                                                "done"))));

        JsonNode entry = mapper.readTree(writer.toJson(snapshot)).at("/handlers/complete/0");

        assertThat(entry.get("class").asText()).isEqualTo("com.example.ScrubHandler");
        assertThat(entry.get("started").asText()).isEqualTo("2024-05-01T10:00:00Z");
        assertThat(entry.get("completed").asText()).isEqualTo("2024-05-01T10:00:01Z");
        assertThat(entry.get("message").asText()).isEqualTo("done");
    }

    @Test
    void shouldWriteExplicitNullsForQueuedHandler() throws Exception {
        EventDebugSnapshot snapshot =
                new EventDebugSnapshot(
                        Map.of(
                                "incomplete",
                                List.of(new HandlerSnapshot("com.example.A", null, null, null))));

        JsonNode entry = mapper.readTree(writer.toJson(snapshot)).at("/handlers/incomplete/0");

        assertThat(entry.has("started")).isTrue();
        assertThat(entry.get("started").isNull()).isTrue();
        assertThat(entry.get("completed").isNull()).isTrue();
        assertThat(entry.get("message").isNull()).isTrue();
    }

    @Test
    void shouldPrettyPrint() {
        String json = writer.toPrettyJson(new EventDebugSnapshot(Map.of()));

        assertThat(json).contains(System.lineSeparator()).contains("\"incomplete\" : [ ]");
    }
}
