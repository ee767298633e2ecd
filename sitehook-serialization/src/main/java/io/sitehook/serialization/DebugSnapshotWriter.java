package io.sitehook.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.sitehook.core.event.Event;
import io.sitehook.core.event.EventDebugSnapshot;
import java.util.Objects;

/// Renders {@link EventDebugSnapshot}s as JSON for diagnostic tooling.
///
/// ```json
/// {"handlers": {
///   "incomplete": [],
///   "complete": [{"class": "com.example.A", "started": "2024-01-01T00:00:00Z",
///                 "completed": "2024-01-01T00:00:01Z", "message": "done"}],
///   "failed": []
/// }}
/// ```
public class DebugSnapshotWriter {

    private final ObjectMapper mapper;

    public DebugSnapshotWriter() {
        this(SitehookObjectMapper.create());
    }

    public DebugSnapshotWriter(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    /// Serializes a snapshot to compact JSON.
    ///
    /// @param snapshot the snapshot, not null
    /// @return JSON string, never null
    /// @throws IllegalArgumentException if serialization fails
    public String toJson(EventDebugSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        try {
            return mapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize debug snapshot: " + e.getMessage(), e);
        }
    }

    /// Serializes the current state of an event.
    ///
    /// @param event the event, not null
    /// @return JSON string, never null
    public String toJson(Event event) {
        Objects.requireNonNull(event, "event must not be null");
        return toJson(event.debug());
    }

    /// Serializes a snapshot to indented JSON.
    ///
    /// @param snapshot the snapshot, not null
    /// @return pretty-printed JSON string, never null
    public String toPrettyJson(EventDebugSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize debug snapshot: " + e.getMessage(), e);
        }
    }
}
