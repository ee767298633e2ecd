package io.sitehook.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.sitehook.core.event.HandlerSnapshot;
import java.io.IOException;
import java.io.Serial;

/// Writes a {@link HandlerSnapshot} as `{class, started, completed, message}`.
///
/// Unset timestamps and messages are written as explicit nulls so every entry has
/// the same keys. Timestamps go through the provider, so their format follows
/// the mapper's `java.time` configuration.
///
/// @implNote Package-private. Registered by {@link SitehookJacksonModule}.
class HandlerSnapshotSerializer extends StdSerializer<HandlerSnapshot> {

    @Serial private static final long serialVersionUID = 1254090367733187208L;

    HandlerSnapshotSerializer() {
        super(HandlerSnapshot.class);
    }

    @Override
    public void serialize(HandlerSnapshot snapshot, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("class", snapshot.className());
        gen.writeFieldName("started");
        provider.defaultSerializeValue(snapshot.started(), gen);
        gen.writeFieldName("completed");
        provider.defaultSerializeValue(snapshot.completed(), gen);
        gen.writeStringField("message", snapshot.message());
        gen.writeEndObject();
    }
}
