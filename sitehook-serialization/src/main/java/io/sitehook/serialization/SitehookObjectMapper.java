package io.sitehook.serialization;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/// Factory for the `ObjectMapper` shared by the serialization helpers.
public final class SitehookObjectMapper {

    private SitehookObjectMapper() {}

    /// Creates an ObjectMapper configured for Sitehook documents.
    ///
    /// Registers:
    /// - `SitehookJacksonModule` for registry and debug snapshot types
    /// - `JavaTimeModule` for `Instant` timestamps
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled for forward compatibility
    /// - Timestamps written as ISO-8601 strings (not numeric)
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper create() {
        return new ObjectMapper()
                .registerModule(new SitehookJacksonModule())
                .registerModule(new JavaTimeModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }
}
