package io.sitehook.serialization;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.sitehook.core.registry.HandlerRegistry;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/// Reads registry documents into {@link HandlerRegistry} snapshots.
///
/// {@snippet :
/// HandlerRegistry registry = new RegistryReader().read(Path.of("/etc/sitehook/registry.json"));
/// }
///
/// @implNote Thread-safe; the underlying mapper is only read after construction.
/// @see HandlerRegistryDeserializer for the accepted document shape
public class RegistryReader {

    private final ObjectMapper mapper;

    public RegistryReader() {
        this(SitehookObjectMapper.create());
    }

    /// Creates a reader backed by the given mapper.
    ///
    /// @param mapper a mapper with {@link SitehookJacksonModule} registered, not null
    public RegistryReader(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    /// Parses a registry from a JSON string.
    ///
    /// @param json the document, not null
    /// @return the registry, never null
    /// @throws RegistryReadException if the document is malformed
    public HandlerRegistry read(String json) {
        Objects.requireNonNull(json, "json must not be null");
        try {
            return requireDocument(mapper.readValue(json, HandlerRegistry.class));
        } catch (IOException e) {
            throw new RegistryReadException("Failed to read registry: " + e.getMessage(), e);
        }
    }

    /// Parses a registry from a stream; the stream is not closed.
    ///
    /// @param input the document, not null
    /// @return the registry, never null
    /// @throws RegistryReadException if the document is malformed or unreadable
    public HandlerRegistry read(InputStream input) {
        Objects.requireNonNull(input, "input must not be null");
        try {
            return requireDocument(mapper.readValue(input, HandlerRegistry.class));
        } catch (IOException e) {
            throw new RegistryReadException("Failed to read registry: " + e.getMessage(), e);
        }
    }

    /// Parses a registry from a file.
    ///
    /// @param file the document, not null
    /// @return the registry, never null
    /// @throws RegistryReadException if the file is malformed or unreadable
    public HandlerRegistry read(Path file) {
        Objects.requireNonNull(file, "file must not be null");
        try (InputStream input = Files.newInputStream(file)) {
            return requireDocument(mapper.readValue(input, HandlerRegistry.class));
        } catch (IOException e) {
            throw new RegistryReadException(
                    "Failed to read registry " + file + ": " + e.getMessage(), e);
        }
    }

    private static HandlerRegistry requireDocument(HandlerRegistry registry) {
        if (registry == null) {
            throw new RegistryReadException("Registry document must be a JSON object, got null");
        }
        return registry;
    }
}
