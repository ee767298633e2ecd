package io.sitehook.serialization;

import io.sitehook.core.registry.HandlerRegistry;
import io.sitehook.core.registry.RegistrySource;
import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;
import java.util.logging.Logger;

/// {@link RegistrySource} reading a JSON document from the classpath once.
///
/// The document is loaded on the first {@link #load()} and cached for the life of
/// the source. A missing resource yields an empty registry; a malformed one fails
/// every call until fixed, since nothing is cached on failure.
///
/// @implNote Thread-safe. Loading is guarded so concurrent first calls read once.
public class ClasspathRegistrySource implements RegistrySource {

    private static final Logger logger = Logger.getLogger(ClasspathRegistrySource.class.getName());

    private final String resource;
    private final ClassLoader classLoader;
    private final RegistryReader reader;

    private volatile HandlerRegistry cached;

    public ClasspathRegistrySource(String resource) {
        this(resource, Thread.currentThread().getContextClassLoader(), new RegistryReader());
    }

    /// Creates a source.
    ///
    /// @param resource classpath resource name, not null
    /// @param classLoader loader to look the resource up with, null uses this class's loader
    /// @param reader document reader, not null
    public ClasspathRegistrySource(String resource, ClassLoader classLoader, RegistryReader reader) {
        this.resource = Objects.requireNonNull(resource, "resource must not be null");
        this.classLoader =
                classLoader != null ? classLoader : ClasspathRegistrySource.class.getClassLoader();
        this.reader = Objects.requireNonNull(reader, "reader must not be null");
    }

    public String getResource() {
        return resource;
    }

    @Override
    public HandlerRegistry load() {
        HandlerRegistry registry = cached;
        if (registry == null) {
            synchronized (this) {
                registry = cached;
                if (registry == null) {
                    registry = readResource();
                    cached = registry;
                }
            }
        }
        return registry;
    }

    private HandlerRegistry readResource() {
        try (InputStream input = classLoader.getResourceAsStream(resource)) {
            if (input == null) {
                logger.info("Registry resource '" + resource + "' not found; using an empty registry");
                return HandlerRegistry.empty();
            }
            HandlerRegistry registry = reader.read(input);
            logger.info(
                    "Loaded "
                            + registry.events().size()
                            + " handler descriptors from '"
                            + resource
                            + "'");
            return registry;
        } catch (IOException e) {
            throw new RegistryReadException(
                    "Failed to read registry resource '" + resource + "': " + e.getMessage(), e);
        }
    }
}
