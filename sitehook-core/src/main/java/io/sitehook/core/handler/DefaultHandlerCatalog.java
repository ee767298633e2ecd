package io.sitehook.core.handler;

import io.sitehook.core.exception.HandlerResolutionException;
import io.sitehook.core.handler.spi.HandlerProvider;
import io.sitehook.core.registry.HandlerDescriptor;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.logging.Logger;

/// Default mutable implementation of {@link HandlerCatalog}.
///
/// Factories are stored in a {@link LinkedHashMap}; registration is not
/// thread-safe and must be finished before the catalog is shared. Resolution
/// is read-only and safe from multiple threads afterwards.
///
/// @see #discover() for ServiceLoader-based population
public class DefaultHandlerCatalog implements HandlerCatalog {

    private static final Logger logger = Logger.getLogger(DefaultHandlerCatalog.class.getName());

    private final Map<String, HandlerFactory> factories = new LinkedHashMap<>();

    /// Creates a catalog populated by every {@link HandlerProvider} on the classpath.
    ///
    /// @return populated catalog, never null
    public static DefaultHandlerCatalog discover() {
        DefaultHandlerCatalog catalog = new DefaultHandlerCatalog();
        for (HandlerProvider provider : ServiceLoader.load(HandlerProvider.class)) {
            logger.fine("Discovered handler provider: " + provider.getName());
            provider.registerHandlers(catalog);
        }
        logger.info("Handler catalog populated with " + catalog.factories.size() + " entries");
        return catalog;
    }

    @Override
    public void register(String name, HandlerFactory factory) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(factory, "factory must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        if (factories.put(name, factory) != null) {
            logger.warning("Handler already registered: " + name + ". Replacing...");
        }
    }

    @Override
    public Optional<HandlerFactory> getFactory(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return Optional.ofNullable(factories.get(name));
    }

    @Override
    public boolean contains(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return factories.containsKey(name);
    }

    @Override
    public Set<String> names() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(factories.keySet()));
    }

    @Override
    public EventHandler resolve(HandlerDescriptor descriptor) {
        Objects.requireNonNull(descriptor, "descriptor must not be null");

        HandlerFactory factory = factories.get(descriptor.qualifiedName());
        if (factory == null && descriptor.hasPath()) {
            factory = factories.get(descriptor.handler());
        }
        if (factory == null) {
            throw new HandlerResolutionException(
                    descriptor,
                    "No handler registered for '"
                            + descriptor.qualifiedName()
                            + "' (event type '"
                            + descriptor.type()
                            + "')");
        }

        EventHandler handler;
        try {
            handler = factory.create(descriptor);
        } catch (RuntimeException e) {
            throw new HandlerResolutionException(
                    descriptor,
                    "Handler factory for '"
                            + descriptor.qualifiedName()
                            + "' failed: "
                            + e.getMessage(),
                    e);
        }
        if (handler == null) {
            throw new HandlerResolutionException(
                    descriptor,
                    "Handler factory for '" + descriptor.qualifiedName() + "' returned null");
        }
        return handler;
    }
}
