package io.sitehook.core.handler;

import io.sitehook.core.exception.HandlerResolutionException;
import io.sitehook.core.registry.HandlerDescriptor;
import java.util.Optional;
import java.util.Set;

/// Table of named {@link HandlerFactory} entries, built once at startup.
///
/// Registry descriptors reference handlers by name; the catalog turns those
/// names into instances. No class loading by name happens at run time.
///
/// ### Permitted Subtypes
/// - {@link DefaultHandlerCatalog} - default mutable implementation
///
/// @implNote Thread-safety is implementation-specific.
///
/// @see io.sitehook.core.handler.spi.HandlerProvider for contributing entries via ServiceLoader
public interface HandlerCatalog {

    /// Registers a factory under a name.
    ///
    /// @apiNote **Side effects**: replaces any factory previously registered under `name`.
    ///
    /// @param name catalog identifier, optionally `path/identifier`, not null
    /// @param factory the factory, not null
    void register(String name, HandlerFactory factory);

    /// Returns the factory registered under a name.
    ///
    /// @param name catalog identifier, not null
    /// @return the factory, or empty if none registered
    Optional<HandlerFactory> getFactory(String name);

    /// Returns whether a name is registered.
    ///
    /// @param name catalog identifier, not null
    /// @return true if a factory is registered under `name`
    boolean contains(String name);

    /// Returns all registered names in registration order.
    ///
    /// @return immutable set of names, never null
    Set<String> names();

    /// Builds the handler a descriptor refers to.
    ///
    /// Tries {@link HandlerDescriptor#qualifiedName()} first, then the bare
    /// {@link HandlerDescriptor#handler()} identifier.
    ///
    /// @param descriptor the registry entry, not null
    /// @return a new handler instance, never null
    /// @throws HandlerResolutionException if no factory matches or the factory returns null
    EventHandler resolve(HandlerDescriptor descriptor);
}
