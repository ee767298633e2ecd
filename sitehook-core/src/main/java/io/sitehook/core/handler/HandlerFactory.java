package io.sitehook.core.handler;

import io.sitehook.core.registry.HandlerDescriptor;

/// Builds a handler instance for a registry descriptor.
///
/// A new instance must be returned on every call; instances are never shared
/// between events or re-executed.
@FunctionalInterface
public interface HandlerFactory {

    /// Creates a handler.
    ///
    /// @param descriptor the registry entry being resolved, not null
    /// @return a new handler, never null
    EventHandler create(HandlerDescriptor descriptor);
}
