package io.sitehook.core.registry;

import java.util.Objects;

/// Supplies registry snapshots to new events.
///
/// How the registry is populated and cached belongs to the implementation.
/// Each event calls {@link #load()} once at construction and never again,
/// so later changes to the underlying data are not observed by a running event.
///
/// @see RegistrySources for the process-wide default
@FunctionalInterface
public interface RegistrySource {

    /// Returns the current registry snapshot.
    ///
    /// @return registry snapshot, never null
    HandlerRegistry load();

    /// Returns a source that always yields the given snapshot.
    ///
    /// @param registry the snapshot to return, not null
    /// @return fixed source, never null
    static RegistrySource of(HandlerRegistry registry) {
        Objects.requireNonNull(registry, "registry must not be null");
        return () -> registry;
    }
}
