package io.sitehook.core.registry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Immutable snapshot of the handler registry.
///
/// Holds the ordered `events` listing plus any other platform data the registry
/// source supplied. The dispatcher core only ever reads `events`; the rest is
/// carried so handlers can inspect it.
///
/// ### Contracts
/// - **Postcondition**: `events` is never null, even when the source omitted it
/// - **Invariant**: descriptor order is the order the source listed them in
///
/// @param events ordered handler descriptors, null is normalized to empty
/// @param data opaque platform data, null is normalized to empty
/// @see RegistrySource for where snapshots come from
public record HandlerRegistry(List<HandlerDescriptor> events, Map<String, Object> data) {

    private static final HandlerRegistry EMPTY = new HandlerRegistry(List.of(), Map.of());

    public HandlerRegistry {
        events = events != null ? List.copyOf(events) : List.of();
        data = data != null ? Collections.unmodifiableMap(new LinkedHashMap<>(data)) : Map.of();
    }

    /// Returns a registry with no handlers and no platform data.
    ///
    /// @return the empty registry, never null
    public static HandlerRegistry empty() {
        return EMPTY;
    }

    /// Creates a registry holding only the given descriptors.
    ///
    /// @param events descriptors in registration order, not null
    /// @return new registry, never null
    public static HandlerRegistry of(List<HandlerDescriptor> events) {
        return new HandlerRegistry(events, Map.of());
    }

    /// Returns the descriptors registered for an event type, in registry order.
    ///
    /// @param type the event type, not null
    /// @return matching descriptors, never null, may be empty
    public List<HandlerDescriptor> descriptorsFor(String type) {
        Objects.requireNonNull(type, "type must not be null");
        List<HandlerDescriptor> matching = new ArrayList<>();
        for (HandlerDescriptor descriptor : events) {
            if (descriptor.type().equals(type)) {
                matching.add(descriptor);
            }
        }
        return Collections.unmodifiableList(matching);
    }

    /// Returns whether any descriptor is registered for the event type.
    ///
    /// @param type the event type, not null
    /// @return true if at least one descriptor matches
    public boolean hasHandlersFor(String type) {
        Objects.requireNonNull(type, "type must not be null");
        return events.stream().anyMatch(d -> d.type().equals(type));
    }
}
