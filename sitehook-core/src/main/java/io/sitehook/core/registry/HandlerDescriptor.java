package io.sitehook.core.registry;

import java.util.Objects;

/// Static registry entry naming one handler for one event type.
///
/// The `handler` identifier is looked up in a {@link io.sitehook.core.handler.HandlerCatalog}.
/// The optional `path` is a namespace hint: when present, the path-qualified name is
/// tried before the bare identifier.
///
/// ### Contracts
/// - **Precondition**: `type` and `handler` must not be null or blank
/// - **Postcondition**: `path` is either null or non-blank with surrounding slashes removed
///
/// @param type the event type this handler applies to, not null
/// @param handler the catalog identifier of the handler, not null
/// @param path optional namespace hint, may be null
public record HandlerDescriptor(String type, String handler, String path) {

    public HandlerDescriptor {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(handler, "handler must not be null");
        if (type.isBlank()) {
            throw new IllegalArgumentException("type must not be blank");
        }
        if (handler.isBlank()) {
            throw new IllegalArgumentException("handler must not be blank");
        }
        path = normalizePath(path);
    }

    /// Creates a descriptor without a path.
    ///
    /// @param type the event type, not null
    /// @param handler the catalog identifier, not null
    /// @return new descriptor, never null
    public static HandlerDescriptor of(String type, String handler) {
        return new HandlerDescriptor(type, handler, null);
    }

    /// Returns whether this descriptor carries a namespace path.
    ///
    /// @return true if `path` is set
    public boolean hasPath() {
        return path != null;
    }

    /// Returns `path/handler` when a path is set, otherwise the bare handler identifier.
    ///
    /// @return the most specific lookup name, never null
    public String qualifiedName() {
        return hasPath() ? path + "/" + handler : handler;
    }

    private static String normalizePath(String path) {
        if (path == null) {
            return null;
        }
        int start = 0;
        int end = path.length();
        while (start < end && path.charAt(start) == '/') {
            start++;
        }
        while (end > start && path.charAt(end - 1) == '/') {
            end--;
        }
        String trimmed = path.substring(start, end).strip();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
