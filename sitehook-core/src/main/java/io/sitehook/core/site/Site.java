package io.sitehook.core.site;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// The site a site-scoped event acts upon.
///
/// Only identity is required; everything else the platform knows about the
/// site travels in `attributes` for handlers to read.
///
/// @param id stable site identifier, not null or blank
/// @param name human-readable site name, may be null
/// @param attributes additional site data, null is normalized to empty
public record Site(String id, String name, Map<String, Object> attributes) {

    public Site {
        Objects.requireNonNull(id, "id must not be null");
        if (id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        attributes =
                attributes != null
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(attributes))
                        : Map.of();
    }

    /// Creates a site without attributes.
    ///
    /// @param id site identifier, not null
    /// @param name site name, may be null
    /// @return new site, never null
    public static Site of(String id, String name) {
        return new Site(id, name, Map.of());
    }

    /// Returns an attribute value.
    ///
    /// @param key attribute key, not null
    /// @return the value, or empty if absent or null
    public Optional<Object> attribute(String key) {
        Objects.requireNonNull(key, "key must not be null");
        return Optional.ofNullable(attributes.get(key));
    }

    /// Returns the name, falling back to the id.
    ///
    /// @return display label, never null
    public String label() {
        return name != null && !name.isBlank() ? name : id;
    }
}
