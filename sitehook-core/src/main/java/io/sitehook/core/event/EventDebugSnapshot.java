package io.sitehook.core.event;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Structured, read-only view of an event's buckets for diagnostics and tests.
///
/// Always carries all three buckets, keyed by {@link HandlerBucket#bucketName()} in the
/// order `incomplete`, `complete`, `failed`; each list keeps bucket order.
///
/// @param handlers bucket name to handler snapshots, not null
/// @see Event#debug()
public record EventDebugSnapshot(Map<String, List<HandlerSnapshot>> handlers) {

    public EventDebugSnapshot {
        Objects.requireNonNull(handlers, "handlers must not be null");
        Map<String, List<HandlerSnapshot>> copy = new LinkedHashMap<>();
        for (HandlerBucket bucket : HandlerBucket.values()) {
            List<HandlerSnapshot> entries = handlers.get(bucket.bucketName());
            copy.put(bucket.bucketName(), entries != null ? List.copyOf(entries) : List.of());
        }
        handlers = Collections.unmodifiableMap(copy);
    }

    /// Returns the snapshots of one bucket.
    ///
    /// @param bucket the bucket, not null
    /// @return snapshots in bucket order, never null
    public List<HandlerSnapshot> bucket(HandlerBucket bucket) {
        Objects.requireNonNull(bucket, "bucket must not be null");
        return handlers.get(bucket.bucketName());
    }
}
