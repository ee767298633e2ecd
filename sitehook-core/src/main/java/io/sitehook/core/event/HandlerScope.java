package io.sitehook.core.event;

import io.sitehook.core.handler.EventHandler;
import io.sitehook.core.output.EventOutput;
import io.sitehook.core.site.Site;
import java.util.Map;
import java.util.Optional;

/// The part of an {@link Event} a running handler may touch.
///
/// Handlers read and write the shared context, inspect the site, write output
/// and enqueue follow-up handlers for the same run. They cannot reach the other
/// buckets or the dispatcher.
public interface HandlerScope {

    /// Returns the event type being dispatched.
    ///
    /// @return event type, never null
    String type();

    /// Returns the context shared by every handler of this event.
    ///
    /// Writes are visible to handlers that run afterwards.
    ///
    /// @return the live, mutable context map, never null
    Map<String, Object> context();

    /// Returns the target site of a site-scoped event.
    ///
    /// @return the site, or empty for global events
    Optional<Site> site();

    /// Returns the event's output sink.
    ///
    /// @return output sink, never null
    EventOutput output();

    /// Appends a handler to the tail of the `incomplete` bucket.
    ///
    /// @param handler the handler to run later in this dispatch, not null
    /// @return the tracked entry created for it, never null
    TrackedHandler enqueue(EventHandler handler);
}
