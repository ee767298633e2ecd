package io.sitehook.core.dispatch;

import io.sitehook.core.event.Event;

/// Drains an event's `incomplete` bucket.
///
/// @see DefaultEventDispatcher
@FunctionalInterface
public interface EventDispatcher {

    /// Runs every handler queued in `incomplete`, including handlers enqueued during
    /// the run, and files each into `complete` or `failed`.
    ///
    /// @param event the event to drain, not null
    /// @return the aggregate outcome, never null
    /// @throws io.sitehook.core.exception.SitehookDispatchException if the run aborts
    DispatchResult dispatch(Event event);
}
