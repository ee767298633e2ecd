package io.sitehook.core.dispatch;

import java.time.Instant;

/// Trace events emitted while an event is dispatched.
///
/// ### Event Flow
/// ```
/// DispatchStarted -> HandlerStarted -> HandlerFinished -> ... -> DispatchFinished
/// ```
/// `DispatchFinished` is not emitted when the run aborts with an exception.
///
/// @see DispatchObserver for consumers
public sealed interface DispatchEvent {

    /// Returns the type of the event being dispatched.
    ///
    /// @return event type, never null
    String eventType();

    /// Returns when this trace event occurred.
    ///
    /// @return timestamp, never null
    Instant timestamp();

    /// Emitted before the first handler runs.
    ///
    /// @param eventType the event type
    /// @param queued handlers in `incomplete` at the start
    /// @param timestamp when dispatch started
    record DispatchStarted(String eventType, int queued, Instant timestamp)
            implements DispatchEvent {}

    /// Emitted right before a handler is invoked.
    ///
    /// @param eventType the event type
    /// @param sequence the handler's position within the event
    /// @param handlerName display name of the handler
    /// @param timestamp the handler's `started` time
    record HandlerStarted(String eventType, long sequence, String handlerName, Instant timestamp)
            implements DispatchEvent {}

    /// Emitted after a handler has been filed.
    ///
    /// @param eventType the event type
    /// @param sequence the handler's position within the event
    /// @param handlerName display name of the handler
    /// @param success whether it was filed into `complete`
    /// @param message the outcome message
    /// @param timestamp the handler's `completed` time
    record HandlerFinished(
            String eventType,
            long sequence,
            String handlerName,
            boolean success,
            String message,
            Instant timestamp)
            implements DispatchEvent {}

    /// Emitted once the dispatch returns normally.
    ///
    /// @param eventType the event type
    /// @param result the aggregate outcome
    /// @param timestamp when dispatch finished
    record DispatchFinished(String eventType, DispatchResult result, Instant timestamp)
            implements DispatchEvent {}
}
