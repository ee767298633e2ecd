package io.sitehook.core.handler;

import io.sitehook.core.event.HandlerScope;

/// A unit of work bound to one event type.
///
/// Implementations capture whatever parameters they need at construction and act
/// on the event through the {@link HandlerScope} passed to {@link #execute}. The
/// dispatcher invokes each instance at most once; a retry is a fresh instance
/// enqueued through {@link HandlerScope#enqueue(EventHandler)}.
///
/// ### Contracts
/// - **Precondition**: `scope` is not null
/// - **Postcondition**: returns an outcome; returning null counts as failure
///
/// ### Failure reporting
/// Report domain failures either by returning {@link HandlerOutcome#failure(String)} or by
/// throwing; both file the handler into the `failed` bucket and the run continues.
/// Throwing a {@link io.sitehook.core.exception.SitehookDispatchException} instead
/// aborts the whole run.
///
/// @see io.sitehook.core.dispatch.DefaultEventDispatcher for the execution loop
/// @see HandlerCatalog for how registry descriptors become handlers
@FunctionalInterface
public interface EventHandler {

    /// Performs the handler's operation.
    ///
    /// @param scope access to the event's type, context, site, output and queue, not null
    /// @return the outcome, should not be null
    /// @throws Exception on domain failure; captured by the dispatcher
    HandlerOutcome execute(HandlerScope scope) throws Exception;
}
