package io.sitehook.core.dispatch;

/// Receives {@link DispatchEvent}s from a {@link DefaultEventDispatcher}.
///
/// Called synchronously on the dispatching thread, so keep it quick. An
/// exception thrown here is logged and otherwise ignored.
@FunctionalInterface
public interface DispatchObserver {

    /// Called for each trace event.
    ///
    /// @param event the trace event, never null
    void onEvent(DispatchEvent event);
}
