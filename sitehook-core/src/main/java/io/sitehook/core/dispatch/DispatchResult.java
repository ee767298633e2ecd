package io.sitehook.core.dispatch;

import java.time.Duration;
import java.util.Objects;

/// Aggregate outcome of dispatching one event.
///
/// Bucket counts describe the event after the dispatch returned, so they include
/// handlers filed by earlier dispatches of the same event.
///
/// @param eventType the dispatched event type, not null
/// @param status overall status, not null
/// @param executed handlers invoked by this dispatch
/// @param completed size of `complete` afterwards
/// @param failed size of `failed` afterwards
/// @param remaining size of `incomplete` afterwards
/// @param duration wall time of this dispatch, null is normalized to zero
/// @see DispatchStatus
public record DispatchResult(
        String eventType,
        DispatchStatus status,
        int executed,
        int completed,
        int failed,
        int remaining,
        Duration duration) {

    public DispatchResult {
        Objects.requireNonNull(eventType, "eventType must not be null");
        Objects.requireNonNull(status, "status must not be null");
        duration = duration != null ? duration : Duration.ZERO;
    }

    /// Returns whether every handler succeeded.
    ///
    /// @return true if status is {@link DispatchStatus#COMPLETED}
    public boolean isSuccess() {
        return status == DispatchStatus.COMPLETED;
    }

    /// Returns whether the run finished with some handlers failed.
    ///
    /// @return true if status is {@link DispatchStatus#PARTIAL}
    public boolean isPartial() {
        return status == DispatchStatus.PARTIAL;
    }

    public boolean isHalted() {
        return status == DispatchStatus.HALTED;
    }
}
