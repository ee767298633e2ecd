package io.sitehook.core.handler;

/// What a handler reports when it finishes.
///
/// @param success whether the handler's operation succeeded
/// @param message human-readable outcome, null is normalized to empty
public record HandlerOutcome(boolean success, String message) {

    public HandlerOutcome {
        message = message != null ? message : "";
    }

    /// Creates a successful outcome.
    ///
    /// @param message outcome description, may be null
    /// @return successful outcome, never null
    public static HandlerOutcome success(String message) {
        return new HandlerOutcome(true, message);
    }

    /// Creates a failed outcome.
    ///
    /// @param message failure description, may be null
    /// @return failed outcome, never null
    public static HandlerOutcome failure(String message) {
        return new HandlerOutcome(false, message);
    }

    public boolean isFailure() {
        return !success;
    }
}
