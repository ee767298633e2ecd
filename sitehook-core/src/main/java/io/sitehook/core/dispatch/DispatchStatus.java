package io.sitehook.core.dispatch;

/// Overall outcome of one dispatch.
public enum DispatchStatus {
    /// Drained with no handler filed into `failed`
    COMPLETED,
    /// Drained, but at least one handler failed
    PARTIAL,
    /// Stopped after the first failure; handlers may remain in `incomplete`
    HALTED
}
