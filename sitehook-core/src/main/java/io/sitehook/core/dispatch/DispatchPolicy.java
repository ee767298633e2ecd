package io.sitehook.core.dispatch;

/// Knobs controlling a {@link DefaultEventDispatcher}.
///
/// @param stopOnFirstFailure stop draining after the first handler is filed into `failed`
/// @param maxHandlerExecutions upper bound on handler invocations per dispatch, positive
public record DispatchPolicy(boolean stopOnFirstFailure, int maxHandlerExecutions) {

    public static final int DEFAULT_MAX_HANDLER_EXECUTIONS = 10_000;

    public DispatchPolicy {
        if (maxHandlerExecutions <= 0) {
            throw new IllegalArgumentException(
                    "maxHandlerExecutions must be positive, got " + maxHandlerExecutions);
        }
    }

    /// Continue past failures, bounded at {@value #DEFAULT_MAX_HANDLER_EXECUTIONS} executions.
    ///
    /// @return default policy, never null
    public static DispatchPolicy defaults() {
        return new DispatchPolicy(false, DEFAULT_MAX_HANDLER_EXECUTIONS);
    }
}
