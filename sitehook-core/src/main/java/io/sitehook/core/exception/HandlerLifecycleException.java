package io.sitehook.core.exception;

import java.io.Serial;

/// Thrown when a tracked handler is moved against its lifecycle: filed into a second
/// bucket, returned to `incomplete` after starting, or started or completed twice.
///
/// The bucket contract is broken at that point, so the dispatcher escalates it like
/// any other {@link SitehookDispatchException} instead of recording a handler failure.
public class HandlerLifecycleException extends SitehookDispatchException {

    @Serial private static final long serialVersionUID = -6034118427725190353L;

    public HandlerLifecycleException(String message) {
        super(message);
    }
}
