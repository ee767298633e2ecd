package io.sitehook.core.exception;

import io.sitehook.core.registry.HandlerDescriptor;
import java.io.Serial;

/// Thrown when a registry descriptor names a handler that no catalog entry can build.
///
/// Raised while loading handlers, before any handler of the event executes.
public class HandlerResolutionException extends SitehookDispatchException {

    @Serial private static final long serialVersionUID = 7711893059214170136L;

    private final transient HandlerDescriptor descriptor;

    public HandlerResolutionException(HandlerDescriptor descriptor, String message) {
        super(message);
        this.descriptor = descriptor;
    }

    public HandlerResolutionException(HandlerDescriptor descriptor, String message, Throwable cause) {
        super(message, cause);
        this.descriptor = descriptor;
    }

    /// Returns the descriptor that could not be resolved.
    ///
    /// @return the unresolved descriptor, may be null after deserialization
    public HandlerDescriptor getDescriptor() {
        return descriptor;
    }
}
