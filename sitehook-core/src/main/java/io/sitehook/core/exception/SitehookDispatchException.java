package io.sitehook.core.exception;

import java.io.Serial;

/// Base class for failures in the dispatch machinery itself.
///
/// Unlike a handler reporting failure, these are structural: a bad bucket name,
/// an unresolvable handler, a runaway queue, a handler filed twice. They are never absorbed by the
/// dispatcher and always escalate to the caller.
///
/// @see IncompatibleHandlerBucketException
/// @see HandlerResolutionException
/// @see DispatchLimitExceededException
/// @see HandlerLifecycleException
public class SitehookDispatchException extends RuntimeException {

    @Serial private static final long serialVersionUID = 4127730917263441582L;

    public SitehookDispatchException(String message) {
        super(message);
    }

    public SitehookDispatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
