package io.sitehook.core.exception;

import java.io.Serial;

/// Thrown when a push or pop names a bucket other than `incomplete`,
/// `complete` or `failed`.
///
/// Always a programming error in the caller. The event is left unmodified.
public class IncompatibleHandlerBucketException extends SitehookDispatchException {

    @Serial private static final long serialVersionUID = -2309150845274317720L;

    private final String bucketName;

    /// Creates the exception for the rejected bucket name.
    ///
    /// @param bucketName the name that was requested, may be null
    public IncompatibleHandlerBucketException(String bucketName) {
        super(String.format("The handler type \"%s\" is incompatible with this event.", bucketName));
        this.bucketName = bucketName;
    }

    /// Returns the bucket name that was rejected.
    ///
    /// @return the rejected name, may be null
    public String getBucketName() {
        return bucketName;
    }
}
