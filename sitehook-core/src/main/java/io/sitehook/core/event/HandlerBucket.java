package io.sitehook.core.event;

import io.sitehook.core.exception.IncompatibleHandlerBucketException;

/// The three lifecycle buckets an event files its handlers into.
public enum HandlerBucket {
    /// Waiting to run, in FIFO order.
    INCOMPLETE("incomplete"),
    /// Ran and reported success.
    COMPLETE("complete"),
    /// Ran and reported failure, or raised.
    FAILED("failed");

    private final String bucketName;

    HandlerBucket(String bucketName) {
        this.bucketName = bucketName;
    }

    /// Returns the lower-case name used in debug snapshots and string-based calls.
    ///
    /// @return bucket name, never null
    public String bucketName() {
        return bucketName;
    }

    /// Parses a bucket name.
    ///
    /// @param name `incomplete`, `complete` or `failed`; exact, case-sensitive
    /// @return the matching bucket, never null
    /// @throws IncompatibleHandlerBucketException for any other value, including null
    public static HandlerBucket fromName(String name) {
        for (HandlerBucket bucket : values()) {
            if (bucket.bucketName.equals(name)) {
                return bucket;
            }
        }
        throw new IncompatibleHandlerBucketException(name);
    }
}
