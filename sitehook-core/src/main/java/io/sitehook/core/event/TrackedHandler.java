package io.sitehook.core.event;

import io.sitehook.core.exception.HandlerLifecycleException;
import io.sitehook.core.handler.EventHandler;
import io.sitehook.core.handler.HandlerOutcome;
import io.sitehook.core.registry.HandlerDescriptor;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/// A handler instance together with its lifecycle state inside one event.
///
/// The {@link EventHandler} itself is stateless from the dispatcher's point of view;
/// this wrapper owns `started`, `completed`, `message` and `success`, and remembers
/// which bucket currently holds it.
///
/// ### Lifecycle
/// ```
/// queued (INCOMPLETE) -> popped (no bucket, running) -> COMPLETE | FAILED
/// ```
/// A tracked handler is started at most once; it never returns to `INCOMPLETE`.
///
/// @implNote Not thread-safe. Lifecycle fields are written only by the dispatching thread;
/// bucket membership changes happen under the owning {@link Event}'s lock.
public final class TrackedHandler {

    private final long sequence;
    private final EventHandler handler;
    private final HandlerDescriptor descriptor;

    private HandlerBucket bucket;
    private Instant started;
    private Instant completed;
    private String message;
    private boolean success;

    TrackedHandler(long sequence, EventHandler handler, HandlerDescriptor descriptor) {
        this.sequence = sequence;
        this.handler = Objects.requireNonNull(handler, "handler must not be null");
        this.descriptor = descriptor;
    }

    /// Returns the position this handler was added at within its event, starting at 0.
    public long sequence() {
        return sequence;
    }

    public EventHandler handler() {
        return handler;
    }

    /// Returns the registry descriptor this handler was loaded from.
    ///
    /// @return the descriptor, or empty for handlers enqueued directly
    public Optional<HandlerDescriptor> descriptor() {
        return Optional.ofNullable(descriptor);
    }

    /// Returns the implementation identity shown in debug snapshots.
    ///
    /// @return fully-qualified class name of the handler, never null
    public String handlerClass() {
        return handler.getClass().getName();
    }

    /// Returns a short label for log lines.
    ///
    /// @return registry identifier if loaded from the registry, else the simple class name
    public String displayName() {
        if (descriptor != null) {
            return descriptor.handler();
        }
        String simple = handler.getClass().getSimpleName();
        return simple.isEmpty() ? handlerClass() : simple;
    }

    /// Returns the bucket holding this handler.
    ///
    /// @return current bucket, or empty while the handler is popped
    public Optional<HandlerBucket> bucket() {
        return Optional.ofNullable(bucket);
    }

    public Optional<Instant> started() {
        return Optional.ofNullable(started);
    }

    public Optional<Instant> completed() {
        return Optional.ofNullable(completed);
    }

    /// Returns the outcome message.
    ///
    /// @return message, or null until the handler has finished or aborted
    public String message() {
        return message;
    }

    /// Returns whether the handler succeeded; meaningful only once {@link #isCompleted()}.
    public boolean isSuccess() {
        return success;
    }

    public boolean isStarted() {
        return started != null;
    }

    public boolean isCompleted() {
        return completed != null;
    }

    /// Records the start of execution.
    ///
    /// @param timestamp start time, not null
    /// @throws HandlerLifecycleException if the handler was already started
    public void markStarted(Instant timestamp) {
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        if (started != null) {
            throw new HandlerLifecycleException(
                    "Handler " + displayName() + " #" + sequence + " was already started");
        }
        this.started = timestamp;
    }

    /// Records the finished outcome.
    ///
    /// @param timestamp completion time, not null
    /// @param outcome the reported outcome, not null
    /// @throws HandlerLifecycleException if the handler was never started or already completed
    public void markCompleted(Instant timestamp, HandlerOutcome outcome) {
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        Objects.requireNonNull(outcome, "outcome must not be null");
        if (started == null) {
            throw new HandlerLifecycleException(
                    "Handler " + displayName() + " #" + sequence + " was never started");
        }
        if (completed != null) {
            throw new HandlerLifecycleException(
                    "Handler " + displayName() + " #" + sequence + " was already completed");
        }
        this.completed = timestamp;
        this.success = outcome.success();
        this.message = outcome.message();
    }

    /// Records an abort: the run stopped inside this handler and it never completed.
    ///
    /// @param reason abort description, may be null
    public void markAborted(String reason) {
        this.success = false;
        this.message = reason;
    }

    /// Records membership in a bucket.
    ///
    /// @throws HandlerLifecycleException if the handler is already in a bucket, or would
    ///     re-enter `incomplete` after starting
    void fileInto(HandlerBucket target) {
        if (bucket != null) {
            throw new HandlerLifecycleException(
                    "Handler "
                            + displayName()
                            + " #"
                            + sequence
                            + " is already in bucket "
                            + bucket.bucketName());
        }
        if (target == HandlerBucket.INCOMPLETE && started != null) {
            throw new HandlerLifecycleException(
                    "Handler " + displayName() + " #" + sequence + " cannot re-enter incomplete");
        }
        this.bucket = target;
    }

    void detach() {
        this.bucket = null;
    }

    HandlerSnapshot snapshot() {
        return new HandlerSnapshot(handlerClass(), started, completed, message);
    }

    @Override
    public String toString() {
        return "TrackedHandler["
                + displayName()
                + " #"
                + sequence
                + ", bucket="
                + (bucket != null ? bucket.bucketName() : "none")
                + "]";
    }
}
