package io.sitehook.core.handler.builtin;

import io.sitehook.core.event.HandlerScope;
import io.sitehook.core.exception.SitehookDispatchException;
import io.sitehook.core.handler.EventHandler;
import io.sitehook.core.handler.HandlerOutcome;
import java.util.Objects;
import java.util.function.Supplier;

/// Runs a freshly supplied delegate and, on failure, enqueues a fresh retry.
///
/// The dispatcher never re-runs a handler, so each attempt is a new
/// `RetryingHandler` with a new delegate from the supplier. The failed attempt is
/// still filed into `failed`; the retry runs later in the same dispatch, behind
/// whatever was already queued.
///
/// Structural exceptions from the delegate are not retried; they propagate.
public final class RetryingHandler implements EventHandler {

    private final Supplier<? extends EventHandler> delegateSupplier;
    private final int attempt;
    private final int maxAttempts;

    /// Creates the first attempt.
    ///
    /// @param delegateSupplier supplies a new delegate per attempt, not null
    /// @param maxAttempts total attempts allowed, at least 1
    public RetryingHandler(Supplier<? extends EventHandler> delegateSupplier, int maxAttempts) {
        this(delegateSupplier, 1, maxAttempts);
    }

    private RetryingHandler(
            Supplier<? extends EventHandler> delegateSupplier, int attempt, int maxAttempts) {
        this.delegateSupplier =
                Objects.requireNonNull(delegateSupplier, "delegateSupplier must not be null");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        this.attempt = attempt;
        this.maxAttempts = maxAttempts;
    }

    public int getAttempt() {
        return attempt;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    @Override
    public HandlerOutcome execute(HandlerScope scope) throws InterruptedException {
        HandlerOutcome outcome = runDelegate(scope);
        String prefix = "Attempt " + attempt + "/" + maxAttempts;
        if (outcome.success()) {
            return HandlerOutcome.success(prefix + ": " + outcome.message());
        }
        if (attempt < maxAttempts) {
            scope.enqueue(new RetryingHandler(delegateSupplier, attempt + 1, maxAttempts));
            return HandlerOutcome.failure(prefix + " failed, retry enqueued: " + outcome.message());
        }
        return HandlerOutcome.failure(prefix + " failed, no attempts left: " + outcome.message());
    }

    private HandlerOutcome runDelegate(HandlerScope scope) throws InterruptedException {
        EventHandler delegate = delegateSupplier.get();
        if (delegate == null) {
            return HandlerOutcome.failure("Retry supplier returned no handler");
        }
        try {
            HandlerOutcome outcome = delegate.execute(scope);
            return outcome != null ? outcome : HandlerOutcome.failure("Handler returned no outcome");
        } catch (SitehookDispatchException | InterruptedException e) {
            throw e;
        } catch (Exception e) {
            String message = e.getMessage();
            return HandlerOutcome.failure(message != null ? message : e.getClass().getSimpleName());
        }
    }
}
