package io.sitehook.core.dispatch;

import io.sitehook.core.dispatch.DispatchEvent.DispatchFinished;
import io.sitehook.core.dispatch.DispatchEvent.DispatchStarted;
import io.sitehook.core.dispatch.DispatchEvent.HandlerFinished;
import io.sitehook.core.dispatch.DispatchEvent.HandlerStarted;
import io.sitehook.core.event.Event;
import io.sitehook.core.event.HandlerBucket;
import io.sitehook.core.event.TrackedHandler;
import io.sitehook.core.exception.DispatchLimitExceededException;
import io.sitehook.core.exception.SitehookDispatchException;
import io.sitehook.core.handler.HandlerOutcome;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Synchronous, single-threaded {@link EventDispatcher}.
///
/// ### Execution Flow
/// 1. Emit {@link DispatchStarted}
/// 2. While `incomplete` is not empty:
///    - Refuse to go past {@link DispatchPolicy#maxHandlerExecutions()}
///    - Pop the head, mark it started, emit {@link HandlerStarted}
///    - Invoke the handler with the event as its {@link io.sitehook.core.event.HandlerScope}
///    - Mark it completed and file it into `complete` or `failed`, emit {@link HandlerFinished}
///    - With {@link DispatchPolicy#stopOnFirstFailure()}, stop after a failure
/// 3. Emit {@link DispatchFinished}
///
/// The bucket is re-checked after every handler, so handlers enqueued during the run
/// are executed in the same dispatch, behind everything already queued.
///
/// ### Failures
/// A returned failure, a null outcome, or any exception other than a
/// {@link SitehookDispatchException} is captured into the handler and the run goes on.
/// A {@link SitehookDispatchException} aborts the run: the raising handler is filed into
/// `failed` without a `completed` timestamp, the rest stay in `incomplete`, and the
/// exception propagates. A {@link io.sitehook.core.exception.HandlerLifecycleException}
/// raised by a handler that misfiles a tracked handler aborts the same way. There are no
/// implicit retries.
///
/// Output sink failures are logged at `WARNING` and never change bucket membership or
/// the run's outcome, the same as observer failures.
///
/// @implNote Thread-safe for observer registration ({@link CopyOnWriteArrayList}).
/// Dispatching the same event from two threads at once is not supported.
///
/// @see DispatchPolicy
/// @see DispatchObserver
public class DefaultEventDispatcher implements EventDispatcher {

    private static final Logger logger = Logger.getLogger(DefaultEventDispatcher.class.getName());

    static final String NO_OUTCOME_MESSAGE = "Handler returned no outcome";

    private final DispatchPolicy policy;
    private final Clock clock;
    private final List<DispatchObserver> observers = new CopyOnWriteArrayList<>();

    /// Creates a dispatcher with {@link DispatchPolicy#defaults()}.
    public DefaultEventDispatcher() {
        this(DispatchPolicy.defaults());
    }

    public DefaultEventDispatcher(DispatchPolicy policy) {
        this(policy, Clock.systemUTC());
    }

    /// Creates a dispatcher.
    ///
    /// @param policy failure and bound policy, not null
    /// @param clock source of handler timestamps, not null
    public DefaultEventDispatcher(DispatchPolicy policy, Clock clock) {
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public DispatchPolicy getPolicy() {
        return policy;
    }

    /// Registers an observer for dispatch trace events.
    ///
    /// @apiNote **Side effects**: adds to the internal observer list; duplicates are allowed.
    ///
    /// @param observer the observer, not null
    public void addObserver(DispatchObserver observer) {
        Objects.requireNonNull(observer, "observer must not be null");
        observers.add(observer);
    }

    /// Removes a previously registered observer.
    ///
    /// @param observer the observer to remove
    /// @return true if it was registered
    public boolean removeObserver(DispatchObserver observer) {
        return observers.remove(observer);
    }

    @Override
    public DispatchResult dispatch(Event event) {
        Objects.requireNonNull(event, "event must not be null");

        Instant dispatchStart = clock.instant();
        notifyObservers(
                new DispatchStarted(
                        event.type(), event.size(HandlerBucket.INCOMPLETE), dispatchStart));

        int executed = 0;
        boolean halted = false;
        while (event.hasIncompleteHandlers()) {
            if (executed >= policy.maxHandlerExecutions()) {
                logger.severe(
                        "Event '"
                                + event.type()
                                + "' hit the dispatch limit with "
                                + event.size(HandlerBucket.INCOMPLETE)
                                + " handlers still queued");
                throw new DispatchLimitExceededException(
                        event.type(), policy.maxHandlerExecutions());
            }

            TrackedHandler next = event.popHandler(HandlerBucket.INCOMPLETE).orElse(null);
            if (next == null) {
                break;
            }
            executed++;

            boolean success = execute(event, next);
            if (!success && policy.stopOnFirstFailure()) {
                halted = true;
                logger.info(
                        "Stopping event '"
                                + event.type()
                                + "' after failure of "
                                + next.displayName());
                break;
            }
        }

        Instant dispatchEnd = clock.instant();
        DispatchResult result =
                new DispatchResult(
                        event.type(),
                        statusOf(event, halted),
                        executed,
                        event.size(HandlerBucket.COMPLETE),
                        event.size(HandlerBucket.FAILED),
                        event.size(HandlerBucket.INCOMPLETE),
                        Duration.between(dispatchStart, dispatchEnd));

        logger.info(
                "Event '"
                        + event.type()
                        + "' finished with status "
                        + result.status()
                        + ": "
                        + result.executed()
                        + " executed, "
                        + result.completed()
                        + " complete, "
                        + result.failed()
                        + " failed, "
                        + result.remaining()
                        + " remaining");
        notifyObservers(new DispatchFinished(event.type(), result, dispatchEnd));
        return result;
    }

    // -----------------------------------------------------------------------
    // Helpers
    // -----------------------------------------------------------------------

    private boolean execute(Event event, TrackedHandler tracked) {
        String name = tracked.displayName();
        Instant started = clock.instant();
        try {
            tracked.markStarted(started);
        } catch (SitehookDispatchException e) {
            throw abort(event, tracked, e);
        }
        write(event, "Running handler " + name);
        logger.fine(
                "Running handler "
                        + name
                        + " #"
                        + tracked.sequence()
                        + " for '"
                        + event.type()
                        + "'");
        notifyObservers(new HandlerStarted(event.type(), tracked.sequence(), name, started));

        HandlerOutcome outcome;
        try {
            outcome = tracked.handler().execute(event);
            if (outcome == null) {
                outcome = HandlerOutcome.failure(NO_OUTCOME_MESSAGE);
            }
        } catch (SitehookDispatchException e) {
            throw abort(event, tracked, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outcome = HandlerOutcome.failure(describe(e));
        } catch (Exception e) {
            logger.log(Level.WARNING, "Handler " + name + " raised: " + describe(e), e);
            outcome = HandlerOutcome.failure(describe(e));
        }

        Instant completed = clock.instant();
        tracked.markCompleted(completed, outcome);
        event.pushHandler(
                tracked, outcome.success() ? HandlerBucket.COMPLETE : HandlerBucket.FAILED);

        if (outcome.success()) {
            write(event, "Handler " + name + " completed: " + outcome.message());
        } else {
            write(event, "Handler " + name + " failed: " + outcome.message());
            logger.warning("Handler " + name + " failed: " + outcome.message());
        }
        notifyObservers(
                new HandlerFinished(
                        event.type(),
                        tracked.sequence(),
                        name,
                        outcome.success(),
                        outcome.message(),
                        completed));
        return outcome.success();
    }

    /// Files the running handler into `failed` without a `completed` timestamp and returns
    /// the exception for the caller to rethrow.
    private SitehookDispatchException abort(
            Event event, TrackedHandler tracked, SitehookDispatchException e) {
        String name = tracked.displayName();
        tracked.markAborted(e.getMessage());
        if (tracked.bucket().isEmpty()) {
            event.pushHandler(tracked, HandlerBucket.FAILED);
        }
        write(event, "Handler " + name + " aborted the run: " + e.getMessage());
        logger.log(Level.SEVERE, "Handler " + name + " aborted event '" + event.type() + "'", e);
        return e;
    }

    private static DispatchStatus statusOf(Event event, boolean halted) {
        if (halted) {
            return DispatchStatus.HALTED;
        }
        return event.size(HandlerBucket.FAILED) > 0
                ? DispatchStatus.PARTIAL
                : DispatchStatus.COMPLETED;
    }

    private static String describe(Exception e) {
        String message = e.getMessage();
        return message != null ? message : e.getClass().getSimpleName();
    }

    /// Writes a progress line; a failing sink is logged and never interrupts the run.
    private static void write(Event event, String line) {
        try {
            event.output().writeln(line);
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Event output failed on '" + line + "'", e);
        }
    }

    private void notifyObservers(DispatchEvent event) {
        for (DispatchObserver observer : observers) {
            try {
                observer.onEvent(event);
            } catch (Exception e) {
                logger.log(Level.WARNING, "Dispatch observer failed on " + event, e);
            }
        }
    }
}
