package io.sitehook.core.event;

import io.sitehook.core.dispatch.DispatchResult;
import io.sitehook.core.dispatch.EventDispatcher;
import io.sitehook.core.exception.HandlerLifecycleException;
import io.sitehook.core.exception.HandlerResolutionException;
import io.sitehook.core.exception.IncompatibleHandlerBucketException;
import io.sitehook.core.handler.EventHandler;
import io.sitehook.core.handler.HandlerCatalog;
import io.sitehook.core.output.EventOutput;
import io.sitehook.core.registry.HandlerDescriptor;
import io.sitehook.core.registry.HandlerRegistry;
import io.sitehook.core.site.Site;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// A triggered event: its type, shared context, optional target site, registry
/// snapshot and the three handler buckets.
///
/// {@link #run()} loads the handlers registered for the event type into `incomplete`
/// and hands the event to its {@link EventDispatcher}, which drains that bucket and
/// files every handler into `complete` or `failed`.
///
/// {@snippet :
/// Event event = SitehookFactory.create("site_duplication_scrub", Map.of("source", 42));
/// DispatchResult result = event.run();
/// if (!result.isSuccess()) {
///     log.warning(event.debug().toString());
/// }
/// }
///
/// ### Contracts
/// - **Invariant**: every tracked handler is in exactly one bucket between dispatcher steps
/// - **Invariant**: `incomplete` is FIFO; push appends at the tail, pop removes the head
/// - **Invariant**: the registry snapshot is fixed at construction
///
/// @implNote Bucket operations are guarded by an internal lock and the context is a
/// {@link Collections#synchronizedMap(Map) synchronized map}, so an event may be inspected
/// from another thread while it runs. Iterating the context from another thread still
/// requires synchronizing on the map itself.
///
/// @see io.sitehook.core.SitehookFactory for the usual way to construct events
/// @see io.sitehook.core.dispatch.DefaultEventDispatcher for the drain loop
public class Event implements HandlerScope {

    private static final Logger logger = Logger.getLogger(Event.class.getName());

    private final EventDispatcher dispatcher;
    private final HandlerCatalog catalog;
    private final EventOutput output;
    private final String type;
    private final HandlerRegistry registry;
    private final Map<String, Object> context;
    private final Site site;

    private final Object lock = new Object();
    private final Map<HandlerBucket, Deque<TrackedHandler>> handlers =
            new EnumMap<>(HandlerBucket.class);
    private long nextSequence;

    /// Creates an event with empty buckets.
    ///
    /// @param dispatcher drains the event on {@link #run()}, not null
    /// @param catalog resolves registry descriptors into handlers, not null
    /// @param output progress sink, null means lines are dropped
    /// @param type the event type selecting registry entries, not null or blank
    /// @param registry registry snapshot, null is treated as an empty registry
    /// @param context initial context entries, copied into a new mutable map; may be null
    /// @param site the target site, null for global events
    public Event(
            EventDispatcher dispatcher,
            HandlerCatalog catalog,
            EventOutput output,
            String type,
            HandlerRegistry registry,
            Map<String, Object> context,
            Site site) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
        this.output = output != null ? output : EventOutput.discard();
        this.type = Objects.requireNonNull(type, "type must not be null");
        if (type.isBlank()) {
            throw new IllegalArgumentException("type must not be blank");
        }
        this.registry = registry != null ? registry : HandlerRegistry.empty();
        this.context =
                Collections.synchronizedMap(
                        context != null ? new LinkedHashMap<>(context) : new LinkedHashMap<>());
        this.site = site;
        for (HandlerBucket bucket : HandlerBucket.values()) {
            handlers.put(bucket, new ArrayDeque<>());
        }
    }

    @Override
    public String type() {
        return type;
    }

    @Override
    public Map<String, Object> context() {
        return context;
    }

    @Override
    public Optional<Site> site() {
        return Optional.ofNullable(site);
    }

    @Override
    public EventOutput output() {
        return output;
    }

    public HandlerRegistry registry() {
        return registry;
    }

    public EventDispatcher dispatcher() {
        return dispatcher;
    }

    /// Instantiates every registry entry matching this event's type and appends them to
    /// `incomplete` in registry order.
    ///
    /// All entries are resolved before any is enqueued, so a resolution failure leaves
    /// the buckets untouched.
    ///
    /// @apiNote **Side effects**: calling this twice enqueues the handlers twice.
    ///
    /// @return the number of handlers added
    /// @throws HandlerResolutionException if any entry cannot be resolved
    public int loadHandlers() {
        List<HandlerDescriptor> descriptors = registry.descriptorsFor(type);
        List<EventHandler> resolved = new ArrayList<>(descriptors.size());
        for (HandlerDescriptor descriptor : descriptors) {
            resolved.add(catalog.resolve(descriptor));
        }

        synchronized (lock) {
            for (int i = 0; i < resolved.size(); i++) {
                TrackedHandler tracked = track(resolved.get(i), descriptors.get(i));
                tracked.fileInto(HandlerBucket.INCOMPLETE);
                handlers.get(HandlerBucket.INCOMPLETE).addLast(tracked);
            }
        }
        logger.fine("Loaded " + resolved.size() + " handlers for event '" + type + "'");
        return resolved.size();
    }

    @Override
    public TrackedHandler enqueue(EventHandler handler) {
        return pushHandler(handler, HandlerBucket.INCOMPLETE);
    }

    /// Wraps a handler and appends it to the `incomplete` bucket.
    ///
    /// @param handler the handler, not null
    /// @return the new tracked entry, never null
    public TrackedHandler pushHandler(EventHandler handler) {
        return pushHandler(handler, HandlerBucket.INCOMPLETE);
    }

    /// Wraps a handler and appends it to a bucket given by name.
    ///
    /// @param handler the handler, not null
    /// @param bucketName `incomplete`, `complete` or `failed`
    /// @return the new tracked entry, never null
    /// @throws IncompatibleHandlerBucketException for any other name; no bucket is modified
    public TrackedHandler pushHandler(EventHandler handler, String bucketName) {
        HandlerBucket bucket = HandlerBucket.fromName(bucketName);
        return pushHandler(handler, bucket);
    }

    /// Wraps a handler and appends it to a bucket.
    ///
    /// @param handler the handler, not null
    /// @param bucket the target bucket, not null
    /// @return the new tracked entry, never null
    public TrackedHandler pushHandler(EventHandler handler, HandlerBucket bucket) {
        Objects.requireNonNull(handler, "handler must not be null");
        Objects.requireNonNull(bucket, "bucket must not be null");
        synchronized (lock) {
            TrackedHandler tracked = track(handler, null);
            tracked.fileInto(bucket);
            handlers.get(bucket).addLast(tracked);
            return tracked;
        }
    }

    /// Appends an already tracked handler to a bucket by name.
    ///
    /// @param tracked a handler previously popped from this event, not null
    /// @param bucketName `incomplete`, `complete` or `failed`
    /// @throws IncompatibleHandlerBucketException for any other name; no bucket is modified
    /// @throws HandlerLifecycleException if the handler is still in a bucket, or would
    ///     re-enter `incomplete` after starting
    public void pushHandler(TrackedHandler tracked, String bucketName) {
        pushHandler(tracked, HandlerBucket.fromName(bucketName));
    }

    /// Appends an already tracked handler to a bucket.
    ///
    /// This is how the dispatcher re-files a handler after running it.
    ///
    /// @param tracked a handler previously popped from this event, not null
    /// @param bucket the target bucket, not null
    /// @throws HandlerLifecycleException if the handler is still in a bucket, or would
    ///     re-enter `incomplete` after starting
    public void pushHandler(TrackedHandler tracked, HandlerBucket bucket) {
        Objects.requireNonNull(tracked, "tracked must not be null");
        Objects.requireNonNull(bucket, "bucket must not be null");
        synchronized (lock) {
            tracked.fileInto(bucket);
            handlers.get(bucket).addLast(tracked);
        }
    }

    /// Removes and returns the oldest handler in `incomplete`.
    ///
    /// @return the head handler, or empty if the bucket is empty
    public Optional<TrackedHandler> popHandler() {
        return popHandler(HandlerBucket.INCOMPLETE);
    }

    /// Removes and returns the oldest handler in a bucket given by name.
    ///
    /// @param bucketName `incomplete`, `complete` or `failed`
    /// @return the head handler, or empty if the bucket is empty
    /// @throws IncompatibleHandlerBucketException for any other name; no bucket is modified
    public Optional<TrackedHandler> popHandler(String bucketName) {
        return popHandler(HandlerBucket.fromName(bucketName));
    }

    /// Removes and returns the oldest handler in a bucket.
    ///
    /// @param bucket the bucket, not null
    /// @return the head handler, or empty if the bucket is empty
    public Optional<TrackedHandler> popHandler(HandlerBucket bucket) {
        Objects.requireNonNull(bucket, "bucket must not be null");
        synchronized (lock) {
            TrackedHandler head = handlers.get(bucket).pollFirst();
            if (head != null) {
                head.detach();
            }
            return Optional.ofNullable(head);
        }
    }

    /// Returns a copy of a bucket's contents in order.
    ///
    /// @param bucket the bucket, not null
    /// @return immutable list, never null
    public List<TrackedHandler> handlers(HandlerBucket bucket) {
        Objects.requireNonNull(bucket, "bucket must not be null");
        synchronized (lock) {
            return List.copyOf(handlers.get(bucket));
        }
    }

    /// Returns the number of handlers in a bucket.
    ///
    /// @param bucket the bucket, not null
    /// @return bucket size
    public int size(HandlerBucket bucket) {
        Objects.requireNonNull(bucket, "bucket must not be null");
        synchronized (lock) {
            return handlers.get(bucket).size();
        }
    }

    public boolean hasIncompleteHandlers() {
        return size(HandlerBucket.INCOMPLETE) > 0;
    }

    /// Loads the handlers for this event's type and dispatches them.
    ///
    /// @return the aggregate outcome, never null
    /// @throws HandlerResolutionException if a registry entry cannot be resolved; nothing runs
    /// @throws io.sitehook.core.exception.SitehookDispatchException if the run aborts
    public DispatchResult run() {
        int loaded = loadHandlers();
        logger.info("Running event '" + type + "' with " + loaded + " registered handlers");
        return dispatcher.dispatch(this);
    }

    /// Produces a snapshot of every bucket for diagnostics.
    ///
    /// Has no side effects; two calls without an intervening mutation return equal snapshots.
    ///
    /// @return the snapshot, never null
    public EventDebugSnapshot debug() {
        Map<String, List<HandlerSnapshot>> view = new LinkedHashMap<>();
        synchronized (lock) {
            for (HandlerBucket bucket : HandlerBucket.values()) {
                List<HandlerSnapshot> entries = new ArrayList<>();
                for (TrackedHandler tracked : handlers.get(bucket)) {
                    entries.add(tracked.snapshot());
                }
                view.put(bucket.bucketName(), entries);
            }
        }
        return new EventDebugSnapshot(view);
    }

    private TrackedHandler track(EventHandler handler, HandlerDescriptor descriptor) {
        return new TrackedHandler(nextSequence++, handler, descriptor);
    }

    @Override
    public String toString() {
        synchronized (lock) {
            return "Event[type="
                    + type
                    + ", site="
                    + (site != null ? site.id() : "none")
                    + ", incomplete="
                    + handlers.get(HandlerBucket.INCOMPLETE).size()
                    + ", complete="
                    + handlers.get(HandlerBucket.COMPLETE).size()
                    + ", failed="
                    + handlers.get(HandlerBucket.FAILED).size()
                    + "]";
        }
    }
}
