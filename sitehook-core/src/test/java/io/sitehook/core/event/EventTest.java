package io.sitehook.core.event;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.sitehook.core.RecordingHandler;
import io.sitehook.core.TickingClock;
import io.sitehook.core.dispatch.DefaultEventDispatcher;
import io.sitehook.core.dispatch.DispatchPolicy;
import io.sitehook.core.dispatch.DispatchResult;
import io.sitehook.core.dispatch.DispatchStatus;
import io.sitehook.core.exception.HandlerLifecycleException;
import io.sitehook.core.exception.HandlerResolutionException;
import io.sitehook.core.exception.IncompatibleHandlerBucketException;
import io.sitehook.core.handler.DefaultHandlerCatalog;
import io.sitehook.core.handler.EventHandler;
import io.sitehook.core.handler.HandlerOutcome;
import io.sitehook.core.registry.HandlerDescriptor;
import io.sitehook.core.registry.HandlerRegistry;
import io.sitehook.core.site.Site;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Event")
class EventTest {

    private DefaultHandlerCatalog catalog;
    private DefaultEventDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        catalog = new DefaultHandlerCatalog();
        dispatcher =
                new DefaultEventDispatcher(
                        DispatchPolicy.defaults(), TickingClock.startingAt("2024-05-01T10:00:00Z"));
    }

    private Event event(String type, HandlerRegistry registry) {
        return new Event(dispatcher, catalog, null, type, registry, Map.of(), null);
    }

    private Event event() {
        return event("demo", HandlerRegistry.empty());
    }

    @Nested
    class Construction {

        @Test
        void shouldStartWithEmptyBuckets() {
            Event event = event();

            for (HandlerBucket bucket : HandlerBucket.values()) {
                assertThat(event.size(bucket)).isZero();
            }
            assertThat(event.hasIncompleteHandlers()).isFalse();
        }

        @Test
        void shouldTreatNullRegistryAsEmpty() {
            Event event = event("demo", null);

            assertThat(event.registry().events()).isEmpty();
            assertThat(event.loadHandlers()).isZero();
        }

        @Test
        void shouldCopyContextIntoMutableMap() {
            Event event =
                    new Event(
                            dispatcher,
                            catalog,
                            null,
                            "demo",
                            null,
                            Map.<String, Object>of("key", "value"),
                            null);

            event.context().put("other", 1);

            assertThat(event.context()).containsEntry("key", "value").containsEntry("other", 1);
        }

        @Test
        void shouldAcceptContextWritesFromSeveralThreads() throws Exception {
            Event event = event();
            int writers = 4;
            int perWriter = 500;
            CountDownLatch start = new CountDownLatch(1);
            ExecutorService pool = Executors.newFixedThreadPool(writers);
            try {
                for (int w = 0; w < writers; w++) {
                    int writer = w;
                    pool.execute(
                            () -> {
                                try {
                                    start.await();
                                } catch (InterruptedException e) {
                                    Thread.currentThread().interrupt();
                                    return;
                                }
                                for (int i = 0; i < perWriter; i++) {
                                    event.context().put(writer + "-" + i, i);
                                }
                            });
                }
                start.countDown();
            } finally {
                pool.shutdown();
            }

            assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
            assertThat(event.context()).hasSize(writers * perWriter);
        }

        @Test
        void shouldExposeSiteOnlyForSiteScopedEvents() {
            Site site = Site.of("42", "Alumni");
            Event scoped = new Event(dispatcher, catalog, null, "demo", null, null, site);

            assertThat(scoped.site()).contains(site);
            assertThat(event().site()).isEmpty();
        }

        @Test
        void shouldRejectBlankType() {
            assertThatThrownBy(() -> event(" ", null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("type");
        }

        @Test
        void shouldRejectNullDispatcher() {
            assertThatThrownBy(() -> new Event(null, catalog, null, "demo", null, null, null))
                    .isInstanceOf(NullPointerException.class)
                    .hasMessageContaining("dispatcher");
        }
    }

    @Nested
    class PushAndPop {

        @Test
        void shouldPopInFifoOrder() {
            Event event = event();
            EventHandler first = RecordingHandler.succeeding("first");
            EventHandler second = RecordingHandler.succeeding("second");

            event.pushHandler(first);
            event.pushHandler(second, "incomplete");

            assertThat(event.popHandler())
                    .get()
                    .extracting(TrackedHandler::handler)
                    .isSameAs(first);
            assertThat(event.popHandler("incomplete"))
                    .get()
                    .extracting(TrackedHandler::handler)
                    .isSameAs(second);
            assertThat(event.popHandler()).isEmpty();
        }

        @Test
        void shouldPushIntoNamedBucket() {
            Event event = event();

            TrackedHandler tracked = event.pushHandler(RecordingHandler.failing("x"), "failed");

            assertThat(event.handlers(HandlerBucket.FAILED)).containsExactly(tracked);
            assertThat(tracked.bucket()).contains(HandlerBucket.FAILED);
        }

        @Test
        void shouldAssignIncreasingSequenceNumbers() {
            Event event = event();

            TrackedHandler a = event.pushHandler(RecordingHandler.succeeding("a"));
            TrackedHandler b = event.enqueue(RecordingHandler.succeeding("b"));

            assertThat(a.sequence()).isZero();
            assertThat(b.sequence()).isEqualTo(1);
        }

        @Test
        void shouldDetachPoppedHandlerFromItsBucket() {
            Event event = event();
            event.pushHandler(RecordingHandler.succeeding("a"));

            TrackedHandler popped = event.popHandler().orElseThrow();

            assertThat(popped.bucket()).isEmpty();
            assertThat(event.size(HandlerBucket.INCOMPLETE)).isZero();
        }

        @Test
        void shouldRefuseToFileHandlerIntoTwoBuckets() {
            Event event = event();
            TrackedHandler tracked = event.pushHandler(RecordingHandler.succeeding("a"));

            assertThatThrownBy(() -> event.pushHandler(tracked, HandlerBucket.COMPLETE))
                    .isInstanceOf(HandlerLifecycleException.class)
                    .hasMessageContaining("already in bucket incomplete");
            assertThat(event.size(HandlerBucket.COMPLETE)).isZero();
        }

        @Test
        void shouldRefuseToRequeueStartedHandler() {
            Event event = event();
            event.pushHandler(RecordingHandler.succeeding("a"));
            TrackedHandler tracked = event.popHandler().orElseThrow();
            tracked.markStarted(Instant.EPOCH);

            assertThatThrownBy(() -> event.pushHandler(tracked, "incomplete"))
                    .isInstanceOf(HandlerLifecycleException.class)
                    .hasMessageContaining("cannot re-enter incomplete");
        }
    }

    @Nested
    @DisplayName("invalid bucket names")
    class InvalidBucket {

        @Test
        void shouldRejectPushToUnknownBucketWithoutMutation() {
            Event event = event();
            event.pushHandler(RecordingHandler.succeeding("kept"));
            EventDebugSnapshot before = event.debug();

            assertThatThrownBy(() -> event.pushHandler(RecordingHandler.succeeding("x"), "bogus"))
                    .isInstanceOf(IncompatibleHandlerBucketException.class)
                    .hasMessage("The handler type \"bogus\" is incompatible with this event.");

            assertThat(event.debug()).isEqualTo(before);
        }

        @Test
        void shouldRejectPopFromUnknownBucketWithoutMutation() {
            Event event = event();
            event.pushHandler(RecordingHandler.succeeding("kept"));
            EventDebugSnapshot before = event.debug();

            assertThatThrownBy(() -> event.popHandler("bogus"))
                    .isInstanceOf(IncompatibleHandlerBucketException.class)
                    .hasMessage("The handler type \"bogus\" is incompatible with this event.");

            assertThat(event.debug()).isEqualTo(before);
        }

        @Test
        void shouldTreatBucketNamesCaseSensitively() {
            Event event = event();

            assertThatThrownBy(() -> event.popHandler("INCOMPLETE"))
                    .isInstanceOf(IncompatibleHandlerBucketException.class)
                    .extracting(e -> ((IncompatibleHandlerBucketException) e).getBucketName())
                    .isEqualTo("INCOMPLETE");
        }

        @Test
        void shouldNotConsumeSequenceNumberOnRejectedPush() {
            Event event = event();

            assertThatThrownBy(() -> event.pushHandler(RecordingHandler.succeeding("x"), "nope"))
                    .isInstanceOf(IncompatibleHandlerBucketException.class);
            TrackedHandler tracked = event.pushHandler(RecordingHandler.succeeding("y"));

            assertThat(tracked.sequence()).isZero();
        }
    }

    @Nested
    class LoadHandlers {

        @Test
        void shouldLoadMatchingDescriptorsInRegistryOrder() {
            catalog.register("A", d -> RecordingHandler.succeeding("A"));
            catalog.register("B", d -> RecordingHandler.succeeding("B"));
            HandlerRegistry registry =
                    HandlerRegistry.of(
                            List.of(
                                    HandlerDescriptor.of("demo", "B"),
                                    HandlerDescriptor.of("other", "A"),
                                    HandlerDescriptor.of("demo", "A")));
            Event event = event("demo", registry);

            int loaded = event.loadHandlers();

            assertThat(loaded).isEqualTo(2);
            assertThat(event.handlers(HandlerBucket.INCOMPLETE))
                    .extracting(TrackedHandler::displayName)
                    .containsExactly("B", "A");
            assertThat(event.handlers(HandlerBucket.INCOMPLETE).get(0).descriptor())
                    .contains(HandlerDescriptor.of("demo", "B"));
        }

        @Test
        void shouldDuplicateHandlersWhenLoadedTwice() {
            catalog.register("A", d -> RecordingHandler.succeeding("A"));
            Event event =
                    event("demo", HandlerRegistry.of(List.of(HandlerDescriptor.of("demo", "A"))));

            event.loadHandlers();
            event.loadHandlers();

            assertThat(event.size(HandlerBucket.INCOMPLETE)).isEqualTo(2);
        }

        @Test
        void shouldLeaveBucketsUntouchedWhenResolutionFails() {
            catalog.register("A", d -> RecordingHandler.succeeding("A"));
            HandlerRegistry registry =
                    HandlerRegistry.of(
                            List.of(
                                    HandlerDescriptor.of("demo", "A"),
                                    HandlerDescriptor.of("demo", "Missing")));
            Event event = event("demo", registry);

            assertThatThrownBy(event::loadHandlers)
                    .isInstanceOf(HandlerResolutionException.class)
                    .hasMessageContaining("Missing");

            assertThat(event.size(HandlerBucket.INCOMPLETE)).isZero();
        }

        @Test
        void shouldAbortRunBeforeAnyHandlerExecutesWhenResolutionFails() {
            RecordingHandler a = RecordingHandler.succeeding("A");
            catalog.register("A", d -> a);
            HandlerRegistry registry =
                    HandlerRegistry.of(
                            List.of(
                                    HandlerDescriptor.of("demo", "A"),
                                    HandlerDescriptor.of("demo", "Missing")));
            Event event = event("demo", registry);

            assertThatThrownBy(event::run).isInstanceOf(HandlerResolutionException.class);

            assertThat(event.context()).doesNotContainKey(RecordingHandler.ORDER_KEY);
        }
    }

    @Nested
    class Debug {

        @Test
        void shouldAlwaysListAllThreeBuckets() {
            EventDebugSnapshot snapshot = event().debug();

            assertThat(snapshot.handlers()).containsOnlyKeys("incomplete", "complete", "failed");
            assertThat(snapshot.handlers().keySet())
                    .containsExactly("incomplete", "complete", "failed");
            assertThat(snapshot.bucket(HandlerBucket.COMPLETE)).isEmpty();
        }

        @Test
        void shouldDescribeQueuedHandlerWithoutTimestamps() {
            Event event = event();
            event.pushHandler(RecordingHandler.succeeding("a"));

            HandlerSnapshot entry = event.debug().bucket(HandlerBucket.INCOMPLETE).get(0);

            assertThat(entry.className()).isEqualTo(RecordingHandler.class.getName());
            assertThat(entry.started()).isNull();
            assertThat(entry.completed()).isNull();
            assertThat(entry.message()).isNull();
        }

        @Test
        void shouldReturnEqualSnapshotsWithoutInterveningDispatch() {
            Event event = event();
            event.pushHandler(RecordingHandler.succeeding("a"));
            event.pushHandler(RecordingHandler.failing("b"));
            event.run();

            assertThat(event.debug()).isEqualTo(event.debug());
        }

        @Test
        void shouldReturnImmutableSnapshot() {
            EventDebugSnapshot snapshot = event().debug();

            assertThatThrownBy(() -> snapshot.handlers().put("extra", List.of()))
                    .isInstanceOf(UnsupportedOperationException.class);
        }
    }

    @Nested
    @DisplayName("demo scenario")
    class DemoScenario {

        @Test
        @DisplayName("A succeeds and enqueues C, B fails: order A, B, C")
        void shouldRunEnqueuedHandlerAfterAlreadyQueuedOnes() {
            catalog.register(
                    "HandlerA",
                    d ->
                            RecordingHandler.succeeding("A")
                                    .thenEnqueue(() -> RecordingHandler.succeeding("C")));
            catalog.register("HandlerB", d -> RecordingHandler.failing("B"));
            HandlerRegistry registry =
                    HandlerRegistry.of(
                            List.of(
                                    HandlerDescriptor.of("demo", "HandlerA"),
                                    HandlerDescriptor.of("demo", "HandlerB")));
            Event event =
                    new Event(
                            dispatcher, catalog, null, "demo", registry, new HashMap<>(), null);

            DispatchResult result = event.run();

            assertThat(RecordingHandler.order(event)).containsExactly("A", "B", "C");
            assertThat(event.handlers(HandlerBucket.COMPLETE))
                    .extracting(TrackedHandler::message)
                    .containsExactly("A done", "C done");
            assertThat(event.handlers(HandlerBucket.FAILED))
                    .extracting(TrackedHandler::message)
                    .containsExactly("B broke");
            assertThat(event.size(HandlerBucket.INCOMPLETE)).isZero();
            assertThat(result.status()).isEqualTo(DispatchStatus.PARTIAL);
            assertThat(result.executed()).isEqualTo(3);
        }

        @Test
        void shouldRecordTimestampsInExecutionOrder() {
            catalog.register("HandlerA", d -> RecordingHandler.succeeding("A"));
            catalog.register("HandlerB", d -> RecordingHandler.failing("B"));
            Event event =
                    event(
                            "demo",
                            HandlerRegistry.of(
                                    List.of(
                                            HandlerDescriptor.of("demo", "HandlerA"),
                                            HandlerDescriptor.of("demo", "HandlerB"))));

            event.run();

            TrackedHandler a = event.handlers(HandlerBucket.COMPLETE).get(0);
            TrackedHandler b = event.handlers(HandlerBucket.FAILED).get(0);
            assertThat(a.started()).isPresent();
            assertThat(a.completed().orElseThrow()).isAfter(a.started().orElseThrow());
            assertThat(b.started().orElseThrow()).isAfter(a.completed().orElseThrow());
            assertThat(a.isSuccess()).isTrue();
            assertThat(b.isSuccess()).isFalse();
        }

        @Test
        void shouldReportSuccessWhenNoHandlerFails() {
            catalog.register("ok", d -> (EventHandler) scope -> HandlerOutcome.success("fine"));
            Event event =
                    event("demo", HandlerRegistry.of(List.of(HandlerDescriptor.of("demo", "ok"))));

            DispatchResult result = event.run();

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.completed()).isEqualTo(1);
        }
    }
}
