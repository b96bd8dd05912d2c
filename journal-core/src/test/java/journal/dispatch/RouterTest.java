package journal.dispatch;

import journal.Destination;
import journal.JournalEvent;
import journal.JournalPath;
import journal.RecordingDestination;
import journal.listener.OutputListener;
import journal.listener.RawOutputListener;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RouterTest {

    private static JournalEvent event(String path, String content) {
        return JournalEvent.builder(path).content(content).build();
    }

    private static List<String> contents(int from, int to) {
        List<String> result = new ArrayList<>();
        for (int i = from; i < to; i++) {
            result.add(Integer.toString(i));
        }
        return result;
    }

    // ── Builder validation ──────────────────────────────────────────

    @Test
    void builderRejectsZeroQueueCapacity() {
        assertThrows(IllegalArgumentException.class, () -> Router.builder().queueCapacity(0).build());
    }

    @Test
    void builderRejectsNegativeHistoryCapacity() {
        assertThrows(IllegalArgumentException.class, () -> Router.builder().historyCapacity(-1).build());
    }

    @Test
    void builderRejectsZeroDeliveryWorkers() {
        assertThrows(IllegalArgumentException.class, () -> Router.builder().deliveryWorkerCount(0).build());
    }

    @Test
    void builderRejectsNegativeDrainTimeout() {
        assertThrows(IllegalArgumentException.class, () -> Router.builder().drainTimeoutMs(-1).build());
    }

    @Test
    void builderRejectsNullDeliveryMode() {
        assertThrows(NullPointerException.class, () -> Router.builder().deliveryMode(null).build());
    }

    // ── Routing ─────────────────────────────────────────────────────

    @Test
    void routesToRecursiveAndExactListeners() throws Exception {
        RecordingDestination d1 = new RecordingDestination("d1");
        RecordingDestination d2 = new RecordingDestination("d2");
        RecordingDestination sentinel = new RecordingDestination("sentinel");
        try (Router router = Router.builder().build()) {
            router.register(new RawOutputListener("/journal", true, d1));
            router.register(new RawOutputListener("/journal/channel", false, d2));
            router.register(new RawOutputListener("/", true, sentinel));
            router.start();

            router.publish(event("/journal/channel/add", "add"));
            router.publish(event("/journal/channel", "channel"));
            router.publish(event("/journalist", "other"));

            assertTrue(sentinel.await(3, 5, TimeUnit.SECONDS));
            assertEquals(List.of("add", "channel"), d1.received());
            assertEquals(List.of("channel"), d2.received());
        }
    }

    @Test
    void eachListenerObservesPublishOrder() throws Exception {
        RecordingDestination destination = new RecordingDestination("d");
        try (Router router = Router.builder().build()) {
            router.register(new RawOutputListener("/a", true, destination));
            router.start();

            for (int i = 0; i < 200; i++) {
                router.publish(event(i % 2 == 0 ? "/a/x" : "/a/y", Integer.toString(i)));
            }

            assertTrue(destination.await(200, 5, TimeUnit.SECONDS));
            assertEquals(contents(0, 200), destination.received());
        }
    }

    @Test
    void concurrentModeDeliversToAllListenersInOrder() throws Exception {
        List<RecordingDestination> destinations = List.of(
                new RecordingDestination("d1"), new RecordingDestination("d2"), new RecordingDestination("d3"));
        try (Router router = Router.builder()
                .deliveryMode(DeliveryMode.CONCURRENT)
                .deliveryWorkerCount(3)
                .build()) {
            for (RecordingDestination d : destinations) {
                router.register(new RawOutputListener("/a", true, d));
            }
            router.start();

            for (int i = 0; i < 50; i++) {
                router.publish(event("/a/b", Integer.toString(i)));
            }

            for (RecordingDestination d : destinations) {
                assertTrue(d.await(50, 5, TimeUnit.SECONDS));
                assertEquals(contents(0, 50), d.received());
            }
        }
    }

    @Test
    void scopedListenerOnlyReceivesItsScope() throws Exception {
        RecordingDestination scoped = new RecordingDestination("scoped");
        RecordingDestination all = new RecordingDestination("all");
        try (Router router = Router.builder().build()) {
            router.register(new RawOutputListener(JournalPath.of("/a"), true, "guild-1", scoped));
            router.register(new RawOutputListener("/a", true, all));
            router.start();

            router.publish(JournalEvent.builder("/a/x").scope("guild-2").content("other").build());
            router.publish(JournalEvent.builder("/a/x").scope("guild-1").content("mine").build());

            assertTrue(all.await(2, 5, TimeUnit.SECONDS));
            assertEquals(List.of("mine"), scoped.received());
        }
    }

    // ── Failures ────────────────────────────────────────────────────

    @Test
    void failingDestinationDoesNotAffectOthers() throws Exception {
        RecordingDestination failing = RecordingDestination.failing("broken", "unreachable");
        RecordingDestination healthy = new RecordingDestination("healthy");
        RecordingRouterMetrics metrics = new RecordingRouterMetrics();
        try (Router router = Router.builder().metrics(metrics).build()) {
            router.register(new RawOutputListener("/a", true, failing));
            router.register(new RawOutputListener("/a", true, healthy));
            router.start();

            JournalEvent first = event("/a", "1");
            assertTrue(router.publish(first));
            router.publish(event("/a", "2"));

            assertTrue(healthy.await(2, 5, TimeUnit.SECONDS));
            assertEquals(List.of("1", "2"), healthy.received());
            assertSame(first, router.history().snapshot().get(1));
            assertTrue(router.isRunning());
        }
        assertEquals(2, metrics.failure.get());
        assertEquals(2, metrics.success.get());
    }

    @Test
    void destinationThrowingErrorDoesNotStarveLaterListeners() throws Exception {
        Destination broken = new Destination() {
            @Override
            public String id() {
                return "broken";
            }

            @Override
            public void send(String content) {
                throw new AssertionError("client library misbehaved");
            }
        };
        RecordingDestination healthy = new RecordingDestination("healthy");
        RecordingRouterMetrics metrics = new RecordingRouterMetrics();
        try (Router router = Router.builder().metrics(metrics).build()) {
            router.register(new RawOutputListener("/a", true, broken));
            router.register(new RawOutputListener("/a", true, healthy));
            router.start();

            router.publish(event("/a/x", "1"));
            router.publish(event("/a/y", "2"));

            assertTrue(healthy.await(2, 5, TimeUnit.SECONDS));
            assertEquals(List.of("1", "2"), healthy.received());
            assertTrue(router.isRunning());
        }
        assertEquals(2, metrics.failure.get());
        assertEquals(2, metrics.success.get());
    }

    @Test
    void countsUnmatchedEvents() throws Exception {
        RecordingRouterMetrics metrics = new RecordingRouterMetrics();
        RecordingDestination destination = new RecordingDestination("d");
        try (Router router = Router.builder().metrics(metrics).build()) {
            router.register(new RawOutputListener("/a", false, destination));
            router.start();

            router.publish(event("/b", "nobody"));
            router.publish(event("/a", "someone"));

            assertTrue(destination.await(1, 5, TimeUnit.SECONDS));
        }
        assertEquals(1, metrics.unmatched.get());
        assertEquals(2, metrics.published.get());
        assertEquals(2, metrics.lastHistorySize);
    }

    // ── Registration timing ─────────────────────────────────────────

    @Test
    void registrationIsNotRetroactiveForQueuedEvents() throws Exception {
        RecordingDestination sentinel = new RecordingDestination("sentinel");
        RecordingDestination late = new RecordingDestination("late");
        try (Router router = Router.builder().build()) {
            router.register(new RawOutputListener("/a", true, sentinel));
            router.publish(event("/a", "before"));
            router.register(new RawOutputListener("/a", true, late));
            router.publish(event("/a", "after"));
            router.start();

            assertTrue(sentinel.await(2, 5, TimeUnit.SECONDS));
            assertEquals(List.of("after"), late.received());
        }
    }

    @Test
    void updatingRegistrationKeepsEarlierEvents() throws Exception {
        RecordingDestination destination = new RecordingDestination("d");
        try (Router router = Router.builder().build()) {
            router.register(new RawOutputListener("/a", true, destination));
            router.publish(event("/a/b", "queued"));
            router.register(new RawOutputListener("/a", true, destination));
            router.start();

            assertTrue(destination.await(1, 5, TimeUnit.SECONDS));
            assertEquals(List.of("queued"), destination.received());
        }
    }

    @Test
    void unregisteredListenerMissesPendingEvents() throws Exception {
        RecordingDestination removed = new RecordingDestination("removed");
        RecordingDestination sentinel = new RecordingDestination("sentinel");
        try (Router router = Router.builder().build()) {
            OutputListener listener = new RawOutputListener("/a", true, removed);
            router.register(listener);
            router.register(new RawOutputListener("/a", true, sentinel));
            router.publish(event("/a", "pending"));

            assertTrue(router.unregister(listener));
            assertFalse(router.unregister(listener));
            router.start();

            assertTrue(sentinel.await(1, 5, TimeUnit.SECONDS));
            assertTrue(removed.received().isEmpty());
        }
    }

    @Test
    void movedListenerDeliversToNewDestination() throws Exception {
        RecordingDestination oldDestination = new RecordingDestination("old");
        RecordingDestination newDestination = new RecordingDestination("new");
        try (Router router = Router.builder().build()) {
            OutputListener listener = new RawOutputListener("/a", true, oldDestination);
            router.register(listener);

            assertTrue(router.move(listener, newDestination));
            assertSame(listener, router.get("/a", newDestination).orElseThrow());
            assertTrue(router.get("/a", oldDestination).isEmpty());

            router.start();
            router.publish(event("/a", "moved"));

            assertTrue(newDestination.await(1, 5, TimeUnit.SECONDS));
            assertTrue(oldDestination.received().isEmpty());
        }
    }

    @Test
    void lookupAndListing() {
        RecordingDestination d1 = new RecordingDestination("d1");
        RecordingDestination d2 = new RecordingDestination("d2");
        try (Router router = Router.builder().build()) {
            OutputListener a1 = new RawOutputListener("/a", true, d1);
            router.register(a1);
            router.register(new RawOutputListener("/a", false, d2));
            router.register(new RawOutputListener("/b", true, d1));

            assertSame(a1, router.get("/a", d1).orElseThrow());
            assertTrue(router.get("/c").isEmpty());
            assertEquals(3, router.listeners().size());
            assertEquals(2, router.listenersAt("/a").size());
        }
    }

    // ── Publish ─────────────────────────────────────────────────────

    @Test
    void publishReturnsFalseWhenQueueFull() {
        RecordingRouterMetrics metrics = new RecordingRouterMetrics();
        try (Router router = Router.builder().queueCapacity(1).metrics(metrics).build()) {
            assertTrue(router.publish(event("/a", "1")));
            assertFalse(router.publish(event("/a", "2")));

            assertEquals(2, router.history().size());
            assertEquals(1, router.queueDepth());
            assertEquals(1, metrics.dropped.get());
        }
    }

    @Test
    void publishAfterCloseIsRecordedButNotQueued() {
        Router router = Router.builder().build();
        router.start();
        router.close();

        assertFalse(router.publish(event("/a", "late")));
        assertEquals("late", router.history().latest().content());
    }

    @Test
    void historyCapacityBoundsRetainedEvents() {
        try (Router router = Router.builder().historyCapacity(3).build()) {
            for (int i = 0; i < 5; i++) {
                router.publish(event("/a", Integer.toString(i)));
            }
            assertEquals(3, router.history().size());
            assertEquals("4", router.history().latest().content());
        }
    }

    @Test
    void broadcasterIsCachedPerRoot() {
        try (Router router = Router.builder().build()) {
            assertSame(router.broadcaster("/journal"), router.broadcaster("/journal"));
            assertNotSame(router.broadcaster("/journal"), router.broadcaster("/filter"));
        }
    }

    // ── Lifecycle ───────────────────────────────────────────────────

    @Test
    void startTwiceIsNoOp() {
        try (Router router = Router.builder().build()) {
            router.start();
            router.start();
            assertTrue(router.isRunning());
        }
    }

    @Test
    void startAfterCloseThrows() {
        Router router = Router.builder().build();
        router.close();
        assertThrows(IllegalStateException.class, router::start);
    }

    @Test
    void rejectedLaunchThrowsIllegalState() {
        try (Router router = Router.builder().build()) {
            IllegalStateException e = assertThrows(IllegalStateException.class,
                    () -> router.start(task -> {
                        throw new RejectedExecutionException("saturated");
                    }));
            assertTrue(e.getCause() instanceof RejectedExecutionException);
            assertFalse(router.isRunning());
        }
    }

    @Test
    void runsOnCallerSuppliedExecutor() throws Exception {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        RecordingDestination destination = new RecordingDestination("d");
        try (Router router = Router.builder().build()) {
            router.register(new RawOutputListener("/a", true, destination));
            router.start(executor);
            router.publish(event("/a", "x"));

            assertTrue(destination.await(1, 5, TimeUnit.SECONDS));
        } finally {
            executor.shutdown();
            assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));
        }
    }

    @Test
    void closeDrainsQueuedEvents() {
        RecordingDestination destination = new RecordingDestination("d");
        Router router = Router.builder().build();
        router.register(new RawOutputListener("/a", true, destination));
        router.start();
        for (int i = 0; i < 100; i++) {
            router.publish(event("/a", Integer.toString(i)));
        }

        router.close();
        router.close();

        assertEquals(contents(0, 100), destination.received());
        assertFalse(router.isRunning());
    }

    @Test
    void closeGivesUpAfterDrainTimeout() {
        AtomicInteger delivered = new AtomicInteger();
        Destination slow = new Destination() {
            @Override
            public String id() {
                return "slow";
            }

            @Override
            public void send(String content) throws InterruptedException {
                Thread.sleep(500);
                delivered.incrementAndGet();
            }
        };
        Router router = Router.builder().drainTimeoutMs(100).build();
        router.register(new RawOutputListener("/a", true, slow));
        router.start();
        for (int i = 0; i < 10; i++) {
            router.publish(event("/a", Integer.toString(i)));
        }

        long start = System.nanoTime();
        router.close();
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertTrue(elapsedMs < 3000, "close took " + elapsedMs + " ms");
        assertTrue(delivered.get() < 10);
        assertEquals(0, router.queueDepth());
    }
}
