package de.htwsaar.datalinker.datalink.hips;

import static org.junit.jupiter.api.Assertions.*;

import de.htwsaar.datalinker.datalink.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import org.junit.jupiter.api.Test;

class CollectionListCacheTest {

    private static final Instant START = Instant.parse("2026-02-01T00:00:00Z");
    private static final Duration TTL = Duration.ofMinutes(10);

    private final MutableClock clock = new MutableClock(START);
    private final List<Runnable> queued = new ArrayList<>();

    @Test
    void emptyCache_throwsAndTriggersRefresh() {
        CollectionListCache cache = cache(ScriptedSource.of(() -> listing("a")));

        assertEquals(CacheState.EMPTY, cache.state());
        assertThrows(CollectionListUnavailableException.class, cache::read);
        assertEquals(1, queued.size(), "Refresh muss angestoßen worden sein");

        queued.remove(0).run();
        assertEquals(Set.of("a"), cache.read().entries().keySet());
        assertEquals(CacheState.FRESH, cache.state());
    }

    @Test
    void expiredList_isServedWhileRefreshRuns() {
        ScriptedSource source = ScriptedSource.of(() -> listing("a"), () -> listing("a", "b"));
        CollectionListCache cache = cache(source);
        assertTrue(cache.refresh());

        clock.advance(TTL.plusSeconds(1));
        assertEquals(CacheState.STALE, cache.state());
        CollectionListSnapshot stale = cache.read();

        assertEquals(Set.of("a"), stale.entries().keySet(), "alter Stand wird sofort geliefert");
        assertEquals(1, queued.size());
        queued.remove(0).run();
        assertEquals(Set.of("a", "b"), cache.read().entries().keySet());
    }

    @Test
    void failedRefresh_keepsPreviousEntriesAndFlagsHealth() {
        ScriptedSource source = ScriptedSource.of(() -> listing("a"), () -> {
            throw new SourceUnavailableException("HiPS server down");
        });
        CollectionListCache cache = cache(source);
        cache.refresh();
        Instant firstSuccess = cache.snapshot().lastSuccess();

        clock.advance(Duration.ofMinutes(1));
        assertTrue(cache.refresh());

        CollectionListSnapshot snapshot = cache.read();
        assertEquals(Set.of("a"), snapshot.entries().keySet());
        assertEquals(firstSuccess, snapshot.lastSuccess());
        assertFalse(snapshot.healthy());
        assertEquals("HiPS server down", snapshot.lastError());
        assertNotEquals(CacheState.EMPTY, cache.state());
    }

    @Test
    void allPathsUnavailable_countsAsFailure() {
        ScriptedSource source = ScriptedSource.of(
                () -> listing("a"), () -> new CollectionListing(List.of(), Set.of("a")));
        CollectionListCache cache = cache(source);
        cache.refresh();
        Instant firstSuccess = cache.snapshot().lastSuccess();
        clock.advance(Duration.ofMinutes(1));
        cache.refresh();

        assertEquals(firstSuccess, cache.snapshot().lastSuccess());
        assertFalse(cache.snapshot().healthy());
    }

    @Test
    void failureOnEmptyCache_staysEmpty() {
        CollectionListCache cache = cache(ScriptedSource.of(() -> {
            throw new SourceUnavailableException("down");
        }));
        cache.refresh();
        assertEquals(CacheState.EMPTY, cache.state());
        assertThrows(CollectionListUnavailableException.class, cache::read);
    }

    @Test
    void reconcile_replacesKeepsAndDrops() {
        Instant t0 = START;
        CollectionListSnapshot previous = CollectionListCache.reconcile(
                CollectionListSnapshot.empty(), listing("a", "b", "c"), t0);

        Instant t1 = t0.plusSeconds(60);
        CollectionListing partial = new CollectionListing(List.of(record("a", "2")), Set.of("b"));
        CollectionListSnapshot next = CollectionListCache.reconcile(previous, partial, t1);

        assertEquals(Set.of("a", "b"), next.entries().keySet(), "c wird entfernt");
        assertEquals("2", next.entries().get("a").properties().get("v"));
        assertEquals(t1, next.entries().get("a").refreshedAt());
        assertEquals(t0, next.entries().get("b").refreshedAt(), "b behält den alten Eintrag");
        assertFalse(next.healthy());
        assertEquals(t1, next.lastSuccess());
    }

    @Test
    void concurrentRefresh_isSkipped() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        CollectionListCache cache = cache(() -> {
            entered.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return listing("a");
        });

        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<Boolean> first = pool.submit(cache::refresh);
            assertTrue(entered.await(5, TimeUnit.SECONDS));
            assertEquals(CacheState.EMPTY, cache.state());
            assertFalse(cache.refresh(), "zweiter Refresh muss übersprungen werden");
            cache.triggerRefresh();
            assertTrue(queued.isEmpty(), "während eines Refreshs wird nichts eingereiht");
            release.countDown();
            assertTrue(first.get(5, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }
        assertEquals(Set.of("a"), cache.read().entries().keySet());
    }

    @Test
    void readersSeeCompleteSnapshots() throws Exception {
        ScriptedSource source = new ScriptedSource(new ArrayDeque<>());
        for (int i = 0; i < 50; i++) {
            int n = i % 2 == 0 ? 3 : 1;
            source.script.add(() -> listingOfSize(n));
        }
        CollectionListCache cache = cache(source);
        cache.refresh();

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<?> writer = pool.submit(() -> {
                for (int i = 0; i < 49; i++) cache.refresh();
            });
            Future<?> reader = pool.submit(() -> {
                for (int i = 0; i < 1000; i++) {
                    CollectionListSnapshot s = cache.snapshot();
                    int size = s.entries().size();
                    assertTrue(size == 1 || size == 3, "unvollständiger Snapshot: " + size);
                }
            });
            writer.get(10, TimeUnit.SECONDS);
            reader.get(10, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }
    }

    private CollectionListCache cache(CollectionSource source) {
        return new CollectionListCache("dp02", source, clock, TTL, queued::add);
    }

    private static CollectionListing listingOfSize(int n) {
        String[] keys = new String[n];
        for (int i = 0; i < n; i++) keys[i] = "k" + i;
        return listing(keys);
    }

    private static CollectionListing listing(String... keys) {
        List<CollectionRecord> records = new ArrayList<>();
        for (String key : keys) records.add(record(key, "1"));
        return CollectionListing.complete(records);
    }

    private static CollectionRecord record(String key, String version) {
        return new CollectionRecord(key, "https://hips.example.org/" + key, Map.of("v", version));
    }

    /** Liefert pro Aufruf die nächste Antwort; die letzte wird wiederholt. */
    static final class ScriptedSource implements CollectionSource {

        final Deque<Supplier<CollectionListing>> script;
        private Supplier<CollectionListing> last;

        ScriptedSource(Deque<Supplier<CollectionListing>> script) {
            this.script = script;
        }

        @SafeVarargs
        static ScriptedSource of(Supplier<CollectionListing>... steps) {
            return new ScriptedSource(new ArrayDeque<>(List.of(steps)));
        }

        @Override
        public synchronized CollectionListing listCollections() {
            if (!script.isEmpty()) last = script.poll();
            return last.get();
        }
    }
}
