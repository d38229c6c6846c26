package de.htwsaar.datalinker.datalink.hips;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prozessweiter TTL-Cache einer Collection-Liste mit Hintergrund-Refresh.
 *
 * <p>Leser sehen immer einen vollständigen {@link CollectionListSnapshot}: der Refresh baut einen
 * neuen Snapshot und veröffentlicht ihn per {@link AtomicReference}. Leser blockieren nie auf einen
 * laufenden Refresh. Refreshs laufen serialisiert; ein zweiter Aufruf während eines laufenden
 * Refreshs wird übersprungen.</p>
 *
 * <p>Ein fehlgeschlagener Refresh setzt nur das Health-Flag; einmal befüllt, fällt der Cache nie
 * wieder auf {@link CacheState#EMPTY} zurück.</p>
 */
public class CollectionListCache {

    private static final Logger log = LoggerFactory.getLogger(CollectionListCache.class);

    private final String name;
    private final CollectionSource source;
    private final Clock clock;
    private final Duration ttl;
    private final Executor refreshExecutor;

    private final AtomicReference<CollectionListSnapshot> ref =
            new AtomicReference<>(CollectionListSnapshot.empty());
    private final ReentrantLock refreshLock = new ReentrantLock();

    /**
     * @param name            Name der Liste (für Logs und Fehlermeldungen)
     * @param source          Quelle der Collections
     * @param clock           Zeitquelle
     * @param ttl             Frische-Fenster nach einem erfolgreichen Refresh
     * @param refreshExecutor Executor für von Lesern angestoßene Refreshs
     */
    public CollectionListCache(
            String name, CollectionSource source, Clock clock, Duration ttl, Executor refreshExecutor) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.ttl = Objects.requireNonNull(ttl, "ttl must not be null");
        this.refreshExecutor = Objects.requireNonNull(refreshExecutor, "refreshExecutor must not be null");
    }

    public String name() {
        return name;
    }

    /**
     * Aktueller Snapshot ohne Nebenwirkungen.
     *
     * @return zuletzt veröffentlichter Snapshot (evtl. leer)
     */
    public CollectionListSnapshot snapshot() {
        return ref.get();
    }

    /**
     * Liest die Liste für einen Endpunkt. Ist sie abgelaufen, wird im Hintergrund ein Refresh angestoßen
     * und trotzdem sofort der alte Stand geliefert.
     *
     * @return letzter erfolgreicher Stand
     * @throws CollectionListUnavailableException wenn noch nie erfolgreich befüllt
     */
    public CollectionListSnapshot read() {
        CollectionListSnapshot current = ref.get();
        if (current.isEmpty()) {
            triggerRefresh();
            throw new CollectionListUnavailableException(name);
        }
        if (isExpired(current)) {
            triggerRefresh();
        }
        return current;
    }

    public CacheState state() {
        CollectionListSnapshot current = ref.get();
        if (current.isEmpty()) return CacheState.EMPTY;
        if (refreshLock.isLocked()) return CacheState.REFRESHING;
        return isExpired(current) ? CacheState.STALE : CacheState.FRESH;
    }

    /**
     * Stößt einen asynchronen Refresh an, sofern keiner läuft.
     */
    public void triggerRefresh() {
        if (refreshLock.isLocked()) return;
        try {
            refreshExecutor.execute(this::refresh);
        } catch (RejectedExecutionException e) {
            log.warn("Refresh of collection list '{}' rejected by executor: {}", name, e.getMessage());
        }
    }

    /**
     * Führt einen Refresh synchron aus.
     *
     * @return {@code false} wenn bereits ein Refresh lief und dieser Aufruf übersprungen wurde
     */
    public boolean refresh() {
        if (!refreshLock.tryLock()) {
            return false;
        }
        try {
            CollectionListing listing = source.listCollections();
            if (listing.records().isEmpty() && !listing.unavailableKeys().isEmpty()) {
                throw new SourceUnavailableException(
                        "No collection could be fetched, unavailable: " + listing.unavailableKeys());
            }
            CollectionListSnapshot next = reconcile(ref.get(), listing, clock.instant());
            ref.set(next);
            if (next.healthy()) {
                log.info("Refreshed collection list '{}' with {} entries", name, next.entries().size());
            } else {
                log.warn("Partially refreshed collection list '{}': {}", name, next.lastError());
            }
        } catch (RuntimeException e) {
            // Refresh-Fehler erreichen nie die Leser
            log.error("Refresh of collection list '{}' failed: {}", name, e.getMessage(), e);
            ref.updateAndGet(current -> current.withFailure(e.getMessage()));
        } finally {
            refreshLock.unlock();
        }
        return true;
    }

    private boolean isExpired(CollectionListSnapshot snapshot) {
        return !clock.instant().isBefore(snapshot.lastSuccess().plus(ttl));
    }

    /**
     * Gelieferte Schlüssel werden ersetzt, vorübergehend fehlende behalten ihren alten Eintrag,
     * alle übrigen alten Schlüssel entfallen.
     */
    static CollectionListSnapshot reconcile(CollectionListSnapshot previous, CollectionListing listing, Instant now) {
        Map<String, CollectionListEntry> next = new LinkedHashMap<>();
        for (CollectionRecord record : listing.records()) {
            next.put(record.key(), new CollectionListEntry(
                    record.key(), record.canonicalUrl(), record.properties(), record.text(), now));
        }
        for (String key : listing.unavailableKeys()) {
            CollectionListEntry old = previous.entries().get(key);
            if (old != null && !next.containsKey(key)) {
                next.put(key, old);
            }
        }
        boolean complete = listing.unavailableKeys().isEmpty();
        String error = complete ? null : "Unavailable collections: " + listing.unavailableKeys();
        return new CollectionListSnapshot(next, now, complete, error);
    }
}
