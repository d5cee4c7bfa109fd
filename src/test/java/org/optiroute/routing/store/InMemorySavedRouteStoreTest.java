package org.optiroute.routing.store;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class InMemorySavedRouteStoreTest {

    private static final Instant START = Instant.parse("2024-03-12T10:00:00Z");

    /** Advances one second per read. */
    private static final class TickingClock extends Clock {
        private final AtomicLong ticks = new AtomicLong();

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return START.plusSeconds(ticks.getAndIncrement());
        }
    }

    private final InMemorySavedRouteStore store = new InMemorySavedRouteStore(new TickingClock());

    @Test
    @DisplayName("Saved route is retrievable with fresh metadata")
    void testSaveAndFind() {
        SavedRoute saved = store.save("Morning run", null, "{}", "ops-1");

        assertNotNull(saved.getId());
        assertEquals("", saved.getDescription());
        assertEquals(0L, saved.getUsageCount());
        assertEquals(START, saved.getCreatedAt());
        assertNull(saved.getLastUsedAt());
        assertEquals(saved, store.findById(saved.getId()).orElseThrow());
        assertEquals(1, store.size());
    }

    @Test
    @DisplayName("Search matches name or description case-insensitively and filters by owner")
    void testSearch() {
        SavedRoute morning = store.save("Morning run", "Manhattan loop", "{}", "ops-1");
        SavedRoute evening = store.save("Evening run", "Brooklyn drops", "{}", "ops-2");
        SavedRoute weekly = store.save("Weekly restock", "manhattan stores", "{}", "ops-1");

        assertEquals(List.of(morning, evening), store.find("RUN", null));
        assertEquals(List.of(morning, weekly), store.find("manhattan", null));
        assertEquals(List.of(morning, weekly), store.find(null, "ops-1"));
        assertEquals(List.of(evening), store.find("  ", "ops-2"));
        assertTrue(store.find("queens", null).isEmpty());
    }

    @Test
    @DisplayName("Delete reports whether a route was removed")
    void testDelete() {
        SavedRoute saved = store.save("Morning run", "", "{}", "ops-1");

        assertTrue(store.delete(saved.getId()));
        assertFalse(store.delete(saved.getId()));
        assertFalse(store.delete(null));
        assertTrue(store.findById(saved.getId()).isEmpty());
    }

    @Test
    @DisplayName("Reassign and usage tracking update the stored route")
    void testUpdates() {
        SavedRoute saved = store.save("Morning run", "", "{}", "ops-1");
        Instant usedAt = START.plusSeconds(3_600);

        SavedRoute reassigned = store.reassign(saved.getId(), "ops-9");
        SavedRoute used = store.recordUsage(saved.getId(), usedAt);

        assertEquals("ops-9", reassigned.getOwnerId());
        assertEquals(1L, used.getUsageCount());
        assertEquals(usedAt, used.getLastUsedAt());
        assertEquals("ops-9", used.getOwnerId());
        assertEquals(used, store.findById(saved.getId()).orElseThrow());
    }

    @Test
    @DisplayName("Updating an unknown route fails with not found")
    void testUnknownRoute() {
        SavedRouteStoreException reassign = assertThrows(SavedRouteStoreException.class,
                () -> store.reassign("missing", "ops-1"));
        assertEquals(SavedRouteStoreException.REASON_NOT_FOUND, reassign.getReasonCode());

        SavedRouteStoreException usage = assertThrows(SavedRouteStoreException.class,
                () -> store.recordUsage(null, null));
        assertEquals(SavedRouteStoreException.REASON_NOT_FOUND, usage.getReasonCode());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   "})
    @DisplayName("Blank name, payload or owner is rejected")
    void testBlankInput(String blank) {
        assertEquals(SavedRouteStoreException.REASON_INVALID_INPUT,
                assertThrows(SavedRouteStoreException.class, () -> store.save(blank, "", "{}", "ops-1")).getReasonCode());
        assertEquals(SavedRouteStoreException.REASON_INVALID_INPUT,
                assertThrows(SavedRouteStoreException.class, () -> store.save("name", "", blank, "ops-1")).getReasonCode());
        SavedRoute saved = store.save("name", "", "{}", "ops-1");
        assertEquals(SavedRouteStoreException.REASON_INVALID_INPUT,
                assertThrows(SavedRouteStoreException.class, () -> store.reassign(saved.getId(), blank)).getReasonCode());
    }

    @Test
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    @DisplayName("Concurrent usage updates are not lost")
    void testConcurrentUsage() throws Exception {
        SavedRoute saved = store.save("Shared", "", "{}", "ops-1");
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<SavedRoute>> futures = new ArrayList<>();
            for (int i = 0; i < 400; i++) {
                futures.add(pool.submit(() -> store.recordUsage(saved.getId(), null)));
            }
            for (Future<SavedRoute> future : futures) {
                future.get();
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(400L, store.findById(saved.getId()).orElseThrow().getUsageCount());
    }
}
