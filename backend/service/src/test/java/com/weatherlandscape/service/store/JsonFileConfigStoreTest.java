package com.weatherlandscape.service.store;

import com.weatherlandscape.service.support.TestClock;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonFileConfigStoreTest {
    private final TestClock clock = new TestClock(Instant.parse("2026-10-19T12:00:00Z"));

    @Test
    void ttlEntryDisappearsOnceExpired() throws Exception {
        JsonFileConfigStore store = new JsonFileConfigStore(tempFile(), clock);
        store.put("weather:78729", "{}", Duration.ofMinutes(20));

        clock.advance(Duration.ofMinutes(19));
        assertEquals(Optional.of("{}"), store.get("weather:78729"));

        clock.advance(Duration.ofMinutes(1));
        assertTrue(store.get("weather:78729").isEmpty());
    }

    @Test
    void plainEntriesNeverExpire() throws Exception {
        JsonFileConfigStore store = new JsonFileConfigStore(tempFile(), clock);
        store.put("geo:78729", "{\"lat\":30.45}");

        clock.advance(Duration.ofDays(365));
        assertEquals(Optional.of("{\"lat\":30.45}"), store.get("geo:78729"));
    }

    @Test
    void putReplacesValueAndClearsTtl() throws Exception {
        JsonFileConfigStore store = new JsonFileConfigStore(tempFile(), clock);
        store.put("active_zips", "[\"78729\"]", Duration.ofSeconds(5));
        store.put("active_zips", "[\"78729\",\"10001\"]");

        clock.advance(Duration.ofMinutes(1));
        assertEquals(Optional.of("[\"78729\",\"10001\"]"), store.get("active_zips"));
    }

    @Test
    void snapshotReloadsAndPrunesExpiredEntries() throws Exception {
        Path file = tempFile();
        JsonFileConfigStore store = new JsonFileConfigStore(file, clock);
        store.put("weather:78729", "old", Duration.ofMinutes(1));
        store.put("formats:78729", "[\"rgb_light\",\"bw\"]");

        JsonFileConfigStore reopened = new JsonFileConfigStore(file, clock);
        assertEquals(Optional.of("old"), reopened.get("weather:78729"));
        assertEquals(Optional.of("[\"rgb_light\",\"bw\"]"), reopened.get("formats:78729"));

        clock.advance(Duration.ofMinutes(2));
        reopened.put("status:fetcher", "{}");
        assertFalse(Files.readString(file).contains("weather:78729"));
    }

    @Test
    void deleteRemovesKey() throws Exception {
        Path file = tempFile();
        JsonFileConfigStore store = new JsonFileConfigStore(file, clock);
        store.put("formats:78729", "[]");

        store.delete("formats:78729");
        store.delete("never-written");

        assertTrue(store.get("formats:78729").isEmpty());
        assertTrue(new JsonFileConfigStore(file, clock).get("formats:78729").isEmpty());
    }

    @Test
    void nonPositiveTtlIsRejected() throws Exception {
        JsonFileConfigStore store = new JsonFileConfigStore(tempFile(), clock);

        assertThrows(IllegalArgumentException.class, () -> store.put("k", "v", Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> store.put("k", "v", Duration.ofSeconds(-1)));
    }

    @Test
    void corruptSnapshotFailsFast() throws Exception {
        Path file = tempFile();
        Files.createDirectories(file.getParent());
        Files.writeString(file, "{not json");

        IllegalStateException error = assertThrows(IllegalStateException.class, () -> new JsonFileConfigStore(file, clock));
        assertTrue(error.getMessage().contains(file.toString()));
    }

    private static Path tempFile() throws Exception {
        return Files.createTempDirectory("config-store-").resolve("state/config-store.json");
    }
}
