package com.weatherlandscape.service.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.weatherlandscape.core.util.JsonUtils;
import com.weatherlandscape.pipeline.api.ConfigStore;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;

public class JsonFileConfigStore implements ConfigStore {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();

    private final Path file;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Entry> entries = new TreeMap<>();

    public JsonFileConfigStore(Path file, Clock clock) {
        this.file = file;
        this.clock = clock;
        loadIfPresent();
    }

    @Override
    public Optional<String> get(String key) {
        lock.lock();
        try {
            Entry entry = entries.get(key);
            if (entry == null || entry.expiredAt(clock.instant())) {
                return Optional.empty();
            }
            return Optional.of(entry.value());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void put(String key, String value) {
        write(key, new Entry(value, null));
    }

    @Override
    public void put(String key, String value, Duration ttl) {
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("TTL must be positive for key " + key);
        }
        write(key, new Entry(value, clock.instant().plus(ttl)));
    }

    @Override
    public void delete(String key) {
        lock.lock();
        try {
            if (entries.remove(key) != null) {
                persist();
            }
        } finally {
            lock.unlock();
        }
    }

    private void write(String key, Entry entry) {
        lock.lock();
        try {
            entries.put(key, entry);
            Instant now = clock.instant();
            entries.values().removeIf(existing -> existing.expiredAt(now));
            persist();
        } finally {
            lock.unlock();
        }
    }

    private void loadIfPresent() {
        lock.lock();
        try {
            if (!Files.exists(file)) {
                return;
            }
            try (InputStream in = Files.newInputStream(file)) {
                Map<String, Entry> loaded = MAPPER.readValue(in, new TypeReference<Map<String, Entry>>() {
                });
                if (loaded != null) {
                    entries.putAll(loaded);
                }
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading config store from " + file, e);
        } finally {
            lock.unlock();
        }
    }

    private void persist() {
        try {
            Path parent = file.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            MAPPER.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), entries);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new IllegalStateException("Failed writing config store to " + file, e);
        }
    }

    private record Entry(String value, Instant expiresAt) {
        private boolean expiredAt(Instant now) {
            return expiresAt != null && !now.isBefore(expiresAt);
        }
    }
}
