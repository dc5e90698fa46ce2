package com.weatherlandscape.service.store;

import com.weatherlandscape.core.events.Event;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

public class JsonlEventStore implements EventStore {
    private static final Logger LOGGER = Logger.getLogger(JsonlEventStore.class.getName());

    private final Path file;
    private final ReentrantLock lock = new ReentrantLock();

    public JsonlEventStore(Path file) {
        this.file = file;
    }

    @Override
    public void append(Event event) {
        String line = EventCodec.toJsonLine(event);
        lock.lock();
        try {
            Path parent = file.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (BufferedWriter writer = Files.newBufferedWriter(
                    file,
                    StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.APPEND
            )) {
                writer.write(line);
                writer.newLine();
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed appending event to " + file, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<Event> query(EventQuery query) {
        lock.lock();
        try {
            if (!Files.exists(file)) {
                return List.of();
            }
            Deque<Event> newest = new ArrayDeque<>();
            int lineNumber = 0;
            try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
                String line;
                while ((line = reader.readLine()) != null) {
                    lineNumber++;
                    if (line.isBlank()) {
                        continue;
                    }
                    Event event;
                    try {
                        event = EventCodec.fromJsonLine(line);
                    } catch (RuntimeException decodeError) {
                        LOGGER.warning("Skipping unreadable event at " + file + ":" + lineNumber + ": "
                                + decodeError.getMessage());
                        continue;
                    }
                    if (!query.matches(event)) {
                        continue;
                    }
                    newest.addLast(event);
                    if (newest.size() > query.limit()) {
                        newest.removeFirst();
                    }
                }
            }
            return List.copyOf(newest);
        } catch (IOException e) {
            throw new IllegalStateException("Failed querying events from " + file, e);
        } finally {
            lock.unlock();
        }
    }
}
