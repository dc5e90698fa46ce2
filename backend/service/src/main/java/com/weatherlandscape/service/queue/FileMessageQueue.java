package com.weatherlandscape.service.queue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.weatherlandscape.core.bus.EventBus;
import com.weatherlandscape.core.events.MessageFailed;
import com.weatherlandscape.core.util.JsonUtils;
import com.weatherlandscape.pipeline.api.MessageQueue;
import com.weatherlandscape.pipeline.api.QueueMessage;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;

public class FileMessageQueue<T> implements MessageQueue<T> {
    private static final Logger LOGGER = Logger.getLogger(FileMessageQueue.class.getName());
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();
    private static final String SUFFIX = ".json";
    private static final long MAX_BACKOFF_SHIFT = 10;

    private final String name;
    private final Path dir;
    private final Class<T> bodyType;
    private final Clock clock;
    private final EventBus eventBus;
    private final Settings settings;
    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicLong sequence = new AtomicLong();

    public FileMessageQueue(String name, Path dir, Class<T> bodyType, Clock clock, EventBus eventBus, Settings settings) {
        this.name = name;
        this.dir = dir;
        this.bodyType = bodyType;
        this.clock = clock;
        this.eventBus = eventBus;
        this.settings = settings;
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to create queue directory " + dir, e);
        }
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public void send(T message) {
        Instant now = clock.instant();
        String id = String.format("%019d-%06d-%s", now.toEpochMilli(), sequence.incrementAndGet() % 1_000_000,
                UUID.randomUUID().toString().substring(0, 8));
        Envelope envelope = new Envelope(id, MAPPER.valueToTree(message), 0, now, now);
        lock.lock();
        try {
            write(envelope);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<QueueMessage<T>> receive(int maxMessages) {
        Instant now = clock.instant();
        List<QueueMessage<T>> batch = new ArrayList<>();
        lock.lock();
        try {
            for (Path file : messageFiles()) {
                if (batch.size() >= maxMessages) {
                    break;
                }
                Envelope envelope = read(file);
                if (envelope == null || envelope.visibleAt().isAfter(now)) {
                    continue;
                }
                if (envelope.attempts() >= settings.maxDeliveryAttempts()) {
                    drop(envelope, "visibility timeout expired on final attempt");
                    continue;
                }
                T body;
                try {
                    body = MAPPER.treeToValue(envelope.body(), bodyType);
                } catch (IOException | IllegalArgumentException e) {
                    LOGGER.log(Level.SEVERE, "Discarding undecodable message " + envelope.id() + " on queue " + name, e);
                    delete(envelope.id());
                    continue;
                }
                Envelope leased = new Envelope(
                        envelope.id(),
                        envelope.body(),
                        envelope.attempts() + 1,
                        now.plus(settings.visibilityTimeout()),
                        envelope.enqueuedAt()
                );
                write(leased);
                batch.add(new Delivery(leased, body));
            }
        } finally {
            lock.unlock();
        }
        return batch;
    }

    public int depth() {
        lock.lock();
        try {
            return messageFiles().size();
        } finally {
            lock.unlock();
        }
    }

    private void settleAck(Envelope leased) {
        lock.lock();
        try {
            if (!holdsLease(leased, "ack")) {
                return;
            }
            delete(leased.id());
        } finally {
            lock.unlock();
        }
    }

    private void settleRetry(Envelope leased) {
        lock.lock();
        try {
            if (!holdsLease(leased, "retry")) {
                return;
            }
            if (leased.attempts() >= settings.maxDeliveryAttempts()) {
                drop(leased, "retry requested on final attempt");
                return;
            }
            Duration delay = backoff(leased.attempts());
            write(new Envelope(leased.id(), leased.body(), leased.attempts(), clock.instant().plus(delay), leased.enqueuedAt()));
            LOGGER.info("Message " + leased.id() + " on " + name + " rescheduled in " + delay.toSeconds() + "s");
        } finally {
            lock.unlock();
        }
    }

    // attempts grows with every lease, so a stale delivery no longer matches the envelope on disk
    private boolean holdsLease(Envelope leased, String action) {
        Envelope current = read(fileFor(leased.id()));
        if (current == null) {
            return false;
        }
        if (current.attempts() != leased.attempts() || !current.visibleAt().equals(leased.visibleAt())) {
            LOGGER.warning("Ignoring " + action + " of message " + leased.id() + " on " + name
                    + " from expired delivery attempt " + leased.attempts() + " (current attempt " + current.attempts() + ")");
            return false;
        }
        return true;
    }

    Duration backoff(int attempts) {
        long shift = Math.min(MAX_BACKOFF_SHIFT, Math.max(0, attempts - 1));
        return settings.retryBackoff().multipliedBy(1L << shift);
    }

    private void drop(Envelope envelope, String reason) {
        String zip = envelope.body().path("zip").asText("");
        String traceId = envelope.body().path("trace").path("traceId").asText("");
        LOGGER.severe("Dropping message " + envelope.id() + " from " + name + " after " + envelope.attempts()
                + " attempt(s) (" + reason + "), zip=" + zip + " traceId=" + traceId);
        delete(envelope.id());
        eventBus.publish(new MessageFailed(
                clock.instant(),
                name,
                zip,
                traceId,
                "Dropped after " + envelope.attempts() + " attempt(s): " + reason,
                false
        ));
    }

    private List<Path> messageFiles() {
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(path -> path.getFileName().toString().endsWith(SUFFIX)).sorted().toList();
        } catch (IOException e) {
            throw new IllegalStateException("Unable to list queue " + name, e);
        }
    }

    private Envelope read(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            return MAPPER.readValue(in, Envelope.class);
        } catch (NoSuchFileException e) {
            return null;
        } catch (IOException e) {
            throw new IllegalStateException("Unable to read queue message " + file, e);
        }
    }

    private void write(Envelope envelope) {
        Path file = fileFor(envelope.id());
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            MAPPER.writeValue(tmp.toFile(), envelope);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to write message " + envelope.id() + " to queue " + name, e);
        }
    }

    private void delete(String id) {
        try {
            Files.deleteIfExists(fileFor(id));
        } catch (IOException e) {
            throw new IllegalStateException("Unable to delete message " + id + " from queue " + name, e);
        }
    }

    private Path fileFor(String id) {
        return dir.resolve(id + SUFFIX);
    }

    public record Settings(Duration visibilityTimeout, Duration retryBackoff, int maxDeliveryAttempts) {
    }

    private record Envelope(String id, JsonNode body, int attempts, Instant visibleAt, Instant enqueuedAt) {
    }

    private final class Delivery implements QueueMessage<T> {
        private final Envelope leased;
        private final T body;

        private Delivery(Envelope leased, T body) {
            this.leased = leased;
            this.body = body;
        }

        @Override
        public String id() {
            return leased.id();
        }

        @Override
        public T body() {
            return body;
        }

        @Override
        public int attempts() {
            return leased.attempts();
        }

        @Override
        public void ack() {
            settleAck(leased);
        }

        @Override
        public void retry() {
            settleRetry(leased);
        }
    }
}
