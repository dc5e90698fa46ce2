package com.weatherlandscape.service.queue;

import com.weatherlandscape.core.bus.EventBus;
import com.weatherlandscape.core.events.MessageFailed;
import com.weatherlandscape.core.message.FetchJob;
import com.weatherlandscape.core.trace.TraceContext;
import com.weatherlandscape.pipeline.api.QueueMessage;
import com.weatherlandscape.service.support.TestClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FileMessageQueueTest {
    private static final FileMessageQueue.Settings SETTINGS =
            new FileMessageQueue.Settings(Duration.ofMinutes(2), Duration.ofSeconds(30), 3);

    private final TestClock clock = new TestClock(Instant.parse("2026-10-19T12:00:00Z"));
    private final EventBus eventBus = new EventBus();
    private final List<MessageFailed> failures = new CopyOnWriteArrayList<>();
    private Path dir;

    @BeforeEach
    void setUp() throws Exception {
        dir = Files.createTempDirectory("queue-test");
        eventBus.subscribe(MessageFailed.class, failures::add);
    }

    @Test
    void ackedMessageIsGone() {
        FileMessageQueue<FetchJob> queue = queue();
        FetchJob job = job("78729");
        queue.send(job);

        List<QueueMessage<FetchJob>> batch = queue.receive(10);
        assertEquals(1, batch.size());
        assertEquals(job, batch.get(0).body());
        assertEquals(1, batch.get(0).attempts());

        batch.get(0).ack();
        clock.advance(Duration.ofHours(1));
        assertTrue(queue.receive(10).isEmpty());
        assertEquals(0, queue.depth());
    }

    @Test
    void unsettledMessageReappearsAfterVisibilityTimeout() {
        FileMessageQueue<FetchJob> queue = queue();
        queue.send(job("78729"));

        assertEquals(1, queue.receive(10).size());
        assertTrue(queue.receive(10).isEmpty());

        clock.advance(Duration.ofMinutes(2));
        List<QueueMessage<FetchJob>> redelivered = queue.receive(10);
        assertEquals(1, redelivered.size());
        assertEquals(2, redelivered.get(0).attempts());
    }

    @Test
    void retryDelaysNextDeliveryWithDoublingBackoff() {
        FileMessageQueue<FetchJob> queue = queue();
        queue.send(job("78729"));

        queue.receive(10).get(0).retry();
        clock.advance(Duration.ofSeconds(29));
        assertTrue(queue.receive(10).isEmpty());
        clock.advance(Duration.ofSeconds(1));
        QueueMessage<FetchJob> second = queue.receive(10).get(0);
        assertEquals(2, second.attempts());

        second.retry();
        clock.advance(Duration.ofSeconds(30));
        assertTrue(queue.receive(10).isEmpty());
        clock.advance(Duration.ofSeconds(30));
        assertEquals(1, queue.receive(10).size());
    }

    @Test
    void backoffIsCapped() {
        FileMessageQueue<FetchJob> queue = queue();

        assertEquals(Duration.ofSeconds(30), queue.backoff(1));
        assertEquals(Duration.ofSeconds(120), queue.backoff(3));
        assertEquals(Duration.ofSeconds(30L << 10), queue.backoff(40));
    }

    @Test
    void retryOnFinalAttemptDropsAndReportsFailure() {
        FileMessageQueue<FetchJob> queue = queue();
        FetchJob job = job("78729");
        queue.send(job);

        for (int attempt = 1; attempt <= 3; attempt++) {
            List<QueueMessage<FetchJob>> batch = queue.receive(10);
            assertEquals(1, batch.size(), "attempt " + attempt);
            batch.get(0).retry();
            clock.advance(Duration.ofMinutes(5));
        }

        assertTrue(queue.receive(10).isEmpty());
        assertEquals(0, queue.depth());
        assertEquals(1, failures.size());
        MessageFailed failure = failures.get(0);
        assertEquals("fetch-jobs", failure.stage());
        assertEquals("78729", failure.zip());
        assertEquals(job.trace().traceId(), failure.traceId());
        assertFalse(failure.retryRequested());
    }

    @Test
    void expiredLeaseOnFinalAttemptIsDropped() {
        FileMessageQueue<FetchJob> queue = queue();
        queue.send(job("78729"));

        for (int attempt = 1; attempt <= 3; attempt++) {
            assertEquals(1, queue.receive(10).size());
            clock.advance(Duration.ofMinutes(2));
        }

        assertTrue(queue.receive(10).isEmpty());
        assertEquals(1, failures.size());
    }

    @Test
    void retryFromExpiredDeliveryDoesNotRewindAttempts() {
        FileMessageQueue<FetchJob> queue = queue();
        queue.send(job("78729"));

        QueueMessage<FetchJob> first = queue.receive(10).get(0);
        clock.advance(Duration.ofMinutes(3));
        QueueMessage<FetchJob> second = queue.receive(10).get(0);
        assertEquals(2, second.attempts());

        second.retry();
        first.retry();
        clock.advance(Duration.ofMinutes(10));

        List<QueueMessage<FetchJob>> third = queue.receive(10);
        assertEquals(1, third.size());
        assertEquals(3, third.get(0).attempts());
        third.get(0).retry();
        assertEquals(0, queue.depth());
        assertEquals(1, failures.size());
    }

    @Test
    void ackFromExpiredDeliveryLeavesNewerLeaseInPlace() {
        FileMessageQueue<FetchJob> queue = queue();
        queue.send(job("78729"));

        QueueMessage<FetchJob> first = queue.receive(10).get(0);
        clock.advance(Duration.ofMinutes(3));
        QueueMessage<FetchJob> second = queue.receive(10).get(0);

        first.ack();
        assertEquals(1, queue.depth());
        assertTrue(queue.receive(10).isEmpty());

        second.ack();
        assertEquals(0, queue.depth());
    }

    @Test
    void receiveHonoursBatchSizeAndSendOrder() {
        FileMessageQueue<FetchJob> queue = queue();
        queue.send(job("78729"));
        queue.send(job("10001"));
        queue.send(job("94103"));

        List<QueueMessage<FetchJob>> first = queue.receive(2);
        assertEquals(List.of("78729", "10001"), first.stream().map(m -> m.body().zip()).toList());
        assertEquals("94103", queue.receive(2).get(0).body().zip());
    }

    @Test
    void messagesSurviveAReopenedQueue() {
        queue().send(job("78729"));

        FileMessageQueue<FetchJob> reopened = queue();
        assertEquals(1, reopened.depth());
        assertEquals("78729", reopened.receive(1).get(0).body().zip());
    }

    private FileMessageQueue<FetchJob> queue() {
        return new FileMessageQueue<>("fetch-jobs", dir, FetchJob.class, clock, eventBus, SETTINGS);
    }

    private FetchJob job(String zip) {
        return new FetchJob(zip, clock.instant(), TraceContext.root());
    }
}
