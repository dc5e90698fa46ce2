package com.weatherlandscape.service.runtime;

import com.weatherlandscape.pipeline.api.MessageQueue;
import com.weatherlandscape.pipeline.api.QueueMessage;
import com.weatherlandscape.pipeline.api.StageConsumer;
import com.weatherlandscape.pipeline.api.StageResult;
import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class QueueWorkerTest {
    @Test
    void handsAtMostBatchSizeMessagesToTheStage() {
        ListQueue queue = new ListQueue();
        for (int i = 0; i < 5; i++) {
            queue.send("m" + i);
        }
        RecordingStage stage = new RecordingStage();
        QueueWorker<String> worker = new QueueWorker<>(queue, stage, 2);

        assertTrue(worker.pollOnce().isPresent());
        assertTrue(worker.pollOnce().isPresent());
        assertTrue(worker.pollOnce().isPresent());
        assertEquals(Optional.empty(), worker.pollOnce());

        assertEquals(List.of(2, 2, 1), stage.batchSizes);
        assertEquals("recorder<-strings", worker.name());
    }

    @Test
    void receiveFailureIsReportedAsNothingToDo() {
        ListQueue queue = new ListQueue();
        queue.failReceive = true;
        RecordingStage stage = new RecordingStage();

        assertEquals(Optional.empty(), new QueueWorker<>(queue, stage, 10).pollOnce());
        assertTrue(stage.batchSizes.isEmpty());
    }

    @Test
    void batchSizeMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new QueueWorker<>(new ListQueue(), new RecordingStage(), 0));
    }

    private static final class ListQueue implements MessageQueue<String> {
        private final Deque<String> bodies = new ArrayDeque<>();
        private boolean failReceive;

        @Override
        public String name() {
            return "strings";
        }

        @Override
        public void send(String message) {
            bodies.addLast(message);
        }

        @Override
        public List<QueueMessage<String>> receive(int maxMessages) {
            if (failReceive) {
                throw new IllegalStateException("disk gone");
            }
            List<QueueMessage<String>> batch = new ArrayList<>();
            while (batch.size() < maxMessages && !bodies.isEmpty()) {
                String body = bodies.removeFirst();
                batch.add(new QueueMessage<>() {
                    @Override
                    public String id() {
                        return body;
                    }

                    @Override
                    public String body() {
                        return body;
                    }

                    @Override
                    public int attempts() {
                        return 1;
                    }

                    @Override
                    public void ack() {
                    }

                    @Override
                    public void retry() {
                        bodies.addLast(body);
                    }
                });
            }
            return batch;
        }
    }

    private static final class RecordingStage implements StageConsumer<String> {
        private final List<Integer> batchSizes = new ArrayList<>();

        @Override
        public String name() {
            return "recorder";
        }

        @Override
        public StageResult handleBatch(List<QueueMessage<String>> batch) {
            batchSizes.add(batch.size());
            batch.forEach(QueueMessage::ack);
            return StageResult.success("ok", Map.of());
        }
    }
}
