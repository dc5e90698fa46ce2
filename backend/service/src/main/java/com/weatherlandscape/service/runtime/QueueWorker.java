package com.weatherlandscape.service.runtime;

import com.weatherlandscape.pipeline.api.MessageQueue;
import com.weatherlandscape.pipeline.api.QueueMessage;
import com.weatherlandscape.pipeline.api.StageConsumer;
import com.weatherlandscape.pipeline.api.StageResult;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

public class QueueWorker<T> {
    private static final Logger LOGGER = Logger.getLogger(QueueWorker.class.getName());

    private final MessageQueue<T> queue;
    private final StageConsumer<T> consumer;
    private final int batchSize;

    public QueueWorker(MessageQueue<T> queue, StageConsumer<T> consumer, int batchSize) {
        this.queue = Objects.requireNonNull(queue, "queue is required");
        this.consumer = Objects.requireNonNull(consumer, "consumer is required");
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be at least 1");
        }
        this.batchSize = batchSize;
    }

    public String name() {
        return consumer.name() + "<-" + queue.name();
    }

    public Optional<StageResult> pollOnce() {
        List<QueueMessage<T>> batch;
        try {
            batch = queue.receive(batchSize);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Receive failed for " + name(), e);
            return Optional.empty();
        }
        if (batch.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(consumer.handleBatch(batch));
    }
}
