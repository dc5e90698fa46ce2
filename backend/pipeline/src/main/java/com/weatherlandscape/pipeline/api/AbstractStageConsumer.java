package com.weatherlandscape.pipeline.api;

import com.weatherlandscape.core.events.MessageFailed;
import com.weatherlandscape.core.events.StageBatchCompleted;
import com.weatherlandscape.core.events.StageBatchStarted;
import com.weatherlandscape.core.model.StatusRecord;
import com.weatherlandscape.core.trace.TraceContext;
import com.weatherlandscape.core.trace.TraceLog;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Level;
import java.util.logging.Logger;

public abstract class AbstractStageConsumer<T> implements StageConsumer<T> {
    private static final Logger LOGGER = Logger.getLogger(AbstractStageConsumer.class.getName());

    protected final StageContext ctx;
    protected final TraceLog traceLog;
    private final String name;

    protected AbstractStageConsumer(String name, StageContext ctx) {
        this.name = name;
        this.ctx = ctx;
        this.traceLog = TraceLog.forClass(getClass());
    }

    @Override
    public final String name() {
        return name;
    }

    @Override
    public final StageResult handleBatch(List<QueueMessage<T>> batch) {
        Instant startedAt = ctx.clock().instant();
        ctx.eventBus().publish(new StageBatchStarted(startedAt, name, batch.size()));

        try {
            checkBatch();
        } catch (PipelineException batchFailure) {
            return failWholeBatch(batch, startedAt, batchFailure);
        }

        List<CompletableFuture<Outcome>> tasks = batch.stream()
                .map(message -> CompletableFuture.supplyAsync(() -> settle(message), ctx.executor()))
                .toList();
        List<Outcome> outcomes = tasks.stream().map(CompletableFuture::join).toList();

        int successes = 0;
        int emitted = 0;
        List<String> errors = new ArrayList<>();
        for (Outcome outcome : outcomes) {
            if (outcome.error() == null) {
                successes++;
                emitted += outcome.emitted();
            } else {
                errors.add(outcome.error());
            }
        }
        Map<String, Integer> totals = new HashMap<>();
        totals.put("messages", batch.size());
        totals.put(emittedLabel(), emitted);
        return complete(startedAt, totals, successes, errors);
    }

    protected void checkBatch() {
    }

    protected abstract int process(T body);

    protected abstract String emittedLabel();

    protected abstract String zipOf(T body);

    protected abstract TraceContext traceOf(T body);

    private Outcome settle(QueueMessage<T> message) {
        T body = message.body();
        int emitted;
        try {
            emitted = process(body);
        } catch (RuntimeException e) {
            return requestRedelivery(message, e);
        }
        try {
            message.ack();
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, name + " could not ack message " + message.id(), e);
            return new Outcome(0, zipOf(body) + ": ack failed: " + describe(e));
        }
        return new Outcome(emitted, null);
    }

    private Outcome requestRedelivery(QueueMessage<T> message, RuntimeException failure) {
        T body = message.body();
        String error = zipOf(body) + ": " + describe(failure);
        traceLog.warn("Message failed, requesting redelivery", traceOf(body), Map.of(
                "stage", name,
                "zip", zipOf(body),
                "attempt", message.attempts(),
                "error", describe(failure)
        ));
        try {
            message.retry();
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, name + " could not reschedule message " + message.id(), e);
            return new Outcome(0, error + "; retry failed: " + describe(e));
        }
        ctx.eventBus().publish(new MessageFailed(
                ctx.clock().instant(),
                name,
                zipOf(body),
                traceOf(body).traceId(),
                describe(failure),
                true
        ));
        return new Outcome(0, error);
    }

    private StageResult failWholeBatch(List<QueueMessage<T>> batch, Instant startedAt, PipelineException failure) {
        LOGGER.log(Level.WARNING, name + " batch of " + batch.size() + " rejected: " + failure.getMessage());
        for (QueueMessage<T> message : batch) {
            try {
                message.retry();
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, name + " could not reschedule message " + message.id(), e);
            }
        }
        Map<String, Integer> totals = new HashMap<>();
        totals.put("messages", batch.size());
        totals.put(emittedLabel(), 0);
        List<String> errors = new ArrayList<>();
        errors.add("batch: " + describe(failure));
        StageResult result = complete(startedAt, totals, 0, errors);
        return StageResult.failure(name + " batch rejected: " + failure.getMessage(), result.stats());
    }

    private StageResult complete(Instant startedAt, Map<String, Integer> totals, int successes, List<String> errors) {
        Instant finishedAt = ctx.clock().instant();
        int errorCount = totals.get("messages") - successes;
        StatusRecord status = new StatusRecord(name, finishedAt, totals, successes, errorCount, errors);
        try {
            ctx.store().putStatus(status);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Failed to write status record for " + name, e);
        }
        ctx.eventBus().publish(new StageBatchCompleted(
                finishedAt,
                name,
                successes,
                errorCount,
                Duration.between(startedAt, finishedAt).toMillis()
        ));
        LOGGER.info(name + " batch completed: " + successes + " success, " + errorCount + " errors");

        Map<String, Object> stats = new HashMap<>(totals);
        stats.put("successes", successes);
        stats.put("errors", errorCount);
        if (errorCount == 0) {
            return StageResult.success(name + " batch completed", stats);
        }
        return StageResult.failure(name + " batch had failures", stats);
    }

    protected static String describe(Throwable throwable) {
        Throwable root = throwable;
        while (root.getCause() != null && root.getMessage() == null) {
            root = root.getCause();
        }
        return root.getMessage() == null ? root.getClass().getSimpleName() : root.getMessage();
    }

    private record Outcome(int emitted, String error) {
    }
}
