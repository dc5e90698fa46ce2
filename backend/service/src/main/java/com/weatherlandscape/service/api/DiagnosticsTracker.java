package com.weatherlandscape.service.api;

import com.weatherlandscape.core.bus.EventBus;
import com.weatherlandscape.core.events.ArtifactPublished;
import com.weatherlandscape.core.events.Event;
import com.weatherlandscape.core.events.MessageFailed;
import com.weatherlandscape.core.events.StageBatchCompleted;
import com.weatherlandscape.core.events.StageBatchStarted;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayDeque;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Supplier;

public final class DiagnosticsTracker {
    private final Clock clock;
    private final Supplier<Map<String, Integer>> queueDepths;
    private final LongAdder eventsEmittedTotal = new LongAdder();
    private final LongAdder artifactsPublishedTotal = new LongAdder();
    private final LongAdder messagesFailedTotal = new LongAdder();
    private final LongAdder messagesDroppedTotal = new LongAdder();
    private final ArrayDeque<Instant> recentEventTimestamps = new ArrayDeque<>();
    private final Object recentLock = new Object();
    private final ConcurrentHashMap<String, StageStatus> stageStatuses = new ConcurrentHashMap<>();

    public DiagnosticsTracker(EventBus eventBus, Clock clock, Supplier<Map<String, Integer>> queueDepths) {
        this(clock, queueDepths);
        eventBus.subscribeAll(this::onAnyEvent);
        eventBus.subscribe(StageBatchStarted.class, this::onBatchStarted);
        eventBus.subscribe(StageBatchCompleted.class, this::onBatchCompleted);
        eventBus.subscribe(MessageFailed.class, this::onMessageFailed);
        eventBus.subscribe(ArtifactPublished.class, event -> artifactsPublishedTotal.increment());
    }

    private DiagnosticsTracker(Clock clock, Supplier<Map<String, Integer>> queueDepths) {
        this.clock = clock;
        this.queueDepths = queueDepths;
    }

    public static DiagnosticsTracker empty() {
        return new DiagnosticsTracker(Clock.systemUTC(), Map::of);
    }

    public Map<String, Object> metricsSnapshot() {
        Map<String, Object> metrics = new HashMap<>();
        metrics.put("eventsEmittedTotal", eventsEmittedTotal.longValue());
        metrics.put("recentEventsPerMinute", recentEventsPerMinute());
        metrics.put("artifactsPublishedTotal", artifactsPublishedTotal.longValue());
        metrics.put("messagesFailedTotal", messagesFailedTotal.longValue());
        metrics.put("messagesDroppedTotal", messagesDroppedTotal.longValue());
        metrics.put("queueDepths", new TreeMap<>(queueDepths.get()));
        metrics.put("stages", stagesSnapshot());
        return metrics;
    }

    public Map<String, Object> stagesSnapshot() {
        Map<String, Object> stages = new TreeMap<>();
        for (Map.Entry<String, StageStatus> entry : stageStatuses.entrySet()) {
            stages.put(entry.getKey(), entry.getValue().toMap());
        }
        return stages;
    }

    private void onAnyEvent(Event event) {
        eventsEmittedTotal.increment();
        Instant now = clock.instant();
        synchronized (recentLock) {
            recentEventTimestamps.addLast(now);
            trimOld(now);
        }
    }

    private int recentEventsPerMinute() {
        synchronized (recentLock) {
            trimOld(clock.instant());
            return recentEventTimestamps.size();
        }
    }

    private void trimOld(Instant now) {
        Instant threshold = now.minus(1, ChronoUnit.MINUTES);
        while (!recentEventTimestamps.isEmpty() && recentEventTimestamps.peekFirst().isBefore(threshold)) {
            recentEventTimestamps.removeFirst();
        }
    }

    private void onBatchStarted(StageBatchStarted event) {
        stageStatuses.compute(event.stage(), (name, current) ->
                (current == null ? StageStatus.EMPTY : current).withStart(event.timestamp()));
    }

    private void onBatchCompleted(StageBatchCompleted event) {
        stageStatuses.compute(event.stage(), (name, current) ->
                (current == null ? StageStatus.EMPTY : current).withCompletion(event));
    }

    private void onMessageFailed(MessageFailed event) {
        if (event.retryRequested()) {
            messagesFailedTotal.increment();
        } else {
            messagesDroppedTotal.increment();
        }
        stageStatuses.compute(event.stage(), (name, current) ->
                (current == null ? StageStatus.EMPTY : current).withLastError(event.zip() + ": " + event.error()));
    }

    private record StageStatus(
            Instant lastRunAt,
            Long lastDurationMillis,
            Boolean lastSuccess,
            long batches,
            long successes,
            long errors,
            String lastErrorMessage
    ) {
        private static final StageStatus EMPTY = new StageStatus(null, null, null, 0, 0, 0, null);

        private StageStatus withStart(Instant runAt) {
            return new StageStatus(runAt, lastDurationMillis, lastSuccess, batches, successes, errors, lastErrorMessage);
        }

        private StageStatus withCompletion(StageBatchCompleted event) {
            return new StageStatus(
                    event.timestamp(),
                    event.durationMillis(),
                    event.success(),
                    batches + 1,
                    successes + event.successCount(),
                    errors + event.errorCount(),
                    lastErrorMessage
            );
        }

        private StageStatus withLastError(String message) {
            return new StageStatus(lastRunAt, lastDurationMillis, lastSuccess, batches, successes, errors, message);
        }

        private Map<String, Object> toMap() {
            Map<String, Object> map = new HashMap<>();
            map.put("lastRunAt", lastRunAt == null ? null : lastRunAt.toString());
            map.put("lastDurationMillis", lastDurationMillis);
            map.put("lastSuccess", lastSuccess);
            map.put("batches", batches);
            map.put("successes", successes);
            map.put("errors", errors);
            map.put("lastErrorMessage", lastErrorMessage);
            return map;
        }
    }
}
