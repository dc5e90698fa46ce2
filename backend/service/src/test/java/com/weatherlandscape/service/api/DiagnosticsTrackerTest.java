package com.weatherlandscape.service.api;

import com.weatherlandscape.core.bus.EventBus;
import com.weatherlandscape.core.events.ArtifactPublished;
import com.weatherlandscape.core.events.MessageFailed;
import com.weatherlandscape.core.events.StageBatchCompleted;
import com.weatherlandscape.core.events.StageBatchStarted;
import com.weatherlandscape.service.support.TestClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;

class DiagnosticsTrackerTest {
    private final TestClock clock = new TestClock(Instant.parse("2026-10-19T12:00:00Z"));
    private final EventBus eventBus = new EventBus();
    private final DiagnosticsTracker tracker =
            new DiagnosticsTracker(eventBus, clock, () -> Map.of("fetch-jobs", 3, "weather-ready", 0));

    @Test
    void countsEventsArtifactsAndFailures() {
        eventBus.publish(new ArtifactPublished(clock.instant(), "78729/bw.bmp", "78729", "bw", 10, "t1"));
        eventBus.publish(new MessageFailed(clock.instant(), "generator", "78729", "t1", "render failed", true));
        eventBus.publish(new MessageFailed(clock.instant(), "landscape-jobs", "78729", "t1", "dropped", false));

        Map<String, Object> metrics = tracker.metricsSnapshot();

        assertEquals(3L, metrics.get("eventsEmittedTotal"));
        assertEquals(1L, metrics.get("artifactsPublishedTotal"));
        assertEquals(1L, metrics.get("messagesFailedTotal"));
        assertEquals(1L, metrics.get("messagesDroppedTotal"));
        assertEquals(Map.of("fetch-jobs", 3, "weather-ready", 0), metrics.get("queueDepths"));
    }

    @Test
    void recentRateForgetsEventsOlderThanAMinute() {
        eventBus.publish(new StageBatchStarted(clock.instant(), "fetcher", 1));
        clock.advance(Duration.ofSeconds(30));
        eventBus.publish(new StageBatchStarted(clock.instant(), "fetcher", 1));

        assertEquals(2, tracker.metricsSnapshot().get("recentEventsPerMinute"));
        clock.advance(Duration.ofSeconds(45));
        assertEquals(1, tracker.metricsSnapshot().get("recentEventsPerMinute"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void tracksPerStageBatchesAndLastError() {
        eventBus.publish(new StageBatchStarted(clock.instant(), "generator", 2));
        eventBus.publish(new StageBatchCompleted(clock.instant(), "generator", 1, 1, 250));
        eventBus.publish(new MessageFailed(clock.instant(), "generator", "78729", "t1", "render failed", true));
        eventBus.publish(new StageBatchCompleted(clock.instant(), "generator", 2, 0, 100));

        Map<String, Object> generator = (Map<String, Object>) tracker.stagesSnapshot().get("generator");

        assertEquals(2L, generator.get("batches"));
        assertEquals(3L, generator.get("successes"));
        assertEquals(1L, generator.get("errors"));
        assertEquals(100L, generator.get("lastDurationMillis"));
        assertEquals(true, generator.get("lastSuccess"));
        assertEquals("78729: render failed", generator.get("lastErrorMessage"));
        assertEquals("2026-10-19T12:00:00Z", generator.get("lastRunAt"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void startedOnlyStageHasNoOutcomeYet() {
        eventBus.publish(new StageBatchStarted(clock.instant(), "dispatcher", 4));

        Map<String, Object> dispatcher = (Map<String, Object>) tracker.stagesSnapshot().get("dispatcher");

        assertNull(dispatcher.get("lastSuccess"));
        assertEquals(0L, dispatcher.get("batches"));
        assertFalse(tracker.stagesSnapshot().containsKey("fetcher"));
    }
}
