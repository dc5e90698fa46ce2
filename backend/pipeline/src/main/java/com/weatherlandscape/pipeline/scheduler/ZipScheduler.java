package com.weatherlandscape.pipeline.scheduler;

import com.weatherlandscape.core.events.StageBatchCompleted;
import com.weatherlandscape.core.events.StageBatchStarted;
import com.weatherlandscape.core.message.FetchJob;
import com.weatherlandscape.core.model.StatusRecord;
import com.weatherlandscape.core.trace.TraceContext;
import com.weatherlandscape.core.trace.TraceLog;
import com.weatherlandscape.pipeline.api.MessageQueue;
import com.weatherlandscape.pipeline.api.StageContext;
import com.weatherlandscape.pipeline.api.StageResult;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

public class ZipScheduler {
    public static final String NAME = "scheduler";

    private static final Logger LOGGER = Logger.getLogger(ZipScheduler.class.getName());
    private static final TraceLog TRACE_LOG = TraceLog.forClass(ZipScheduler.class);

    private final StageContext ctx;
    private final MessageQueue<FetchJob> fetchJobs;

    public ZipScheduler(StageContext ctx, MessageQueue<FetchJob> fetchJobs) {
        this.ctx = ctx;
        this.fetchJobs = fetchJobs;
    }

    public StageResult tick() {
        Instant startedAt = ctx.clock().instant();
        List<String> zips;
        try {
            zips = ctx.store().activeZips();
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Scheduler could not read active ZIPs", e);
            ctx.eventBus().publish(new StageBatchCompleted(ctx.clock().instant(), NAME, 0, 1, 0));
            return StageResult.failure("Active ZIPs unavailable: " + e.getMessage(), Map.of());
        }
        ctx.eventBus().publish(new StageBatchStarted(startedAt, NAME, zips.size()));
        LOGGER.info("Scheduling " + zips.size() + " ZIP(s): " + String.join(", ", zips));

        int enqueued = 0;
        List<String> errors = new ArrayList<>();
        for (String zip : zips) {
            try {
                enqueue(zip, startedAt);
                enqueued++;
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, "Failed to enqueue fetch job for " + zip, e);
                errors.add(zip + ": " + e.getMessage());
            }
        }

        Instant finishedAt = ctx.clock().instant();
        Map<String, Integer> totals = new HashMap<>();
        totals.put("totalZips", zips.size());
        totals.put("enqueued", enqueued);
        try {
            ctx.store().putStatus(new StatusRecord(NAME, finishedAt, totals, enqueued, errors.size(), errors));
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Failed to update scheduler status", e);
        }
        ctx.eventBus().publish(new StageBatchCompleted(
                finishedAt,
                NAME,
                enqueued,
                errors.size(),
                Duration.between(startedAt, finishedAt).toMillis()
        ));

        Map<String, Object> stats = new HashMap<>(totals);
        if (errors.isEmpty()) {
            return StageResult.success("Scheduled " + enqueued + " ZIP(s)", stats);
        }
        return StageResult.failure("Scheduled " + enqueued + " of " + zips.size() + " ZIP(s)", stats);
    }

    public FetchJob enqueue(String zip, Instant scheduledAt) {
        FetchJob job = new FetchJob(zip, scheduledAt, TraceContext.root());
        TRACE_LOG.info("Scheduling ZIP for refresh", job.trace(), Map.of(
                "zip", job.zip(),
                "stage", NAME,
                "action", "schedule_zip"
        ));
        fetchJobs.send(job);
        return job;
    }
}
