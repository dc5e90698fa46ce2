package com.weatherlandscape.service.runtime;

import com.weatherlandscape.pipeline.api.StageResult;
import com.weatherlandscape.pipeline.scheduler.ZipScheduler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

public class SchedulerService {
    private static final Logger LOGGER = Logger.getLogger(SchedulerService.class.getName());

    private final ZipScheduler zipScheduler;
    private final List<QueueWorker<?>> workers;
    private final Duration tickInterval;
    private final Duration pollInterval;
    private final long minIntervalMillis;
    private final ScheduledExecutorService timerExecutor = Executors.newSingleThreadScheduledExecutor();
    private final ExecutorService pollExecutor;

    public SchedulerService(
            ZipScheduler zipScheduler,
            List<QueueWorker<?>> workers,
            Duration tickInterval,
            Duration pollInterval
    ) {
        this(zipScheduler, workers, tickInterval, pollInterval, 100);
    }

    SchedulerService(
            ZipScheduler zipScheduler,
            List<QueueWorker<?>> workers,
            Duration tickInterval,
            Duration pollInterval,
            long minIntervalMillis
    ) {
        this.zipScheduler = zipScheduler;
        this.workers = List.copyOf(workers);
        this.tickInterval = tickInterval;
        this.pollInterval = pollInterval;
        this.minIntervalMillis = minIntervalMillis;
        this.pollExecutor = Executors.newFixedThreadPool(Math.max(1, this.workers.size()));
    }

    public void start() {
        long tickMillis = Math.max(minIntervalMillis, tickInterval.toMillis());
        timerExecutor.scheduleAtFixedRate(
                this::tickSafely,
                0,
                tickMillis,
                TimeUnit.MILLISECONDS
        );
        long pollMillis = Math.max(minIntervalMillis, pollInterval.toMillis());
        for (QueueWorker<?> worker : workers) {
            pollExecutor.submit(() -> pollLoop(worker, pollMillis));
        }
        LOGGER.info("Scheduler started: tick every " + tickMillis + "ms, " + workers.size() + " worker(s)");
    }

    public List<StageResult> runOnce() {
        List<StageResult> results = new ArrayList<>();
        results.add(tickSafely());
        for (QueueWorker<?> worker : workers) {
            while (true) {
                Optional<StageResult> result = worker.pollOnce();
                if (result.isEmpty()) {
                    break;
                }
                results.add(result.get());
            }
        }
        return results;
    }

    public void shutdown() {
        timerExecutor.shutdown();
        pollExecutor.shutdownNow();
        try {
            timerExecutor.awaitTermination(5, TimeUnit.SECONDS);
            pollExecutor.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private StageResult tickSafely() {
        try {
            return zipScheduler.tick();
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Scheduler tick failed", e);
            return StageResult.failure("Scheduler tick failed: " + e.getMessage(), Map.of());
        }
    }

    private void pollLoop(QueueWorker<?> worker, long pollMillis) {
        while (!Thread.currentThread().isInterrupted()) {
            boolean handled;
            try {
                handled = worker.pollOnce().isPresent();
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, "Worker " + worker.name() + " failed", e);
                handled = false;
            }
            if (handled) {
                continue;
            }
            try {
                Thread.sleep(pollMillis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
