package com.weatherlandscape.service.runtime;

import com.weatherlandscape.core.bus.EventBus;
import com.weatherlandscape.core.message.FetchJob;
import com.weatherlandscape.core.message.GenerationJob;
import com.weatherlandscape.core.message.WeatherReadyEvent;
import com.weatherlandscape.pipeline.api.ArtifactStore;
import com.weatherlandscape.pipeline.api.Renderer;
import com.weatherlandscape.pipeline.api.StageContext;
import com.weatherlandscape.pipeline.api.WeatherProvider;
import com.weatherlandscape.pipeline.dispatch.JobDispatcher;
import com.weatherlandscape.pipeline.fetch.WeatherFetcher;
import com.weatherlandscape.pipeline.generate.LandscapeGenerator;
import com.weatherlandscape.pipeline.scheduler.ZipScheduler;
import com.weatherlandscape.pipeline.store.PipelineStore;
import com.weatherlandscape.service.config.PipelineSettings;
import com.weatherlandscape.service.queue.FileMessageQueue;

import java.nio.file.Path;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

public final class PipelineAssembly {
    public static final String FETCH_JOBS = "fetch-jobs";
    public static final String WEATHER_READY = "weather-ready";
    public static final String LANDSCAPE_JOBS = "landscape-jobs";

    private final FileMessageQueue<FetchJob> fetchJobs;
    private final FileMessageQueue<WeatherReadyEvent> weatherReady;
    private final FileMessageQueue<GenerationJob> generationJobs;
    private final ExecutorService stageExecutor;
    private final ZipScheduler zipScheduler;
    private final List<QueueWorker<?>> workers;

    public PipelineAssembly(
            PipelineSettings settings,
            Path queueRoot,
            PipelineStore store,
            ArtifactStore artifacts,
            WeatherProvider provider,
            Renderer renderer,
            EventBus eventBus,
            Clock clock
    ) {
        FileMessageQueue.Settings queueSettings = new FileMessageQueue.Settings(
                settings.visibilityTimeout(),
                settings.retryBackoff(),
                settings.maxDeliveryAttempts()
        );
        this.fetchJobs = new FileMessageQueue<>(FETCH_JOBS, queueRoot.resolve(FETCH_JOBS), FetchJob.class,
                clock, eventBus, queueSettings);
        this.weatherReady = new FileMessageQueue<>(WEATHER_READY, queueRoot.resolve(WEATHER_READY),
                WeatherReadyEvent.class, clock, eventBus, queueSettings);
        this.generationJobs = new FileMessageQueue<>(LANDSCAPE_JOBS, queueRoot.resolve(LANDSCAPE_JOBS),
                GenerationJob.class, clock, eventBus, queueSettings);

        this.stageExecutor = Executors.newFixedThreadPool(settings.workerThreads());
        StageContext context = new StageContext(store, eventBus, clock, stageExecutor);
        this.zipScheduler = new ZipScheduler(context, fetchJobs);
        this.workers = List.of(
                new QueueWorker<>(fetchJobs,
                        new WeatherFetcher(context, provider, weatherReady, settings.weatherTtl()),
                        settings.batchSize()),
                new QueueWorker<>(weatherReady, new JobDispatcher(context, generationJobs), settings.batchSize()),
                new QueueWorker<>(generationJobs, new LandscapeGenerator(context, renderer, artifacts),
                        settings.batchSize())
        );
    }

    public ZipScheduler zipScheduler() {
        return zipScheduler;
    }

    public List<QueueWorker<?>> workers() {
        return workers;
    }

    public Map<String, Integer> queueDepths() {
        Map<String, Integer> depths = new LinkedHashMap<>();
        depths.put(fetchJobs.name(), fetchJobs.depth());
        depths.put(weatherReady.name(), weatherReady.depth());
        depths.put(generationJobs.name(), generationJobs.depth());
        return depths;
    }

    public void shutdown() {
        stageExecutor.shutdown();
    }
}
