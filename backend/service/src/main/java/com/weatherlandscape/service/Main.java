package com.weatherlandscape.service;

import com.weatherlandscape.core.bus.EventBus;
import com.weatherlandscape.pipeline.store.PipelineStore;
import com.weatherlandscape.service.admin.AdminService;
import com.weatherlandscape.service.api.ApiServer;
import com.weatherlandscape.service.api.DiagnosticsTracker;
import com.weatherlandscape.service.config.ConfigLoader;
import com.weatherlandscape.service.config.PipelineSettings;
import com.weatherlandscape.service.provider.OpenWeatherMapClient;
import com.weatherlandscape.service.render.LandscapeRenderer;
import com.weatherlandscape.service.runtime.PipelineAssembly;
import com.weatherlandscape.service.runtime.SchedulerService;
import com.weatherlandscape.service.store.FileArtifactStore;
import com.weatherlandscape.service.store.JsonFileConfigStore;
import com.weatherlandscape.service.store.JsonlEventStore;

import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    private Main() {
    }

    public static void main(String[] args) throws InterruptedException {
        Map<String, String> env = System.getenv();
        Path configDir = Path.of(env.getOrDefault("WL_CONFIG_DIR", "config"));
        PipelineSettings settings = resolveSettings(configDir, env);
        Path dataDir = Path.of(settings.dataDir());
        Clock clock = Clock.systemUTC();

        EventBus eventBus = new EventBus();
        JsonlEventStore eventStore = new JsonlEventStore(dataDir.resolve("logs/events.jsonl"));
        eventBus.subscribeAll(eventStore::append);

        PipelineStore store = new PipelineStore(
                new JsonFileConfigStore(dataDir.resolve("state/config-store.json"), clock),
                settings.defaultZips()
        );
        FileArtifactStore artifacts = new FileArtifactStore(dataDir.resolve("artifacts"));

        String apiKey = env.getOrDefault("OWM_API_KEY", "");
        if (apiKey.isBlank()) {
            LOGGER.warning("OWM_API_KEY is not set; fetch batches will be retried until it is configured");
        }
        OpenWeatherMapClient provider = new OpenWeatherMapClient(
                HttpClient.newBuilder().connectTimeout(settings.providerTimeout()).build(),
                settings.providerBaseUrl(),
                apiKey,
                settings.providerTimeout(),
                clock
        );

        PipelineAssembly pipeline = new PipelineAssembly(
                settings,
                dataDir.resolve("queues"),
                store,
                artifacts,
                provider,
                new LandscapeRenderer(),
                eventBus,
                clock
        );
        SchedulerService scheduler = new SchedulerService(
                pipeline.zipScheduler(),
                pipeline.workers(),
                settings.schedulerInterval(),
                settings.pollInterval()
        );

        DiagnosticsTracker diagnosticsTracker = new DiagnosticsTracker(eventBus, clock, pipeline::queueDepths);
        ApiServer apiServer = new ApiServer(
                settings.httpPort(),
                store,
                artifacts,
                eventStore,
                new AdminService(store, pipeline.zipScheduler(), clock),
                diagnosticsTracker,
                clock
        );

        scheduler.start();
        apiServer.start();

        CountDownLatch shutdownLatch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            scheduler.shutdown();
            apiServer.stop();
            pipeline.shutdown();
            shutdownLatch.countDown();
        }));

        shutdownLatch.await();
    }

    static PipelineSettings resolveSettings(Path configDir, Map<String, String> env) {
        PipelineSettings settings;
        if (Files.exists(configDir.resolve(ConfigLoader.PIPELINE_FILE))) {
            settings = ConfigLoader.loadPipeline(configDir);
        } else {
            LOGGER.warning("No " + ConfigLoader.PIPELINE_FILE + " in " + configDir.toAbsolutePath() + ", using defaults");
            settings = PipelineSettings.defaults();
        }
        String dataDirOverride = env.get("WL_DATA_DIR");
        if (dataDirOverride != null && !dataDirOverride.isBlank()) {
            settings = settings.withDataDir(dataDirOverride);
        }
        return settings;
    }
}
