package com.weatherlandscape.service.config;

import java.time.Duration;
import java.util.List;

public record PipelineSettings(
        Duration schedulerInterval,
        Duration weatherTtl,
        Integer batchSize,
        Duration pollInterval,
        Duration visibilityTimeout,
        Integer maxDeliveryAttempts,
        Duration retryBackoff,
        Integer workerThreads,
        Integer httpPort,
        String dataDir,
        List<String> defaultZips,
        Duration providerTimeout,
        String providerBaseUrl
) {
    public static final Duration DEFAULT_SCHEDULER_INTERVAL = Duration.ofMinutes(15);
    public static final Duration DEFAULT_WEATHER_TTL = Duration.ofMinutes(20);

    public PipelineSettings {
        schedulerInterval = schedulerInterval == null ? DEFAULT_SCHEDULER_INTERVAL : schedulerInterval;
        weatherTtl = weatherTtl == null ? DEFAULT_WEATHER_TTL : weatherTtl;
        batchSize = batchSize == null ? 10 : batchSize;
        pollInterval = pollInterval == null ? Duration.ofSeconds(5) : pollInterval;
        visibilityTimeout = visibilityTimeout == null ? Duration.ofMinutes(2) : visibilityTimeout;
        maxDeliveryAttempts = maxDeliveryAttempts == null ? 5 : maxDeliveryAttempts;
        retryBackoff = retryBackoff == null ? Duration.ofSeconds(30) : retryBackoff;
        workerThreads = workerThreads == null ? 4 : workerThreads;
        httpPort = httpPort == null ? 8080 : httpPort;
        dataDir = dataDir == null || dataDir.isBlank() ? "data" : dataDir;
        defaultZips = defaultZips == null || defaultZips.isEmpty() ? List.of("78729") : List.copyOf(defaultZips);
        providerTimeout = providerTimeout == null ? Duration.ofSeconds(10) : providerTimeout;
        providerBaseUrl = providerBaseUrl == null || providerBaseUrl.isBlank()
                ? "http://api.openweathermap.org"
                : providerBaseUrl;

        if (schedulerInterval.isNegative() || schedulerInterval.isZero()) {
            throw new IllegalArgumentException("schedulerInterval must be positive");
        }
        if (weatherTtl.compareTo(schedulerInterval) <= 0) {
            throw new IllegalArgumentException("weatherTtl (" + weatherTtl + ") must be longer than schedulerInterval ("
                    + schedulerInterval + ") or generation jobs will find the cache empty");
        }
        if (batchSize < 1 || maxDeliveryAttempts < 1 || workerThreads < 1) {
            throw new IllegalArgumentException("batchSize, maxDeliveryAttempts and workerThreads must be at least 1");
        }
        if (httpPort < 0 || httpPort > 65535) {
            throw new IllegalArgumentException("httpPort out of range: " + httpPort);
        }
    }

    public static PipelineSettings defaults() {
        return new PipelineSettings(null, null, null, null, null, null, null, null, null, null, null, null, null);
    }

    public PipelineSettings withDataDir(String override) {
        return new PipelineSettings(schedulerInterval, weatherTtl, batchSize, pollInterval, visibilityTimeout,
                maxDeliveryAttempts, retryBackoff, workerThreads, httpPort, override, defaultZips, providerTimeout,
                providerBaseUrl);
    }
}
