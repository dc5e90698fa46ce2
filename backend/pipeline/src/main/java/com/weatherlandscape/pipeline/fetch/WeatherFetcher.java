package com.weatherlandscape.pipeline.fetch;

import com.fasterxml.jackson.databind.JsonNode;
import com.weatherlandscape.core.message.FetchJob;
import com.weatherlandscape.core.message.WeatherReadyEvent;
import com.weatherlandscape.core.model.GeocodeEntry;
import com.weatherlandscape.core.model.WeatherPayload;
import com.weatherlandscape.core.trace.TraceContext;
import com.weatherlandscape.pipeline.api.AbstractStageConsumer;
import com.weatherlandscape.pipeline.api.MessageQueue;
import com.weatherlandscape.pipeline.api.StageContext;
import com.weatherlandscape.pipeline.api.WeatherProvider;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

public class WeatherFetcher extends AbstractStageConsumer<FetchJob> {
    public static final String NAME = "fetcher";

    private static final Logger LOGGER = Logger.getLogger(WeatherFetcher.class.getName());

    private final WeatherProvider provider;
    private final MessageQueue<WeatherReadyEvent> weatherReady;
    private final Duration weatherTtl;

    public WeatherFetcher(
            StageContext ctx,
            WeatherProvider provider,
            MessageQueue<WeatherReadyEvent> weatherReady,
            Duration weatherTtl
    ) {
        super(NAME, ctx);
        if (weatherTtl.isZero() || weatherTtl.isNegative()) {
            throw new IllegalArgumentException("weatherTtl must be positive");
        }
        this.provider = provider;
        this.weatherReady = weatherReady;
        this.weatherTtl = weatherTtl;
    }

    @Override
    protected void checkBatch() {
        provider.requireCredentials();
    }

    @Override
    protected int process(FetchJob job) {
        String zip = job.zip();
        GeocodeEntry geo = resolveCoordinates(zip);

        JsonNode current = provider.currentWeather(geo.lat(), geo.lon());
        JsonNode forecast = provider.forecast(geo.lat(), geo.lon());
        ctx.store().putWeather(zip, new WeatherPayload(current, forecast), weatherTtl);

        WeatherReadyEvent event = new WeatherReadyEvent(
                zip,
                geo.lat(),
                geo.lon(),
                ctx.clock().instant(),
                job.trace().child()
        );
        weatherReady.send(event);
        traceLog.info("Weather ready", event.trace(), Map.of(
                "zip", zip,
                "stage", NAME,
                "action", "weather_ready",
                "ttlSeconds", weatherTtl.toSeconds()
        ));
        return 1;
    }

    GeocodeEntry resolveCoordinates(String zip) {
        Optional<GeocodeEntry> cached;
        try {
            cached = ctx.store().geocode(zip);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Geocode cache read failed for " + zip + ", asking provider", e);
            cached = Optional.empty();
        }
        if (cached.isPresent()) {
            return cached.get();
        }

        GeocodeEntry resolved = provider.geocode(zip);
        try {
            ctx.store().putGeocode(resolved);
            LOGGER.info("Cached geocode for " + zip + ": " + resolved.lat() + ", " + resolved.lon());
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Failed to cache geocode for " + zip, e);
        }
        return resolved;
    }

    @Override
    protected String emittedLabel() {
        return "eventsEnqueued";
    }

    @Override
    protected String zipOf(FetchJob body) {
        return body.zip();
    }

    @Override
    protected TraceContext traceOf(FetchJob body) {
        return body.trace();
    }
}
