package com.weatherlandscape.pipeline.api;

import com.weatherlandscape.core.bus.EventBus;
import com.weatherlandscape.pipeline.store.PipelineStore;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.Executor;

public record StageContext(
        PipelineStore store,
        EventBus eventBus,
        Clock clock,
        Executor executor
) {
    public StageContext {
        Objects.requireNonNull(store, "store is required");
        Objects.requireNonNull(eventBus, "eventBus is required");
        Objects.requireNonNull(clock, "clock is required");
        Objects.requireNonNull(executor, "executor is required");
    }
}
