package com.weatherlandscape.pipeline.dispatch;

import com.weatherlandscape.core.format.FormatId;
import com.weatherlandscape.core.message.GenerationJob;
import com.weatherlandscape.core.message.WeatherReadyEvent;
import com.weatherlandscape.core.trace.TraceContext;
import com.weatherlandscape.pipeline.api.AbstractStageConsumer;
import com.weatherlandscape.pipeline.api.MessageQueue;
import com.weatherlandscape.pipeline.api.StageContext;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public class JobDispatcher extends AbstractStageConsumer<WeatherReadyEvent> {
    public static final String NAME = "dispatcher";

    private final MessageQueue<GenerationJob> generationJobs;

    public JobDispatcher(StageContext ctx, MessageQueue<GenerationJob> generationJobs) {
        super(NAME, ctx);
        this.generationJobs = generationJobs;
    }

    @Override
    protected int process(WeatherReadyEvent event) {
        List<FormatId> formats = ctx.store().formatsFor(event.zip());
        traceLog.info("Dispatching generation jobs", event.trace(), Map.of(
                "zip", event.zip(),
                "formats", formats.stream().map(FormatId::id).toList(),
                "stage", NAME,
                "action", "dispatch_jobs"
        ));
        Instant enqueuedAt = ctx.clock().instant();
        for (FormatId format : formats) {
            generationJobs.send(new GenerationJob(
                    event.zip(),
                    format,
                    event.lat(),
                    event.lon(),
                    enqueuedAt,
                    event.trace().child()
            ));
        }
        return formats.size();
    }

    @Override
    protected String emittedLabel() {
        return "jobsEnqueued";
    }

    @Override
    protected String zipOf(WeatherReadyEvent body) {
        return body.zip();
    }

    @Override
    protected TraceContext traceOf(WeatherReadyEvent body) {
        return body.trace();
    }
}
