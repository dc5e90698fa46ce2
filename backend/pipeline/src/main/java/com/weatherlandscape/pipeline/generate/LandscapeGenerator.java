package com.weatherlandscape.pipeline.generate;

import com.weatherlandscape.core.events.ArtifactPublished;
import com.weatherlandscape.core.message.GenerationJob;
import com.weatherlandscape.core.model.ArtifactMetadata;
import com.weatherlandscape.core.model.WeatherPayload;
import com.weatherlandscape.core.trace.TraceContext;
import com.weatherlandscape.pipeline.api.AbstractStageConsumer;
import com.weatherlandscape.pipeline.api.ArtifactStore;
import com.weatherlandscape.pipeline.api.PipelineException;
import com.weatherlandscape.pipeline.api.Renderer;
import com.weatherlandscape.pipeline.api.StageContext;
import com.weatherlandscape.pipeline.api.StalePipelineException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

public class LandscapeGenerator extends AbstractStageConsumer<GenerationJob> {
    public static final String NAME = "generator";

    private final Renderer renderer;
    private final ArtifactStore artifacts;

    public LandscapeGenerator(StageContext ctx, Renderer renderer, ArtifactStore artifacts) {
        super(NAME, ctx);
        this.renderer = renderer;
        this.artifacts = artifacts;
    }

    @Override
    protected int process(GenerationJob job) {
        WeatherPayload weather = ctx.store().weather(job.zip())
                .orElseThrow(() -> new StalePipelineException(NAME, job.zip()));

        byte[] image;
        try {
            image = renderer.render(new Renderer.RenderRequest(weather, job.lat(), job.lon(), job.format()));
        } catch (RuntimeException e) {
            throw new PipelineException(NAME, "Render failed for " + job.artifactKey() + ": " + describe(e), e);
        }
        if (image == null || image.length == 0) {
            throw new PipelineException(NAME, "Renderer produced no bytes for " + job.artifactKey());
        }

        Instant generatedAt = ctx.clock().instant();
        ArtifactMetadata metadata = new ArtifactMetadata(
                generatedAt,
                job.lat(),
                job.lon(),
                job.zip(),
                image.length,
                job.format().id(),
                job.trace().traceId()
        );
        artifacts.put(job.artifactKey(), image, job.format().mimeType(), blobMetadata(metadata));
        ctx.store().putArtifactMetadata(job.format(), metadata);

        ctx.eventBus().publish(new ArtifactPublished(
                generatedAt,
                job.artifactKey(),
                job.zip(),
                job.format().id(),
                image.length,
                job.trace().traceId()
        ));
        traceLog.info("Artifact uploaded", job.trace(), Map.of(
                "zip", job.zip(),
                "format", job.format().id(),
                "key", job.artifactKey(),
                "bytes", image.length,
                "stage", NAME,
                "action", "upload"
        ));
        return 1;
    }

    static Map<String, String> blobMetadata(ArtifactMetadata metadata) {
        Map<String, String> blob = new LinkedHashMap<>();
        blob.put("generated-at", metadata.generatedAt().toString());
        blob.put("latitude", Double.toString(metadata.lat()));
        blob.put("longitude", Double.toString(metadata.lon()));
        blob.put("zip-code", metadata.zip());
        blob.put("file-size", Long.toString(metadata.byteSize()));
        blob.put("variant", metadata.formatVariant());
        blob.put("trace-id", metadata.traceId());
        return blob;
    }

    @Override
    protected String emittedLabel() {
        return "artifactsUploaded";
    }

    @Override
    protected String zipOf(GenerationJob body) {
        return body.zip();
    }

    @Override
    protected TraceContext traceOf(GenerationJob body) {
        return body.trace();
    }
}
