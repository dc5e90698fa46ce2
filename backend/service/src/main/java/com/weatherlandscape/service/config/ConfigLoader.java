package com.weatherlandscape.service.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.weatherlandscape.core.util.JsonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

public final class ConfigLoader {
    public static final String PIPELINE_FILE = "pipeline.json";

    private ConfigLoader() {
    }

    public static PipelineSettings loadPipeline(Path configDir) {
        return read(configDir.resolve(PIPELINE_FILE), new TypeReference<>() {
        });
    }

    private static <T> T read(Path path, TypeReference<T> ref) {
        try (InputStream in = Files.newInputStream(path)) {
            return JsonUtils.objectMapper().readValue(in, ref);
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading config from " + path, e);
        }
    }
}
