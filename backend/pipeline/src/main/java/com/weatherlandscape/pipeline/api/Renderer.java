package com.weatherlandscape.pipeline.api;

import com.weatherlandscape.core.format.FormatId;
import com.weatherlandscape.core.format.RenderConfig;
import com.weatherlandscape.core.model.WeatherPayload;

import java.util.Objects;

@FunctionalInterface
public interface Renderer {
    byte[] render(RenderRequest request);

    record RenderRequest(WeatherPayload weather, double lat, double lon, FormatId format) {
        public RenderRequest {
            Objects.requireNonNull(weather, "weather is required");
            Objects.requireNonNull(format, "format is required");
        }

        public RenderConfig config() {
            return format.renderConfig();
        }
    }
}
