package com.weatherlandscape.core.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

public record WeatherPayload(JsonNode current, JsonNode forecast) {
    public WeatherPayload {
        Objects.requireNonNull(current, "current is required");
        Objects.requireNonNull(forecast, "forecast is required");
    }
}
