package com.weatherlandscape.service.support;

import com.fasterxml.jackson.databind.JsonNode;
import com.weatherlandscape.core.model.WeatherPayload;
import com.weatherlandscape.core.util.JsonUtils;

import java.io.IOException;
import java.io.InputStream;

public final class Fixtures {
    private Fixtures() {
    }

    public static JsonNode json(String name) {
        try (InputStream in = Fixtures.class.getResourceAsStream("/fixtures/" + name)) {
            if (in == null) {
                throw new IllegalArgumentException("Fixture not found: " + name);
            }
            return JsonUtils.objectMapper().readTree(in);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to read fixture " + name, e);
        }
    }

    public static WeatherPayload austinWeather() {
        return new WeatherPayload(json("owm-current.json"), json("owm-forecast.json"));
    }
}
