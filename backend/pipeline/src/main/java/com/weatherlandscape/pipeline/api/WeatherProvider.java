package com.weatherlandscape.pipeline.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.weatherlandscape.core.model.GeocodeEntry;

public interface WeatherProvider {
    void requireCredentials();

    GeocodeEntry geocode(String zip);

    JsonNode currentWeather(double lat, double lon);

    JsonNode forecast(double lat, double lon);
}
