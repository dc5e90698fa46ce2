package com.weatherlandscape.service.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.weatherlandscape.core.model.GeocodeEntry;
import com.weatherlandscape.core.util.JsonUtils;
import com.weatherlandscape.core.util.Zips;
import com.weatherlandscape.pipeline.api.MissingCredentialsException;
import com.weatherlandscape.pipeline.api.ProviderException;
import com.weatherlandscape.pipeline.api.WeatherProvider;
import com.weatherlandscape.pipeline.fetch.WeatherFetcher;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.logging.Logger;

public final class OpenWeatherMapClient implements WeatherProvider {
    private static final Logger LOGGER = Logger.getLogger(OpenWeatherMapClient.class.getName());

    private final HttpClient httpClient;
    private final String baseUrl;
    private final String apiKey;
    private final Duration timeout;
    private final Clock clock;

    public OpenWeatherMapClient(HttpClient httpClient, String baseUrl, String apiKey, Duration timeout, Clock clock) {
        this.httpClient = httpClient;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.apiKey = apiKey == null ? "" : apiKey.trim();
        this.timeout = timeout;
        this.clock = clock;
    }

    @Override
    public void requireCredentials() {
        if (apiKey.isEmpty()) {
            throw new MissingCredentialsException(WeatherFetcher.NAME, "OWM_API_KEY is not configured");
        }
    }

    @Override
    public GeocodeEntry geocode(String zip) {
        String normalized = Zips.normalize(zip);
        URI uri = URI.create(baseUrl + "/geo/1.0/zip?zip=" + normalized + ",US&appid=" + encode(apiKey));
        JsonNode body = getJson(uri, "Geocoding");
        JsonNode lat = body.path("lat");
        JsonNode lon = body.path("lon");
        if (!lat.isNumber() || !lon.isNumber()) {
            throw new ProviderException("Geocoding response missing coordinates for ZIP " + normalized, 200);
        }
        LOGGER.info("Geocoded ZIP " + normalized + " to " + lat.asDouble() + ", " + lon.asDouble());
        return new GeocodeEntry(normalized, lat.asDouble(), lon.asDouble(), Instant.now(clock), "openweathermap");
    }

    @Override
    public JsonNode currentWeather(double lat, double lon) {
        return getJson(weatherUri("weather", lat, lon), "Current weather");
    }

    @Override
    public JsonNode forecast(double lat, double lon) {
        return getJson(weatherUri("forecast", lat, lon), "Forecast");
    }

    URI weatherUri(String endpoint, double lat, double lon) {
        String query = String.format(Locale.ROOT, "lat=%.4f&lon=%.4f&mode=json&APPID=%s", lat, lon, encode(apiKey));
        return URI.create(baseUrl + "/data/2.5/" + endpoint + "?" + query);
    }

    private JsonNode getJson(URI uri, String label) {
        int attempts = 0;
        while (true) {
            attempts++;
            HttpRequest request = HttpRequest.newBuilder(uri)
                    .GET()
                    .timeout(timeout)
                    .header("Accept", "application/json")
                    .build();
            HttpResponse<String> response;
            try {
                response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            } catch (IOException e) {
                throw new ProviderException(label + " request failed: " + e.getMessage(), e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ProviderException(label + " request interrupted", e);
            }
            if (response.statusCode() == 200) {
                try {
                    return JsonUtils.objectMapper().readTree(response.body());
                } catch (IOException e) {
                    throw new ProviderException(label + " API returned malformed JSON", e);
                }
            }
            if (attempts >= 2 || response.statusCode() < 500) {
                throw new ProviderException(label + " API returned status " + response.statusCode(), response.statusCode());
            }
            LOGGER.warning(label + " API returned status " + response.statusCode() + ", retrying once");
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
