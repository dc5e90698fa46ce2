package com.weatherlandscape.pipeline.api;

import java.time.Duration;
import java.util.Optional;

public interface ConfigStore {
    Optional<String> get(String key);

    void put(String key, String value);

    void put(String key, String value, Duration ttl);

    void delete(String key);
}
