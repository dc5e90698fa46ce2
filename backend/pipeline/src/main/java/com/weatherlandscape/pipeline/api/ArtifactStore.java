package com.weatherlandscape.pipeline.api;

import java.util.List;
import java.util.Map;
import java.util.Optional;

public interface ArtifactStore {
    void put(String key, byte[] bytes, String contentType, Map<String, String> metadata);

    Optional<StoredArtifact> get(String key);

    List<String> list();

    record StoredArtifact(String key, byte[] bytes, String contentType, Map<String, String> metadata) {
        public StoredArtifact {
            metadata = Map.copyOf(metadata);
        }
    }
}
