package com.weatherlandscape.pipeline.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.weatherlandscape.core.format.FormatId;
import com.weatherlandscape.core.model.ArtifactMetadata;
import com.weatherlandscape.core.model.GeocodeEntry;
import com.weatherlandscape.core.model.StatusRecord;
import com.weatherlandscape.core.model.WeatherPayload;
import com.weatherlandscape.core.util.JsonUtils;
import com.weatherlandscape.core.util.Zips;
import com.weatherlandscape.pipeline.api.ConfigStore;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

public class PipelineStore {
    private static final Logger LOGGER = Logger.getLogger(PipelineStore.class.getName());
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    private final ConfigStore store;
    private final List<String> defaultZips;

    public PipelineStore(ConfigStore store, List<String> defaultZips) {
        this.store = store;
        this.defaultZips = defaultZips.stream().map(Zips::normalize).distinct().toList();
    }

    // seeds the configured defaults the first time the key is absent
    public List<String> activeZips() {
        if (store.get(PipelineKeys.ACTIVE_ZIPS).isEmpty()) {
            putActiveZips(defaultZips);
            LOGGER.info("Initialized active ZIPs with defaults " + defaultZips);
        }
        return currentActiveZips();
    }

    // read-only: reports the defaults without storing them
    public List<String> currentActiveZips() {
        Optional<String> raw = store.get(PipelineKeys.ACTIVE_ZIPS);
        if (raw.isEmpty()) {
            return defaultZips;
        }
        LinkedHashSet<String> zips = new LinkedHashSet<>();
        for (String zip : readList(raw.get(), PipelineKeys.ACTIVE_ZIPS)) {
            if (Zips.isValid(zip)) {
                zips.add(zip);
            } else {
                LOGGER.warning("Ignoring invalid active ZIP '" + zip + "'");
            }
        }
        return List.copyOf(zips);
    }

    public List<String> activateZip(String zip) {
        String normalized = Zips.normalize(zip);
        List<String> zips = new ArrayList<>(activeZips());
        if (!zips.contains(normalized)) {
            zips.add(normalized);
            putActiveZips(zips);
        }
        return List.copyOf(zips);
    }

    public List<String> deactivateZip(String zip) {
        List<String> zips = new ArrayList<>(activeZips());
        if (zips.remove(zip == null ? null : zip.trim())) {
            putActiveZips(zips);
        }
        return List.copyOf(zips);
    }

    public List<FormatId> formatsFor(String zip) {
        Optional<String> raw = store.get(PipelineKeys.formats(zip));
        if (raw.isEmpty()) {
            return List.of(FormatId.DEFAULT);
        }
        LinkedHashSet<FormatId> formats = new LinkedHashSet<>();
        formats.add(FormatId.DEFAULT);
        for (String id : readList(raw.get(), PipelineKeys.formats(zip))) {
            Optional<FormatId> format = FormatId.fromId(id);
            if (format.isPresent()) {
                formats.add(format.get());
            } else {
                LOGGER.warning("Ignoring unknown format '" + id + "' configured for ZIP " + zip);
            }
        }
        return List.copyOf(formats);
    }

    public List<FormatId> addFormat(String zip, FormatId format) {
        String normalized = Zips.normalize(zip);
        List<FormatId> formats = new ArrayList<>(formatsFor(normalized));
        if (!formats.contains(format)) {
            formats.add(format);
            putFormats(normalized, formats);
        }
        return List.copyOf(formats);
    }

    public List<FormatId> removeFormat(String zip, FormatId format) {
        if (format == FormatId.DEFAULT) {
            throw new IllegalArgumentException("Cannot remove default format " + FormatId.DEFAULT.id());
        }
        String normalized = Zips.normalize(zip);
        List<FormatId> formats = new ArrayList<>(formatsFor(normalized));
        if (formats.remove(format)) {
            putFormats(normalized, formats);
        }
        return List.copyOf(formats);
    }

    public Optional<GeocodeEntry> geocode(String zip) {
        return store.get(PipelineKeys.geocode(zip)).map(json -> JsonUtils.read(json, GeocodeEntry.class));
    }

    public void putGeocode(GeocodeEntry entry) {
        store.put(PipelineKeys.geocode(entry.zip()), JsonUtils.write(entry));
    }

    public Optional<WeatherPayload> weather(String zip) {
        return store.get(PipelineKeys.weather(zip)).map(json -> JsonUtils.read(json, WeatherPayload.class));
    }

    public void putWeather(String zip, WeatherPayload payload, Duration ttl) {
        store.put(PipelineKeys.weather(zip), JsonUtils.write(payload), ttl);
    }

    public Optional<ArtifactMetadata> artifactMetadata(String zip, FormatId format) {
        return store.get(PipelineKeys.metadata(zip, format)).map(json -> JsonUtils.read(json, ArtifactMetadata.class));
    }

    public void putArtifactMetadata(FormatId format, ArtifactMetadata metadata) {
        store.put(PipelineKeys.metadata(metadata.zip(), format), JsonUtils.write(metadata));
    }

    public Optional<StatusRecord> status(String stage) {
        return store.get(PipelineKeys.status(stage)).map(json -> JsonUtils.read(json, StatusRecord.class));
    }

    public void putStatus(StatusRecord status) {
        store.put(PipelineKeys.status(status.stage()), JsonUtils.write(status));
    }

    private void putActiveZips(List<String> zips) {
        store.put(PipelineKeys.ACTIVE_ZIPS, JsonUtils.write(zips));
    }

    private void putFormats(String zip, List<FormatId> formats) {
        store.put(PipelineKeys.formats(zip), JsonUtils.write(formats.stream().map(FormatId::id).toList()));
    }

    private static List<String> readList(String json, String key) {
        try {
            List<String> values = JsonUtils.objectMapper().readValue(json, STRING_LIST);
            return values == null ? List.of() : values;
        } catch (IOException e) {
            throw new IllegalStateException("Malformed list under key " + key, e);
        }
    }
}
