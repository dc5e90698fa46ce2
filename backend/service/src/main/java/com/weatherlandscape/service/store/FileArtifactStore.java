package com.weatherlandscape.service.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.weatherlandscape.core.util.JsonUtils;
import com.weatherlandscape.pipeline.api.ArtifactStore;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Stream;

public class FileArtifactStore implements ArtifactStore {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();
    private static final String SIDECAR = ".meta.json";

    private final Path root;
    private final ReentrantLock lock = new ReentrantLock();

    public FileArtifactStore(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    @Override
    public void put(String key, byte[] bytes, String contentType, Map<String, String> metadata) {
        Path blob = resolve(key);
        lock.lock();
        try {
            Files.createDirectories(blob.getParent());
            Path tmpMeta = blob.resolveSibling(blob.getFileName() + SIDECAR + ".tmp");
            MAPPER.writeValue(tmpMeta.toFile(), new Sidecar(contentType, metadata));
            Path tmpBlob = blob.resolveSibling(blob.getFileName() + ".tmp");
            Files.write(tmpBlob, bytes);
            Files.move(tmpBlob, blob, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            Files.move(tmpMeta, sidecarFor(blob), StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new IllegalStateException("Failed writing artifact " + key, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<StoredArtifact> get(String key) {
        Path blob = resolve(key);
        lock.lock();
        try {
            byte[] bytes = Files.readAllBytes(blob);
            Sidecar sidecar;
            try (InputStream in = Files.newInputStream(sidecarFor(blob))) {
                sidecar = MAPPER.readValue(in, Sidecar.class);
            } catch (NoSuchFileException e) {
                sidecar = new Sidecar("application/octet-stream", Map.of());
            }
            Map<String, String> metadata = sidecar.metadata() == null ? Map.of() : sidecar.metadata();
            return Optional.of(new StoredArtifact(key, bytes, sidecar.contentType(), metadata));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new IllegalStateException("Failed reading artifact " + key, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<String> list() {
        if (!Files.isDirectory(root)) {
            return List.of();
        }
        try (Stream<Path> files = Files.walk(root)) {
            return files.filter(Files::isRegularFile)
                    .map(path -> root.relativize(path).toString().replace('\\', '/'))
                    .filter(key -> !key.endsWith(SIDECAR) && !key.endsWith(".tmp"))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new IllegalStateException("Failed listing artifacts under " + root, e);
        }
    }

    private Path resolve(String key) {
        if (key == null || key.isBlank() || key.startsWith("/")) {
            throw new IllegalArgumentException("Invalid artifact key: " + key);
        }
        Path resolved = root.resolve(key).normalize();
        if (!resolved.startsWith(root) || resolved.equals(root)) {
            throw new IllegalArgumentException("Artifact key escapes store root: " + key);
        }
        return resolved;
    }

    private static Path sidecarFor(Path blob) {
        return blob.resolveSibling(blob.getFileName() + SIDECAR);
    }

    private record Sidecar(String contentType, Map<String, String> metadata) {
    }
}
