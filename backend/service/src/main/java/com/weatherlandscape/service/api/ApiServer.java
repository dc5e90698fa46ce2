package com.weatherlandscape.service.api;

import com.weatherlandscape.core.format.FormatHints;
import com.weatherlandscape.core.format.FormatId;
import com.weatherlandscape.core.message.FetchJob;
import com.weatherlandscape.core.model.ArtifactMetadata;
import com.weatherlandscape.core.model.StatusRecord;
import com.weatherlandscape.core.util.JsonUtils;
import com.weatherlandscape.core.util.Zips;
import com.weatherlandscape.pipeline.api.ArtifactStore;
import com.weatherlandscape.pipeline.dispatch.JobDispatcher;
import com.weatherlandscape.pipeline.fetch.WeatherFetcher;
import com.weatherlandscape.pipeline.generate.LandscapeGenerator;
import com.weatherlandscape.pipeline.scheduler.ZipScheduler;
import com.weatherlandscape.pipeline.store.PipelineStore;
import com.weatherlandscape.service.admin.AdminService;
import com.weatherlandscape.service.store.EventCodec;
import com.weatherlandscape.service.store.EventStore;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

public class ApiServer {
    private static final Logger LOGGER = Logger.getLogger(ApiServer.class.getName());
    private static final String CACHE_CONTROL = "public, max-age=900";
    private static final List<String> STAGES = List.of(
            ZipScheduler.NAME,
            WeatherFetcher.NAME,
            JobDispatcher.NAME,
            LandscapeGenerator.NAME
    );

    private final int port;
    private final PipelineStore store;
    private final ArtifactStore artifacts;
    private final EventStore eventStore;
    private final AdminService admin;
    private final DiagnosticsTracker diagnosticsTracker;
    private final Clock clock;

    private HttpServer server;
    private ExecutorService executor;

    public ApiServer(
            int port,
            PipelineStore store,
            ArtifactStore artifacts,
            EventStore eventStore,
            AdminService admin,
            DiagnosticsTracker diagnosticsTracker,
            Clock clock
    ) {
        this.port = port;
        this.store = store;
        this.artifacts = artifacts;
        this.eventStore = eventStore;
        this.admin = admin;
        this.diagnosticsTracker = diagnosticsTracker == null ? DiagnosticsTracker.empty() : diagnosticsTracker;
        this.clock = clock;
    }

    public void start() {
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
            executor = Executors.newFixedThreadPool(8);
            server.setExecutor(executor);
            server.createContext("/api/health", guarded(this::handleHealth));
            server.createContext("/api/status", guarded(this::handleStatus));
            server.createContext("/api/metrics", guarded(this::handleMetrics));
            server.createContext("/api/zips", guarded(this::handleZips));
            server.createContext("/api/events", guarded(this::handleEvents));
            server.createContext("/admin", guarded(this::handleAdmin));
            server.createContext("/", guarded(this::handleRoot));
            server.start();
            LOGGER.info("API server listening on port " + actualPort());
        } catch (IOException e) {
            throw new IllegalStateException("Failed starting API server", e);
        }
    }

    public void stop() {
        if (server != null) {
            server.stop(0);
        }
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    public int actualPort() {
        if (server == null) {
            return port;
        }
        return server.getAddress().getPort();
    }

    private void handleHealth(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "GET")) {
            return;
        }
        writeJson(exchange, 200, Map.of("status", "ok"));
    }

    private void handleStatus(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "GET")) {
            return;
        }
        writeJson(exchange, 200, statusSnapshot());
    }

    private void handleMetrics(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "GET")) {
            return;
        }
        writeJson(exchange, 200, diagnosticsTracker.metricsSnapshot());
    }

    private void handleZips(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "GET")) {
            return;
        }
        List<Map<String, Object>> zips = new ArrayList<>();
        ArtifactIndex.byZip(artifacts.list()).forEach((zip, formats) -> {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("zip", zip);
            entry.put("formats", formats.stream().map(FormatId::id).toList());
            entry.put("url", "/" + zip);
            zips.add(entry);
        });
        writeJson(exchange, 200, Map.of("zips", zips));
    }

    private void handleEvents(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "GET")) {
            return;
        }
        Instant since;
        Optional<String> type;
        int limit;
        try {
            Map<String, String> query = queryParams(exchange.getRequestURI());
            since = query.containsKey("since") ? Instant.parse(query.get("since")) : Instant.EPOCH;
            type = Optional.ofNullable(query.get("type")).filter(value -> !value.isBlank());
            limit = query.containsKey("limit") ? Integer.parseInt(query.get("limit")) : 200;
        } catch (RuntimeException invalidParamError) {
            writeJson(exchange, 400, Map.of("error", "invalid_query_params"));
            return;
        }
        List<EventCodec.StoredEvent> events = eventStore.query(new EventStore.EventQuery(since, type, Math.max(1, limit)))
                .stream()
                .map(EventCodec::envelope)
                .toList();
        writeJson(exchange, 200, events);
    }

    private void handleAdmin(HttpExchange exchange) throws IOException {
        String path = exchange.getRequestURI().getPath();
        Map<String, String> query = queryParams(exchange.getRequestURI());
        String method = exchange.getRequestMethod().toUpperCase();
        switch (path) {
            case "/admin/status" -> {
                if (ensureMethod(exchange, "GET")) {
                    writeJson(exchange, 200, statusSnapshot());
                }
            }
            case "/admin/formats" -> {
                if (ensureMethod(exchange, "GET")) {
                    String zip = requireParam(query, "zip");
                    writeJson(exchange, 200, Map.of("zip", zip, "formats", admin.formats(zip)));
                }
            }
            case "/admin/activate" -> {
                if (ensureMethod(exchange, "POST")) {
                    String zip = requireParam(query, "zip");
                    List<String> active = admin.activateZip(zip);
                    writeJson(exchange, 200, result(zip, "ZIP " + zip + " added to active regeneration list",
                            "activeZips", active));
                }
            }
            case "/admin/deactivate" -> {
                if (ensureMethod(exchange, "POST")) {
                    String zip = requireParam(query, "zip");
                    List<String> active = admin.deactivateZip(zip);
                    writeJson(exchange, 200, result(zip, "ZIP " + zip + " removed from active regeneration list",
                            "activeZips", active));
                }
            }
            case "/admin/formats/add" -> {
                if (ensureMethod(exchange, "POST")) {
                    String zip = requireParam(query, "zip");
                    String format = requireParam(query, "format");
                    List<String> formats = admin.addFormat(zip, format);
                    writeJson(exchange, 200, result(zip, "Format " + format + " enabled for ZIP " + zip,
                            "formats", formats));
                }
            }
            case "/admin/formats/remove" -> {
                if (ensureMethod(exchange, "POST")) {
                    String zip = requireParam(query, "zip");
                    String format = requireParam(query, "format");
                    List<String> formats = admin.removeFormat(zip, format);
                    writeJson(exchange, 200, result(zip, "Format " + format + " disabled for ZIP " + zip,
                            "formats", formats));
                }
            }
            case "/admin/generate" -> {
                if (ensureMethod(exchange, "POST")) {
                    FetchJob job = admin.generateNow(requireParam(query, "zip"));
                    writeJson(exchange, 202, result(job.zip(), "Generation queued for ZIP " + job.zip(),
                            "traceId", job.trace().traceId()));
                }
            }
            default -> {
                LOGGER.fine("No admin route for " + method + " " + path);
                writeJson(exchange, 404, Map.of("error", "Not found"));
            }
        }
    }

    private void handleRoot(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "GET")) {
            return;
        }
        List<String> segments = Arrays.stream(exchange.getRequestURI().getPath().split("/"))
                .filter(segment -> !segment.isEmpty())
                .toList();
        if (segments.isEmpty()) {
            Map<String, Object> index = new LinkedHashMap<>();
            index.put("service", "weather-landscape");
            Map<String, String> formats = new LinkedHashMap<>();
            for (FormatId format : FormatId.values()) {
                formats.put(format.id(), format.title());
            }
            index.put("formats", formats);
            index.put("defaultFormat", FormatId.DEFAULT.id());
            index.put("zips", ArtifactIndex.byZip(artifacts.list()).keySet());
            writeJson(exchange, 200, index);
            return;
        }
        String zip = segments.get(0);
        if (!Zips.isValid(zip)) {
            writeJson(exchange, 404, Map.of("error", "Not found"));
            return;
        }
        serveArtifact(exchange, zip, segments, queryParams(exchange.getRequestURI()));
    }

    private void serveArtifact(HttpExchange exchange, String zip, List<String> segments, Map<String, String> query)
            throws IOException {
        FormatId requested = FormatHints.parseFormatHint(segments, query).orElse(FormatId.DEFAULT);
        FormatId served = requested;
        Optional<ArtifactStore.StoredArtifact> artifact = artifacts.get(requested.artifactKey(zip));
        if (artifact.isEmpty() && requested != FormatId.DEFAULT) {
            served = FormatId.DEFAULT;
            artifact = artifacts.get(served.artifactKey(zip));
        }
        if (artifact.isEmpty()) {
            writeJson(exchange, 404, Map.of("error", "Image not found. Waiting for first generation."));
            return;
        }

        ArtifactStore.StoredArtifact stored = artifact.get();
        exchange.getResponseHeaders().set("Content-Type", served.mimeType());
        exchange.getResponseHeaders().set("Cache-Control", CACHE_CONTROL);
        exchange.getResponseHeaders().set("X-Generated-At", stored.metadata().getOrDefault("generated-at", "unknown"));
        exchange.getResponseHeaders().set("X-Zip-Code", zip);
        exchange.getResponseHeaders().set("X-Format", served.id());
        exchange.getResponseHeaders().set("X-Variant", stored.metadata().getOrDefault("variant", "unknown"));
        exchange.sendResponseHeaders(200, stored.bytes().length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(stored.bytes());
        }
    }

    private Map<String, Object> statusSnapshot() {
        List<String> activeZips = store.currentActiveZips();
        Map<String, StatusRecord> stages = new TreeMap<>();
        for (String stage : STAGES) {
            store.status(stage).ifPresent(status -> stages.put(stage, status));
        }
        Map<String, Map<String, ArtifactMetadata>> metadata = new TreeMap<>();
        for (String zip : activeZips) {
            Map<String, ArtifactMetadata> byFormat = new LinkedHashMap<>();
            for (FormatId format : store.formatsFor(zip)) {
                store.artifactMetadata(zip, format).ifPresent(meta -> byFormat.put(format.id(), meta));
            }
            metadata.put(zip, byFormat);
        }
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("serverTime", clock.instant().toString());
        snapshot.put("activeZips", activeZips);
        snapshot.put("stages", stages);
        snapshot.put("artifacts", metadata);
        return snapshot;
    }

    private static Map<String, Object> result(String zip, String message, String key, Object value) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("zip", zip);
        body.put("message", message);
        body.put(key, value);
        return body;
    }

    private static String requireParam(Map<String, String> query, String name) {
        String value = query.get(name);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing required query parameter '" + name + "'");
        }
        return value.trim();
    }

    private HttpHandler guarded(HttpHandler handler) {
        return exchange -> {
            try {
                handler.handle(exchange);
            } catch (IllegalArgumentException e) {
                writeJson(exchange, 400, Map.of("error", errorMessage(e)));
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, "Request failed: " + exchange.getRequestMethod() + " "
                        + exchange.getRequestURI(), e);
                writeJson(exchange, 500, Map.of("error", "Internal error: " + errorMessage(e)));
            } finally {
                exchange.close();
            }
        };
    }

    static String errorMessage(RuntimeException e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }

    private boolean ensureMethod(HttpExchange exchange, String allowed) throws IOException {
        if ("OPTIONS".equalsIgnoreCase(exchange.getRequestMethod())) {
            exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
            exchange.getResponseHeaders().set("Access-Control-Allow-Methods", allowed + ",OPTIONS");
            exchange.getResponseHeaders().set("Access-Control-Allow-Headers", "Content-Type");
            exchange.sendResponseHeaders(204, -1);
            return false;
        }
        if (!allowed.equalsIgnoreCase(exchange.getRequestMethod())) {
            exchange.getResponseHeaders().set("Allow", allowed);
            exchange.sendResponseHeaders(405, -1);
            return false;
        }
        return true;
    }

    private void writeJson(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] payload = JsonUtils.objectMapper().writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
        exchange.sendResponseHeaders(status, payload.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(payload);
        }
    }

    private Map<String, String> queryParams(URI uri) {
        Map<String, String> query = new LinkedHashMap<>();
        String raw = uri.getRawQuery();
        if (raw == null || raw.isBlank()) {
            return query;
        }
        for (String entry : raw.split("&")) {
            if (entry.isEmpty()) {
                continue;
            }
            String[] pair = entry.split("=", 2);
            String key = URLDecoder.decode(pair[0], StandardCharsets.UTF_8);
            String value = pair.length > 1 ? URLDecoder.decode(pair[1], StandardCharsets.UTF_8) : "";
            query.put(key, value);
        }
        return query;
    }
}
