package com.weatherlandscape.core.trace;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Objects;
import java.util.UUID;

public record TraceContext(String traceId, String spanId, String parentSpanId) {
    public TraceContext {
        Objects.requireNonNull(traceId, "traceId is required");
        Objects.requireNonNull(spanId, "spanId is required");
        if (traceId.isBlank() || spanId.isBlank()) {
            throw new IllegalArgumentException("traceId and spanId must not be blank");
        }
    }

    public static TraceContext root() {
        return new TraceContext(newTraceId(), newSpanId(), null);
    }

    public TraceContext child() {
        return new TraceContext(traceId, newSpanId(), spanId);
    }

    @JsonIgnore
    public boolean isRoot() {
        return parentSpanId == null;
    }

    static String newTraceId() {
        return UUID.randomUUID().toString().replace("-", "");
    }

    static String newSpanId() {
        return newTraceId().substring(0, 16);
    }
}
