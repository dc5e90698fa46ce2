package com.weatherlandscape.core.trace;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.weatherlandscape.core.util.JsonUtils;

import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

public final class TraceLog {
    private final Logger logger;

    private TraceLog(Logger logger) {
        this.logger = logger;
    }

    public static TraceLog forClass(Class<?> type) {
        return new TraceLog(Logger.getLogger(type.getName()));
    }

    public void info(String message, TraceContext trace, Map<String, ?> fields) {
        log(Level.INFO, message, trace, fields);
    }

    public void warn(String message, TraceContext trace, Map<String, ?> fields) {
        log(Level.WARNING, message, trace, fields);
    }

    public void log(Level level, String message, TraceContext trace, Map<String, ?> fields) {
        if (!logger.isLoggable(level)) {
            return;
        }
        logger.log(level, render(message, trace, fields));
    }

    static String render(String message, TraceContext trace, Map<String, ?> fields) {
        ObjectNode node = JsonUtils.objectMapper().createObjectNode();
        node.put("message", message);
        fields.forEach((key, value) -> node.set(key, JsonUtils.objectMapper().valueToTree(value)));
        if (trace != null) {
            node.put("traceId", trace.traceId());
            node.put("spanId", trace.spanId());
            if (trace.parentSpanId() != null) {
                node.put("parentSpanId", trace.parentSpanId());
            }
        }
        return node.toString();
    }
}
