package com.weatherlandscape.service.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.weatherlandscape.core.events.ArtifactPublished;
import com.weatherlandscape.core.events.Event;
import com.weatherlandscape.core.events.MessageFailed;
import com.weatherlandscape.core.events.StageBatchCompleted;
import com.weatherlandscape.core.events.StageBatchStarted;
import com.weatherlandscape.core.util.JsonUtils;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

public final class EventCodec {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();
    private static final Map<String, Class<? extends Event>> TYPES = List.of(
                    StageBatchStarted.class,
                    StageBatchCompleted.class,
                    MessageFailed.class,
                    ArtifactPublished.class
            ).stream()
            .collect(Collectors.toUnmodifiableMap(Class::getSimpleName, Function.identity()));

    private EventCodec() {
    }

    public static StoredEvent envelope(Event event) {
        return new StoredEvent(event.type(), event.timestamp(), MAPPER.valueToTree(event));
    }

    public static String toJsonLine(Event event) {
        try {
            return MAPPER.writeValueAsString(envelope(event));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize " + event.type() + " event", e);
        }
    }

    public static Event fromJsonLine(String line) {
        StoredEvent stored;
        try {
            stored = MAPPER.readValue(line, StoredEvent.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to deserialize event: " + e.getOriginalMessage(), e);
        }
        if (stored.event() == null || !stored.event().isObject()) {
            throw new IllegalStateException("Unable to deserialize event: envelope has no event object");
        }
        Class<? extends Event> eventClass = TYPES.get(stored.type());
        if (eventClass == null) {
            throw new IllegalArgumentException("Unsupported event type: " + stored.type());
        }
        try {
            return MAPPER.treeToValue(stored.event(), eventClass);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to deserialize event of type " + stored.type(), e);
        }
    }

    public record StoredEvent(String type, Instant timestamp, JsonNode event) {
    }
}
