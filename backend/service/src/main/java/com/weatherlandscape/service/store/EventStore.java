package com.weatherlandscape.service.store;

import com.weatherlandscape.core.events.Event;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

public interface EventStore {
    void append(Event event);

    List<Event> query(EventQuery query);

    record EventQuery(Instant since, Optional<String> type, int limit) {
        public EventQuery {
            since = since == null ? Instant.EPOCH : since;
            type = Objects.requireNonNullElse(type, Optional.<String>empty()).filter(value -> !value.isBlank());
            if (limit < 1) {
                throw new IllegalArgumentException("limit must be at least 1");
            }
        }

        public static EventQuery latest(int limit) {
            return new EventQuery(Instant.EPOCH, Optional.empty(), limit);
        }

        public boolean matches(Event event) {
            return !event.timestamp().isBefore(since) && type.map(event.type()::equals).orElse(true);
        }
    }
}
