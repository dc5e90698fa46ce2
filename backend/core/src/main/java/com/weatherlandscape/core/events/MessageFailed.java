package com.weatherlandscape.core.events;

import java.time.Instant;

public record MessageFailed(
        Instant timestamp,
        String stage,
        String zip,
        String traceId,
        String error,
        boolean retryRequested
) implements Event {
    @Override
    public String type() {
        return "MessageFailed";
    }
}
