package com.weatherlandscape.pipeline.api;

import java.util.Map;

public record StageResult(boolean success, String message, Map<String, Object> stats) {
    public static StageResult success(String message, Map<String, Object> stats) {
        return new StageResult(true, message, stats);
    }

    public static StageResult failure(String message, Map<String, Object> stats) {
        return new StageResult(false, message, stats);
    }
}
