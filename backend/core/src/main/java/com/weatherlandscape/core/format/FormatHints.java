package com.weatherlandscape.core.format;

import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class FormatHints {
    private FormatHints() {
    }

    public static Optional<FormatId> parseFormatHint(List<String> pathSegments, Map<String, String> query) {
        Optional<FormatId> hint = Optional.empty();
        for (String key : query.keySet()) {
            Optional<FormatId> candidate = FormatId.fromId(key);
            if (candidate.isPresent()) {
                hint = candidate;
                break;
            }
        }
        for (String segment : pathSegments) {
            if (segment == null || segment.isBlank() || segment.chars().allMatch(Character::isDigit)) {
                continue;
            }
            Optional<FormatId> candidate = FormatId.fromId(stripExtension(segment));
            if (candidate.isPresent()) {
                return candidate;
            }
        }
        return hint;
    }

    private static String stripExtension(String segment) {
        for (ImageEncoding encoding : ImageEncoding.values()) {
            if (segment.endsWith(encoding.extension())) {
                return segment.substring(0, segment.length() - encoding.extension().length());
            }
        }
        return segment;
    }
}
