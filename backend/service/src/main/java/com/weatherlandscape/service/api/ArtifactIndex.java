package com.weatherlandscape.service.api;

import com.weatherlandscape.core.format.FormatId;
import com.weatherlandscape.core.util.Zips;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

final class ArtifactIndex {
    private static final Comparator<FormatId> DEFAULT_FIRST = Comparator
            .comparing((FormatId format) -> format != FormatId.DEFAULT)
            .thenComparing(FormatId::id);

    private ArtifactIndex() {
    }

    static Map<String, List<FormatId>> byZip(List<String> keys) {
        Map<String, List<FormatId>> byZip = new TreeMap<>();
        for (String key : keys) {
            parse(key).ifPresent(entry -> byZip.computeIfAbsent(entry.zip(), ignored -> new ArrayList<>())
                    .add(entry.format()));
        }
        byZip.values().forEach(formats -> formats.sort(DEFAULT_FIRST));
        return byZip;
    }

    static Optional<Entry> parse(String key) {
        int slash = key.indexOf('/');
        if (slash < 0 || key.indexOf('/', slash + 1) >= 0) {
            return Optional.empty();
        }
        String zip = key.substring(0, slash);
        String file = key.substring(slash + 1);
        int dot = file.lastIndexOf('.');
        if (!Zips.isValid(zip) || dot <= 0) {
            return Optional.empty();
        }
        return FormatId.fromId(file.substring(0, dot))
                .filter(format -> format.extension().equals(file.substring(dot)))
                .map(format -> new Entry(zip, format));
    }

    record Entry(String zip, FormatId format) {
    }
}
