package com.weatherlandscape.core.format;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

public enum FormatId {
    RGB_LIGHT("rgb_light", "RGB Light Theme",
            RenderConfig.rgb("Color, white BG", 0xFFFFFF, 0x000000, 0x0A6494, 0xC2C2C2)),
    RGB_DARK("rgb_dark", "RGB Dark Theme",
            RenderConfig.rgb("Color, black BG", 0x000000, 0xFFFFFF, 0x7AD5FF, 0xFFFFFF)),
    BW("bw", "Black & White", RenderConfig.monochrome("BW", false, false)),
    EINK("eink", "E-Ink (Flipped)", RenderConfig.monochrome("BW EINK", false, true)),
    BWI("bwi", "Black & White Inverted", RenderConfig.monochrome("BW inverted", true, false));

    public static final FormatId DEFAULT = RGB_LIGHT;

    private final String id;
    private final String title;
    private final RenderConfig renderConfig;

    FormatId(String id, String title, RenderConfig renderConfig) {
        this.id = id;
        this.title = title;
        this.renderConfig = renderConfig;
    }

    @JsonValue
    public String id() {
        return id;
    }

    public String title() {
        return title;
    }

    public RenderConfig renderConfig() {
        return renderConfig;
    }

    public String extension() {
        return renderConfig.encoding().extension();
    }

    public String mimeType() {
        return renderConfig.encoding().mimeType();
    }

    public String artifactKey(String zip) {
        return zip + "/" + id + extension();
    }

    public static Optional<FormatId> fromId(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (FormatId format : values()) {
            if (format.id.equals(normalized)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    public static FormatId require(String raw) {
        return fromId(raw).orElseThrow(() -> new IllegalArgumentException(
                "Unknown format '" + raw + "'. Available formats: " + String.join(", ", ids())));
    }

    public static List<String> ids() {
        return Arrays.stream(values()).map(FormatId::id).toList();
    }
}
