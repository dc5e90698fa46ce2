package com.weatherlandscape.core.format;

import java.util.Objects;

public record RenderConfig(
        String title,
        ImageEncoding encoding,
        SpriteMode spriteMode,
        TemperatureUnit temperatureUnit,
        int background,
        int foreground,
        int soil,
        int smoke,
        int rain,
        int snow,
        boolean invert,
        boolean einkFlip
) {
    public enum SpriteMode {
        MONOCHROME,
        RGB
    }

    public enum TemperatureUnit {
        CELSIUS,
        FAHRENHEIT
    }

    public RenderConfig {
        Objects.requireNonNull(title, "title is required");
        Objects.requireNonNull(encoding, "encoding is required");
        Objects.requireNonNull(spriteMode, "spriteMode is required");
        Objects.requireNonNull(temperatureUnit, "temperatureUnit is required");
    }

    static RenderConfig monochrome(String title, boolean invert, boolean einkFlip) {
        return new RenderConfig(
                title,
                ImageEncoding.BMP,
                SpriteMode.MONOCHROME,
                TemperatureUnit.FAHRENHEIT,
                0xFFFFFF,
                0x000000,
                0x000000,
                0x000000,
                0x000000,
                0x000000,
                invert,
                einkFlip
        );
    }

    static RenderConfig rgb(String title, int background, int foreground, int rain, int snow) {
        return new RenderConfig(
                title,
                ImageEncoding.PNG,
                SpriteMode.RGB,
                TemperatureUnit.FAHRENHEIT,
                background,
                foreground,
                0x945201,
                0x7F7F7F,
                rain,
                snow,
                false,
                false
        );
    }
}
