package com.weatherlandscape.service;

import com.weatherlandscape.service.config.PipelineSettings;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class MainTest {
    @Test
    void missingConfigFileFallsBackToDefaults() throws Exception {
        Path configDir = Files.createTempDirectory("main-config-");

        PipelineSettings settings = Main.resolveSettings(configDir, Map.of());

        assertEquals(PipelineSettings.defaults(), settings);
    }

    @Test
    void dataDirEnvironmentOverridesFile() throws Exception {
        Path configDir = Files.createTempDirectory("main-config-");
        Files.writeString(configDir.resolve("pipeline.json"), """
                {"schedulerInterval": "PT10M", "weatherTtl": "PT15M", "dataDir": "from-file"}
                """);

        PipelineSettings settings = Main.resolveSettings(configDir, Map.of("WL_DATA_DIR", "/var/lib/landscape"));

        assertEquals("/var/lib/landscape", settings.dataDir());
        assertEquals(Duration.ofMinutes(10), settings.schedulerInterval());
    }

    @Test
    void blankOverrideIsIgnored() throws Exception {
        Path configDir = Files.createTempDirectory("main-config-");

        assertEquals("data", Main.resolveSettings(configDir, Map.of("WL_DATA_DIR", " ")).dataDir());
    }
}
