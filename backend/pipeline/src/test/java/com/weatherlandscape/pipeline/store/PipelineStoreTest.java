package com.weatherlandscape.pipeline.store;

import com.weatherlandscape.core.format.FormatId;
import com.weatherlandscape.core.model.StatusRecord;
import com.weatherlandscape.pipeline.support.PipelineHarness;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PipelineStoreTest {
    @Test
    void activeZipsSeedDefaultsOnceAndKeepInsertionOrder() {
        PipelineHarness h = new PipelineHarness();

        assertEquals(List.of("78729"), h.store.activeZips());
        assertTrue(h.configStore.get(PipelineKeys.ACTIVE_ZIPS).isPresent());

        h.store.activateZip("02108");
        h.store.activateZip("78729");
        assertEquals(List.of("78729", "02108"), h.store.activeZips());

        h.store.deactivateZip("78729");
        assertEquals(List.of("02108"), h.store.activeZips());
    }

    @Test
    void currentActiveZipsReportsDefaultsWithoutStoringThem() {
        PipelineHarness h = new PipelineHarness();

        assertEquals(List.of("78729"), h.store.currentActiveZips());
        assertTrue(h.configStore.get(PipelineKeys.ACTIVE_ZIPS).isEmpty());

        h.store.activateZip("02108");
        assertEquals(List.of("78729", "02108"), h.store.currentActiveZips());
    }

    @Test
    void deactivatingEveryZipDoesNotReseedDefaults() {
        PipelineHarness h = new PipelineHarness();
        h.store.deactivateZip("78729");

        assertEquals(List.of(), h.store.activeZips());
    }

    @Test
    void invalidStoredZipsAreSkipped() {
        PipelineHarness h = new PipelineHarness();
        h.configStore.put(PipelineKeys.ACTIVE_ZIPS, "[\"78729\",\"abc\",\"1234\",\"02108\"]");

        assertEquals(List.of("78729", "02108"), h.store.activeZips());
    }

    @Test
    void activateRejectsMalformedZip() {
        PipelineHarness h = new PipelineHarness();

        assertThrows(IllegalArgumentException.class, () -> h.store.activateZip("7872"));
    }

    @Test
    void formatsAlwaysStartWithDefaultAndIgnoreUnknownIds() {
        PipelineHarness h = new PipelineHarness();
        h.configStore.put(PipelineKeys.formats("78729"), "[\"bw\",\"sepia\",\"rgb_light\"]");

        assertEquals(List.of(FormatId.RGB_LIGHT, FormatId.BW), h.store.formatsFor("78729"));
    }

    @Test
    void addAndRemoveFormatsPersistAsIds() {
        PipelineHarness h = new PipelineHarness();

        h.store.addFormat("78729", FormatId.EINK);
        h.store.addFormat("78729", FormatId.EINK);
        assertEquals("[\"rgb_light\",\"eink\"]", h.configStore.get(PipelineKeys.formats("78729")).orElseThrow());

        h.store.removeFormat("78729", FormatId.EINK);
        assertEquals(List.of(FormatId.RGB_LIGHT), h.store.formatsFor("78729"));
        assertThrows(IllegalArgumentException.class, () -> h.store.removeFormat("78729", FormatId.RGB_LIGHT));
    }

    @Test
    void statusRecordRoundTripsThroughJson() {
        PipelineHarness h = new PipelineHarness();
        StatusRecord status = new StatusRecord("fetcher", h.clock.instant(), Map.of("messages", 2), 1, 1,
                List.of("00000: Geocoding API returned status 404"));

        h.store.putStatus(status);

        assertEquals(status, h.store.status("fetcher").orElseThrow());
        assertTrue(h.configStore.get("status:fetcher").isPresent());
    }

    @Test
    void keysFollowTheSharedNamingScheme() {
        assertEquals("geo:78729", PipelineKeys.geocode("78729"));
        assertEquals("weather:78729", PipelineKeys.weather("78729"));
        assertEquals("formats:78729", PipelineKeys.formats("78729"));
        assertEquals("metadata:78729:bw", PipelineKeys.metadata("78729", FormatId.BW));
        assertEquals("status:generator", PipelineKeys.status("generator"));
    }
}
