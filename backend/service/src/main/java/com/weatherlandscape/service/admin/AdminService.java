package com.weatherlandscape.service.admin;

import com.weatherlandscape.core.format.FormatId;
import com.weatherlandscape.core.message.FetchJob;
import com.weatherlandscape.core.util.Zips;
import com.weatherlandscape.pipeline.scheduler.ZipScheduler;
import com.weatherlandscape.pipeline.store.PipelineStore;

import java.time.Clock;
import java.util.List;
import java.util.logging.Logger;

public class AdminService {
    private static final Logger LOGGER = Logger.getLogger(AdminService.class.getName());

    private final PipelineStore store;
    private final ZipScheduler scheduler;
    private final Clock clock;

    public AdminService(PipelineStore store, ZipScheduler scheduler, Clock clock) {
        this.store = store;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    public List<String> activeZips() {
        return store.currentActiveZips();
    }

    public List<String> activateZip(String zip) {
        List<String> zips = store.activateZip(zip);
        LOGGER.info("Activated ZIP " + zip.trim() + "; active: " + zips);
        return zips;
    }

    public List<String> deactivateZip(String zip) {
        String normalized = Zips.normalize(zip);
        List<String> zips = store.deactivateZip(normalized);
        LOGGER.info("Deactivated ZIP " + normalized + "; active: " + zips);
        return zips;
    }

    public List<String> formats(String zip) {
        return ids(store.formatsFor(Zips.normalize(zip)));
    }

    public List<String> addFormat(String zip, String format) {
        List<String> formats = ids(store.addFormat(zip, FormatId.require(format)));
        LOGGER.info("Formats for " + zip + ": " + formats);
        return formats;
    }

    public List<String> removeFormat(String zip, String format) {
        List<String> formats = ids(store.removeFormat(zip, FormatId.require(format)));
        LOGGER.info("Formats for " + zip + ": " + formats);
        return formats;
    }

    public FetchJob generateNow(String zip) {
        return scheduler.enqueue(Zips.normalize(zip), clock.instant());
    }

    private static List<String> ids(List<FormatId> formats) {
        return formats.stream().map(FormatId::id).toList();
    }
}
