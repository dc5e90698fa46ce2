package com.weatherlandscape.pipeline.store;

import com.weatherlandscape.core.format.FormatId;

public final class PipelineKeys {
    public static final String ACTIVE_ZIPS = "active_zips";

    private PipelineKeys() {
    }

    public static String formats(String zip) {
        return "formats:" + zip;
    }

    public static String geocode(String zip) {
        return "geo:" + zip;
    }

    public static String weather(String zip) {
        return "weather:" + zip;
    }

    public static String metadata(String zip, FormatId format) {
        return "metadata:" + zip + ":" + format.id();
    }

    public static String status(String stage) {
        return "status:" + stage;
    }
}
