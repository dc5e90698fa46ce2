package com.weatherlandscape.pipeline.api;

public class StalePipelineException extends PipelineException {
    private final String zip;

    public StalePipelineException(String stage, String zip) {
        super(stage, "Stale pipeline: no cached weather for ZIP " + zip);
        this.zip = zip;
    }

    public String zip() {
        return zip;
    }
}
