package com.weatherlandscape.pipeline.api;

public class MissingCredentialsException extends PipelineException {
    public MissingCredentialsException(String stage, String message) {
        super(stage, message);
    }
}
