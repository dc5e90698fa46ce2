package com.weatherlandscape.pipeline.api;

public class ProviderException extends PipelineException {
    private final int statusCode;

    public ProviderException(String message, int statusCode) {
        super("provider", message);
        this.statusCode = statusCode;
    }

    public ProviderException(String message, Throwable cause) {
        super("provider", message, cause);
        this.statusCode = -1;
    }

    public int statusCode() {
        return statusCode;
    }
}
