package com.weatherlandscape.pipeline.api;

public interface QueueMessage<T> {
    String id();

    T body();

    // 1 on first delivery
    int attempts();

    void ack();

    void retry();
}
