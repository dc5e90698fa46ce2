package com.weatherlandscape.pipeline.api;

import java.util.List;

public interface StageConsumer<T> {
    String name();

    // settles every message with ack or retry, never throws for a message-level failure
    StageResult handleBatch(List<QueueMessage<T>> batch);
}
