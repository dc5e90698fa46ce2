package com.weatherlandscape.pipeline.api;

import java.util.List;

public interface MessageQueue<T> {
    String name();

    void send(T message);

    List<QueueMessage<T>> receive(int maxMessages);
}
