package com.weatherlandscape.pipeline.support;

import com.weatherlandscape.pipeline.api.MessageQueue;
import com.weatherlandscape.pipeline.api.QueueMessage;

import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

public class InMemoryMessageQueue<T> implements MessageQueue<T> {
    private final String name;
    private final Deque<Pending<T>> ready = new ConcurrentLinkedDeque<>();
    private final List<T> sent = new CopyOnWriteArrayList<>();
    private final List<String> acked = new CopyOnWriteArrayList<>();
    private final List<String> retried = new CopyOnWriteArrayList<>();
    private final AtomicInteger failNextSends = new AtomicInteger();
    private volatile Predicate<T> sendFailure = body -> false;
    private volatile String retryFailure;

    public InMemoryMessageQueue(String name) {
        this.name = name;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public void send(T message) {
        if (failNextSends.getAndUpdate(n -> Math.max(0, n - 1)) > 0 || sendFailure.test(message)) {
            throw new IllegalStateException("Queue " + name + " unavailable");
        }
        sent.add(message);
        ready.addLast(new Pending<>(UUID.randomUUID().toString(), message, 0));
    }

    @Override
    public List<QueueMessage<T>> receive(int maxMessages) {
        List<QueueMessage<T>> batch = new ArrayList<>();
        while (batch.size() < maxMessages) {
            Pending<T> next = ready.pollFirst();
            if (next == null) {
                break;
            }
            batch.add(new Delivery(next));
        }
        return batch;
    }

    public void failNextSends(int count) {
        failNextSends.set(count);
    }

    public void failSendsWhen(Predicate<T> predicate) {
        sendFailure = predicate;
    }

    public void failRetries(String reason) {
        retryFailure = reason;
    }

    public List<T> sent() {
        return List.copyOf(sent);
    }

    public int ackedCount() {
        return acked.size();
    }

    public int retriedCount() {
        return retried.size();
    }

    public int pendingCount() {
        return ready.size();
    }

    public List<QueueMessage<T>> drain() {
        return receive(Integer.MAX_VALUE);
    }

    private record Pending<T>(String id, T body, int deliveries) {
    }

    private final class Delivery implements QueueMessage<T> {
        private final Pending<T> pending;

        private Delivery(Pending<T> pending) {
            this.pending = pending;
        }

        @Override
        public String id() {
            return pending.id();
        }

        @Override
        public T body() {
            return pending.body();
        }

        @Override
        public int attempts() {
            return pending.deliveries() + 1;
        }

        @Override
        public void ack() {
            acked.add(pending.id());
        }

        @Override
        public void retry() {
            if (retryFailure != null) {
                throw new IllegalStateException(retryFailure);
            }
            retried.add(pending.id());
            ready.addLast(new Pending<>(pending.id(), pending.body(), pending.deliveries() + 1));
        }
    }
}
