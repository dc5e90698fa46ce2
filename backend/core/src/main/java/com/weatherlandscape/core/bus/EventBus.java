package com.weatherlandscape.core.bus;

import com.weatherlandscape.core.events.Event;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

public class EventBus {
    private static final Logger LOGGER = Logger.getLogger(EventBus.class.getName());

    private final Map<Class<? extends Event>, List<Consumer<Event>>> typed = new ConcurrentHashMap<>();
    private final List<Consumer<Event>> wildcard = new CopyOnWriteArrayList<>();
    private final BiConsumer<Event, Exception> onSubscriberError;

    public EventBus() {
        this((event, ex) -> LOGGER.log(Level.WARNING, "Event subscriber failed for " + event.type(), ex));
    }

    public EventBus(BiConsumer<Event, Exception> onSubscriberError) {
        this.onSubscriberError = onSubscriberError;
    }

    public <T extends Event> void subscribe(Class<T> type, Consumer<T> handler) {
        typed.computeIfAbsent(type, ignored -> new CopyOnWriteArrayList<>())
                .add(event -> handler.accept(type.cast(event)));
    }

    public void subscribeAll(Consumer<Event> handler) {
        wildcard.add(handler);
    }

    public void publish(Event event) {
        List<Consumer<Event>> targets = new ArrayList<>(typed.getOrDefault(event.getClass(), List.of()));
        targets.addAll(wildcard);
        for (Consumer<Event> target : targets) {
            try {
                target.accept(event);
            } catch (Exception ex) {
                onSubscriberError.accept(event, ex);
            }
        }
    }
}
