package com.climapipeline.core.bus;

import com.climapipeline.core.events.Event;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

public class EventBus {
    private static final Logger LOGGER = Logger.getLogger(EventBus.class.getName());

    // One list across all types so a catch-all subscriber sees events in publish order.
    private final List<Subscription<?>> subscriptions = new CopyOnWriteArrayList<>();
    private final BiConsumer<Event, Exception> onHandlerError;

    public EventBus() {
        this((event, ex) -> LOGGER.log(Level.WARNING, "Event handler failed for " + event.type(), ex));
    }

    public EventBus(BiConsumer<Event, Exception> onHandlerError) {
        this.onHandlerError = Objects.requireNonNull(onHandlerError, "onHandlerError");
    }

    public <T extends Event> void subscribe(Class<T> type, Consumer<? super T> handler) {
        subscriptions.add(new Subscription<>(
                Objects.requireNonNull(type, "type"),
                Objects.requireNonNull(handler, "handler")));
    }

    public void publish(Event event) {
        Objects.requireNonNull(event, "event");
        for (Subscription<?> subscription : subscriptions) {
            if (!subscription.type().isInstance(event)) {
                continue;
            }
            try {
                subscription.deliver(event);
            } catch (Exception ex) {
                onHandlerError.accept(event, ex);
            }
        }
    }

    private record Subscription<T extends Event>(Class<T> type, Consumer<? super T> handler) {
        void deliver(Event event) {
            handler.accept(type.cast(event));
        }
    }
}
