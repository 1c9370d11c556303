package com.storyline.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * In-process fan-out of orchestration events to CLI listeners.
 * <p>
 * Each listener carries a filter: one story, or every event. Delivery is synchronous on the
 * publishing thread, in subscription order. A listener that throws is logged and skipped.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final CopyOnWriteArrayList<Listener> listeners = new CopyOnWriteArrayList<>();

    public void publish(StorylineEvent event) {
        log.debug("Event {} (story {}, task {})", event.eventType(), event.storyId(), event.taskId());
        for (Listener listener : listeners) {
            if (listener.filter().test(event)) {
                deliver(listener, event);
            }
        }
    }

    /**
     * Events of one story. Cycle-level events carry no story and are not delivered.
     */
    public Subscription subscribe(String storyId, Consumer<StorylineEvent> consumer) {
        Objects.requireNonNull(storyId, "storyId must not be null");
        return register(new Listener("story " + storyId, e -> storyId.equals(e.storyId()), consumer));
    }

    public Subscription subscribeAll(Consumer<StorylineEvent> consumer) {
        return register(new Listener("all", e -> true, consumer));
    }

    private Subscription register(Listener listener) {
        listeners.add(listener);
        log.debug("Listener added for {} ({} active)", listener.scope(), listeners.size());
        return () -> {
            if (listeners.remove(listener)) {
                log.debug("Listener removed for {}", listener.scope());
            }
        };
    }

    private static void deliver(Listener listener, StorylineEvent event) {
        try {
            listener.consumer().accept(event);
        } catch (RuntimeException e) {
            log.warn("Listener for {} failed on {}: {}", listener.scope(), event.eventType(), e.getMessage(), e);
        }
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private record Listener(String scope, Predicate<StorylineEvent> filter, Consumer<StorylineEvent> consumer) {}
}
