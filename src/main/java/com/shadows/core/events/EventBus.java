package com.shadows.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub bus for scenario events.
 * <p>
 * Listeners subscribe to one scenario or to everything. A failing listener never stops delivery to the others.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<ShadowsEvent>>> scenarioSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<ShadowsEvent>> globalSubscribers = new CopyOnWriteArrayList<>();

    public void publish(ShadowsEvent event) {
        log.debug("Publishing {} for scenario {}", event.eventType(), event.scenarioId());

        if (event.scenarioId() != null) {
            List<Consumer<ShadowsEvent>> subs = scenarioSubscribers.get(event.scenarioId());
            if (subs != null) {
                for (Consumer<ShadowsEvent> subscriber : subs) {
                    deliverSafely(subscriber, event);
                }
            }
        }
        for (Consumer<ShadowsEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    public Subscription subscribe(String scenarioId, Consumer<ShadowsEvent> consumer) {
        scenarioSubscribers.computeIfAbsent(scenarioId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        return () -> {
            CopyOnWriteArrayList<Consumer<ShadowsEvent>> subs = scenarioSubscribers.get(scenarioId);
            if (subs != null) {
                subs.remove(consumer);
            }
        };
    }

    public Subscription subscribeAll(Consumer<ShadowsEvent> consumer) {
        globalSubscribers.add(consumer);
        return () -> globalSubscribers.remove(consumer);
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<ShadowsEvent> subscriber, ShadowsEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Listener failed on {}: {}", event.eventType(), e.getMessage(), e);
        }
    }
}
