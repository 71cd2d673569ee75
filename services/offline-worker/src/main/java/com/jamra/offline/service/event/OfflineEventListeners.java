package com.jamra.offline.service.event;

import com.jamra.offline.service.LoggerService;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Subscriber list shared by the event-emitting services. A throwing subscriber is logged and
 * does not stop delivery to the others.
 */
public class OfflineEventListeners {

    private final List<Consumer<OfflineEvent>> listeners = new CopyOnWriteArrayList<>();
    private final LoggerService logger;
    private final String tag;

    public OfflineEventListeners(LoggerService logger, String tag) {
        this.logger = logger;
        this.tag = tag;
    }

    /** @return a handle that removes the listener again */
    public Runnable subscribe(Consumer<OfflineEvent> listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    public void emit(OfflineEvent event) {
        for (Consumer<OfflineEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                logger.error(tag, "❌ Event listener failed for " + event.getType().getValue() + ": " + e.getMessage(), e);
            }
        }
    }

    public int size() {
        return listeners.size();
    }
}
