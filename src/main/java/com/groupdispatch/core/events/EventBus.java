package com.groupdispatch.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub for dispatch events.
 * <p>
 * A subscription either follows one conversation or, when registered through
 * {@link #subscribeAll}, every event including engine-level ones that carry no
 * conversation id. Delivery happens on the publishing thread; a subscriber that throws
 * is logged and skipped.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /** Null conversation id means every event. */
    private record Registration(String conversationId, Consumer<DispatchEvent> consumer) {

        boolean accepts(DispatchEvent event) {
            return conversationId == null || conversationId.equals(event.conversationId());
        }
    }

    private final CopyOnWriteArrayList<Registration> registrations = new CopyOnWriteArrayList<>();

    public void publish(DispatchEvent event) {
        log.debug("Publishing {} for conversation {}", event.eventType(), event.conversationId());
        for (Registration registration : registrations) {
            if (registration.accepts(event)) {
                deliver(registration, event);
            }
        }
    }

    /**
     * Subscribe to the events of one conversation.
     *
     * @return a handle that removes this subscription
     */
    public Subscription subscribe(String conversationId, Consumer<DispatchEvent> consumer) {
        if (conversationId == null) {
            throw new IllegalArgumentException("conversationId is required; use subscribeAll for every event");
        }
        log.debug("Subscribed to conversation {}", conversationId);
        return register(new Registration(conversationId, consumer));
    }

    /**
     * Subscribe to every event.
     */
    public Subscription subscribeAll(Consumer<DispatchEvent> consumer) {
        log.debug("Subscribed to all events");
        return register(new Registration(null, consumer));
    }

    private Subscription register(Registration registration) {
        registrations.add(registration);
        return () -> registrations.remove(registration);
    }

    private void deliver(Registration registration, DispatchEvent event) {
        try {
            registration.consumer().accept(event);
        } catch (Exception e) {
            log.warn("Subscriber of {} failed on {}: {}",
                    registration.conversationId() == null ? "all events" : registration.conversationId(),
                    event.eventType(), e.getMessage(), e);
        }
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }
}
