package work.cellium.kernel.bus;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.cellium.kernel.cell.EventHandler;

/**
 * In-process publish/subscribe channel shared by all cells.
 *
 * <p>Delivery is synchronous: {@link #publish} runs every handler subscribed to the event on the
 * caller's thread, in subscription order, against a snapshot of the subscriber list taken when
 * delivery starts. A handler added during delivery may miss that publish; a handler cancelled
 * before it is reached is skipped. Each handler runs in isolation, so one failure never prevents
 * the others from running.
 */
public final class EventBus implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(EventBus.class);
    static final String ANONYMOUS = "anonymous";

    private final Map<String, CopyOnWriteArrayList<Subscription>> subscribers = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private volatile boolean closed;

    public Subscription subscribe(String eventName, EventHandler handler) {
        return subscribe(eventName, ANONYMOUS, handler);
    }

    public Subscription subscribe(String eventName, String subscriberId, EventHandler handler) {
        requireEventName(eventName);
        Objects.requireNonNull(subscriberId, "subscriberId");
        Objects.requireNonNull(handler, "handler");
        if (closed) {
            throw new IllegalStateException("Event bus is closed");
        }
        var subscription = new Subscription(this, sequence.incrementAndGet(), eventName, subscriberId, handler);
        subscribers.compute(eventName, (key, list) -> {
            var target = list == null ? new CopyOnWriteArrayList<Subscription>() : list;
            target.add(subscription);
            return target;
        });
        log.debug("Subscribed {} to '{}'", subscriberId, eventName);
        return subscription;
    }

    public void unsubscribe(Subscription subscription) {
        if (subscription == null || !subscription.deactivate()) {
            return;
        }
        subscribers.computeIfPresent(subscription.eventName(), (key, list) -> {
            list.remove(subscription);
            return list.isEmpty() ? null : list;
        });
        log.debug("Unsubscribed {} from '{}'", subscription.subscriberId(), subscription.eventName());
    }

    /**
     * Cancels every subscription registered under {@code subscriberId}.
     *
     * @return the number of subscriptions removed
     */
    public int unsubscribeAll(String subscriberId) {
        int removed = 0;
        for (var list : subscribers.values()) {
            for (var subscription : list) {
                if (subscription.subscriberId().equals(subscriberId) && subscription.isActive()) {
                    unsubscribe(subscription);
                    removed++;
                }
            }
        }
        return removed;
    }

    public DeliveryReport publish(String eventName, Map<String, Object> payload) {
        requireEventName(eventName);
        if (closed) {
            log.warn("Dropping '{}': event bus is closed", eventName);
            return DeliveryReport.none(eventName);
        }
        var targets = subscribers.get(eventName);
        if (targets == null || targets.isEmpty()) {
            log.debug("No subscribers for '{}'", eventName);
            return DeliveryReport.none(eventName);
        }
        Map<String, Object> view = payload == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        int delivered = 0;
        List<DeliveryReport.Failure> failures = new ArrayList<>();
        for (var subscription : targets) {
            if (!subscription.isActive()) {
                continue;
            }
            delivered++;
            try {
                subscription.handler().onEvent(eventName, view);
            } catch (Exception | StackOverflowError | LinkageError | AssertionError ex) {
                log.error("Handler of {} failed for event '{}'", subscription.subscriberId(), eventName, ex);
                failures.add(new DeliveryReport.Failure(subscription.subscriberId(), ex));
            }
        }
        return new DeliveryReport(eventName, delivered, failures);
    }

    public boolean hasSubscribers(String eventName) {
        return subscriberCount(eventName) > 0;
    }

    public int subscriberCount(String eventName) {
        var list = subscribers.get(eventName);
        return list == null ? 0 : list.size();
    }

    public void clear() {
        for (var list : subscribers.values()) {
            for (var subscription : list) {
                subscription.deactivate();
            }
        }
        subscribers.clear();
        log.info("Cleared all event subscriptions");
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        clear();
    }

    private static void requireEventName(String eventName) {
        if (eventName == null || eventName.isBlank()) {
            throw new IllegalArgumentException("Event name must not be blank");
        }
    }
}
