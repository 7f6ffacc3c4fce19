package work.cellium.kernel.bus;

import java.util.concurrent.atomic.AtomicBoolean;
import work.cellium.kernel.cell.EventHandler;

/**
 * Handle returned by {@link EventBus#subscribe}. Cancelling it more than once has no further effect.
 */
public final class Subscription {
    private final EventBus bus;
    private final long id;
    private final String eventName;
    private final String subscriberId;
    private final EventHandler handler;
    private final AtomicBoolean active = new AtomicBoolean(true);

    Subscription(EventBus bus, long id, String eventName, String subscriberId, EventHandler handler) {
        this.bus = bus;
        this.id = id;
        this.eventName = eventName;
        this.subscriberId = subscriberId;
        this.handler = handler;
    }

    public long id() {
        return id;
    }

    public String eventName() {
        return eventName;
    }

    public String subscriberId() {
        return subscriberId;
    }

    public boolean isActive() {
        return active.get();
    }

    public void cancel() {
        bus.unsubscribe(this);
    }

    EventHandler handler() {
        return handler;
    }

    boolean deactivate() {
        return active.compareAndSet(true, false);
    }

    @Override
    public String toString() {
        return "Subscription[" + id + " " + eventName + " <- " + subscriberId + "]";
    }
}
