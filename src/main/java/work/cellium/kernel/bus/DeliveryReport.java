package work.cellium.kernel.bus;

import java.util.List;

/**
 * Outcome of one {@link EventBus#publish} call. Handler failures are recorded here and logged,
 * never rethrown to the publisher.
 */
public record DeliveryReport(String eventName, int delivered, List<Failure> failures) {
    public DeliveryReport {
        failures = List.copyOf(failures);
    }

    static DeliveryReport none(String eventName) {
        return new DeliveryReport(eventName, 0, List.of());
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    public record Failure(String subscriberId, Throwable error) {}
}
