package work.cellium.kernel.cell;

import java.util.Map;

/**
 * Receives events published on the bus.
 */
@FunctionalInterface
public interface EventHandler {
    void onEvent(String eventName, Map<String, Object> payload) throws Exception;
}
