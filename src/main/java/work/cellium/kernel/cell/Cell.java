package work.cellium.kernel.cell;

import java.util.Map;

/**
 * A named backend unit exposing commands to the router and, optionally, event handlers to the bus.
 *
 * <p>Implementations loaded from configuration are constructed by the injector: they must be
 * public, concrete, and declare a single public constructor (or mark one with
 * {@link CellConstructor}). Each constructor parameter is resolved by its declared type.
 */
public interface Cell {
    String name();

    /**
     * Command table. The registry snapshots it at registration; it must not change afterwards.
     */
    Map<String, CommandHandler> commands();

    default Map<String, String> commandDescriptions() {
        return Map.of();
    }

    default Map<String, EventHandler> events() {
        return Map.of();
    }

    /**
     * Teardown hook invoked once at shutdown, after the cell's subscriptions are removed.
     */
    default void close() throws Exception {}
}
