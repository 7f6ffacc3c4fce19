package work.cellium.kernel.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import work.cellium.kernel.cell.Cell;
import work.cellium.kernel.cell.CommandHandler;
import work.cellium.kernel.error.CellNotFoundException;
import work.cellium.kernel.error.CommandNotFoundException;
import work.cellium.kernel.error.DuplicateCellException;

/**
 * Stores loaded cells by name together with a snapshot of their command tables.
 *
 * <p>Written once while the kernel loads, then read concurrently by the router.
 */
public final class Registry {
    private final Map<String, Entry> cells = new ConcurrentHashMap<>();
    private final List<String> order = new CopyOnWriteArrayList<>();

    public Registry register(Cell cell) {
        return register(cell.name(), cell);
    }

    public Registry register(String name, Cell cell) {
        Objects.requireNonNull(cell, "cell");
        if (name == null || name.isBlank() || name.indexOf(':') >= 0) {
            throw new IllegalArgumentException("Invalid cell name: '" + name + "'");
        }
        var entry = new Entry(name, cell, snapshot(cell.commands()), snapshot(cell.commandDescriptions()));
        if (cells.putIfAbsent(name, entry) != null) {
            throw new DuplicateCellException(name);
        }
        order.add(name);
        return this;
    }

    public Cell resolve(String name) {
        return entry(name).cell();
    }

    public Entry entry(String name) {
        var entry = name == null ? null : cells.get(name);
        if (entry == null) {
            throw new CellNotFoundException(name);
        }
        return entry;
    }

    public CommandHandler command(String cellName, String command) {
        var handler = entry(cellName).commands().get(command);
        if (handler == null) {
            throw new CommandNotFoundException(cellName, command);
        }
        return handler;
    }

    public Optional<Cell> find(String name) {
        return Optional.ofNullable(name == null ? null : cells.get(name)).map(Entry::cell);
    }

    public <T extends Cell> Optional<T> findByType(Class<T> type) {
        for (String name : order) {
            var entry = cells.get(name);
            if (entry != null && type.isInstance(entry.cell())) {
                return Optional.of(type.cast(entry.cell()));
            }
        }
        return Optional.empty();
    }

    public boolean contains(String name) {
        return name != null && cells.containsKey(name);
    }

    /**
     * Cell names in registration order.
     */
    public List<String> names() {
        return List.copyOf(order);
    }

    Entry remove(String name) {
        var removed = cells.remove(name);
        if (removed != null) {
            order.remove(name);
        }
        return removed;
    }

    private static <V> Map<String, V> snapshot(Map<String, V> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    public record Entry(String name, Cell cell, Map<String, CommandHandler> commands, Map<String, String> descriptions) {}
}
