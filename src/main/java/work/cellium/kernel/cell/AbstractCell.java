package work.cellium.kernel.cell;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Convenience base class: subclasses declare their commands and event handlers from the
 * constructor with {@link #command} and {@link #on}. The tables are frozen the first time they are
 * read.
 */
public abstract class AbstractCell implements Cell {
    private final String name;
    private final Map<String, CommandHandler> commands = new LinkedHashMap<>();
    private final Map<String, String> descriptions = new LinkedHashMap<>();
    private final Map<String, EventHandler> events = new LinkedHashMap<>();
    private volatile boolean frozen;

    protected AbstractCell(String name) {
        Objects.requireNonNull(name, "name");
        if (name.isBlank() || name.indexOf(':') >= 0) {
            throw new IllegalArgumentException("Invalid cell name: '" + name + "'");
        }
        this.name = name;
    }

    @Override
    public final String name() {
        return name;
    }

    protected final void command(String command, CommandHandler handler) {
        command(command, "", handler);
    }

    protected final void command(String command, String description, CommandHandler handler) {
        ensureMutable();
        Objects.requireNonNull(handler, "handler");
        if (command == null || command.isBlank() || command.indexOf(':') >= 0) {
            throw new IllegalArgumentException("Invalid command name: '" + command + "'");
        }
        if (commands.putIfAbsent(command, handler) != null) {
            throw new IllegalArgumentException("Command '" + command + "' declared twice in cell '" + name + "'");
        }
        descriptions.put(command, description == null ? "" : description);
    }

    protected final void on(String eventName, EventHandler handler) {
        ensureMutable();
        Objects.requireNonNull(handler, "handler");
        if (eventName == null || eventName.isBlank()) {
            throw new IllegalArgumentException("Event name must not be blank");
        }
        if (events.putIfAbsent(eventName, handler) != null) {
            throw new IllegalArgumentException("Event '" + eventName + "' handled twice in cell '" + name + "'");
        }
    }

    @Override
    public final Map<String, CommandHandler> commands() {
        frozen = true;
        return Collections.unmodifiableMap(commands);
    }

    @Override
    public final Map<String, String> commandDescriptions() {
        frozen = true;
        return Collections.unmodifiableMap(descriptions);
    }

    @Override
    public final Map<String, EventHandler> events() {
        frozen = true;
        return Collections.unmodifiableMap(events);
    }

    private void ensureMutable() {
        if (frozen) {
            throw new IllegalStateException("Cell '" + name + "' is already loaded; its tables are immutable");
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + name + "]";
    }
}
