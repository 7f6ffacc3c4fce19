package work.cellium.kernel.runtime;

import java.util.LinkedHashMap;
import work.cellium.kernel.cell.AbstractCell;
import work.cellium.kernel.cell.ArgumentValue;

/**
 * Built-in {@code kernel} cell exposing introspection commands to the view layer.
 */
public final class KernelCell extends AbstractCell {
    public static final String NAME = "kernel";

    private final Registry registry;

    public KernelCell(Registry registry) {
        super(NAME);
        this.registry = registry;
        command("ping", "Liveness probe, replies pong", args -> "pong");
        command("cells", "Lists loaded cells in load order", args -> registry.names());
        command("commands", "Lists the commands of a cell, e.g. kernel:commands:greeter", this::commandsOf);
    }

    private Object commandsOf(ArgumentValue args) {
        var entry = registry.entry(args.asText().trim());
        var listing = new LinkedHashMap<String, String>();
        for (String command : entry.commands().keySet()) {
            listing.put(command, entry.descriptions().getOrDefault(command, ""));
        }
        return listing;
    }
}
