package work.cellium.kernel.runtime;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.cellium.kernel.api.LoadPolicy;
import work.cellium.kernel.bus.EventBus;
import work.cellium.kernel.cell.Cell;
import work.cellium.kernel.error.CellLoadException;
import work.cellium.kernel.error.ErrorKind;
import work.cellium.kernel.error.KernelException;

/**
 * Loads the configured cells into the {@link Registry} and tears them down again.
 *
 * <p>Identifiers are fully-qualified class names, processed in order. Each cell is constructed by
 * the {@link Injector}, registered, and its declared event handlers are subscribed on the
 * {@link EventBus} under the cell's name. A cell required by another cell's constructor is loaded
 * first, so the effective load order is dependency-first. Under {@link LoadPolicy#STRICT} the
 * first failure tears down what was loaded and aborts with a {@link CellLoadException}; under
 * {@link LoadPolicy#LENIENT} the failed cell is logged and skipped.
 */
public final class CellLoader {
    private static final Logger log = LoggerFactory.getLogger(CellLoader.class);

    private final Registry registry;
    private final Injector injector;
    private final EventBus eventBus;
    private final LoadPolicy policy;
    private final List<Configured> configured = new ArrayList<>();
    private final Map<Class<? extends Cell>, RuntimeException> failures = new LinkedHashMap<>();
    private final List<Cell> loaded = new ArrayList<>();
    private final List<String> skipped = new ArrayList<>();

    public CellLoader(Registry registry, Injector injector, EventBus eventBus, LoadPolicy policy) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.injector = Objects.requireNonNull(injector, "injector");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus");
        this.policy = Objects.requireNonNull(policy, "policy");
        injector.setCellResolver(this::resolveDependency);
    }

    /**
     * Loads every identifier in order.
     *
     * @return names of all cells loaded so far, in load order
     */
    public synchronized List<String> load(List<String> identifiers) {
        int first = configured.size();
        for (String identifier : identifiers) {
            try {
                configured.add(new Configured(identifier, loadClass(identifier)));
            } catch (RuntimeException ex) {
                handleFailure(identifier, ex);
            }
        }
        for (var entry : List.copyOf(configured.subList(first, configured.size()))) {
            if (entry.consumed) {
                continue;
            }
            var earlier = failures.get(entry.type);
            if (earlier != null) {
                entry.consumed = true;
                handleFailure(entry.identifier, earlier);
                continue;
            }
            try {
                loadCell(entry);
            } catch (RuntimeException ex) {
                handleFailure(entry.identifier, ex);
            }
        }
        log.info("Loaded {} cell(s): {}", loaded.size(), loadedNames());
        return loadedNames();
    }

    /**
     * Registers an already constructed cell and subscribes its event handlers.
     */
    public synchronized Cell install(Cell cell) {
        Objects.requireNonNull(cell, "cell");
        registry.register(cell.name(), cell);
        loaded.add(cell);
        for (var entry : cell.events().entrySet()) {
            eventBus.subscribe(entry.getKey(), cell.name(), entry.getValue());
        }
        log.info("Loaded cell '{}' ({})", cell.name(), cell.getClass().getName());
        return cell;
    }

    /**
     * Tears cells down in reverse load order: subscriptions first, then the cell's close hook.
     */
    public synchronized void unload() {
        for (int i = loaded.size() - 1; i >= 0; i--) {
            var cell = loaded.get(i);
            int removed = eventBus.unsubscribeAll(cell.name());
            registry.remove(cell.name());
            try {
                cell.close();
                log.debug("Closed cell '{}' ({} subscription(s) removed)", cell.name(), removed);
            } catch (Exception ex) {
                log.warn("Teardown of cell '{}' failed", cell.name(), ex);
            }
        }
        loaded.clear();
    }

    public synchronized List<String> loadedNames() {
        var names = new ArrayList<String>(loaded.size());
        for (var cell : loaded) {
            names.add(cell.name());
        }
        return names;
    }

    /**
     * Identifiers skipped under the lenient policy.
     */
    public synchronized List<String> skipped() {
        return List.copyOf(skipped);
    }

    private Cell loadCell(Configured entry) {
        entry.consumed = true;
        try {
            return install(injector.construct(entry.type));
        } catch (RuntimeException ex) {
            entry.consumed = false;
            failures.putIfAbsent(entry.type, ex);
            throw ex;
        }
    }

    private Optional<Cell> resolveDependency(Class<? extends Cell> type) {
        for (var cell : loaded) {
            if (type.isInstance(cell)) {
                return Optional.of(cell);
            }
        }
        for (var candidate : configured) {
            if (!type.isAssignableFrom(candidate.type) || failures.containsKey(candidate.type)) {
                continue;
            }
            if (candidate.consumed) {
                // still under construction: the injector reports the cycle
                return Optional.of(injector.construct(candidate.type));
            }
            return Optional.of(loadCell(candidate));
        }
        return Optional.empty();
    }

    private void handleFailure(String identifier, RuntimeException ex) {
        if (policy == LoadPolicy.STRICT) {
            log.error("Aborting startup: cell {} failed to load", identifier, ex);
            unload();
            throw ex instanceof CellLoadException loadEx ? loadEx : new CellLoadException(identifier, ex);
        }
        log.error("Skipping cell {}: {}", identifier, ex.getMessage(), ex);
        skipped.add(identifier);
    }

    private static Class<? extends Cell> loadClass(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            throw new KernelException(ErrorKind.CELL_LOAD_FAILURE, "Blank cell identifier");
        }
        Class<?> type;
        try {
            type = Class.forName(identifier.trim(), true, classLoader());
        } catch (ClassNotFoundException | LinkageError ex) {
            throw new KernelException(ErrorKind.CELL_LOAD_FAILURE, "Cell class not found: " + identifier, ex);
        }
        if (!Cell.class.isAssignableFrom(type)) {
            throw new KernelException(ErrorKind.CELL_LOAD_FAILURE, identifier + " does not implement " + Cell.class.getName());
        }
        return type.asSubclass(Cell.class);
    }

    private static ClassLoader classLoader() {
        var context = Thread.currentThread().getContextClassLoader();
        return context != null ? context : CellLoader.class.getClassLoader();
    }

    private static final class Configured {
        private final String identifier;
        private final Class<? extends Cell> type;
        private boolean consumed;

        private Configured(String identifier, Class<? extends Cell> type) {
            this.identifier = identifier;
            this.type = type;
        }
    }
}
