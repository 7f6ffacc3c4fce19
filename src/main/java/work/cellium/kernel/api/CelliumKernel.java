package work.cellium.kernel.api;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.cellium.kernel.bus.EventBus;
import work.cellium.kernel.process.ProcessManager;
import work.cellium.kernel.router.Router;
import work.cellium.kernel.runtime.CellLoader;
import work.cellium.kernel.runtime.Injector;
import work.cellium.kernel.runtime.KernelCell;
import work.cellium.kernel.runtime.Registry;

/**
 * Embedding entry point: wires the kernel singletons in order, loads the configured cells and
 * exposes the {@link Router}.
 *
 * <p>Startup order is event bus, process manager (workers started), injector, cells, router.
 * {@link #close()} reverses it: the process manager drains, cells are torn down in reverse load
 * order, then the event bus and the injector are released.
 */
public final class CelliumKernel implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CelliumKernel.class);

    private final KernelConfiguration configuration;
    private final EventBus eventBus;
    private final ProcessManager processManager;
    private final Registry registry;
    private final Injector injector;
    private final CellLoader loader;
    private final Router router;
    private volatile boolean closed;

    private CelliumKernel(
        KernelConfiguration configuration,
        EventBus eventBus,
        ProcessManager processManager,
        Registry registry,
        Injector injector,
        CellLoader loader
    ) {
        this.configuration = configuration;
        this.eventBus = eventBus;
        this.processManager = processManager;
        this.registry = registry;
        this.injector = injector;
        this.loader = loader;
        this.router = new Router(registry, eventBus);
    }

    public static CelliumKernel start(KernelConfiguration configuration) {
        return start(configuration, injector -> {});
    }

    /**
     * Starts a kernel, letting {@code bindings} add host services to the injector before any cell
     * is constructed.
     *
     * @throws work.cellium.kernel.error.CellLoadException when a cell fails under the strict policy
     */
    public static CelliumKernel start(KernelConfiguration configuration, Consumer<Injector> bindings) {
        Objects.requireNonNull(configuration, "configuration");
        Objects.requireNonNull(bindings, "bindings");
        var eventBus = new EventBus();
        var processManager = ProcessManager.builder()
            .workers(configuration.workers())
            .queueCapacity(configuration.queueCapacity())
            .defaultTimeout(configuration.defaultTimeout())
            .shutdownGrace(configuration.shutdownGrace())
            .jvmOptions(configuration.workerJvmOptions())
            .build();
        var registry = new Registry();
        Injector injector = null;
        try {
            processManager.start();
            injector = new Injector(eventBus, processManager, registry);
            bindings.accept(injector);
            var loader = new CellLoader(registry, injector, eventBus, configuration.loadPolicy());
            if (configuration.builtinCells()) {
                loader.install(new KernelCell(registry));
            }
            loader.load(configuration.cells());
            log.info("Cellium kernel started: cells={}, workers={}", registry.names(), configuration.workers());
            return new CelliumKernel(configuration, eventBus, processManager, registry, injector, loader);
        } catch (RuntimeException ex) {
            processManager.shutdown(Duration.ZERO);
            eventBus.close();
            if (injector != null) {
                injector.close();
            }
            throw ex;
        }
    }

    /**
     * Routes one inbound message; never throws.
     */
    public String handle(String message) {
        return router.handle(message);
    }

    public Router router() {
        return router;
    }

    public Registry registry() {
        return registry;
    }

    public EventBus eventBus() {
        return eventBus;
    }

    public ProcessManager processManager() {
        return processManager;
    }

    public Injector injector() {
        return injector;
    }

    public KernelConfiguration configuration() {
        return configuration;
    }

    public List<String> loadedCells() {
        return loader.loadedNames();
    }

    /**
     * Configured identifiers skipped under {@link LoadPolicy#LENIENT}.
     */
    public List<String> skippedCells() {
        return loader.skipped();
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        log.info("Shutting down Cellium kernel");
        processManager.shutdown(configuration.shutdownGrace());
        loader.unload();
        eventBus.close();
        injector.close();
        log.info("Cellium kernel stopped");
    }
}
