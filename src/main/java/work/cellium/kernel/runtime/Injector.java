package work.cellium.kernel.runtime;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.lang.reflect.Parameter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.cellium.kernel.bus.EventBus;
import work.cellium.kernel.cell.Cell;
import work.cellium.kernel.cell.CellConstructor;
import work.cellium.kernel.error.CircularDependencyException;
import work.cellium.kernel.error.ErrorKind;
import work.cellium.kernel.error.KernelException;
import work.cellium.kernel.process.ProcessManager;

/**
 * Constructs cells, resolving every constructor parameter by its declared type.
 *
 * <p>Resolvable types: the bound services ({@link EventBus}, {@link ProcessManager},
 * {@link Registry}, this injector and anything added with {@link #bind}), {@link Logger} (named
 * after the cell class), and other {@link Cell} types, which are delegated to the
 * {@link CellResolver} installed by the loader. Resolution is eager; a cell that transitively
 * requires itself fails with {@link CircularDependencyException}.
 */
public final class Injector implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Injector.class);

    private final Map<Class<?>, Object> services = new LinkedHashMap<>();
    private final LinkedHashSet<Class<?>> constructing = new LinkedHashSet<>();
    private CellResolver cellResolver = type -> Optional.empty();

    public Injector(EventBus eventBus, ProcessManager processManager, Registry registry) {
        bind(EventBus.class, Objects.requireNonNull(eventBus, "eventBus"));
        bind(ProcessManager.class, Objects.requireNonNull(processManager, "processManager"));
        bind(Registry.class, Objects.requireNonNull(registry, "registry"));
        bind(Injector.class, this);
    }

    public synchronized <T> Injector bind(Class<T> type, T instance) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(instance, "instance");
        if (Cell.class.isAssignableFrom(type)) {
            throw new IllegalArgumentException("Cells are loaded by the kernel, not bound as services: " + type.getName());
        }
        services.put(type, instance);
        return this;
    }

    public synchronized <T> Optional<T> service(Class<T> type) {
        var direct = services.get(type);
        if (direct != null) {
            return Optional.of(type.cast(direct));
        }
        for (var entry : services.entrySet()) {
            if (type.isAssignableFrom(entry.getKey())) {
                return Optional.of(type.cast(entry.getValue()));
            }
        }
        return Optional.empty();
    }

    synchronized void setCellResolver(CellResolver resolver) {
        this.cellResolver = Objects.requireNonNull(resolver, "resolver");
    }

    public synchronized <T extends Cell> T construct(Class<T> type) {
        Objects.requireNonNull(type, "type");
        if (constructing.contains(type)) {
            var chain = new ArrayList<String>();
            for (var pending : constructing) {
                chain.add(pending.getName());
            }
            chain.add(type.getName());
            throw new CircularDependencyException(chain);
        }
        constructing.add(type);
        try {
            var constructor = selectConstructor(type);
            var parameters = constructor.getParameters();
            var arguments = new Object[parameters.length];
            for (int i = 0; i < parameters.length; i++) {
                arguments[i] = resolveParameter(type, parameters[i], i);
            }
            log.debug("Constructing {} with {} dependencies", type.getName(), arguments.length);
            return type.cast(constructor.newInstance(arguments));
        } catch (InvocationTargetException ex) {
            var cause = ex.getCause() == null ? ex : ex.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new KernelException(ErrorKind.CELL_LOAD_FAILURE, "Constructor of " + type.getName() + " failed: " + cause.getMessage(), cause);
        } catch (InstantiationException | IllegalAccessException ex) {
            throw new KernelException(ErrorKind.CELL_LOAD_FAILURE, "Cannot instantiate " + type.getName() + ": " + ex.getMessage(), ex);
        } finally {
            constructing.remove(type);
        }
    }

    @Override
    public synchronized void close() {
        services.clear();
        cellResolver = type -> Optional.empty();
    }

    private Object resolveParameter(Class<?> owner, Parameter parameter, int index) {
        Class<?> type = parameter.getType();
        if (type == Logger.class) {
            return LoggerFactory.getLogger(owner);
        }
        if (Cell.class.isAssignableFrom(type)) {
            return cellResolver.resolve(type.asSubclass(Cell.class))
                .orElseThrow(() -> unresolved(owner, type, index, "no configured cell of that type"));
        }
        return service(type).orElseThrow(() -> unresolved(owner, type, index, "no service bound for that type"));
    }

    private static KernelException unresolved(Class<?> owner, Class<?> type, int index, String reason) {
        return new KernelException(
            ErrorKind.UNRESOLVED_DEPENDENCY,
            "Cannot resolve parameter #" + index + " (" + type.getName() + ") of " + owner.getName() + ": " + reason
        );
    }

    private static Constructor<?> selectConstructor(Class<?> type) {
        if (type.isInterface() || Modifier.isAbstract(type.getModifiers())) {
            throw new KernelException(ErrorKind.CELL_LOAD_FAILURE, type.getName() + " is not a concrete class");
        }
        if (!Modifier.isPublic(type.getModifiers())) {
            throw new KernelException(ErrorKind.CELL_LOAD_FAILURE, type.getName() + " must be public");
        }
        List<Constructor<?>> annotated = new ArrayList<>();
        var candidates = type.getConstructors();
        for (var candidate : candidates) {
            if (candidate.isAnnotationPresent(CellConstructor.class)) {
                annotated.add(candidate);
            }
        }
        if (annotated.size() == 1) {
            return annotated.get(0);
        }
        if (annotated.isEmpty() && candidates.length == 1) {
            return candidates[0];
        }
        throw new KernelException(
            ErrorKind.CELL_LOAD_FAILURE,
            type.getName() + " must declare exactly one public constructor or mark one with @CellConstructor"
        );
    }

    /**
     * Supplies cell-typed constructor arguments, loading the dependency first when needed.
     */
    @FunctionalInterface
    interface CellResolver {
        Optional<Cell> resolve(Class<? extends Cell> type);
    }
}
