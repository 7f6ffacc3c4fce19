package work.cellium.kernel.api;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Immutable startup configuration of a {@link CelliumKernel}.
 *
 * @param cells fully-qualified cell class names, in load order
 * @param workers size of the worker process pool; {@code 0} disables work offload
 * @param builtinCells whether the {@code kernel} introspection cell is registered
 */
public record KernelConfiguration(
    List<String> cells,
    LoadPolicy loadPolicy,
    int workers,
    int queueCapacity,
    Duration defaultTimeout,
    Duration shutdownGrace,
    List<String> workerJvmOptions,
    boolean builtinCells
) {
    public static final int DEFAULT_QUEUE_CAPACITY = 64;
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_SHUTDOWN_GRACE = Duration.ofSeconds(5);

    public KernelConfiguration {
        cells = List.copyOf(Objects.requireNonNull(cells, "cells"));
        Objects.requireNonNull(loadPolicy, "loadPolicy");
        Objects.requireNonNull(defaultTimeout, "defaultTimeout");
        Objects.requireNonNull(shutdownGrace, "shutdownGrace");
        workerJvmOptions = List.copyOf(Objects.requireNonNull(workerJvmOptions, "workerJvmOptions"));
        if (workers < 0) {
            throw new IllegalArgumentException("workers must be >= 0: " + workers);
        }
        if (queueCapacity < 0) {
            throw new IllegalArgumentException("queueCapacity must be >= 0: " + queueCapacity);
        }
        if (defaultTimeout.isZero() || defaultTimeout.isNegative()) {
            throw new IllegalArgumentException("defaultTimeout must be positive: " + defaultTimeout);
        }
        if (shutdownGrace.isNegative()) {
            throw new IllegalArgumentException("shutdownGrace must not be negative: " + shutdownGrace);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .cells(cells)
            .loadPolicy(loadPolicy)
            .workers(workers)
            .queueCapacity(queueCapacity)
            .defaultTimeout(defaultTimeout)
            .shutdownGrace(shutdownGrace)
            .workerJvmOptions(workerJvmOptions)
            .builtinCells(builtinCells);
    }

    public static int defaultWorkers() {
        return Math.max(1, Runtime.getRuntime().availableProcessors());
    }

    public static final class Builder {
        private final List<String> cells = new ArrayList<>();
        private LoadPolicy loadPolicy = LoadPolicy.STRICT;
        private int workers = defaultWorkers();
        private int queueCapacity = DEFAULT_QUEUE_CAPACITY;
        private Duration defaultTimeout = DEFAULT_TIMEOUT;
        private Duration shutdownGrace = DEFAULT_SHUTDOWN_GRACE;
        private List<String> workerJvmOptions = List.of();
        private boolean builtinCells = true;

        public Builder cells(Collection<String> cells) {
            this.cells.clear();
            this.cells.addAll(cells);
            return this;
        }

        public Builder cell(String cell) {
            this.cells.add(cell);
            return this;
        }

        public Builder cell(Class<?> cell) {
            return cell(cell.getName());
        }

        public Builder loadPolicy(LoadPolicy loadPolicy) {
            this.loadPolicy = loadPolicy;
            return this;
        }

        public Builder workers(int workers) {
            this.workers = workers;
            return this;
        }

        public Builder queueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
            return this;
        }

        public Builder defaultTimeout(Duration defaultTimeout) {
            this.defaultTimeout = defaultTimeout;
            return this;
        }

        public Builder shutdownGrace(Duration shutdownGrace) {
            this.shutdownGrace = shutdownGrace;
            return this;
        }

        public Builder workerJvmOptions(List<String> workerJvmOptions) {
            this.workerJvmOptions = workerJvmOptions;
            return this;
        }

        public Builder builtinCells(boolean builtinCells) {
            this.builtinCells = builtinCells;
            return this;
        }

        public KernelConfiguration build() {
            return new KernelConfiguration(
                cells,
                loadPolicy,
                workers,
                queueCapacity,
                defaultTimeout,
                shutdownGrace,
                workerJvmOptions,
                builtinCells
            );
        }
    }
}
