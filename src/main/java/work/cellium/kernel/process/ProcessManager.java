package work.cellium.kernel.process;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.cellium.kernel.shared.DaemonThreadFactory;

/**
 * Runs {@link WorkUnit}s in a fixed pool of worker JVMs.
 *
 * <p>Each worker executes one unit at a time. A submission goes to an idle worker, or waits in a
 * bounded FIFO queue; when the queue is full the unit is rejected as
 * {@link WorkResult.Outcome#OVERLOADED}. Every submission gets a unique id that correlates the
 * worker's response with the waiting caller, whatever order workers finish in.
 *
 * <p>The timeout of a unit runs from submission. A unit still queued at its deadline is dropped; a
 * unit still running has its worker killed and replaced, so a hung task cannot shrink the pool. A
 * worker that dies mid-unit resolves that unit as {@link WorkResult.Outcome#WORKER_CRASHED} and is
 * replaced as well. Units are never retried.
 *
 * <p>A worker that exits before announcing itself is a start failure. Replacements for it are
 * delayed with an exponential backoff, and after {@value #MAX_START_FAILURES} consecutive start
 * failures no further worker is spawned; once no worker is left, work resolves as
 * {@link WorkResult.Outcome#WORKER_CRASHED}. {@link #start} fails when none of the initial workers
 * comes up.
 *
 * <p>All bookkeeping (idle workers, queue, correlation table) is guarded by one lock, so
 * {@link #submit} may be called concurrently from any thread.
 */
public final class ProcessManager implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ProcessManager.class);
    private static final Duration EXIT_WAIT = Duration.ofMillis(500);
    private static final Duration STARTUP_WAIT = Duration.ofSeconds(20);
    private static final Duration RESPAWN_BACKOFF = Duration.ofMillis(100);
    private static final Duration MAX_RESPAWN_BACKOFF = Duration.ofSeconds(5);
    static final int MAX_START_FAILURES = 5;

    private final int workerCount;
    private final int queueCapacity;
    private final Duration defaultTimeout;
    private final Duration shutdownGrace;
    private final List<String> jvmOptions;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition drained = lock.newCondition();
    private final Condition readiness = lock.newCondition();
    private final Map<Long, Pending> pending = new HashMap<>();
    private final Deque<Pending> queue = new ArrayDeque<>();
    private final List<WorkerProcess> workers = new ArrayList<>();
    private final Deque<WorkerProcess> idle = new ArrayDeque<>();
    private final Map<WorkerProcess, Pending> inFlight = new IdentityHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final ScheduledExecutorService timer =
        Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("cellium-work-timer-"));
    private final WorkerProcess.Listener listener = new WorkerListener();
    private State state = State.NEW;
    private int nextSlot;
    private int startFailures;
    private int scheduledRespawns;
    private boolean respawnsAbandoned;

    private ProcessManager(Builder builder) {
        if (builder.workers < 0) {
            throw new IllegalArgumentException("workers must be >= 0");
        }
        if (builder.queueCapacity < 0) {
            throw new IllegalArgumentException("queueCapacity must be >= 0");
        }
        this.workerCount = builder.workers;
        this.queueCapacity = builder.queueCapacity;
        this.defaultTimeout = requirePositive(builder.defaultTimeout, "defaultTimeout");
        this.shutdownGrace = Objects.requireNonNull(builder.shutdownGrace, "shutdownGrace");
        this.jvmOptions = List.copyOf(builder.jvmOptions);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts the worker processes and waits until one of them is ready. A manager configured with
     * zero workers rejects every unit.
     *
     * @throws IllegalStateException when no worker process could be started
     */
    public void start() {
        lock.lock();
        try {
            if (state != State.NEW) {
                throw new IllegalStateException("Process manager already " + state.name().toLowerCase());
            }
            try {
                for (int i = 0; i < workerCount; i++) {
                    var worker = spawn();
                    idle.addLast(worker);
                }
            } catch (IOException ex) {
                abortStart();
                throw new IllegalStateException("Failed to start worker process", ex);
            }
            awaitFirstReady();
            if (workerCount > 0 && workers.isEmpty()) {
                int failures = startFailures;
                abortStart();
                throw new IllegalStateException(
                    "No worker process could be started: " + failures + " exited during startup (check the worker JVM options)"
                );
            }
            state = State.RUNNING;
            refill();
            log.info("Process manager started with {} worker(s), queue capacity {}", workerCount, queueCapacity);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Submits a unit and blocks until it resolves (at the latest when its timeout expires).
     */
    public WorkResult submit(WorkUnit unit) {
        return submitAsync(unit).await();
    }

    public WorkHandle submitAsync(WorkUnit unit) {
        Objects.requireNonNull(unit, "unit");
        long id = sequence.incrementAndGet();
        var future = new CompletableFuture<WorkResult>();
        var timeout = unit.timeout().orElse(defaultTimeout);
        lock.lock();
        try {
            if (state != State.RUNNING) {
                future.complete(WorkResult.failure(id, WorkResult.Outcome.OVERLOADED, "Process manager is not accepting work (" + state.name().toLowerCase() + ")"));
                return new WorkHandle(id, future);
            }
            if (workerCount == 0) {
                future.complete(WorkResult.failure(id, WorkResult.Outcome.OVERLOADED, "Process offload is disabled: no workers configured"));
                return new WorkHandle(id, future);
            }
            refill();
            if (workers.isEmpty() && startFailures >= MAX_START_FAILURES) {
                future.complete(WorkResult.failure(id, WorkResult.Outcome.WORKER_CRASHED, noWorkersMessage()));
                return new WorkHandle(id, future);
            }
            var entry = new Pending(id, unit, future);
            var worker = idle.pollFirst();
            if (worker == null) {
                if (queue.size() >= queueCapacity) {
                    log.warn("Rejecting work unit {} ({}): queue full at {}", id, unit.task(), queueCapacity);
                    future.complete(WorkResult.failure(id, WorkResult.Outcome.OVERLOADED, "Work queue is full (" + queueCapacity + " pending)"));
                    return new WorkHandle(id, future);
                }
                pending.put(id, entry);
                queue.addLast(entry);
            } else {
                pending.put(id, entry);
                assign(worker, entry);
            }
            if (pending.containsKey(id)) {
                entry.timeoutTask = timer.schedule(() -> expire(id, timeout), timeout.toNanos(), TimeUnit.NANOSECONDS);
            }
        } finally {
            lock.unlock();
        }
        return new WorkHandle(id, future);
    }

    /**
     * Runs {@code task} once per argument list, in parallel across the pool.
     *
     * @return the results, in the order of {@code argsList}
     */
    public List<WorkResult> map(Class<? extends WorkTask> task, List<List<Object>> argsList, Duration timeout) {
        var handles = new ArrayList<WorkHandle>(argsList.size());
        for (var args : argsList) {
            handles.add(submitAsync(WorkUnit.builder(task).args(args).timeout(timeout).build()));
        }
        var results = new ArrayList<WorkResult>(handles.size());
        for (var handle : handles) {
            results.add(handle.await());
        }
        return results;
    }

    public int workerCount() {
        return workerCount;
    }

    public int queueCapacity() {
        return queueCapacity;
    }

    public Duration defaultTimeout() {
        return defaultTimeout;
    }

    public int pendingCount() {
        lock.lock();
        try {
            return pending.size();
        } finally {
            lock.unlock();
        }
    }

    public int queuedCount() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Process ids of the live workers, in pool order.
     */
    public List<Long> workerPids() {
        lock.lock();
        try {
            var pids = new ArrayList<Long>(workers.size());
            for (var worker : workers) {
                pids.add(worker.pid());
            }
            return pids;
        } finally {
            lock.unlock();
        }
    }

    public boolean isAccepting() {
        lock.lock();
        try {
            return state == State.RUNNING;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        shutdown(shutdownGrace);
    }

    /**
     * Stops accepting work, waits up to {@code grace} for pending units, resolves whatever is left
     * as crashed and terminates the workers.
     */
    public void shutdown(Duration grace) {
        List<WorkerProcess> stopping;
        lock.lock();
        try {
            if (state == State.CLOSED || state == State.CLOSING) {
                return;
            }
            if (state == State.NEW) {
                state = State.CLOSED;
                timer.shutdownNow();
                return;
            }
            state = State.CLOSING;
            log.info("Shutting down process manager ({} unit(s) pending)", pending.size());
            long remaining = grace.toNanos();
            while (!pending.isEmpty() && remaining > 0) {
                try {
                    remaining = drained.awaitNanos(remaining);
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
            for (var entry : new ArrayList<>(pending.values())) {
                resolve(entry, WorkResult.failure(entry.id, WorkResult.Outcome.WORKER_CRASHED, "Work unit abandoned at shutdown"));
            }
            queue.clear();
            inFlight.clear();
            stopping = new ArrayList<>(workers);
            for (var worker : stopping) {
                worker.retire();
            }
            workers.clear();
            idle.clear();
            state = State.CLOSED;
        } finally {
            lock.unlock();
        }
        for (var worker : stopping) {
            worker.closeInput();
        }
        for (var worker : stopping) {
            if (!worker.awaitExit(EXIT_WAIT)) {
                log.warn("Force-terminating {}", worker);
                worker.kill();
            }
        }
        timer.shutdownNow();
        log.info("Process manager stopped");
    }

    // --- internals, all called with the lock held ---

    private WorkerProcess spawn() throws IOException {
        var worker = WorkerProcess.start(nextSlot++, jvmOptions, listener);
        workers.add(worker);
        return worker;
    }

    private void awaitFirstReady() {
        long remaining = STARTUP_WAIT.toNanos();
        while (!workers.isEmpty() && workers.stream().noneMatch(WorkerProcess::isReady) && remaining > 0) {
            try {
                remaining = readiness.awaitNanos(remaining);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                return;
            }
        }
        if (!workers.isEmpty() && workers.stream().noneMatch(WorkerProcess::isReady)) {
            log.warn("No worker announced itself within {} ms; continuing", STARTUP_WAIT.toMillis());
        }
    }

    private void abortStart() {
        state = State.CLOSED;
        for (var worker : workers) {
            worker.kill();
        }
        workers.clear();
        idle.clear();
        timer.shutdownNow();
    }

    /**
     * Brings the pool back to its configured size: immediately while workers start cleanly, after
     * a backoff once start failures accumulate, not at all past {@link #MAX_START_FAILURES}.
     */
    private void refill() {
        if (!(state == State.RUNNING || (state == State.CLOSING && !queue.isEmpty()))) {
            return;
        }
        int missing = workerCount - workers.size() - scheduledRespawns;
        for (int i = 0; i < missing; i++) {
            if (startFailures >= MAX_START_FAILURES) {
                abandonRespawns();
                return;
            }
            if (startFailures == 0) {
                spawnIntoPool();
            } else {
                scheduleRespawn();
            }
        }
    }

    private void spawnIntoPool() {
        try {
            release(spawn());
        } catch (IOException ex) {
            startFailures++;
            log.error("Unable to start replacement worker", ex);
        }
    }

    private void scheduleRespawn() {
        long delay = Math.min(
            RESPAWN_BACKOFF.toMillis() << Math.min(startFailures - 1, 16),
            MAX_RESPAWN_BACKOFF.toMillis()
        );
        scheduledRespawns++;
        log.warn("Replacing worker in {} ms after {} start failure(s)", delay, startFailures);
        timer.schedule(this::respawn, delay, TimeUnit.MILLISECONDS);
    }

    private void respawn() {
        lock.lock();
        try {
            scheduledRespawns--;
            if (startFailures >= MAX_START_FAILURES) {
                abandonRespawns();
            } else if ((state == State.RUNNING || (state == State.CLOSING && !queue.isEmpty())) && workers.size() < workerCount) {
                spawnIntoPool();
                refill();
            }
        } finally {
            lock.unlock();
        }
    }

    private void abandonRespawns() {
        if (!workers.isEmpty() || scheduledRespawns > 0) {
            return;
        }
        if (!respawnsAbandoned) {
            respawnsAbandoned = true;
            log.error("Giving up on worker processes after {} consecutive start failures", startFailures);
        }
        for (var entry : new ArrayList<>(queue)) {
            resolve(entry, WorkResult.failure(entry.id, WorkResult.Outcome.WORKER_CRASHED, noWorkersMessage()));
        }
        queue.clear();
    }

    private String noWorkersMessage() {
        return "No worker process could be started (" + startFailures + " consecutive start failures)";
    }

    private void assign(WorkerProcess worker, Pending entry) {
        entry.worker = worker;
        inFlight.put(worker, entry);
        try {
            worker.send(WorkerRequest.of(entry.id, entry.unit));
        } catch (IOException ex) {
            log.error("Could not send work unit {} to {}", entry.id, worker, ex);
            inFlight.remove(worker);
            resolve(entry, WorkResult.failure(entry.id, WorkResult.Outcome.WORKER_CRASHED, "Worker unreachable: " + ex.getMessage()));
            recycle(worker);
        }
    }

    /**
     * Hands the next queued unit to {@code worker}, or parks it as idle.
     */
    private void release(WorkerProcess worker) {
        Pending next;
        while ((next = queue.pollFirst()) != null) {
            if (pending.containsKey(next.id)) {
                assign(worker, next);
                return;
            }
        }
        idle.addLast(worker);
    }

    private void recycle(WorkerProcess worker) {
        worker.retire();
        workers.remove(worker);
        idle.remove(worker);
        inFlight.remove(worker);
        worker.kill();
        refill();
    }

    private boolean resolve(Pending entry, WorkResult result) {
        if (pending.remove(entry.id) == null) {
            return false;
        }
        if (entry.timeoutTask != null) {
            entry.timeoutTask.cancel(false);
        }
        entry.future.complete(result);
        if (pending.isEmpty()) {
            drained.signalAll();
        }
        return true;
    }

    private void expire(long id, Duration timeout) {
        lock.lock();
        try {
            var entry = pending.get(id);
            if (entry == null) {
                return;
            }
            var message = "No response within " + timeout.toMillis() + " ms";
            if (entry.worker == null) {
                queue.remove(entry);
                log.warn("Work unit {} ({}) timed out while queued", id, entry.unit.task());
                resolve(entry, WorkResult.failure(id, WorkResult.Outcome.TIMEOUT, message));
                return;
            }
            log.warn("Work unit {} ({}) timed out on {}; recycling the worker", id, entry.unit.task(), entry.worker);
            resolve(entry, WorkResult.failure(id, WorkResult.Outcome.TIMEOUT, message));
            recycle(entry.worker);
        } finally {
            lock.unlock();
        }
    }

    private static Duration requirePositive(Duration value, String name) {
        Objects.requireNonNull(value, name);
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
        return value;
    }

    private final class WorkerListener implements WorkerProcess.Listener {
        @Override
        public void onReady(WorkerProcess worker) {
            lock.lock();
            try {
                startFailures = 0;
                respawnsAbandoned = false;
                readiness.signalAll();
            } finally {
                lock.unlock();
            }
        }

        @Override
        public void onResponse(WorkerProcess worker, WorkerResponse response) {
            lock.lock();
            try {
                var entry = pending.get(response.id());
                if (entry == null || entry.worker != worker) {
                    log.debug("Discarding response for unit {} from {}: no longer pending", response.id(), worker);
                    return;
                }
                inFlight.remove(worker);
                resolve(entry, response.toResult());
                if (!worker.isRetired()) {
                    release(worker);
                }
            } finally {
                lock.unlock();
            }
        }

        @Override
        public void onExit(WorkerProcess worker, int exitCode) {
            lock.lock();
            try {
                if (worker.isRetired()) {
                    log.debug("{} exited with code {}", worker, exitCode);
                    return;
                }
                if (!worker.isReady()) {
                    startFailures++;
                    log.error("{} exited with code {} during startup", worker, exitCode);
                } else {
                    log.error("{} died unexpectedly with exit code {}", worker, exitCode);
                }
                var entry = inFlight.remove(worker);
                if (entry != null) {
                    resolve(entry, WorkResult.failure(
                        entry.id,
                        WorkResult.Outcome.WORKER_CRASHED,
                        "Worker exited with code " + exitCode + " before responding"
                    ));
                }
                recycle(worker);
                readiness.signalAll();
            } finally {
                lock.unlock();
            }
        }
    }

    private static final class Pending {
        private final long id;
        private final WorkUnit unit;
        private final CompletableFuture<WorkResult> future;
        private ScheduledFuture<?> timeoutTask;
        private WorkerProcess worker;

        private Pending(long id, WorkUnit unit, CompletableFuture<WorkResult> future) {
            this.id = id;
            this.unit = unit;
            this.future = future;
        }
    }

    private enum State {
        NEW,
        RUNNING,
        CLOSING,
        CLOSED
    }

    public static final class Builder {
        private int workers = Math.max(1, Runtime.getRuntime().availableProcessors());
        private int queueCapacity = 64;
        private Duration defaultTimeout = Duration.ofSeconds(30);
        private Duration shutdownGrace = Duration.ofSeconds(5);
        private List<String> jvmOptions = List.of();

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

        public Builder jvmOptions(List<String> jvmOptions) {
            this.jvmOptions = jvmOptions == null ? List.of() : jvmOptions;
            return this;
        }

        public ProcessManager build() {
            return new ProcessManager(this);
        }
    }
}
