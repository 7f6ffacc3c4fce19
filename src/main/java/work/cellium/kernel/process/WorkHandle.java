package work.cellium.kernel.process;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Non-blocking view of a submitted work unit. The underlying future always completes normally,
 * at the latest when the unit's timeout expires.
 */
public final class WorkHandle {
    private final long id;
    private final CompletableFuture<WorkResult> future;

    WorkHandle(long id, CompletableFuture<WorkResult> future) {
        this.id = id;
        this.future = future;
    }

    public long id() {
        return id;
    }

    public boolean isDone() {
        return future.isDone();
    }

    public Optional<WorkResult> poll() {
        return Optional.ofNullable(future.getNow(null));
    }

    public WorkResult await() {
        return future.join();
    }

    public CompletableFuture<WorkResult> toFuture() {
        return future.copy();
    }
}
