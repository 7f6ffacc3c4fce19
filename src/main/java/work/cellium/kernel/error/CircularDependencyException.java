package work.cellium.kernel.error;

import java.util.List;

/**
 * Raised when constructing a cell would require constructing itself again.
 */
public final class CircularDependencyException extends KernelException {
    private final List<String> chain;

    public CircularDependencyException(List<String> chain) {
        super(ErrorKind.CIRCULAR_DEPENDENCY, "Circular dependency: " + String.join(" -> ", chain));
        this.chain = List.copyOf(chain);
    }

    public List<String> chain() {
        return chain;
    }
}
