package work.cellium.kernel.error;

import java.util.Objects;

/**
 * Base exception for kernel failures; carries the {@link ErrorKind} used in reply envelopes.
 */
public class KernelException extends RuntimeException {
    private final ErrorKind kind;

    public KernelException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public KernelException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ErrorKind kind() {
        return kind;
    }
}
