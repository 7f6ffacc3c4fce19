package work.cellium.kernel.error;

/**
 * Error taxonomy shared by the router, the loader and the process manager. The {@link #code()} is
 * the value written into the {@code "error"} field of reply envelopes.
 */
public enum ErrorKind {
    CELL_NOT_FOUND("CellNotFound"),
    COMMAND_NOT_FOUND("CommandNotFound"),
    DUPLICATE_CELL("DuplicateCell"),
    CIRCULAR_DEPENDENCY("CircularDependency"),
    UNRESOLVED_DEPENDENCY("UnresolvedDependency"),
    CELL_LOAD_FAILURE("CellLoadFailure"),
    INVALID_MESSAGE("InvalidMessage"),
    ARGUMENT_DECODE_FALLBACK("ArgumentDecodeFallback"),
    OVERLOADED("Overloaded"),
    TIMEOUT("Timeout"),
    WORKER_CRASHED("WorkerCrashed"),
    EXECUTION_ERROR("ExecutionError"),
    HANDLER_FAILURE("HandlerFailure"),
    INTERNAL_ERROR("InternalError");

    private final String code;

    ErrorKind(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
