package work.cellium.kernel.error;

/**
 * Construction or registration of a configured cell failed.
 */
public final class CellLoadException extends KernelException {
    private final String identifier;

    public CellLoadException(String identifier, Throwable cause) {
        super(ErrorKind.CELL_LOAD_FAILURE, "Failed to load cell " + identifier + ": " + describe(cause), cause);
        this.identifier = identifier;
    }

    public String identifier() {
        return identifier;
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown error";
        }
        var message = cause.getMessage();
        return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
    }
}
