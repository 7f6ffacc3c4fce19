package work.cellium.kernel.process;

import work.cellium.kernel.error.KernelException;

/**
 * Raised by {@link WorkResult#orElseThrow()} for failed work units.
 */
public final class WorkException extends KernelException {
    private final transient WorkResult result;

    public WorkException(WorkResult result) {
        super(result.outcome().kind(), describe(result));
        this.result = result;
    }

    public WorkResult result() {
        return result;
    }

    private static String describe(WorkResult result) {
        var message = result.message() == null ? result.outcome().kind().code() : result.message();
        if (result.errorType() != null) {
            return "Work unit " + result.id() + " failed with " + result.errorType() + ": " + message;
        }
        return "Work unit " + result.id() + ": " + message;
    }
}
