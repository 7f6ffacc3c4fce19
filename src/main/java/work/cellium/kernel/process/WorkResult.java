package work.cellium.kernel.process;

import work.cellium.kernel.error.ErrorKind;

/**
 * Resolution of a submitted {@link WorkUnit}. Exactly one is produced per submission.
 */
public record WorkResult(long id, Outcome outcome, Object value, String errorType, String message) {
    public static WorkResult success(long id, Object value) {
        return new WorkResult(id, Outcome.OK, value, null, null);
    }

    public static WorkResult failure(long id, Outcome outcome, String message) {
        return failure(id, outcome, null, message);
    }

    public static WorkResult failure(long id, Outcome outcome, String errorType, String message) {
        if (outcome == Outcome.OK) {
            throw new IllegalArgumentException("failure outcome required");
        }
        return new WorkResult(id, outcome, null, errorType, message);
    }

    public boolean isSuccess() {
        return outcome == Outcome.OK;
    }

    /**
     * Returns the task's value, or raises a {@link WorkException} carrying the failure kind.
     */
    public Object orElseThrow() {
        if (isSuccess()) {
            return value;
        }
        throw new WorkException(this);
    }

    public enum Outcome {
        OK(null),
        TIMEOUT(ErrorKind.TIMEOUT),
        WORKER_CRASHED(ErrorKind.WORKER_CRASHED),
        OVERLOADED(ErrorKind.OVERLOADED),
        EXECUTION_ERROR(ErrorKind.EXECUTION_ERROR);

        private final ErrorKind kind;

        Outcome(ErrorKind kind) {
            this.kind = kind;
        }

        public ErrorKind kind() {
            return kind;
        }
    }
}
