package work.cellium.kernel.process;

/**
 * One line of the worker protocol, worker to parent.
 */
record WorkerResponse(long id, String status, Object value, String errorType, String error) {
    static final String OK = "ok";
    static final String ERROR = "error";
    /** Sent once by a worker before it reads its first request. */
    static final String READY = "ready";

    static WorkerResponse ready(long pid) {
        return new WorkerResponse(0, READY, pid, null, null);
    }

    static WorkerResponse ok(long id, Object value) {
        return new WorkerResponse(id, OK, value, null, null);
    }

    static WorkerResponse error(long id, String errorType, String error) {
        return new WorkerResponse(id, ERROR, null, errorType, error);
    }

    WorkResult toResult() {
        if (OK.equals(status)) {
            return WorkResult.success(id, value);
        }
        return WorkResult.failure(id, WorkResult.Outcome.EXECUTION_ERROR, errorType, error);
    }
}
