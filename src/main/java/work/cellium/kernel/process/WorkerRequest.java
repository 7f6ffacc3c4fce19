package work.cellium.kernel.process;

import java.util.List;
import java.util.Map;

/**
 * One line of the worker protocol, parent to worker.
 */
record WorkerRequest(long id, String task, List<Object> args, Map<String, Object> kwargs) {
    static WorkerRequest of(long id, WorkUnit unit) {
        return new WorkerRequest(id, unit.task(), unit.args(), unit.kwargs());
    }
}
