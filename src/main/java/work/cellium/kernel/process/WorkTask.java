package work.cellium.kernel.process;

import java.util.List;
import java.util.Map;

/**
 * Unit of computation executed inside a worker process.
 *
 * <p>Implementations are referenced by class name, so they must be public with a public no-arg
 * constructor and available on the worker's classpath. Arguments and results cross the process
 * boundary as JSON.
 */
@FunctionalInterface
public interface WorkTask {
    Object run(List<Object> args, Map<String, Object> kwargs) throws Exception;
}
