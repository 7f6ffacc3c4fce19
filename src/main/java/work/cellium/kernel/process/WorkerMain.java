package work.cellium.kernel.process;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.lang.reflect.InvocationTargetException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of a worker process: announces itself with a {@code ready} line, then reads one JSON
 * request per stdin line, runs the task and writes one JSON response per stdout line. Exits when
 * stdin closes.
 */
public final class WorkerMain {
    private static final ObjectMapper JSON = new ObjectMapper();

    private WorkerMain() {}

    public static void main(String[] args) throws IOException {
        var protocol = new BufferedWriter(new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8));
        // stdout carries the protocol; stray prints from tasks go to stderr
        System.setOut(System.err);
        Logger log = LoggerFactory.getLogger(WorkerMain.class);
        long pid = ProcessHandle.current().pid();
        protocol.write(encode(WorkerResponse.ready(pid)));
        protocol.newLine();
        protocol.flush();
        log.debug("Worker {} ready", pid);

        var input = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        String line;
        while ((line = input.readLine()) != null) {
            if (line.isBlank()) {
                continue;
            }
            WorkerRequest request;
            try {
                request = JSON.readValue(line, WorkerRequest.class);
            } catch (JsonProcessingException ex) {
                log.warn("Ignoring malformed request: {}", ex.getOriginalMessage());
                continue;
            }
            protocol.write(encode(execute(request)));
            protocol.newLine();
            protocol.flush();
        }
        log.debug("Worker {} input closed, exiting", ProcessHandle.current().pid());
    }

    static WorkerResponse execute(WorkerRequest request) {
        try {
            var task = instantiate(request.task());
            List<Object> args = request.args() == null ? List.of() : request.args();
            Map<String, Object> kwargs = request.kwargs() == null ? Map.of() : request.kwargs();
            var value = task.run(args, kwargs);
            return WorkerResponse.ok(request.id(), value);
        } catch (Exception | StackOverflowError | LinkageError | AssertionError ex) {
            // the unit failed but the worker is still usable; other VirtualMachineErrors end the process
            return WorkerResponse.error(request.id(), ex.getClass().getName(), describe(ex));
        }
    }

    static String encode(WorkerResponse response) throws JsonProcessingException {
        try {
            return JSON.writeValueAsString(response);
        } catch (JsonProcessingException ex) {
            var fallback = WorkerResponse.error(
                response.id(),
                ex.getClass().getName(),
                "Result is not JSON serialisable: " + ex.getOriginalMessage()
            );
            return JSON.writeValueAsString(fallback);
        }
    }

    private static WorkTask instantiate(String className) throws ReflectiveOperationException {
        Class<?> type = Class.forName(className);
        if (!WorkTask.class.isAssignableFrom(type)) {
            throw new IllegalArgumentException(className + " does not implement " + WorkTask.class.getName());
        }
        try {
            return (WorkTask) type.getConstructor().newInstance();
        } catch (InvocationTargetException ex) {
            if (ex.getCause() instanceof Exception cause) {
                throw new IllegalStateException("Constructor of " + className + " failed: " + describe(cause), cause);
            }
            throw ex;
        }
    }

    private static String describe(Throwable error) {
        var message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }
}
