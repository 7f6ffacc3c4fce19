package work.cellium.kernel.process;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A pooled worker JVM. Requests go to its stdin, responses are read from its stdout by a
 * dedicated daemon thread; end of stream means the process is gone.
 */
final class WorkerProcess {
    private static final Logger log = LoggerFactory.getLogger(WorkerProcess.class);
    private static final ObjectMapper JSON = new ObjectMapper();

    private final int slot;
    private final Process process;
    private final BufferedWriter stdin;
    private volatile boolean retired;
    private volatile boolean ready;

    private WorkerProcess(int slot, Process process) {
        this.slot = slot;
        this.process = process;
        this.stdin = new BufferedWriter(new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8));
    }

    static WorkerProcess start(int slot, List<String> jvmOptions, Listener listener) throws IOException {
        var builder = new ProcessBuilder(command(jvmOptions))
            .redirectError(ProcessBuilder.Redirect.INHERIT);
        var worker = new WorkerProcess(slot, builder.start());
        var reader = new Thread(() -> worker.readLoop(listener), "cellium-worker-" + slot + "-" + worker.pid());
        reader.setDaemon(true);
        reader.start();
        log.debug("Started worker {} (pid {})", slot, worker.pid());
        return worker;
    }

    static List<String> command(List<String> jvmOptions) {
        var javaHome = Path.of(System.getProperty("java.home"));
        var executable = System.getProperty("os.name", "").toLowerCase().contains("win") ? "java.exe" : "java";
        var command = new ArrayList<String>();
        command.add(javaHome.resolve("bin").resolve(executable).toString());
        command.addAll(jvmOptions);
        command.add("-cp");
        command.add(System.getProperty("java.class.path"));
        command.add(WorkerMain.class.getName());
        return command;
    }

    int slot() {
        return slot;
    }

    long pid() {
        return process.pid();
    }

    boolean isAlive() {
        return process.isAlive();
    }

    /**
     * Whether the worker JVM came up and announced itself.
     */
    boolean isReady() {
        return ready;
    }

    boolean isRetired() {
        return retired;
    }

    void retire() {
        retired = true;
    }

    synchronized void send(WorkerRequest request) throws IOException {
        stdin.write(JSON.writeValueAsString(request));
        stdin.newLine();
        stdin.flush();
    }

    synchronized void closeInput() {
        try {
            stdin.close();
        } catch (IOException ex) {
            log.debug("Closing stdin of worker {} failed: {}", slot, ex.getMessage());
        }
    }

    boolean awaitExit(Duration timeout) {
        try {
            return process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    void kill() {
        retired = true;
        process.destroyForcibly();
    }

    private void readLoop(Listener listener) {
        try (var reader = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                WorkerResponse response;
                try {
                    response = JSON.readValue(line, WorkerResponse.class);
                } catch (JsonProcessingException ex) {
                    log.warn("Worker {} sent an unreadable line: {}", slot, ex.getOriginalMessage());
                    continue;
                }
                if (WorkerResponse.READY.equals(response.status())) {
                    ready = true;
                    listener.onReady(this);
                    continue;
                }
                listener.onResponse(this, response);
            }
        } catch (IOException ex) {
            log.debug("Worker {} stream closed: {}", slot, ex.getMessage());
        }
        int exitCode = awaitExit(Duration.ofSeconds(2)) ? process.exitValue() : -1;
        listener.onExit(this, exitCode);
    }

    @Override
    public String toString() {
        return "worker-" + slot + "(pid " + process.pid() + ")";
    }

    interface Listener {
        void onReady(WorkerProcess worker);

        void onResponse(WorkerProcess worker, WorkerResponse response);

        void onExit(WorkerProcess worker, int exitCode);
    }
}
