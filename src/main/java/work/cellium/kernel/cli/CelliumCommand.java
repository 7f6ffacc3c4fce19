package work.cellium.kernel.cli;

import ch.qos.logback.classic.Level;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import work.cellium.kernel.api.CelliumKernel;
import work.cellium.kernel.api.KernelConfiguration;
import work.cellium.kernel.api.LoadPolicy;
import work.cellium.kernel.api.LogLevel;
import work.cellium.kernel.config.KernelConfigLoader;
import work.cellium.kernel.shared.DurationParser;

/**
 * Line-oriented host: one inbound message per line, one reply per line.
 */
@CommandLine.Command(
    name = "cellium",
    description = "Run the Cellium microkernel, routing one message per stdin line to the loaded cells.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class CelliumCommand implements Callable<Integer> {
    @CommandLine.Option(
        names = {"-c", "--config"},
        description = "Kernel configuration file (.toml, .yaml, .yml or .json).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path config;

    @CommandLine.Option(
        names = "--cell",
        paramLabel = "CLASS",
        description = "Cell class to load, appended after the configured ones (repeatable)."
    )
    private List<String> cells = new ArrayList<>();

    @CommandLine.Option(
        names = "--lenient",
        description = "Skip cells that fail to load instead of aborting."
    )
    private boolean lenient;

    @CommandLine.Option(
        names = {"-w", "--workers"},
        description = "Worker process count (0 disables offloading).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Integer workers;

    @CommandLine.Option(
        names = "--queue-capacity",
        description = "Maximum number of queued work units.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Integer queueCapacity;

    @CommandLine.Option(
        names = "--timeout",
        description = "Default work unit timeout (e.g. 500ms, 30s, 2m).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String timeoutRaw;

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error|off).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    @CommandLine.Option(
        names = {"-m", "--message"},
        paramLabel = "MESSAGE",
        description = "Route this message and exit instead of reading stdin (repeatable)."
    )
    private List<String> messages = new ArrayList<>();

    private final InputStream in;
    private final PrintStream out;

    CelliumCommand() {
        this(System.in, System.out);
    }

    CelliumCommand(InputStream in, PrintStream out) {
        this.in = in;
        this.out = out;
    }

    @Override
    public Integer call() throws Exception {
        if (logLevelRaw != null) {
            applyLogLevel(LogLevel.from(logLevelRaw));
        }
        try (var kernel = CelliumKernel.start(buildConfiguration())) {
            if (!messages.isEmpty()) {
                for (String message : messages) {
                    out.println(kernel.handle(message));
                }
                out.flush();
                return 0;
            }
            serve(kernel);
        }
        return 0;
    }

    KernelConfiguration buildConfiguration() {
        var builder = config != null ? KernelConfigLoader.builder(config) : KernelConfiguration.builder();
        if (!cells.isEmpty()) {
            var all = new ArrayList<>(builder.build().cells());
            all.addAll(cells);
            builder.cells(all);
        }
        if (lenient) {
            builder.loadPolicy(LoadPolicy.LENIENT);
        }
        if (workers != null) {
            builder.workers(workers);
        }
        if (queueCapacity != null) {
            builder.queueCapacity(queueCapacity);
        }
        DurationParser.parse(timeoutRaw).ifPresent(builder::defaultTimeout);
        return builder.build();
    }

    private void serve(CelliumKernel kernel) throws IOException {
        var reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        String line;
        while ((line = reader.readLine()) != null) {
            if (line.isBlank()) {
                continue;
            }
            out.println(kernel.handle(line));
            out.flush();
        }
    }

    private static void applyLogLevel(LogLevel level) {
        var root = LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        if (root instanceof ch.qos.logback.classic.Logger logback) {
            logback.setLevel(Level.toLevel(level.name(), Level.INFO));
        }
    }
}
