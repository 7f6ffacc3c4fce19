package work.cellium.kernel.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;
import work.cellium.kernel.api.LoadPolicy;

class CelliumCommandTest {
    @Test
    void routesOneShotMessages() {
        var out = new ByteArrayOutputStream();
        var command = new CelliumCommand(new ByteArrayInputStream(new byte[0]), new PrintStream(out, true, StandardCharsets.UTF_8));

        int exit = new CommandLine(command).execute(
            "--workers", "0",
            "--cell", "work.cellium.kernel.demo.GreeterCell",
            "--message", "greeter:greet:Hi",
            "--message", "kernel:ping"
        );

        assertEquals(0, exit);
        assertEquals(List.of("Hi Hallo Cellium", "pong"), lines(out));
    }

    @Test
    void servesStdinLineByLine() {
        var input = "greeter:greet:one\n\njsontest:echo:two\n";
        var out = new ByteArrayOutputStream();
        var command = new CelliumCommand(
            new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)),
            new PrintStream(out, true, StandardCharsets.UTF_8)
        );

        int exit = new CommandLine(command).execute(
            "--workers", "0",
            "--cell", "work.cellium.kernel.demo.GreeterCell",
            "--cell", "work.cellium.kernel.demo.JsonTestCell"
        );

        assertEquals(0, exit);
        assertEquals(List.of("one Hallo Cellium", "Echo: two"), lines(out));
    }

    @Test
    void optionsOverrideTheConfigurationFile() {
        var command = new CelliumCommand();
        new CommandLine(command).parseArgs(
            "--config", Path.of("src", "test", "resources", "config", "kernel.toml").toString(),
            "--cell", "work.cellium.kernel.demo.CalculatorCell",
            "--workers", "1",
            "--timeout", "5s"
        );

        var config = command.buildConfiguration();

        assertEquals(List.of(
            "work.cellium.kernel.demo.GreeterCell",
            "work.cellium.kernel.demo.JsonTestCell",
            "work.cellium.kernel.demo.CalculatorCell"
        ), config.cells());
        assertEquals(LoadPolicy.LENIENT, config.loadPolicy());
        assertEquals(1, config.workers());
        assertEquals(8, config.queueCapacity());
        assertEquals(Duration.ofSeconds(5), config.defaultTimeout());
    }

    @Test
    void unknownCellFailsStrictStartup() {
        var err = new StringWriter();
        var commandLine = new CommandLine(new CelliumCommand(new ByteArrayInputStream(new byte[0]), new PrintStream(new ByteArrayOutputStream())))
            .setExecutionExceptionHandler(new ShortErrorHandler())
            .setErr(new PrintWriter(err));

        int exit = commandLine.execute("--workers", "0", "--cell", "com.example.Missing", "--message", "kernel:ping");

        assertEquals(1, exit);
        assertEquals(true, err.toString().contains("CellLoadFailure"));
    }

    private static List<String> lines(ByteArrayOutputStream out) {
        return out.toString(StandardCharsets.UTF_8).lines().toList();
    }
}
