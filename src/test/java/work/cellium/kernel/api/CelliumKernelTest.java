package work.cellium.kernel.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import work.cellium.kernel.demo.CalculatorCell;
import work.cellium.kernel.demo.GreeterCell;
import work.cellium.kernel.demo.JsonTestCell;
import work.cellium.kernel.error.CellLoadException;
import work.cellium.kernel.support.KernelTestSupport;
import work.cellium.kernel.support.KernelTestSupport.ClockCell;
import work.cellium.kernel.support.KernelTestSupport.ListenerCell;

class CelliumKernelTest {
    @Test
    void routesCommandsToConfiguredCells() {
        var config = KernelTestSupport.inProcessConfiguration()
            .cell(GreeterCell.class)
            .cell(JsonTestCell.class)
            .build();
        try (var kernel = CelliumKernel.start(config)) {
            assertEquals(List.of("kernel", "greeter", "jsontest"), kernel.loadedCells());
            assertEquals("Hello Hallo Cellium", kernel.handle("greeter:greet:Hello"));
            assertEquals("pong", kernel.handle("kernel:ping"));
            assertEquals("[\"kernel\",\"greeter\",\"jsontest\"]", kernel.handle("kernel:cells:"));
        }
    }

    @Test
    void builtinCellsCanBeDisabled() {
        var config = KernelTestSupport.inProcessConfiguration().builtinCells(false).cell(GreeterCell.class).build();
        try (var kernel = CelliumKernel.start(config)) {
            assertEquals(List.of("greeter"), kernel.registry().names());
            assertTrue(kernel.handle("kernel:ping").contains("CellNotFound"));
        }
    }

    @Test
    void eventEnvelopesReachCellHandlers() {
        var config = KernelTestSupport.inProcessConfiguration().cell(ListenerCell.class).build();
        try (var kernel = CelliumKernel.start(config)) {
            var ack = kernel.handle("{\"event_name\":\"ping\",\"payload\":{\"n\":5}}");
            assertEquals("{\"status\":\"ok\",\"event\":\"ping\",\"delivered\":1}", ack);
            assertEquals("[\"ping:5\"]", kernel.handle("listener:received:"));
        }
    }

    @Test
    void hostBindingsAreInjected() {
        var config = KernelTestSupport.inProcessConfiguration().cell(ClockCell.class).build();
        try (var kernel = CelliumKernel.start(config,
            injector -> injector.bind(KernelTestSupport.Clock.class, () -> 99L))) {
            assertEquals("99", kernel.handle("clock:now:"));
        }
    }

    @Test
    void strictFailureAbortsStartup() {
        KernelTestSupport.CLOSED.clear();
        var config = KernelTestSupport.inProcessConfiguration()
            .cell(ListenerCell.class)
            .cell(KernelTestSupport.BrokenCell.class)
            .build();

        assertThrows(CellLoadException.class, () -> CelliumKernel.start(config));
        assertEquals(List.of("listener"), KernelTestSupport.CLOSED);
    }

    @Test
    void lenientStartupReportsSkippedCells() {
        var config = KernelTestSupport.inProcessConfiguration()
            .loadPolicy(LoadPolicy.LENIENT)
            .cell(KernelTestSupport.BrokenCell.class)
            .cell(GreeterCell.class)
            .build();
        try (var kernel = CelliumKernel.start(config)) {
            assertEquals(List.of(KernelTestSupport.BrokenCell.class.getName()), kernel.skippedCells());
            assertEquals("Hallo Cellium", kernel.handle("greeter:greet:"));
        }
    }

    @Test
    void closeTearsDownInOrderAndIsIdempotent() {
        KernelTestSupport.CLOSED.clear();
        var config = KernelTestSupport.inProcessConfiguration()
            .cell(KernelTestSupport.FirstClosingCell.class)
            .cell(ListenerCell.class)
            .build();
        var kernel = CelliumKernel.start(config);

        kernel.close();
        kernel.close();

        assertTrue(kernel.isClosed());
        assertEquals(List.of("listener", "first"), KernelTestSupport.CLOSED);
        assertTrue(kernel.eventBus().isClosed());
        assertFalse(kernel.processManager().isAccepting());
    }

    @Test
    void offloadWithoutWorkersIsOverloaded() {
        var config = KernelTestSupport.inProcessConfiguration().cell(CalculatorCell.class).build();
        try (var kernel = CelliumKernel.start(config)) {
            assertTrue(kernel.handle("calculator:primes:100").contains("\"error\":\"Overloaded\""));
        }
    }

    @Test
    @Timeout(value = 60, unit = TimeUnit.SECONDS)
    void offloadsPrimeCountingToAWorker() {
        var config = KernelConfiguration.builder()
            .workers(1)
            .defaultTimeout(Duration.ofSeconds(20))
            .shutdownGrace(Duration.ofSeconds(1))
            .cell(CalculatorCell.class)
            .build();
        try (var kernel = CelliumKernel.start(config)) {
            assertEquals("{\"below\":\"100\",\"count\":25}", kernel.handle("calculator:primes:100"));
            assertEquals("3", kernel.handle("calculator:calc:1+2"));
        }
    }
}
