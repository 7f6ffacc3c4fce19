package work.cellium.kernel.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.cellium.kernel.cell.ArgumentValue;
import work.cellium.kernel.demo.GreeterCell;
import work.cellium.kernel.error.CellNotFoundException;

class KernelCellTest {
    @Test
    void listsCellsAndTheirCommands() throws Exception {
        var registry = new Registry();
        var kernel = new KernelCell(registry);
        registry.register(kernel);
        registry.register(new GreeterCell());

        assertEquals("pong", kernel.commands().get("ping").handle(ArgumentValue.text("")));
        assertEquals(List.of("kernel", "greeter"), kernel.commands().get("cells").handle(ArgumentValue.text("")));
        var listing = kernel.commands().get("commands").handle(ArgumentValue.text("greeter"));
        assertEquals(Map.of("greet", "Appends the greeting suffix, e.g. greeter:greet:Hello"), listing);
    }

    @Test
    void unknownCellIsReported() {
        var registry = new Registry();
        var kernel = new KernelCell(registry);
        assertThrows(CellNotFoundException.class,
            () -> kernel.commands().get("commands").handle(ArgumentValue.text("ghost")));
    }
}
