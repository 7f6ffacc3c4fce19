package work.cellium.kernel.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.cellium.kernel.cell.ArgumentValue;
import work.cellium.kernel.demo.GreeterCell;
import work.cellium.kernel.error.CellNotFoundException;
import work.cellium.kernel.error.CommandNotFoundException;
import work.cellium.kernel.error.DuplicateCellException;
import work.cellium.kernel.error.ErrorKind;
import work.cellium.kernel.support.KernelTestSupport;

class RegistryTest {
    @Test
    void duplicateNameFailsAndFirstRegistrationStays() {
        var registry = new Registry();
        var first = new GreeterCell();
        registry.register(first);

        var ex = assertThrows(DuplicateCellException.class, () -> registry.register(new GreeterCell()));

        assertEquals(ErrorKind.DUPLICATE_CELL, ex.kind());
        assertSame(first, registry.resolve("greeter"));
        assertEquals(List.of("greeter"), registry.names());
    }

    @Test
    void resolvesCommandsFromTheSnapshot() throws Exception {
        var registry = new Registry().register(new GreeterCell());
        var handler = registry.command("greeter", "greet");
        assertEquals("Hallo Cellium", handler.handle(ArgumentValue.text("")));
        assertThrows(CommandNotFoundException.class, () -> registry.command("greeter", "wave"));
        assertThrows(CellNotFoundException.class, () -> registry.command("ghost", "greet"));
    }

    @Test
    void keepsRegistrationOrderAndFindsByType() {
        var registry = new Registry();
        registry.register(new KernelTestSupport.EchoCell());
        registry.register(new GreeterCell());

        assertEquals(List.of("echo", "greeter"), registry.names());
        assertTrue(registry.findByType(GreeterCell.class).isPresent());
        assertTrue(registry.find("missing").isEmpty());
    }

    @Test
    void removeForgetsTheCell() {
        var registry = new Registry().register(new GreeterCell());
        registry.remove("greeter");
        assertFalse(registry.contains("greeter"));
        assertEquals(List.of(), registry.names());
    }
}
