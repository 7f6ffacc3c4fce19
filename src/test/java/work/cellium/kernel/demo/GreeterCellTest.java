package work.cellium.kernel.demo;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;
import work.cellium.kernel.cell.ArgumentValue;

class GreeterCellTest {
    private final GreeterCell greeter = new GreeterCell();

    @Test
    void appendsTheSuffix() throws Exception {
        assertEquals("Hello Hallo Cellium", greeter.commands().get("greet").handle(ArgumentValue.text("Hello")));
    }

    @Test
    void emptyTextReturnsTheSuffixAlone() throws Exception {
        assertEquals("Hallo Cellium", greeter.commands().get("greet").handle(ArgumentValue.text("")));
    }
}
