package work.cellium.kernel.router;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.cellium.kernel.cell.ArgumentValue;

class ArgumentDecoderTest {
    @Test
    void plainTextStaysText() {
        var value = ArgumentDecoder.decode("Hello world");
        assertEquals(ArgumentValue.text("Hello world"), value);
    }

    @Test
    void emptyArgumentsAreEmptyText() {
        var value = assertInstanceOf(ArgumentValue.Text.class, ArgumentDecoder.decode(""));
        assertEquals("", value.value());
    }

    @Test
    void validObjectDecodesToMap() {
        var value = assertInstanceOf(ArgumentValue.MapValue.class, ArgumentDecoder.decode("{\"name\":\"Ada\",\"age\":36,\"tags\":[\"x\"]}"));
        assertEquals(ArgumentValue.text("Ada"), value.entries().get("name"));
        assertEquals(new ArgumentValue.Scalar(36), value.entries().get("age"));
        assertEquals(Map.of("name", "Ada", "age", 36, "tags", List.of("x")), value.toPlain());
    }

    @Test
    void validArrayDecodesToList() {
        var value = assertInstanceOf(ArgumentValue.ListValue.class, ArgumentDecoder.decode("[1, \"two\", null]"));
        assertEquals(3, value.items().size());
        assertEquals(ArgumentValue.text("two"), value.items().get(1));
        assertEquals(new ArgumentValue.Scalar(null), value.items().get(2));
    }

    @Test
    void malformedObjectFallsBackToOriginalText() {
        var raw = "{name: Ada";
        assertEquals(ArgumentValue.text(raw), ArgumentDecoder.decode(raw));
    }

    @Test
    void trailingGarbageIsNotSilentlyDropped() {
        var raw = "{\"a\":1} tail";
        assertEquals(ArgumentValue.text(raw), ArgumentDecoder.decode(raw));
    }

    @Test
    void arrayWhereObjectExpectedShapesAreNotMixed() {
        var raw = "[1, 2";
        assertEquals(ArgumentValue.text(raw), ArgumentDecoder.decode(raw));
    }
}
