package work.cellium.kernel.demo;

import work.cellium.kernel.cell.AbstractCell;

/**
 * Appends a greeting suffix to the text it receives, e.g. {@code greeter:greet:Hello}.
 */
public final class GreeterCell extends AbstractCell {
    static final String SUFFIX = "Hallo Cellium";

    public GreeterCell() {
        super("greeter");
        command("greet", "Appends the greeting suffix, e.g. greeter:greet:Hello", args -> greet(args.asText()));
    }

    static String greet(String text) {
        if (text == null || text.isEmpty()) {
            return SUFFIX;
        }
        return text + " " + SUFFIX;
    }
}
