package work.cellium.kernel.router;

import work.cellium.kernel.error.ErrorKind;
import work.cellium.kernel.error.KernelException;

/**
 * Parsed {@code cell:command:args} triple. Only the first two separators are structural; the
 * remainder, colons included, is the raw argument string.
 */
public record Address(String cellName, String command, String rawArgs) {
    public static final char SEPARATOR = ':';

    public Address {
        if (cellName == null || cellName.isEmpty()) {
            throw invalid("Missing cell name");
        }
        if (command == null || command.isEmpty()) {
            throw invalid("Missing command name for cell '" + cellName + "'");
        }
        rawArgs = rawArgs == null ? "" : rawArgs;
    }

    /**
     * Splits an inbound command message. A message with a single separator has empty arguments.
     *
     * @throws KernelException of kind {@link ErrorKind#INVALID_MESSAGE} when the message has no
     *     separator or an empty cell or command segment
     */
    public static Address parse(String message) {
        if (message == null) {
            throw invalid("Message is null");
        }
        int first = message.indexOf(SEPARATOR);
        if (first < 0) {
            throw invalid("Expected '<cell>:<command>[:<args>]' but got '" + abbreviate(message) + "'");
        }
        var cell = message.substring(0, first).trim();
        int second = message.indexOf(SEPARATOR, first + 1);
        if (second < 0) {
            return new Address(cell, message.substring(first + 1).trim(), "");
        }
        return new Address(cell, message.substring(first + 1, second).trim(), message.substring(second + 1));
    }

    @Override
    public String toString() {
        return cellName + SEPARATOR + command;
    }

    private static KernelException invalid(String message) {
        return new KernelException(ErrorKind.INVALID_MESSAGE, message);
    }

    static String abbreviate(String value) {
        return value.length() <= 80 ? value : value.substring(0, 77) + "...";
    }
}
