package work.cellium.kernel.error;

public final class CommandNotFoundException extends KernelException {
    private final String cellName;
    private final String command;

    public CommandNotFoundException(String cellName, String command) {
        super(ErrorKind.COMMAND_NOT_FOUND, "Command not found: '" + command + "' in cell '" + cellName + "'");
        this.cellName = cellName;
        this.command = command;
    }

    public String cellName() {
        return cellName;
    }

    public String command() {
        return command;
    }
}
