package work.cellium.kernel.cell;

/**
 * Handles one named command of a cell.
 */
@FunctionalInterface
public interface CommandHandler {
    Object handle(ArgumentValue args) throws Exception;
}
