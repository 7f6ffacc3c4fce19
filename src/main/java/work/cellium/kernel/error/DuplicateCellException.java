package work.cellium.kernel.error;

public final class DuplicateCellException extends KernelException {
    private final String cellName;

    public DuplicateCellException(String cellName) {
        super(ErrorKind.DUPLICATE_CELL, "Cell '" + cellName + "' is already registered");
        this.cellName = cellName;
    }

    public String cellName() {
        return cellName;
    }
}
