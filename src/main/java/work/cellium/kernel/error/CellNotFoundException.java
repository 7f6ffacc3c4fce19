package work.cellium.kernel.error;

public final class CellNotFoundException extends KernelException {
    private final String cellName;

    public CellNotFoundException(String cellName) {
        super(ErrorKind.CELL_NOT_FOUND, "Cell '" + cellName + "' not found");
        this.cellName = cellName;
    }

    public String cellName() {
        return cellName;
    }
}
