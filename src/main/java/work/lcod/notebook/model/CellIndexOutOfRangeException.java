package work.lcod.notebook.model;

/**
 * Raised when a cell operation targets an index outside its valid range.
 */
public final class CellIndexOutOfRangeException extends NotebookException {
    private final int index;
    private final int lowerBound;
    private final int upperBound;

    public CellIndexOutOfRangeException(int index, int lowerBound, int upperBound) {
        super(
            "index_out_of_range",
            "Cell index " + index + " out of range [" + lowerBound + ", " + upperBound + "]"
        );
        this.index = index;
        this.lowerBound = lowerBound;
        this.upperBound = upperBound;
    }

    public int index() {
        return index;
    }

    /** Inclusive. */
    public int lowerBound() {
        return lowerBound;
    }

    /** Inclusive. */
    public int upperBound() {
        return upperBound;
    }
}
