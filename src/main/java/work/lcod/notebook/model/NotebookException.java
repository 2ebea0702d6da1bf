package work.lcod.notebook.model;

/**
 * Base failure of notebook operations, carrying a stable machine-readable code.
 */
public class NotebookException extends RuntimeException {
    private final String code;

    public NotebookException(String code, String message) {
        super(message);
        this.code = code;
    }

    public NotebookException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String code() {
        return code;
    }
}
