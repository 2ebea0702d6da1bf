package work.lcod.notebook.model;

/**
 * Structured input (JSON/YAML) that does not have the notebook document shape.
 */
public final class MalformedInputException extends NotebookException {
    public MalformedInputException(String message) {
        super("malformed_input", message);
    }

    public MalformedInputException(String message, Throwable cause) {
        super("malformed_input", message, cause);
    }
}
