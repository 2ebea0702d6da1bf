package work.lcod.notebook.model;

public final class MissingContentException extends NotebookException {
    public MissingContentException(String operation) {
        super("missing_content", operation + " requires cell content");
    }
}
