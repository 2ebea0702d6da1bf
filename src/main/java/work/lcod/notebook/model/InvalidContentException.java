package work.lcod.notebook.model;

import work.lcod.notebook.format.SourceFormat;

/**
 * Cell content holding a {@code # COMMAND ----------} line, which would become a cell boundary once
 * the notebook is written out.
 */
public final class InvalidContentException extends NotebookException {
    public InvalidContentException(String operation) {
        super(
            "invalid_content",
            operation + " content must not contain a '" + SourceFormat.CELL_DELIMITER + "' line"
        );
    }
}
