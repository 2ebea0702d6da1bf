package work.lcod.notebook.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import java.util.Optional;
import work.lcod.notebook.format.CellLanguage;
import work.lcod.notebook.format.CellSplitter;
import work.lcod.notebook.format.LanguageDetector;
import work.lcod.notebook.format.MagicCommands;
import work.lcod.notebook.format.SourceSerializer;
import work.lcod.notebook.json.NotebookJsonCodec;
import work.lcod.notebook.model.Cell;
import work.lcod.notebook.model.Notebook;

/**
 * Public entry point for embedding the notebook source parser.
 *
 * <p>All operations are pure: nothing is cached between calls and no I/O is performed.
 */
public final class NotebookSource {
    private NotebookSource() {}

    public static Notebook parse(String text) {
        return CellSplitter.split(text);
    }

    public static String serialize(Notebook notebook) {
        return serialize(notebook, true);
    }

    /**
     * Writes the header only when asked to and the first cell is non-empty: after the header, an
     * empty first cell leaves a bare delimiter that parsing folds into the header.
     */
    public static String serialize(Notebook notebook, boolean includeHeader) {
        return SourceSerializer.serialize(notebook.cells(), includeHeader && headerKeepsFirstCell(notebook));
    }

    public static boolean hasHeader(String text) {
        return CellSplitter.hasHeader(text);
    }

    public static String serialize(List<Cell> cells, boolean includeHeader) {
        return SourceSerializer.serialize(cells, includeHeader);
    }

    public static ObjectNode toJson(Notebook notebook) {
        return NotebookJsonCodec.toTree(notebook);
    }

    public static Notebook fromJson(JsonNode document) {
        return NotebookJsonCodec.fromTree(document);
    }

    public static Notebook fromJson(String document) {
        return NotebookJsonCodec.fromJson(document);
    }

    private static boolean headerKeepsFirstCell(Notebook notebook) {
        return notebook.isEmpty() || !notebook.cells().get(0).content().isEmpty();
    }

    public static Optional<CellLanguage> detectLanguage(String content) {
        return LanguageDetector.detect(content);
    }

    public static String wrap(String content, CellLanguage language) {
        return MagicCommands.wrap(content, language);
    }

    public static String unwrap(String content) {
        return MagicCommands.unwrap(content);
    }
}
