package work.lcod.notebook.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import work.lcod.notebook.format.CellLanguage;
import work.lcod.notebook.format.CellSplitter;
import work.lcod.notebook.format.MagicCommands;

/**
 * Immutable, ordered cell sequence. Cell indices are always {@code 0..size-1}.
 *
 * <p>Mutations never touch the receiver; they return a new reindexed notebook.
 */
public record Notebook(List<Cell> cells) {
    public Notebook {
        Objects.requireNonNull(cells, "cells");
        cells = Collections.unmodifiableList(reindex(cells));
    }

    public static Notebook empty() {
        return new Notebook(List.of());
    }

    public int size() {
        return cells.size();
    }

    public boolean isEmpty() {
        return cells.isEmpty();
    }

    public Cell get(int index) {
        checkExisting(index);
        return cells.get(index);
    }

    public Notebook update(int index, String content) {
        return update(index, content, Optional.empty());
    }

    public Notebook update(int index, String content, CellLanguage language) {
        return update(index, content, Optional.ofNullable(language));
    }

    /**
     * Replaces the content of a cell. With a language the content is wrapped and the cell is
     * re-tagged; without one the cell keeps its current language.
     */
    public Notebook update(int index, String content, Optional<CellLanguage> language) {
        checkExisting(index);
        String body = requireContent(content, "update");
        Cell current = cells.get(index);
        Cell replacement = language
            .map(lang -> new Cell(index, MagicCommands.wrap(body, lang), Optional.of(lang)))
            .orElseGet(() -> new Cell(index, body, current.language()));
        var copy = new ArrayList<>(cells);
        copy.set(index, replacement);
        return new Notebook(copy);
    }

    public Notebook insert(int index, String content) {
        return insert(index, content, Optional.empty());
    }

    public Notebook insert(int index, String content, CellLanguage language) {
        return insert(index, content, Optional.ofNullable(language));
    }

    /**
     * Inserts a cell before {@code index}; {@code index == size()} appends.
     */
    public Notebook insert(int index, String content, Optional<CellLanguage> language) {
        if (index < 0 || index > cells.size()) {
            throw new CellIndexOutOfRangeException(index, 0, cells.size());
        }
        String body = requireContent(content, "insert");
        Cell inserted = language
            .map(lang -> new Cell(index, MagicCommands.wrap(body, lang), Optional.of(lang)))
            .orElseGet(() -> Cell.of(index, body));
        var copy = new ArrayList<>(cells);
        copy.add(index, inserted);
        return new Notebook(copy);
    }

    public Notebook delete(int index) {
        checkExisting(index);
        var copy = new ArrayList<>(cells);
        copy.remove(index);
        return new Notebook(copy);
    }

    private void checkExisting(int index) {
        if (index < 0 || index >= cells.size()) {
            throw new CellIndexOutOfRangeException(index, 0, cells.size() - 1);
        }
    }

    private static String requireContent(String content, String operation) {
        if (content == null) {
            throw new MissingContentException(operation);
        }
        if (CellSplitter.containsDelimiter(content)) {
            throw new InvalidContentException(operation);
        }
        return content.strip();
    }

    private static List<Cell> reindex(List<Cell> cells) {
        var result = new ArrayList<Cell>(cells.size());
        for (int i = 0; i < cells.size(); i++) {
            Cell cell = Objects.requireNonNull(cells.get(i), "cell");
            result.add(cell.withIndex(i));
        }
        return result;
    }
}
