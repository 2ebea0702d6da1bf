package work.lcod.notebook.model;

import java.util.Objects;
import java.util.Optional;
import work.lcod.notebook.format.CellLanguage;

/**
 * One logical cell of a notebook. An empty {@code language} means the cell inherits the notebook
 * default language.
 */
public record Cell(int index, String content, Optional<CellLanguage> language) {
    public Cell {
        if (index < 0) {
            throw new IllegalArgumentException("index must be non-negative: " + index);
        }
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(language, "language");
    }

    public static Cell of(int index, String content) {
        return new Cell(index, content, Optional.empty());
    }

    public static Cell of(int index, String content, CellLanguage language) {
        return new Cell(index, content, Optional.ofNullable(language));
    }

    public Cell withIndex(int newIndex) {
        return newIndex == index ? this : new Cell(newIndex, content, language);
    }

    public boolean isDefaultLanguage() {
        return language.isEmpty();
    }

    /**
     * Language token as written in JSON ({@code null} when unset).
     */
    public String languageToken() {
        return language.map(CellLanguage::token).orElse(null);
    }
}
