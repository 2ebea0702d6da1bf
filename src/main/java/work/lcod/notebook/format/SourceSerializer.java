package work.lcod.notebook.format;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import work.lcod.notebook.model.Cell;

/**
 * Renders cells as canonical notebook source.
 *
 * <p>The spacing around delimiters is what the workspace store emits on export; keep it exact.
 */
public final class SourceSerializer {
    private SourceSerializer() {}

    public static String serialize(List<Cell> cells, boolean includeHeader) {
        Objects.requireNonNull(cells, "cells");
        List<String> parts = new ArrayList<>();
        if (includeHeader) {
            parts.add(SourceFormat.HEADER);
        }
        for (int i = 0; i < cells.size(); i++) {
            if (i > 0) {
                parts.add("");
                parts.add(SourceFormat.CELL_DELIMITER);
                parts.add("");
            }
            parts.add(cells.get(i).content());
        }
        return String.join("\n", parts);
    }
}
