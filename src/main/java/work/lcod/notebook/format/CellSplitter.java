package work.lcod.notebook.format;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import work.lcod.notebook.model.Cell;
import work.lcod.notebook.model.Notebook;

/**
 * Splits notebook source text into cells.
 *
 * <p>Empty segments are dropped, except the first one: a notebook may legitimately start with an
 * empty cell. Empty interior cells do not survive a parse.
 */
public final class CellSplitter {
    private static final Pattern DELIMITER_LINE = Pattern.compile(
        "^" + Pattern.quote(SourceFormat.CELL_DELIMITER) + "\\r?$",
        Pattern.MULTILINE | Pattern.UNIX_LINES
    );
    private static final Pattern HEADER_PREAMBLE = Pattern.compile(
        "\\A" + Pattern.quote(SourceFormat.HEADER) + "\\r?(?:\\n|\\z)"
            + "(?:[ \\t]*\\r?\\n)*"
            + "(?:" + Pattern.quote(SourceFormat.CELL_DELIMITER) + "\\r?(?:\\n|\\z))?"
    );

    private CellSplitter() {}

    public static Notebook split(String text) {
        Objects.requireNonNull(text, "text");
        String body = stripHeader(text);
        String[] segments = DELIMITER_LINE.split(body, -1);
        List<Cell> cells = new ArrayList<>(segments.length);
        for (int i = 0; i < segments.length; i++) {
            String content = segments[i].strip();
            if (content.isEmpty() && i > 0) {
                continue;
            }
            cells.add(new Cell(cells.size(), content, LanguageDetector.detect(content)));
        }
        return new Notebook(cells);
    }

    /**
     * Whether the text starts with the notebook source header line.
     */
    public static boolean hasHeader(String text) {
        return text != null && HEADER_PREAMBLE.matcher(text).lookingAt();
    }

    /**
     * Whether {@code content} holds a delimiter line, which would split it into several cells.
     */
    public static boolean containsDelimiter(String content) {
        return content != null && DELIMITER_LINE.matcher(content).find();
    }

    /**
     * Removes the header line, the blank lines after it and a delimiter line that directly follows
     * them. Text without the header is returned as is.
     */
    static String stripHeader(String text) {
        var matcher = HEADER_PREAMBLE.matcher(text);
        return matcher.lookingAt() ? text.substring(matcher.end()) : text;
    }
}
