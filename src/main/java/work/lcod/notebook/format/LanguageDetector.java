package work.lcod.notebook.format;

import java.util.Optional;

/**
 * Reads the magic directive ({@code # MAGIC %sql}) of a cell.
 *
 * <p>Only the first line is inspected. A directive on any later line leaves the cell in the
 * notebook default language.
 */
public final class LanguageDetector {
    private LanguageDetector() {}

    public static Optional<CellLanguage> detect(String content) {
        if (content == null || content.isEmpty()) {
            return Optional.empty();
        }
        String firstLine = firstLine(content);
        if (!firstLine.startsWith(SourceFormat.MAGIC_PREFIX)) {
            return Optional.empty();
        }
        String remainder = firstLine.substring(SourceFormat.MAGIC_PREFIX.length());
        if (!remainder.startsWith(SourceFormat.DIRECTIVE_SIGIL)) {
            return Optional.empty();
        }
        return CellLanguage.fromToken(directiveToken(remainder.substring(1)));
    }

    static String firstLine(String content) {
        int newline = content.indexOf('\n');
        String line = newline == -1 ? content : content.substring(0, newline);
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }

    private static String directiveToken(String text) {
        int end = 0;
        while (end < text.length() && !Character.isWhitespace(text.charAt(end))) {
            end++;
        }
        return text.substring(0, end);
    }
}
