package work.lcod.notebook.format;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Converts cell content between its plain form and the {@code # MAGIC} wrapped form stored in
 * notebook source.
 */
public final class MagicCommands {
    private MagicCommands() {}

    /**
     * Prefixes every line with the magic marker and prepends the {@code %language} directive.
     * Content is returned unchanged for languages outside {@link MagicLanguage} (python).
     */
    public static String wrap(String content, CellLanguage language) {
        Objects.requireNonNull(content, "content");
        var magic = MagicLanguage.of(language);
        if (magic.isEmpty()) {
            return content;
        }
        var lines = new ArrayList<String>();
        lines.add(SourceFormat.MAGIC_PREFIX + SourceFormat.DIRECTIVE_SIGIL + magic.get().token());
        for (String line : content.split("\n", -1)) {
            lines.add(line.isEmpty() ? SourceFormat.MAGIC_MARKER : SourceFormat.MAGIC_PREFIX + line);
        }
        return String.join("\n", lines);
    }

    /**
     * Strips magic markers and the leading directive line, then trims.
     */
    public static String unwrap(String content) {
        Objects.requireNonNull(content, "content");
        List<String> lines = new ArrayList<>();
        for (String line : content.split("\n", -1)) {
            if (line.startsWith(SourceFormat.MAGIC_PREFIX)) {
                lines.add(line.substring(SourceFormat.MAGIC_PREFIX.length()));
            } else if (line.equals(SourceFormat.MAGIC_MARKER)) {
                lines.add("");
            } else {
                lines.add(line);
            }
        }
        if (!lines.isEmpty() && lines.get(0).startsWith(SourceFormat.DIRECTIVE_SIGIL)) {
            lines.remove(0);
        }
        return String.join("\n", lines).strip();
    }
}
