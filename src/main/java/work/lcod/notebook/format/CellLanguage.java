package work.lcod.notebook.format;

import java.util.Locale;
import java.util.Optional;

/**
 * Languages a magic directive may name on the first line of a cell.
 */
public enum CellLanguage {
    PYTHON,
    SQL,
    SCALA,
    R,
    MD,
    SH,
    RUN,
    PIP,
    FS;

    public String token() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Case-sensitive lookup; directives are always written in lower case.
     */
    public static Optional<CellLanguage> fromToken(String token) {
        if (token == null || token.isEmpty()) {
            return Optional.empty();
        }
        for (CellLanguage language : values()) {
            if (language.token().equals(token)) {
                return Optional.of(language);
            }
        }
        return Optional.empty();
    }

    /**
     * Lenient variant used for user input (e.g. {@code --language SQL}).
     */
    public static CellLanguage from(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("language is required");
        }
        return fromToken(value.trim().toLowerCase(Locale.ROOT))
            .orElseThrow(() -> new IllegalArgumentException("Unsupported language: " + value));
    }
}
