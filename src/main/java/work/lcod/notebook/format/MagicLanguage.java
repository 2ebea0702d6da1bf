package work.lcod.notebook.format;

import java.util.Optional;

/**
 * Languages whose content is rendered with per-line {@code # MAGIC} markers.
 *
 * <p>Python is detectable but never wrapped: it is expressible as the notebook default language.
 * Keep this enum separate from {@link CellLanguage}.
 */
public enum MagicLanguage {
    MD(CellLanguage.MD),
    SQL(CellLanguage.SQL),
    SCALA(CellLanguage.SCALA),
    R(CellLanguage.R),
    SH(CellLanguage.SH),
    FS(CellLanguage.FS),
    RUN(CellLanguage.RUN),
    PIP(CellLanguage.PIP);

    private final CellLanguage language;

    MagicLanguage(CellLanguage language) {
        this.language = language;
    }

    public CellLanguage language() {
        return language;
    }

    public String token() {
        return language.token();
    }

    public static Optional<MagicLanguage> of(CellLanguage language) {
        if (language == null) {
            return Optional.empty();
        }
        for (MagicLanguage candidate : values()) {
            if (candidate.language == language) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}
