package work.lcod.notebook.format;

/**
 * Literal markers of the notebook {@code SOURCE} format. They must match byte-for-byte what the
 * workspace store exports and imports.
 */
public final class SourceFormat {
    public static final String HEADER = "# Databricks notebook source";
    public static final String CELL_DELIMITER = "# COMMAND ----------";
    public static final String MAGIC_PREFIX = "# MAGIC ";
    /** Magic marker carried by an empty line of a wrapped cell (no trailing space). */
    public static final String MAGIC_MARKER = "# MAGIC";
    public static final String DIRECTIVE_SIGIL = "%";
    public static final String FORMAT_TAG = "SOURCE";

    private SourceFormat() {}
}
