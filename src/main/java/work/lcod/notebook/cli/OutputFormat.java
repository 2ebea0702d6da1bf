package work.lcod.notebook.cli;

import java.util.Locale;

/**
 * Structured document formats accepted and produced by the CLI.
 */
enum OutputFormat {
    JSON,
    YAML;

    static OutputFormat from(String value) {
        if (value == null || value.isBlank()) {
            return JSON;
        }
        try {
            return OutputFormat.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported format: " + value + " (expected json or yaml)");
        }
    }

    static OutputFormat forPath(String path) {
        String lower = path.toLowerCase(Locale.ROOT);
        return lower.endsWith(".yaml") || lower.endsWith(".yml") ? YAML : JSON;
    }
}
