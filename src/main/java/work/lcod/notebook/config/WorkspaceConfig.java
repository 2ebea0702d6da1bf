package work.lcod.notebook.config;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Connection settings of a remote workspace (host URL and access token).
 */
public record WorkspaceConfig(Optional<String> host, Optional<String> token, Path source) {
    public WorkspaceConfig {
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(source, "source");
    }

    public boolean isComplete() {
        return host.isPresent() && token.isPresent();
    }

    /**
     * Token suitable for display: only the last four characters are kept.
     */
    public Optional<String> maskedToken() {
        return token.map(value -> value.length() <= 4 ? "****" : "****" + value.substring(value.length() - 4));
    }
}
