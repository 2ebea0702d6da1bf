package work.lcod.notebook.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.tomlj.Toml;
import org.tomlj.TomlInvalidTypeException;
import org.tomlj.TomlParseResult;

/**
 * TOML-backed store for {@link WorkspaceConfig}. Environment variables take precedence over the
 * file.
 */
public final class ConfigStore {
    public static final String CONFIG_PATH_ENV = "NBSOURCE_CONFIG";
    public static final String HOST_ENV = "DATABRICKS_HOST";
    public static final String TOKEN_ENV = "DATABRICKS_TOKEN";
    static final String HOST_KEY = "host";
    static final String TOKEN_KEY = "token";

    private final Path file;
    private final Map<String, String> env;

    public ConfigStore(Path file, Map<String, String> env) {
        this.file = Objects.requireNonNull(file, "file").toAbsolutePath().normalize();
        this.env = Map.copyOf(Objects.requireNonNull(env, "env"));
    }

    /**
     * {@code $NBSOURCE_CONFIG} when set, otherwise {@code ~/.nbsource/config.toml}.
     */
    public static Path defaultLocation(Map<String, String> env) {
        String fromEnv = env.get(CONFIG_PATH_ENV);
        if (fromEnv != null && !fromEnv.isBlank()) {
            return Path.of(fromEnv);
        }
        return Path.of(System.getProperty("user.home"), ".nbsource", "config.toml");
    }

    public Path file() {
        return file;
    }

    public WorkspaceConfig load() {
        TomlParseResult toml = Files.exists(file) ? parse() : null;
        return new WorkspaceConfig(
            envValue(HOST_ENV).or(() -> toml == null ? Optional.<String>empty() : readString(toml, HOST_KEY)),
            envValue(TOKEN_ENV).or(() -> toml == null ? Optional.<String>empty() : readString(toml, TOKEN_KEY)),
            file
        );
    }

    /**
     * Writes the given values, keeping file values for absent arguments. Environment overrides are
     * not persisted.
     */
    public WorkspaceConfig save(Optional<String> host, Optional<String> token) throws IOException {
        TomlParseResult current = Files.exists(file) ? parse() : null;
        Optional<String> newHost = nonBlank(host)
            .or(() -> current == null ? Optional.<String>empty() : readString(current, HOST_KEY));
        Optional<String> newToken = nonBlank(token)
            .or(() -> current == null ? Optional.<String>empty() : readString(current, TOKEN_KEY));

        StringBuilder content = new StringBuilder();
        newHost.ifPresent(value -> appendEntry(content, HOST_KEY, value));
        newToken.ifPresent(value -> appendEntry(content, TOKEN_KEY, value));
        Path parent = file.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(file, content.toString(), StandardCharsets.UTF_8);
        return load();
    }

    private TomlParseResult parse() {
        TomlParseResult result;
        try {
            result = Toml.parse(file);
        } catch (IOException ex) {
            throw new IllegalStateException("Unable to read config: " + file, ex);
        }
        if (result.hasErrors()) {
            throw new IllegalStateException("config parse error in " + file + ": " + result.errors().get(0).toString());
        }
        return result;
    }

    private Optional<String> readString(TomlParseResult toml, String key) {
        try {
            return nonBlank(Optional.ofNullable(toml.getString(key)));
        } catch (TomlInvalidTypeException ex) {
            throw new IllegalStateException("config key '" + key + "' must be a string in " + file, ex);
        }
    }

    private Optional<String> envValue(String name) {
        return nonBlank(Optional.ofNullable(env.get(name)));
    }

    private static Optional<String> nonBlank(Optional<String> value) {
        return value.map(String::trim).filter(str -> !str.isEmpty());
    }

    private static void appendEntry(StringBuilder content, String key, String value) {
        content.append(key).append(" = \"").append(Toml.tomlEscape(value)).append("\"\n");
    }
}
