package work.lcod.notebook.cli;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.notebook.config.ConfigStore;

@CommandLine.Command(
    name = "nbsource",
    description = "Inspect and edit notebook source files cell by cell.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true,
    subcommands = {
        ParseCommand.class,
        RenderCommand.class,
        CellsCommand.class,
        ConfigCommand.class,
        CommandLine.HelpCommand.class
    }
)
final class NotebookCommand implements Callable<Integer> {
    static final String STDIN = "-";

    private final InputStream stdin;
    private final Map<String, String> env;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = "--log-level",
        description = "Diagnostics threshold on stderr (trace|debug|info|warn|error|fatal).",
        defaultValue = "warn"
    )
    private String logLevelRaw;

    @CommandLine.Option(
        names = "--config",
        paramLabel = "PATH",
        description = "Config file (default: $NBSOURCE_CONFIG or ~/.nbsource/config.toml).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String configPath;

    NotebookCommand() {
        this(System.in, System.getenv());
    }

    NotebookCommand(InputStream stdin, Map<String, String> env) {
        this.stdin = Objects.requireNonNull(stdin, "stdin");
        this.env = Map.copyOf(env);
    }

    @Override
    public Integer call() {
        throw new CommandLine.ParameterException(spec.commandLine(), "A subcommand is required.");
    }

    LogLevel logLevel() {
        return LogLevel.from(logLevelRaw);
    }

    void log(LogLevel level, String format, Object... args) {
        if (logLevel().allows(level)) {
            spec.commandLine().getErr().printf(format + "%n", args);
        }
    }

    ConfigStore configStore() {
        Path file = configPath != null && !configPath.isBlank()
            ? Paths.get(configPath)
            : ConfigStore.defaultLocation(env);
        return new ConfigStore(file, env);
    }

    /**
     * Reads a whole file, or stdin when {@code location} is {@code -}.
     */
    String readInput(String location) {
        if (STDIN.equals(location)) {
            try {
                return new String(stdin.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException ex) {
                throw new UncheckedIOException("Unable to read stdin: " + ex.getMessage(), ex);
            }
        }
        Path path = Paths.get(location).toAbsolutePath().normalize();
        if (!Files.isRegularFile(path)) {
            throw new CommandLine.ParameterException(spec.commandLine(), "File not found: " + path);
        }
        try {
            String text = Files.readString(path, StandardCharsets.UTF_8);
            log(LogLevel.DEBUG, "Read %d characters from %s", text.length(), path);
            return text;
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to read " + path + ": " + ex.getMessage(), ex);
        }
    }

    void writeFile(String location, String content) {
        Path path = Paths.get(location).toAbsolutePath().normalize();
        try {
            Files.writeString(path, content, StandardCharsets.UTF_8);
            log(LogLevel.INFO, "Wrote %s", path);
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to write " + path + ": " + ex.getMessage(), ex);
        }
    }
}
