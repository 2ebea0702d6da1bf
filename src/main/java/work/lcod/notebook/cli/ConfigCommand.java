package work.lcod.notebook.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.notebook.config.ConfigStore;
import work.lcod.notebook.config.WorkspaceConfig;

@CommandLine.Command(
    name = "config",
    description = "Show or change the workspace host and access token.",
    subcommands = { ConfigCommand.ShowCommand.class, ConfigCommand.SetCommand.class }
)
final class ConfigCommand implements Callable<Integer> {
    private static final ObjectWriter JSON_WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    @CommandLine.ParentCommand
    private NotebookCommand root;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        throw new CommandLine.ParameterException(spec.commandLine(), "A config subcommand is required.");
    }

    static String describe(WorkspaceConfig config) throws JsonProcessingException {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("file", config.source().toString());
        view.put("host", config.host().orElse(null));
        view.put("token", config.maskedToken().orElse(null));
        view.put("complete", config.isComplete());
        return JSON_WRITER.writeValueAsString(view);
    }

    @CommandLine.Command(name = "show", description = "Print the effective configuration (token masked).")
    static final class ShowCommand implements Callable<Integer> {
        @CommandLine.ParentCommand
        private ConfigCommand config;

        @CommandLine.Spec
        private CommandLine.Model.CommandSpec spec;

        @Override
        public Integer call() throws JsonProcessingException {
            WorkspaceConfig loaded = config.root.configStore().load();
            if (!loaded.isComplete()) {
                config.root.log(LogLevel.WARN, "Workspace configuration is incomplete (%s)", loaded.source());
            }
            spec.commandLine().getOut().println(describe(loaded));
            spec.commandLine().getOut().flush();
            return 0;
        }
    }

    @CommandLine.Command(name = "set", description = "Store the workspace host and/or access token.")
    static final class SetCommand implements Callable<Integer> {
        @CommandLine.ParentCommand
        private ConfigCommand config;

        @CommandLine.Spec
        private CommandLine.Model.CommandSpec spec;

        @CommandLine.Option(names = "--host", paramLabel = "URL", description = "Workspace URL.")
        private String host;

        @CommandLine.Option(names = "--token", paramLabel = "TOKEN", description = "Personal access token.")
        private String token;

        @Override
        public Integer call() throws IOException {
            if (host == null && token == null) {
                throw new CommandLine.ParameterException(spec.commandLine(), "Provide --host and/or --token.");
            }
            ConfigStore store = config.root.configStore();
            WorkspaceConfig saved = store.save(Optional.ofNullable(host), Optional.ofNullable(token));
            config.root.log(LogLevel.INFO, "Saved configuration to %s", store.file());
            spec.commandLine().getOut().println(describe(saved));
            spec.commandLine().getOut().flush();
            return 0;
        }
    }
}
