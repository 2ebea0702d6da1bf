package work.lcod.notebook.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.notebook.api.NotebookSource;
import work.lcod.notebook.json.NotebookJsonCodec;
import work.lcod.notebook.model.Notebook;

@CommandLine.Command(
    name = "parse",
    description = "Parse notebook source and print its cells as JSON or YAML."
)
final class ParseCommand implements Callable<Integer> {
    @CommandLine.ParentCommand
    private NotebookCommand root;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", paramLabel = "FILE|-", description = "Notebook source file.")
    private String file;

    @CommandLine.Option(
        names = {"-o", "--output"},
        description = "Document format (json|yaml).",
        defaultValue = "json"
    )
    private String outputRaw;

    @Override
    public Integer call() {
        OutputFormat format = OutputFormat.from(outputRaw);
        Notebook notebook = NotebookSource.parse(root.readInput(file));
        root.log(LogLevel.DEBUG, "Parsed %d cell(s)", notebook.size());
        var out = spec.commandLine().getOut();
        if (format == OutputFormat.YAML) {
            out.print(NotebookJsonCodec.toYaml(notebook));
        } else {
            out.println(NotebookJsonCodec.toJson(notebook));
        }
        out.flush();
        return 0;
    }
}
