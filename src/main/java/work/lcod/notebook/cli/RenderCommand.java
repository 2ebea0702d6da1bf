package work.lcod.notebook.cli;

import java.util.Locale;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.notebook.api.NotebookSource;
import work.lcod.notebook.json.NotebookJsonCodec;
import work.lcod.notebook.model.Notebook;

@CommandLine.Command(
    name = "render",
    description = "Render a JSON (or YAML) cell document back to notebook source."
)
final class RenderCommand implements Callable<Integer> {
    @CommandLine.ParentCommand
    private NotebookCommand root;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", paramLabel = "FILE|-", description = "Cell document.")
    private String file;

    @CommandLine.Option(
        names = "--input-format",
        description = "Document format (json|yaml; default: from the file extension).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String inputFormatRaw;

    @CommandLine.Option(names = "--no-header", description = "Omit the notebook source header line.")
    private boolean noHeader;

    @Override
    public Integer call() {
        OutputFormat format = inputFormatRaw != null
            ? OutputFormat.from(inputFormatRaw)
            : OutputFormat.forPath(file);
        String document = root.readInput(file);
        Notebook notebook = format == OutputFormat.YAML
            ? NotebookJsonCodec.fromYaml(document)
            : NotebookJsonCodec.fromJson(document);
        root.log(LogLevel.DEBUG, "Decoded %d cell(s) from %s document", notebook.size(), format.name().toLowerCase(Locale.ROOT));
        var out = spec.commandLine().getOut();
        out.println(NotebookSource.serialize(notebook, !noHeader));
        out.flush();
        return 0;
    }
}
