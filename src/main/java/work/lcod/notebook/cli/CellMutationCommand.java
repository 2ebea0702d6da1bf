package work.lcod.notebook.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.notebook.api.NotebookSource;
import work.lcod.notebook.model.Notebook;

/**
 * Shared flow of the editing subcommands: parse FILE, apply one mutation, write the notebook back
 * (or print it with {@code --stdout}) and report a JSON summary. The header is kept only when FILE
 * had one.
 */
abstract class CellMutationCommand implements Callable<Integer> {
    private static final ObjectWriter JSON_WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    @CommandLine.ParentCommand
    private CellsCommand cells;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", paramLabel = "FILE|-", description = "Notebook source file.")
    private String file;

    @CommandLine.Parameters(index = "1", paramLabel = "INDEX", description = "Zero-based cell index.")
    private int index;

    @CommandLine.Option(names = "--stdout", description = "Print the edited notebook instead of rewriting FILE.")
    private boolean toStdout;

    protected abstract String operation();

    protected abstract Notebook apply(Notebook notebook, int index);

    @Override
    public Integer call() throws JsonProcessingException {
        NotebookCommand root = cells.root();
        String text = root.readInput(file);
        Notebook before = NotebookSource.parse(text);
        Notebook after = apply(before, index);
        String source = NotebookSource.serialize(after, NotebookSource.hasHeader(text));
        var out = spec.commandLine().getOut();
        if (toStdout || NotebookCommand.STDIN.equals(file)) {
            out.println(source);
        } else {
            root.writeFile(file, source + "\n");
            Map<String, Object> summary = new LinkedHashMap<>();
            summary.put("file", file);
            summary.put("operation", operation());
            summary.put("index", index);
            summary.put("cells", after.size());
            out.println(JSON_WRITER.writeValueAsString(summary));
        }
        root.log(LogLevel.DEBUG, "%s cell %d: %d -> %d cell(s)", operation(), index, before.size(), after.size());
        out.flush();
        return 0;
    }

    protected NotebookCommand root() {
        return cells.root();
    }
}
