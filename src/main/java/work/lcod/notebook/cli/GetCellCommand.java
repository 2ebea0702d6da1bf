package work.lcod.notebook.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.notebook.api.NotebookSource;
import work.lcod.notebook.model.Cell;

@CommandLine.Command(name = "get", description = "Print the content of one cell.")
final class GetCellCommand implements Callable<Integer> {
    @CommandLine.ParentCommand
    private CellsCommand cells;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", paramLabel = "FILE|-", description = "Notebook source file.")
    private String file;

    @CommandLine.Parameters(index = "1", paramLabel = "INDEX", description = "Zero-based cell index.")
    private int index;

    @CommandLine.Option(names = "--unwrap", description = "Strip # MAGIC markers and the directive line.")
    private boolean unwrap;

    @Override
    public Integer call() {
        Cell cell = NotebookSource.parse(cells.root().readInput(file)).get(index);
        var out = spec.commandLine().getOut();
        out.println(unwrap ? NotebookSource.unwrap(cell.content()) : cell.content());
        out.flush();
        return 0;
    }
}
