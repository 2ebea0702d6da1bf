package work.lcod.notebook.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.notebook.api.NotebookSource;
import work.lcod.notebook.format.CellLanguage;
import work.lcod.notebook.model.Cell;
import work.lcod.notebook.model.Notebook;

@CommandLine.Command(name = "list", description = "Print index, language and first line of every cell.")
final class ListCellsCommand implements Callable<Integer> {
    private static final int SUMMARY_WIDTH = 60;

    @CommandLine.ParentCommand
    private CellsCommand cells;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", paramLabel = "FILE|-", description = "Notebook source file.")
    private String file;

    @Override
    public Integer call() {
        Notebook notebook = NotebookSource.parse(cells.root().readInput(file));
        var out = spec.commandLine().getOut();
        for (Cell cell : notebook.cells()) {
            String language = cell.language().map(CellLanguage::token).orElse("-");
            out.printf("%d\t%s\t%s%n", cell.index(), language, summary(cell.content()));
        }
        out.flush();
        return 0;
    }

    static String summary(String content) {
        int newline = content.indexOf('\n');
        String first = (newline == -1 ? content : content.substring(0, newline)).strip();
        return first.length() <= SUMMARY_WIDTH ? first : first.substring(0, SUMMARY_WIDTH - 3) + "...";
    }
}
