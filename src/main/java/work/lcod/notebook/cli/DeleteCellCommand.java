package work.lcod.notebook.cli;

import picocli.CommandLine;
import work.lcod.notebook.model.Notebook;

@CommandLine.Command(name = "delete", description = "Remove a cell; later cells shift down.")
final class DeleteCellCommand extends CellMutationCommand {
    @Override
    protected String operation() {
        return "delete";
    }

    @Override
    protected Notebook apply(Notebook notebook, int index) {
        return notebook.delete(index);
    }
}
