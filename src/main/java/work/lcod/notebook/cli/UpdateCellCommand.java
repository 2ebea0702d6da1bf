package work.lcod.notebook.cli;

import java.util.Optional;
import picocli.CommandLine;
import work.lcod.notebook.format.CellLanguage;
import work.lcod.notebook.model.Notebook;

@CommandLine.Command(
    name = "update",
    description = "Replace the content of a cell; --language wraps it in magic markers."
)
final class UpdateCellCommand extends CellMutationCommand {
    @CommandLine.ArgGroup(exclusive = true, multiplicity = "0..1")
    private ContentSource contentSource;

    @CommandLine.Option(names = {"-l", "--language"}, description = "Cell language (python, sql, scala, r, md, sh, fs, run, pip).")
    private String language;

    @Override
    protected String operation() {
        return "update";
    }

    @Override
    protected Notebook apply(Notebook notebook, int index) {
        Optional<CellLanguage> lang = Optional.ofNullable(language).map(CellLanguage::from);
        return notebook.update(index, ContentSource.resolve(contentSource, root()), lang);
    }
}
