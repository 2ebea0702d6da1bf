package work.lcod.notebook.cli;

import picocli.CommandLine;

/**
 * Mutually exclusive ways of passing new cell content.
 */
final class ContentSource {
    @CommandLine.Option(names = {"-c", "--content"}, paramLabel = "TEXT", description = "Cell content.")
    private String content;

    @CommandLine.Option(
        names = {"-f", "--content-file"},
        paramLabel = "PATH|-",
        description = "Read cell content from a file ('-' for stdin)."
    )
    private String contentFile;

    /**
     * Returns {@code null} when neither option was given.
     */
    static String resolve(ContentSource source, NotebookCommand root) {
        if (source == null) {
            return null;
        }
        if (source.content != null) {
            return source.content;
        }
        if (source.contentFile != null) {
            return root.readInput(source.contentFile);
        }
        return null;
    }
}
