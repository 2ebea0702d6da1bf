package work.lcod.notebook.cli;

import picocli.CommandLine;

/**
 * Reports the jar manifest version, or {@code development} when run from classes.
 */
final class VersionProvider implements CommandLine.IVersionProvider {
    @Override
    public String[] getVersion() {
        String implementationVersion = Main.class.getPackage().getImplementationVersion();
        String version = implementationVersion != null ? implementationVersion : "development";
        return new String[] { "nbsource (java) " + version };
    }
}
