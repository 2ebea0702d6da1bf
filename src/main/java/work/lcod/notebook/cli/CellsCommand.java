package work.lcod.notebook.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine;

@CommandLine.Command(
    name = "cells",
    description = "List, read and edit individual cells of a notebook source file.",
    subcommands = {
        ListCellsCommand.class,
        GetCellCommand.class,
        UpdateCellCommand.class,
        InsertCellCommand.class,
        DeleteCellCommand.class
    }
)
final class CellsCommand implements Callable<Integer> {
    @CommandLine.ParentCommand
    private NotebookCommand root;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        throw new CommandLine.ParameterException(spec.commandLine(), "A cells subcommand is required.");
    }

    NotebookCommand root() {
        return root;
    }
}
