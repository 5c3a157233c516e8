package org.procsim.cli.commands;

import java.util.concurrent.Callable;

import org.procsim.cli.CommandLineInterface;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.ParentCommand;

@Command(
    name = "node",
    description = "Run and manage the simulation node",
    subcommands = {
        NodeRunCommand.class
    }
)
public class NodeCommand implements Callable<Integer> {

    @ParentCommand
    private CommandLineInterface parent;

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }

    public CommandLineInterface getParent() {
        return parent;
    }
}
