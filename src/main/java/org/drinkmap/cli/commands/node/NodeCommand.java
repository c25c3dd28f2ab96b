package org.drinkmap.cli.commands.node;

import org.drinkmap.cli.CommandLineInterface;
import picocli.CommandLine.Command;
import picocli.CommandLine.ParentCommand;

@Command(
    name = "node",
    description = "Manages the DrinkMap node",
    subcommands = {
        NodeRunCommand.class
    }
)
public class NodeCommand {

    @ParentCommand
    private CommandLineInterface parent;

    public CommandLineInterface getParent() {
        return parent;
    }
}
