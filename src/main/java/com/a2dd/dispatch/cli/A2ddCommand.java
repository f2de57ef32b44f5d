package com.a2dd.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for a2dd.
 * Routes to subcommands: convert, inventory.
 */
@Command(
        name = "a2dd",
        mixinStandardHelpOptions = true,
        version = "a2dd 0.1.0",
        description = "Converts Ansible playbooks, task files and roles to DirectorD orchestrations",
        subcommands = {
                ConvertCommand.class,
                InventoryCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class A2ddCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
