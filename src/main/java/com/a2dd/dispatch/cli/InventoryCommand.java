package com.a2dd.dispatch.cli;

import com.a2dd.core.inventory.ActionInventory;
import com.a2dd.core.inventory.InventoryReport;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: a2dd inventory [-m &lt;module&gt;] &lt;paths...&gt;
 * <p>
 * Counts module usage across files and directories, or lists the options one module is
 * called with.
 */
@Command(name = "inventory", mixinStandardHelpOptions = true,
        description = "Count Ansible module usage across files and directories")
@Component
public class InventoryCommand implements Callable<Integer> {

    @Parameters(arity = "1..*", description = "Files or directories to scan")
    private List<Path> paths;

    @Option(names = {"--module", "-m"}, description = "List the options used with this module instead of counting modules")
    private String module;

    @Option(names = {"--output", "-o"}, description = "Write the report to this file instead of stdout")
    private Path output;

    private final ActionInventory inventory;

    public InventoryCommand(ActionInventory inventory) {
        this.inventory = inventory;
    }

    @Override
    public Integer call() {
        List<String> lines;
        if (module != null) {
            lines = new ArrayList<>(inventory.collectOptions(paths, module));
        } else {
            InventoryReport report = inventory.countActions(paths);
            lines = report.lines();
            if (report.errors() > 0) {
                ConsoleOutput.info(report.errors() + " task(s) or file(s) could not be read, see log");
            }
        }

        String text = String.join("\n", lines);
        if (output == null) {
            System.out.println(text);
            return 0;
        }
        try {
            Files.writeString(output, text + "\n");
        } catch (IOException e) {
            ConsoleOutput.error("Failed to write " + output + ": " + e.getMessage());
            return 1;
        }
        return 0;
    }
}
