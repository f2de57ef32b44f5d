package com.a2dd.dispatch.cli;

import com.a2dd.core.conversion.ConversionException;
import com.a2dd.core.conversion.ConversionService;
import com.a2dd.core.model.PlayDescriptor;
import org.springframework.stereotype.Component;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: a2dd convert (-f &lt;file&gt; | -r &lt;role-dir&gt;) [-o &lt;output&gt;]
 * <p>
 * Converts a playbook, task file or variable file, or a whole role directory, and prints
 * the DirectorD document. Any conversion error aborts with exit code 1 and no output.
 */
@Command(name = "convert", mixinStandardHelpOptions = true,
        description = "Convert an Ansible file or role to a DirectorD orchestration")
@Component
public class ConvertCommand implements Callable<Integer> {

    @ArgGroup(exclusive = true, multiplicity = "1")
    private Source source;

    @Option(names = {"--output", "-o"}, description = "Write the result to this file instead of stdout")
    private Path output;

    private final ConversionService conversionService;

    public ConvertCommand(ConversionService conversionService) {
        this.conversionService = conversionService;
    }

    static class Source {
        @Option(names = {"--file", "-f"}, required = true, description = "Path to Ansible file")
        Path file;

        @Option(names = {"--role", "-r"}, required = true, description = "Path to Ansible role")
        Path role;
    }

    @Override
    public Integer call() {
        String rendered;
        try {
            List<PlayDescriptor> plays = source.file != null
                    ? conversionService.convertFile(source.file)
                    : conversionService.convertRole(source.role);
            rendered = conversionService.render(plays);
        } catch (ConversionException e) {
            ConsoleOutput.error("Conversion failed: " + e.getMessage());
            return 1;
        }

        if (output == null) {
            System.out.print(rendered);
            return 0;
        }
        try {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(output, rendered);
        } catch (IOException e) {
            ConsoleOutput.error("Failed to write " + output + ": " + e.getMessage());
            return 1;
        }
        ConsoleOutput.success("Wrote " + output);
        return 0;
    }
}
