package com.a2dd.core.assemble;

import com.a2dd.core.config.ConverterProperties;
import com.a2dd.core.context.ContextAccumulator;
import com.a2dd.core.context.ScopeChain;
import com.a2dd.core.context.ScopeFrame;
import com.a2dd.core.conversion.UnsupportedConstructException;
import com.a2dd.core.document.DocumentParser;
import com.a2dd.core.model.Directive;
import com.a2dd.core.model.DirectiveKind;
import com.a2dd.core.model.JobSequence;
import com.a2dd.core.model.ScopeKind;
import com.a2dd.core.model.TaskNode;
import com.a2dd.core.translate.SetFactTranslator;
import com.a2dd.core.walk.StructureWalker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Converts a role directory: ARG directives for {@code defaults/} then {@code vars/}, followed
 * by every task file under {@code tasks/}. Includes inside a task file resolve against that
 * file's directory.
 */
@Service
public class RoleAssembler {

    private static final Logger log = LoggerFactory.getLogger(RoleAssembler.class);

    private final StructureWalker walker;
    private final ContextAccumulator accumulator;
    private final DocumentParser parser;
    private final ConverterProperties properties;

    public RoleAssembler(StructureWalker walker, ContextAccumulator accumulator,
                         DocumentParser parser, ConverterProperties properties) {
        this.walker = walker;
        this.accumulator = accumulator;
        this.parser = parser;
        this.properties = properties;
    }

    public JobSequence assemble(Path roleDir) {
        if (!Files.isDirectory(roleDir)) {
            throw new UnsupportedConstructException("Role path is not a directory: " + roleDir);
        }
        JobSequence jobs = variables(roleDir.resolve("defaults"), "default")
                .concat(variables(roleDir.resolve("vars"), "var"));

        TaskNode role = TaskNode.of(Map.of("role", String.valueOf(roleDir.getFileName())));
        var frame = new ScopeFrame(ScopeKind.ROLE, role, accumulator.roleContext());
        for (Path file : yamlFiles(roleDir.resolve("tasks"))) {
            Object document = parser.parse(file);
            if (document == null) {
                continue;
            }
            if (!(document instanceof List<?> tasks)) {
                throw new UnsupportedConstructException("Role task file is not a task list: " + file);
            }
            log.debug("Converting role task file {}", file);
            ScopeChain scope = ScopeChain.root(file.getParent()).enterInclude(file).descend(frame);
            jobs = jobs.concat(walker.walk(tasks, scope));
        }
        return jobs;
    }

    private JobSequence variables(Path dir, String label) {
        var directives = new ArrayList<Directive>();
        for (Path file : yamlFiles(dir)) {
            Object document = parser.parse(file);
            if (document == null) {
                continue;
            }
            if (!(document instanceof Map<?, ?> vars)) {
                throw new UnsupportedConstructException("Role variable file is not a mapping: " + file);
            }
            vars.forEach((k, v) -> directives.add(new Directive(DirectiveKind.ARG,
                    SetFactTranslator.argPayload(String.valueOf(k), v),
                    "Set role " + label + " value for " + k, null)));
        }
        return JobSequence.of(directives);
    }

    List<Path> yamlFiles(Path dir) {
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            Stream<Path> files = walk
                    .filter(Files::isRegularFile)
                    .filter(p -> properties.isYamlFile(p.getFileName().toString()));
            if (properties.isSortDirectoryEntries()) {
                files = files.sorted();
            }
            return files.toList();
        } catch (IOException e) {
            throw new UnsupportedConstructException("Failed to list role directory " + dir, e);
        }
    }
}
