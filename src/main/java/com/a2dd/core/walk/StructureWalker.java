package com.a2dd.core.walk;

import com.a2dd.core.context.ContextAccumulator;
import com.a2dd.core.context.ScopeChain;
import com.a2dd.core.context.ScopeFrame;
import com.a2dd.core.conversion.UnsupportedConstructException;
import com.a2dd.core.document.DocumentParser;
import com.a2dd.core.document.InlineValues;
import com.a2dd.core.model.Directive;
import com.a2dd.core.model.DirectiveKind;
import com.a2dd.core.model.JobSequence;
import com.a2dd.core.model.ScopeKind;
import com.a2dd.core.model.TaskNode;
import com.a2dd.core.resolve.Keywords;
import com.a2dd.core.translate.TaskTranslator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Flattens a task list into one job sequence.
 * <p>
 * Each entry is a block (nested list sharing control attributes), an include (another task
 * file spliced in place) or a plain task. Blocks and includes first emit one ENV directive per
 * environment entry, then their children, with the scope's audit section attached to every
 * descendant directive. Include files are re-read every time they are referenced.
 */
@Service
public class StructureWalker {

    private static final Logger log = LoggerFactory.getLogger(StructureWalker.class);

    private final TaskTranslator taskTranslator;
    private final ContextAccumulator accumulator;
    private final DocumentParser parser;

    public StructureWalker(TaskTranslator taskTranslator, ContextAccumulator accumulator, DocumentParser parser) {
        this.taskTranslator = taskTranslator;
        this.accumulator = accumulator;
        this.parser = parser;
    }

    public JobSequence walk(List<?> tasks, ScopeChain scope) {
        JobSequence result = JobSequence.empty();
        if (tasks == null) {
            return result;
        }
        for (Object entry : tasks) {
            if (!(entry instanceof Map<?, ?> map)) {
                throw new UnsupportedConstructException("Task list entry is not a mapping: " + entry);
            }
            TaskNode node = TaskNode.of(map);
            if (node.has(Keywords.BLOCK_KEY)) {
                result = result.concat(walkBlock(node, scope));
            } else if (includeKey(node) != null) {
                result = result.concat(walkInclude(node, scope));
            } else {
                result = result.concat(taskTranslator.translate(node, scope));
            }
        }
        return result;
    }

    private JobSequence walkBlock(TaskNode block, ScopeChain scope) {
        JobSequence env = environmentDirectives(block, "block");
        ScopeChain inner = scope.descend(new ScopeFrame(ScopeKind.BLOCK, block, accumulator.blockContext(block)));
        return env.concat(walk(taskList(block.get(Keywords.BLOCK_KEY), "block"), inner));
    }

    private JobSequence walkInclude(TaskNode include, ScopeChain scope) {
        String key = includeKey(include);
        String reference = includeReference(include.get(key));
        if (reference == null) {
            throw new UnsupportedConstructException("Can not get included file from: " + include);
        }
        Path file = scope.resolveInclude(reference);
        ScopeChain inner = scope.enterInclude(file)
                .descend(new ScopeFrame(ScopeKind.INCLUDE, include, accumulator.includeContext(include)));
        log.debug("Including {} via {}", file, key);

        JobSequence env = environmentDirectives(include, "include");
        Object document = parser.parse(file);
        return env.concat(walk(taskList(document, file.toString()), inner));
    }

    private static String includeKey(TaskNode node) {
        for (String key : node.keys()) {
            if (Keywords.INCLUDE_KEYS.contains(key)) {
                return key;
            }
        }
        return null;
    }

    /**
     * {@code include_tasks: file.yml}, {@code include_tasks: {file: file.yml}} or the legacy
     * {@code include: file.yml var=value} form (parameters are ignored).
     */
    private static String includeReference(Object value) {
        if (value instanceof Map<?, ?> map) {
            Object file = map.get("file");
            return file == null ? null : String.valueOf(file);
        }
        if (value instanceof String text && !text.isBlank()) {
            return text.trim().split("\\s+", 2)[0];
        }
        return null;
    }

    private static List<?> taskList(Object value, String origin) {
        if (value == null) {
            return List.of();
        }
        if (value instanceof List<?> list) {
            return list;
        }
        throw new UnsupportedConstructException("Expected a task list in " + origin + " but got: " + value);
    }

    private static JobSequence environmentDirectives(TaskNode node, String scopeLabel) {
        if (!(node.get("environment") instanceof Map<?, ?> env)) {
            return JobSequence.empty();
        }
        var directives = new ArrayList<Directive>();
        env.forEach((k, v) -> directives.add(new Directive(DirectiveKind.ENV,
                k + " " + InlineValues.format(v), "Set " + scopeLabel + " env value for " + k, null)));
        return JobSequence.of(directives);
    }
}
