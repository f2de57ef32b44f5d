package com.a2dd.core.translate;

import com.a2dd.core.config.ConverterProperties;
import com.a2dd.core.context.ContextAccumulator;
import com.a2dd.core.context.ScopeChain;
import com.a2dd.core.logging.MdcContext;
import com.a2dd.core.model.Directive;
import com.a2dd.core.model.JobSequence;
import com.a2dd.core.model.ScopeContext;
import com.a2dd.core.model.TaskNode;
import com.a2dd.core.resolve.ActionResolver;
import com.a2dd.core.resolve.ResolvedAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;

/**
 * Converts one plain task: resolve its module, apply the module's rule, then name every
 * emitted directive after the task and attach the composed audit comment.
 */
@Service
public class TaskTranslator {

    private static final Logger log = LoggerFactory.getLogger(TaskTranslator.class);

    private final ActionResolver resolver;
    private final ModuleTranslatorRegistry registry;
    private final ContextAccumulator accumulator;
    private final ConverterProperties properties;

    public TaskTranslator(ActionResolver resolver, ModuleTranslatorRegistry registry,
                          ContextAccumulator accumulator, ConverterProperties properties) {
        this.resolver = resolver;
        this.registry = registry;
        this.accumulator = accumulator;
        this.properties = properties;
    }

    public JobSequence translate(TaskNode task, ScopeChain scope) {
        String name = task.name() != null ? task.name() : properties.getUnnamedTaskName();
        MdcContext.setTask(name);
        try {
            ResolvedAction resolved = resolver.resolve(task);
            if (!registry.isSupported(resolved.action())) {
                log.warn("Module '{}' is not supported, task '{}' becomes an ECHO", resolved.action(), name);
            }
            TranslationResult result = registry.lookup(resolved.action())
                    .translate(TranslationRequest.of(resolved, task, scope));

            var contexts = new ArrayList<ScopeContext>(scope.contexts());
            contexts.add(accumulator.taskContext(result.residual()));
            String comment = accumulator.compose(contexts);

            var directives = new ArrayList<Directive>(result.directives().size());
            for (Directive directive : result.directives()) {
                directives.add(directive.withName(name).withComment(comment));
            }
            log.debug("Task '{}' ({}) produced {} directive(s)", name, resolved.action(), directives.size());
            return JobSequence.of(directives);
        } finally {
            MdcContext.clearTask();
        }
    }
}
