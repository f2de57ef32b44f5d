package com.a2dd.core.assemble;

import com.a2dd.core.config.ConverterProperties;
import com.a2dd.core.context.ContextAccumulator;
import com.a2dd.core.context.ScopeChain;
import com.a2dd.core.context.ScopeFrame;
import com.a2dd.core.conversion.UnsupportedConstructException;
import com.a2dd.core.document.InlineValues;
import com.a2dd.core.model.Directive;
import com.a2dd.core.model.DirectiveKind;
import com.a2dd.core.model.JobSequence;
import com.a2dd.core.model.PlayDescriptor;
import com.a2dd.core.model.ScopeKind;
import com.a2dd.core.model.TaskNode;
import com.a2dd.core.translate.ModuleArgs;
import com.a2dd.core.translate.SetFactTranslator;
import com.a2dd.core.walk.StructureWalker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Converts one play: environment exports, play variables and fact gathering first, then the
 * play's task lists in document order.
 * <p>
 * Task-list keys are matched against {@code a2dd.play-task-list-keys}. The default keeps the
 * hyphenated {@code pre-tasks}/{@code post-tasks} spellings, so the usual underscore keys are
 * skipped with a warning rather than converted.
 */
@Service
public class PlayAssembler {

    private static final Logger log = LoggerFactory.getLogger(PlayAssembler.class);

    private static final Set<String> KNOWN_TASK_LIST_KEYS = Set.of(
            "tasks", "pre_tasks", "post_tasks", "pre-tasks", "post-tasks");

    private final StructureWalker walker;
    private final ContextAccumulator accumulator;
    private final ConverterProperties properties;

    public PlayAssembler(StructureWalker walker, ContextAccumulator accumulator, ConverterProperties properties) {
        this.walker = walker;
        this.accumulator = accumulator;
        this.properties = properties;
    }

    public PlayDescriptor assemble(TaskNode play, ScopeChain root) {
        if (play.has("roles")) {
            throw new UnsupportedConstructException("Roles are not supported yet! Convert each role with --role");
        }

        var setup = new ArrayList<Directive>();
        if (play.get("environment") instanceof Map<?, ?> env) {
            env.forEach((k, v) -> setup.add(new Directive(DirectiveKind.ENV,
                    k + " " + InlineValues.format(v), "Set playbook env value for " + k, null)));
        }
        if (play.get("vars") instanceof Map<?, ?> vars) {
            vars.forEach((k, v) -> setup.add(new Directive(DirectiveKind.ARG,
                    SetFactTranslator.argPayload(String.valueOf(k), v), "Set playbook var value for " + k, null)));
        }
        if (ModuleArgs.flag(play.get("gather_facts")).orElse(false)) {
            setup.add(new Directive(DirectiveKind.FACTER, "", "Gather facts for playbook", null));
        }

        ScopeChain scope = root.descend(new ScopeFrame(ScopeKind.PLAY, play, accumulator.playContext(play)));
        List<String> taskListKeys = properties.getPlayTaskListKeys();
        JobSequence jobs = JobSequence.of(setup);
        for (String key : play.keys()) {
            if (taskListKeys.contains(key)) {
                if (!(play.get(key) instanceof List<?> tasks)) {
                    throw new UnsupportedConstructException("Play key '" + key + "' is not a task list");
                }
                jobs = jobs.concat(walker.walk(tasks, scope));
            } else if (KNOWN_TASK_LIST_KEYS.contains(key)) {
                log.warn("Play key '{}' is not one of the configured task list keys {} and is not converted",
                        key, taskListKeys);
            }
        }

        Object hosts = play.get("hosts");
        Object targets = "all".equals(hosts) ? null : hosts;
        return new PlayDescriptor(targets, jobs);
    }
}
