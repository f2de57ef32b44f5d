package com.a2dd.core.context;

import com.a2dd.core.config.ConverterProperties;
import com.a2dd.core.document.DocumentRenderer;
import com.a2dd.core.document.InlineValues;
import com.a2dd.core.model.ScopeContext;
import com.a2dd.core.model.ScopeKind;
import com.a2dd.core.model.TaskNode;
import com.a2dd.core.resolve.Keywords;
import com.a2dd.core.translate.ModuleArgs;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Collects the attributes each scope carries but the converter does not translate, and
 * composes them into the audit comment attached to emitted directives.
 * <p>
 * Sections are composed outermost first (PLAY, ROLE, INCLUDE/BLOCK in nesting order, TASK).
 * Scopes with nothing to report contribute no section.
 */
@Service
public class ContextAccumulator {

    private static final Set<String> BLOCK_CONSUMED = Set.of(Keywords.BLOCK_KEY);
    private static final Set<String> PLAY_CONSUMED = Set.of(
            "hosts", "roles", "tasks", "pre_tasks", "post_tasks", "pre-tasks", "post-tasks");

    private final DocumentRenderer renderer;
    private final ConverterProperties properties;

    public ContextAccumulator(DocumentRenderer renderer, ConverterProperties properties) {
        this.renderer = renderer;
        this.properties = properties;
    }

    public ScopeContext playContext(TaskNode play) {
        var consumed = new HashSet<>(PLAY_CONSUMED);
        consumed.addAll(properties.getPlayTaskListKeys());
        consumeMaps(play, consumed, "environment", "vars");
        if (ModuleArgs.flag(play.get("gather_facts")).isPresent()) {
            consumed.add("gather_facts");
        }
        return lines(ScopeKind.PLAY, select(play, Keywords.PLAY, consumed));
    }

    public ScopeContext blockContext(TaskNode block) {
        var consumed = new HashSet<>(BLOCK_CONSUMED);
        consumeMaps(block, consumed, "environment");
        return lines(ScopeKind.BLOCK, select(block, Keywords.BLOCK, consumed));
    }

    public ScopeContext includeContext(TaskNode include) {
        var consumed = new HashSet<>(Keywords.INCLUDE_KEYS);
        consumeMaps(include, consumed, "environment");
        var selected = select(include, Keywords.TASK, consumed);
        include.attributes().forEach((k, v) -> {
            if (Keywords.isLoopKey(k)) {
                selected.put(k, v);
            }
        });
        return lines(ScopeKind.INCLUDE, selected);
    }

    /**
     * Roles carry no untranslated attributes of their own yet; the section exists so role
     * conversion composes the same way as the other scopes.
     */
    public ScopeContext roleContext() {
        return ScopeContext.empty(ScopeKind.ROLE);
    }

    /**
     * Task section: the translator's residual attributes dumped as block YAML.
     */
    public ScopeContext taskContext(Map<String, Object> residual) {
        if (residual == null || residual.isEmpty()) {
            return ScopeContext.empty(ScopeKind.TASK);
        }
        String text = ScopeKind.TASK.header() + "\n" + renderer.dumpBlock(residual);
        return new ScopeContext(ScopeKind.TASK, residual, text);
    }

    /**
     * Joins the non-empty sections in the given order.
     *
     * @return the composed comment, or null when every section is empty
     */
    public String compose(List<ScopeContext> outerToInner) {
        var sections = new ArrayList<String>();
        for (ScopeContext context : outerToInner) {
            if (context != null && !context.isEmpty()) {
                sections.add(context.text());
            }
        }
        return sections.isEmpty() ? null : String.join("\n", sections);
    }

    /** Mappings become ENV/ARG directives; any other value stays in the audit context. */
    private static void consumeMaps(TaskNode node, Set<String> consumed, String... keys) {
        for (String key : keys) {
            if (node.get(key) instanceof Map<?, ?>) {
                consumed.add(key);
            }
        }
    }

    private static Map<String, Object> select(TaskNode node, Set<String> allowed, Set<String> consumed) {
        var selected = new LinkedHashMap<String, Object>();
        node.attributes().forEach((k, v) -> {
            if (allowed.contains(k) && !consumed.contains(k)) {
                selected.put(k, v);
            }
        });
        return selected;
    }

    private static ScopeContext lines(ScopeKind kind, Map<String, Object> attributes) {
        if (attributes.isEmpty()) {
            return ScopeContext.empty(kind);
        }
        var text = new StringBuilder(kind.header());
        attributes.forEach((k, v) -> text.append('\n').append(k).append(": ").append(InlineValues.format(v)));
        return new ScopeContext(kind, attributes, text.toString());
    }
}
