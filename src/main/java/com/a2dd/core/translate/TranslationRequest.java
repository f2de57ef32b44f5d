package com.a2dd.core.translate;

import com.a2dd.core.context.ScopeChain;
import com.a2dd.core.model.TaskNode;
import com.a2dd.core.resolve.ResolvedAction;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Input handed to a {@link ModuleTranslator}.
 * <p>
 * Module arguments and sibling attributes are private mutable copies. Translators remove
 * what they consume; whatever is left becomes the task's audit context.
 */
public final class TranslationRequest {

    private final String action;
    private final TaskNode task;
    private final TaskNode original;
    private final Object moduleValue;
    private final Map<String, Object> moduleArgs;
    private final Map<String, Object> siblings;
    private final ScopeChain scope;

    public TranslationRequest(String action, TaskNode task, TaskNode original, ScopeChain scope) {
        this.action = action;
        this.task = task;
        this.original = original;
        this.scope = scope;
        this.moduleValue = task.get(action);
        this.moduleArgs = new LinkedHashMap<>();
        if (moduleValue instanceof Map<?, ?> map) {
            map.forEach((k, v) -> moduleArgs.put(String.valueOf(k), v));
        }
        this.siblings = new LinkedHashMap<>();
        task.attributes().forEach((k, v) -> {
            if (!k.equals(action) && !k.equals("name")) {
                siblings.put(k, v);
            }
        });
    }

    public static TranslationRequest of(ResolvedAction resolved, TaskNode original, ScopeChain scope) {
        return new TranslationRequest(resolved.action(), resolved.node(), original, scope);
    }

    public String action() {
        return action;
    }

    public TaskNode task() {
        return task;
    }

    public TaskNode original() {
        return original;
    }

    /** The raw value under the module key: a mapping, or free-form text for command-like modules. */
    public Object moduleValue() {
        return moduleValue;
    }

    public ScopeChain scope() {
        return scope;
    }

    public boolean hasArg(String key) {
        return moduleArgs.containsKey(key);
    }

    /** Removes and returns a module argument. */
    public Object take(String key) {
        return moduleArgs.remove(key);
    }

    public String takeString(String key) {
        Object value = moduleArgs.remove(key);
        return value == null ? null : String.valueOf(value);
    }

    /**
     * Removes and returns a boolean module argument. A value that is not a plain boolean stays
     * in the arguments so it is reported in the audit context.
     */
    public Optional<Boolean> takeFlag(String key) {
        Optional<Boolean> flag = ModuleArgs.flag(moduleArgs.get(key));
        if (flag.isPresent()) {
            moduleArgs.remove(key);
        }
        return flag;
    }

    public Map<String, Object> remainingArgs() {
        return moduleArgs;
    }

    /** Removes and returns a sibling task attribute such as {@code environment} or {@code args}. */
    public Object takeSibling(String key) {
        return siblings.remove(key);
    }

    public void putSibling(String key, Object value) {
        siblings.put(key, value);
    }

    /**
     * Attributes nobody consumed: remaining siblings, plus leftover module arguments
     * under the module key.
     */
    public Map<String, Object> residual() {
        var residual = new LinkedHashMap<String, Object>(siblings);
        if (!moduleArgs.isEmpty()) {
            residual.put(action, new LinkedHashMap<>(moduleArgs));
        }
        return residual;
    }
}
