package com.a2dd.core.context;

import com.a2dd.core.model.ScopeContext;
import com.a2dd.core.model.ScopeKind;
import com.a2dd.core.model.TaskNode;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One enclosing level (play, role, include or block) of a task being translated.
 *
 * @param kind    scope level
 * @param node    the source mapping of that level
 * @param context untranslated attributes of that level
 */
public record ScopeFrame(ScopeKind kind, TaskNode node, ScopeContext context) {

    /**
     * Environment variables declared on this level, in source order. Empty when the
     * {@code environment} keyword is absent or is not a mapping (e.g. a templated string).
     */
    public Map<String, Object> environment() {
        var env = new LinkedHashMap<String, Object>();
        if (node.get("environment") instanceof Map<?, ?> map) {
            map.forEach((k, v) -> env.put(String.valueOf(k), v));
        }
        return env;
    }
}
