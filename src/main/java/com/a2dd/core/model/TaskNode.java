package com.a2dd.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Immutable, insertion-ordered view of one task mapping loaded from a source document.
 * <p>
 * Rewrites go through {@link #edit(Consumer)}, which works on a private copy and never
 * touches the map the node was created from.
 */
public final class TaskNode {

    private final Map<String, Object> attributes;

    private TaskNode(Map<String, Object> attributes) {
        this.attributes = Collections.unmodifiableMap(attributes);
    }

    public static TaskNode of(Map<?, ?> source) {
        var copy = new LinkedHashMap<String, Object>();
        if (source != null) {
            source.forEach((k, v) -> copy.put(String.valueOf(k), v));
        }
        return new TaskNode(copy);
    }

    public TaskNode edit(Consumer<Map<String, Object>> editor) {
        var copy = new LinkedHashMap<>(attributes);
        editor.accept(copy);
        return new TaskNode(copy);
    }

    public Map<String, Object> attributes() {
        return attributes;
    }

    public Set<String> keys() {
        return attributes.keySet();
    }

    public boolean has(String key) {
        return attributes.containsKey(key);
    }

    public Object get(String key) {
        return attributes.get(key);
    }

    public String name() {
        Object name = attributes.get("name");
        return name == null ? null : String.valueOf(name);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof TaskNode other && attributes.equals(other.attributes);
    }

    @Override
    public int hashCode() {
        return attributes.hashCode();
    }

    @Override
    public String toString() {
        return attributes.toString();
    }
}
