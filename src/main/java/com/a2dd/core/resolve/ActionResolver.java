package com.a2dd.core.resolve;

import com.a2dd.core.conversion.AmbiguousActionException;
import com.a2dd.core.conversion.NoActionException;
import com.a2dd.core.conversion.UnsupportedConstructException;
import com.a2dd.core.model.TaskNode;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Determines the module a task invokes and rewrites the task into one canonical shape.
 * <p>
 * Supported declaration styles:
 * <ul>
 *   <li>{@code copy: {src: a, dest: b}} and {@code copy: src=a dest=b}</li>
 *   <li>{@code action: copy src=a dest=b} and {@code local_action: ...}</li>
 *   <li>{@code action: {module: copy, args: {src: a}}}</li>
 *   <li>collection-qualified names such as {@code ansible.builtin.copy}</li>
 * </ul>
 * Qualified names are reduced to their last segment. This assumes short module names are
 * unique across all collections used by the converted content.
 */
@Service
public class ActionResolver {

    public ResolvedAction resolve(TaskNode task) {
        TaskNode node = task;
        String action;
        String actionKey = actionKeyOf(node);
        if (actionKey != null) {
            node = unwrapActionKey(node, actionKey);
            action = moduleName(node.get(actionKey), node);
            node = rekeyActionStyle(node, actionKey, action);
        } else {
            action = findModuleKey(node);
        }

        if (action.contains(".")) {
            String shortName = action.substring(action.lastIndexOf('.') + 1);
            node = rekey(node, action, shortName);
            action = shortName;
        }

        if (Keywords.isStructural(action)) {
            throw new UnsupportedConstructException("Can not parse module " + action
                    + " as a task, it is a task list construct");
        }

        Object value = node.get(action);
        if (value instanceof String text && !text.contains("\n")
                && !Keywords.FREE_FORM_MODULES.contains(action)) {
            Map<String, Object> parsed;
            try {
                parsed = FreeFormArgs.parse(text);
            } catch (IllegalArgumentException e) {
                throw new UnsupportedConstructException("Can not parse arguments of task " + task, e);
            }
            String key = action;
            node = node.edit(m -> m.put(key, parsed));
        }
        return new ResolvedAction(action, node);
    }

    private static String actionKeyOf(TaskNode node) {
        if (node.has("action")) {
            return "action";
        }
        if (node.has("local_action")) {
            return "local_action";
        }
        return null;
    }

    private static TaskNode unwrapActionKey(TaskNode node, String actionKey) {
        if ("local_action".equals(actionKey) && !node.has("delegate_to")) {
            return node.edit(m -> m.put("delegate_to", "localhost"));
        }
        return node;
    }

    private static String moduleName(Object value, TaskNode node) {
        if (value instanceof Map<?, ?> map) {
            Object module = map.get("module");
            if (module == null) {
                throw new NoActionException("Can't get action from task: " + node);
            }
            return String.valueOf(module);
        }
        if (value instanceof String text && !text.isBlank()) {
            return text.trim().split("\\s+", 2)[0];
        }
        throw new NoActionException("Can't get action from task: " + node);
    }

    /**
     * Moves {@code action: copy src=a} / {@code action: {module: copy, ...}} under the module key.
     */
    private static TaskNode rekeyActionStyle(TaskNode node, String actionKey, String module) {
        Object value = node.get(actionKey);
        Object moduleValue;
        if (value instanceof Map<?, ?> map) {
            var args = new LinkedHashMap<String, Object>();
            map.forEach((k, v) -> {
                if (!"module".equals(k) && !"args".equals(k)) {
                    args.put(String.valueOf(k), v);
                }
            });
            if (map.get("args") instanceof Map<?, ?> nested) {
                nested.forEach((k, v) -> args.put(String.valueOf(k), v));
            }
            moduleValue = args;
        } else {
            String[] parts = String.valueOf(value).trim().split("\\s+", 2);
            moduleValue = parts.length > 1 ? parts[1] : new LinkedHashMap<String, Object>();
        }
        return node.edit(m -> {
            var rebuilt = new LinkedHashMap<String, Object>();
            m.forEach((k, v) -> rebuilt.put(k.equals(actionKey) ? module : k, k.equals(actionKey) ? moduleValue : v));
            m.clear();
            m.putAll(rebuilt);
        });
    }

    private static String findModuleKey(TaskNode node) {
        List<String> candidates = node.keys().stream()
                .filter(k -> !Keywords.TASK.contains(k))
                .filter(k -> !Keywords.isLoopKey(k))
                .toList();
        if (candidates.size() > 1) {
            throw new AmbiguousActionException("Task has more than one action " + candidates + ": " + node);
        }
        if (candidates.isEmpty()) {
            throw new NoActionException("Can't get action from task: " + node);
        }
        return candidates.get(0);
    }

    private static TaskNode rekey(TaskNode node, String from, String to) {
        return node.edit(m -> {
            var rebuilt = new LinkedHashMap<String, Object>();
            m.forEach((k, v) -> rebuilt.put(k.equals(from) ? to : k, v));
            m.clear();
            m.putAll(rebuilt);
        });
    }
}
