package com.a2dd.core.resolve;

import com.a2dd.core.model.TaskNode;

/**
 * Outcome of action resolution.
 *
 * @param action short module name, e.g. {@code copy}
 * @param node   normalized task: the module key is {@code action} and its value is a mapping
 *               unless the module takes free-form text
 */
public record ResolvedAction(String action, TaskNode node) {

    public Object moduleValue() {
        return node.get(action);
    }
}
