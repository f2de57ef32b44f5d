package com.a2dd.core.model;

/**
 * Nesting levels that contribute an audit section to directive comments.
 */
public enum ScopeKind {
    PLAY,
    ROLE,
    INCLUDE,
    BLOCK,
    TASK;

    public String header() {
        return "## " + name() + "-CONTEXT:";
    }
}
