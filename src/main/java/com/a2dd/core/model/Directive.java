package com.a2dd.core.model;

import java.util.Objects;

/**
 * A single emitted DirectorD instruction.
 *
 * @param kind    directive keyword, e.g. RUN or COPY
 * @param payload directive argument string (may be empty, never null)
 * @param name    display name written under the NAME key
 * @param comment audit comment placed before the directive, or null
 */
public record Directive(
    DirectiveKind kind,
    String payload,
    String name,
    String comment
) {

    public Directive {
        Objects.requireNonNull(kind, "kind");
        payload = payload == null ? "" : payload;
    }

    public static Directive of(DirectiveKind kind, String payload) {
        return new Directive(kind, payload, null, null);
    }

    public Directive withName(String newName) {
        return new Directive(kind, payload, newName, comment);
    }

    public Directive withComment(String newComment) {
        return new Directive(kind, payload, name, newComment);
    }

    public boolean hasComment() {
        return comment != null && !comment.isBlank();
    }
}
