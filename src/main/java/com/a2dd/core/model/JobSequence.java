package com.a2dd.core.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Ordered, immutable list of directives. Sequences only ever grow by concatenation.
 */
public record JobSequence(List<Directive> directives) {

    private static final JobSequence EMPTY = new JobSequence(List.of());

    public JobSequence {
        directives = directives == null ? List.of() : List.copyOf(directives);
    }

    public static JobSequence empty() {
        return EMPTY;
    }

    public static JobSequence of(Directive... directives) {
        return new JobSequence(List.of(directives));
    }

    public static JobSequence of(Collection<Directive> directives) {
        return new JobSequence(List.copyOf(directives));
    }

    public JobSequence concat(JobSequence other) {
        if (other == null || other.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return other;
        }
        var joined = new ArrayList<Directive>(directives.size() + other.size());
        joined.addAll(directives);
        joined.addAll(other.directives);
        return new JobSequence(joined);
    }

    public int size() {
        return directives.size();
    }

    public boolean isEmpty() {
        return directives.isEmpty();
    }

    public Directive get(int index) {
        return directives.get(index);
    }

    public long count(DirectiveKind kind) {
        return directives.stream().filter(d -> d.kind() == kind).count();
    }
}
