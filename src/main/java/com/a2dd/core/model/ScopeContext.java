package com.a2dd.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Untranslated attributes of one nesting level, together with their rendered audit section.
 *
 * @param kind       scope level the attributes were taken from
 * @param attributes attributes in source order
 * @param text       rendered section (header plus lines), empty when there is nothing to report
 */
public record ScopeContext(
    ScopeKind kind,
    Map<String, Object> attributes,
    String text
) {

    public ScopeContext {
        attributes = attributes == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        text = text == null ? "" : text;
    }

    public static ScopeContext empty(ScopeKind kind) {
        return new ScopeContext(kind, Map.of(), "");
    }

    public boolean isEmpty() {
        return text.isEmpty();
    }
}
