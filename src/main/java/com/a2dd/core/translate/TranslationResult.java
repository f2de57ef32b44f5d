package com.a2dd.core.translate;

import com.a2dd.core.model.Directive;

import java.util.List;
import java.util.Map;

/**
 * @param directives emitted directives, unnamed and uncommented
 * @param residual   attributes left for the task's audit context
 */
public record TranslationResult(List<Directive> directives, Map<String, Object> residual) {

    public TranslationResult {
        directives = List.copyOf(directives);
        residual = residual == null ? Map.of() : residual;
    }
}
