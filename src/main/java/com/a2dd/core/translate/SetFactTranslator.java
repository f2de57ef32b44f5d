package com.a2dd.core.translate;

import com.a2dd.core.document.InlineValues;
import com.a2dd.core.model.Directive;
import com.a2dd.core.model.DirectiveKind;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Set;

/**
 * {@code set_fact}: one ARG per fact. {@code cacheable} has no DirectorD counterpart and is dropped.
 */
@Component
public class SetFactTranslator implements ModuleTranslator {

    @Override
    public Set<String> actions() {
        return Set.of("set_fact");
    }

    @Override
    public TranslationResult translate(TranslationRequest request) {
        request.take("cacheable");
        var facts = new LinkedHashMap<>(request.remainingArgs());
        request.remainingArgs().clear();

        var directives = new ArrayList<Directive>();
        facts.forEach((k, v) -> directives.add(Directive.of(DirectiveKind.ARG, argPayload(k, v))));
        return new TranslationResult(directives, request.residual());
    }

    public static String argPayload(String key, Object value) {
        return key + " \"" + InlineValues.format(value) + "\"";
    }
}
