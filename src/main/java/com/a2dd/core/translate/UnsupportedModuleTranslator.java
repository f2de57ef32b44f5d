package com.a2dd.core.translate;

import com.a2dd.core.model.Directive;
import com.a2dd.core.model.DirectiveKind;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;

/**
 * Fallback for modules without a rule: an ECHO naming the module, with the whole original
 * task kept in the audit context so nothing is silently lost.
 */
@Component
public class UnsupportedModuleTranslator implements ModuleTranslator {

    @Override
    public Set<String> actions() {
        return Set.of();
    }

    @Override
    public TranslationResult translate(TranslationRequest request) {
        return new TranslationResult(
                List.of(Directive.of(DirectiveKind.ECHO, message(request.action()))),
                new LinkedHashMap<>(request.original().attributes()));
    }

    static String message(String action) {
        return "Conversion of task module '" + action + "' is not implemented yet!";
    }
}
