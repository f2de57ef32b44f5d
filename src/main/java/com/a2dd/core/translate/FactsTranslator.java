package com.a2dd.core.translate;

import com.a2dd.core.model.Directive;
import com.a2dd.core.model.DirectiveKind;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;

/**
 * {@code setup} / {@code gather_facts}: FACTER gathers everything, so filters stay in the audit context.
 */
@Component
public class FactsTranslator implements ModuleTranslator {

    @Override
    public Set<String> actions() {
        return Set.of("setup", "gather_facts");
    }

    @Override
    public TranslationResult translate(TranslationRequest request) {
        return new TranslationResult(List.of(Directive.of(DirectiveKind.FACTER, "")), request.residual());
    }
}
