package com.a2dd.core.translate;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;

/**
 * {@code copy}: staged COPY, or a plain {@code cp} on the target when {@code remote_src} is set.
 */
@Component
public class CopyTranslator extends FilePlacementTranslator {

    @Override
    public Set<String> actions() {
        return Set.of("copy");
    }

    @Override
    protected List<String> copyFlags() {
        return List.of();
    }

    @Override
    protected boolean isRemoteCopy(TranslationRequest request) {
        return request.takeFlag("remote_src").orElse(false);
    }
}
