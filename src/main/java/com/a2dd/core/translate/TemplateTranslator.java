package com.a2dd.core.translate;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;

/**
 * {@code template}: always a staged COPY with {@code --blueprint}, the rendering happens
 * on the staging side.
 */
@Component
public class TemplateTranslator extends FilePlacementTranslator {

    @Override
    public Set<String> actions() {
        return Set.of("template");
    }

    @Override
    protected List<String> copyFlags() {
        return List.of("--blueprint");
    }

    @Override
    protected boolean isRemoteCopy(TranslationRequest request) {
        return false;
    }
}
