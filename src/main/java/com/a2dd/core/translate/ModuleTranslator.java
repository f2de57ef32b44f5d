package com.a2dd.core.translate;

import java.util.Set;

/**
 * Translation rule for one family of modules.
 */
public interface ModuleTranslator {

    /** Short module names this rule handles. */
    Set<String> actions();

    TranslationResult translate(TranslationRequest request);
}
