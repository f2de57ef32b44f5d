package com.a2dd.core.translate;

import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Closed table from short module name to translation rule. Names missing from the table
 * resolve to the {@link UnsupportedModuleTranslator}.
 */
@Component
public class ModuleTranslatorRegistry {

    private final Map<String, ModuleTranslator> byAction = new HashMap<>();
    private final UnsupportedModuleTranslator fallback;

    public ModuleTranslatorRegistry(List<ModuleTranslator> translators, UnsupportedModuleTranslator fallback) {
        this.fallback = fallback;
        for (ModuleTranslator translator : translators) {
            for (String action : translator.actions()) {
                ModuleTranslator previous = byAction.putIfAbsent(action, translator);
                if (previous != null && previous != translator) {
                    throw new IllegalStateException("Module '" + action + "' is handled by both "
                            + previous.getClass().getSimpleName() + " and "
                            + translator.getClass().getSimpleName());
                }
            }
        }
    }

    /**
     * Registry with every built-in rule, for use outside a Spring context.
     */
    public static ModuleTranslatorRegistry standard() {
        return new ModuleTranslatorRegistry(List.of(
                new ShellTranslator(),
                new SetFactTranslator(),
                new PackageTranslator(),
                new FactsTranslator(),
                new ServiceTranslator(),
                new CopyTranslator(),
                new TemplateTranslator(),
                new FileTranslator()
        ), new UnsupportedModuleTranslator());
    }

    public ModuleTranslator lookup(String action) {
        return byAction.getOrDefault(action, fallback);
    }

    public boolean isSupported(String action) {
        return byAction.containsKey(action);
    }
}
