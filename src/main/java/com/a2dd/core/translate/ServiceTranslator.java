package com.a2dd.core.translate;

import com.a2dd.core.conversion.UnsupportedConstructException;
import com.a2dd.core.model.Directive;
import com.a2dd.core.model.DirectiveKind;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * {@code service} / {@code systemd}: one SERVICE directive. Masking and daemon reloads
 * only exist on the systemd modules.
 */
@Component
public class ServiceTranslator implements ModuleTranslator {

    private static final Set<String> SYSTEMD = Set.of("systemd", "systemd_service");

    @Override
    public Set<String> actions() {
        return Set.of("service", "systemd", "systemd_service");
    }

    @Override
    public TranslationResult translate(TranslationRequest request) {
        var parts = new ArrayList<String>();

        String state = request.takeString("state");
        if (state != null) {
            switch (state) {
                case "started", "running" -> { }
                case "stopped" -> parts.add("--stopped");
                case "restarted" -> parts.add("--restarted");
                case "reloaded" -> parts.add("--reloaded");
                default -> throw new UnsupportedConstructException(
                        "Unsupported service state '" + state + "' in task: " + request.original());
            }
        }
        request.takeFlag("enabled").ifPresent(enabled -> parts.add(enabled ? "--enable" : "--disable"));
        boolean daemonReload = false;
        if (SYSTEMD.contains(request.action())) {
            request.takeFlag("masked").ifPresent(masked -> parts.add(masked ? "--mask" : "--unmask"));
            daemonReload = request.takeFlag("daemon_reload").orElse(false);
            if (daemonReload) {
                parts.add("--daemon-reload");
            }
        }

        List<String> names = ModuleArgs.stringList(request.take("name"));
        if (names.isEmpty() && !daemonReload) {
            throw new UnsupportedConstructException("Service task without name: " + request.original());
        }
        parts.addAll(names);
        return new TranslationResult(
                List.of(Directive.of(DirectiveKind.SERVICE, String.join(" ", parts))),
                request.residual());
    }
}
