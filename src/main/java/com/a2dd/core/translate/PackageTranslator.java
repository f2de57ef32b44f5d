package com.a2dd.core.translate;

import com.a2dd.core.conversion.UnsupportedConstructException;
import com.a2dd.core.model.Directive;
import com.a2dd.core.model.DirectiveKind;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * {@code dnf} / {@code yum} / {@code package}: a DNF directive, or a full system update
 * for {@code name: "*"} (or {@code ["*"]}) with {@code state: latest}.
 */
@Component
public class PackageTranslator implements ModuleTranslator {

    static final String UPDATE_ALL = "dnf update -y";

    @Override
    public Set<String> actions() {
        return Set.of("dnf", "yum", "package");
    }

    @Override
    public TranslationResult translate(TranslationRequest request) {
        Object name = request.take("name");
        String state = request.hasArg("state") ? request.takeString("state") : "present";
        List<String> excludes = ModuleArgs.stringList(request.take("exclude"));

        if (!request.remainingArgs().isEmpty()) {
            Map.Entry<String, Object> first = request.remainingArgs().entrySet().iterator().next();
            throw new UnsupportedConstructException("Not implemented key in " + request.action()
                    + " task: " + first.getKey() + ": " + first.getValue());
        }
        if (name == null) {
            throw new UnsupportedConstructException("Package task without name: " + request.original());
        }

        List<String> names = ModuleArgs.stringList(name);
        if (names.equals(List.of("*")) && "latest".equals(state)) {
            var command = new StringBuilder(UPDATE_ALL);
            for (String exclude : excludes) {
                command.append(" --exclude ").append(exclude);
            }
            return new TranslationResult(
                    List.of(Directive.of(DirectiveKind.RUN, command.toString())),
                    request.residual());
        }

        var parts = new ArrayList<String>();
        switch (state) {
            case "latest" -> parts.add("--latest");
            case "absent", "removed" -> parts.add("--absent");
            case "present", "installed" -> { }
            default -> throw new UnsupportedConstructException(
                    "Unsupported package state '" + state + "' in task: " + request.original());
        }
        for (String exclude : excludes) {
            parts.add("--exclude \"" + exclude + "\"");
        }
        parts.addAll(names);
        return new TranslationResult(
                List.of(Directive.of(DirectiveKind.DNF, String.join(" ", parts))),
                request.residual());
    }
}
