package com.a2dd.core.translate;

import com.a2dd.core.conversion.UnsupportedConstructException;
import com.a2dd.core.document.InlineValues;
import com.a2dd.core.model.Directive;
import com.a2dd.core.model.DirectiveKind;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * {@code shell} / {@code command}: a single RUN script.
 * <p>
 * The script changes directory first when {@code chdir} is given, then exports the play,
 * block and task environments in that order, then runs the command. A later export of the
 * same name shadows the earlier one when the script executes.
 */
@Component
public class ShellTranslator implements ModuleTranslator {

    @Override
    public Set<String> actions() {
        return Set.of("shell", "command");
    }

    @Override
    public TranslationResult translate(TranslationRequest request) {
        Map<String, Object> args = new LinkedHashMap<>();
        if (request.takeSibling("args") instanceof Map<?, ?> map) {
            map.forEach((k, v) -> args.put(String.valueOf(k), v));
        }

        Object command = request.moduleValue();
        if (command instanceof Map<?, ?>) {
            command = args.remove("cmd");
            if (request.hasArg("cmd")) {
                command = request.take("cmd");
            }
        } else if (command == null) {
            command = args.remove("cmd");
        }
        if (!(command instanceof String script)) {
            throw new UnsupportedConstructException("Can not get shell command from: " + request.original());
        }

        var lines = new ArrayList<String>();
        Object chdir = args.containsKey("chdir") ? args.remove("chdir") : request.take("chdir");
        if (chdir != null) {
            lines.add("cd " + chdir + ";");
        }

        List<Map<String, Object>> environments = new ArrayList<>(request.scope().exportedEnvironments());
        Object taskEnv = request.takeSibling("environment");
        if (taskEnv instanceof Map<?, ?> map) {
            var env = new LinkedHashMap<String, Object>();
            map.forEach((k, v) -> env.put(String.valueOf(k), v));
            environments.add(env);
        } else if (taskEnv != null) {
            // templated environment, can not be expanded
            request.putSibling("environment", taskEnv);
        }
        for (Map<String, Object> env : environments) {
            env.forEach((k, v) -> lines.add("export " + k + "=\"" + InlineValues.format(v) + "\";"));
        }
        lines.add(script);

        if (!args.isEmpty()) {
            request.putSibling("args", args);
        }
        return new TranslationResult(
                List.of(Directive.of(DirectiveKind.RUN, String.join("\n", lines))),
                request.residual());
    }
}
