package com.a2dd.core.translate;

import com.a2dd.core.conversion.NotImplementedYetException;
import com.a2dd.core.conversion.UnsupportedConstructException;
import com.a2dd.core.model.Directive;
import com.a2dd.core.model.DirectiveKind;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * {@code file}: path state management.
 * <ul>
 *   <li>{@code directory}: WORKDIR, then recursive chmod/chown/chcon when {@code recurse} is set</li>
 *   <li>{@code absent}: {@code rm -rf}</li>
 *   <li>{@code touch}: {@code touch}, then attribute changes</li>
 *   <li>{@code file} (default): attribute changes guarded by an existence check</li>
 * </ul>
 */
@Component
public class FileTranslator implements ModuleTranslator {

    @Override
    public Set<String> actions() {
        return Set.of("file");
    }

    @Override
    public TranslationResult translate(TranslationRequest request) {
        String path = firstNonNull(request.takeString("path"), request.takeString("dest"), request.takeString("name"));
        if (path == null) {
            throw new UnsupportedConstructException("file task without path: " + request.original());
        }
        String state = request.hasArg("state") ? request.takeString("state") : "file";
        String mode = ModuleArgs.mode(request.take("mode"));
        String owner = ModuleArgs.ownership(request.take("owner"), request.take("group"));
        SelinuxContext selinux = SelinuxContext.take(request);

        List<Directive> directives = switch (state) {
            case "directory" -> directory(path, mode, owner, selinux, request.takeFlag("recurse").orElse(false));
            case "absent" -> List.of(Directive.of(DirectiveKind.RUN, "rm -rf " + path));
            case "touch" -> touch(path, mode, owner, selinux);
            case "file" -> existing(path, mode, owner, selinux);
            default -> throw new NotImplementedYetException(
                    "File state '" + state + "' is not implemented yet: " + request.original());
        };
        return new TranslationResult(directives, request.residual());
    }

    private static List<Directive> directory(String path, String mode, String owner,
                                             SelinuxContext selinux, boolean recurse) {
        var directives = new ArrayList<Directive>();
        var parts = new ArrayList<String>();
        if (mode != null) {
            parts.add("--chmod " + mode);
        }
        if (owner != null) {
            parts.add("--chown " + owner);
        }
        parts.add(path);
        directives.add(Directive.of(DirectiveKind.WORKDIR, String.join(" ", parts)));
        if (selinux.isSet()) {
            directives.add(Directive.of(DirectiveKind.SECONTEXT, selinux.secontextPayload(path)));
        }
        if (recurse) {
            for (String command : attributeCommands(path, mode, owner, selinux, "-R ")) {
                directives.add(Directive.of(DirectiveKind.RUN, command));
            }
        }
        return directives;
    }

    private static List<Directive> touch(String path, String mode, String owner, SelinuxContext selinux) {
        var directives = new ArrayList<Directive>();
        directives.add(Directive.of(DirectiveKind.RUN, "touch " + path));
        for (String command : attributeCommands(path, mode, owner, selinux, "")) {
            directives.add(Directive.of(DirectiveKind.RUN, command));
        }
        return directives;
    }

    private static List<Directive> existing(String path, String mode, String owner, SelinuxContext selinux) {
        var directives = new ArrayList<Directive>();
        for (String command : attributeCommands(path, mode, owner, selinux, "")) {
            directives.add(Directive.of(DirectiveKind.RUN,
                    "if [ -e " + path + " ]; then " + command + "; fi"));
        }
        return directives;
    }

    /** chmod, chown, chcon in that order, each only when its attribute is set. */
    private static List<String> attributeCommands(String path, String mode, String owner,
                                                  SelinuxContext selinux, String recursive) {
        var commands = new ArrayList<String>();
        if (mode != null) {
            commands.add("chmod " + recursive + mode + " " + path);
        }
        if (owner != null) {
            commands.add("chown " + recursive + owner + " " + path);
        }
        if (selinux.isSet()) {
            commands.add("chcon " + recursive + selinux.chconOptions() + " " + path);
        }
        return commands;
    }

    private static String firstNonNull(String... values) {
        for (String value : values) {
            if (value != null) {
                return value;
            }
        }
        return null;
    }
}
