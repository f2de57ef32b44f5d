package com.a2dd.core.translate;

import com.a2dd.core.conversion.NotImplementedYetException;
import com.a2dd.core.conversion.UnsupportedConstructException;
import com.a2dd.core.model.Directive;
import com.a2dd.core.model.DirectiveKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Shared rule for modules that place a source file at a destination ({@code copy}, {@code template}).
 * <p>
 * When a backup or validation is requested the file is first placed at {@code <dest>.backup},
 * the validation command runs against that path ({@code %s} substituted), the staged copy is
 * removed unless a backup was asked for, and then the real placement happens.
 */
abstract class FilePlacementTranslator implements ModuleTranslator {

    static final String BACKUP_SUFFIX = ".backup";

    /** Extra leading COPY flags, e.g. {@code --blueprint} for rendered templates. */
    protected abstract List<String> copyFlags();

    /** Whether this request copies between paths on the target host instead of staging. */
    protected abstract boolean isRemoteCopy(TranslationRequest request);

    @Override
    public TranslationResult translate(TranslationRequest request) {
        if (request.hasArg("content")) {
            throw new UnsupportedConstructException(
                    "Placing inline content is not supported, use a source file: " + request.original());
        }
        if (!request.takeFlag("force").orElse(true)) {
            throw new NotImplementedYetException("force=false is not implemented yet: " + request.original());
        }
        boolean remote = isRemoteCopy(request);
        String src = request.takeString("src");
        String dest = request.takeString("dest");
        if (src == null || dest == null) {
            throw new UnsupportedConstructException(request.action() + " task requires src and dest: "
                    + request.original());
        }
        String mode = ModuleArgs.mode(request.take("mode"));
        String owner = ModuleArgs.ownership(request.take("owner"), request.take("group"));
        boolean backup = request.takeFlag("backup").orElse(false);
        String validate = request.takeString("validate");
        SelinuxContext selinux = SelinuxContext.take(request);

        var flags = new ArrayList<>(copyFlags());
        if (mode != null) {
            flags.add("--chmod " + mode);
        }
        if (owner != null) {
            flags.add("--chown " + owner);
        }

        var directives = new ArrayList<Directive>();
        if (backup || validate != null) {
            String staged = dest + BACKUP_SUFFIX;
            directives.add(remote ? localCopy(src, staged) : stagedCopy(flags, src, staged));
            if (validate != null) {
                directives.add(Directive.of(DirectiveKind.RUN, validate.replace("%s", staged)));
            }
            if (!backup) {
                directives.add(Directive.of(DirectiveKind.RUN, "rm -f " + staged));
            }
        }
        if (remote) {
            directives.add(localCopy(src, dest));
            if (owner != null) {
                directives.add(Directive.of(DirectiveKind.RUN, "chown " + owner + " " + dest));
            }
            if (mode != null) {
                directives.add(Directive.of(DirectiveKind.RUN, "chmod " + mode + " " + dest));
            }
        } else {
            directives.add(stagedCopy(flags, src, dest));
        }
        if (selinux.isSet()) {
            directives.add(Directive.of(DirectiveKind.SECONTEXT, selinux.secontextPayload(dest)));
        }
        return new TranslationResult(directives, request.residual());
    }

    private static Directive stagedCopy(List<String> flags, String src, String dest) {
        var parts = new ArrayList<>(flags);
        parts.add(src);
        parts.add(dest);
        return Directive.of(DirectiveKind.COPY, String.join(" ", parts));
    }

    private static Directive localCopy(String src, String dest) {
        return Directive.of(DirectiveKind.RUN, "cp -r " + src + " " + dest);
    }
}
