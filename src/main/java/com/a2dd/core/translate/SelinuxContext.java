package com.a2dd.core.translate;

import java.util.ArrayList;
import java.util.List;

/**
 * SELinux attributes of a file-placing task.
 */
record SelinuxContext(String user, String role, String type, String level) {

    static SelinuxContext take(TranslationRequest request) {
        return new SelinuxContext(
                request.takeString("seuser"),
                request.takeString("serole"),
                request.takeString("setype"),
                request.takeString("selevel"));
    }

    boolean isSet() {
        return user != null || role != null || type != null || level != null;
    }

    /** Payload of a SECONTEXT directive for {@code path}. */
    String secontextPayload(String path) {
        var parts = new ArrayList<String>();
        addFlag(parts, "--seuser", user);
        addFlag(parts, "--serole", role);
        addFlag(parts, "--setype", type);
        addFlag(parts, "--selevel", level);
        parts.add(path);
        return String.join(" ", parts);
    }

    /** {@code chcon} options, without the path. */
    String chconOptions() {
        List<String> parts = new ArrayList<>();
        addFlag(parts, "-u", user);
        addFlag(parts, "-r", role);
        addFlag(parts, "-t", type);
        addFlag(parts, "-l", level);
        return String.join(" ", parts);
    }

    private static void addFlag(List<String> parts, String flag, String value) {
        if (value != null) {
            parts.add(flag);
            parts.add(value);
        }
    }
}
