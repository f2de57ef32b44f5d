package com.a2dd.core.resolve;

import java.util.Set;

/**
 * Ansible keyword allow-lists per scope kind.
 */
public final class Keywords {

    private Keywords() {} // constants

    /** Prefix shared by the legacy loop keys ({@code with_items}, {@code with_dict}, ...). */
    public static final String LOOP_PREFIX = "with_";

    public static final Set<String> TASK = Set.of(
            "action", "any_errors_fatal", "args", "async", "become", "become_exe",
            "become_flags", "become_method", "become_user", "changed_when", "check_mode",
            "collections", "connection", "debugger", "delay", "delegate_facts", "delegate_to",
            "diff", "environment", "failed_when", "ignore_errors", "ignore_unreachable",
            "local_action", "loop", "loop_control", "module_defaults", "name", "no_log",
            "notify", "poll", "port", "register", "remote_user", "retries", "run_once", "tags",
            "throttle", "timeout", "until", "vars", "when"
    );

    public static final Set<String> BLOCK = Set.of(
            "always", "any_errors_fatal", "become", "become_exe", "become_flags",
            "become_method", "become_user", "block", "check_mode", "collections", "connection",
            "debugger", "delegate_facts", "delegate_to", "diff", "environment", "ignore_errors",
            "ignore_unreachable", "module_defaults", "name", "no_log", "port", "remote_user",
            "rescue", "run_once", "tags", "throttle", "timeout", "vars", "when"
    );

    public static final Set<String> PLAY = Set.of(
            "any_errors_fatal", "become", "become_exe", "become_flags", "become_method",
            "become_user", "check_mode", "collections", "connection", "debugger", "diff",
            "environment", "fact_path", "force_handlers", "gather_facts", "gather_subset",
            "gather_timeout", "handlers", "hosts", "ignore_errors", "ignore_unreachable",
            "max_fail_percentage", "module_defaults", "name", "no_log", "order", "port",
            "post_tasks", "pre_tasks", "remote_user", "roles", "run_once", "serial", "strategy",
            "tags", "tasks", "throttle", "timeout", "vars", "vars_files", "vars_prompt"
    );

    public static final String BLOCK_KEY = "block";

    /** Keys that splice another task file in place. */
    public static final Set<String> INCLUDE_KEYS = Set.of("include", "include_tasks", "import_tasks");

    /** Modules whose single-line string value is kept verbatim instead of split into key=value pairs. */
    public static final Set<String> FREE_FORM_MODULES = Set.of("shell", "command", "raw", "script", "include_vars");

    public static boolean isLoopKey(String key) {
        return key.startsWith(LOOP_PREFIX);
    }

    public static boolean isStructural(String action) {
        return BLOCK_KEY.equals(action) || INCLUDE_KEYS.contains(action);
    }
}
