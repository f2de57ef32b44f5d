package com.a2dd.core.translate;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Value coercions shared by translators. Source values may arrive typed by the YAML loader
 * or as strings from free-form {@code key=value} arguments, so both forms are accepted.
 */
public final class ModuleArgs {

    private static final Set<String> TRUE_WORDS = Set.of("yes", "true", "on", "1", "y");
    private static final Set<String> FALSE_WORDS = Set.of("no", "false", "off", "0", "n");

    private ModuleArgs() {}

    /**
     * Reads an Ansible boolean.
     *
     * @return empty when the value is absent or can not be decided without evaluation,
     *         e.g. a template expression
     */
    public static Optional<Boolean> flag(Object value) {
        if (value instanceof Boolean b) {
            return Optional.of(b);
        }
        if (value instanceof Number n) {
            return Optional.of(n.intValue() != 0);
        }
        if (value == null) {
            return Optional.empty();
        }
        String word = String.valueOf(value).trim().toLowerCase(Locale.ROOT);
        if (TRUE_WORDS.contains(word)) {
            return Optional.of(true);
        }
        if (FALSE_WORDS.contains(word)) {
            return Optional.of(false);
        }
        return Optional.empty();
    }

    /** A string becomes a one-element list; a list is stringified element by element. */
    public static List<String> stringList(Object value) {
        var result = new ArrayList<String>();
        if (value instanceof Collection<?> items) {
            for (Object item : items) {
                result.add(String.valueOf(item));
            }
        } else if (value != null) {
            result.add(String.valueOf(value));
        }
        return result;
    }

    /**
     * Octal permission string. Integers were octal literals in the source ({@code 0644}
     * loads as 420), digit strings are zero-padded, symbolic modes pass through.
     */
    public static String mode(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Integer || value instanceof Long) {
            return String.format("%04o", ((Number) value).longValue());
        }
        String text = String.valueOf(value).trim();
        if (text.matches("[0-7]{1,3}")) {
            return "0".repeat(4 - text.length()) + text;
        }
        return text;
    }

    /** {@code owner:group}, {@code owner} or {@code :group}; null when neither is set. */
    public static String ownership(Object owner, Object group) {
        if (owner == null && group == null) {
            return null;
        }
        String owners = owner == null ? "" : String.valueOf(owner);
        if (group != null) {
            owners += ":" + group;
        }
        return owners;
    }
}
