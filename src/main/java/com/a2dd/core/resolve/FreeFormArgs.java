package com.a2dd.core.resolve;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Splits Ansible free-form module arguments ({@code src=a dest="b c"}) into a mapping.
 * <p>
 * Tokenization follows shell rules: whitespace separates tokens, single and double quotes
 * group characters and are stripped, and a backslash escapes the next character outside
 * single quotes. Tokens without {@code =} are joined under {@link #RAW_PARAMS}.
 */
public final class FreeFormArgs {

    public static final String RAW_PARAMS = "_raw_params";

    private FreeFormArgs() {}

    public static Map<String, Object> parse(String text) {
        var result = new LinkedHashMap<String, Object>();
        var raw = new ArrayList<String>();
        for (String token : tokenize(text)) {
            int eq = token.indexOf('=');
            if (eq > 0) {
                result.put(token.substring(0, eq), token.substring(eq + 1));
            } else {
                raw.add(token);
            }
        }
        if (!raw.isEmpty()) {
            result.put(RAW_PARAMS, String.join(" ", raw));
        }
        return result;
    }

    static List<String> tokenize(String text) {
        var tokens = new ArrayList<String>();
        if (text == null) {
            return tokens;
        }
        var current = new StringBuilder();
        boolean inToken = false;
        char quote = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                } else if (c == '\\' && quote == '"' && i + 1 < text.length()) {
                    current.append(text.charAt(++i));
                } else {
                    current.append(c);
                }
            } else if (c == '\'' || c == '"') {
                quote = c;
                inToken = true;
            } else if (c == '\\' && i + 1 < text.length()) {
                current.append(text.charAt(++i));
                inToken = true;
            } else if (Character.isWhitespace(c)) {
                if (inToken) {
                    tokens.add(current.toString());
                    current.setLength(0);
                    inToken = false;
                }
            } else {
                current.append(c);
                inToken = true;
            }
        }
        if (quote != 0) {
            throw new IllegalArgumentException("Unbalanced quote in free-form arguments: " + text);
        }
        if (inToken) {
            tokens.add(current.toString());
        }
        return tokens;
    }
}
