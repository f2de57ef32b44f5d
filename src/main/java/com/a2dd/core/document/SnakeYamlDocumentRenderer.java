package com.a2dd.core.document;

import com.a2dd.core.model.Directive;
import com.a2dd.core.model.PlayDescriptor;
import org.springframework.stereotype.Component;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.nodes.Node;
import org.yaml.snakeyaml.nodes.Tag;
import org.yaml.snakeyaml.representer.Representer;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Renders orchestrations with SnakeYAML.
 * <p>
 * Directive mappings are dumped one at a time and stitched under their play's {@code jobs}
 * key so each directive's comment lands directly above its sequence entry.
 */
@Component
public class SnakeYamlDocumentRenderer implements DocumentRenderer {

    private static final String LINE_BREAKS = "\n\r\u001c\u001d\u001e\u0085\u2028\u2029";
    private static final Pattern COMMENT_BREAK = Pattern.compile("\r\n|[" + LINE_BREAKS + "]");
    private static final String INDENT = "  ";

    private final Yaml yaml;

    public SnakeYamlDocumentRenderer() {
        var options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        options.setIndent(2);
        options.setSplitLines(false);
        options.setWidth(Integer.MAX_VALUE);
        this.yaml = new Yaml(new LiteralBlockRepresenter(options), options);
    }

    @Override
    public String render(List<PlayDescriptor> plays) {
        if (plays.isEmpty()) {
            return "[]\n";
        }
        var out = new StringBuilder();
        for (PlayDescriptor play : plays) {
            String prefix = "- ";
            if (play.hasTargets()) {
                var header = new LinkedHashMap<String, Object>();
                header.put("targets", play.targets());
                out.append(indentBody(yaml.dump(header), prefix));
                prefix = INDENT;
            }
            if (play.jobs().isEmpty()) {
                out.append(prefix).append("jobs: []\n");
                continue;
            }
            out.append(prefix).append("jobs:\n");
            for (Directive directive : play.jobs().directives()) {
                if (directive.hasComment()) {
                    for (String line : COMMENT_BREAK.split(directive.comment(), -1)) {
                        out.append(INDENT).append(line.isEmpty() ? "#" : "# " + line).append('\n');
                    }
                }
                out.append(indentAll(yaml.dump(List.of(toMap(directive))), INDENT));
            }
        }
        return out.toString();
    }

    @Override
    public String dumpBlock(Object value) {
        String dumped = yaml.dump(value);
        return dumped.endsWith("\n") ? dumped.substring(0, dumped.length() - 1) : dumped;
    }

    static Map<String, Object> toMap(Directive directive) {
        var map = new LinkedHashMap<String, Object>();
        if (directive.name() != null) {
            map.put("NAME", directive.name());
        }
        map.put(directive.kind().name(), directive.payload());
        return map;
    }

    /** First line gets {@code firstPrefix}, continuation lines are aligned under it. */
    private static String indentBody(String text, String firstPrefix) {
        var out = new StringBuilder();
        String[] lines = text.split("\n");
        for (int i = 0; i < lines.length; i++) {
            out.append(i == 0 ? firstPrefix : INDENT).append(lines[i]).append('\n');
        }
        return out.toString();
    }

    private static String indentAll(String text, String indent) {
        var out = new StringBuilder();
        for (String line : text.split("\n")) {
            out.append(line.isEmpty() ? "" : indent).append(line).append('\n');
        }
        return out.toString();
    }

    static boolean hasLineBreak(String value) {
        for (int i = 0; i < value.length(); i++) {
            if (LINE_BREAKS.indexOf(value.charAt(i)) >= 0) {
                return true;
            }
        }
        return false;
    }

    /**
     * Prefers literal block style for any string carrying a line-break-class character.
     */
    static class LiteralBlockRepresenter extends Representer {

        LiteralBlockRepresenter(DumperOptions options) {
            super(options);
        }

        @Override
        protected Node representScalar(Tag tag, String value, DumperOptions.ScalarStyle style) {
            if (Tag.STR.equals(tag) && hasLineBreak(value)
                    && (style == null || style == DumperOptions.ScalarStyle.PLAIN)) {
                return super.representScalar(tag, value, DumperOptions.ScalarStyle.LITERAL);
            }
            return super.representScalar(tag, value, style);
        }
    }
}
