package com.a2dd.core.conversion;

import com.a2dd.core.assemble.PlayAssembler;
import com.a2dd.core.assemble.RoleAssembler;
import com.a2dd.core.context.ScopeChain;
import com.a2dd.core.document.DocumentParser;
import com.a2dd.core.document.DocumentRenderer;
import com.a2dd.core.logging.MdcContext;
import com.a2dd.core.model.Directive;
import com.a2dd.core.model.DirectiveKind;
import com.a2dd.core.model.JobSequence;
import com.a2dd.core.model.PlayDescriptor;
import com.a2dd.core.model.TaskNode;
import com.a2dd.core.translate.SetFactTranslator;
import com.a2dd.core.walk.StructureWalker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Entry point of a conversion. Detects what kind of document a file holds (playbook,
 * task list or variable file), or converts a whole role directory, and renders the result.
 * <p>
 * Conversions are all-or-nothing: any {@link ConversionException} propagates to the caller
 * and nothing is rendered.
 */
@Service
public class ConversionService {

    private static final Logger log = LoggerFactory.getLogger(ConversionService.class);

    private final DocumentParser parser;
    private final DocumentRenderer renderer;
    private final PlayAssembler playAssembler;
    private final RoleAssembler roleAssembler;
    private final StructureWalker walker;

    public ConversionService(DocumentParser parser, DocumentRenderer renderer, PlayAssembler playAssembler,
                             RoleAssembler roleAssembler, StructureWalker walker) {
        this.parser = parser;
        this.renderer = renderer;
        this.playAssembler = playAssembler;
        this.roleAssembler = roleAssembler;
        this.walker = walker;
    }

    public List<PlayDescriptor> convertFile(Path file) {
        MdcContext.setSource(file.toString());
        try {
            log.info("Converting file {}", file);
            Object document = parser.parse(file);
            ScopeChain root = ScopeChain.root(file.toAbsolutePath().getParent()).enterInclude(file);
            List<PlayDescriptor> result = convertDocument(document, root);
            log.info("Converted {} into {} play(s) with {} directive(s)", file, result.size(), countDirectives(result));
            return result;
        } finally {
            MdcContext.clear();
        }
    }

    public List<PlayDescriptor> convertRole(Path roleDir) {
        MdcContext.setSource(roleDir.toString());
        try {
            log.info("Converting role {}", roleDir);
            JobSequence jobs = roleAssembler.assemble(roleDir);
            log.info("Converted role {} into {} directive(s)", roleDir, jobs.size());
            return List.of(PlayDescriptor.untargeted(jobs));
        } finally {
            MdcContext.clear();
        }
    }

    public String render(List<PlayDescriptor> plays) {
        return renderer.render(plays);
    }

    List<PlayDescriptor> convertDocument(Object document, ScopeChain root) {
        if (document == null) {
            return List.of();
        }
        if (document instanceof List<?> entries) {
            if (isPlaybook(entries)) {
                var plays = new ArrayList<PlayDescriptor>();
                for (Object entry : entries) {
                    if (!(entry instanceof Map<?, ?> play) || !play.containsKey("hosts")) {
                        throw new UnsupportedConstructException("Playbook entry is not a play: " + entry);
                    }
                    plays.add(playAssembler.assemble(TaskNode.of(play), root));
                }
                return plays;
            }
            return List.of(PlayDescriptor.untargeted(walker.walk(entries, root)));
        }
        if (document instanceof Map<?, ?> vars) {
            var directives = new ArrayList<Directive>();
            vars.forEach((k, v) -> directives.add(new Directive(DirectiveKind.ARG,
                    SetFactTranslator.argPayload(String.valueOf(k), v), "Set var value for " + k, null)));
            return List.of(PlayDescriptor.untargeted(JobSequence.of(directives)));
        }
        throw new UnsupportedConstructException("Unsupported document root: " + document);
    }

    private static boolean isPlaybook(List<?> entries) {
        for (Object entry : entries) {
            if (entry instanceof Map<?, ?> map && map.containsKey("hosts")) {
                return true;
            }
        }
        return false;
    }

    private static int countDirectives(List<PlayDescriptor> plays) {
        return plays.stream().mapToInt(p -> p.jobs().size()).sum();
    }
}
