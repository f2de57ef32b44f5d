package com.a2dd.core.context;

import com.a2dd.core.conversion.UnsupportedConstructException;
import com.a2dd.core.model.ScopeContext;
import com.a2dd.core.model.ScopeKind;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Immutable stack of enclosing scopes, outermost first, plus include bookkeeping.
 * Every descent returns a new chain; siblings never see each other's frames.
 *
 * @param frames        enclosing levels, outermost first
 * @param includePrefix directory relative include paths resolve against, or null for the working directory
 * @param openIncludes  include files currently being expanded, outermost first
 */
public record ScopeChain(List<ScopeFrame> frames, Path includePrefix, List<Path> openIncludes) {

    public ScopeChain {
        frames = List.copyOf(frames);
        openIncludes = List.copyOf(openIncludes);
    }

    public static ScopeChain root(Path includePrefix) {
        return new ScopeChain(List.of(), includePrefix, List.of());
    }

    public ScopeChain descend(ScopeFrame frame) {
        var next = new ArrayList<>(frames);
        next.add(frame);
        return new ScopeChain(next, includePrefix, openIncludes);
    }

    /**
     * Records {@code file} as being expanded.
     *
     * @throws UnsupportedConstructException if the file is already being expanded further up
     */
    public ScopeChain enterInclude(Path file) {
        Path normalized = file.toAbsolutePath().normalize();
        if (openIncludes.contains(normalized)) {
            throw new UnsupportedConstructException("Include cycle detected: " + normalized
                    + " is already being included via " + openIncludes);
        }
        var next = new ArrayList<>(openIncludes);
        next.add(normalized);
        return new ScopeChain(frames, includePrefix, next);
    }

    public Path resolveInclude(String reference) {
        Path path = Path.of(reference);
        if (path.isAbsolute() || includePrefix == null) {
            return path;
        }
        return includePrefix.resolve(path);
    }

    public List<ScopeContext> contexts() {
        return frames.stream().map(ScopeFrame::context).toList();
    }

    /**
     * Environment maps exported by shell tasks: the play first, then each enclosing block
     * from outermost to innermost.
     */
    public List<Map<String, Object>> exportedEnvironments() {
        var envs = new ArrayList<Map<String, Object>>();
        for (ScopeFrame frame : frames) {
            if (frame.kind() == ScopeKind.PLAY) {
                envs.add(frame.environment());
            }
        }
        for (ScopeFrame frame : frames) {
            if (frame.kind() == ScopeKind.BLOCK) {
                envs.add(frame.environment());
            }
        }
        return envs;
    }
}
