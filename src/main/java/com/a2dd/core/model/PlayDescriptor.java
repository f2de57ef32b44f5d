package com.a2dd.core.model;

/**
 * One DirectorD orchestration entry: an optional host selector and its jobs.
 *
 * @param targets host selector, or null when the play targets every host
 * @param jobs    flattened job sequence
 */
public record PlayDescriptor(Object targets, JobSequence jobs) {

    public PlayDescriptor {
        jobs = jobs == null ? JobSequence.empty() : jobs;
    }

    public static PlayDescriptor untargeted(JobSequence jobs) {
        return new PlayDescriptor(null, jobs);
    }

    public boolean hasTargets() {
        return targets != null;
    }
}
