package com.example.shiftsync.schedule.generator;

/**
 * Switches for one run. {@code prioritizeFairness} is recorded with the run; the fairness
 * adjustment in {@link CandidateScorer} applies either way.
 */
public record GenerationOptions(boolean prioritizeFairness, boolean prioritizeCost, boolean allowOvertime) {

    public static GenerationOptions defaults() {
        return new GenerationOptions(true, false, false);
    }
}
