package com.tradeadmission.common.scoring;

/**
 * Adds the signal adjustment to the externally computed base entry score.
 * Kept separate so base scoring and signal adjustment can be tested and replaced
 * independently.
 */
public final class ScoreIntegrator {

    private ScoreIntegrator() {}

    public static double finalScore(double baseEntryScore, double delta) {
        return baseEntryScore + delta;
    }
}
