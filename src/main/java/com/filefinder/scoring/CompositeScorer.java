package com.filefinder.scoring;

import java.time.Clock;

/**
 * 汇总各评分项。
 */
public class CompositeScorer {
    private final Clock clock;

    public CompositeScorer(Clock clock) {
        this.clock = clock;
    }

    public ScoreBreakdown score(ScoreCandidate candidate) {
        return new ScoreBreakdown(
            ScoringRules.fuzzyBase(candidate),
            ScoringRules.exactBoost(candidate),
            ScoringRules.nameVsPathBoost(candidate),
            ScoringRules.recencyBoost(candidate, clock.instant()),
            ScoringRules.extensionIntentBoost(candidate),
            ScoringRules.folderContextBoost(candidate),
            ScoringRules.depthPenalty(candidate)
        );
    }
}
