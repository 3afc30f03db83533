package com.filefinder.scoring;

public record ScoreBreakdown(
        double fuzzyBase,
        double exactBoost,
        double nameVsPathBoost,
        double recencyBoost,
        double extensionIntentBoost,
        double folderContextBoost,
        double depthPenalty
) {
    public double total() {
        return fuzzyBase + exactBoost + nameVsPathBoost + recencyBoost + extensionIntentBoost + folderContextBoost
            - depthPenalty;
    }
}
