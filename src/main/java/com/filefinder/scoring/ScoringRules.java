package com.filefinder.scoring;

import com.filefinder.config.Constants;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * 组合评分的各项，均为无副作用的纯函数。
 */
public final class ScoringRules {

    private ScoringRules() {
    }

    /**
     * 查询与文件名、查询与小写路径两者词集合相似度的较大值。
     */
    public static double fuzzyBase(ScoreCandidate candidate) {
        return Math.max(
            TokenSetSimilarity.score(candidate.normalizedQuery(), candidate.normalizedName()),
            TokenSetSimilarity.score(candidate.normalizedQuery(), candidate.lowerPath())
        );
    }

    public static double exactBoost(ScoreCandidate candidate) {
        if (candidate.normalizedQuery().equals(candidate.normalizedName())) {
            return Constants.EXACT_MATCH_BOOST;
        }
        if (candidate.normalizedName().contains(candidate.normalizedQuery())) {
            return Constants.PARTIAL_MATCH_BOOST;
        }
        return 0.0;
    }

    /**
     * 查询出现在文件名中时的额外加分，与 exactBoost 的条件独立计算。
     */
    public static double nameVsPathBoost(ScoreCandidate candidate) {
        return candidate.normalizedName().contains(candidate.normalizedQuery()) ? Constants.NAME_OVER_PATH_BOOST : 0.0;
    }

    public static double recencyBoost(ScoreCandidate candidate, Instant now) {
        Duration age = Duration.between(candidate.lastModified(), now);
        if (age.compareTo(Duration.ofDays(1)) < 0) {
            return Constants.RECENCY_BOOST_DAY;
        }
        if (age.compareTo(Duration.ofDays(7)) < 0) {
            return Constants.RECENCY_BOOST_WEEK;
        }
        if (age.compareTo(Duration.ofDays(30)) < 0) {
            return Constants.RECENCY_BOOST_MONTH;
        }
        return 0.0;
    }

    public static double extensionIntentBoost(ScoreCandidate candidate) {
        for (Map.Entry<String, String> keyword : Constants.EXTENSION_KEYWORDS.entrySet()) {
            if (candidate.normalizedQuery().contains(keyword.getKey())
                && candidate.extension().equals(keyword.getValue())) {
                return Constants.EXTENSION_INTENT_BOOST;
            }
        }
        return 0.0;
    }

    /**
     * 每个出现在路径中的查询词各加一次，不去重。
     */
    public static double folderContextBoost(ScoreCandidate candidate) {
        double boost = 0.0;
        for (String token : candidate.queryTokens()) {
            if (candidate.lowerPath().contains(token)) {
                boost += Constants.FOLDER_CONTEXT_BOOST;
            }
        }
        return boost;
    }

    /**
     * 按路径分隔符（/ 与 \）数量计算的扣分，返回正值。
     */
    public static double depthPenalty(ScoreCandidate candidate) {
        long separators = candidate.lowerPath().chars().filter(ch -> ch == '/' || ch == '\\').count();
        return separators * Constants.DEPTH_PENALTY_PER_LEVEL;
    }
}
