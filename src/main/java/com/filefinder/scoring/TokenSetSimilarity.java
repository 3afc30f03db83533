package com.filefinder.scoring;

import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * 词集合相似度，结果范围 [0,100]，对词序与重复词不敏感。
 *
 * 两侧按空白切成词集合，取交集与两侧差集（排序后以空格拼接），
 * 一侧词集合被另一侧完全包含时为 100，否则比较 交集、交集+左差集、交集+右差集 三个串，
 * 取两两之间 indel 归一化相似度的最大值。
 */
public final class TokenSetSimilarity {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private TokenSetSimilarity() {
    }

    public static double score(String left, String right) {
        Set<String> leftTokens = toTokenSet(left);
        Set<String> rightTokens = toTokenSet(right);
        if (leftTokens.isEmpty() || rightTokens.isEmpty()) {
            return 0.0;
        }

        Set<String> intersection = new TreeSet<>(leftTokens);
        intersection.retainAll(rightTokens);
        Set<String> leftOnly = new TreeSet<>(leftTokens);
        leftOnly.removeAll(rightTokens);
        Set<String> rightOnly = new TreeSet<>(rightTokens);
        rightOnly.removeAll(leftTokens);

        if (!intersection.isEmpty() && (leftOnly.isEmpty() || rightOnly.isEmpty())) {
            return 100.0;
        }

        String leftDiff = String.join(" ", leftOnly);
        String rightDiff = String.join(" ", rightOnly);

        int sectLength = String.join(" ", intersection).length();
        if (sectLength == 0) {
            return normalizedSimilarity(leftDiff, rightDiff);
        }

        // 交集串与 "交集 + 差集" 串之间的距离只有空格加差集长度
        int leftCombinedDistance = 1 + leftDiff.length();
        int rightCombinedDistance = 1 + rightDiff.length();
        int leftCombinedLength = sectLength + leftCombinedDistance;
        int rightCombinedLength = sectLength + rightCombinedDistance;

        // "交集 + 左差集" 与 "交集 + 右差集" 共享前缀，距离等于两侧差集间的距离，但按组合串总长归一化
        double best = 100.0 * (1.0 - (double) indelDistance(leftDiff, rightDiff)
            / (leftCombinedLength + rightCombinedLength));
        double leftRatio = 100.0 * (1.0 - (double) leftCombinedDistance / (sectLength + leftCombinedLength));
        double rightRatio = 100.0 * (1.0 - (double) rightCombinedDistance / (sectLength + rightCombinedLength));
        return Math.max(best, Math.max(leftRatio, rightRatio));
    }

    /**
     * indel 归一化相似度：100 × (1 − indel距离 / 两串总长)。
     */
    static double normalizedSimilarity(String left, String right) {
        int totalLength = left.length() + right.length();
        if (totalLength == 0) {
            return 100.0;
        }
        return 100.0 * (1.0 - (double) indelDistance(left, right) / totalLength);
    }

    /**
     * 只允许插入与删除时的编辑距离。
     */
    static int indelDistance(String left, String right) {
        return left.length() + right.length() - 2 * longestCommonSubsequence(left, right);
    }

    static int longestCommonSubsequence(String left, String right) {
        if (left.isEmpty() || right.isEmpty()) {
            return 0;
        }
        int[] previous = new int[right.length() + 1];
        int[] current = new int[right.length() + 1];
        for (int i = 1; i <= left.length(); i++) {
            char leftChar = left.charAt(i - 1);
            for (int j = 1; j <= right.length(); j++) {
                if (leftChar == right.charAt(j - 1)) {
                    current[j] = previous[j - 1] + 1;
                } else {
                    current[j] = Math.max(previous[j], current[j - 1]);
                }
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[right.length()];
    }

    private static Set<String> toTokenSet(String text) {
        Set<String> tokens = new TreeSet<>();
        if (text == null || text.isBlank()) {
            return tokens;
        }
        for (String token : WHITESPACE.split(text.trim())) {
            tokens.add(token);
        }
        return tokens;
    }
}
