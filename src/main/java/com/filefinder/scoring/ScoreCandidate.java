package com.filefinder.scoring;

import com.filefinder.catalog.FileEntry;
import com.filefinder.text.QueryNormalizer;

import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * 评分所需的不可变输入：归一化查询与一条候选的归一化视图。
 */
public record ScoreCandidate(
        String normalizedQuery,
        List<String> queryTokens,
        String normalizedName,
        String lowerPath,
        String extension,
        Instant lastModified
) {
    public ScoreCandidate {
        queryTokens = List.copyOf(queryTokens);
    }

    public static ScoreCandidate of(String normalizedQuery, List<String> queryTokens, FileEntry entry) {
        return new ScoreCandidate(
                normalizedQuery,
                queryTokens,
                QueryNormalizer.normalize(entry.name()),
                entry.path().toLowerCase(Locale.ROOT),
                entry.extension() == null ? "" : entry.extension(),
                entry.lastModified()
        );
    }
}
