package com.filefinder.query;

import com.filefinder.catalog.FileCatalog;
import com.filefinder.catalog.FileEntry;
import com.filefinder.config.Constants;
import com.filefinder.config.FinderConfig;
import com.filefinder.scoring.CompositeScorer;
import com.filefinder.scoring.ScoreBreakdown;
import com.filefinder.scoring.ScoreCandidate;
import com.filefinder.text.QueryNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 名称/路径模糊检索：目录库子串粗筛 → 组合评分 → 阈值过滤 → 稳定降序排序。
 */
public class RankingEngine {
    private static final Logger logger = LoggerFactory.getLogger(RankingEngine.class);

    private final Path catalogPath;
    private final CompositeScorer scorer;
    private final double minScore;
    private final int candidateCap;

    public RankingEngine(FinderConfig config) {
        this(config.getCatalogPath(), Clock.systemUTC(), config.getMinScore(), config.getCandidateCap());
    }

    public RankingEngine(Path catalogPath, Clock clock) {
        this(catalogPath, clock, Constants.MIN_SCORE, Constants.CANDIDATE_CAP);
    }

    public RankingEngine(Path catalogPath, Clock clock, double minScore, int candidateCap) {
        this.catalogPath = catalogPath;
        this.scorer = new CompositeScorer(clock);
        this.minScore = minScore;
        this.candidateCap = candidateCap;
    }

    public List<FileEntry> search(String query) {
        return search(query, Constants.DEFAULT_SEARCH_LIMIT);
    }

    /**
     * 返回按得分降序的条目；空查询或无匹配时返回空列表。
     */
    public List<FileEntry> search(String query, int limit) {
        return rank(query, limit).hits().stream()
            .map(SearchHit::entry)
            .toList();
    }

    /**
     * 与 search 相同，但保留每条结果的分项得分。
     */
    public SearchResult rank(String query, int limit) {
        long startNanos = System.nanoTime();
        String normalizedQuery = QueryNormalizer.normalize(query);
        List<String> tokens = QueryNormalizer.tokenize(normalizedQuery);
        if (tokens.isEmpty() || limit <= 0) {
            return SearchResult.empty(query);
        }

        List<FileEntry> candidates;
        try (FileCatalog catalog = new FileCatalog(catalogPath)) {
            candidates = catalog.queryCandidates(tokens, candidateCap);
        }

        List<SearchHit> accepted = new ArrayList<>();
        for (FileEntry candidate : candidates) {
            ScoreBreakdown breakdown = scorer.score(ScoreCandidate.of(normalizedQuery, tokens, candidate));
            double total = breakdown.total();
            if (total >= minScore) {
                accepted.add(new SearchHit(candidate, total, breakdown));
            }
        }
        // List.sort 是稳定排序，同分保持粗筛顺序
        accepted.sort(Comparator.comparingDouble(SearchHit::score).reversed());
        List<SearchHit> hits = List.copyOf(accepted.subList(0, Math.min(limit, accepted.size())));

        long elapsedMs = (System.nanoTime() - startNanos) / 1_000_000;
        logger.debug("查询 \"{}\": 候选 {} 条, 命中 {} 条, 用时 {}ms", normalizedQuery, candidates.size(), accepted.size(), elapsedMs);
        return new SearchResult(hits, candidates.size(), elapsedMs, query);
    }
}
