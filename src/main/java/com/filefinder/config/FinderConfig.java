package com.filefinder.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 运行时配置
 * 
 * 支持从 JSON 配置文件或 CLI 参数注入，覆盖 Constants 默认值
 */
public class FinderConfig {
    private Path catalogPath = Paths.get(Constants.DEFAULT_CATALOG_FILE);
    private List<Path> roots = new ArrayList<>();
    private Set<String> excludedDirectories = new LinkedHashSet<>(Constants.EXCLUDED_DIRECTORIES);
    private Set<String> blockedExtensions = new LinkedHashSet<>(Constants.BLOCKED_EXTENSIONS);
    private Set<String> allowedExtensions = new LinkedHashSet<>(Constants.DEFAULT_ALLOWED_EXTENSIONS);
    private double minScore = Constants.MIN_SCORE;
    private int candidateCap = Constants.CANDIDATE_CAP;
    private int searchLimit = Constants.DEFAULT_SEARCH_LIMIT;

    public Path getCatalogPath() {
        return catalogPath;
    }

    public void setCatalogPath(Path catalogPath) {
        this.catalogPath = catalogPath;
    }

    public List<Path> getRoots() {
        return roots;
    }

    public void setRoots(List<Path> roots) {
        this.roots = roots == null ? new ArrayList<>() : new ArrayList<>(roots);
    }

    public Set<String> getExcludedDirectories() {
        return excludedDirectories;
    }

    public void setExcludedDirectories(Set<String> excludedDirectories) {
        this.excludedDirectories = excludedDirectories == null
            ? new LinkedHashSet<>()
            : new LinkedHashSet<>(excludedDirectories);
    }

    public Set<String> getBlockedExtensions() {
        return blockedExtensions;
    }

    public void setBlockedExtensions(Set<String> blockedExtensions) {
        this.blockedExtensions = normalizeExtensions(blockedExtensions);
    }

    public Set<String> getAllowedExtensions() {
        return allowedExtensions;
    }

    /**
     * 设置扩展名白名单，空集合表示不启用白名单。
     */
    public void setAllowedExtensions(Set<String> allowedExtensions) {
        this.allowedExtensions = normalizeExtensions(allowedExtensions);
    }

    public double getMinScore() {
        return minScore;
    }

    public void setMinScore(double minScore) {
        this.minScore = minScore;
    }

    public int getCandidateCap() {
        return candidateCap;
    }

    public void setCandidateCap(int candidateCap) {
        this.candidateCap = candidateCap;
    }

    public int getSearchLimit() {
        return searchLimit;
    }

    public void setSearchLimit(int searchLimit) {
        this.searchLimit = searchLimit;
    }

    /**
     * 使用默认配置创建实例
     */
    public static FinderConfig defaults() {
        return new FinderConfig();
    }

    /**
     * 从 JSON 文件加载配置，文件中未出现的字段保持默认值。
     */
    public static FinderConfig load(Path configFile) {
        ObjectMapper mapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        try {
            return mapper.readValue(configFile.toFile(), FinderConfig.class);
        } catch (IOException ioException) {
            throw new IllegalStateException("读取配置文件失败: " + configFile, ioException);
        }
    }

    /**
     * 统一为小写、去掉前导点的扩展名集合，兼容 ".pdf" 与 "pdf" 两种写法。
     */
    static Set<String> normalizeExtensions(Set<String> extensions) {
        Set<String> normalized = new LinkedHashSet<>();
        if (extensions == null) {
            return normalized;
        }
        for (String extension : extensions) {
            if (extension == null || extension.isBlank()) {
                continue;
            }
            String trimmed = extension.trim().toLowerCase(Locale.ROOT);
            normalized.add(trimmed.startsWith(".") ? trimmed.substring(1) : trimmed);
        }
        return normalized;
    }
}
