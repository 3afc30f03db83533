package com.filefinder.index;

import com.filefinder.catalog.FileEntry;
import com.filefinder.config.FinderConfig;

import java.util.Set;

/**
 * 索引时的目录剪枝与文件扩展名策略，全量重建和增量更新共用同一份规则。
 */
public final class ExclusionRules {
    private final Set<String> excludedDirectories;
    private final Set<String> blockedExtensions;
    private final Set<String> allowedExtensions;

    public ExclusionRules(Set<String> excludedDirectories, Set<String> blockedExtensions, Set<String> allowedExtensions) {
        this.excludedDirectories = Set.copyOf(excludedDirectories);
        this.blockedExtensions = Set.copyOf(blockedExtensions);
        this.allowedExtensions = Set.copyOf(allowedExtensions);
    }

    public static ExclusionRules from(FinderConfig config) {
        return new ExclusionRules(config.getExcludedDirectories(), config.getBlockedExtensions(), config.getAllowedExtensions());
    }

    /**
     * 目录名命中排除集时既不记录也不进入。
     */
    public boolean shouldDescend(String directoryName) {
        return !excludedDirectories.contains(directoryName);
    }

    /**
     * 黑名单扩展名始终拒绝；白名单非空时还要求扩展名在白名单中。
     */
    public boolean acceptsFile(String fileName) {
        String extension = FileEntry.extractExtension(fileName);
        if (blockedExtensions.contains(extension)) {
            return false;
        }
        return allowedExtensions.isEmpty() || allowedExtensions.contains(extension);
    }
}
