package com.filefinder.index;

import com.filefinder.catalog.FileCatalog;
import com.filefinder.catalog.FileEntry;
import com.filefinder.config.Constants;
import com.filefinder.config.FinderConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 把配置的根目录同步到目录库：每个根首次执行全量重建，之后执行增量比对。
 */
public class FileIndexer {
    private static final Logger logger = LoggerFactory.getLogger(FileIndexer.class);

    private final Path catalogPath;
    private final CatalogWalker walker;
    private final Clock clock;

    public FileIndexer(FinderConfig config) {
        this(config.getCatalogPath(), ExclusionRules.from(config), Clock.systemUTC());
    }

    public FileIndexer(Path catalogPath, ExclusionRules rules, Clock clock) {
        this.catalogPath = catalogPath;
        this.walker = new CatalogWalker(rules);
        this.clock = clock;
    }

    /**
     * 幂等入口，进程启动时调用一次。不存在或不是目录的根会被跳过，其已有条目保持不变。
     */
    public List<IndexReport> ensureIndex(List<Path> roots) throws IOException {
        List<IndexReport> reports = new ArrayList<>();
        for (Path rawRoot : roots) {
            Path root = rawRoot.toAbsolutePath().normalize();
            if (!Files.isDirectory(root)) {
                logger.warn("根目录不存在或不是目录，已跳过: {}", root);
                continue;
            }
            reports.add(ensureSingleRoot(root));
        }
        return reports;
    }

    private IndexReport ensureSingleRoot(Path root) throws IOException {
        String rootKey = Constants.ROOT_META_PREFIX + root;
        boolean alreadyIndexed;
        try (FileCatalog catalog = new FileCatalog(catalogPath)) {
            alreadyIndexed = catalog.getMeta(rootKey).isPresent();
        }

        IndexReport report;
        if (alreadyIndexed) {
            logger.info("增量更新根目录: {}", root);
            report = incrementalUpdate(root);
        } else {
            logger.info("首次全量构建根目录: {}", root);
            report = fullRebuild(root);
            saveMetaQuietly(rootKey, Constants.ROOT_META_VALUE);
        }
        saveMetaQuietly(Constants.LAST_INDEX_TIME_KEY, clock.instant().toString());
        logger.info("索引完成: root={}, mode={}, added={}, updated={}, deleted={}, unchanged={}, {}ms",
            root, report.mode(), report.added(), report.updated(), report.deleted(), report.unchanged(), report.elapsedMs());
        return report;
    }

    /**
     * 全量重建：插入全部通过规则的条目，已存在的路径保持原样，因此可安全重跑。
     */
    public IndexReport fullRebuild(Path root) throws IOException {
        long start = System.currentTimeMillis();
        int[] counters = new int[2];
        try (FileCatalog catalog = new FileCatalog(catalogPath)) {
            walker.walk(root, entry -> {
                if (catalog.insertIfAbsent(entry)) {
                    counters[0]++;
                } else {
                    counters[1]++;
                }
            });
        }
        long elapsed = System.currentTimeMillis() - start;
        return new IndexReport(root, IndexMode.FULL, counters[0], 0, 0, counters[1], elapsed);
    }

    /**
     * 增量更新：新增插入、修改时间变化时刷新时间与大小、未出现在本次遍历中的已存路径删除。
     */
    public IndexReport incrementalUpdate(Path root) throws IOException {
        long start = System.currentTimeMillis();
        int added = 0;
        int updated = 0;
        int unchanged = 0;
        int deleted = 0;

        try (FileCatalog catalog = new FileCatalog(catalogPath)) {
            Map<String, Long> storedTimestamps = catalog.entriesWithPathPrefix(root.toString());
            List<FileEntry> observedEntries = new ArrayList<>();
            walker.walk(root, observedEntries::add);

            Set<String> observedPaths = new HashSet<>(observedEntries.size());
            for (FileEntry entry : observedEntries) {
                observedPaths.add(entry.path());
                Long storedMillis = storedTimestamps.get(entry.path());
                if (storedMillis == null) {
                    catalog.upsert(entry);
                    added++;
                } else if (storedMillis != entry.lastModified().toEpochMilli()) {
                    catalog.upsert(entry);
                    updated++;
                } else {
                    unchanged++;
                }
            }

            for (String storedPath : storedTimestamps.keySet()) {
                if (!observedPaths.contains(storedPath) && catalog.deleteByPath(storedPath)) {
                    deleted++;
                }
            }
        }
        long elapsed = System.currentTimeMillis() - start;
        return new IndexReport(root, IndexMode.INCREMENTAL, added, updated, deleted, unchanged, elapsed);
    }

    /**
     * 元数据写入失败只记录日志：缺少根标记时下次会走全量重建，而全量重建是只插入不覆盖的。
     */
    private void saveMetaQuietly(String key, String value) {
        try (FileCatalog catalog = new FileCatalog(catalogPath)) {
            catalog.setMeta(key, value);
        } catch (IllegalStateException exception) {
            logger.warn("写入元数据失败, key={}: {}", key, exception.getMessage());
        }
    }
}
