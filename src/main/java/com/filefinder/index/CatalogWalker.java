package com.filefinder.index;

import com.filefinder.catalog.EntryKind;
import com.filefinder.catalog.FileEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.function.Consumer;

/**
 * 带剪枝的目录树遍历，把通过规则的文件夹与文件交给回调。
 */
public class CatalogWalker {
    private static final Logger logger = LoggerFactory.getLogger(CatalogWalker.class);

    private final ExclusionRules rules;

    public CatalogWalker(ExclusionRules rules) {
        this.rules = rules;
    }

    /**
     * 遍历 root（root 自身不产出条目）。单个条目的读取失败只跳过该条目，遍历继续。
     */
    public void walk(Path root, Consumer<FileEntry> sink) throws IOException {
        Path normalizedRoot = root.toAbsolutePath().normalize();
        Files.walkFileTree(normalizedRoot, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (dir.equals(normalizedRoot)) {
                    return FileVisitResult.CONTINUE;
                }
                String directoryName = dir.getFileName().toString();
                if (!rules.shouldDescend(directoryName)) {
                    logger.debug("跳过排除目录: {}", dir);
                    return FileVisitResult.SKIP_SUBTREE;
                }
                sink.accept(FileEntry.of(dir, attrs, EntryKind.FOLDER));
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isDirectory()) {
                    return FileVisitResult.CONTINUE;
                }
                if (rules.acceptsFile(file.getFileName().toString())) {
                    sink.accept(FileEntry.of(file, attrs, EntryKind.FILE));
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                logger.warn("无法访问，已跳过: {} - {}", file, exc.getMessage());
                return FileVisitResult.CONTINUE;
            }
        });
    }
}
