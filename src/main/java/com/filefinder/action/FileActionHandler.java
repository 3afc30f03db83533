package com.filefinder.action;

import com.filefinder.catalog.EntryKind;
import com.filefinder.catalog.FileEntry;
import com.filefinder.query.RankingEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * 文件/文件夹动作的统一入口：检索目标文本，按类型过滤后打开、列出或交给调用方消歧。
 */
public class FileActionHandler {
    private static final Logger logger = LoggerFactory.getLogger(FileActionHandler.class);

    private final RankingEngine rankingEngine;
    private final EntryOpener opener;

    public FileActionHandler(RankingEngine rankingEngine, EntryOpener opener) {
        this.rankingEngine = rankingEngine;
        this.opener = opener;
    }

    public FileActionResult handleFileAction(String action, EntryKind kind, String targetText) {
        return handleFileAction(FileAction.parse(action), kind, targetText);
    }

    public FileActionResult handleFileAction(FileAction action, EntryKind kind, String targetText) {
        if (action == FileAction.LIST && kind != EntryKind.FOLDER) {
            throw new IllegalArgumentException("list 动作只支持文件夹, kind=" + kind);
        }
        String target = targetText == null ? "" : targetText.trim();
        List<FileEntry> matches = rankingEngine.search(target).stream()
            .filter(entry -> entry.kind() == kind)
            .toList();

        if (matches.isEmpty()) {
            logger.info("未找到匹配的{}: \"{}\"", kind.columnValue(), target);
            return FileActionResult.notFound();
        }

        return switch (action) {
            case OPEN -> {
                if (matches.size() == 1) {
                    FileEntry match = matches.get(0);
                    yield openEntry(match) ? FileActionResult.opened(match) : FileActionResult.openFailed(match);
                }
                yield FileActionResult.ambiguous(matches);
            }
            case LIST -> listFolder(matches.get(0));
        };
    }

    public boolean openEntry(FileEntry entry) {
        return opener.open(entry);
    }

    private FileActionResult listFolder(FileEntry folder) {
        List<String> children = new ArrayList<>();
        try (Stream<Path> stream = Files.list(Path.of(folder.path()))) {
            stream.map(child -> child.getFileName().toString())
                .sorted()
                .forEach(children::add);
        } catch (IOException exception) {
            logger.warn("无法列出文件夹内容: {} - {}", folder.path(), exception.getMessage());
            return FileActionResult.notFound();
        }
        return FileActionResult.listed(folder, children);
    }
}
