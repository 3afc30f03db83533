package com.filefinder.catalog;

import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;
import java.util.Locale;

public record FileEntry(
        long id,
        String name,
        String path,
        EntryKind kind,
        String extension,
        String parentDirName,
        Instant lastModified,
        long sizeBytes
) {
    /** 尚未写入目录库的条目 ID */
    public static final long UNASSIGNED_ID = 0L;

    /**
     * 由遍历得到的路径与属性构造条目，修改时间截断到毫秒以便与库中记录比较。
     */
    public static FileEntry of(Path path, BasicFileAttributes attributes, EntryKind kind) {
        Path normalizedPath = path.toAbsolutePath().normalize();
        String fileName = normalizedPath.getFileName() == null ? normalizedPath.toString() : normalizedPath.getFileName().toString();
        Path parent = normalizedPath.getParent();
        String parentName = parent == null || parent.getFileName() == null ? "" : parent.getFileName().toString();
        String extension = kind == EntryKind.FOLDER ? "" : extractExtension(fileName);
        Instant modifiedTime = Instant.ofEpochMilli(attributes.lastModifiedTime().toMillis());
        return new FileEntry(UNASSIGNED_ID, fileName, normalizedPath.toString(), kind, extension, parentName,
                modifiedTime, attributes.size());
    }

    public boolean isFolder() {
        return kind == EntryKind.FOLDER;
    }

    /**
     * 提取小写扩展名（不含点）；无扩展名或以点开头的隐藏文件返回空串。
     */
    public static String extractExtension(String fileName) {
        if (fileName == null) {
            return "";
        }
        int lastDotIndex = fileName.lastIndexOf('.');
        if (lastDotIndex > 0 && lastDotIndex < fileName.length() - 1) {
            return fileName.substring(lastDotIndex + 1).toLowerCase(Locale.ROOT);
        }
        return "";
    }
}
