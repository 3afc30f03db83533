package com.filefinder.catalog;

import java.util.Locale;

/**
 * 目录条目类型，对应 files.type 列的取值。
 */
public enum EntryKind {
    FILE("file"),
    FOLDER("folder");

    private final String columnValue;

    EntryKind(String columnValue) {
        this.columnValue = columnValue;
    }

    public String columnValue() {
        return columnValue;
    }

    /**
     * 解析列值或用户输入（file/folder，大小写不敏感）。
     */
    public static EntryKind parse(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (EntryKind kind : values()) {
                if (kind.columnValue.equals(normalized)) {
                    return kind;
                }
            }
        }
        throw new IllegalArgumentException("未知的条目类型: " + value);
    }
}
