package com.filefinder.action;

import com.filefinder.catalog.FileEntry;

import java.util.List;

/**
 * handleFileAction 的结果。
 *
 * NOT_FOUND 对应"未找到"，OPENED 表示唯一匹配已被打开，OPEN_FAILED 表示唯一匹配存在但系统打开失败，
 * AMBIGUOUS 携带待用户选择的候选，LISTED 携带文件夹的直接子项名称。
 */
public record FileActionResult(
        Outcome outcome,
        List<FileEntry> entries,
        List<String> children
) {
    public enum Outcome {
        NOT_FOUND,
        OPENED,
        OPEN_FAILED,
        AMBIGUOUS,
        LISTED
    }

    public FileActionResult {
        entries = List.copyOf(entries);
        children = List.copyOf(children);
    }

    public static FileActionResult notFound() {
        return new FileActionResult(Outcome.NOT_FOUND, List.of(), List.of());
    }

    public static FileActionResult opened(FileEntry entry) {
        return new FileActionResult(Outcome.OPENED, List.of(entry), List.of());
    }

    public static FileActionResult openFailed(FileEntry entry) {
        return new FileActionResult(Outcome.OPEN_FAILED, List.of(entry), List.of());
    }

    public static FileActionResult ambiguous(List<FileEntry> entries) {
        return new FileActionResult(Outcome.AMBIGUOUS, entries, List.of());
    }

    public static FileActionResult listed(FileEntry folder, List<String> children) {
        return new FileActionResult(Outcome.LISTED, List.of(folder), children);
    }

    public boolean found() {
        return outcome != Outcome.NOT_FOUND;
    }
}
