package com.filefinder.dialog;

import com.filefinder.catalog.FileEntry;

import java.util.List;

/**
 * 一句话语的处理结果。handled=false 表示不是文件控制或消歧话语，应交给上游的命令/对话层。
 */
public record DispatchReply(
        boolean handled,
        String message,
        List<FileEntry> options,
        List<String> children
) {
    public DispatchReply {
        options = List.copyOf(options);
        children = List.copyOf(children);
    }

    static DispatchReply unhandled() {
        return new DispatchReply(false, "", List.of(), List.of());
    }

    static DispatchReply message(String message) {
        return new DispatchReply(true, message, List.of(), List.of());
    }

    static DispatchReply options(String message, List<FileEntry> options) {
        return new DispatchReply(true, message, options, List.of());
    }

    static DispatchReply children(String message, List<String> children) {
        return new DispatchReply(true, message, List.of(), children);
    }
}
