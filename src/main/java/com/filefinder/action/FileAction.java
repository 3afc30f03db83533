package com.filefinder.action;

import java.util.Locale;

public enum FileAction {
    OPEN,
    LIST;

    /**
     * 解析动作名；未知动作属于调用方契约错误，直接抛出而不是返回"未找到"。
     */
    public static FileAction parse(String action) {
        if (action == null) {
            throw new IllegalArgumentException("动作不能为空");
        }
        return switch (action.trim().toLowerCase(Locale.ROOT)) {
            case "open" -> OPEN;
            case "list", "list_folder" -> LIST;
            default -> throw new IllegalArgumentException("未知的文件动作: " + action);
        };
    }
}
