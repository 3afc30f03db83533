package com.filefinder.dialog;

import com.filefinder.action.FileAction;
import com.filefinder.action.FileActionHandler;
import com.filefinder.action.FileActionResult;
import com.filefinder.catalog.EntryKind;
import com.filefinder.catalog.FileEntry;
import com.filefinder.config.Constants;
import com.filefinder.session.SelectionResult;
import com.filefinder.session.SelectionSession;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 命令分发边界：持有消歧会话，先让会话消费话语，再识别文件控制命令。
 *
 * 每次只处理一句已定稿的话语，非线程安全。
 */
public class CommandDispatcher {

    private static final Pattern OPEN_PATTERN = Pattern.compile("\\bopen (?:the )?(file|folder)\\b\\s*(.*)$");
    private static final Pattern LIST_PATTERN =
        Pattern.compile("\\b(?:list the folder|list folder|what files are in the folder)\\b\\s*(.*)$");
    private static final String EDGE_PUNCTUATION = "\"'.,!?;:";

    private final FileActionHandler actionHandler;
    private final SelectionSession session;

    public CommandDispatcher(FileActionHandler actionHandler, SelectionSession session) {
        this.actionHandler = actionHandler;
        this.session = session;
    }

    public SelectionSession session() {
        return session;
    }

    public DispatchReply handle(String utterance) {
        String text = utterance == null ? "" : utterance.trim().toLowerCase(Locale.ROOT);
        if (text.isEmpty()) {
            return DispatchReply.unhandled();
        }

        if (session.hasPending()) {
            SelectionResult selection = session.handle(text);
            if (selection.handled()) {
                return replyForSelection(selection);
            }
        }

        Matcher listMatcher = LIST_PATTERN.matcher(text);
        if (listMatcher.find()) {
            return listFolder(cleanTarget(listMatcher.group(1)));
        }
        Matcher openMatcher = OPEN_PATTERN.matcher(text);
        if (openMatcher.find()) {
            EntryKind kind = EntryKind.parse(openMatcher.group(1));
            return open(kind, cleanTarget(openMatcher.group(2)));
        }
        return DispatchReply.unhandled();
    }

    private DispatchReply open(EntryKind kind, String target) {
        if (target.isEmpty()) {
            return DispatchReply.message("请说出要打开的" + label(kind) + "名称");
        }
        FileActionResult result = actionHandler.handleFileAction(FileAction.OPEN, kind, target);
        return switch (result.outcome()) {
            case NOT_FOUND -> DispatchReply.message("❌ 未找到匹配的" + label(kind) + ": " + target);
            case OPENED -> DispatchReply.message("🟢 已打开 " + result.entries().get(0).name());
            case OPEN_FAILED -> DispatchReply.message("❌ 无法打开 " + result.entries().get(0).name());
            case AMBIGUOUS -> {
                session.begin(result.entries(), kind);
                yield DispatchReply.options(formatOptions("找到多个" + label(kind) + ":", result.entries()),
                    result.entries());
            }
            case LISTED -> throw new IllegalStateException("open 动作不应返回 LISTED");
        };
    }

    private DispatchReply listFolder(String target) {
        if (target.isEmpty()) {
            return DispatchReply.message("请说出要列出的文件夹名称");
        }
        FileActionResult result = actionHandler.handleFileAction(FileAction.LIST, EntryKind.FOLDER, target);
        if (result.outcome() != FileActionResult.Outcome.LISTED) {
            return DispatchReply.message("❌ 未找到匹配的文件夹: " + target);
        }
        StringBuilder message = new StringBuilder("📂 " + result.entries().get(0).name() + " 的内容:");
        result.children().stream()
            .limit(Constants.LIST_PREVIEW_LIMIT)
            .forEach(child -> message.append(System.lineSeparator()).append(" - ").append(child));
        return DispatchReply.children(message.toString(), result.children());
    }

    private DispatchReply replyForSelection(SelectionResult selection) {
        return switch (selection.outcome()) {
            case CANCELLED -> DispatchReply.message("❌ 已取消选择");
            case OPTIONS_REPEATED -> DispatchReply.options(formatOptions("候选项:", selection.options()), selection.options());
            case SELECTED -> selection.opened()
                ? DispatchReply.message("🟢 已打开 " + selection.selected().name())
                : DispatchReply.message("❌ 无法打开 " + selection.selected().name());
            case INVALID_CHOICE -> DispatchReply.message("❌ 无效的选择序号");
            case IGNORED -> DispatchReply.unhandled();
        };
    }

    static String formatOptions(String header, List<FileEntry> options) {
        StringBuilder builder = new StringBuilder(header);
        for (int index = 0; index < options.size(); index++) {
            builder.append(System.lineSeparator())
                .append(index + 1).append(". ").append(options.get(index).name());
        }
        builder.append(System.lineSeparator()).append("请说: open number X");
        return builder.toString();
    }

    /**
     * 去掉首尾引号与标点并压缩空白。
     */
    static String cleanTarget(String rawTarget) {
        if (rawTarget == null) {
            return "";
        }
        String target = rawTarget.trim();
        int start = 0;
        int end = target.length();
        while (start < end && EDGE_PUNCTUATION.indexOf(target.charAt(start)) >= 0) {
            start++;
        }
        while (end > start && EDGE_PUNCTUATION.indexOf(target.charAt(end - 1)) >= 0) {
            end--;
        }
        return target.substring(start, end).trim().replaceAll("\\s+", " ");
    }

    private static String label(EntryKind kind) {
        return kind == EntryKind.FOLDER ? "文件夹" : "文件";
    }
}
