package com.filefinder.session;

import com.filefinder.action.EntryOpener;
import com.filefinder.catalog.EntryKind;
import com.filefinder.catalog.FileEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * 消歧会话：最多持有一组待选候选，并用后续话语完成选择、重复或取消。
 *
 * 非线程安全，由唯一的命令分发线程持有。
 */
public class SelectionSession {
    private static final Logger logger = LoggerFactory.getLogger(SelectionSession.class);

    private final EntryOpener opener;
    private PendingSelection pending;

    public SelectionSession(EntryOpener opener) {
        this.opener = opener;
    }

    /**
     * 进入等待选择状态，新的候选会直接替换旧的。
     */
    public void begin(List<FileEntry> options, EntryKind kind) {
        if (options == null || options.isEmpty()) {
            throw new IllegalArgumentException("候选列表不能为空");
        }
        this.pending = new PendingSelection(options, kind);
    }

    public boolean hasPending() {
        return pending != null;
    }

    public Optional<PendingSelection> pending() {
        return Optional.ofNullable(pending);
    }

    public void clear() {
        pending = null;
    }

    /**
     * 处理一句话语。空闲状态或无法识别的话语返回 IGNORED，由上游继续处理。
     */
    public SelectionResult handle(String utterance) {
        if (pending == null) {
            return SelectionResult.of(SelectionOutcome.IGNORED);
        }
        String text = SelectionPhrases.normalize(utterance);
        if (text.isEmpty()) {
            return SelectionResult.of(SelectionOutcome.IGNORED);
        }

        if (SelectionPhrases.isCancel(text)) {
            clear();
            logger.info("已取消选择");
            return SelectionResult.of(SelectionOutcome.CANCELLED);
        }
        if (SelectionPhrases.isRepeat(text)) {
            return SelectionResult.repeated(pending.options());
        }

        OptionalInt choice = SelectionPhrases.choiceIndex(text);
        if (choice.isEmpty()) {
            return SelectionResult.of(SelectionOutcome.IGNORED);
        }
        int index = choice.getAsInt();
        if (index < 0 || index >= pending.size()) {
            logger.info("无效的选择序号: {} (共 {} 项)", index + 1, pending.size());
            return SelectionResult.of(SelectionOutcome.INVALID_CHOICE);
        }

        FileEntry selected = pending.options().get(index);
        boolean opened = opener.open(selected);
        clear();
        return SelectionResult.selected(selected, opened);
    }
}
