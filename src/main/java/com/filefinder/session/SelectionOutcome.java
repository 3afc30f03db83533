package com.filefinder.session;

public enum SelectionOutcome {
    /** 不是会话短语，交回上游处理 */
    IGNORED,
    CANCELLED,
    OPTIONS_REPEATED,
    SELECTED,
    /** 序号超出候选范围，会话保持等待 */
    INVALID_CHOICE
}
