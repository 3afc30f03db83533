package com.filefinder.index;

import java.nio.file.Path;

/**
 * 单个根目录的一次索引结果。
 */
public record IndexReport(
        Path root,
        IndexMode mode,
        int added,
        int updated,
        int deleted,
        int unchanged,
        long elapsedMs
) {
    /** 本次发生变化的条目总数 */
    public int changed() {
        return added + updated + deleted;
    }
}
