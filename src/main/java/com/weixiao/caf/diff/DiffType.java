package com.weixiao.caf.diff;

/**
 * diff 节点的种类。
 * MOVED_TO 位于旧的一侧（内容被移到别处），MOVED_FROM 位于新的一侧（内容从别处移来），二者成对出现。
 */
public enum DiffType {
    ADDED,
    REMOVED,
    MODIFIED,
    MOVED_TO,
    MOVED_FROM;

    public boolean isMove() {
        return this == MOVED_TO || this == MOVED_FROM;
    }
}
