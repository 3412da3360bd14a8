package com.weixiao.caf.diff;

import com.weixiao.caf.obj.TreeRecord;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * {@link TreeDiff} 中一个节点的只读视图。
 * MODIFIED 与 MOVED_TO、REMOVED 的 record 取自旧的一侧，ADDED 与 MOVED_FROM 的 record 取自新的一侧。
 */
public final class DiffEntry {

    private final TreeDiff owner;
    private final int index;

    DiffEntry(TreeDiff owner, int index) {
        this.owner = owner;
        this.index = index;
    }

    public int getIndex() {
        return index;
    }

    public DiffType getType() {
        return owner.type(index);
    }

    public TreeRecord getRecord() {
        return owner.record(index);
    }

    /** 所在目录对应的 MODIFIED 节点；顶层节点返回 null。 */
    public DiffEntry getParent() {
        int parent = owner.parent(index);
        return parent == TreeDiff.NONE ? null : new DiffEntry(owner, parent);
    }

    public List<DiffEntry> getChildren() {
        return owner.children(index);
    }

    /**
     * 移动的另一端：MOVED_TO 返回对应的 MOVED_FROM，MOVED_FROM 返回对应的 MOVED_TO，其余种类返回 null。
     */
    public DiffEntry getMovedPair() {
        int pair = owner.pair(index);
        return pair == TreeDiff.NONE ? null : new DiffEntry(owner, pair);
    }

    /** 从根起的 "/" 分隔路径，如 "dir/sub/file.txt"。 */
    public String getPath() {
        Deque<String> names = new ArrayDeque<>();
        for (DiffEntry e = this; e != null; e = e.getParent()) {
            names.push(e.getRecord().getName());
        }
        return String.join("/", names);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DiffEntry)) return false;
        DiffEntry that = (DiffEntry) o;
        return index == that.index && owner == that.owner;
    }

    @Override
    public int hashCode() {
        return Objects.hash(System.identityHashCode(owner), index);
    }

    @Override
    public String toString() {
        return getType() + " " + getPath();
    }
}
