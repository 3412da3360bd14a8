package com.weixiao.caf.diff;

import com.weixiao.caf.obj.TreeRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 一次 diff 的结果：按下标存放全部节点。
 * 父节点、子节点以及移动配对都以下标互相引用，节点只归本对象所有。
 * 对外通过 {@link DiffEntry} 视图访问。
 */
public final class TreeDiff {

    static final int NONE = -1;

    private final List<Node> nodes = new ArrayList<>();
    private final List<Integer> roots = new ArrayList<>();

    /** 空结果。 */
    public static TreeDiff empty() {
        return new TreeDiff();
    }

    /** 顶层节点（直接位于根目录下的差异），按产生顺序。 */
    public List<DiffEntry> getRoots() {
        return view(roots);
    }

    public boolean isEmpty() {
        return roots.isEmpty();
    }

    /** 节点总数（含各层）。 */
    public int size() {
        return nodes.size();
    }

    /** 按下标取节点。 */
    public DiffEntry get(int index) {
        if (index < 0 || index >= nodes.size()) {
            throw new IndexOutOfBoundsException("no diff node at " + index);
        }
        return new DiffEntry(this, index);
    }

    /** 全部节点，先序（父先于子，兄弟按产生顺序）。 */
    public List<DiffEntry> flatten() {
        List<DiffEntry> out = new ArrayList<>();
        List<Integer> stack = new ArrayList<>();
        for (int i = roots.size() - 1; i >= 0; i--) stack.add(roots.get(i));
        while (!stack.isEmpty()) {
            int idx = stack.remove(stack.size() - 1);
            out.add(new DiffEntry(this, idx));
            List<Integer> children = nodes.get(idx).children;
            for (int i = children.size() - 1; i >= 0; i--) stack.add(children.get(i));
        }
        return out;
    }

    /**
     * 追加一个节点并挂到父节点（NONE 表示顶层）的子节点末尾，返回下标。
     */
    int add(DiffType type, TreeRecord record, int parent) {
        int index = nodes.size();
        nodes.add(new Node(type, record, parent));
        if (parent == NONE) {
            roots.add(index);
        } else {
            nodes.get(parent).children.add(index);
        }
        return index;
    }

    /** 原地改变节点种类并设置移动配对，节点在父节点中的位置不变。 */
    void reclassify(int index, DiffType type, int pair) {
        Node node = nodes.get(index);
        node.type = type;
        node.pair = pair;
    }

    DiffType type(int index) {
        return nodes.get(index).type;
    }

    TreeRecord record(int index) {
        return nodes.get(index).record;
    }

    int parent(int index) {
        return nodes.get(index).parent;
    }

    int pair(int index) {
        return nodes.get(index).pair;
    }

    List<DiffEntry> children(int index) {
        return view(nodes.get(index).children);
    }

    private List<DiffEntry> view(List<Integer> indices) {
        List<DiffEntry> out = new ArrayList<>(indices.size());
        for (int i : indices) {
            out.add(new DiffEntry(this, i));
        }
        return Collections.unmodifiableList(out);
    }

    private static final class Node {
        private DiffType type;
        private final TreeRecord record;
        private final int parent;
        private final List<Integer> children = new ArrayList<>();
        private int pair = NONE;

        private Node(DiffType type, TreeRecord record, int parent) {
            this.type = type;
            this.record = record;
            this.parent = parent;
        }
    }
}
