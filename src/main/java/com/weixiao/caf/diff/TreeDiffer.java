package com.weixiao.caf.diff;

import com.weixiao.caf.errors.CafException;
import com.weixiao.caf.obj.Tree;
import com.weixiao.caf.obj.TreeRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.SortedMap;

/**
 * 比较两个 tree 图，得到带 ADDED / REMOVED / MODIFIED / MOVED_TO / MOVED_FROM 标注的层级 diff。
 * <p>
 * 用显式工作栈逐层比较成对的子 tree，内容相同的子 tree 直接剪枝。
 * 移动在整次 diff 内全局识别：一侧被删除、另一侧被新增且内容 oid 相同的两条记录配成一对，
 * 不要求在同一目录。先出现的那一侧节点原地改为移动节点，位置保持不变。
 * <p>
 * 每层先按名字顺序处理旧 tree 的记录，再处理新 tree 中新增的记录，这就是输出顺序。
 */
public final class TreeDiffer {

    private static final Logger log = LoggerFactory.getLogger(TreeDiffer.class);

    private final TreeLookup lookupA;
    private final TreeLookup lookupB;

    /**
     * @param lookupA 旧的一侧取子 tree
     * @param lookupB 新的一侧取子 tree
     */
    public TreeDiffer(TreeLookup lookupA, TreeLookup lookupB) {
        this.lookupA = lookupA;
        this.lookupB = lookupB;
    }

    /**
     * 比较 a（旧）与 b（新）；null 视为空 tree。
     *
     * @throws CafException 子 tree 无法加载，cause 为底层错误
     */
    public TreeDiff diff(Tree a, Tree b) throws IOException {
        TreeDiff result = new TreeDiff();
        Map<String, Integer> potentiallyAdded = new HashMap<>();
        Map<String, Integer> potentiallyRemoved = new HashMap<>();

        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(a, b, TreeDiff.NONE));
        while (!stack.isEmpty()) {
            Frame frame = stack.pop();
            SortedMap<String, TreeRecord> records1 = recordsOf(frame.a);
            SortedMap<String, TreeRecord> records2 = recordsOf(frame.b);

            for (TreeRecord record1 : records1.values()) {
                TreeRecord record2 = records2.get(record1.getName());
                if (record2 == null) {
                    Integer added = potentiallyAdded.remove(record1.getHash());
                    if (added != null) {
                        int movedTo = result.add(DiffType.MOVED_TO, record1, frame.parent);
                        result.reclassify(added, DiffType.MOVED_FROM, movedTo);
                        result.reclassify(movedTo, DiffType.MOVED_TO, added);
                    } else {
                        int removed = result.add(DiffType.REMOVED, record1, frame.parent);
                        potentiallyRemoved.put(record1.getHash(), removed);
                    }
                } else if (!record1.getHash().equals(record2.getHash())) {
                    int modified = result.add(DiffType.MODIFIED, record1, frame.parent);
                    if (record1.isTree() && record2.isTree()) {
                        Tree subtree1;
                        Tree subtree2;
                        try {
                            subtree1 = lookupA.lookup(record1.getHash());
                            subtree2 = lookupB.lookup(record2.getHash());
                        } catch (IOException e) {
                            throw new CafException("Error loading subtree for diff: " + record1.getName(), e);
                        }
                        stack.push(new Frame(subtree1, subtree2, modified));
                    }
                }
            }

            for (TreeRecord record2 : records2.values()) {
                if (records1.containsKey(record2.getName())) {
                    continue;
                }
                Integer removed = potentiallyRemoved.remove(record2.getHash());
                if (removed != null) {
                    int movedFrom = result.add(DiffType.MOVED_FROM, record2, frame.parent);
                    result.reclassify(removed, DiffType.MOVED_TO, movedFrom);
                    result.reclassify(movedFrom, DiffType.MOVED_FROM, removed);
                } else {
                    int added = result.add(DiffType.ADDED, record2, frame.parent);
                    potentiallyAdded.put(record2.getHash(), added);
                }
            }
        }
        log.debug("diff done nodes={} top-level={}", result.size(), result.getRoots().size());
        return result;
    }

    private static SortedMap<String, TreeRecord> recordsOf(Tree tree) {
        return tree != null ? tree.getRecords() : Tree.empty().getRecords();
    }

    private static final class Frame {
        private final Tree a;
        private final Tree b;
        private final int parent;

        private Frame(Tree a, Tree b, int parent) {
            this.a = a;
            this.b = b;
            this.parent = parent;
        }
    }
}
