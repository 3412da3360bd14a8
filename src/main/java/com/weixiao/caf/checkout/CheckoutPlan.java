package com.weixiao.caf.checkout;

import com.weixiao.caf.diff.TreeLookup;
import com.weixiao.caf.obj.Tree;
import com.weixiao.caf.obj.TreeRecord;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Predicate;

/**
 * 检出计划：把当前 tree 与目标 tree 展开成路径级的文件表，得出需要删除与写入的路径。
 * 路径均相对工作区根，"/" 分隔。
 */
public final class CheckoutPlan {

    private final TreeMap<String, String> currentFiles;
    private final TreeMap<String, String> targetFiles;
    private final Set<String> targetDirs;
    private final List<String> toRemove;

    private CheckoutPlan(TreeMap<String, String> currentFiles, TreeMap<String, String> targetFiles,
                         Set<String> targetDirs) {
        this.currentFiles = currentFiles;
        this.targetFiles = targetFiles;
        this.targetDirs = targetDirs;
        List<String> remove = new ArrayList<>();
        for (String path : currentFiles.keySet()) {
            if (!targetFiles.containsKey(path)) remove.add(path);
        }
        this.toRemove = Collections.unmodifiableList(remove);
    }

    /**
     * @param current 当前 HEAD 的 tree（未出生分支为空 tree）
     * @param target  目标 tree
     * @param lookup  按 oid 加载子 tree
     */
    public static CheckoutPlan create(Tree current, Tree target, TreeLookup lookup) throws IOException {
        TreeMap<String, String> currentFiles = new TreeMap<>();
        flatten(current, lookup, currentFiles, new TreeSet<>());
        TreeMap<String, String> targetFiles = new TreeMap<>();
        Set<String> targetDirs = new TreeSet<>();
        flatten(target, lookup, targetFiles, targetDirs);
        return new CheckoutPlan(currentFiles, targetFiles, targetDirs);
    }

    /**
     * 把 tree 展开为 路径 -&gt; blob oid，同时收集全部目录路径。
     */
    static void flatten(Tree root, TreeLookup lookup, Map<String, String> files, Set<String> dirs) throws IOException {
        Deque<Pending> stack = new ArrayDeque<>();
        stack.push(new Pending("", root));
        while (!stack.isEmpty()) {
            Pending item = stack.pop();
            for (TreeRecord record : item.tree.getRecords().values()) {
                String path = item.prefix.isEmpty() ? record.getName() : item.prefix + "/" + record.getName();
                if (record.isTree()) {
                    dirs.add(path);
                    stack.push(new Pending(path, lookup.lookup(record.getHash())));
                } else {
                    files.put(path, record.getHash());
                }
            }
        }
    }

    /** tree 展开后是否至少含一个文件。 */
    static boolean containsFiles(Tree tree, TreeLookup lookup) throws IOException {
        Map<String, String> files = new TreeMap<>();
        flatten(tree, lookup, files, new TreeSet<>());
        return !files.isEmpty();
    }

    /**
     * 会被检出覆盖的未跟踪文件（当前 tree 中没有的工作区文件）：
     * 目标在同一路径写入不同内容的文件、目标在该路径需要目录、或目标在其某个上级路径写入文件。
     * 内容与目标完全相同的未跟踪文件不算冲突。另外，目标要写文件的路径上若存在未跟踪的目录，也算冲突。
     *
     * @param workingFiles 工作区快照（路径 -&gt; blob oid）
     * @param isDirectory  工作区中某路径是否为目录
     */
    public List<String> untrackedCollisions(Map<String, String> workingFiles, Predicate<String> isDirectory) {
        Set<String> collisions = new TreeSet<>();
        for (Map.Entry<String, String> file : workingFiles.entrySet()) {
            String path = file.getKey();
            if (currentFiles.containsKey(path)) {
                continue;
            }
            String wanted = targetFiles.get(path);
            if (wanted != null && !wanted.equals(file.getValue())) {
                collisions.add(path);
            } else if (targetDirs.contains(path)) {
                collisions.add(path);
            } else {
                for (int slash = path.indexOf('/'); slash > 0; slash = path.indexOf('/', slash + 1)) {
                    if (targetFiles.containsKey(path.substring(0, slash))) {
                        collisions.add(path);
                        break;
                    }
                }
            }
        }
        for (String path : targetFiles.keySet()) {
            if (isDirectory.test(path) && !tracksDirectory(path)) {
                collisions.add(path);
            }
        }
        return new ArrayList<>(collisions);
    }

    private boolean tracksDirectory(String dir) {
        String prefix = dir + "/";
        String next = currentFiles.ceilingKey(prefix);
        return next != null && next.startsWith(prefix);
    }

    /** 当前跟踪、目标中没有的文件，需要删除。 */
    public List<String> getToRemove() {
        return toRemove;
    }

    /** 目标 tree 的全部文件：路径 -&gt; blob oid。 */
    public SortedMap<String, String> getTargetFiles() {
        return Collections.unmodifiableSortedMap(targetFiles);
    }

    /** 目标 tree 的全部目录（含空目录）。 */
    public Set<String> getTargetDirs() {
        return Collections.unmodifiableSet(targetDirs);
    }

    /** 当前 tree 的全部文件：路径 -&gt; blob oid。 */
    public SortedMap<String, String> getCurrentFiles() {
        return Collections.unmodifiableSortedMap(currentFiles);
    }

    private static final class Pending {
        private final String prefix;
        private final Tree tree;

        private Pending(String prefix, Tree tree) {
            this.prefix = prefix;
            this.tree = tree;
        }
    }
}
