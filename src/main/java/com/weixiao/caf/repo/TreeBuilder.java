package com.weixiao.caf.repo;

import com.weixiao.caf.obj.Tree;
import com.weixiao.caf.obj.TreeRecord;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 从目录构建 Tree 对象图。
 * <p>
 * 深度优先遍历，使用显式栈而不是递归，目录层级再深也不会耗尽调用栈。
 * 每个目录的条目按名字排序后再记录，同样内容的目录总是得到同样的 oid。
 * 构建过程只计算 hash，不写对象库；持久化由调用方（{@link Repository#saveDir(Path)}）单独完成。
 */
public final class TreeBuilder {

    private static final Logger log = LoggerFactory.getLogger(TreeBuilder.class);

    private final ObjectCodec codec;
    private final Workspace workspace;

    /**
     * @param codec     计算 blob/tree 的 oid
     * @param workspace 提供排序后的目录列表（跳过元数据目录）
     */
    public TreeBuilder(ObjectCodec codec, Workspace workspace) {
        this.codec = codec;
        this.workspace = workspace;
    }

    /**
     * 构建 root 目录的 tree。
     *
     * @return 根 tree、根 oid、全部子 tree（含根，按 oid 索引，子目录先于父目录）以及 blob oid 到源文件的映射
     * @throws IllegalArgumentException root 不是目录
     */
    public BuildResult build(Path root) throws IOException {
        if (root == null || !Files.isDirectory(root)) {
            throw new IllegalArgumentException(root + " is not a directory");
        }
        Map<String, Tree> subtrees = new LinkedHashMap<>();
        Map<String, Path> blobSources = new LinkedHashMap<>();
        Map<Path, String> dirHashes = new HashMap<>();

        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(root, null));
        while (!stack.isEmpty()) {
            Frame frame = stack.pop();
            if (frame.entries == null) {
                // 第一次访问：先压回自身，再压入子目录，子目录全部完成后才回到本目录
                List<Path> entries = workspace.listEntries(frame.dir);
                stack.push(new Frame(frame.dir, entries));
                for (Path entry : entries) {
                    if (Files.isDirectory(entry, LinkOption.NOFOLLOW_LINKS)) {
                        stack.push(new Frame(entry, null));
                    }
                }
                continue;
            }

            List<TreeRecord> records = new ArrayList<>();
            for (Path entry : frame.entries) {
                String name = entry.getFileName().toString();
                if (Files.isDirectory(entry, LinkOption.NOFOLLOW_LINKS)) {
                    records.add(TreeRecord.tree(name, dirHashes.get(entry)));
                } else if (Files.isRegularFile(entry)) {
                    String hash = codec.hashFile(entry);
                    blobSources.putIfAbsent(hash, entry);
                    records.add(TreeRecord.blob(name, hash));
                } else {
                    log.debug("skip non-regular entry {}", entry);
                }
            }
            Tree tree = new Tree(records);
            String hash = codec.hash(tree);
            subtrees.putIfAbsent(hash, tree);
            dirHashes.put(frame.dir, hash);
        }

        String rootHash = dirHashes.get(root);
        log.debug("built tree root={} hash={} trees={} blobs={}", root, rootHash, subtrees.size(), blobSources.size());
        return new BuildResult(subtrees.get(rootHash), rootHash,
                Collections.unmodifiableMap(subtrees), Collections.unmodifiableMap(blobSources));
    }

    /** 遍历栈帧：entries 为 null 表示该目录尚未展开。 */
    private static final class Frame {
        private final Path dir;
        private final List<Path> entries;

        private Frame(Path dir, List<Path> entries) {
            this.dir = dir;
            this.entries = entries;
        }
    }

    /** 构建结果。 */
    @Value
    public static class BuildResult {
        Tree tree;
        String hash;
        /** oid -&gt; tree，包含根 tree，子 tree 排在父 tree 之前。 */
        Map<String, Tree> subtrees;
        /** blob oid -&gt; 内容来源文件。 */
        Map<String, Path> blobSources;
    }
}
