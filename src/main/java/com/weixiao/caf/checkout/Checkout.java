package com.weixiao.caf.checkout;

import com.weixiao.caf.diff.DiffEntry;
import com.weixiao.caf.diff.TreeDiff;
import com.weixiao.caf.diff.TreeDiffer;
import com.weixiao.caf.diff.TreeLookup;
import com.weixiao.caf.errors.CafException;
import com.weixiao.caf.errors.ConflictException;
import com.weixiao.caf.errors.InvalidReferenceException;
import com.weixiao.caf.errors.NotFoundException;
import com.weixiao.caf.obj.Tree;
import com.weixiao.caf.ref.HashRef;
import com.weixiao.caf.ref.Ref;
import com.weixiao.caf.ref.SymRef;
import com.weixiao.caf.repo.ObjectDatabase;
import com.weixiao.caf.repo.Repository;
import com.weixiao.caf.repo.TreeBuilder;
import com.weixiao.caf.repo.Workspace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 检出：把工作目录改成目标 commit 的 tree，并移动 HEAD。
 * <p>
 * 任何文件系统修改之前先做全部检查：
 * 工作目录相对 HEAD 有未提交的修改或删除时拒绝；会覆盖未跟踪文件时拒绝。
 * 检查通过后才删除目标中不存在的已跟踪文件、写入目标的全部文件，最后更新 HEAD。
 */
public final class Checkout {

    private static final Logger log = LoggerFactory.getLogger(Checkout.class);

    private final Repository repo;

    public Checkout(Repository repo) {
        this.repo = repo;
    }

    /**
     * 检出分支名、标签名、"HEAD" 或 commit oid。
     *
     * @throws InvalidReferenceException target 无法解析
     * @throws ConflictException         会丢失未提交或未跟踪的内容
     */
    public void checkout(String target) throws IOException {
        repo.requireRepository();
        if (target == null || target.isEmpty()) {
            throw new IllegalArgumentException("Checkout target is required");
        }
        checkout(repo.getRefs().classify(target));
    }

    /**
     * 检出引用。分支 SymRef 检出后 HEAD 指向该分支；HashRef 与标签检出后 HEAD 分离；HEAD 本身不改 HEAD。
     * 未出生的分支按空 tree 处理。
     */
    public void checkout(Ref target) throws IOException {
        repo.requireRepository();
        HashRef targetCommit = resolveTarget(target);

        Ref head = repo.headRef();
        HashRef headCommit = repo.resolveRef(head);
        Tree currentTree;
        Tree targetTree;
        try {
            currentTree = repo.treeOf(headCommit);
            targetTree = repo.treeOf(targetCommit);
        } catch (IOException e) {
            throw new CafException("failed while loading trees for checkout of " + target, e);
        }

        CheckoutPlan plan = reconcile(currentTree, targetTree);

        if (target instanceof SymRef && ((SymRef) target).isHead()) {
            log.debug("checkout HEAD, HEAD unchanged");
        } else if (target instanceof SymRef && ((SymRef) target).isBranch()) {
            repo.writeHead(new SymRef(((SymRef) target).getName()));
        } else {
            repo.writeHead(targetCommit);
        }
        log.info("checked out {} ({} files, {} removed)", target, plan.getTargetFiles().size(), plan.getToRemove().size());
    }

    /**
     * 把工作目录从 currentTree 调整为 targetTree，不改 HEAD；合并的快进也使用它。
     * 检查全部通过前不做任何修改。
     *
     * @param currentTree HEAD 的 tree，用于判断哪些文件是已跟踪的
     * @param targetTree  目标 tree
     * @return 执行的计划
     * @throws ConflictException 有未提交的修改，或会覆盖未跟踪文件
     * @throws CafException      要写入的 blob 缺失或损坏（此时工作目录未被修改）
     */
    public CheckoutPlan reconcile(Tree currentTree, Tree targetTree) throws IOException {
        ObjectDatabase database = repo.getDatabase();
        Workspace workspace = repo.getWorkspace();
        TreeLookup store = database::loadTree;

        List<String> dirty = dirtyPaths(currentTree);
        if (!dirty.isEmpty()) {
            throw new ConflictException("Your local changes would be overwritten by checkout: " + String.join(", ", dirty));
        }

        CheckoutPlan plan;
        try {
            plan = CheckoutPlan.create(currentTree, targetTree, store);
        } catch (IOException e) {
            throw new CafException("failed while planning checkout", e);
        }
        Map<String, String> workingFiles = workspace.snapshot(repo.getCodec());
        List<String> collisions = plan.untrackedCollisions(workingFiles, workspace::isDirectory);
        if (!collisions.isEmpty()) {
            throw new ConflictException("Untracked working tree files would be overwritten by checkout: "
                    + String.join(", ", collisions));
        }

        // 要写入的 blob 全部先读出并解码，任何一个缺失或损坏都在修改工作目录之前失败
        Map<String, byte[]> toWrite = new TreeMap<>();
        for (Map.Entry<String, String> file : plan.getTargetFiles().entrySet()) {
            String path = file.getKey();
            if (file.getValue().equals(workingFiles.get(path)) && workspace.isFile(path)) {
                continue;
            }
            toWrite.put(path, database.loadBlob(file.getValue()).toBytes());
        }

        apply(plan, toWrite);
        return plan;
    }

    /**
     * 相对 HEAD tree 有未提交改动的已跟踪路径：被删除、被移走、内容被修改或类型改变。
     * 工作目录中新增的文件（未跟踪）不算。
     */
    List<String> dirtyPaths(Tree currentTree) throws IOException {
        ObjectDatabase database = repo.getDatabase();
        TreeLookup store = database::loadTree;
        List<String> dirty = new ArrayList<>();
        try {
            TreeBuilder.BuildResult working = repo.getTreeBuilder().build(repo.getWorkingDir());
            Map<String, Tree> inMemory = working.getSubtrees();
            TreeLookup workingLookup = hash -> {
                Tree tree = inMemory.get(hash);
                return tree != null ? tree : database.loadTree(hash);
            };
            TreeDiff diff = new TreeDiffer(store, workingLookup).diff(currentTree, working.getTree());
            for (DiffEntry entry : diff.flatten()) {
                if (isDirty(entry, store)) {
                    dirty.add(entry.getPath());
                }
            }
        } catch (IOException e) {
            throw new CafException("failed while checking working directory for local changes", e);
        }
        return dirty;
    }

    private static boolean isDirty(DiffEntry entry, TreeLookup store) throws IOException {
        switch (entry.getType()) {
            case REMOVED:
            case MOVED_TO:
                return !entry.getRecord().isTree()
                        || CheckoutPlan.containsFiles(store.lookup(entry.getRecord().getHash()), store);
            case MODIFIED:
                if (!entry.getRecord().isTree()) {
                    return true;
                }
                // 两侧都是目录时改动体现在子节点上；没有子节点说明目录被同名文件替换
                return entry.getChildren().isEmpty()
                        && CheckoutPlan.containsFiles(store.lookup(entry.getRecord().getHash()), store);
            default:
                return false;
        }
    }

    private void apply(CheckoutPlan plan, Map<String, byte[]> toWrite) throws IOException {
        Workspace workspace = repo.getWorkspace();
        for (String path : plan.getToRemove()) {
            workspace.deleteFile(path);
            log.debug("removed {}", path);
        }
        for (Map.Entry<String, byte[]> file : toWrite.entrySet()) {
            workspace.writeFile(file.getKey(), file.getValue());
        }
        for (String dir : plan.getTargetDirs()) {
            workspace.createDirectory(dir);
        }
    }

    private HashRef resolveTarget(Ref target) throws IOException {
        if (target == null) {
            throw new InvalidReferenceException("Cannot resolve reference null");
        }
        HashRef commit;
        try {
            commit = repo.resolveRef(target);
        } catch (NotFoundException e) {
            throw new InvalidReferenceException("Cannot resolve reference " + target, e);
        }
        if (commit == null) {
            boolean unbornBranch = target instanceof SymRef
                    && (((SymRef) target).isBranch() || ((SymRef) target).isHead());
            if (!unbornBranch) {
                throw new InvalidReferenceException("Cannot resolve reference " + target);
            }
            return null;
        }
        if (!repo.getDatabase().exists(commit.getHash())) {
            throw new InvalidReferenceException("Cannot resolve reference " + target + ": no such commit");
        }
        return commit;
    }
}
