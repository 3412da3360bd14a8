package com.weixiao.caf.merge;

import com.weixiao.caf.checkout.Checkout;
import com.weixiao.caf.errors.CafException;
import com.weixiao.caf.errors.InvalidReferenceException;
import com.weixiao.caf.errors.MergeInProgressException;
import com.weixiao.caf.obj.Commit;
import com.weixiao.caf.obj.Tree;
import com.weixiao.caf.ref.HashRef;
import com.weixiao.caf.ref.Ref;
import com.weixiao.caf.repo.ObjectDatabase;
import com.weixiao.caf.repo.Repository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

/**
 * 合并：求 HEAD 与目标的最近公共祖先，按结果分类并执行对应动作。
 * <ul>
 *   <li>没有共同祖先：DISCONNECTED，不做任何操作</li>
 *   <li>祖先是目标：UP_TO_DATE，不做任何操作</li>
 *   <li>祖先是 HEAD：FAST_FORWARD，调整工作目录后把分支（或分离的 HEAD）移到目标</li>
 *   <li>其余：THREE_WAY，只进入合并进行中状态，不合并文件内容</li>
 * </ul>
 */
public final class MergeEngine {

    private static final Logger log = LoggerFactory.getLogger(MergeEngine.class);

    private final Repository repo;

    public MergeEngine(Repository repo) {
        this.repo = repo;
    }

    /** 合并分支名、标签名或 commit oid。 */
    public MergeStatus merge(String target) throws IOException {
        repo.requireRepository();
        if (target == null || target.isEmpty()) {
            throw new IllegalArgumentException("Merge target is required");
        }
        return merge(repo.getRefs().classify(target));
    }

    /**
     * 合并目标引用到当前 HEAD。
     *
     * @throws MergeInProgressException  已有合并在进行
     * @throws InvalidReferenceException 目标无法解析到 commit
     * @throws CafException              遍历祖先时有 commit 无法加载
     */
    public MergeStatus merge(Ref target) throws IOException {
        repo.requireRepository();
        if (repo.isMerging()) {
            throw new MergeInProgressException();
        }
        HashRef targetCommit = repo.resolveRef(target);
        if (targetCommit == null) {
            throw new InvalidReferenceException("Cannot resolve reference " + target + ": no commits to merge");
        }
        Ref head = repo.headRef();
        HashRef headCommit = repo.resolveRef(head);

        MergeStatus status;
        if (headCommit == null) {
            // 未出生的 HEAD：任何目标都是快进
            status = MergeStatus.FAST_FORWARD;
        } else {
            HashRef base = findCommonAncestor(headCommit, targetCommit);
            status = classify(headCommit, targetCommit, base);
            log.debug("merge head={} target={} base={}", headCommit, targetCommit, base);
        }

        switch (status) {
            case FAST_FORWARD:
                fastForward(head, headCommit, targetCommit);
                break;
            case THREE_WAY:
                repo.startMerge();
                break;
            default:
                break;
        }
        log.info("merge {} into {}: {}", targetCommit, head, status);
        return status;
    }

    /**
     * 按共同祖先分类；base 为 null 表示没有共同祖先。
     */
    static MergeStatus classify(HashRef head, HashRef target, HashRef base) {
        if (base == null) {
            return MergeStatus.DISCONNECTED;
        }
        if (base.equals(target)) {
            return MergeStatus.UP_TO_DATE;
        }
        if (base.equals(head)) {
            return MergeStatus.FAST_FORWARD;
        }
        return MergeStatus.THREE_WAY;
    }

    /**
     * 最近公共祖先。a == b 时直接返回 a。
     * 否则先用显式栈走遍 a 的全部祖先（含 a 本身，沿所有父提交，去重），
     * 再从 b 出发按广度优先遍历，返回第一个属于 a 祖先集合的提交，即离 b 最近的公共祖先。
     *
     * @return 没有共同祖先时返回 null
     * @throws CafException 任一被访问的 commit 无法加载；祖先集合不完整时不能继续
     */
    public HashRef findCommonAncestor(HashRef a, HashRef b) throws IOException {
        if (a.equals(b)) {
            return a;
        }
        ObjectDatabase database = repo.getDatabase();

        Set<String> ancestorsOfA = new HashSet<>();
        Deque<String> stack = new ArrayDeque<>();
        stack.push(a.getHash());
        while (!stack.isEmpty()) {
            String current = stack.pop();
            if (!ancestorsOfA.add(current)) {
                continue;
            }
            for (String parent : load(database, current, a).getParents()) {
                if (!ancestorsOfA.contains(parent)) {
                    stack.push(parent);
                }
            }
        }

        Set<String> visited = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(b.getHash());
        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (!visited.add(current)) {
                continue;
            }
            if (ancestorsOfA.contains(current)) {
                return new HashRef(current);
            }
            queue.addAll(load(database, current, b).getParents());
        }
        return null;
    }

    private void fastForward(Ref head, HashRef headCommit, HashRef targetCommit) throws IOException {
        Tree currentTree;
        Tree targetTree;
        try {
            currentTree = repo.treeOf(headCommit);
            targetTree = repo.treeOf(targetCommit);
        } catch (IOException e) {
            throw new CafException("failed while loading trees for fast-forward to " + targetCommit, e);
        }
        new Checkout(repo).reconcile(currentTree, targetTree);
        repo.moveHead(head, targetCommit);
    }

    private static Commit load(ObjectDatabase database, String oid, HashRef from) throws IOException {
        try {
            return database.loadCommit(oid);
        } catch (IOException e) {
            throw new CafException("failed while walking ancestors of " + from + ": cannot load commit " + oid, e);
        }
    }
}
