package com.weixiao.caf.repo;

import com.weixiao.caf.errors.CafException;
import com.weixiao.caf.obj.Commit;
import com.weixiao.caf.ref.HashRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * 沿第一父提交回溯的提交序列，每次 {@link #next()} 产出一项，到根提交结束。
 * 状态只有当前 oid，{@link #reset()} 后可从起点重新遍历。
 * <pre>
 * LogWalk walk = repo.log();
 * for (LogEntry e = walk.next(); e != null; e = walk.next()) { ... }
 * </pre>
 */
public final class LogWalk {

    private static final Logger log = LoggerFactory.getLogger(LogWalk.class);

    private final ObjectDatabase database;
    private final HashRef start;
    private HashRef current;

    /**
     * @param database 对象库
     * @param start    起点 commit，null 表示空序列（如未出生分支）
     */
    public LogWalk(ObjectDatabase database, HashRef start) {
        this.database = database;
        this.start = start;
        this.current = start;
    }

    /**
     * 下一项；遍历结束返回 null。
     *
     * @throws CafException commit 无法加载，cause 为底层异常
     */
    public LogEntry next() throws IOException {
        if (current == null) {
            return null;
        }
        HashRef ref = current;
        Commit commit;
        try {
            commit = database.loadCommit(ref.getHash());
        } catch (IOException e) {
            current = null;
            throw new CafException("Error loading commit " + ref, e);
        }
        String parent = commit.getFirstParent();
        current = parent != null ? new HashRef(parent) : null;
        log.debug("log step commit={} parent={}", ref, parent);
        return new LogEntry(ref, commit);
    }

    /** 回到起点。 */
    public void reset() {
        current = start;
    }

    /** 从当前位置走完剩余序列。 */
    public List<LogEntry> toList() throws IOException {
        List<LogEntry> entries = new ArrayList<>();
        for (LogEntry e = next(); e != null; e = next()) {
            entries.add(e);
        }
        return entries;
    }
}
