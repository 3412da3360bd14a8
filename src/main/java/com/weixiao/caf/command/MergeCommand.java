package com.weixiao.caf.command;

import com.weixiao.caf.merge.MergeEngine;
import com.weixiao.caf.merge.MergeStatus;
import com.weixiao.caf.repo.Repository;
import picocli.CommandLine.*;

import java.io.IOException;

/**
 * caf merge &lt;target&gt; - 把目标合并到当前 HEAD；caf merge --abort 退出合并进行中状态。
 */
@Command(name = "merge", mixinStandardHelpOptions = true, description = "合并分支或提交")
public class MergeCommand extends RepositoryCommand {

    @Option(names = "--abort", description = "放弃进行中的合并")
    private boolean abort;

    @Parameters(index = "0", arity = "0..1", paramLabel = "TARGET", description = "分支名、标签名或 commit oid")
    private String target;

    @Override
    protected void execute(Repository repo) throws IOException {
        if (abort) {
            repo.abortMerge();
            System.out.println("Merge aborted.");
            return;
        }
        if (target == null) {
            throw new IllegalArgumentException("Merge target is required");
        }
        MergeStatus status = new MergeEngine(repo).merge(target);
        switch (status) {
            case UP_TO_DATE:
                System.out.println("Already up to date.");
                break;
            case FAST_FORWARD:
                System.out.println("Fast-forward to " + repo.headCommit());
                break;
            case THREE_WAY:
                System.out.println("Three-way merge required; merge in progress (use \"merge --abort\" to leave it).");
                break;
            default:
                System.err.println("fatal: refusing to merge unrelated histories");
                exitCode = 1;
                break;
        }
    }
}
