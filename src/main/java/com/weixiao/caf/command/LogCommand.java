package com.weixiao.caf.command;

import com.weixiao.caf.obj.Commit;
import com.weixiao.caf.ref.Ref;
import com.weixiao.caf.repo.LogEntry;
import com.weixiao.caf.repo.LogWalk;
import com.weixiao.caf.repo.Repository;
import picocli.CommandLine.*;

import java.io.IOException;
import java.time.Instant;

/**
 * caf log - 从 HEAD（或给定的分支、标签、oid）沿第一父提交输出提交历史。
 */
@Command(name = "log", mixinStandardHelpOptions = true, description = "显示提交历史")
public class LogCommand extends RepositoryCommand {

    @Parameters(index = "0", arity = "0..1", paramLabel = "TIP", description = "起点，默认 HEAD")
    private String tip;

    @Override
    protected void execute(Repository repo) throws IOException {
        Ref start = tip != null ? repo.getRefs().classify(tip) : null;
        LogWalk walk = repo.log(start);
        LogEntry entry = walk.next();
        if (entry == null) {
            System.out.println("No commits in the repository.");
            return;
        }
        for (; entry != null; entry = walk.next()) {
            Commit commit = entry.getCommit();
            System.out.println("commit " + entry.getCommitRef());
            if (commit.getParents().size() > 1) {
                System.out.println("Merge: " + String.join(" ", commit.getParents()));
            }
            System.out.println("Author: " + commit.getAuthor());
            System.out.println("Date:   " + Instant.ofEpochSecond(commit.getTimestamp()));
            System.out.println();
            for (String line : commit.getMessage().split("\n", -1)) {
                System.out.println("    " + line);
            }
            System.out.println();
        }
    }
}
