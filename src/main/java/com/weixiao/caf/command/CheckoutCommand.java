package com.weixiao.caf.command;

import com.weixiao.caf.checkout.Checkout;
import com.weixiao.caf.repo.Repository;
import picocli.CommandLine.*;

import java.io.IOException;

/**
 * caf checkout &lt;target&gt; - 切换到分支，或以分离 HEAD 检出标签 / commit。
 * 工作目录有未提交修改或会覆盖未跟踪文件时拒绝，且不修改任何文件。
 */
@Command(name = "checkout", mixinStandardHelpOptions = true, description = "切换分支或检出提交")
public class CheckoutCommand extends RepositoryCommand {

    @Parameters(index = "0", paramLabel = "TARGET", description = "分支名、标签名或 commit oid")
    private String target;

    @Override
    protected void execute(Repository repo) throws IOException {
        new Checkout(repo).checkout(target);
        String branch = repo.currentBranch();
        if (branch != null) {
            System.out.println("Switched to branch '" + branch + "'");
        } else {
            System.out.println("HEAD is now at " + repo.headCommit());
        }
    }
}
