package com.weixiao.caf.command;

import com.weixiao.caf.ref.HashRef;
import com.weixiao.caf.repo.Repository;
import picocli.CommandLine.*;

import java.io.IOException;

/**
 * caf commit - 把整个工作目录作为新快照提交，更新当前分支（分离 HEAD 时更新 HEAD）。
 */
@Command(name = "commit", mixinStandardHelpOptions = true, description = "提交工作目录")
public class CommitCommand extends RepositoryCommand {

    @Option(names = {"-a", "--author"}, required = true, description = "作者")
    private String author;

    @Option(names = {"-m", "--message"}, required = true, description = "提交信息")
    private String message;

    @Override
    protected void execute(Repository repo) throws IOException {
        HashRef commit = repo.commitWorkingDir(author, message);
        String branch = repo.currentBranch();
        String firstLine = message.contains("\n") ? message.substring(0, message.indexOf('\n')) : message;
        System.out.println("[" + (branch != null ? branch : "detached HEAD") + " "
                + commit.getHash().substring(0, 7) + "] " + firstLine);
    }
}
