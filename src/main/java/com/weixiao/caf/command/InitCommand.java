package com.weixiao.caf.command;

import com.weixiao.caf.Caf;
import com.weixiao.caf.repo.Repository;
import com.weixiao.caf.repo.RepositoryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.*;

import java.io.IOException;

/**
 * caf init - 在工作目录创建空仓库：objects、refs/heads、refs/tags、未出生的默认分支与 HEAD。
 */
@Command(name = "init", mixinStandardHelpOptions = true, description = "创建空的 caf 仓库")
public class InitCommand implements Runnable, IExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(InitCommand.class);

    @ParentCommand
    private Caf caf;

    @Option(names = {"-b", "--default-branch"}, paramLabel = "BRANCH",
            description = "默认分支名，默认 " + RepositoryConfig.DEFAULT_BRANCH)
    private String defaultBranch = RepositoryConfig.DEFAULT_BRANCH;

    private int exitCode = 0;

    @Override
    public void run() {
        exitCode = 0;
        Repository repo = new Repository(caf.getStartPath(), caf.getConfig());
        try {
            repo.init(defaultBranch);
        } catch (IOException | IllegalArgumentException e) {
            log.debug("init failed", e);
            System.err.println("fatal: " + e.getMessage());
            exitCode = 1;
            return;
        }
        System.out.println("Initialized empty CAF repository in " + repo.getRepoDir() + " on branch " + defaultBranch);
    }

    /** 返回本命令的退出码（0 成功，1 失败）。 */
    @Override
    public int getExitCode() {
        return exitCode;
    }
}
