package com.weixiao.caf.command;

import com.weixiao.caf.Caf;
import com.weixiao.caf.repo.Repository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.IExitCodeGenerator;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.file.Path;

/**
 * 需要已有仓库的子命令的公共流程：从起始路径向上查找仓库，执行 {@link #execute(Repository)}，
 * 失败时在 stderr 输出 "fatal: ..." 并以 1 退出。
 */
abstract class RepositoryCommand implements Runnable, IExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(RepositoryCommand.class);

    @ParentCommand
    protected Caf caf;

    protected int exitCode = 0;

    @Override
    public void run() {
        exitCode = 0;
        Path start = caf.getStartPath();
        Repository repo = Repository.find(start, caf.getConfig());
        if (repo == null) {
            log.debug("no repo found from {}", start);
            System.err.println("fatal: not a caf repository (or any of the parent directories): "
                    + caf.getConfig().getRepoDirName());
            exitCode = 1;
            return;
        }
        try {
            execute(repo);
        } catch (IOException | IllegalArgumentException e) {
            log.debug("{} failed", getClass().getSimpleName(), e);
            System.err.println("fatal: " + e.getMessage());
            exitCode = 1;
        }
    }

    /** 在已找到的仓库上执行命令。 */
    protected abstract void execute(Repository repo) throws IOException;

    /** 返回本命令的退出码（0 成功，1 失败）。 */
    @Override
    public int getExitCode() {
        return exitCode;
    }
}
