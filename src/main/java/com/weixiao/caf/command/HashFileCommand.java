package com.weixiao.caf.command;

import com.weixiao.caf.Caf;
import com.weixiao.caf.repo.ObjectCodec;
import com.weixiao.caf.repo.Repository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * caf hash-file - 计算文件作为 blob 的 oid；-w 时同时写入对象库。
 * 不带 -w 时不需要仓库。
 */
@Command(name = "hash-file", mixinStandardHelpOptions = true, description = "计算文件的 blob oid，-w 时写入仓库")
public class HashFileCommand implements Runnable, IExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(HashFileCommand.class);

    @ParentCommand
    private Caf caf;

    @Option(names = {"-w", "--write"}, description = "将文件内容写入对象库")
    private boolean write;

    @Parameters(index = "0", paramLabel = "FILE", description = "文件路径，相对路径基于工作目录")
    private Path file;

    private int exitCode = 0;

    @Override
    public void run() {
        exitCode = 0;
        Path target = caf.getStartPath().resolve(file).normalize();
        if (!Files.isRegularFile(target)) {
            System.err.println("fatal: File " + file + " does not exist.");
            exitCode = 1;
            return;
        }
        try {
            if (!write) {
                String oid = new ObjectCodec(caf.getConfig().getHashLength()).hashFile(target);
                System.out.println("Hash: " + oid);
                return;
            }
            Repository repo = Repository.find(caf.getStartPath(), caf.getConfig());
            if (repo == null) {
                System.err.println("fatal: not a caf repository (or any of the parent directories): "
                        + caf.getConfig().getRepoDirName());
                exitCode = 1;
                return;
            }
            String oid = repo.saveFileContent(target);
            System.out.println("Hash: " + oid);
            System.out.println("Saved file " + file + " to CAF repository");
        } catch (IOException | IllegalArgumentException e) {
            log.debug("hash-file failed", e);
            System.err.println("fatal: " + e.getMessage());
            exitCode = 1;
        }
    }

    /** 返回本命令的退出码（0 成功，1 失败）。 */
    @Override
    public int getExitCode() {
        return exitCode;
    }
}
