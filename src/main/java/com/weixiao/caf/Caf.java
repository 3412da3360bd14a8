package com.weixiao.caf;

import com.weixiao.caf.command.BranchCommand;
import com.weixiao.caf.command.CheckoutCommand;
import com.weixiao.caf.command.CommitCommand;
import com.weixiao.caf.command.DeleteRepoCommand;
import com.weixiao.caf.command.DiffCommand;
import com.weixiao.caf.command.HashFileCommand;
import com.weixiao.caf.command.InitCommand;
import com.weixiao.caf.command.LogCommand;
import com.weixiao.caf.command.MergeCommand;
import com.weixiao.caf.command.TagCommand;
import com.weixiao.caf.repo.RepositoryConfig;
import picocli.CommandLine;
import picocli.CommandLine.*;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * caf - 内容寻址的版本控制命令行入口。
 * <p>
 * 所有 caf 命令都通过此类执行。工作目录由 -C / -d 统一提供，元数据目录名由 --repo-dir 指定，
 * 子命令通过 {@link #getStartPath()} 与 {@link #getConfig()} 获取。
 */
@Command(name = "caf", mixinStandardHelpOptions = true, description = "caf - 内容寻址的版本控制")
public class Caf implements Runnable {

    @Option(names = {"-C", "-d", "--directory"}, paramLabel = "PATH",
            description = "以指定路径作为工作目录执行命令（默认为当前目录），子命令据此查找仓库")
    private Path workingDirectory;

    @Option(names = "--repo-dir", paramLabel = "NAME",
            description = "仓库元数据目录名，默认 " + RepositoryConfig.DEFAULT_REPO_DIR)
    private String repoDir;

    /**
     * 未指定子命令时打印用法说明。
     */
    @Override
    public void run() {
        new CommandLine(this).usage(System.out);
    }

    /**
     * 返回命令的起始路径（工作目录）。
     * init 在此路径下创建仓库；其余命令从此路径向上查找仓库。
     *
     * @return 已规范化的绝对路径，不会为 null
     */
    public Path getStartPath() {
        Path base = workingDirectory != null ? workingDirectory : Paths.get("");
        return base.toAbsolutePath().normalize();
    }

    /** 由 --repo-dir 得到的仓库配置。 */
    public RepositoryConfig getConfig() {
        return RepositoryConfig.withRepoDir(repoDir);
    }

    /**
     * 创建配置好的 CommandLine 实例，包含所有已注册的子命令，供 main() 和测试使用。
     */
    public static CommandLine createCommandLine() {
        return new CommandLine(new Caf())
                .addSubcommand("init", new InitCommand())
                .addSubcommand("delete-repo", new DeleteRepoCommand())
                .addSubcommand("hash-file", new HashFileCommand())
                .addSubcommand("commit", new CommitCommand())
                .addSubcommand("branch", new BranchCommand())
                .addSubcommand("tag", new TagCommand())
                .addSubcommand("log", new LogCommand())
                .addSubcommand("diff", new DiffCommand())
                .addSubcommand("checkout", new CheckoutCommand())
                .addSubcommand("merge", new MergeCommand());
    }

    /**
     * 主入口方法。
     * 若需调试日志：-Dcaf.debug=true 或环境变量 CAF_DEBUG=true，或 -Dcaf.log.level=DEBUG。
     *
     * @param args 命令行参数
     */
    public static void main(String[] args) {
        if ("true".equalsIgnoreCase(System.getProperty("caf.debug"))
                || "true".equalsIgnoreCase(System.getenv("CAF_DEBUG"))) {
            System.setProperty("caf.log.level", "DEBUG");
        }
        CommandLine cli = createCommandLine();
        String[] runArgs = args != null && args.length > 0 ? args : new String[]{"--help"};
        int exitCode = cli.execute(runArgs);
        System.exit(exitCode);
    }
}
