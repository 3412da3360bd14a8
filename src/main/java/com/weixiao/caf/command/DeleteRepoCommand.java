package com.weixiao.caf.command;

import com.weixiao.caf.repo.Repository;
import picocli.CommandLine.Command;

import java.io.IOException;

/**
 * caf delete-repo - 删除整个仓库元数据目录，工作目录中的文件保留。
 */
@Command(name = "delete-repo", mixinStandardHelpOptions = true, description = "删除仓库（对象与引用），保留工作目录文件")
public class DeleteRepoCommand extends RepositoryCommand {

    @Override
    protected void execute(Repository repo) throws IOException {
        repo.delete();
        System.out.println("Deleted repository at " + repo.getRepoDir());
    }
}
