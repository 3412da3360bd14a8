package com.weixiao.caf.command;

import com.weixiao.caf.repo.Repository;
import picocli.CommandLine.*;

import java.io.IOException;
import java.util.List;

/**
 * caf branch - 不带参数时列出分支（当前分支前加 "*"）；带名字时新建未出生的分支；
 * -d 删除分支；--exists 检查分支是否存在（不存在时退出码为 1）。
 */
@Command(name = "branch", mixinStandardHelpOptions = true, description = "列出、创建、删除分支")
public class BranchCommand extends RepositoryCommand {

    @Option(names = {"-d", "--delete"}, description = "删除分支")
    private boolean delete;

    @Option(names = "--exists", description = "检查分支是否存在")
    private boolean exists;

    @Parameters(index = "0", arity = "0..1", paramLabel = "NAME", description = "分支名")
    private String name;

    @Override
    protected void execute(Repository repo) throws IOException {
        if (name == null) {
            if (delete || exists) {
                throw new IllegalArgumentException("Branch name is required");
            }
            list(repo);
        } else if (exists) {
            if (repo.branchExists(name)) {
                System.out.println("Branch \"" + name + "\" exists.");
            } else {
                System.err.println("Branch \"" + name + "\" does not exist.");
                exitCode = 1;
            }
        } else if (delete) {
            repo.deleteBranch(name);
            System.out.println("Branch \"" + name + "\" deleted.");
        } else {
            repo.addBranch(name);
            System.out.println("Branch \"" + name + "\" created.");
        }
    }

    private static void list(Repository repo) throws IOException {
        List<String> branches = repo.branches();
        if (branches.isEmpty()) {
            System.out.println("No branches found.");
            return;
        }
        String current = repo.currentBranch();
        for (String branch : branches) {
            System.out.println((branch.equals(current) ? "* " : "  ") + branch);
        }
    }
}
