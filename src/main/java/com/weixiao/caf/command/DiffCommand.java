package com.weixiao.caf.command;

import com.weixiao.caf.diff.DiffEntry;
import com.weixiao.caf.diff.DiffSource;
import com.weixiao.caf.diff.TreeDiff;
import com.weixiao.caf.repo.Repository;
import picocli.CommandLine.*;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * caf diff [source1] [source2] - 比较两个 commit、分支、标签或目录。
 * 不带参数比较 HEAD 与工作目录；只给一个参数时比较它与工作目录。
 * 输出按目录层级缩进。
 */
@Command(name = "diff", mixinStandardHelpOptions = true, description = "比较提交或目录")
public class DiffCommand extends RepositoryCommand {

    @Parameters(index = "0", arity = "0..1", paramLabel = "SOURCE1", description = "旧的一侧，默认 HEAD")
    private String source1;

    @Parameters(index = "1", arity = "0..1", paramLabel = "SOURCE2", description = "新的一侧，默认工作目录")
    private String source2;

    @Override
    protected void execute(Repository repo) throws IOException {
        DiffSource first = source1 != null ? DiffSource.of(source1) : null;
        DiffSource second = source2 != null ? DiffSource.of(source2) : DiffSource.of(repo.getWorkingDir());
        TreeDiff diff = repo.diff(first, second);
        if (diff.isEmpty()) {
            System.out.println("No changes detected.");
            return;
        }
        print(diff.getRoots());
    }

    private static void print(List<DiffEntry> roots) {
        Deque<DiffEntry> stack = new ArrayDeque<>();
        for (int i = roots.size() - 1; i >= 0; i--) stack.push(roots.get(i));
        while (!stack.isEmpty()) {
            DiffEntry entry = stack.pop();
            int depth = 0;
            for (DiffEntry p = entry.getParent(); p != null; p = p.getParent()) depth++;
            System.out.println("  ".repeat(depth) + describe(entry));
            List<DiffEntry> children = entry.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) stack.push(children.get(i));
        }
    }

    private static String describe(DiffEntry entry) {
        String name = entry.getRecord().getName();
        switch (entry.getType()) {
            case ADDED:
                return "Added: " + name;
            case REMOVED:
                return "Removed: " + name;
            case MODIFIED:
                return "Modified: " + name;
            case MOVED_TO:
                return "Moved: " + entry.getPath() + " -> " + entry.getMovedPair().getPath();
            default:
                return "Moved: " + entry.getPath() + " <- " + entry.getMovedPair().getPath();
        }
    }
}
