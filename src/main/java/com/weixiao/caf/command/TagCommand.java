package com.weixiao.caf.command;

import com.weixiao.caf.ref.SymRef;
import com.weixiao.caf.repo.Repository;
import picocli.CommandLine.*;

import java.io.IOException;
import java.util.List;

/**
 * caf tag - 不带参数时列出标签；caf tag &lt;name&gt; [target] 在 target（默认 HEAD）指向的 commit 上创建标签；
 * -d 删除标签。
 */
@Command(name = "tag", mixinStandardHelpOptions = true, description = "列出、创建、删除标签")
public class TagCommand extends RepositoryCommand {

    @Option(names = {"-d", "--delete"}, description = "删除标签")
    private boolean delete;

    @Parameters(index = "0", arity = "0..1", paramLabel = "NAME", description = "标签名")
    private String name;

    @Parameters(index = "1", arity = "0..1", paramLabel = "TARGET", description = "分支名或 commit oid，默认 HEAD")
    private String target;

    @Override
    protected void execute(Repository repo) throws IOException {
        if (name == null) {
            if (delete) {
                throw new IllegalArgumentException("Tag name is required");
            }
            List<String> tags = repo.tags();
            if (tags.isEmpty()) {
                System.out.println("No tags found.");
            }
            tags.forEach(System.out::println);
        } else if (delete) {
            repo.deleteTag(name);
            System.out.println("Tag \"" + name + "\" deleted.");
        } else {
            repo.createTag(name, target != null ? target : SymRef.HEAD);
            System.out.println("Tag \"" + name + "\" created.");
        }
    }
}
