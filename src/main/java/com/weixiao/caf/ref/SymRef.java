package com.weixiao.caf.ref;

import lombok.Value;

/**
 * 具名间接引用：值为相对仓库目录的 ref 路径（如 "refs/heads/main"），或字面量 "HEAD"。
 * ref 文件中以 "ref: &lt;path&gt;" 形式保存。
 */
@Value
public class SymRef implements Ref {

    public static final String PREFIX = "ref: ";
    public static final String HEAD = "HEAD";
    public static final String HEADS_PREFIX = "refs/heads/";
    public static final String TAGS_PREFIX = "refs/tags/";

    String name;

    /** 指向分支 refs/heads/&lt;branch&gt; 的引用。 */
    public static SymRef branch(String branch) {
        return new SymRef(HEADS_PREFIX + branch);
    }

    /** 指向标签 refs/tags/&lt;tag&gt; 的引用。 */
    public static SymRef tag(String tag) {
        return new SymRef(TAGS_PREFIX + tag);
    }

    /** 是否为 HEAD（不区分大小写）。 */
    public boolean isHead() {
        return HEAD.equalsIgnoreCase(name);
    }

    public boolean isBranch() {
        return name.startsWith(HEADS_PREFIX);
    }

    public boolean isTag() {
        return name.startsWith(TAGS_PREFIX);
    }

    /** 分支名（去掉 refs/heads/ 前缀）；不是分支引用时返回 null。 */
    public String branchName() {
        return isBranch() ? name.substring(HEADS_PREFIX.length()) : null;
    }

    @Override
    public String toRefString() {
        return PREFIX + name;
    }

    @Override
    public String toString() {
        return name;
    }
}
