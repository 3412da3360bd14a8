package com.weixiao.caf.repo;

import lombok.Value;

/**
 * 仓库布局与常量：元数据目录名、各子目录/文件名、默认分支、oid 长度。
 * 在打开仓库时构造一次，随 Repository 传给各组件，不使用可变的全局常量。
 */
@Value
public class RepositoryConfig {

    public static final String DEFAULT_REPO_DIR = ".caf";
    public static final String DEFAULT_BRANCH = "main";
    /** SHA-1 的 hex 长度。 */
    public static final int SHA1_HEX_LENGTH = 40;

    /** 工作区根下的元数据目录名，如 ".caf"。 */
    String repoDirName;
    String objectsDir;
    String refsDir;
    String headsDir;
    String tagsDir;
    String headFile;
    /** 合并进行中的标记目录，仅看是否存在。 */
    String mergeDir;
    String defaultBranch;
    int hashLength;

    /** 默认布局：.caf/objects、.caf/refs/heads、.caf/refs/tags、.caf/HEAD、.caf/merge。 */
    public static RepositoryConfig defaults() {
        return withRepoDir(DEFAULT_REPO_DIR);
    }

    /** 使用自定义元数据目录名，其余取默认值；null 或空串视为默认。 */
    public static RepositoryConfig withRepoDir(String repoDirName) {
        String name = repoDirName == null || repoDirName.isEmpty() ? DEFAULT_REPO_DIR : repoDirName;
        return new RepositoryConfig(name, "objects", "refs", "heads", "tags", "HEAD", "merge",
                DEFAULT_BRANCH, SHA1_HEX_LENGTH);
    }
}
