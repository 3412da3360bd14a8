package com.weixiao.caf.errors;

import java.nio.file.Path;

/**
 * 目标目录下尚未初始化仓库。
 */
public class RepositoryNotFoundException extends NotFoundException {

    private static final long serialVersionUID = 1L;

    public RepositoryNotFoundException(Path repoPath) {
        super("Repository not initialized at " + repoPath);
    }
}
