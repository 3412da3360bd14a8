package com.weixiao.caf.errors;

/**
 * 操作会丢弃未提交/未跟踪的工作，或与已有名字冲突（重复的分支、标签等）。
 */
public class ConflictException extends CafException {

    private static final long serialVersionUID = 1L;

    public ConflictException(String message) {
        super(message);
    }
}
