package com.weixiao.caf.errors;

/**
 * 已有合并在进行中，合并不能嵌套。
 */
public class MergeInProgressException extends CafException {

    private static final long serialVersionUID = 1L;

    public MergeInProgressException() {
        super("Merge already in progress");
    }
}
