package com.weixiao.caf.merge;

/**
 * 合并分类。
 */
public enum MergeStatus {
    /** HEAD 与目标没有共同祖先，不做任何操作。 */
    DISCONNECTED,
    /** 共同祖先就是目标：HEAD 已包含目标的全部提交。 */
    UP_TO_DATE,
    /** 共同祖先就是 HEAD：直接把当前分支（或分离的 HEAD）移到目标。 */
    FAST_FORWARD,
    /** 共同祖先既不是 HEAD 也不是目标：进入合并进行中状态，不合并文件内容。 */
    THREE_WAY
}
