package com.weixiao.caf.errors;

import java.io.IOException;

/**
 * 仓库操作失败的基类异常。
 * 上层（merge、checkout、diff）用它包装底层加载失败并附带操作上下文，原始异常保留在 cause 中。
 */
public class CafException extends IOException {

    private static final long serialVersionUID = 1L;

    public CafException(String message) {
        super(message);
    }

    public CafException(String message, Throwable cause) {
        super(message, cause);
    }
}
