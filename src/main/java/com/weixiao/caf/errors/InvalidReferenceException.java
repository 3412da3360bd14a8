package com.weixiao.caf.errors;

/**
 * 字符串既不是已知引用名，也不是合法的 hash。
 */
public class InvalidReferenceException extends CafException {

    private static final long serialVersionUID = 1L;

    public InvalidReferenceException(String message) {
        super(message);
    }

    public InvalidReferenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
