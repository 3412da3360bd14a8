package com.weixiao.caf.errors;

/**
 * 引用、对象或分支不存在。
 */
public class NotFoundException extends CafException {

    private static final long serialVersionUID = 1L;

    public NotFoundException(String message) {
        super(message);
    }
}
