package com.weixiao.caf.ref;

/**
 * 引用：要么是直接的 oid（{@link HashRef}，分离状态），要么是具名的间接引用（{@link SymRef}，如分支路径或 HEAD）。
 * 变体集合是封闭的，消费方按两种情况分别处理。
 */
public interface Ref {

    /** 写入 ref 文件时的文本形式。 */
    String toRefString();
}
