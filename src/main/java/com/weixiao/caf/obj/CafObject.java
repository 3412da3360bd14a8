package com.weixiao.caf.obj;

/**
 * 对象库中三种持久化对象的统一接口：blob、tree、commit。
 * 由 ObjectCodec 编码为 "type size\0body"，其 SHA-1 即对象的 oid。
 */
public interface CafObject {

    /** 对象类型：blob / tree / commit */
    String getType();

    /** 对象体字节（不含 type/size header） */
    byte[] toBytes();
}
