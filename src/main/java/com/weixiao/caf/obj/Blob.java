package com.weixiao.caf.obj;

import lombok.EqualsAndHashCode;

import java.util.Arrays;

/**
 * blob 对象：表示一份文件内容。
 * 序列化格式即原始字节（无 header，由 ObjectCodec 统一加 type + size）。
 */
@EqualsAndHashCode
public final class Blob implements CafObject {

    public static final String TYPE = "blob";

    private final byte[] data;

    /** 用给定字节构造 blob，null 视为空数组并做拷贝避免外部修改。 */
    public Blob(byte[] data) {
        this.data = data != null ? data.clone() : new byte[0];
    }

    @Override
    public String getType() {
        return TYPE;
    }

    /** 返回对象体字节（与 CafObject 约定一致，不含 type/size header）。 */
    @Override
    public byte[] toBytes() {
        return Arrays.copyOf(data, data.length);
    }

    /** 内容长度（字节）。 */
    public int size() {
        return data.length;
    }
}
