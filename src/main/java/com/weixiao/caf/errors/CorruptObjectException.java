package com.weixiao.caf.errors;

/**
 * 对象文件存在，但其字节无法按声明的类型解码。
 */
public class CorruptObjectException extends CafException {

    private static final long serialVersionUID = 1L;

    private final String oid;

    public CorruptObjectException(String oid, String why) {
        super("object " + oid + " is corrupt: " + why);
        this.oid = oid;
    }

    public CorruptObjectException(String oid, String why, Throwable cause) {
        super("object " + oid + " is corrupt: " + why, cause);
        this.oid = oid;
    }

    /** 损坏对象的 oid。 */
    public String getOid() {
        return oid;
    }
}
