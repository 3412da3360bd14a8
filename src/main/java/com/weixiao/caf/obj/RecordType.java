package com.weixiao.caf.obj;

/**
 * Tree 记录的种类，以及它在 tree 对象体中的 mode 字符串。
 */
public enum RecordType {

    BLOB("100644"),
    TREE("40000");

    private final String mode;

    RecordType(String mode) {
        this.mode = mode;
    }

    /** 写入 tree 对象体时使用的 mode。 */
    public String getMode() {
        return mode;
    }

    /** 由 mode 解析记录种类；未知 mode 返回 null。 */
    public static RecordType fromMode(String mode) {
        for (RecordType t : values()) {
            if (t.mode.equals(mode)) return t;
        }
        return null;
    }
}
