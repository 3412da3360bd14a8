package com.weixiao.caf.obj;

import lombok.Value;

/**
 * Tree 中的一条记录：种类（blob/tree）+ 内容 oid + 名字。名字在所属 tree 内唯一。
 */
@Value
public class TreeRecord {

    RecordType type;
    String hash;
    String name;

    /** 构造一条文件记录。 */
    public static TreeRecord blob(String name, String hash) {
        return new TreeRecord(RecordType.BLOB, hash, name);
    }

    /** 构造一条子目录记录。 */
    public static TreeRecord tree(String name, String hash) {
        return new TreeRecord(RecordType.TREE, hash, name);
    }

    public boolean isTree() {
        return type == RecordType.TREE;
    }
}
