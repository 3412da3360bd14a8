package com.weixiao.caf.diff;

import com.weixiao.caf.obj.Tree;

import java.io.IOException;

/**
 * 按 oid 取子 tree：可以来自内存中刚构建的目录快照，也可以来自对象库。
 */
@FunctionalInterface
public interface TreeLookup {

    Tree lookup(String hash) throws IOException;
}
