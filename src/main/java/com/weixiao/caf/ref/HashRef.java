package com.weixiao.caf.ref;

import lombok.Value;

/**
 * 直接指向一个 oid 的引用。
 */
@Value
public class HashRef implements Ref {

    String hash;

    @Override
    public String toRefString() {
        return hash;
    }

    @Override
    public String toString() {
        return hash;
    }
}
