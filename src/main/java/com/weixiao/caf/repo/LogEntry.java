package com.weixiao.caf.repo;

import com.weixiao.caf.obj.Commit;
import com.weixiao.caf.ref.HashRef;
import lombok.Value;

/**
 * log 中的一项：commit 的 oid 与解码后的 commit。
 */
@Value
public class LogEntry {
    HashRef commitRef;
    Commit commit;
}
