package com.weixiao.caf.obj;

import com.weixiao.caf.utils.HexUtils;
import lombok.EqualsAndHashCode;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * tree 对象：一个目录的快照，记录按 name 排序。
 * 序列化：每条 mode + " " + name + "\0" + 二进制 oid。
 * <p>
 * 排序决定了 tree 的 oid：相同内容的目录无论在磁盘上以何种顺序枚举，都得到相同的 oid。
 */
@EqualsAndHashCode
public final class Tree implements CafObject {

    public static final String TYPE = "tree";

    private final SortedMap<String, TreeRecord> records;

    /** 用给定记录构造 tree，按 name 排序；null 或空集合视为空 tree。同名记录以后者为准。 */
    public Tree(Collection<TreeRecord> records) {
        this.records = new TreeMap<>();
        if (records != null) {
            for (TreeRecord r : records) {
                this.records.put(r.getName(), r);
            }
        }
    }

    /** 空 tree（未出生分支、空目录）。 */
    public static Tree empty() {
        return new Tree(null);
    }

    @Override
    public String getType() {
        return TYPE;
    }

    /** 按 name 排序的只读记录表。 */
    public SortedMap<String, TreeRecord> getRecords() {
        return Collections.unmodifiableSortedMap(records);
    }

    /** 按名字查找记录，不存在返回 null。 */
    public TreeRecord get(String name) {
        return records.get(name);
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    /** 返回 tree 格式字节：每条 mode + " " + name + "\\0" + 二进制 oid，条目已按 name 排序。 */
    @Override
    public byte[] toBytes() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (TreeRecord r : records.values()) {
            String header = r.getType().getMode() + " " + r.getName() + "\0";
            byte[] headerBytes = header.getBytes(StandardCharsets.UTF_8);
            out.write(headerBytes, 0, headerBytes.length);
            byte[] oidBinary = HexUtils.hexToBytes(r.getHash());
            out.write(oidBinary, 0, oidBinary.length);
        }
        return out.toByteArray();
    }

    /**
     * 解析 tree body。
     *
     * @param body       对象体（不含 header）
     * @param hashLength oid 的 hex 长度，二进制 oid 占 hashLength / 2 字节
     */
    public static Tree parse(byte[] body, int hashLength) throws IOException {
        int oidSize = hashLength / 2;
        Map<String, TreeRecord> parsed = new TreeMap<>();
        int pos = 0;
        while (pos < body.length) {
            int nullPos = pos;
            while (nullPos < body.length && body[nullPos] != 0) {
                nullPos++;
            }
            if (nullPos >= body.length) {
                throw new IOException("invalid tree format: missing null byte");
            }

            String header = new String(body, pos, nullPos - pos, StandardCharsets.UTF_8);
            int spacePos = header.indexOf(' ');
            if (spacePos <= 0 || spacePos == header.length() - 1) {
                throw new IOException("invalid tree entry header: " + header);
            }
            String mode = header.substring(0, spacePos);
            String name = header.substring(spacePos + 1);
            if (!isValidName(name)) {
                throw new IOException("invalid tree entry name: \"" + name + "\"");
            }

            int oidStart = nullPos + 1;
            if (oidStart + oidSize > body.length) {
                throw new IOException("invalid tree format: oid out of bounds");
            }
            RecordType type = RecordType.fromMode(mode);
            if (type == null) {
                throw new IOException("invalid tree entry mode: " + mode);
            }
            byte[] oidBytes = new byte[oidSize];
            System.arraycopy(body, oidStart, oidBytes, 0, oidSize);

            if (parsed.put(name, new TreeRecord(type, HexUtils.bytesToHex(oidBytes), name)) != null) {
                throw new IOException("invalid tree format: duplicate name " + name);
            }
            pos = oidStart + oidSize;
        }
        return new Tree(parsed.values());
    }

    /** 记录名必须是单个路径段：非空，不是 "." 或 ".."，不含 "/"、"\\" 与 NUL。 */
    static boolean isValidName(String name) {
        return !name.isEmpty() && !name.equals(".") && !name.equals("..")
                && name.indexOf('/') < 0 && name.indexOf('\\') < 0 && name.indexOf('\0') < 0;
    }

    @Override
    public String toString() {
        return "Tree" + records.values();
    }
}
